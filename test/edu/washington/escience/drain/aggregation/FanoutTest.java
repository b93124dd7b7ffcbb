package edu.washington.escience.drain.aggregation;

import static org.junit.Assert.assertEquals;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.CrimeFixtures;
import edu.washington.escience.drain.DrainConstants;
import edu.washington.escience.drain.Schema;
import edu.washington.escience.drain.Type;
import edu.washington.escience.drain.agg.IndexSpec;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.storage.TableBuilder;

public class FanoutTest {

  private static Table counts(final String district, final long count) {
    return new TableBuilder(
            Schema.ofFields(Type.STRING_TYPE, "district"), Schema.ofFields(Type.LONG_TYPE, "count"))
        .addRow(district, count)
        .build();
  }

  @Test
  public void testPartitionFollowsUnitOrder() throws Exception {
    SpacetimeSpecializer specializer =
        SpacetimeSpecializer.builder()
            .input(CrimeFixtures.source())
            .dateColumn("Date")
            .dates(CrimeFixtures.DEC_31, CrimeFixtures.DEC_30)
            .spacedelta("district", Spacedelta.of(IndexSpec.of("District"), "1d"))
            .spacedelta("community", Spacedelta.of(IndexSpec.of("CommunityArea"), "1d"))
            .build();
    assertEquals(
        ImmutableList.of(
            new PartitionDescriptor(DrainConstants.DATE, CrimeFixtures.DEC_31),
            new PartitionDescriptor(DrainConstants.DATE, CrimeFixtures.DEC_30)),
        Fanout.partition(specializer, DrainConstants.DATE));
    assertEquals(
        ImmutableList.of(
            new PartitionDescriptor(DrainConstants.INDEX, "district"),
            new PartitionDescriptor(DrainConstants.INDEX, "community")),
        Fanout.partition(specializer, DrainConstants.INDEX));

    List<Specializer> narrowed =
        Fanout.narrow(specializer, Fanout.partition(specializer, DrainConstants.INDEX));
    assertEquals(2, narrowed.get(0).getArgumentSpace().size());
    assertEquals(
        "district", narrowed.get(0).getArgumentSpace().getUnits().get(0).get(DrainConstants.INDEX));
  }

  @Test
  public void testFaninGroupedIsKeyUnion() throws Exception {
    AggregationResult merged =
        Fanout.fanin(
            ImmutableList.of(
                AggregationResult.grouped(ImmutableMap.of("A", counts("A", 1))),
                AggregationResult.grouped(ImmutableMap.of("B", counts("B", 2)))));
    assertEquals(ImmutableList.of("A", "B"), ImmutableList.copyOf(merged.getGroups().keySet()));
  }

  @Test
  public void testFaninStacksDisjointRows() throws Exception {
    AggregationResult merged =
        Fanout.fanin(
            ImmutableList.of(
                AggregationResult.grouped(ImmutableMap.of("all", counts("A", 1))),
                AggregationResult.grouped(ImmutableMap.of("all", counts("B", 2)))));
    assertEquals(2, merged.getGroups().get("all").numTuples());
  }

  @Test(expected = ConfigurationException.class)
  public void testFaninRejectsOverlappingKeys() throws Exception {
    Fanout.fanin(
        ImmutableList.of(
            AggregationResult.grouped(ImmutableMap.of("all", counts("A", 1))),
            AggregationResult.grouped(ImmutableMap.of("all", counts("A", 2)))));
  }

  @Test
  public void testFaninUngroupedKeepsOrder() throws Exception {
    Table a = counts("A", 1);
    Table b = counts("B", 2);
    Table c = counts("C", 3);
    AggregationResult merged =
        Fanout.fanin(
            ImmutableList.of(
                AggregationResult.ungrouped(ImmutableList.of(a, b)),
                AggregationResult.ungrouped(ImmutableList.of(c))));
    assertEquals(ImmutableList.of(a, b, c), merged.getTables());
  }

  @Test(expected = ConfigurationException.class)
  public void testFaninRejectsMixedResults() throws Exception {
    Fanout.fanin(
        ImmutableList.of(
            AggregationResult.grouped(ImmutableMap.of("A", counts("A", 1))),
            AggregationResult.ungrouped(ImmutableList.of(counts("B", 2)))));
  }

  @Test(expected = ConfigurationException.class)
  public void testPartitionsSharingAKeyAndRows() throws Exception {
    /* two indexes over the same column, grouped by delta alone, collide across index partitions */
    SpacetimeSpecializer specializer =
        SpacetimeSpecializer.builder()
            .input(CrimeFixtures.source())
            .dateColumn("Date")
            .dates(CrimeFixtures.DEC_31)
            .spacedelta("district", Spacedelta.of(IndexSpec.of("District"), "1d"))
            .spacedelta("police", Spacedelta.of(IndexSpec.of("District"), "1d"))
            .concatArgs(ImmutableList.of(DrainConstants.DELTA))
            .aggregates((date, delta) -> CrimeFixtures.aggregates())
            .build();
    new Aggregation(specializer, AggregationOptions.DEFAULT.partitionedBy(DrainConstants.INDEX))
        .getResult();
  }

  @Test
  public void testSequentialStackKeepsMultiplicity() throws Exception {
    SpacetimeSpecializer specializer =
        SpacetimeSpecializer.builder()
            .input(CrimeFixtures.source())
            .dateColumn("Date")
            .dates(CrimeFixtures.DEC_31)
            .spacedelta("district", Spacedelta.of(IndexSpec.of("District"), "1d"))
            .spacedelta("police", Spacedelta.of(IndexSpec.of("District"), "1d"))
            .concatArgs(ImmutableList.of(DrainConstants.DELTA))
            .aggregates((date, delta) -> CrimeFixtures.aggregates())
            .build();
    Table stacked =
        new Aggregation(specializer, AggregationOptions.DEFAULT).getResult().getGroups().get("1d");
    assertEquals(2, stacked.numTuples());
  }
}
