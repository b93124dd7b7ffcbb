package edu.washington.escience.drain.aggregation;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.CrimeFixtures;
import edu.washington.escience.drain.DrainConstants;
import edu.washington.escience.drain.Schema;
import edu.washington.escience.drain.Type;
import edu.washington.escience.drain.agg.IndexSpec;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.window.Delta;

public class SpacetimeAggregationTest {

  private static SpacetimeSpecializer.Builder crimeAggregation() {
    return SpacetimeSpecializer.builder()
        .input(CrimeFixtures.source())
        .dateColumn("Date")
        .dates(CrimeFixtures.DEC_30, CrimeFixtures.DEC_31)
        .spacedelta("district", Spacedelta.of(IndexSpec.of("District"), "12h", "24h"))
        .spacedelta("community", Spacedelta.of(IndexSpec.of("CommunityArea"), "1d", "2d"))
        .aggregates((date, delta) -> CrimeFixtures.aggregates());
  }

  private static List<Object> column(final Table table, final String name) {
    return table.getField(name);
  }

  @Test
  public void testPartitionedByDate() throws Exception {
    Aggregation aggregation =
        new Aggregation(crimeAggregation().build(), AggregationOptions.DEFAULT.partitionedBy(null));
    assertEquals(DrainConstants.DATE, aggregation.getPartitionKey());

    List<Aggregation> partitions = aggregation.getPartitions();
    assertEquals(2, partitions.size());
    for (Aggregation partition : partitions) {
      assertEquals(4, partition.getSpecializer().getArgumentSpace().getUnits().size());
    }

    Map<String, Table> groups = aggregation.getResult().getGroups();
    assertEquals(
        ImmutableList.of("district_12h", "district_24h", "community_1d", "community_2d"),
        ImmutableList.copyOf(groups.keySet()));
    for (Table group : groups.values()) {
      assertEquals(2, group.numTuples());
      assertEquals(
          ImmutableList.of((Object) CrimeFixtures.DEC_30, CrimeFixtures.DEC_31), column(group, "date"));
    }

    Table district12h = groups.get("district_12h");
    assertEquals(
        Schema.ofFields(Type.INT_TYPE, "District", Type.DATETIME_TYPE, DrainConstants.DATE),
        district12h.getIndexSchema());
    assertEquals(ImmutableList.of((Object) 1L, 1L), column(district12h, "count"));
    assertEquals(ImmutableList.of((Object) 1L, 0L), column(district12h, "Arrest_count"));

    Table community2d = groups.get("community_2d");
    assertEquals(ImmutableList.of((Object) 2L, 3L), column(community2d, "count"));
    assertEquals(ImmutableList.of((Object) 1L, 2L), column(community2d, "theft_count"));
    assertEquals(2.0 / 3, (Double) column(community2d, "theft_prop").get(1), 1e-9);
  }

  @Test
  public void testPartitionedMatchesSequential() throws Exception {
    AggregationResult sequential =
        new Aggregation(crimeAggregation().build(), AggregationOptions.DEFAULT).getResult();
    AggregationResult byDate =
        new Aggregation(crimeAggregation().build(), AggregationOptions.DEFAULT.partitionedBy(null))
            .getResult();
    AggregationResult byIndex =
        new Aggregation(
                crimeAggregation().build(),
                AggregationOptions.DEFAULT.partitionedBy(DrainConstants.INDEX))
            .getResult();
    assertEquals(sequential, byDate);
    assertEquals(sequential, byIndex);
  }

  @Test
  public void testUnstackingRecoversUnits() throws Exception {
    SpacetimeSpecializer specializer = crimeAggregation().build();
    AggregationResult grouped = new Aggregation(specializer, AggregationOptions.DEFAULT).getResult();
    AggregationResult units =
        new Aggregation(specializer, AggregationOptions.DEFAULT.withConcat(false)).getResult();

    List<Table> unstacked = new ArrayList<>();
    for (Table group : grouped.getGroups().values()) {
      unstacked.addAll(group.partitionBy(DrainConstants.DATE).values());
    }
    assertEquals(units.getTables().size(), unstacked.size());
    assertEquals(
        ImmutableMultiset.copyOf(units.getTables()),
        ImmutableMultiset.copyOf(unstacked));
  }

  @Test
  public void testCensoring() throws Exception {
    SpacetimeSpecializer specializer =
        crimeAggregation()
            .censorColumns(
                ImmutableMap.<String, List<String>>of("ArrestDate", ImmutableList.of("Arrest")))
            .build();
    Table community2d =
        new Aggregation(specializer, AggregationOptions.DEFAULT)
            .getResult()
            .getGroups()
            .get("community_2d");
    /* the arrest of 29 December is only known on the 30th */
    assertEquals(ImmutableList.of((Object) 1L, 1L), column(community2d, "Arrest_count"));
  }

  @Test
  public void testGetData() throws Exception {
    Table data = crimeAggregation().build().getData(CrimeFixtures.DEC_31, Delta.parse("12h"));
    assertEquals(1, data.numTuples());
    assertEquals("THEFT", data.getColumn("PrimaryType").get(0));
  }

  @Test
  public void testNarrowByDateKeepsSpacedeltas() throws Exception {
    SpacetimeSpecializer narrowed =
        (SpacetimeSpecializer) crimeAggregation().build().narrow(DrainConstants.DATE, CrimeFixtures.DEC_31);
    assertEquals(ImmutableList.of(CrimeFixtures.DEC_31), narrowed.getDates());
    assertEquals(2, narrowed.getSpacedeltas().size());
    assertEquals(4, narrowed.getArgumentSpace().size());
  }

  @Test(expected = ConfigurationException.class)
  public void testCannotPartitionByDelta() throws Exception {
    new Aggregation(
            crimeAggregation().build(), AggregationOptions.DEFAULT.partitionedBy(DrainConstants.DELTA))
        .getResult();
  }
}
