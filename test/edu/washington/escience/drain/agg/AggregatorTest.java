package edu.washington.escience.drain.agg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.CrimeFixtures;
import edu.washington.escience.drain.Schema;
import edu.washington.escience.drain.Type;
import edu.washington.escience.drain.agg.PrimitiveAggregate.AggregationOp;
import edu.washington.escience.drain.storage.Table;
import edu.washington.escience.drain.storage.TableBuilder;

public class AggregatorTest {

  @Test
  public void testCountAggregates() throws Exception {
    Aggregator aggregator = new Aggregator(CrimeFixtures.crimes(), CrimeFixtures.aggregates());
    assertEquals(
        Schema.ofFields(
            Type.LONG_TYPE, "count",
            Type.LONG_TYPE, "Arrest_count",
            Type.LONG_TYPE, "theft_count",
            Type.DOUBLE_TYPE, "theft_prop"),
        aggregator.getOutputSchema());

    Table result = aggregator.aggregate(IndexSpec.of("District"));
    assertEquals(Schema.ofFields(Type.INT_TYPE, "District"), result.getIndexSchema());
    assertEquals(1, result.numTuples());
    assertEquals(1, result.getIndexValue(0, 0));
    assertEquals(5L, result.getField("count").get(0));
    assertEquals(3L, result.getField("Arrest_count").get(0));
    assertEquals(3L, result.getField("theft_count").get(0));
    assertEquals(0.6, (Double) result.getField("theft_prop").get(0), 1e-9);
  }

  @Test
  public void testGroupsAreSortedAndNullKeysDropped() throws Exception {
    Table table =
        new TableBuilder(Schema.ofFields(Type.STRING_TYPE, "beat", Type.LONG_TYPE, "n"))
            .addRow("B", 1)
            .addRow(null, 2)
            .addRow("A", 3)
            .addRow("B", 4)
            .build();
    Aggregator aggregator =
        new Aggregator(
            table,
            ImmutableList.of(
                new PrimitiveAggregate("n", AggregationOp.SUM),
                new PrimitiveAggregate("n", AggregationOp.MAX)));
    Table result = aggregator.aggregate(IndexSpec.of("beat"));
    assertEquals(ImmutableList.of((Object) "A", "B"), result.getField("beat"));
    assertEquals(ImmutableList.of((Object) 3L, 5L), result.getField("sum_n"));
    assertEquals(ImmutableList.of((Object) 3L, 4L), result.getField("max_n"));
  }

  @Test
  public void testMultiColumnIndex() throws Exception {
    Aggregator aggregator = new Aggregator(CrimeFixtures.crimes(), ImmutableList.of(CountAggregate.rows()));
    Table result = aggregator.aggregate(IndexSpec.of("District", "PrimaryType"));
    assertEquals(2, result.numTuples());
    assertEquals(ImmutableList.of((Object) 1, "BATTERY"), result.getIndexKey(0));
    assertEquals(ImmutableList.of((Object) 2L, 3L), result.getField("count"));
  }

  @Test
  public void testPrimitiveAggregatesIgnoreMissingValues() throws Exception {
    Table table =
        new TableBuilder(Schema.ofFields(Type.STRING_TYPE, "k", Type.DOUBLE_TYPE, "x"))
            .addRow("a", 1.0)
            .addRow("a", null)
            .addRow("a", 3.0)
            .addRow("b", null)
            .build();
    Aggregator aggregator =
        new Aggregator(
            table,
            ImmutableList.of(
                new PrimitiveAggregate("x", AggregationOp.AVG),
                new PrimitiveAggregate("x", AggregationOp.COUNT),
                new PrimitiveAggregate("x", AggregationOp.MIN)));
    Table result = aggregator.aggregate(IndexSpec.of("k"));
    assertEquals(2.0, (Double) result.getField("avg_x").get(0), 1e-9);
    assertEquals(2L, result.getField("count_x").get(0));
    assertEquals(1.0, result.getField("min_x").get(0));
    assertNull(result.getField("avg_x").get(1));
    assertEquals(0L, result.getField("count_x").get(1));
    assertNull(result.getField("min_x").get(1));
  }

  @Test(expected = ConfigurationException.class)
  public void testSumOfStringsIsRejected() throws Exception {
    new Aggregator(
        CrimeFixtures.crimes(), ImmutableList.of(new PrimitiveAggregate("PrimaryType", AggregationOp.SUM)));
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingColumnIsRejected() throws Exception {
    new Aggregator(CrimeFixtures.crimes(), ImmutableList.of(CountAggregate.of("Beat")));
  }

  @Test(expected = ConfigurationException.class)
  public void testConflictingOutputsAreRejected() throws Exception {
    new Aggregator(
        CrimeFixtures.crimes(), ImmutableList.of(CountAggregate.rows(), CountAggregate.rows()));
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingIndexColumn() throws Exception {
    new Aggregator(CrimeFixtures.crimes(), CrimeFixtures.aggregates()).aggregate(IndexSpec.of("Beat"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnnamedProportionOfRows() {
    new CountAggregate(null, null, null, true);
  }
}
