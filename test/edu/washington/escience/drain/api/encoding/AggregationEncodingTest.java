package edu.washington.escience.drain.api.encoding;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.CrimeFixtures;
import edu.washington.escience.drain.DrainConstants;
import edu.washington.escience.drain.agg.CountAggregate;
import edu.washington.escience.drain.agg.IndexSpec;
import edu.washington.escience.drain.agg.PrimitiveAggregate;
import edu.washington.escience.drain.agg.PrimitiveAggregate.AggregationOp;
import edu.washington.escience.drain.aggregation.Aggregation;
import edu.washington.escience.drain.aggregation.AggregationOptions;
import edu.washington.escience.drain.aggregation.DirectRunner;
import edu.washington.escience.drain.aggregation.SpacetimeSpecializer;
import edu.washington.escience.drain.api.DrainJsonMapperProvider;
import edu.washington.escience.drain.window.Delta;

public class AggregationEncodingTest {

  private static final String SPACETIME =
      "{\"type\": \"Spacetime\","
          + " \"parallel\": true,"
          + " \"dateColumn\": \"Date\","
          + " \"dates\": [\"2015-12-30\", \"2015-12-31\"],"
          + " \"spacedeltas\": {"
          + "   \"district\": {\"index\": [\"District\"], \"deltas\": [\"12h\", \"24h\"]},"
          + "   \"community\": {\"index\": [\"CommunityArea\"], \"deltas\": [\"1d\", \"2d\"]}},"
          + " \"censorColumns\": {\"ArrestDate\": [\"Arrest\"]},"
          + " \"aggregates\": ["
          + "   {\"type\": \"Count\"},"
          + "   {\"type\": \"Count\", \"column\": \"Arrest\"},"
          + "   {\"type\": \"Count\", \"column\": \"PrimaryType\", \"equalTo\": \"THEFT\","
          + "    \"name\": \"theft\", \"prop\": true}]}";

  private static AggregationEncoding read(final String json) throws Exception {
    return DrainJsonMapperProvider.getMapper().readValue(json, AggregationEncoding.class);
  }

  @Test
  public void testSpacetime() throws Exception {
    AggregationEncoding encoding = read(SPACETIME);
    assertTrue(encoding instanceof SpacetimeAggregationEncoding);
    SpacetimeAggregationEncoding spacetime = (SpacetimeAggregationEncoding) encoding;
    assertEquals(ImmutableList.of(CrimeFixtures.DEC_30, CrimeFixtures.DEC_31), spacetime.dates);
    assertEquals(
        ImmutableList.of(
            CountAggregate.rows(),
            CountAggregate.of("Arrest"),
            CountAggregate.ofValue("PrimaryType", "THEFT", "theft", true)),
        spacetime.aggregates);
    assertEquals(new AggregationOptions(true, true, null), encoding.getOptions());

    Aggregation aggregation = encoding.construct(CrimeFixtures.source(), DirectRunner.INSTANCE);
    SpacetimeSpecializer specializer = (SpacetimeSpecializer) aggregation.getSpecializer();
    assertEquals(IndexSpec.of("District"), specializer.getIndex("district"));
    assertEquals(
        ImmutableList.of(Delta.parse("1d"), Delta.parse("2d")),
        specializer.getSpacedeltas().get("community").getDeltas());
    assertEquals(
        ImmutableList.of("district_12h", "district_24h", "community_1d", "community_2d"),
        ImmutableList.copyOf(aggregation.getResult().getGroups().keySet()));
    assertEquals(2, aggregation.getPartitions().size());
  }

  @Test
  public void testSimple() throws Exception {
    String json =
        "{\"type\": \"Simple\", \"concat\": false,"
            + " \"indexes\": {\"A\": [\"District\"], \"B\": [\"District\", \"PrimaryType\"]},"
            + " \"aggregates\": [{\"type\": \"Primitive\", \"column\": \"District\", \"op\": \"SUM\"}]}";
    AggregationEncoding encoding = read(json);
    assertTrue(encoding instanceof SimpleAggregationEncoding);
    assertEquals(
        ImmutableList.of(new PrimitiveAggregate("District", AggregationOp.SUM)),
        ((SimpleAggregationEncoding) encoding).aggregates);
    Aggregation aggregation = encoding.construct(CrimeFixtures.source(), DirectRunner.INSTANCE);
    assertEquals(DrainConstants.INDEX, aggregation.getPartitionKey());
    assertEquals(2, aggregation.getResult().getTables().size());
    assertEquals(5L, aggregation.getResult().getTables().get(0).getField("sum_District").get(0));
  }

  @Test
  public void testAggregatesRoundTrip() throws Exception {
    SimpleAggregationEncoding encoding = (SimpleAggregationEncoding) read(
        "{\"type\": \"Simple\", \"indexes\": {\"A\": [\"District\"]},"
            + " \"aggregates\": [{\"type\": \"Count\", \"column\": \"Arrest\", \"prop\": true}]}");
    String written = DrainJsonMapperProvider.getWriter().writeValueAsString(encoding);
    SimpleAggregationEncoding reread = (SimpleAggregationEncoding) read(written);
    assertEquals(encoding.aggregates, reread.aggregates);
    assertEquals(encoding.indexes, reread.indexes);
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingRequiredField() throws Exception {
    read("{\"type\": \"Simple\", \"indexes\": {\"A\": [\"District\"]}}").validate();
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingDelta() throws Exception {
    read(
            "{\"type\": \"Spacetime\", \"dateColumn\": \"Date\", \"dates\": [\"2015-12-30\"],"
                + " \"spacedeltas\": {\"district\": {\"index\": [\"District\"]}},"
                + " \"aggregates\": []}")
        .validate();
  }
}
