package edu.washington.escience.drain.api.encoding;

import java.util.List;
import java.util.Map;

import org.joda.time.DateTime;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.agg.Aggregate;
import edu.washington.escience.drain.aggregation.SpacetimeSpecializer;
import edu.washington.escience.drain.aggregation.Specializer;
import edu.washington.escience.drain.storage.TableSource;

/** JSON wrapper for a space-time aggregation. The same aggregates are computed over every window. */
public class SpacetimeAggregationEncoding extends AggregationEncoding {
  /** The spacedeltas, by index name. */
  @Required public Map<String, SpacedeltaEncoding> spacedeltas;
  /** The window end dates. */
  @Required public List<DateTime> dates;
  /** The timestamp column windows select on. */
  @Required public String dateColumn;
  /** The aggregates. */
  @Required public List<Aggregate> aggregates;
  /** Date columns mapped to the columns they censor. */
  public Map<String, List<String>> censorColumns;
  /** Arguments an aggregator depends on. */
  public List<String> aggregatorArgs;
  /** Arguments forming the result key. */
  public List<String> concatArgs;

  @Override
  protected void validateExtra() throws ConfigurationException {
    for (SpacedeltaEncoding spacedelta : spacedeltas.values()) {
      spacedelta.validate();
    }
  }

  @Override
  public Specializer constructSpecializer(final TableSource input) throws ConfigurationException {
    SpacetimeSpecializer.Builder builder =
        SpacetimeSpecializer.builder()
            .input(input)
            .dates(dates)
            .dateColumn(dateColumn)
            .aggregates((date, delta) -> aggregates);
    for (Map.Entry<String, SpacedeltaEncoding> entry : spacedeltas.entrySet()) {
      builder.spacedelta(entry.getKey(), entry.getValue().construct());
    }
    if (censorColumns != null) {
      builder.censorColumns(censorColumns);
    }
    if (aggregatorArgs != null) {
      builder.aggregatorArgs(aggregatorArgs);
    }
    if (concatArgs != null) {
      builder.concatArgs(concatArgs);
    }
    return builder.build();
  }
}
