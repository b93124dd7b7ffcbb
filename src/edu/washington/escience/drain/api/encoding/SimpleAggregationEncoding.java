package edu.washington.escience.drain.api.encoding;

import java.util.List;
import java.util.Map;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.agg.Aggregate;
import edu.washington.escience.drain.agg.IndexSpec;
import edu.washington.escience.drain.aggregation.SimpleSpecializer;
import edu.washington.escience.drain.aggregation.Specializer;
import edu.washington.escience.drain.storage.TableSource;

/** JSON wrapper for a simple aggregation. */
public class SimpleAggregationEncoding extends AggregationEncoding {
  /** The index registry: index name to grouping columns. */
  @Required public Map<String, IndexSpec> indexes;
  /** The aggregates. */
  @Required public List<Aggregate> aggregates;

  @Override
  protected void validateExtra() throws ConfigurationException {
    if (indexes.isEmpty()) {
      throw new ConfigurationException("indexes must not be empty");
    }
  }

  @Override
  public Specializer constructSpecializer(final TableSource input) throws ConfigurationException {
    return new SimpleSpecializer(input, indexes, aggregates);
  }
}
