package edu.washington.escience.drain.aggregation;

import java.util.List;

import edu.washington.escience.drain.ConfigurationException;
import edu.washington.escience.drain.DrainException;
import edu.washington.escience.drain.IndexLookupException;
import edu.washington.escience.drain.agg.Aggregator;
import edu.washington.escience.drain.agg.IndexSpec;
import edu.washington.escience.drain.storage.TableSource;

/**
 * Supplies what differs between kinds of aggregation: the argument space, which arguments an aggregator depends on,
 * how results are keyed and stacked, and how the data and aggregates of a unit are obtained.
 */
public interface Specializer {
  /**
   * @return the source of the data being aggregated.
   */
  TableSource getInput();

  /**
   * @return the space of units to aggregate. It always has an {@code index} dimension.
   */
  ArgumentSpace getArgumentSpace();

  /**
   * @return the arguments an aggregator depends on. Units that agree on these share one aggregator.
   */
  List<String> getAggregatorArgs();

  /**
   * @return the arguments whose values form the result key of a unit.
   */
  List<String> getConcatArgs();

  /**
   * @return the arguments whose values are added to a unit's result as extra index levels.
   */
  List<String> getInsertArgs();

  /**
   * Build the aggregator for a combination of aggregator arguments.
   *
   * @param arguments a unit restricted to {@link #getAggregatorArgs()}.
   * @return a new aggregator.
   * @throws DrainException if the data cannot be read, a hook is missing, or the aggregates do not apply.
   */
  Aggregator buildAggregator(AggregationUnit arguments) throws DrainException;

  /**
   * @param name the value of a unit's {@code index} argument.
   * @return the physical index to aggregate over.
   * @throws IndexLookupException if no such index is registered.
   */
  IndexSpec getIndex(String name) throws IndexLookupException;

  /**
   * @return the argument to partition on when no other is requested.
   */
  String getDefaultPartitionKey();

  /**
   * Restrict this specializer to the units where one argument has one value. The result is the same kind of
   * specializer, reading the same input.
   *
   * @param key the argument.
   * @param value the value to keep.
   * @return the narrowed specializer.
   * @throws ConfigurationException if this kind of specializer cannot be partitioned on that argument.
   */
  Specializer narrow(String key, Object value) throws ConfigurationException;
}
