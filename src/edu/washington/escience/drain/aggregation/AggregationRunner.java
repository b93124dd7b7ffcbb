package edu.washington.escience.drain.aggregation;

import java.util.List;

import edu.washington.escience.drain.DrainException;

/**
 * Runs the partitions of a partitioned {@link Aggregation}. A runtime may run them concurrently; each partition owns
 * its own aggregators.
 */
public interface AggregationRunner {
  /**
   * @param partitions the partitions.
   * @return their results, in partition order.
   * @throws DrainException if any partition fails.
   */
  List<AggregationResult> run(List<Aggregation> partitions) throws DrainException;
}
