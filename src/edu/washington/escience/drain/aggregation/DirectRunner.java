package edu.washington.escience.drain.aggregation;

import java.util.ArrayList;
import java.util.List;

import edu.washington.escience.drain.DrainException;

/**
 * Runs partitions one after another in the calling thread.
 */
public final class DirectRunner implements AggregationRunner {
  /** The shared instance. */
  public static final DirectRunner INSTANCE = new DirectRunner();

  /** Use {@link #INSTANCE}. */
  private DirectRunner() {}

  @Override
  public List<AggregationResult> run(final List<Aggregation> partitions) throws DrainException {
    List<AggregationResult> ret = new ArrayList<>(partitions.size());
    for (Aggregation partition : partitions) {
      ret.add(partition.getResult());
    }
    return ret;
  }
}
