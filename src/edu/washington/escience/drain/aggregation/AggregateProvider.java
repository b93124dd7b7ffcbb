package edu.washington.escience.drain.aggregation;

import java.util.List;

import org.joda.time.DateTime;

import edu.washington.escience.drain.DrainException;
import edu.washington.escience.drain.agg.Aggregate;
import edu.washington.escience.drain.window.Delta;

/**
 * Supplies the aggregates of a space-time aggregation for one window.
 */
public interface AggregateProvider {
  /**
   * @param date the end of the window.
   * @param delta the length of the window.
   * @return the aggregates to compute over that window.
   * @throws DrainException if the aggregates cannot be determined.
   */
  List<? extends Aggregate> getAggregates(DateTime date, Delta delta) throws DrainException;
}
