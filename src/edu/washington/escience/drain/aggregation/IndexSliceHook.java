package edu.washington.escience.drain.aggregation;

import edu.washington.escience.drain.DrainException;
import edu.washington.escience.drain.storage.Table;

/**
 * Narrows a windowed table to the rows relevant to one index. Required when a space-time aggregation's aggregators
 * depend on the index.
 */
public interface IndexSliceHook {
  /**
   * @param windowed the selected and censored rows of one window.
   * @param index the name of the index being aggregated.
   * @return the rows to aggregate.
   * @throws DrainException if the slice cannot be produced.
   */
  Table slice(Table windowed, String index) throws DrainException;
}
