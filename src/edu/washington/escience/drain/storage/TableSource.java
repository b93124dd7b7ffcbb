package edu.washington.escience.drain.storage;

import edu.washington.escience.drain.DrainException;

/**
 * Supplies the table an aggregation reads from. Implementations are owned by the runtime that executes aggregations
 * and may compute, cache or load their result.
 */
public interface TableSource {
  /**
   * @return the table.
   * @throws DrainException if the table cannot be produced.
   */
  Table getResult() throws DrainException;
}
