package edu.washington.escience.drain;

/** Thrown when an aggregation unit refers to an index that is not registered. */
public class IndexLookupException extends DrainException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param name the unknown index name.
   */
  public IndexLookupException(final String name) {
    super("No index named " + name + " is registered");
  }
}
