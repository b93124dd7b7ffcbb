package edu.washington.escience.drain;

/**
 * Thrown when an aggregation is declared inconsistently: conflicting or missing dimensions, overlapping result keys
 * across partitions, or tables that cannot be stacked together.
 */
public class ConfigurationException extends DrainException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param s a String describing the exception.
   */
  public ConfigurationException(final String s) {
    super(s);
  }

  /**
   * @param s a String describing the exception.
   * @param e the cause.
   */
  public ConfigurationException(final String s, final Throwable e) {
    super(s, e);
  }
}
