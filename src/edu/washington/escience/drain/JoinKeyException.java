package edu.washington.escience.drain;

/** Thrown when a result group cannot be joined into a table on its index levels. */
public class JoinKeyException extends DrainException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param s a String describing the exception.
   */
  public JoinKeyException(final String s) {
    super(s);
  }
}
