package edu.washington.escience.drain;

/** Generic drain exception class. */
public class DrainException extends Exception {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * Standard String constructor.
   *
   * @param s a String describing the exception.
   */
  public DrainException(final String s) {
    super(s);
  }

  /**
   * Standard Throwable constructor.
   *
   * @param e a different Throwable to be wrapped in a DrainException.
   */
  public DrainException(final Throwable e) {
    super(e);
  }

  /**
   * @param s a String describing the exception.
   * @param e the cause.
   */
  public DrainException(final String s, final Throwable e) {
    super(s, e);
  }
}
