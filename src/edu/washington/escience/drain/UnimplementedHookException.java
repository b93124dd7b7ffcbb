package edu.washington.escience.drain;

/** Thrown when a specializer is asked for a hook it was never given. */
public class UnimplementedHookException extends DrainException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param hook the name of the missing hook.
   * @param owner the class that should have supplied it.
   */
  public UnimplementedHookException(final String hook, final Class<?> owner) {
    super(owner.getSimpleName() + " does not implement " + hook);
  }
}
