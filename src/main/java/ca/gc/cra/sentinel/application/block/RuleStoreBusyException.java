package ca.gc.cra.sentinel.application.block;

/**
 * Raised when the block rule store cannot acquire its write lock in time. The caller may retry.
 *
 * @since 0.1.0
 */
public final class RuleStoreBusyException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public RuleStoreBusyException(String message) {
    super(message);
  }

  public RuleStoreBusyException(String message, Throwable cause) {
    super(message, cause);
  }
}
