package ca.gc.cra.sentinel.application.query;

/** Expected failure categories reported by pull operations. */
public enum ErrorCode {
  /** Referenced id, rule or capture does not exist. */
  NOT_FOUND,
  /** Caller supplied a malformed or out-of-range argument. */
  INVALID_INPUT,
  /** Operation could not complete now; retrying may succeed. */
  TRANSIENT
}
