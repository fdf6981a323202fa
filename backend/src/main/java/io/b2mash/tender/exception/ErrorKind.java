package io.b2mash.tender.exception;

/**
 * Stable error categories surfaced to callers as the {@code kind} property of every problem
 * response. Clients branch on this value, never on the human-readable detail.
 */
public enum ErrorKind {
  /** Caller lacks the role the operation requires. */
  UNAUTHORIZED,

  /** Tender, offer or evaluator does not exist. */
  NOT_FOUND,

  /** Operation invoked outside its lifecycle phase. */
  INVALID_STATE,

  /** Malformed arguments: bad weights, non-positive price, blank strings, score out of range. */
  INVALID_INPUT,

  /** A time-based precondition failed. */
  DEADLINE_VIOLATION,

  /** Duplicate offer or evaluator, or re-run of a one-shot operation. */
  ALREADY_EXISTS;

  public static final String PROPERTY = "kind";
}
