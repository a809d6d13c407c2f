package org.example.crowdledger.model;

import java.util.Objects;

/**
 * Precondition or arithmetic failure raised by the ledger components.
 *
 * <p>Unchecked: a failure aborts the running workflow, which then discards every mutation it made
 * before rethrowing. The {@link #reason()} tells the caller what went wrong.
 */
public class LedgerException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final FailureReason reason;

  public LedgerException(FailureReason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public FailureReason reason() {
    return reason;
  }

  /** Shorthand for the most common failure. */
  public static LedgerException notFound(ContentId id) {
    return new LedgerException(FailureReason.NOT_FOUND, "No content at " + id);
  }
}
