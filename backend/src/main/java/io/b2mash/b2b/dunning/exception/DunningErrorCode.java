package io.b2mash.b2b.dunning.exception;

/**
 * Discriminator for every failure the dunning engine reports. Batch callers switch on the code
 * instead of the exception type.
 */
public enum DunningErrorCode {
  INVOICE_NOT_FOUND(Category.PRECONDITION),
  NOTICE_NOT_FOUND(Category.PRECONDITION),
  INVOICE_ALREADY_SETTLED(Category.PRECONDITION),
  INVOICE_NOT_OVERDUE(Category.PRECONDITION),
  MAX_LEVEL_REACHED(Category.PRECONDITION),
  INVALID_TRANSITION(Category.PRECONDITION),
  SWEEP_DATE_IN_FUTURE(Category.PRECONDITION),
  CONCURRENT_ESCALATION(Category.CONFLICT),
  SOURCE_UNAVAILABLE(Category.TRANSIENT),
  PERSISTENCE_TIMEOUT(Category.TRANSIENT);

  /** Retry semantics of a code. */
  public enum Category {
    /** Deterministic; retrying yields the same result. */
    PRECONDITION,
    /** Lost a race; safe to retry once after re-reading state. */
    CONFLICT,
    /** Infrastructure hiccup; retry with backoff. */
    TRANSIENT
  }

  private final Category category;

  DunningErrorCode(Category category) {
    this.category = category;
  }

  public boolean isRetryable() {
    return category != Category.PRECONDITION;
  }
}
