package io.b2mash.b2b.dunning.sweep;

public enum SkipReason {
  /** The invoice already carries the final notice. */
  FINAL_LEVEL_REACHED,
  /** Overdue, but not long enough for a first reminder. */
  GRACE_PERIOD,
  /** The latest notice is too recent for the next step. */
  TOO_SOON_SINCE_LAST_NOTICE,
  /** The sweep ran out of its time budget before reaching the invoice. */
  DEADLINE_EXCEEDED,
  /** The sweeping thread was interrupted. */
  CANCELLED
}
