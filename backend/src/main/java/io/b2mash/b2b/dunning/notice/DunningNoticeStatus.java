package io.b2mash.b2b.dunning.notice;

/**
 * Lifecycle of a dunning notice.
 *
 * <ul>
 *   <li>CREATED → SENT (delivery confirmed)
 *   <li>CREATED → PAID, CREATED → CANCELLED (resolved before delivery was confirmed)
 *   <li>SENT → PAID, SENT → CANCELLED
 *   <li>PAID and CANCELLED are terminal
 * </ul>
 */
public enum DunningNoticeStatus {
  CREATED,
  SENT,
  PAID,
  CANCELLED;

  public boolean canTransitionTo(DunningNoticeStatus target) {
    return switch (this) {
      case CREATED -> target == SENT || target == PAID || target == CANCELLED;
      case SENT -> target == PAID || target == CANCELLED;
      case PAID, CANCELLED -> false;
    };
  }

  public boolean isTerminal() {
    return this == PAID || this == CANCELLED;
  }
}
