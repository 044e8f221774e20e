package io.b2mash.b2b.dunning.invoice;

import java.util.EnumSet;
import java.util.Set;

/**
 * Payment status of an invoice as maintained by the invoicing subsystem. The dunning engine only
 * observes it.
 */
public enum PaymentStatus {
  UNPAID,
  PARTIAL,
  PAID,
  OVERDUE,
  CANCELLED;

  /** Statuses the engine may escalate. */
  public static final Set<PaymentStatus> OPEN = EnumSet.of(UNPAID, PARTIAL, OVERDUE);

  public boolean isOpen() {
    return OPEN.contains(this);
  }

  /** Paid or cancelled invoices are never escalated. */
  public boolean isSettled() {
    return this == PAID || this == CANCELLED;
  }
}
