package io.b2mash.b2b.dunning.invoice;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Read-only view of an invoice as seen by the dunning engine.
 *
 * @param invoiceId opaque invoice identifier
 * @param invoiceNumber human-facing invoice number (may be null)
 * @param buyerName buyer display name (may be null)
 * @param buyerAddress free-text buyer address (may be null)
 * @param buyerEndpointId electronic address of the buyer, BT-49 (may be null)
 * @param buyerEndpointScheme scheme of {@code buyerEndpointId}, e.g. "EM" (may be null)
 * @param grossAmount gross amount, never negative
 * @param currency ISO 4217 currency code
 * @param dueDate payment due date (may be null for invoices without terms)
 * @param paymentStatus current payment status
 */
public record InvoiceSnapshot(
    String invoiceId,
    String invoiceNumber,
    String buyerName,
    String buyerAddress,
    String buyerEndpointId,
    String buyerEndpointScheme,
    BigDecimal grossAmount,
    String currency,
    LocalDate dueDate,
    PaymentStatus paymentStatus) {

  public InvoiceSnapshot {
    Objects.requireNonNull(invoiceId, "invoiceId must not be null");
    Objects.requireNonNull(paymentStatus, "paymentStatus must not be null");
    grossAmount = grossAmount != null ? grossAmount : BigDecimal.ZERO;
    if (grossAmount.signum() < 0) {
      throw new IllegalArgumentException("grossAmount must not be negative: " + grossAmount);
    }
  }

  /** Whole days between the due date and {@code asOf}; zero or negative when not yet due. */
  public long daysOverdue(LocalDate asOf) {
    if (dueDate == null) {
      return 0;
    }
    return ChronoUnit.DAYS.between(dueDate, asOf);
  }

  /** True when the invoice is open and its due date lies strictly before {@code asOf}. */
  public boolean isOverdueOn(LocalDate asOf) {
    return paymentStatus.isOpen() && dueDate != null && dueDate.isBefore(asOf);
  }
}
