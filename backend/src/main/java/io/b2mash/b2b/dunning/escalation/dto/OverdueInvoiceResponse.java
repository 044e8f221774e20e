package io.b2mash.b2b.dunning.escalation.dto;

import io.b2mash.b2b.dunning.escalation.OverdueInvoiceView;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public record OverdueInvoiceResponse(
    String invoiceId,
    String invoiceNumber,
    String buyerName,
    BigDecimal grossAmount,
    String currency,
    LocalDate dueDate,
    long daysOverdue,
    int currentLevel,
    Instant lastNoticeAt) {

  public static OverdueInvoiceResponse from(OverdueInvoiceView view) {
    return new OverdueInvoiceResponse(
        view.invoiceId(),
        view.invoiceNumber() != null ? view.invoiceNumber() : "",
        view.buyerName() != null ? view.buyerName() : "",
        view.grossAmount(),
        view.currency(),
        view.dueDate(),
        view.daysOverdue(),
        view.currentLevel(),
        view.lastNoticeAt());
  }
}
