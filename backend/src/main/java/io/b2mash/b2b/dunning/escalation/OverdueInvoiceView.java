package io.b2mash.b2b.dunning.escalation;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * An invoice eligible for dunning as of a given date, together with its escalation state.
 *
 * @param daysOverdue days between due date and the evaluation date, always positive
 * @param currentLevel highest notice level issued so far, 0 if none
 * @param lastNoticeAt creation time of the latest notice, null if none
 */
public record OverdueInvoiceView(
    String invoiceId,
    String invoiceNumber,
    String buyerName,
    BigDecimal grossAmount,
    String currency,
    LocalDate dueDate,
    long daysOverdue,
    int currentLevel,
    Instant lastNoticeAt) {}
