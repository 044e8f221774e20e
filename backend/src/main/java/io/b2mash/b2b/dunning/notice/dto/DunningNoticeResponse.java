package io.b2mash.b2b.dunning.notice.dto;

import io.b2mash.b2b.dunning.notice.DunningNotice;
import io.b2mash.b2b.dunning.notice.DunningNoticeStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record DunningNoticeResponse(
    UUID noticeId,
    String noticeNumber,
    String invoiceId,
    int level,
    String label,
    String currency,
    BigDecimal grossAmount,
    BigDecimal fee,
    BigDecimal interest,
    BigDecimal totalDue,
    DunningNoticeStatus status,
    Instant createdAt,
    Instant sentAt,
    Instant resolvedAt) {

  public static DunningNoticeResponse from(DunningNotice notice) {
    return new DunningNoticeResponse(
        notice.getId(),
        notice.getNoticeNumber(),
        notice.getInvoiceId(),
        notice.getLevel().number(),
        notice.getLabel(),
        notice.getCurrency(),
        notice.getGrossAmount(),
        notice.getFee(),
        notice.getInterest(),
        notice.getTotalDue(),
        notice.getStatus(),
        notice.getCreatedAt(),
        notice.getSentAt(),
        notice.getResolvedAt());
  }
}
