package io.b2mash.b2b.dunning.sweep;

import io.b2mash.b2b.dunning.exception.DunningErrorCode;
import io.b2mash.b2b.dunning.notice.DunningNotice;
import java.util.UUID;

/**
 * Result of considering one invoice during a sweep. Exactly one of notice fields, {@code
 * errorCode}/{@code message} or {@code skipReason} is populated, according to {@code type}.
 *
 * @param errorCode code of a failed escalation; null when the failure was not a dunning error
 */
public record EscalationOutcome(
    String invoiceId,
    Type type,
    Integer level,
    UUID noticeId,
    String noticeNumber,
    DunningErrorCode errorCode,
    String message,
    SkipReason skipReason) {

  public enum Type {
    ESCALATED,
    FAILED,
    SKIPPED
  }

  public static EscalationOutcome escalated(String invoiceId, DunningNotice notice) {
    return new EscalationOutcome(
        invoiceId,
        Type.ESCALATED,
        notice.getLevel().number(),
        notice.getId(),
        notice.getNoticeNumber(),
        null,
        null,
        null);
  }

  public static EscalationOutcome failed(
      String invoiceId, DunningErrorCode errorCode, String message) {
    return new EscalationOutcome(
        invoiceId, Type.FAILED, null, null, null, errorCode, message, null);
  }

  public static EscalationOutcome skipped(String invoiceId, SkipReason reason) {
    return new EscalationOutcome(invoiceId, Type.SKIPPED, null, null, null, null, null, reason);
  }

  public boolean isRetryable() {
    return type == Type.FAILED && (errorCode == null || errorCode.isRetryable());
  }
}
