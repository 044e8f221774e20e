package io.b2mash.b2b.dunning.exception;

import org.springframework.http.HttpStatus;

/**
 * Another escalation of the same invoice committed first. The attempted level is kept so callers
 * can look up the winning notice.
 */
public class ConcurrentEscalationException extends DunningException {

  private final String invoiceId;
  private final int attemptedLevel;

  public ConcurrentEscalationException(String invoiceId, int attemptedLevel) {
    this(invoiceId, attemptedLevel, null);
  }

  public ConcurrentEscalationException(String invoiceId, int attemptedLevel, Throwable cause) {
    super(
        HttpStatus.CONFLICT,
        DunningErrorCode.CONCURRENT_ESCALATION,
        "Concurrent escalation",
        "Invoice "
            + invoiceId
            + " was escalated concurrently while creating level "
            + attemptedLevel
            + ". Please retry.",
        cause);
    this.invoiceId = invoiceId;
    this.attemptedLevel = attemptedLevel;
  }

  public String getInvoiceId() {
    return invoiceId;
  }

  public int getAttemptedLevel() {
    return attemptedLevel;
  }
}
