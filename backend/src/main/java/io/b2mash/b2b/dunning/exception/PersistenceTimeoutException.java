package io.b2mash.b2b.dunning.exception;

import org.springframework.http.HttpStatus;

public class PersistenceTimeoutException extends DunningException {

  public PersistenceTimeoutException(String invoiceId, Throwable cause) {
    super(
        HttpStatus.SERVICE_UNAVAILABLE,
        DunningErrorCode.PERSISTENCE_TIMEOUT,
        "Escalation timed out",
        "Escalation of invoice " + invoiceId + " timed out and was rolled back. Please try again.",
        cause);
  }
}
