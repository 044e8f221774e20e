package io.b2mash.b2b.dunning.exception;

import org.springframework.http.HttpStatus;

public class SourceUnavailableException extends DunningException {

  public SourceUnavailableException(String detail, Throwable cause) {
    super(
        HttpStatus.SERVICE_UNAVAILABLE,
        DunningErrorCode.SOURCE_UNAVAILABLE,
        "Data source unavailable",
        detail + " Please try again.",
        cause);
  }
}
