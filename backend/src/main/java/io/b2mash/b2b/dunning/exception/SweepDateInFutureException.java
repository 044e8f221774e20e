package io.b2mash.b2b.dunning.exception;

import java.time.LocalDate;
import org.springframework.http.HttpStatus;

public class SweepDateInFutureException extends DunningException {

  public SweepDateInFutureException(LocalDate asOf, LocalDate today) {
    super(
        HttpStatus.BAD_REQUEST,
        DunningErrorCode.SWEEP_DATE_IN_FUTURE,
        "Sweep date in the future",
        "Cannot sweep as of " + asOf + ", which is after today (" + today + ").");
  }
}
