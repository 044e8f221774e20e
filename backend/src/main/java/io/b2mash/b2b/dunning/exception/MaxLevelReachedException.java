package io.b2mash.b2b.dunning.exception;

import org.springframework.http.HttpStatus;

public class MaxLevelReachedException extends DunningException {

  public MaxLevelReachedException(String invoiceId, int currentLevel) {
    super(
        HttpStatus.BAD_REQUEST,
        DunningErrorCode.MAX_LEVEL_REACHED,
        "Maximum reminder stage reached",
        "Invoice "
            + invoiceId
            + " already has a level "
            + currentLevel
            + " notice. Further steps require manual intervention.");
  }
}
