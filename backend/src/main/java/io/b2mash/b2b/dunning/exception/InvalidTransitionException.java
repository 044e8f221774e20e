package io.b2mash.b2b.dunning.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;

public class InvalidTransitionException extends DunningException {

  public InvalidTransitionException(UUID noticeId, String from, String to) {
    super(
        HttpStatus.BAD_REQUEST,
        DunningErrorCode.INVALID_TRANSITION,
        "Invalid notice status",
        "Cannot move dunning notice " + noticeId + " from " + from + " to " + to + ".");
  }
}
