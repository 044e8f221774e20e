package io.b2mash.b2b.dunning.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;

public class DunningNoticeNotFoundException extends DunningException {

  public DunningNoticeNotFoundException(UUID noticeId) {
    super(
        HttpStatus.NOT_FOUND,
        DunningErrorCode.NOTICE_NOT_FOUND,
        "Dunning notice not found",
        "No dunning notice found with id " + noticeId);
  }
}
