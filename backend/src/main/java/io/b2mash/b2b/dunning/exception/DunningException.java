package io.b2mash.b2b.dunning.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base type of all dunning failures. Carries an RFC 7807 body for the HTTP layer and a {@link
 * DunningErrorCode} for programmatic callers.
 */
public abstract class DunningException extends ErrorResponseException {

  private final DunningErrorCode code;

  protected DunningException(
      HttpStatus status, DunningErrorCode code, String title, String detail) {
    super(status, createProblem(status, code, title, detail), null);
    this.code = code;
  }

  protected DunningException(
      HttpStatus status, DunningErrorCode code, String title, String detail, Throwable cause) {
    super(status, createProblem(status, code, title, detail), cause);
    this.code = code;
  }

  public DunningErrorCode getCode() {
    return code;
  }

  public boolean isRetryable() {
    return code.isRetryable();
  }

  private static ProblemDetail createProblem(
      HttpStatus status, DunningErrorCode code, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", code.name());
    problem.setProperty("retryable", code.isRetryable());
    return problem;
  }
}
