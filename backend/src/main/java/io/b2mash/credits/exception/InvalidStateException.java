package io.b2mash.credits.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A well-formed request the engine cannot act on in its current state: an out-of-range query
 * parameter, or a manual firing of a schedule that is inactive or out of budget. HTTP 400.
 */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, null), null);
  }

  private InvalidStateException(String title, String detail, UUID scheduleId) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, scheduleId), null);
  }

  /** The schedule exists but cannot be fired right now. */
  public static InvalidStateException notFireable(UUID scheduleId, String title, String reason) {
    return new InvalidStateException(
        title, "Credit schedule " + scheduleId + " cannot be executed: " + reason, scheduleId);
  }

  private static ProblemDetail createProblem(String title, String detail, UUID scheduleId) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    if (scheduleId != null) {
      problem.setProperty("scheduleId", scheduleId.toString());
    }
    return problem;
  }
}
