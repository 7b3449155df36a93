package io.b2mash.credits.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a credit schedule definition is inconsistent (temporal fields that do not match the
 * schedule type, targeting parameters of the wrong mode, non-positive amounts or caps). Raised at
 * create/update time only. Results in HTTP 400 with the offending field as a property.
 */
public class ScheduleValidationException extends ErrorResponseException {

  private final String field;

  public ScheduleValidationException(String field, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(field, detail), null);
    this.field = field;
  }

  public String getField() {
    return field;
  }

  private static ProblemDetail createProblem(String field, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid credit schedule");
    problem.setDetail(detail);
    problem.setProperty("field", field);
    return problem;
  }
}
