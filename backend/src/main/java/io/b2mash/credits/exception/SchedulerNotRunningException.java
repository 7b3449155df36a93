package io.b2mash.credits.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class SchedulerNotRunningException extends ErrorResponseException {

  public SchedulerNotRunningException(String currentState) {
    super(HttpStatus.CONFLICT, createProblem(currentState), null);
  }

  private static ProblemDetail createProblem(String currentState) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Scheduler not running");
    problem.setDetail("Credit scheduler must be RUNNING to stop. Current state: " + currentState);
    return problem;
  }
}
