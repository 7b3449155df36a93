package io.b2mash.credits.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown by a manual execution request while another execution of the schedule is RUNNING. */
public class ScheduleAlreadyRunningException extends ErrorResponseException {

  public ScheduleAlreadyRunningException(UUID scheduleId) {
    super(HttpStatus.CONFLICT, createProblem(scheduleId), null);
  }

  private static ProblemDetail createProblem(UUID scheduleId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Schedule already running");
    problem.setDetail(
        "Credit schedule " + scheduleId + " has an execution in progress. Retry once it finishes.");
    problem.setProperty("scheduleId", scheduleId);
    return problem;
  }
}
