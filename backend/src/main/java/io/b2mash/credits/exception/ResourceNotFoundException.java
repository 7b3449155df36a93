package io.b2mash.credits.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A credit schedule, execution or template that does not exist (or was soft-deleted). The problem
 * body names the resource kind and key under {@code resource} and {@code key}.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  private ResourceNotFoundException(String resource, Object key, String detail) {
    super(HttpStatus.NOT_FOUND, createProblem(resource, key, detail), null);
  }

  public static ResourceNotFoundException schedule(UUID scheduleId) {
    return new ResourceNotFoundException(
        "CreditSchedule", scheduleId, "No credit schedule found with id " + scheduleId);
  }

  public static ResourceNotFoundException execution(UUID executionId) {
    return new ResourceNotFoundException(
        "CreditScheduleExecution",
        executionId,
        "No credit schedule execution found with id " + executionId);
  }

  public static ResourceNotFoundException template(String templateName) {
    return new ResourceNotFoundException(
        "ScheduleTemplate", templateName, "No schedule template named " + templateName);
  }

  private static ProblemDetail createProblem(String resource, Object key, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resource + " not found");
    problem.setDetail(detail);
    problem.setProperty("resource", resource);
    problem.setProperty("key", String.valueOf(key));
    return problem;
  }
}
