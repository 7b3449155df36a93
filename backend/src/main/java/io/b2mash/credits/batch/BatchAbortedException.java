package io.b2mash.credits.batch;

import io.b2mash.credits.execution.ExecutionResult;

/** A run stopped by an unexpected error. Carries the counters reached before the error. */
public class BatchAbortedException extends RuntimeException {

  private final ExecutionResult progress;

  public BatchAbortedException(ExecutionResult progress, Throwable cause) {
    super(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName(), cause);
    this.progress = progress;
  }

  public ExecutionResult getProgress() {
    return progress;
  }
}
