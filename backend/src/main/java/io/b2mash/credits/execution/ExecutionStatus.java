package io.b2mash.credits.execution;

import java.util.EnumSet;
import java.util.Set;

public enum ExecutionStatus {
  RUNNING,
  COMPLETED,
  PARTIALLY_FAILED,
  FAILED;

  /** Statuses that occupy a period: no other execution may claim the same period key. */
  public static final Set<ExecutionStatus> CLAIMING =
      EnumSet.of(RUNNING, COMPLETED, PARTIALLY_FAILED);

  public static final Set<ExecutionStatus> TERMINAL =
      EnumSet.of(COMPLETED, PARTIALLY_FAILED, FAILED);

  public boolean isTerminal() {
    return this != RUNNING;
  }
}
