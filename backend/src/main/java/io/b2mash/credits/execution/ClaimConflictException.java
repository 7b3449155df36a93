package io.b2mash.credits.execution;

import java.util.UUID;

/**
 * Another execution already holds the period (or the schedule has one RUNNING). Raised when the
 * claiming insert violates one of the partial unique indexes. Never surfaced over HTTP.
 */
public class ClaimConflictException extends RuntimeException {

  private final UUID scheduleId;
  private final String periodKey;

  public ClaimConflictException(UUID scheduleId, String periodKey, Throwable cause) {
    super(
        "Execution of schedule " + scheduleId + " for period " + periodKey + " already claimed",
        cause);
    this.scheduleId = scheduleId;
    this.periodKey = periodKey;
  }

  public UUID getScheduleId() {
    return scheduleId;
  }

  public String getPeriodKey() {
    return periodKey;
  }
}
