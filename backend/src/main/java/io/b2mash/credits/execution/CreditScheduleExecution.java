package io.b2mash.credits.execution;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One firing attempt of a credit schedule. The row is inserted as RUNNING to claim its period;
 * afterwards only bulk updates in {@link CreditScheduleExecutionRepository} touch it, each guarded
 * by {@code status = RUNNING}.
 *
 * <p>Partial unique indexes on the table are the exactly-once guard: one RUNNING, COMPLETED or
 * PARTIALLY_FAILED row per (schedule_id, period_key), and one RUNNING row per schedule_id.
 */
@Entity
@Table(name = "credit_schedule_executions")
public class CreditScheduleExecution {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "schedule_id", nullable = false, updatable = false)
  private UUID scheduleId;

  @Column(name = "period_key", nullable = false, updatable = false, length = 40)
  private String periodKey;

  @Column(name = "execution_time", nullable = false, updatable = false)
  private Instant executionTime;

  @Enumerated(EnumType.STRING)
  @Column(name = "triggered_by", nullable = false, updatable = false, length = 10)
  private TriggerSource triggeredBy;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ExecutionStatus status;

  @Column(name = "cohort_size", nullable = false)
  private int cohortSize;

  @Column(name = "users_credited", nullable = false)
  private int usersCredited;

  @Column(name = "users_failed", nullable = false)
  private int usersFailed;

  @Column(name = "total_amount_granted", nullable = false, precision = 19, scale = 4)
  private BigDecimal totalAmountGranted;

  @Column(name = "error_message", length = 1000)
  private String errorMessage;

  @Column(name = "finished_at")
  private Instant finishedAt;

  @Column(name = "last_progress_at", nullable = false)
  private Instant lastProgressAt;

  @Column(name = "counted_users", nullable = false)
  private int countedUsers;

  @Column(name = "counted_amount", nullable = false, precision = 19, scale = 4)
  private BigDecimal countedAmount;

  protected CreditScheduleExecution() {}

  public CreditScheduleExecution(
      UUID scheduleId, String periodKey, TriggerSource triggeredBy, Instant executionTime) {
    this.scheduleId = scheduleId;
    this.periodKey = periodKey;
    this.triggeredBy = triggeredBy;
    this.executionTime = executionTime;
    this.status = ExecutionStatus.RUNNING;
    this.totalAmountGranted = BigDecimal.ZERO;
    this.lastProgressAt = executionTime;
    this.countedAmount = BigDecimal.ZERO;
  }

  public UUID getId() {
    return id;
  }

  public UUID getScheduleId() {
    return scheduleId;
  }

  public String getPeriodKey() {
    return periodKey;
  }

  public Instant getExecutionTime() {
    return executionTime;
  }

  public TriggerSource getTriggeredBy() {
    return triggeredBy;
  }

  public ExecutionStatus getStatus() {
    return status;
  }

  public int getCohortSize() {
    return cohortSize;
  }

  public int getUsersCredited() {
    return usersCredited;
  }

  public int getUsersFailed() {
    return usersFailed;
  }

  public BigDecimal getTotalAmountGranted() {
    return totalAmountGranted;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }

  public Instant getLastProgressAt() {
    return lastProgressAt;
  }

  /** Credited users already added to the schedule's running counters. */
  public int getCountedUsers() {
    return countedUsers;
  }

  /** Credits already added to the schedule's running counters. */
  public BigDecimal getCountedAmount() {
    return countedAmount;
  }
}
