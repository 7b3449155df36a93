package io.b2mash.credits.execution;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CreditScheduleExecutionRepository
    extends JpaRepository<CreditScheduleExecution, UUID> {

  boolean existsByScheduleIdAndPeriodKeyAndStatusIn(
      UUID scheduleId, String periodKey, Collection<ExecutionStatus> statuses);

  boolean existsByScheduleIdAndStatus(UUID scheduleId, ExecutionStatus status);

  long countByScheduleIdAndPeriodKeyAndStatus(
      UUID scheduleId, String periodKey, ExecutionStatus status);

  Optional<CreditScheduleExecution> findFirstByScheduleIdAndPeriodKeyAndStatusOrderByFinishedAtDesc(
      UUID scheduleId, String periodKey, ExecutionStatus status);

  List<CreditScheduleExecution> findByScheduleIdOrderByExecutionTimeDesc(
      UUID scheduleId, Pageable pageable);

  List<CreditScheduleExecution> findAllByOrderByExecutionTimeDesc(Pageable pageable);

  List<CreditScheduleExecution> findByStatusAndLastProgressAtBefore(
      ExecutionStatus status, Instant cutoff);

  List<CreditScheduleExecution>
      findByScheduleIdAndStatusInAndExecutionTimeGreaterThanEqualOrderByExecutionTimeAsc(
          UUID scheduleId, Collection<ExecutionStatus> statuses, Instant from);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE CreditScheduleExecution e
      SET e.cohortSize = :cohortSize,
          e.usersCredited = :usersCredited,
          e.usersFailed = :usersFailed,
          e.totalAmountGranted = :amount,
          e.lastProgressAt = :progressAt
      WHERE e.id = :id AND e.status = io.b2mash.credits.execution.ExecutionStatus.RUNNING
      """)
  int updateProgress(
      @Param("id") UUID id,
      @Param("cohortSize") int cohortSize,
      @Param("usersCredited") int usersCredited,
      @Param("usersFailed") int usersFailed,
      @Param("amount") BigDecimal amount,
      @Param("progressAt") Instant progressAt);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE CreditScheduleExecution e
      SET e.status = :status,
          e.cohortSize = :cohortSize,
          e.usersCredited = :usersCredited,
          e.usersFailed = :usersFailed,
          e.totalAmountGranted = :amount,
          e.errorMessage = :errorMessage,
          e.finishedAt = :finishedAt,
          e.lastProgressAt = :finishedAt,
          e.countedUsers = :usersCredited,
          e.countedAmount = :amount
      WHERE e.id = :id AND e.status = io.b2mash.credits.execution.ExecutionStatus.RUNNING
      """)
  int finishIfRunning(
      @Param("id") UUID id,
      @Param("status") ExecutionStatus status,
      @Param("cohortSize") int cohortSize,
      @Param("usersCredited") int usersCredited,
      @Param("usersFailed") int usersFailed,
      @Param("amount") BigDecimal amount,
      @Param("errorMessage") String errorMessage,
      @Param("finishedAt") Instant finishedAt);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE CreditScheduleExecution e
      SET e.status = io.b2mash.credits.execution.ExecutionStatus.FAILED,
          e.errorMessage = :errorMessage,
          e.finishedAt = :finishedAt,
          e.countedUsers = e.usersCredited,
          e.countedAmount = e.totalAmountGranted
      WHERE e.id = :id AND e.status = io.b2mash.credits.execution.ExecutionStatus.RUNNING
      """)
  int failIfRunning(
      @Param("id") UUID id,
      @Param("errorMessage") String errorMessage,
      @Param("finishedAt") Instant finishedAt);

  /**
   * Stores the final counters of a run that finished after its row had already left RUNNING, and
   * marks them as counted on the schedule.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE CreditScheduleExecution e
      SET e.cohortSize = :cohortSize,
          e.usersCredited = :usersCredited,
          e.usersFailed = :usersFailed,
          e.totalAmountGranted = :amount,
          e.countedUsers = :usersCredited,
          e.countedAmount = :amount
      WHERE e.id = :id AND e.status <> io.b2mash.credits.execution.ExecutionStatus.RUNNING
      """)
  int recordLateCounters(
      @Param("id") UUID id,
      @Param("cohortSize") int cohortSize,
      @Param("usersCredited") int usersCredited,
      @Param("usersFailed") int usersFailed,
      @Param("amount") BigDecimal amount);
}
