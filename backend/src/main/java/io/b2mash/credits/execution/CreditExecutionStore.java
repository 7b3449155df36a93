package io.b2mash.credits.execution;

import io.b2mash.credits.config.CreditSchedulerProperties;
import io.b2mash.credits.exception.ResourceNotFoundException;
import io.b2mash.credits.execution.dto.ExecutionResponse;
import io.b2mash.credits.execution.event.CreditExecutionFinishedEvent;
import io.b2mash.credits.schedule.CreditScheduleRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes the execution ledger. Every write runs in its own transaction: the claim must be visible
 * to other replicas before any ledger call is made, and no transaction is held open while grants
 * are in flight.
 */
@Service
public class CreditExecutionStore {

  private static final Logger log = LoggerFactory.getLogger(CreditExecutionStore.class);

  private static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

  private final CreditScheduleExecutionRepository executionRepository;
  private final CreditScheduleRepository scheduleRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final CreditSchedulerProperties properties;
  private final Clock clock;

  public CreditExecutionStore(
      CreditScheduleExecutionRepository executionRepository,
      CreditScheduleRepository scheduleRepository,
      ApplicationEventPublisher eventPublisher,
      CreditSchedulerProperties properties,
      Clock clock) {
    this.executionRepository = executionRepository;
    this.scheduleRepository = scheduleRepository;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Claims a period by inserting a RUNNING execution.
   *
   * @throws ClaimConflictException if a partial unique index rejects the insert
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public CreditScheduleExecution claim(UUID scheduleId, String periodKey, TriggerSource trigger) {
    var execution = new CreditScheduleExecution(scheduleId, periodKey, trigger, clock.instant());
    try {
      execution = executionRepository.saveAndFlush(execution);
    } catch (DataIntegrityViolationException ex) {
      throw new ClaimConflictException(scheduleId, periodKey, ex);
    }
    log.info(
        "Claimed execution {} for schedule {} period {} ({})",
        execution.getId(),
        scheduleId,
        periodKey,
        trigger);
    return execution;
  }

  /** Flushes a running execution's counters; this is also its liveness heartbeat. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void recordProgress(UUID executionId, ExecutionResult progress) {
    executionRepository.updateProgress(
        executionId,
        progress.cohortSize(),
        progress.usersCredited(),
        progress.usersFailed(),
        progress.totalAmountGranted(),
        clock.instant());
  }

  /**
   * Finalizes an execution and adds its totals to the schedule's running counters in the same
   * transaction. If the stale-claim sweep got there first, the row stays FAILED and only the
   * grants the sweep did not count are added.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public ExecutionResponse finish(CreditScheduleExecution execution, ExecutionResult result) {
    var now = clock.instant();
    var status = result.status();
    int updated =
        executionRepository.finishIfRunning(
            execution.getId(),
            status,
            result.cohortSize(),
            result.usersCredited(),
            result.usersFailed(),
            result.totalAmountGranted(),
            status == ExecutionStatus.FAILED ? "All grants in this execution failed" : null,
            now);
    if (updated == 1) {
      scheduleRepository.recordFiring(
          execution.getScheduleId(), result.totalAmountGranted(), result.usersCredited(), now);
    } else {
      recordLateGrants(execution, result);
    }

    log.info(
        "Finished execution {} of schedule {} period {}: status={}, cohort={}, credited={},"
            + " failed={}, amount={}, already applied by ledger={}",
        execution.getId(),
        execution.getScheduleId(),
        execution.getPeriodKey(),
        status,
        result.cohortSize(),
        result.usersCredited(),
        result.usersFailed(),
        result.totalAmountGranted(),
        result.duplicateGrants());

    eventPublisher.publishEvent(
        new CreditExecutionFinishedEvent(
            execution.getId(),
            execution.getScheduleId(),
            execution.getPeriodKey(),
            status,
            result.usersCredited(),
            result.usersFailed(),
            result.totalAmountGranted(),
            now));
    return load(execution.getId());
  }

  /**
   * Marks a RUNNING execution FAILED after an unexpected error. Grants already made stay counted.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public ExecutionResponse fail(
      CreditScheduleExecution execution, ExecutionResult progress, String errorMessage) {
    var now = clock.instant();
    int updated =
        executionRepository.finishIfRunning(
            execution.getId(),
            ExecutionStatus.FAILED,
            progress.cohortSize(),
            progress.usersCredited(),
            progress.usersFailed(),
            progress.totalAmountGranted(),
            truncate(errorMessage),
            now);
    if (updated == 0) {
      recordLateGrants(execution, progress);
    } else if (progress.usersCredited() > 0) {
      scheduleRepository.recordFiring(
          execution.getScheduleId(), progress.totalAmountGranted(), progress.usersCredited(), now);
    }
    eventPublisher.publishEvent(
        new CreditExecutionFinishedEvent(
            execution.getId(),
            execution.getScheduleId(),
            execution.getPeriodKey(),
            ExecutionStatus.FAILED,
            progress.usersCredited(),
            progress.usersFailed(),
            progress.totalAmountGranted(),
            now));
    return load(execution.getId());
  }

  /**
   * Moves RUNNING executions that have not flushed progress within the stale-claim timeout to
   * FAILED so their periods can be claimed again. Grants they had already flushed are added to the
   * schedule's counters, since the next attempt skips those users. Returns the number recovered.
   */
  @Transactional
  public int sweepStaleClaims() {
    var now = clock.instant();
    var cutoff = now.minus(properties.staleClaimTimeout());
    var stale =
        executionRepository.findByStatusAndLastProgressAtBefore(ExecutionStatus.RUNNING, cutoff);
    int recovered = 0;
    for (var candidate : stale) {
      int updated =
          executionRepository.failIfRunning(
              candidate.getId(),
              "Stale claim: no progress since " + candidate.getLastProgressAt(),
              now);
      if (updated == 0) {
        continue;
      }
      recovered++;
      // Re-read: counters may have moved between the query and the update
      var execution = executionRepository.findById(candidate.getId()).orElseThrow();
      if (execution.getCountedUsers() > 0) {
        scheduleRepository.recordFiring(
            execution.getScheduleId(),
            execution.getCountedAmount(),
            execution.getCountedUsers(),
            now);
      }
      log.warn(
          "Recovered stale execution {} of schedule {} period {} (last progress at {},"
              + " {} credited users counted)",
          execution.getId(),
          execution.getScheduleId(),
          execution.getPeriodKey(),
          candidate.getLastProgressAt(),
          execution.getCountedUsers());
      eventPublisher.publishEvent(
          new CreditExecutionFinishedEvent(
              execution.getId(),
              execution.getScheduleId(),
              execution.getPeriodKey(),
              ExecutionStatus.FAILED,
              execution.getUsersCredited(),
              execution.getUsersFailed(),
              execution.getTotalAmountGranted(),
              now));
    }
    return recovered;
  }

  private void recordLateGrants(CreditScheduleExecution execution, ExecutionResult result) {
    var current =
        executionRepository
            .findById(execution.getId())
            .orElseThrow(() -> ResourceNotFoundException.execution(execution.getId()));
    int users = result.usersCredited() - current.getCountedUsers();
    var credits = result.totalAmountGranted().subtract(current.getCountedAmount());
    log.warn(
        "Execution {} of schedule {} was already {} at finish; adding {} late credited users",
        execution.getId(),
        execution.getScheduleId(),
        current.getStatus(),
        Math.max(users, 0));
    if (users <= 0 && credits.signum() <= 0) {
      return;
    }
    executionRepository.recordLateCounters(
        execution.getId(),
        result.cohortSize(),
        result.usersCredited(),
        result.usersFailed(),
        result.totalAmountGranted());
    scheduleRepository.addLateGrants(execution.getScheduleId(), credits, users);
  }

  @Transactional(readOnly = true)
  public boolean hasRunningExecution(UUID scheduleId) {
    return executionRepository.existsByScheduleIdAndStatus(scheduleId, ExecutionStatus.RUNNING);
  }

  @Transactional(readOnly = true)
  public List<ExecutionResponse> recent(int limit) {
    return executionRepository.findAllByOrderByExecutionTimeDesc(PageRequest.of(0, limit)).stream()
        .map(ExecutionResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public List<ExecutionResponse> recentForSchedule(UUID scheduleId, int limit) {
    return executionRepository
        .findByScheduleIdOrderByExecutionTimeDesc(scheduleId, PageRequest.of(0, limit))
        .stream()
        .map(ExecutionResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public ExecutionResponse get(UUID executionId) {
    return load(executionId);
  }

  private ExecutionResponse load(UUID executionId) {
    return executionRepository
        .findById(executionId)
        .map(ExecutionResponse::from)
        .orElseThrow(() -> ResourceNotFoundException.execution(executionId));
  }

  private static String truncate(String message) {
    if (message == null || message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
      return message;
    }
    return message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
  }
}
