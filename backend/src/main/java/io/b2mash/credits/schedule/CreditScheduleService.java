package io.b2mash.credits.schedule;

import io.b2mash.credits.config.CreditSchedulerProperties;
import io.b2mash.credits.eligibility.EligibilityEvaluator;
import io.b2mash.credits.exception.InvalidStateException;
import io.b2mash.credits.exception.ResourceNotFoundException;
import io.b2mash.credits.exception.ScheduleValidationException;
import io.b2mash.credits.execution.CreditExecutionStore;
import io.b2mash.credits.execution.CreditScheduleExecutionRepository;
import io.b2mash.credits.execution.ExecutionStatus;
import io.b2mash.credits.execution.dto.ExecutionResponse;
import io.b2mash.credits.schedule.dto.CreateScheduleRequest;
import io.b2mash.credits.schedule.dto.ScheduleDetailsResponse;
import io.b2mash.credits.schedule.dto.ScheduleResponse;
import io.b2mash.credits.schedule.dto.UpcomingFire;
import io.b2mash.credits.schedule.dto.UpdateScheduleRequest;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Durable CRUD over credit schedules, plus the "which schedules are due" query. */
@Service
public class CreditScheduleService {

  private static final Logger log = LoggerFactory.getLogger(CreditScheduleService.class);

  static final int MAX_PAGE_SIZE = 100;
  static final int RECENT_EXECUTIONS = 10;

  private final CreditScheduleRepository scheduleRepository;
  private final CreditScheduleExecutionRepository executionRepository;
  private final CreditExecutionStore executionStore;
  private final ScheduleDefinitionMapper definitionMapper;
  private final FireTimeCalculator fireTimeCalculator;
  private final EligibilityEvaluator eligibilityEvaluator;
  private final CreditSchedulerProperties schedulerProperties;
  private final Clock clock;

  public CreditScheduleService(
      CreditScheduleRepository scheduleRepository,
      CreditScheduleExecutionRepository executionRepository,
      CreditExecutionStore executionStore,
      ScheduleDefinitionMapper definitionMapper,
      FireTimeCalculator fireTimeCalculator,
      EligibilityEvaluator eligibilityEvaluator,
      CreditSchedulerProperties schedulerProperties,
      Clock clock) {
    this.scheduleRepository = scheduleRepository;
    this.executionRepository = executionRepository;
    this.executionStore = executionStore;
    this.definitionMapper = definitionMapper;
    this.fireTimeCalculator = fireTimeCalculator;
    this.eligibilityEvaluator = eligibilityEvaluator;
    this.schedulerProperties = schedulerProperties;
    this.clock = clock;
  }

  /** A schedule that should fire now, with the period it fires for. */
  public record DueSchedule(CreditSchedule schedule, String periodKey) {}

  @Transactional
  public ScheduleResponse create(CreateScheduleRequest request) {
    return create(definitionMapper.toDefinition(request));
  }

  @Transactional
  public ScheduleResponse create(ScheduleDefinition definition) {
    requireResolvableTargeting(definition);
    var schedule = scheduleRepository.save(new CreditSchedule(definition, clock.instant()));
    log.info(
        "Created credit schedule {} '{}' ({}, {} x {} {})",
        schedule.getId(),
        schedule.getName(),
        schedule.getScheduleType(),
        schedule.getMaxUsersPerExecution(),
        schedule.getCreditAmount(),
        schedule.getCreditType());
    return toResponse(schedule);
  }

  @Transactional
  public ScheduleResponse update(UUID id, UpdateScheduleRequest request) {
    var schedule = requireSchedule(id);
    var definition = definitionMapper.merge(schedule, request);
    requireResolvableTargeting(definition);
    schedule.apply(definition, clock.instant());
    schedule = scheduleRepository.save(schedule);
    log.info("Updated credit schedule {}", id);
    return toResponse(schedule);
  }

  /** Sets the active flag, or flips it when {@code active} is null. */
  @Transactional
  public ScheduleResponse toggle(UUID id, Boolean active) {
    var schedule = requireSchedule(id);
    boolean target = active != null ? active : !schedule.isActive();
    schedule.setActive(target, clock.instant());
    schedule = scheduleRepository.save(schedule);
    log.info("Credit schedule {} is now {}", id, target ? "active" : "inactive");
    return toResponse(schedule);
  }

  @Transactional
  public void delete(UUID id) {
    var schedule = requireSchedule(id);
    schedule.markDeleted(clock.instant());
    scheduleRepository.save(schedule);
    log.info("Deleted credit schedule {}", id);
  }

  @Transactional(readOnly = true)
  public ScheduleResponse get(UUID id) {
    return toResponse(requireSchedule(id));
  }

  /**
   * Lists non-deleted schedules, newest first.
   *
   * @param page 1-based page number
   * @param status {@code all}, {@code active} or {@code inactive}
   */
  @Transactional(readOnly = true)
  public Page<ScheduleResponse> list(int page, int size, String status) {
    if (page < 1) {
      throw new InvalidStateException("Invalid page", "Page numbers start at 1");
    }
    if (size < 1 || size > MAX_PAGE_SIZE) {
      throw new InvalidStateException(
          "Invalid page size", "Page size must be between 1 and " + MAX_PAGE_SIZE);
    }
    var pageable = PageRequest.of(page - 1, size, Sort.by(Sort.Direction.DESC, "createdAt"));
    var filter = status == null ? "all" : status.trim().toLowerCase();
    Page<CreditSchedule> schedules =
        switch (filter) {
          case "all" -> scheduleRepository.findByDeletedFalse(pageable);
          case "active" -> scheduleRepository.findByDeletedFalseAndActive(true, pageable);
          case "inactive" -> scheduleRepository.findByDeletedFalseAndActive(false, pageable);
          default ->
              throw new InvalidStateException(
                  "Invalid status filter", "Status must be one of all, active, inactive");
        };
    return schedules.map(this::toResponse);
  }

  @Transactional(readOnly = true)
  public ScheduleDetailsResponse details(UUID id) {
    var schedule = requireSchedule(id);
    var estimate = eligibilityEvaluator.estimateCohortSize(schedule, clock.instant());
    return new ScheduleDetailsResponse(
        toResponse(schedule),
        estimate.isPresent() ? estimate.getAsLong() : -1,
        executionStore.hasRunningExecution(id),
        executionStore.recentForSchedule(id, RECENT_EXECUTIONS));
  }

  @Transactional(readOnly = true)
  public List<ExecutionResponse> listExecutions(UUID id, int limit) {
    requireSchedule(id);
    return executionStore.recentForSchedule(id, Math.max(1, Math.min(limit, MAX_PAGE_SIZE)));
  }

  @Transactional(readOnly = true)
  public CreditSchedule requireSchedule(UUID id) {
    return scheduleRepository
        .findByIdAndDeletedFalse(id)
        .orElseThrow(() -> ResourceNotFoundException.schedule(id));
  }

  /**
   * Active schedules whose occurrence is due at {@code now} and whose period is still open: no
   * RUNNING, COMPLETED or PARTIALLY_FAILED execution, fewer FAILED attempts than allowed with the
   * last one older than the retry delay, and budget left for at least one grant. The claim insert
   * remains the real guard against double firing.
   */
  @Transactional(readOnly = true)
  public List<DueSchedule> loadDue(Instant now) {
    var due = new ArrayList<DueSchedule>();
    for (var schedule : scheduleRepository.findByActiveTrueAndDeletedFalse()) {
      var occurrence = fireTimeCalculator.dueOccurrence(schedule, now);
      if (occurrence.isEmpty()) {
        continue;
      }
      var periodKey = occurrence.get().periodKey();
      if (schedule.isBudgetExhausted()) {
        log.debug("Schedule {} skipped: credit budget exhausted", schedule.getId());
        continue;
      }
      if (executionRepository.existsByScheduleIdAndPeriodKeyAndStatusIn(
          schedule.getId(), periodKey, ExecutionStatus.CLAIMING)) {
        continue;
      }
      if (!retryAllowed(schedule, periodKey, now)) {
        continue;
      }
      due.add(new DueSchedule(schedule, periodKey));
    }
    return due;
  }

  @Transactional(readOnly = true)
  public long countActive() {
    return scheduleRepository.countByActiveTrueAndDeletedFalse();
  }

  @Transactional(readOnly = true)
  public long countAll() {
    return scheduleRepository.countByDeletedFalse();
  }

  @Transactional(readOnly = true)
  public Optional<UpcomingFire> nextUpcomingFire(Instant now) {
    return scheduleRepository.findByActiveTrueAndDeletedFalse().stream()
        .flatMap(
            schedule ->
                fireTimeCalculator.nextOccurrenceAfter(schedule, now).stream()
                    .map(o -> new UpcomingFire(schedule.getId(), schedule.getName(), o.fireAt())))
        .min(Comparator.comparing(UpcomingFire::fireAt));
  }

  private boolean retryAllowed(CreditSchedule schedule, String periodKey, Instant now) {
    long failedAttempts =
        executionRepository.countByScheduleIdAndPeriodKeyAndStatus(
            schedule.getId(), periodKey, ExecutionStatus.FAILED);
    if (failedAttempts == 0) {
      return true;
    }
    if (failedAttempts >= schedulerProperties.maxAttemptsPerPeriod()) {
      log.debug(
          "Schedule {} period {} gave up after {} failed attempts",
          schedule.getId(),
          periodKey,
          failedAttempts);
      return false;
    }
    return executionRepository
        .findFirstByScheduleIdAndPeriodKeyAndStatusOrderByFinishedAtDesc(
            schedule.getId(), periodKey, ExecutionStatus.FAILED)
        .map(
            last ->
                last.getFinishedAt() == null
                    || !now.isBefore(
                        last.getFinishedAt().plus(schedulerProperties.failedRetryDelay())))
        .orElse(true);
  }

  private void requireResolvableTargeting(ScheduleDefinition definition) {
    if (definition.targeting() instanceof Targeting.Custom custom
        && !eligibilityEvaluator.isKnownCustomCriteria(custom.criteria())) {
      throw new ScheduleValidationException(
          "customCriteria", "No custom cohort source named '" + custom.criteria() + "'");
    }
  }

  ScheduleResponse toResponse(CreditSchedule schedule) {
    Instant nextFireAt =
        schedule.isActive()
            ? fireTimeCalculator
                .nextOccurrenceAfter(schedule, clock.instant())
                .map(FireTimeCalculator.Occurrence::fireAt)
                .orElse(null)
            : null;
    return ScheduleResponse.from(schedule, nextFireAt);
  }
}
