package io.b2mash.credits.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.credits.config.CreditScheduleProperties;
import io.b2mash.credits.eligibility.EligibilityEvaluator;
import io.b2mash.credits.exception.InvalidStateException;
import io.b2mash.credits.exception.ResourceNotFoundException;
import io.b2mash.credits.exception.ScheduleValidationException;
import io.b2mash.credits.execution.CreditExecutionStore;
import io.b2mash.credits.execution.CreditScheduleExecution;
import io.b2mash.credits.execution.CreditScheduleExecutionRepository;
import io.b2mash.credits.execution.ExecutionStatus;
import io.b2mash.credits.testutil.TestProperties;
import io.b2mash.credits.testutil.TestScheduleFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CreditScheduleServiceTest {

  private static final Instant NOW = Instant.parse("2024-03-05T10:00:00Z");
  private static final String PERIOD = "2024-03-05";

  @Mock private CreditScheduleRepository scheduleRepository;
  @Mock private CreditScheduleExecutionRepository executionRepository;
  @Mock private CreditExecutionStore executionStore;
  @Mock private EligibilityEvaluator eligibilityEvaluator;

  private CreditScheduleService service;

  @BeforeEach
  void setUp() {
    var properties = TestProperties.scheduler();
    service =
        new CreditScheduleService(
            scheduleRepository,
            executionRepository,
            executionStore,
            new ScheduleDefinitionMapper(
                new CreditScheduleProperties(1000, LocalTime.of(9, 0), "bonus")),
            new FireTimeCalculator(properties),
            eligibilityEvaluator,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void loadDue_openPeriod_isDue() {
    var schedule = TestScheduleFactory.schedule(TestScheduleFactory.dailyWelcome());
    when(scheduleRepository.findByActiveTrueAndDeletedFalse()).thenReturn(List.of(schedule));
    when(executionRepository.existsByScheduleIdAndPeriodKeyAndStatusIn(
            schedule.getId(), PERIOD, ExecutionStatus.CLAIMING))
        .thenReturn(false);
    when(executionRepository.countByScheduleIdAndPeriodKeyAndStatus(
            schedule.getId(), PERIOD, ExecutionStatus.FAILED))
        .thenReturn(0L);

    var due = service.loadDue(NOW);

    assertThat(due).hasSize(1);
    assertThat(due.get(0).schedule()).isSameAs(schedule);
    assertThat(due.get(0).periodKey()).isEqualTo(PERIOD);
  }

  @Test
  void loadDue_beforeExecutionTime_isNotDue() {
    var schedule = TestScheduleFactory.schedule(TestScheduleFactory.dailyWelcome());
    when(scheduleRepository.findByActiveTrueAndDeletedFalse()).thenReturn(List.of(schedule));

    assertThat(service.loadDue(Instant.parse("2024-03-05T08:00:00Z"))).isEmpty();
  }

  @Test
  void loadDue_periodAlreadyClaimed_isNotDue() {
    var schedule = TestScheduleFactory.schedule(TestScheduleFactory.dailyWelcome());
    when(scheduleRepository.findByActiveTrueAndDeletedFalse()).thenReturn(List.of(schedule));
    when(executionRepository.existsByScheduleIdAndPeriodKeyAndStatusIn(
            schedule.getId(), PERIOD, ExecutionStatus.CLAIMING))
        .thenReturn(true);

    assertThat(service.loadDue(NOW)).isEmpty();
  }

  @Test
  void loadDue_budgetExhausted_isNotDue() {
    var schedule =
        TestScheduleFactory.withDistributed(
            TestScheduleFactory.schedule(
                TestScheduleFactory.withBudget(TestScheduleFactory.dailyWelcome(), "100")),
            "98");
    when(scheduleRepository.findByActiveTrueAndDeletedFalse()).thenReturn(List.of(schedule));

    assertThat(service.loadDue(NOW)).isEmpty();
    verify(executionRepository, never())
        .existsByScheduleIdAndPeriodKeyAndStatusIn(any(), any(), any());
  }

  @Test
  void loadDue_maxFailedAttemptsReached_isNotDue() {
    var schedule = TestScheduleFactory.schedule(TestScheduleFactory.dailyWelcome());
    when(scheduleRepository.findByActiveTrueAndDeletedFalse()).thenReturn(List.of(schedule));
    when(executionRepository.existsByScheduleIdAndPeriodKeyAndStatusIn(
            schedule.getId(), PERIOD, ExecutionStatus.CLAIMING))
        .thenReturn(false);
    when(executionRepository.countByScheduleIdAndPeriodKeyAndStatus(
            schedule.getId(), PERIOD, ExecutionStatus.FAILED))
        .thenReturn(3L);

    assertThat(service.loadDue(NOW)).isEmpty();
  }

  @Test
  void loadDue_recentFailure_waitsForRetryDelay() {
    var schedule = TestScheduleFactory.schedule(TestScheduleFactory.dailyWelcome());
    stubFailedAttempt(schedule, NOW.minusSeconds(5 * 60));

    assertThat(service.loadDue(NOW)).isEmpty();
  }

  @Test
  void loadDue_failureOlderThanRetryDelay_isDueAgain() {
    var schedule = TestScheduleFactory.schedule(TestScheduleFactory.dailyWelcome());
    stubFailedAttempt(schedule, NOW.minusSeconds(20 * 60));

    assertThat(service.loadDue(NOW)).hasSize(1);
  }

  @Test
  void create_unknownCustomCriteria_isRejected() {
    var definition =
        TestScheduleFactory.definition(
            new Cadence.Daily(), new Targeting.Custom("whales"), "5", 10);
    when(eligibilityEvaluator.isKnownCustomCriteria("whales")).thenReturn(false);

    assertThatThrownBy(() -> service.create(definition))
        .isInstanceOf(ScheduleValidationException.class)
        .extracting("field")
        .isEqualTo("customCriteria");
    verify(scheduleRepository, never()).save(any());
  }

  @Test
  void create_returnsNextFireTime() {
    when(scheduleRepository.save(any(CreditSchedule.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    var response = service.create(TestScheduleFactory.dailyWelcome());

    assertThat(response.active()).isTrue();
    assertThat(response.nextFireAt()).isEqualTo(Instant.parse("2024-03-06T09:00:00Z"));
  }

  @Test
  void toggle_withoutValue_flipsActiveFlag() {
    var schedule = TestScheduleFactory.schedule(TestScheduleFactory.dailyWelcome());
    when(scheduleRepository.findByIdAndDeletedFalse(schedule.getId()))
        .thenReturn(Optional.of(schedule));
    when(scheduleRepository.save(schedule)).thenReturn(schedule);

    var response = service.toggle(schedule.getId(), null);

    assertThat(response.active()).isFalse();
    assertThat(response.nextFireAt()).isNull();
  }

  @Test
  void toggle_explicitValue_isIdempotent() {
    var schedule = TestScheduleFactory.schedule(TestScheduleFactory.dailyWelcome());
    when(scheduleRepository.findByIdAndDeletedFalse(schedule.getId()))
        .thenReturn(Optional.of(schedule));
    when(scheduleRepository.save(schedule)).thenReturn(schedule);

    assertThat(service.toggle(schedule.getId(), true).active()).isTrue();
    assertThat(service.toggle(schedule.getId(), true).active()).isTrue();
  }

  @Test
  void delete_softDeletesAndDeactivates() {
    var schedule = TestScheduleFactory.schedule(TestScheduleFactory.dailyWelcome());
    when(scheduleRepository.findByIdAndDeletedFalse(schedule.getId()))
        .thenReturn(Optional.of(schedule));

    service.delete(schedule.getId());

    assertThat(schedule.isDeleted()).isTrue();
    assertThat(schedule.isActive()).isFalse();
    assertThat(schedule.getDeletedAt()).isEqualTo(NOW);
    verify(scheduleRepository).save(schedule);
  }

  @Test
  void get_unknownSchedule_throwsNotFound() {
    var id = UUID.randomUUID();
    when(scheduleRepository.findByIdAndDeletedFalse(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.get(id)).isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void list_pageSizeAboveLimit_isRejected() {
    assertThatThrownBy(() -> service.list(1, 101, "all"))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void list_pageZero_isRejected() {
    assertThatThrownBy(() -> service.list(0, 10, "all"))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void list_unknownStatusFilter_isRejected() {
    assertThatThrownBy(() -> service.list(1, 10, "paused"))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void details_unknownEstimate_reportsMinusOne() {
    var schedule = TestScheduleFactory.schedule(TestScheduleFactory.dailyWelcome());
    when(scheduleRepository.findByIdAndDeletedFalse(schedule.getId()))
        .thenReturn(Optional.of(schedule));
    when(eligibilityEvaluator.estimateCohortSize(schedule, NOW)).thenReturn(OptionalLong.empty());

    var details = service.details(schedule.getId());

    assertThat(details.estimatedEligibleUsers()).isEqualTo(-1);
    assertThat(details.executionRunning()).isFalse();
  }

  private void stubFailedAttempt(CreditSchedule schedule, Instant finishedAt) {
    var failed = mock(CreditScheduleExecution.class);
    when(failed.getFinishedAt()).thenReturn(finishedAt);
    when(scheduleRepository.findByActiveTrueAndDeletedFalse()).thenReturn(List.of(schedule));
    when(executionRepository.existsByScheduleIdAndPeriodKeyAndStatusIn(
            schedule.getId(), PERIOD, ExecutionStatus.CLAIMING))
        .thenReturn(false);
    when(executionRepository.countByScheduleIdAndPeriodKeyAndStatus(
            schedule.getId(), PERIOD, ExecutionStatus.FAILED))
        .thenReturn(1L);
    when(executionRepository.findFirstByScheduleIdAndPeriodKeyAndStatusOrderByFinishedAtDesc(
            schedule.getId(), PERIOD, ExecutionStatus.FAILED))
        .thenReturn(Optional.of(failed));
  }
}
