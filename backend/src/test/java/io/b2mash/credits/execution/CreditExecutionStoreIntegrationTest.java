package io.b2mash.credits.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.credits.TestcontainersConfiguration;
import io.b2mash.credits.schedule.CreditScheduleRepository;
import io.b2mash.credits.schedule.CreditScheduleService;
import io.b2mash.credits.testutil.TestScheduleFactory;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class CreditExecutionStoreIntegrationTest {

  @Autowired private CreditExecutionStore executionStore;
  @Autowired private CreditScheduleService scheduleService;
  @Autowired private CreditScheduleRepository scheduleRepository;
  @Autowired private CreditScheduleExecutionRepository executionRepository;
  @Autowired private JdbcTemplate jdbcTemplate;

  @Test
  void claim_samePeriodTwice_secondConflicts() {
    var scheduleId = newSchedule();
    var first = executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO);

    assertThat(first.getStatus()).isEqualTo(ExecutionStatus.RUNNING);
    assertThatThrownBy(() -> executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO))
        .isInstanceOf(ClaimConflictException.class);
  }

  @Test
  void claim_otherPeriodWhileRunning_conflicts() {
    var scheduleId = newSchedule();
    executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO);

    assertThatThrownBy(
            () -> executionStore.claim(scheduleId, "manual:1709629200000", TriggerSource.MANUAL))
        .isInstanceOf(ClaimConflictException.class);
  }

  @Test
  void claim_concurrentReplicas_exactlyOneWins() throws Exception {
    var scheduleId = newSchedule();
    int replicas = 8;
    var pool = Executors.newFixedThreadPool(replicas);
    var startGate = new CountDownLatch(1);
    var results = new ArrayList<Future<Boolean>>();
    try {
      for (int i = 0; i < replicas; i++) {
        results.add(
            pool.submit(
                () -> {
                  startGate.await();
                  try {
                    executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO);
                    return true;
                  } catch (ClaimConflictException e) {
                    return false;
                  }
                }));
      }
      startGate.countDown();
      int wins = 0;
      for (var result : results) {
        if (result.get(30, TimeUnit.SECONDS)) {
          wins++;
        }
      }
      assertThat(wins).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void finish_recordsCountersOnSchedule() {
    var scheduleId = newSchedule();
    var execution = executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO);

    var response =
        executionStore.finish(execution, new ExecutionResult(50, 47, 3, new BigDecimal("235")));

    assertThat(response.status()).isEqualTo(ExecutionStatus.PARTIALLY_FAILED);
    assertThat(response.finishedAt()).isNotNull();
    var schedule = scheduleRepository.findById(scheduleId).orElseThrow();
    assertThat(schedule.getTotalCreditsDistributed()).isEqualByComparingTo("235");
    assertThat(schedule.getTotalUsersCredited()).isEqualTo(47);
    assertThat(schedule.getTotalExecutions()).isEqualTo(1);
    assertThat(schedule.getLastFiredAt()).isNotNull();
  }

  @Test
  void fail_freesPeriodForAnotherAttempt() {
    var scheduleId = newSchedule();
    var execution = executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO);

    var failed = executionStore.fail(execution, ExecutionResult.EMPTY, "ledger down");
    var retry = executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO);

    assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
    assertThat(failed.errorMessage()).isEqualTo("ledger down");
    assertThat(retry.getId()).isNotEqualTo(execution.getId());
  }

  @Test
  void completedPeriod_cannotBeClaimedAgain() {
    var scheduleId = newSchedule();
    var execution = executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO);
    executionStore.finish(execution, ExecutionResult.EMPTY);

    assertThatThrownBy(() -> executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO))
        .isInstanceOf(ClaimConflictException.class);
  }

  @Test
  void sweepStaleClaims_failsAbandonedExecutions() {
    var scheduleId = newSchedule();
    var execution = executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO);
    makeSilentForTwoHours(execution.getId());

    int recovered = executionStore.sweepStaleClaims();

    assertThat(recovered).isGreaterThanOrEqualTo(1);
    var swept = executionRepository.findById(execution.getId()).orElseThrow();
    assertThat(swept.getStatus()).isEqualTo(ExecutionStatus.FAILED);
    assertThat(swept.getErrorMessage()).startsWith("Stale claim");
    assertThat(executionStore.hasRunningExecution(scheduleId)).isFalse();
  }

  @Test
  void sweepStaleClaims_longRunStillFlushingProgress_isLeftRunning() {
    var scheduleId = newSchedule();
    var execution = executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO);
    jdbcTemplate.update(
        "UPDATE credit_schedule_executions SET execution_time = now() - interval '2 hours'"
            + " WHERE id = ?",
        execution.getId());
    executionStore.recordProgress(
        execution.getId(), new ExecutionResult(50, 50, 0, new BigDecimal("250")));

    executionStore.sweepStaleClaims();

    var running = executionRepository.findById(execution.getId()).orElseThrow();
    assertThat(running.getStatus()).isEqualTo(ExecutionStatus.RUNNING);
    assertThat(running.getUsersCredited()).isEqualTo(50);
  }

  @Test
  void sweepStaleClaims_addsFlushedGrantsToSchedule() {
    var scheduleId = newSchedule();
    var execution = executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO);
    executionStore.recordProgress(
        execution.getId(), new ExecutionResult(40, 40, 0, new BigDecimal("200")));
    makeSilentForTwoHours(execution.getId());

    executionStore.sweepStaleClaims();

    var schedule = scheduleRepository.findById(scheduleId).orElseThrow();
    assertThat(schedule.getTotalCreditsDistributed()).isEqualByComparingTo("200");
    assertThat(schedule.getTotalUsersCredited()).isEqualTo(40);
    assertThat(schedule.getTotalExecutions()).isEqualTo(1);
  }

  @Test
  void finish_afterSweepWithFlushedProgress_addsOnlyTheRemainder() {
    var scheduleId = newSchedule();
    var execution = executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO);
    executionStore.recordProgress(
        execution.getId(), new ExecutionResult(40, 40, 0, new BigDecimal("200")));
    makeSilentForTwoHours(execution.getId());
    executionStore.sweepStaleClaims();

    var response =
        executionStore.finish(execution, new ExecutionResult(50, 50, 0, new BigDecimal("250")));

    assertThat(response.status()).isEqualTo(ExecutionStatus.FAILED);
    assertThat(response.usersCredited()).isEqualTo(50);
    var schedule = scheduleRepository.findById(scheduleId).orElseThrow();
    assertThat(schedule.getTotalCreditsDistributed()).isEqualByComparingTo("250");
    assertThat(schedule.getTotalUsersCredited()).isEqualTo(50);
    assertThat(schedule.getTotalExecutions()).isEqualTo(1);
  }

  @Test
  void fail_afterSweep_doesNotCountFlushedGrantsTwice() {
    var scheduleId = newSchedule();
    var execution = executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO);
    var progress = new ExecutionResult(40, 40, 0, new BigDecimal("200"));
    executionStore.recordProgress(execution.getId(), progress);
    makeSilentForTwoHours(execution.getId());
    executionStore.sweepStaleClaims();

    executionStore.fail(execution, progress, "cohort store unavailable");

    var schedule = scheduleRepository.findById(scheduleId).orElseThrow();
    assertThat(schedule.getTotalCreditsDistributed()).isEqualByComparingTo("200");
    assertThat(schedule.getTotalUsersCredited()).isEqualTo(40);
  }

  @Test
  void finish_afterSweep_keepsFailedStatusButCountsGrants() {
    var scheduleId = newSchedule();
    var execution = executionStore.claim(scheduleId, "2024-03-05", TriggerSource.AUTO);
    jdbcTemplate.update(
        "UPDATE credit_schedule_executions SET status = 'FAILED', finished_at = now()"
            + " WHERE id = ?",
        execution.getId());

    var response =
        executionStore.finish(execution, new ExecutionResult(2, 2, 0, new BigDecimal("10")));

    assertThat(response.status()).isEqualTo(ExecutionStatus.FAILED);
    var schedule = scheduleRepository.findById(scheduleId).orElseThrow();
    assertThat(schedule.getTotalUsersCredited()).isEqualTo(2);
  }

  private void makeSilentForTwoHours(UUID executionId) {
    jdbcTemplate.update(
        "UPDATE credit_schedule_executions SET last_progress_at = now() - interval '2 hours'"
            + " WHERE id = ?",
        executionId);
  }

  private UUID newSchedule() {
    return scheduleService.create(TestScheduleFactory.dailyWelcome()).id();
  }
}
