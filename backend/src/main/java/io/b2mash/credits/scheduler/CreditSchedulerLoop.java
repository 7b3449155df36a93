package io.b2mash.credits.scheduler;

import io.b2mash.credits.config.CreditSchedulerProperties;
import io.b2mash.credits.exception.InvalidStateException;
import io.b2mash.credits.exception.ScheduleAlreadyRunningException;
import io.b2mash.credits.exception.SchedulerNotRunningException;
import io.b2mash.credits.execution.ClaimConflictException;
import io.b2mash.credits.execution.CreditExecutionStore;
import io.b2mash.credits.execution.TriggerSource;
import io.b2mash.credits.execution.dto.ExecutionResponse;
import io.b2mash.credits.schedule.CreditScheduleService;
import io.b2mash.credits.scheduler.dto.SchedulerStatus;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The credit scheduler control loop. One instance per process; several processes may run against
 * the same database because claims are arbitrated by the execution table's unique indexes.
 *
 * <p>Each tick recovers stale claims, loads the due schedules and fires them one after another on
 * the loop thread. Ticks are scheduled with a fixed delay, so a slow tick postpones the next one
 * instead of overlapping it.
 */
@Service
public class CreditSchedulerLoop {

  private static final Logger log = LoggerFactory.getLogger(CreditSchedulerLoop.class);

  static final int RECENT_EXECUTIONS = 5;

  private final CreditScheduleService scheduleService;
  private final CreditExecutionStore executionStore;
  private final ScheduleRunner scheduleRunner;
  private final CreditSchedulerProperties properties;
  private final Clock clock;

  private final Object lifecycleLock = new Object();
  private volatile SchedulerState state = SchedulerState.STOPPED;
  private ScheduledExecutorService executor;
  private ScheduledFuture<?> tickFuture;

  private final AtomicLong ticksRun = new AtomicLong();
  private final AtomicLong claimsWon = new AtomicLong();
  private final AtomicLong claimsSkipped = new AtomicLong();
  private final AtomicLong executionsFinished = new AtomicLong();
  private final AtomicLong staleClaimsRecovered = new AtomicLong();
  private volatile Instant lastTickAt;
  private volatile String lastTickError;

  public CreditSchedulerLoop(
      CreditScheduleService scheduleService,
      CreditExecutionStore executionStore,
      ScheduleRunner scheduleRunner,
      CreditSchedulerProperties properties,
      Clock clock) {
    this.scheduleService = scheduleService;
    this.executionStore = executionStore;
    this.scheduleRunner = scheduleRunner;
    this.properties = properties;
    this.clock = clock;
  }

  /** Starts ticking. Calling it while RUNNING changes nothing. */
  public SchedulerStatus start() {
    synchronized (lifecycleLock) {
      if (state == SchedulerState.RUNNING) {
        log.debug("Credit scheduler already running");
        return status();
      }
      state = SchedulerState.STARTING;
      executor =
          Executors.newSingleThreadScheduledExecutor(
              runnable -> {
                var thread = new Thread(runnable, "credit-scheduler-loop");
                thread.setDaemon(true);
                return thread;
              });
      tickFuture =
          executor.scheduleWithFixedDelay(
              this::tickSafely, 0, properties.tickInterval().toMillis(), TimeUnit.MILLISECONDS);
      state = SchedulerState.RUNNING;
      log.info("Credit scheduler started (tick interval {})", properties.tickInterval());
    }
    return status();
  }

  /**
   * Stops ticking. The firing in progress, if any, runs to completion; due schedules not yet
   * claimed by the current tick are left for the next start.
   *
   * @throws SchedulerNotRunningException if the loop is not RUNNING
   */
  public SchedulerStatus stop() {
    synchronized (lifecycleLock) {
      if (state != SchedulerState.RUNNING) {
        throw new SchedulerNotRunningException(state.name());
      }
      state = SchedulerState.STOPPING;
      log.info("Credit scheduler stopping");
      terminate();
      log.info("Credit scheduler stopped");
    }
    return status();
  }

  @PreDestroy
  public void shutdown() {
    synchronized (lifecycleLock) {
      if (executor != null) {
        state = SchedulerState.STOPPING;
        terminate();
      }
    }
  }

  /** Must hold {@link #lifecycleLock}. */
  private void terminate() {
    tickFuture.cancel(false);
    executor.shutdown();
    try {
      if (!executor.awaitTermination(properties.stopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn(
            "Credit scheduler tick still running after {}; interrupting it",
            properties.stopTimeout());
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    } finally {
      executor = null;
      tickFuture = null;
      state = SchedulerState.STOPPED;
    }
  }

  /**
   * Fires a schedule immediately under a {@code manual:<epoch-millis>} period key, whether or not
   * the loop is running.
   *
   * @throws ScheduleAlreadyRunningException if the schedule has a RUNNING execution
   */
  public ExecutionResponse executeNow(UUID scheduleId) {
    var schedule = scheduleService.requireSchedule(scheduleId);
    if (!schedule.isActive()) {
      throw InvalidStateException.notFireable(
          scheduleId, "Schedule inactive", "the schedule is not active");
    }
    if (schedule.isBudgetExhausted()) {
      throw InvalidStateException.notFireable(
          scheduleId, "Budget exhausted", "no credit budget is left for another grant");
    }
    if (executionStore.hasRunningExecution(scheduleId)) {
      throw new ScheduleAlreadyRunningException(scheduleId);
    }
    var periodKey = "manual:" + clock.millis();
    try {
      var response = scheduleRunner.fire(schedule, periodKey, TriggerSource.MANUAL);
      executionsFinished.incrementAndGet();
      log.info(
          "Manual execution {} of credit schedule {} ended {}",
          response.id(),
          scheduleId,
          response.status());
      return response;
    } catch (ClaimConflictException ex) {
      throw new ScheduleAlreadyRunningException(scheduleId);
    }
  }

  void tickSafely() {
    ticksRun.incrementAndGet();
    lastTickAt = clock.instant();
    try {
      tick(lastTickAt);
      lastTickError = null;
    } catch (RuntimeException ex) {
      lastTickError = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getName();
      log.error("Credit scheduler tick failed; retrying on the next tick", ex);
    }
  }

  private void tick(Instant now) {
    int recovered = executionStore.sweepStaleClaims();
    staleClaimsRecovered.addAndGet(recovered);

    var due = scheduleService.loadDue(now);
    if (!due.isEmpty()) {
      log.info("{} credit schedule(s) due", due.size());
    }
    for (var dueSchedule : due) {
      if (state == SchedulerState.STOPPING) {
        log.info("Credit scheduler stopping; leaving remaining due schedules for the next start");
        return;
      }
      var schedule = dueSchedule.schedule();
      try {
        var response = scheduleRunner.fire(schedule, dueSchedule.periodKey(), TriggerSource.AUTO);
        claimsWon.incrementAndGet();
        executionsFinished.incrementAndGet();
        log.debug("Credit schedule {} fired: execution {}", schedule.getId(), response.id());
      } catch (ClaimConflictException ex) {
        claimsSkipped.incrementAndGet();
        log.debug(
            "Credit schedule {} period {} already claimed elsewhere; skipping",
            schedule.getId(),
            dueSchedule.periodKey());
      } catch (RuntimeException ex) {
        log.error("Credit schedule {} could not be fired", schedule.getId(), ex);
      }
    }
  }

  public SchedulerState state() {
    return state;
  }

  public SchedulerStatus status() {
    var now = clock.instant();
    return new SchedulerStatus(
        state,
        properties.tickInterval(),
        ticksRun.get(),
        lastTickAt,
        lastTickError,
        claimsWon.get(),
        claimsSkipped.get(),
        executionsFinished.get(),
        staleClaimsRecovered.get(),
        scheduleService.countActive(),
        scheduleService.countAll(),
        scheduleService.nextUpcomingFire(now).orElse(null),
        executionStore.recent(RECENT_EXECUTIONS));
  }
}
