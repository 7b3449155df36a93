package io.b2mash.credits.scheduler;

import io.b2mash.credits.batch.BatchAbortedException;
import io.b2mash.credits.batch.BatchExecutor;
import io.b2mash.credits.execution.ClaimConflictException;
import io.b2mash.credits.execution.CreditExecutionStore;
import io.b2mash.credits.execution.ExecutionResult;
import io.b2mash.credits.execution.TriggerSource;
import io.b2mash.credits.execution.dto.ExecutionResponse;
import io.b2mash.credits.schedule.CreditSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Claims a schedule period, runs the batch and finalizes the execution. */
@Component
public class ScheduleRunner {

  private static final Logger log = LoggerFactory.getLogger(ScheduleRunner.class);

  private final CreditExecutionStore executionStore;
  private final BatchExecutor batchExecutor;

  public ScheduleRunner(CreditExecutionStore executionStore, BatchExecutor batchExecutor) {
    this.executionStore = executionStore;
    this.batchExecutor = batchExecutor;
  }

  /**
   * Fires a schedule for one period. Errors after a successful claim end the execution as FAILED
   * and are not rethrown.
   *
   * @throws ClaimConflictException if the period (or the schedule) is already claimed
   */
  public ExecutionResponse fire(CreditSchedule schedule, String periodKey, TriggerSource trigger) {
    var execution = executionStore.claim(schedule.getId(), periodKey, trigger);
    try {
      var result = batchExecutor.run(schedule, periodKey, execution.getId());
      return executionStore.finish(execution, result);
    } catch (BatchAbortedException ex) {
      log.error(
          "Execution {} of credit schedule {} aborted after {} users",
          execution.getId(),
          schedule.getId(),
          ex.getProgress().cohortSize(),
          ex);
      return executionStore.fail(execution, ex.getProgress(), ex.getMessage());
    } catch (RuntimeException ex) {
      log.error(
          "Execution {} of credit schedule {} failed", execution.getId(), schedule.getId(), ex);
      return executionStore.fail(execution, ExecutionResult.EMPTY, describe(ex));
    }
  }

  private static String describe(RuntimeException ex) {
    return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getName();
  }
}
