package io.b2mash.credits.batch;

import io.b2mash.credits.config.CreditSchedulerProperties;
import io.b2mash.credits.eligibility.EligibilityEvaluator;
import io.b2mash.credits.execution.CreditExecutionStore;
import io.b2mash.credits.execution.ExecutionResult;
import io.b2mash.credits.ledger.CreditLedgerClient;
import io.b2mash.credits.ledger.GrantRequest;
import io.b2mash.credits.ledger.LedgerGrantException;
import io.b2mash.credits.schedule.CreditSchedule;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Grants one schedule's credits for one period. Walks the cohort page by page until the run's cap
 * is reached, granting each page concurrently on the grant pool and waiting for every grant of a
 * page before fetching the next. No transaction is open while grants are in flight.
 */
@Component
public class BatchExecutor {

  private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

  private final EligibilityEvaluator eligibilityEvaluator;
  private final CreditLedgerClient ledgerClient;
  private final CreditExecutionStore executionStore;
  private final Executor grantExecutor;
  private final CreditSchedulerProperties properties;
  private final Clock clock;

  public BatchExecutor(
      EligibilityEvaluator eligibilityEvaluator,
      CreditLedgerClient ledgerClient,
      CreditExecutionStore executionStore,
      @Qualifier("creditGrantExecutor") Executor grantExecutor,
      CreditSchedulerProperties properties,
      Clock clock) {
    this.eligibilityEvaluator = eligibilityEvaluator;
    this.ledgerClient = ledgerClient;
    this.executionStore = executionStore;
    this.grantExecutor = grantExecutor;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * @throws BatchAbortedException if the cohort cannot be read or a page cannot be dispatched; the
   *     exception carries the counters reached so far
   */
  public ExecutionResult run(CreditSchedule schedule, String periodKey, UUID executionId) {
    int cap = effectiveCap(schedule);
    var now = clock.instant();
    var amount = schedule.getCreditAmount();

    int processed = 0;
    int credited = 0;
    int failed = 0;
    int duplicates = 0;
    String pageToken = null;
    try {
      while (processed < cap) {
        var page =
            eligibilityEvaluator.cohort(
                schedule, periodKey, pageToken, properties.cohortPageSize(), now);
        var userIds = page.userIds();
        int room = cap - processed;
        if (userIds.size() > room) {
          userIds = userIds.subList(0, room);
        }
        if (!userIds.isEmpty()) {
          var outcomes = grantPage(schedule, periodKey, userIds);
          int granted = count(outcomes, GrantOutcome.CREDITED, GrantOutcome.ALREADY_APPLIED);
          processed += userIds.size();
          credited += granted;
          failed += userIds.size() - granted;
          duplicates += count(outcomes, GrantOutcome.ALREADY_APPLIED);
          executionStore.recordProgress(
              executionId, result(processed, credited, failed, duplicates, amount));
        }
        if (!page.hasMore()) {
          break;
        }
        pageToken = page.nextPageToken();
      }
    } catch (RuntimeException ex) {
      throw new BatchAbortedException(
          result(processed, credited, failed, duplicates, amount), ex);
    }

    if (processed >= cap && cap < schedule.getMaxUsersPerExecution()) {
      log.info(
          "Schedule {} period {} stopped at {} users: remaining credit budget reached",
          schedule.getId(),
          periodKey,
          cap);
    }
    if (duplicates > 0) {
      log.info(
          "Schedule {} period {}: ledger had already applied {} of {} grants",
          schedule.getId(),
          periodKey,
          duplicates,
          credited);
    }
    return result(processed, credited, failed, duplicates, amount);
  }

  /** Per-run cap, lowered so that the remaining lifetime budget is never exceeded. */
  static int effectiveCap(CreditSchedule schedule) {
    int cap = schedule.getMaxUsersPerExecution();
    var remaining = schedule.remainingBudget();
    if (remaining == null) {
      return cap;
    }
    return remaining
        .divide(schedule.getCreditAmount(), 0, RoundingMode.FLOOR)
        .min(BigDecimal.valueOf(cap))
        .intValue();
  }

  private List<GrantOutcome> grantPage(
      CreditSchedule schedule, String periodKey, List<String> userIds) {
    var futures =
        userIds.stream()
            .map(
                userId ->
                    CompletableFuture.supplyAsync(
                        () ->
                            grantWithRetry(
                                new GrantRequest(
                                    userId,
                                    schedule.getCreditAmount(),
                                    schedule.getCreditType(),
                                    GrantRequest.idempotencyKey(
                                        schedule.getId(), periodKey, userId))),
                        grantExecutor))
            .toList();
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    return futures.stream().map(CompletableFuture::join).toList();
  }

  /** Never throws; every failure ends as {@link GrantOutcome#FAILED}. */
  GrantOutcome grantWithRetry(GrantRequest request) {
    int maxAttempts = properties.grantMaxAttempts();
    for (int attempt = 1; ; attempt++) {
      try {
        var receipt = ledgerClient.grant(request);
        if (receipt.duplicate()) {
          log.debug(
              "Grant {} was already applied by the ledger as {}",
              request.idempotencyKey(),
              receipt.grantId());
          return GrantOutcome.ALREADY_APPLIED;
        }
        return GrantOutcome.CREDITED;
      } catch (LedgerGrantException ex) {
        if (!ex.isTransient()) {
          log.warn(
              "Grant {} rejected by ledger: {}", request.idempotencyKey(), ex.getMessage());
          return GrantOutcome.FAILED;
        }
        if (attempt >= maxAttempts) {
          log.warn(
              "Grant {} failed after {} attempts: {}",
              request.idempotencyKey(),
              attempt,
              ex.getMessage());
          return GrantOutcome.FAILED;
        }
      } catch (RuntimeException ex) {
        if (attempt >= maxAttempts) {
          log.error("Grant {} failed after {} attempts", request.idempotencyKey(), attempt, ex);
          return GrantOutcome.FAILED;
        }
      }
      if (!backoff(attempt)) {
        return GrantOutcome.FAILED;
      }
    }
  }

  private static int count(List<GrantOutcome> outcomes, GrantOutcome... wanted) {
    var accepted = List.of(wanted);
    return (int) outcomes.stream().filter(accepted::contains).count();
  }

  private boolean backoff(int attempt) {
    long delayMillis = properties.grantRetryBackoff().toMillis() * attempt;
    if (delayMillis <= 0) {
      return true;
    }
    try {
      Thread.sleep(delayMillis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static ExecutionResult result(
      int processed, int credited, int failed, int duplicates, BigDecimal amount) {
    return new ExecutionResult(
        processed, credited, failed, amount.multiply(BigDecimal.valueOf(credited)), duplicates);
  }
}
