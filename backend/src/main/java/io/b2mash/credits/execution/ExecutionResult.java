package io.b2mash.credits.execution;

import java.math.BigDecimal;

/**
 * Counters of one firing. {@code usersCredited + usersFailed == cohortSize} always holds, where
 * {@code cohortSize} counts the users actually processed (never more than the run's cap).
 * {@code duplicateGrants} counts the credited users whose grant the ledger reported as already
 * applied under the same idempotency key.
 */
public record ExecutionResult(
    int cohortSize,
    int usersCredited,
    int usersFailed,
    BigDecimal totalAmountGranted,
    int duplicateGrants) {

  public static final ExecutionResult EMPTY = new ExecutionResult(0, 0, 0, BigDecimal.ZERO);

  public ExecutionResult(
      int cohortSize, int usersCredited, int usersFailed, BigDecimal totalAmountGranted) {
    this(cohortSize, usersCredited, usersFailed, totalAmountGranted, 0);
  }

  public ExecutionResult {
    if (duplicateGrants < 0 || duplicateGrants > usersCredited) {
      throw new IllegalArgumentException(
          "duplicateGrants must be between 0 and usersCredited, got " + duplicateGrants);
    }
    if (usersCredited + usersFailed != cohortSize) {
      throw new IllegalArgumentException(
          "usersCredited + usersFailed must equal cohortSize, got "
              + usersCredited
              + " + "
              + usersFailed
              + " != "
              + cohortSize);
    }
  }

  public ExecutionStatus status() {
    if (usersFailed == 0) {
      return ExecutionStatus.COMPLETED;
    }
    if (usersCredited == 0 && cohortSize > 0) {
      return ExecutionStatus.FAILED;
    }
    return ExecutionStatus.PARTIALLY_FAILED;
  }
}
