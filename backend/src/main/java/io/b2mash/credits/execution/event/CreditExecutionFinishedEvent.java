package io.b2mash.credits.execution.event;

import io.b2mash.credits.execution.ExecutionStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record CreditExecutionFinishedEvent(
    UUID executionId,
    UUID scheduleId,
    String periodKey,
    ExecutionStatus status,
    int usersCredited,
    int usersFailed,
    BigDecimal totalAmountGranted,
    Instant occurredAt) {}
