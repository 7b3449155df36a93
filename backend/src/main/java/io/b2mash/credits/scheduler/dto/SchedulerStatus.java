package io.b2mash.credits.scheduler.dto;

import io.b2mash.credits.execution.dto.ExecutionResponse;
import io.b2mash.credits.schedule.dto.UpcomingFire;
import io.b2mash.credits.scheduler.SchedulerState;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record SchedulerStatus(
    SchedulerState state,
    Duration tickInterval,
    long ticksRun,
    Instant lastTickAt,
    String lastTickError,
    long claimsWon,
    long claimsSkipped,
    long executionsFinished,
    long staleClaimsRecovered,
    long activeSchedules,
    long totalSchedules,
    UpcomingFire nextExecution,
    List<ExecutionResponse> recentExecutions) {}
