package io.b2mash.credits.schedule.dto;

import io.b2mash.credits.execution.dto.ExecutionResponse;
import java.util.List;

public record ScheduleDetailsResponse(
    ScheduleResponse schedule,
    long estimatedEligibleUsers,
    boolean executionRunning,
    List<ExecutionResponse> recentExecutions) {}
