package io.b2mash.credits.analytics.dto;

import io.b2mash.credits.execution.dto.ExecutionResponse;
import java.math.BigDecimal;
import java.util.List;

public record DashboardSummary(
    long totalSchedules,
    long activeSchedules,
    BigDecimal totalCreditsDistributed,
    long totalUsersCredited,
    long totalExecutions,
    List<ExecutionResponse> recentExecutions,
    List<TopSchedule> topSchedules) {}
