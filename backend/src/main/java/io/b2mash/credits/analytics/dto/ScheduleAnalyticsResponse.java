package io.b2mash.credits.analytics.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Rollup of a schedule's finished executions over the last {@code days} days. {@code successRate}
 * is the percentage of COMPLETED runs, rounded to two decimals.
 */
public record ScheduleAnalyticsResponse(
    UUID scheduleId,
    String scheduleName,
    int days,
    long totalRuns,
    long successfulRuns,
    BigDecimal successRate,
    BigDecimal creditsDistributed,
    long usersCredited,
    BigDecimal averageCreditsPerRun,
    BigDecimal averageUsersPerRun,
    List<DailyTrend> trend) {}
