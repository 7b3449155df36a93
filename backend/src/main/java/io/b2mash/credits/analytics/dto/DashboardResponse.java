package io.b2mash.credits.analytics.dto;

import io.b2mash.credits.scheduler.dto.SchedulerStatus;

public record DashboardResponse(DashboardSummary summary, SchedulerStatus scheduler) {}
