package io.b2mash.credits.analytics.dto;

import java.math.BigDecimal;
import java.util.UUID;

public record TopSchedule(
    UUID scheduleId,
    String name,
    boolean active,
    BigDecimal totalCreditsDistributed,
    long totalUsersCredited,
    long totalExecutions) {}
