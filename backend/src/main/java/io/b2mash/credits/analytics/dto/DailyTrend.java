package io.b2mash.credits.analytics.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DailyTrend(
    LocalDate date, int runs, BigDecimal creditsDistributed, long usersCredited) {}
