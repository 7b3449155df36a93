package io.b2mash.credits.config;

import java.time.LocalTime;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Defaults applied to schedule definitions that leave optional fields empty. */
@ConfigurationProperties(prefix = "credits.schedule")
public record CreditScheduleProperties(
    @DefaultValue("1000") int defaultMaxUsersPerExecution,
    @DefaultValue("09:00") LocalTime defaultExecutionTime,
    @DefaultValue("bonus") String defaultCreditType) {}
