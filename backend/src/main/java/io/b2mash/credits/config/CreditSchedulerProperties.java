package io.b2mash.credits.config;

import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Runtime settings of the scheduler loop and the batch executor.
 *
 * @param tickInterval delay between the end of one tick and the start of the next
 * @param staleClaimTimeout age after which a RUNNING execution is considered abandoned
 * @param failedRetryDelay minimum wait before a FAILED period is attempted again
 * @param maxAttemptsPerPeriod attempts (failed executions) allowed per schedule period
 * @param zone zone in which execution times and period keys are evaluated
 * @param autoStart whether the loop starts when the application is ready
 * @param grantConcurrency size of the worker pool that calls the ledger
 * @param grantMaxAttempts attempts per user grant when the ledger reports a transient error
 * @param grantRetryBackoff base backoff between grant attempts, multiplied by the attempt number
 * @param cohortPageSize users fetched per cohort page
 * @param stopTimeout how long {@code stop()} waits for the in-flight tick
 */
@ConfigurationProperties(prefix = "credits.scheduler")
public record CreditSchedulerProperties(
    @DefaultValue("60s") Duration tickInterval,
    @DefaultValue("30m") Duration staleClaimTimeout,
    @DefaultValue("15m") Duration failedRetryDelay,
    @DefaultValue("3") int maxAttemptsPerPeriod,
    @DefaultValue("UTC") ZoneId zone,
    @DefaultValue("false") boolean autoStart,
    @DefaultValue("10") int grantConcurrency,
    @DefaultValue("3") int grantMaxAttempts,
    @DefaultValue("500ms") Duration grantRetryBackoff,
    @DefaultValue("200") int cohortPageSize,
    @DefaultValue("5m") Duration stopTimeout) {}
