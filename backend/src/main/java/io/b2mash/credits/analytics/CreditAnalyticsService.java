package io.b2mash.credits.analytics;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.credits.analytics.dto.DailyTrend;
import io.b2mash.credits.analytics.dto.DashboardSummary;
import io.b2mash.credits.analytics.dto.ScheduleAnalyticsResponse;
import io.b2mash.credits.analytics.dto.TopSchedule;
import io.b2mash.credits.config.CreditSchedulerProperties;
import io.b2mash.credits.exception.InvalidStateException;
import io.b2mash.credits.exception.ResourceNotFoundException;
import io.b2mash.credits.execution.CreditExecutionStore;
import io.b2mash.credits.execution.CreditScheduleExecution;
import io.b2mash.credits.execution.CreditScheduleExecutionRepository;
import io.b2mash.credits.execution.ExecutionStatus;
import io.b2mash.credits.schedule.CreditScheduleRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only rollups over finished executions. Results are cached for a minute and dropped whenever
 * an execution finishes (see {@link AnalyticsCacheEvictionListener}).
 */
@Service
public class CreditAnalyticsService {

  private static final Logger log = LoggerFactory.getLogger(CreditAnalyticsService.class);

  static final int MIN_DAYS = 1;
  static final int MAX_DAYS = 365;
  static final int DASHBOARD_RECENT_EXECUTIONS = 10;
  static final int DASHBOARD_TOP_SCHEDULES = 5;
  static final int MAX_TOP_SCHEDULES = 100;

  private final Cache<String, Object> cache =
      Caffeine.newBuilder().maximumSize(1_000).expireAfterWrite(Duration.ofMinutes(1)).build();

  private final CreditScheduleRepository scheduleRepository;
  private final CreditScheduleExecutionRepository executionRepository;
  private final CreditExecutionStore executionStore;
  private final ZoneId zone;
  private final Clock clock;

  public CreditAnalyticsService(
      CreditScheduleRepository scheduleRepository,
      CreditScheduleExecutionRepository executionRepository,
      CreditExecutionStore executionStore,
      CreditSchedulerProperties properties,
      Clock clock) {
    this.scheduleRepository = scheduleRepository;
    this.executionRepository = executionRepository;
    this.executionStore = executionStore;
    this.zone = properties.zone();
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public ScheduleAnalyticsResponse scheduleAnalytics(UUID scheduleId, int days) {
    if (days < MIN_DAYS || days > MAX_DAYS) {
      throw new InvalidStateException(
          "Invalid analytics window",
          "days must be between " + MIN_DAYS + " and " + MAX_DAYS + ", got " + days);
    }
    var key = "schedule:" + scheduleId + ":" + days;
    var cached = (ScheduleAnalyticsResponse) cache.getIfPresent(key);
    if (cached != null) {
      return cached;
    }

    var schedule =
        scheduleRepository
            .findByIdAndDeletedFalse(scheduleId)
            .orElseThrow(() -> ResourceNotFoundException.schedule(scheduleId));
    var from = clock.instant().minus(Duration.ofDays(days));
    var executions =
        executionRepository
            .findByScheduleIdAndStatusInAndExecutionTimeGreaterThanEqualOrderByExecutionTimeAsc(
                scheduleId, ExecutionStatus.TERMINAL, from);

    long totalRuns = executions.size();
    long successfulRuns =
        executions.stream().filter(e -> e.getStatus() == ExecutionStatus.COMPLETED).count();
    var credits =
        executions.stream()
            .map(CreditScheduleExecution::getTotalAmountGranted)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    long users = executions.stream().mapToLong(CreditScheduleExecution::getUsersCredited).sum();

    var response =
        new ScheduleAnalyticsResponse(
            scheduleId,
            schedule.getName(),
            days,
            totalRuns,
            successfulRuns,
            percentage(successfulRuns, totalRuns),
            credits,
            users,
            average(credits, totalRuns),
            average(BigDecimal.valueOf(users), totalRuns),
            trend(executions));
    cache.put(key, response);
    return response;
  }

  @Transactional(readOnly = true)
  @SuppressWarnings("unchecked")
  public List<TopSchedule> topSchedules(int limit) {
    int bounded = Math.max(1, Math.min(limit, MAX_TOP_SCHEDULES));
    var key = "top:" + bounded;
    var cached = (List<TopSchedule>) cache.getIfPresent(key);
    if (cached != null) {
      return cached;
    }
    var top =
        scheduleRepository
            .findByDeletedFalseOrderByTotalCreditsDistributedDesc(PageRequest.of(0, bounded))
            .stream()
            .map(
                s ->
                    new TopSchedule(
                        s.getId(),
                        s.getName(),
                        s.isActive(),
                        s.getTotalCreditsDistributed(),
                        s.getTotalUsersCredited(),
                        s.getTotalExecutions()))
            .toList();
    cache.put(key, top);
    return top;
  }

  @Transactional(readOnly = true)
  public DashboardSummary dashboardSummary() {
    var cached = (DashboardSummary) cache.getIfPresent("dashboard");
    if (cached != null) {
      return cached;
    }
    var summary =
        new DashboardSummary(
            scheduleRepository.countByDeletedFalse(),
            scheduleRepository.countByActiveTrueAndDeletedFalse(),
            scheduleRepository.sumCreditsDistributed(),
            scheduleRepository.sumUsersCredited(),
            scheduleRepository.sumExecutions(),
            executionStore.recent(DASHBOARD_RECENT_EXECUTIONS),
            topSchedules(DASHBOARD_TOP_SCHEDULES));
    cache.put("dashboard", summary);
    return summary;
  }

  public void evictAll() {
    cache.invalidateAll();
    log.debug("Credit analytics cache evicted");
  }

  private List<DailyTrend> trend(List<CreditScheduleExecution> executions) {
    Map<LocalDate, DailyTrend> byDay = new TreeMap<>();
    for (var execution : executions) {
      var day = LocalDate.ofInstant(execution.getExecutionTime(), zone);
      var current = byDay.getOrDefault(day, new DailyTrend(day, 0, BigDecimal.ZERO, 0));
      byDay.put(
          day,
          new DailyTrend(
              day,
              current.runs() + 1,
              current.creditsDistributed().add(execution.getTotalAmountGranted()),
              current.usersCredited() + execution.getUsersCredited()));
    }
    return List.copyOf(byDay.values());
  }

  static BigDecimal percentage(long part, long total) {
    if (total == 0) {
      return BigDecimal.ZERO.setScale(2);
    }
    return BigDecimal.valueOf(part)
        .multiply(BigDecimal.valueOf(100))
        .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
  }

  static BigDecimal average(BigDecimal sum, long count) {
    if (count == 0) {
      return BigDecimal.ZERO.setScale(2);
    }
    return sum.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
  }
}
