package io.b2mash.credits.schedule;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "credit_schedules")
public class CreditSchedule {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", length = 1000)
  private String description;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "deleted", nullable = false)
  private boolean deleted;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "schedule_type", nullable = false, length = 20)
  private ScheduleType scheduleType;

  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Column(name = "end_date")
  private LocalDate endDate;

  @Column(name = "execution_time", nullable = false)
  private LocalTime executionTime;

  // Only set for WEEKLY
  @Convert(converter = DaysOfWeekConverter.class)
  @Column(name = "days_of_week", length = 20)
  private Set<DayOfWeek> daysOfWeek;

  // Only set for MONTHLY
  @Column(name = "day_of_month")
  private Integer dayOfMonth;

  @Enumerated(EnumType.STRING)
  @Column(name = "targeting_mode", nullable = false, length = 20)
  private TargetingMode targetingMode;

  @Column(name = "max_days_since_registration")
  private Integer maxDaysSinceRegistration;

  @Column(name = "min_days_since_registration")
  private Integer minDaysSinceRegistration;

  @Column(name = "max_days_since_last_activity")
  private Integer maxDaysSinceLastActivity;

  @Column(name = "custom_criteria", length = 100)
  private String customCriteria;

  @Column(name = "credit_amount", nullable = false, precision = 19, scale = 4)
  private BigDecimal creditAmount;

  @Column(name = "credit_type", nullable = false, length = 50)
  private String creditType;

  @Column(name = "max_users_per_execution", nullable = false)
  private int maxUsersPerExecution;

  @Column(name = "max_total_credits", precision = 19, scale = 4)
  private BigDecimal maxTotalCredits;

  @Column(name = "max_credits_per_user", precision = 19, scale = 4)
  private BigDecimal maxCreditsPerUser;

  // Running counters are only written by the bulk updates in CreditScheduleRepository
  @Column(
      name = "total_credits_distributed",
      nullable = false,
      updatable = false,
      precision = 19,
      scale = 4)
  private BigDecimal totalCreditsDistributed;

  @Column(name = "total_users_credited", nullable = false, updatable = false)
  private long totalUsersCredited;

  @Column(name = "total_executions", nullable = false, updatable = false)
  private long totalExecutions;

  @Column(name = "last_fired_at", updatable = false)
  private Instant lastFiredAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CreditSchedule() {}

  public CreditSchedule(ScheduleDefinition definition, Instant now) {
    this.totalCreditsDistributed = BigDecimal.ZERO;
    this.totalUsersCredited = 0;
    this.totalExecutions = 0;
    this.createdAt = now;
    apply(definition, now);
  }

  /** Replaces the whole policy. Parameters of the variants not chosen are cleared. */
  public void apply(ScheduleDefinition definition, Instant now) {
    this.name = definition.name();
    this.description = definition.description();
    this.active = definition.active();
    this.startDate = definition.startDate();
    this.endDate = definition.endDate();
    this.executionTime = definition.executionTime();
    this.creditAmount = definition.creditAmount();
    this.creditType = definition.creditType();
    this.maxUsersPerExecution = definition.maxUsersPerExecution();
    this.maxTotalCredits = definition.maxTotalCredits();
    this.maxCreditsPerUser = definition.maxCreditsPerUser();
    applyCadence(definition.cadence());
    applyTargeting(definition.targeting());
    this.updatedAt = now;
  }

  private void applyCadence(Cadence cadence) {
    this.scheduleType = cadence.type();
    this.daysOfWeek = null;
    this.dayOfMonth = null;
    if (cadence instanceof Cadence.Weekly weekly) {
      this.daysOfWeek = weekly.daysOfWeek();
    } else if (cadence instanceof Cadence.Monthly monthly) {
      this.dayOfMonth = monthly.dayOfMonth();
    }
  }

  private void applyTargeting(Targeting targeting) {
    this.targetingMode = targeting.mode();
    this.maxDaysSinceRegistration = null;
    this.minDaysSinceRegistration = null;
    this.maxDaysSinceLastActivity = null;
    this.customCriteria = null;
    if (targeting instanceof Targeting.NewUsers newUsers) {
      this.maxDaysSinceRegistration = newUsers.maxDaysSinceRegistration();
      this.minDaysSinceRegistration = newUsers.minDaysSinceRegistration();
    } else if (targeting instanceof Targeting.ActiveUsers activeUsers) {
      this.maxDaysSinceLastActivity = activeUsers.maxDaysSinceLastActivity();
    } else if (targeting instanceof Targeting.Custom custom) {
      this.customCriteria = custom.criteria();
    }
  }

  public Cadence cadence() {
    return switch (scheduleType) {
      case ONE_OFF -> new Cadence.OneOff();
      case DAILY -> new Cadence.Daily();
      case WEEKLY -> new Cadence.Weekly(daysOfWeek);
      case MONTHLY -> new Cadence.Monthly(dayOfMonth);
    };
  }

  public Targeting targeting() {
    return switch (targetingMode) {
      case NEW_USERS -> new Targeting.NewUsers(maxDaysSinceRegistration, minDaysSinceRegistration);
      case ACTIVE_USERS -> new Targeting.ActiveUsers(maxDaysSinceLastActivity);
      case ALL_USERS -> new Targeting.AllUsers();
      case CUSTOM -> new Targeting.Custom(customCriteria);
    };
  }

  public ScheduleDefinition definition() {
    return new ScheduleDefinition(
        name,
        description,
        cadence(),
        startDate,
        endDate,
        executionTime,
        targeting(),
        creditAmount,
        creditType,
        maxUsersPerExecution,
        maxTotalCredits,
        maxCreditsPerUser,
        active);
  }

  public void setActive(boolean active, Instant now) {
    this.active = active;
    this.updatedAt = now;
  }

  public void markDeleted(Instant now) {
    this.deleted = true;
    this.deletedAt = now;
    this.active = false;
    this.updatedAt = now;
  }

  /**
   * Credits still available under the lifetime budget, or {@code null} when the schedule has no
   * budget.
   */
  public BigDecimal remainingBudget() {
    if (maxTotalCredits == null) {
      return null;
    }
    var remaining = maxTotalCredits.subtract(totalCreditsDistributed);
    return remaining.signum() < 0 ? BigDecimal.ZERO : remaining;
  }

  /** True when the lifetime budget cannot cover one more grant. */
  public boolean isBudgetExhausted() {
    var remaining = remainingBudget();
    return remaining != null && remaining.compareTo(creditAmount) < 0;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public boolean isActive() {
    return active;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public ScheduleType getScheduleType() {
    return scheduleType;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public LocalTime getExecutionTime() {
    return executionTime;
  }

  public Set<DayOfWeek> getDaysOfWeek() {
    return daysOfWeek;
  }

  public Integer getDayOfMonth() {
    return dayOfMonth;
  }

  public TargetingMode getTargetingMode() {
    return targetingMode;
  }

  public Integer getMaxDaysSinceRegistration() {
    return maxDaysSinceRegistration;
  }

  public Integer getMinDaysSinceRegistration() {
    return minDaysSinceRegistration;
  }

  public Integer getMaxDaysSinceLastActivity() {
    return maxDaysSinceLastActivity;
  }

  public String getCustomCriteria() {
    return customCriteria;
  }

  public BigDecimal getCreditAmount() {
    return creditAmount;
  }

  public String getCreditType() {
    return creditType;
  }

  public int getMaxUsersPerExecution() {
    return maxUsersPerExecution;
  }

  public BigDecimal getMaxTotalCredits() {
    return maxTotalCredits;
  }

  public BigDecimal getMaxCreditsPerUser() {
    return maxCreditsPerUser;
  }

  public BigDecimal getTotalCreditsDistributed() {
    return totalCreditsDistributed;
  }

  public long getTotalUsersCredited() {
    return totalUsersCredited;
  }

  public long getTotalExecutions() {
    return totalExecutions;
  }

  public Instant getLastFiredAt() {
    return lastFiredAt;
  }

  public long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
