package io.b2mash.credits.template;

import io.b2mash.credits.schedule.Cadence;
import io.b2mash.credits.schedule.Targeting;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** The built-in schedule presets, in display order. */
public final class SchedulePresets {

  public static final String DAILY_WELCOME = "daily_welcome";
  public static final String WEEKLY_LOYALTY = "weekly_loyalty";
  public static final String MONTHLY_BONUS = "monthly_bonus";
  public static final String MONTHLY_PREMIUM = "monthly_premium";
  public static final String WEEKEND_BOOST = "weekend_boost";

  private static final Map<String, SchedulePreset> PRESETS = new LinkedHashMap<>();

  static {
    register(
        new SchedulePreset(
            DAILY_WELCOME,
            "Daily Welcome Credits",
            "Daily credits for users who registered in the last 7 days",
            new Cadence.Daily(),
            LocalTime.of(9, 0),
            new Targeting.NewUsers(7, null),
            new BigDecimal("5"),
            "welcome",
            100));
    register(
        new SchedulePreset(
            WEEKLY_LOYALTY,
            "Weekly Loyalty Bonus",
            "Weekly bonus for users active in the last 7 days",
            new Cadence.Weekly(EnumSet.of(DayOfWeek.FRIDAY)),
            LocalTime.of(18, 0),
            new Targeting.ActiveUsers(7),
            new BigDecimal("10"),
            "loyalty",
            null));
    register(
        new SchedulePreset(
            MONTHLY_BONUS,
            "Monthly Bonus",
            "Monthly bonus for all users",
            new Cadence.Monthly(1),
            LocalTime.of(12, 0),
            new Targeting.AllUsers(),
            new BigDecimal("25"),
            "bonus",
            null));
    register(
        new SchedulePreset(
            MONTHLY_PREMIUM,
            "Monthly Premium Bonus",
            "Monthly premium bonus for all users",
            new Cadence.Monthly(1),
            LocalTime.of(12, 0),
            new Targeting.AllUsers(),
            new BigDecimal("25"),
            "bonus",
            null));
    register(
        new SchedulePreset(
            WEEKEND_BOOST,
            "Weekend Activity Boost",
            "Weekend credits to boost activity",
            new Cadence.Weekly(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY)),
            LocalTime.of(10, 0),
            new Targeting.AllUsers(),
            new BigDecimal("3"),
            "activity",
            null));
  }

  private SchedulePresets() {}

  private static void register(SchedulePreset preset) {
    PRESETS.put(preset.key(), preset);
  }

  public static Optional<SchedulePreset> find(String key) {
    return Optional.ofNullable(key).map(PRESETS::get);
  }

  public static Collection<SchedulePreset> all() {
    return Collections.unmodifiableCollection(new ArrayList<>(PRESETS.values()));
  }
}
