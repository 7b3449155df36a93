package io.b2mash.credits.schedule;

import io.b2mash.credits.exception.ScheduleValidationException;

/** Which users a credit schedule targets. Exactly one mode is active per schedule. */
public sealed interface Targeting
    permits Targeting.NewUsers, Targeting.ActiveUsers, Targeting.AllUsers, Targeting.Custom {

  TargetingMode mode();

  /**
   * Users registered within the last {@code maxDaysSinceRegistration} days, optionally excluding
   * those registered less than {@code minDaysSinceRegistration} days ago.
   */
  record NewUsers(int maxDaysSinceRegistration, Integer minDaysSinceRegistration)
      implements Targeting {

    public NewUsers {
      if (maxDaysSinceRegistration <= 0) {
        throw new ScheduleValidationException(
            "maxDaysSinceRegistration", "maxDaysSinceRegistration must be greater than 0");
      }
      if (minDaysSinceRegistration != null
          && (minDaysSinceRegistration < 0
              || minDaysSinceRegistration >= maxDaysSinceRegistration)) {
        throw new ScheduleValidationException(
            "minDaysSinceRegistration",
            "minDaysSinceRegistration must be at least 0 and less than maxDaysSinceRegistration");
      }
    }

    @Override
    public TargetingMode mode() {
      return TargetingMode.NEW_USERS;
    }
  }

  record ActiveUsers(int maxDaysSinceLastActivity) implements Targeting {

    public ActiveUsers {
      if (maxDaysSinceLastActivity <= 0) {
        throw new ScheduleValidationException(
            "maxDaysSinceLastActivity", "maxDaysSinceLastActivity must be greater than 0");
      }
    }

    @Override
    public TargetingMode mode() {
      return TargetingMode.ACTIVE_USERS;
    }
  }

  record AllUsers() implements Targeting {

    @Override
    public TargetingMode mode() {
      return TargetingMode.ALL_USERS;
    }
  }

  /** Delegates cohort selection to the custom cohort source registered under {@code criteria}. */
  record Custom(String criteria) implements Targeting {

    public Custom {
      if (criteria == null || criteria.isBlank()) {
        throw new ScheduleValidationException(
            "customCriteria", "Custom targeting requires the name of a cohort source");
      }
      criteria = criteria.trim();
    }

    @Override
    public TargetingMode mode() {
      return TargetingMode.CUSTOM;
    }
  }
}
