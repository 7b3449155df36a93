package io.b2mash.credits.testutil;

import io.b2mash.credits.config.CreditSchedulerProperties;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Scheduler settings for unit tests: UTC, no retry backoff, small cohort pages. */
public final class TestProperties {

  private TestProperties() {}

  public static CreditSchedulerProperties scheduler() {
    return scheduler(ZoneOffset.UTC);
  }

  public static CreditSchedulerProperties scheduler(ZoneId zone) {
    return new CreditSchedulerProperties(
        Duration.ofSeconds(60),
        Duration.ofMinutes(30),
        Duration.ofMinutes(15),
        3,
        zone,
        false,
        4,
        3,
        Duration.ZERO,
        50,
        Duration.ofSeconds(5));
  }
}
