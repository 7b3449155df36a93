package io.b2mash.credits.template.dto;

import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;

/** Optional changes to a preset. {@code daysOfWeek} holds ISO day numbers. */
public record TemplateOverrides(
    @Size(max = 200) String name,
    BigDecimal creditAmount,
    LocalTime executionTime,
    Set<Integer> daysOfWeek,
    Integer dayOfMonth,
    Integer maxUsersPerExecution,
    LocalDate startDate) {

  public static final TemplateOverrides NONE =
      new TemplateOverrides(null, null, null, null, null, null, null);
}
