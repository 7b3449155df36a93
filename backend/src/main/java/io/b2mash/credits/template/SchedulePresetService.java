package io.b2mash.credits.template;

import io.b2mash.credits.config.CreditScheduleProperties;
import io.b2mash.credits.config.CreditSchedulerProperties;
import io.b2mash.credits.exception.InvalidStateException;
import io.b2mash.credits.exception.ResourceNotFoundException;
import io.b2mash.credits.schedule.CreditScheduleService;
import io.b2mash.credits.schedule.dto.CreateScheduleRequest;
import io.b2mash.credits.schedule.dto.ScheduleResponse;
import io.b2mash.credits.template.dto.CreateFromTemplateRequest;
import io.b2mash.credits.template.dto.QuickSetupRequest;
import io.b2mash.credits.template.dto.TemplateOverrides;
import io.b2mash.credits.template.dto.TemplateResponse;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SchedulePresetService {

  private static final Logger log = LoggerFactory.getLogger(SchedulePresetService.class);

  static final String CUSTOM_SETUP = "custom";

  private static final Set<String> QUICK_SETUP_PRESETS =
      Set.of(
          SchedulePresets.DAILY_WELCOME,
          SchedulePresets.WEEKLY_LOYALTY,
          SchedulePresets.MONTHLY_BONUS);

  private final CreditScheduleService scheduleService;
  private final CreditScheduleProperties scheduleDefaults;
  private final ZoneId zone;
  private final Clock clock;

  public SchedulePresetService(
      CreditScheduleService scheduleService,
      CreditScheduleProperties scheduleDefaults,
      CreditSchedulerProperties schedulerProperties,
      Clock clock) {
    this.scheduleService = scheduleService;
    this.scheduleDefaults = scheduleDefaults;
    this.zone = schedulerProperties.zone();
    this.clock = clock;
  }

  public List<TemplateResponse> templates() {
    return SchedulePresets.all().stream().map(TemplateResponse::from).toList();
  }

  public ScheduleResponse createFromTemplate(CreateFromTemplateRequest request) {
    var preset =
        SchedulePresets.find(request.templateName())
            .orElseThrow(() -> ResourceNotFoundException.template(request.templateName()));
    return createFromPreset(preset, request.overrides());
  }

  public ScheduleResponse quickSetup(QuickSetupRequest request) {
    var setupType = request.setupType().trim().toLowerCase();
    if (CUSTOM_SETUP.equals(setupType)) {
      if (request.scheduleData() == null) {
        throw new InvalidStateException(
            "Missing schedule data", "Quick setup of type custom requires scheduleData");
      }
      return scheduleService.create(withDefaultStartDate(request.scheduleData()));
    }
    if (!QUICK_SETUP_PRESETS.contains(setupType)) {
      throw new InvalidStateException(
          "Invalid setup type",
          "setupType must be one of daily_welcome, weekly_loyalty, monthly_bonus, custom");
    }
    var preset = SchedulePresets.find(setupType).orElseThrow();
    return createFromPreset(preset, request.overrides());
  }

  private ScheduleResponse createFromPreset(SchedulePreset preset, TemplateOverrides overrides) {
    var definition =
        preset.toDefinition(overrides, today(), scheduleDefaults.defaultMaxUsersPerExecution());
    var response = scheduleService.create(definition);
    log.info("Created credit schedule {} from preset {}", response.id(), preset.key());
    return response;
  }

  private CreateScheduleRequest withDefaultStartDate(CreateScheduleRequest request) {
    if (request.startDate() != null) {
      return request;
    }
    return new CreateScheduleRequest(
        request.name(),
        request.description(),
        request.scheduleType(),
        today(),
        request.endDate(),
        request.executionTime(),
        request.daysOfWeek(),
        request.dayOfMonth(),
        request.targetingMode(),
        request.maxDaysSinceRegistration(),
        request.minDaysSinceRegistration(),
        request.maxDaysSinceLastActivity(),
        request.customCriteria(),
        request.creditAmount(),
        request.creditType(),
        request.maxUsersPerExecution(),
        request.maxTotalCredits(),
        request.maxCreditsPerUser(),
        request.active());
  }

  private LocalDate today() {
    return LocalDate.now(clock.withZone(zone));
  }
}
