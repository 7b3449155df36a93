package io.b2mash.credits.schedule;

import io.b2mash.credits.analytics.CreditAnalyticsService;
import io.b2mash.credits.analytics.dto.DashboardResponse;
import io.b2mash.credits.analytics.dto.ScheduleAnalyticsResponse;
import io.b2mash.credits.analytics.dto.TopSchedule;
import io.b2mash.credits.execution.dto.ExecutionResponse;
import io.b2mash.credits.schedule.dto.CreateScheduleRequest;
import io.b2mash.credits.schedule.dto.ScheduleDetailsResponse;
import io.b2mash.credits.schedule.dto.ScheduleResponse;
import io.b2mash.credits.schedule.dto.ToggleScheduleRequest;
import io.b2mash.credits.schedule.dto.UpdateScheduleRequest;
import io.b2mash.credits.scheduler.CreditSchedulerLoop;
import io.b2mash.credits.scheduler.dto.SchedulerStatus;
import io.b2mash.credits.template.SchedulePresetService;
import io.b2mash.credits.template.dto.CreateFromTemplateRequest;
import io.b2mash.credits.template.dto.QuickSetupRequest;
import io.b2mash.credits.template.dto.TemplateResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/credit-schedules")
public class CreditScheduleController {

  private final CreditScheduleService scheduleService;
  private final CreditSchedulerLoop schedulerLoop;
  private final CreditAnalyticsService analyticsService;
  private final SchedulePresetService presetService;

  public CreditScheduleController(
      CreditScheduleService scheduleService,
      CreditSchedulerLoop schedulerLoop,
      CreditAnalyticsService analyticsService,
      SchedulePresetService presetService) {
    this.scheduleService = scheduleService;
    this.schedulerLoop = schedulerLoop;
    this.analyticsService = analyticsService;
    this.presetService = presetService;
  }

  @PostMapping("/scheduler/start")
  public ResponseEntity<SchedulerStatus> startScheduler() {
    return ResponseEntity.ok(schedulerLoop.start());
  }

  @PostMapping("/scheduler/stop")
  public ResponseEntity<SchedulerStatus> stopScheduler() {
    return ResponseEntity.ok(schedulerLoop.stop());
  }

  @GetMapping("/scheduler/status")
  public ResponseEntity<SchedulerStatus> schedulerStatus() {
    return ResponseEntity.ok(schedulerLoop.status());
  }

  @PostMapping("/create")
  public ResponseEntity<ScheduleResponse> createSchedule(
      @Valid @RequestBody CreateScheduleRequest request) {
    return created(scheduleService.create(request));
  }

  @PutMapping("/update/{id}")
  public ResponseEntity<ScheduleResponse> updateSchedule(
      @PathVariable UUID id, @Valid @RequestBody UpdateScheduleRequest request) {
    return ResponseEntity.ok(scheduleService.update(id, request));
  }

  @DeleteMapping("/delete/{id}")
  public ResponseEntity<Void> deleteSchedule(@PathVariable UUID id) {
    scheduleService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/toggle/{id}")
  public ResponseEntity<ScheduleResponse> toggleSchedule(
      @PathVariable UUID id, @RequestBody(required = false) ToggleScheduleRequest request) {
    return ResponseEntity.ok(scheduleService.toggle(id, request == null ? null : request.active()));
  }

  @PostMapping("/execute/{id}")
  public ResponseEntity<ExecutionResponse> executeSchedule(@PathVariable UUID id) {
    return ResponseEntity.ok(schedulerLoop.executeNow(id));
  }

  @GetMapping("/list")
  public ResponseEntity<Page<ScheduleResponse>> listSchedules(
      @RequestParam(defaultValue = "1") int page,
      @RequestParam(defaultValue = "10") int size,
      @RequestParam(defaultValue = "all") String status) {
    return ResponseEntity.ok(scheduleService.list(page, size, status));
  }

  @GetMapping("/details/{id}")
  public ResponseEntity<ScheduleDetailsResponse> scheduleDetails(@PathVariable UUID id) {
    return ResponseEntity.ok(scheduleService.details(id));
  }

  @GetMapping("/executions/{id}")
  public ResponseEntity<List<ExecutionResponse>> listExecutions(
      @PathVariable UUID id, @RequestParam(defaultValue = "50") int limit) {
    return ResponseEntity.ok(scheduleService.listExecutions(id, limit));
  }

  @GetMapping("/analytics/top")
  public ResponseEntity<List<TopSchedule>> topSchedules(
      @RequestParam(defaultValue = "10") int limit) {
    return ResponseEntity.ok(analyticsService.topSchedules(limit));
  }

  @GetMapping("/analytics/{id}")
  public ResponseEntity<ScheduleAnalyticsResponse> scheduleAnalytics(
      @PathVariable UUID id, @RequestParam(defaultValue = "30") int days) {
    return ResponseEntity.ok(analyticsService.scheduleAnalytics(id, days));
  }

  @GetMapping("/templates")
  public ResponseEntity<List<TemplateResponse>> templates() {
    return ResponseEntity.ok(presetService.templates());
  }

  @PostMapping("/create-from-template")
  public ResponseEntity<ScheduleResponse> createFromTemplate(
      @Valid @RequestBody CreateFromTemplateRequest request) {
    return created(presetService.createFromTemplate(request));
  }

  @PostMapping("/quick-setup")
  public ResponseEntity<ScheduleResponse> quickSetup(
      @Valid @RequestBody QuickSetupRequest request) {
    return created(presetService.quickSetup(request));
  }

  @GetMapping("/dashboard")
  public ResponseEntity<DashboardResponse> dashboard() {
    return ResponseEntity.ok(
        new DashboardResponse(analyticsService.dashboardSummary(), schedulerLoop.status()));
  }

  private static ResponseEntity<ScheduleResponse> created(ScheduleResponse response) {
    return ResponseEntity.created(URI.create("/api/credit-schedules/details/" + response.id()))
        .body(response);
  }
}
