package io.b2mash.credits.template.dto;

import io.b2mash.credits.schedule.dto.CreateScheduleRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

/**
 * {@code setupType} is {@code daily_welcome}, {@code weekly_loyalty}, {@code monthly_bonus} or
 * {@code custom}; {@code scheduleData} is required for (and only used by) {@code custom}.
 */
public record QuickSetupRequest(
    @NotBlank String setupType,
    @Valid TemplateOverrides overrides,
    CreateScheduleRequest scheduleData) {}
