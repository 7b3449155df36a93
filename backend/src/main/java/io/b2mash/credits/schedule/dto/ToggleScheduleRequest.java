package io.b2mash.credits.schedule.dto;

/** {@code active} omitted flips the current state. */
public record ToggleScheduleRequest(Boolean active) {}
