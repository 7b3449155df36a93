package io.b2mash.credits.schedule.dto;

import java.time.Instant;
import java.util.UUID;

public record UpcomingFire(UUID scheduleId, String scheduleName, Instant fireAt) {}
