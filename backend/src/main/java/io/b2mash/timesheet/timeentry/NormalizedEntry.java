package io.b2mash.timesheet.timeentry;

import java.time.LocalDate;
import java.time.LocalTime;

/** A validated entry ready to be stored; {@code durationMinutes} is derived from the times. */
public record NormalizedEntry(
    Long chargeCodeId,
    LocalDate entryDate,
    LocalTime startTime,
    LocalTime endTime,
    int durationMinutes,
    String activityText) {}
