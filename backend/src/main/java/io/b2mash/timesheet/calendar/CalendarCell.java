package io.b2mash.timesheet.calendar;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * One entry positioned on the calendar grid. {@code startMinutes}/{@code endMinutes} are the
 * entry's own bounds; {@code relativeStartMinutes}/{@code relativeDurationMinutes} are clipped to
 * the display window and measured from its start.
 */
public record CalendarCell(
    Long id,
    LocalDate entryDate,
    Long chargeCodeId,
    @JsonFormat(pattern = "HH:mm") LocalTime startTime,
    @JsonFormat(pattern = "HH:mm") LocalTime endTime,
    String activityText,
    String chargeCodeLabel,
    int durationMinutes,
    int startMinutes,
    int endMinutes,
    int relativeStartMinutes,
    int relativeDurationMinutes,
    String colorClass) {}
