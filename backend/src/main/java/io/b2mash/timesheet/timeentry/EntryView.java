package io.b2mash.timesheet.timeentry;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.b2mash.timesheet.chargecode.ChargeCode;
import java.time.LocalDate;
import java.time.LocalTime;

/** Read model of a time entry, labelled with its charge code. Built per read, never stored. */
public record EntryView(
    Long id,
    Long chargeCodeId,
    String chargeCodeLabel,
    LocalDate entryDate,
    @JsonFormat(pattern = "HH:mm") LocalTime startTime,
    @JsonFormat(pattern = "HH:mm") LocalTime endTime,
    int durationMinutes,
    String activityText) {

  public static EntryView from(TimeEntry entry, ChargeCode chargeCode) {
    return new EntryView(
        entry.getId(),
        entry.getChargeCodeId(),
        chargeCode.getLabel(),
        entry.getEntryDate(),
        entry.getStartTime(),
        entry.getEndTime(),
        entry.getDurationMinutes(),
        entry.getActivityText());
  }
}
