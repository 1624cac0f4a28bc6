package io.b2mash.timesheet.calendar;

import io.b2mash.timesheet.timeentry.EntryView;
import io.b2mash.timesheet.timeentry.TimeArithmetic;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class CalendarProjector {

  private final String unassignedColor;

  public CalendarProjector(CalendarProperties properties) {
    this.unassignedColor = properties.unassignedColor();
  }

  /**
   * Lays entries out on the display window, keyed by ISO entry date in input order. Entries lying
   * wholly outside the window are left out, but their date still gets a (possibly empty) list.
   * Clipped cells are at least one minute tall.
   */
  public Map<String, List<CalendarCell>> project(
      List<EntryView> entries, Map<Long, String> colorOf, CalendarWindow window) {
    Map<String, List<CalendarCell>> grouped = new LinkedHashMap<>();
    for (EntryView entry : entries) {
      var dayCells = grouped.computeIfAbsent(entry.entryDate().toString(), d -> new ArrayList<>());

      int startMinutes = TimeArithmetic.timeToMinutes(entry.startTime());
      int endMinutes = startMinutes + entry.durationMinutes();
      if (endMinutes <= window.startMinute() || startMinutes >= window.endMinute()) {
        continue;
      }

      int clampedStart = Math.max(startMinutes, window.startMinute());
      int clampedEnd = Math.min(endMinutes, window.endMinute());
      dayCells.add(
          new CalendarCell(
              entry.id(),
              entry.entryDate(),
              entry.chargeCodeId(),
              entry.startTime(),
              entry.endTime(),
              entry.activityText(),
              entry.chargeCodeLabel(),
              entry.durationMinutes(),
              startMinutes,
              endMinutes,
              clampedStart - window.startMinute(),
              Math.max(clampedEnd - clampedStart, 1),
              colorOf.getOrDefault(entry.chargeCodeId(), unassignedColor)));
    }
    return grouped;
  }
}
