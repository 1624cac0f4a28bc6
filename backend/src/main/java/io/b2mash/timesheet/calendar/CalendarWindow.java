package io.b2mash.timesheet.calendar;

import java.util.ArrayList;
import java.util.List;

/** The part of each day drawn on the calendar grid, in minutes since midnight. */
public record CalendarWindow(int startMinute, int endMinute, int slotMinutes) {

  public CalendarWindow {
    if (startMinute < 0 || endMinute > 24 * 60 || startMinute >= endMinute) {
      throw new IllegalArgumentException(
          "Calendar window must lie within the day and start before it ends: "
              + startMinute
              + ".."
              + endMinute);
    }
    if (slotMinutes <= 0) {
      throw new IllegalArgumentException("Slot length must be positive: " + slotMinutes);
    }
  }

  /** Start minute of every grid row, from {@code startMinute} up to but excluding the end. */
  public List<Integer> slotStarts() {
    List<Integer> slots = new ArrayList<>();
    for (int minute = startMinute; minute < endMinute; minute += slotMinutes) {
      slots.add(minute);
    }
    return slots;
  }
}
