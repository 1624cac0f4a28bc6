package io.b2mash.timesheet.calendar;

import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Calendar grid settings.
 *
 * @param dayStart offset from midnight of the first displayed minute (default 7h)
 * @param dayEnd offset from midnight where the display stops (default 18h)
 * @param slot height of one grid row in time (default 30m)
 * @param slotHeight height of one grid row in pixels (default 24)
 * @param palette color tags handed out to charge codes in order
 * @param unassignedColor tag for entries whose charge code has no assigned color
 */
@ConfigurationProperties(prefix = "timesheet.calendar")
public record CalendarProperties(
    Duration dayStart,
    Duration dayEnd,
    Duration slot,
    Integer slotHeight,
    List<String> palette,
    String unassignedColor) {

  public CalendarProperties {
    if (dayStart == null) {
      dayStart = Duration.ofHours(7);
    }
    if (dayEnd == null) {
      dayEnd = Duration.ofHours(18);
    }
    if (slot == null) {
      slot = Duration.ofMinutes(30);
    }
    if (slotHeight == null) {
      slotHeight = 24;
    }
    if (palette == null) {
      palette = IntStream.range(0, 10).mapToObj(i -> "charge-color-" + i).toList();
    }
    if (unassignedColor == null) {
      unassignedColor = "charge-color-default";
    }
  }

  public static CalendarProperties defaults() {
    return new CalendarProperties(null, null, null, null, null, null);
  }

  public CalendarWindow window() {
    return new CalendarWindow(
        (int) dayStart.toMinutes(), (int) dayEnd.toMinutes(), (int) slot.toMinutes());
  }
}
