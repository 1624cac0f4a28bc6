package io.b2mash.timesheet.calendar;

import io.b2mash.timesheet.chargecode.ChargeCode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Hands out palette colors by position in the sorted charge code list, wrapping around when there
 * are more codes than colors. Recomputed on every request, so a code's color changes when another
 * code is inserted before it.
 */
@Component
public class ChargeColorAssigner {

  private final List<String> palette;
  private final String unassignedColor;

  public ChargeColorAssigner(CalendarProperties properties) {
    this.palette = List.copyOf(properties.palette());
    this.unassignedColor = properties.unassignedColor();
  }

  /**
   * @param sortedCodes the user's charge codes ordered by project then task number
   * @return charge code id to color tag, in the order of {@code sortedCodes}
   */
  public Map<Long, String> assignColors(List<ChargeCode> sortedCodes) {
    Map<Long, String> colors = new LinkedHashMap<>();
    for (int i = 0; i < sortedCodes.size(); i++) {
      colors.put(sortedCodes.get(i).getId(), colorAt(i));
    }
    return colors;
  }

  private String colorAt(int index) {
    if (palette.isEmpty()) {
      return unassignedColor;
    }
    return palette.get(index % palette.size());
  }
}
