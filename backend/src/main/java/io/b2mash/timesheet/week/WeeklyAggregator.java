package io.b2mash.timesheet.week;

import io.b2mash.timesheet.timeentry.EntryView;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Reduces a week of entries into a charge code x day matrix. Minutes are summed exactly and
 * converted to hours only when the overview is built, so each rounded figure is derived from its
 * own exact total.
 */
@Component
public class WeeklyAggregator {

  private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

  /** Accumulates one cell before rounding. */
  private static final class CellAccumulator {
    private long minutes;
    private final List<String> comments = new ArrayList<>();
    private final List<WeekOverview.EntryDetail> details = new ArrayList<>();
  }

  /**
   * Callers pass only entries dated within {@code [weekStart, weekEnd]}; the aggregator does not
   * filter by date.
   *
   * @throws IllegalArgumentException if an entry falls outside the week
   */
  public WeekOverview aggregate(List<EntryView> entries, LocalDate weekStart, LocalDate weekEnd) {
    List<String> days = new ArrayList<>();
    for (LocalDate day = weekStart; !day.isAfter(weekEnd); day = day.plusDays(1)) {
      days.add(day.toString());
    }

    Map<String, Long> dayMinutes = new LinkedHashMap<>();
    days.forEach(day -> dayMinutes.put(day, 0L));
    Map<String, Map<String, CellAccumulator>> byLabel = new TreeMap<>();

    for (EntryView entry : entries) {
      String day = entry.entryDate().toString();
      if (!dayMinutes.containsKey(day)) {
        throw new IllegalArgumentException(
            "Entry " + entry.id() + " dated " + day + " is outside " + weekStart + ".." + weekEnd);
      }
      var cells =
          byLabel.computeIfAbsent(
              entry.chargeCodeLabel(),
              label -> {
                Map<String, CellAccumulator> perDay = new LinkedHashMap<>();
                days.forEach(d -> perDay.put(d, new CellAccumulator()));
                return perDay;
              });
      var cell = cells.get(day);
      cell.minutes += entry.durationMinutes();
      cell.comments.add(entry.activityText());
      cell.details.add(
          new WeekOverview.EntryDetail(entry.startTime(), entry.endTime(), entry.activityText()));
      dayMinutes.merge(day, (long) entry.durationMinutes(), Long::sum);
    }

    List<WeekOverview.Row> rows = new ArrayList<>();
    byLabel.forEach(
        (label, accumulators) -> {
          Map<String, WeekOverview.DayCell> cells = new LinkedHashMap<>();
          long rowMinutes = 0;
          for (var dayCell : accumulators.entrySet()) {
            var acc = dayCell.getValue();
            rowMinutes += acc.minutes;
            cells.put(
                dayCell.getKey(),
                new WeekOverview.DayCell(
                    toHours(acc.minutes), List.copyOf(acc.comments), List.copyOf(acc.details)));
          }
          rows.add(new WeekOverview.Row(label, cells, toHours(rowMinutes)));
        });

    Map<String, BigDecimal> dayTotals = new LinkedHashMap<>();
    long weekMinutes = 0;
    for (var dayTotal : dayMinutes.entrySet()) {
      weekMinutes += dayTotal.getValue();
      dayTotals.put(dayTotal.getKey(), toHours(dayTotal.getValue()));
    }

    return new WeekOverview(List.copyOf(days), rows, dayTotals, toHours(weekMinutes));
  }

  static BigDecimal toHours(long minutes) {
    return BigDecimal.valueOf(minutes).divide(MINUTES_PER_HOUR, 2, RoundingMode.HALF_UP);
  }
}
