package io.b2mash.timesheet.week;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class WeekBoundsCalculator {

  public record WeekBounds(LocalDate start, LocalDate end) {

    /** The seven dates from {@code start} to {@code end}. */
    public List<LocalDate> days() {
      return Stream.iterate(start, d -> d.plusDays(1)).limit(7).toList();
    }
  }

  private final DayOfWeek weekStartDay;

  @Autowired
  public WeekBoundsCalculator(WeekProperties properties) {
    this(properties.startDay());
  }

  WeekBoundsCalculator(DayOfWeek weekStartDay) {
    this.weekStartDay = weekStartDay;
  }

  public DayOfWeek getWeekStartDay() {
    return weekStartDay;
  }

  /** The week containing {@code anchor}, starting on the configured weekday and spanning 7 days. */
  public WeekBounds calculateWeekBounds(LocalDate anchor) {
    int daysBack = Math.floorMod(anchor.getDayOfWeek().getValue() - weekStartDay.getValue(), 7);
    LocalDate start = anchor.minusDays(daysBack);
    return new WeekBounds(start, start.plusDays(6));
  }
}
