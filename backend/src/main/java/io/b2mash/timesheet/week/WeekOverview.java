package io.b2mash.timesheet.week;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

/**
 * Weekly hours report: one row per charge code label, one cell per day. Every hour figure is
 * rounded to two decimals from its own unrounded total.
 */
public record WeekOverview(
    List<String> days, List<Row> rows, Map<String, BigDecimal> dayTotals, BigDecimal weekTotal) {

  public record Row(String label, Map<String, DayCell> cells, BigDecimal total) {}

  public record DayCell(BigDecimal hours, List<String> comments, List<EntryDetail> details) {}

  public record EntryDetail(
      @JsonFormat(pattern = "HH:mm") LocalTime startTime,
      @JsonFormat(pattern = "HH:mm") LocalTime endTime,
      String activityText) {}
}
