package io.b2mash.timesheet.timeentry;

import io.b2mash.timesheet.exception.EntryValidationException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;

/**
 * Conversions between same-day times and minutes since midnight. All times are naive local
 * times-of-day; nothing here rolls over midnight.
 */
public final class TimeArithmetic {

  /** Strict 24-hour, zero-padded {@code HH:MM}. */
  public static final DateTimeFormatter TIME_FORMAT =
      DateTimeFormatter.ofPattern("HH:mm").withResolverStyle(ResolverStyle.STRICT);

  /** Strict {@code YYYY-MM-DD} with an unsigned four-digit year. */
  public static final DateTimeFormatter DATE_FORMAT =
      new DateTimeFormatterBuilder()
          .appendValue(ChronoField.YEAR, 4)
          .appendLiteral('-')
          .appendValue(ChronoField.MONTH_OF_YEAR, 2)
          .appendLiteral('-')
          .appendValue(ChronoField.DAY_OF_MONTH, 2)
          .toFormatter()
          .withResolverStyle(ResolverStyle.STRICT);

  private TimeArithmetic() {}

  public static LocalTime parseTime(String value) {
    if (value == null) {
      throw EntryValidationException.parse();
    }
    try {
      return LocalTime.parse(value, TIME_FORMAT);
    } catch (DateTimeParseException e) {
      throw EntryValidationException.parse();
    }
  }

  public static LocalDate parseDate(String value) {
    if (value == null) {
      throw EntryValidationException.parse();
    }
    try {
      return LocalDate.parse(value, DATE_FORMAT);
    } catch (DateTimeParseException e) {
      throw EntryValidationException.parse();
    }
  }

  public static String formatTime(LocalTime time) {
    return time.format(TIME_FORMAT);
  }

  public static int timeToMinutes(String value) {
    return timeToMinutes(parseTime(value));
  }

  public static int timeToMinutes(LocalTime time) {
    return time.getHour() * 60 + time.getMinute();
  }

  public static String minutesToLabel(int totalMinutes) {
    int hours = Math.floorDiv(totalMinutes, 60);
    int minutes = Math.floorMod(totalMinutes, 60);
    return String.format("%02d:%02d", hours, minutes);
  }

  /** 12-hour label such as {@code 9:05 AM}; midnight and noon both render as 12. */
  public static String minutesToAmPm(int totalMinutes) {
    int hours = Math.floorDiv(totalMinutes, 60);
    int minutes = Math.floorMod(totalMinutes, 60);
    String suffix = hours < 12 ? "AM" : "PM";
    int hourOfHalfDay = Math.floorMod(hours, 12);
    int hour12 = hourOfHalfDay == 0 ? 12 : hourOfHalfDay;
    return String.format("%d:%02d %s", hour12, minutes, suffix);
  }

  /** {@code end - start} in whole minutes. Ordering is not checked. */
  public static int durationMinutes(LocalTime start, LocalTime end) {
    return (int) ChronoUnit.MINUTES.between(start, end);
  }
}
