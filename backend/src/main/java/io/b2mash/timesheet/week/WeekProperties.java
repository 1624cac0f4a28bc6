package io.b2mash.timesheet.week;

import java.time.DayOfWeek;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Week layout settings.
 *
 * @param startDay weekday every reporting week begins on; Thursday unless configured otherwise
 */
@ConfigurationProperties(prefix = "timesheet.week")
public record WeekProperties(DayOfWeek startDay) {

  public WeekProperties {
    if (startDay == null) {
      startDay = DayOfWeek.THURSDAY;
    }
  }
}
