package io.b2mash.timesheet.config;

import io.b2mash.timesheet.calendar.CalendarProperties;
import io.b2mash.timesheet.week.WeekProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({WeekProperties.class, CalendarProperties.class})
public class TimesheetConfig {}
