package io.b2mash.timesheet.dashboard;

import io.b2mash.timesheet.calendar.CalendarCell;
import io.b2mash.timesheet.calendar.CalendarProjector;
import io.b2mash.timesheet.calendar.CalendarProperties;
import io.b2mash.timesheet.calendar.ChargeColorAssigner;
import io.b2mash.timesheet.chargecode.ChargeCode;
import io.b2mash.timesheet.chargecode.ChargeCodeService;
import io.b2mash.timesheet.timeentry.TimeArithmetic;
import io.b2mash.timesheet.timeentry.TimeEntryService;
import io.b2mash.timesheet.week.WeekBoundsCalculator;
import io.b2mash.timesheet.week.WeekOverview;
import io.b2mash.timesheet.week.WeeklyAggregator;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Builds the weekly calendar and the weekly overview for one user from a single entry fetch. */
@Service
public class DashboardService {

  private static final Logger log = LoggerFactory.getLogger(DashboardService.class);

  private final TimeEntryService timeEntryService;
  private final ChargeCodeService chargeCodeService;
  private final WeekBoundsCalculator weekBoundsCalculator;
  private final CalendarProjector calendarProjector;
  private final WeeklyAggregator weeklyAggregator;
  private final ChargeColorAssigner chargeColorAssigner;
  private final CalendarProperties calendarProperties;

  public DashboardService(
      TimeEntryService timeEntryService,
      ChargeCodeService chargeCodeService,
      WeekBoundsCalculator weekBoundsCalculator,
      CalendarProjector calendarProjector,
      WeeklyAggregator weeklyAggregator,
      ChargeColorAssigner chargeColorAssigner,
      CalendarProperties calendarProperties) {
    this.timeEntryService = timeEntryService;
    this.chargeCodeService = chargeCodeService;
    this.weekBoundsCalculator = weekBoundsCalculator;
    this.calendarProjector = calendarProjector;
    this.weeklyAggregator = weeklyAggregator;
    this.chargeColorAssigner = chargeColorAssigner;
    this.calendarProperties = calendarProperties;
  }

  // --- DTOs ---

  public record ActiveChargeCode(
      Long id, String projectNumber, String taskNumber, String description, String colorClass) {}

  public record TimeSlot(int minute, String label, String amPmLabel) {}

  public record WeekView(
      LocalDate anchorDate,
      LocalDate weekStart,
      LocalDate weekEnd,
      LocalDate previousWeek,
      LocalDate nextWeek,
      LocalDate today,
      List<LocalDate> weekDays,
      Map<String, List<CalendarCell>> calendarEntries,
      WeekOverview overview,
      List<ActiveChargeCode> chargeCodes,
      List<TimeSlot> timeSlots,
      int slotMinutes,
      int slotHeight,
      int displayStartMinutes) {}

  @Transactional(readOnly = true)
  public WeekView getWeekView(Long userId, LocalDate anchorDate) {
    var bounds = weekBoundsCalculator.calculateWeekBounds(anchorDate);
    var entries = timeEntryService.fetchEntries(userId, bounds.start(), bounds.end());

    // Colors are assigned over every code, active or not
    var codes = chargeCodeService.listChargeCodes(userId);
    var colors = chargeColorAssigner.assignColors(codes);
    var activeCodes =
        codes.stream()
            .filter(ChargeCode::isActive)
            .map(
                code ->
                    new ActiveChargeCode(
                        code.getId(),
                        code.getProjectNumber(),
                        code.getTaskNumber(),
                        code.getDescription(),
                        colors.get(code.getId())))
            .toList();

    var window = calendarProperties.window();
    var calendar = calendarProjector.project(entries, colors, window);
    var overview = weeklyAggregator.aggregate(entries, bounds.start(), bounds.end());
    var slots =
        window.slotStarts().stream()
            .map(
                minute ->
                    new TimeSlot(
                        minute,
                        TimeArithmetic.minutesToLabel(minute),
                        TimeArithmetic.minutesToAmPm(minute)))
            .toList();

    log.debug(
        "Built week view for user {}: {}..{}, {} entries",
        userId,
        bounds.start(),
        bounds.end(),
        entries.size());

    return new WeekView(
        anchorDate,
        bounds.start(),
        bounds.end(),
        bounds.start().minusDays(7),
        bounds.start().plusDays(7),
        LocalDate.now(),
        bounds.days(),
        calendar,
        overview,
        activeCodes,
        slots,
        window.slotMinutes(),
        calendarProperties.slotHeight(),
        window.startMinute());
  }
}
