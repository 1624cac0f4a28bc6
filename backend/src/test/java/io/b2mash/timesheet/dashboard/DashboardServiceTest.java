package io.b2mash.timesheet.dashboard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.b2mash.timesheet.calendar.CalendarCell;
import io.b2mash.timesheet.calendar.CalendarProjector;
import io.b2mash.timesheet.calendar.CalendarProperties;
import io.b2mash.timesheet.calendar.ChargeColorAssigner;
import io.b2mash.timesheet.chargecode.ChargeCodeService;
import io.b2mash.timesheet.chargecode.TestChargeCodes;
import io.b2mash.timesheet.timeentry.EntryView;
import io.b2mash.timesheet.timeentry.TimeEntryService;
import io.b2mash.timesheet.week.WeekBoundsCalculator;
import io.b2mash.timesheet.week.WeekProperties;
import io.b2mash.timesheet.week.WeeklyAggregator;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

  private static final Long USER_ID = 7L;
  private static final LocalDate WEEK_START = LocalDate.of(2024, 1, 4);
  private static final LocalDate WEEK_END = LocalDate.of(2024, 1, 10);

  @Mock private TimeEntryService timeEntryService;
  @Mock private ChargeCodeService chargeCodeService;

  private DashboardService service;

  @BeforeEach
  void setUp() {
    var calendarProperties = CalendarProperties.defaults();
    service =
        new DashboardService(
            timeEntryService,
            chargeCodeService,
            new WeekBoundsCalculator(new WeekProperties(DayOfWeek.THURSDAY)),
            new CalendarProjector(calendarProperties),
            new WeeklyAggregator(),
            new ChargeColorAssigner(calendarProperties),
            calendarProperties);
  }

  @Test
  void getWeekView_combinesCalendarAndOverviewForAnchorWeek() {
    var admin = TestChargeCodes.withId(20L, USER_ID, "1000", "01", "Admin", false);
    var platform = TestChargeCodes.withId(10L, USER_ID, "4410", "02", "Platform upgrade", true);
    when(chargeCodeService.listChargeCodes(USER_ID)).thenReturn(List.of(admin, platform));
    var early =
        new EntryView(
            1L,
            10L,
            platform.getLabel(),
            LocalDate.of(2024, 1, 8),
            LocalTime.of(6, 0),
            LocalTime.of(6, 45),
            45,
            "Early deploy");
    var review =
        new EntryView(
            2L,
            20L,
            admin.getLabel(),
            LocalDate.of(2024, 1, 8),
            LocalTime.of(9, 0),
            LocalTime.of(10, 30),
            90,
            "Timesheets");
    when(timeEntryService.fetchEntries(USER_ID, WEEK_START, WEEK_END))
        .thenReturn(List.of(early, review));

    var view = service.getWeekView(USER_ID, LocalDate.of(2024, 1, 8));

    assertThat(view.weekStart()).isEqualTo(WEEK_START);
    assertThat(view.weekEnd()).isEqualTo(WEEK_END);
    assertThat(view.previousWeek()).isEqualTo(LocalDate.of(2023, 12, 28));
    assertThat(view.nextWeek()).isEqualTo(LocalDate.of(2024, 1, 11));
    assertThat(view.weekDays()).hasSize(7).startsWith(WEEK_START).endsWith(WEEK_END);

    // the 06:00 entry is outside the 07:00-18:00 window
    assertThat(view.calendarEntries().get("2024-01-08"))
        .extracting(CalendarCell::id)
        .containsExactly(2L);
    assertThat(view.calendarEntries().get("2024-01-08").get(0).colorClass())
        .isEqualTo("charge-color-0");

    // the overview ignores the display window
    assertThat(view.overview().weekTotal()).isEqualByComparingTo("2.25");
    assertThat(view.overview().rows()).hasSize(2);

    // colors are assigned over all codes, only active ones are listed
    assertThat(view.chargeCodes())
        .singleElement()
        .satisfies(
            code -> {
              assertThat(code.id()).isEqualTo(10L);
              assertThat(code.colorClass()).isEqualTo("charge-color-1");
            });
  }

  @Test
  void getWeekView_describesDisplayGrid() {
    when(chargeCodeService.listChargeCodes(USER_ID)).thenReturn(List.of());
    when(timeEntryService.fetchEntries(USER_ID, WEEK_START, WEEK_END)).thenReturn(List.of());

    var view = service.getWeekView(USER_ID, WEEK_START);

    assertThat(view.slotMinutes()).isEqualTo(30);
    assertThat(view.slotHeight()).isEqualTo(24);
    assertThat(view.displayStartMinutes()).isEqualTo(420);
    assertThat(view.timeSlots()).hasSize(22);
    assertThat(view.timeSlots().get(0))
        .isEqualTo(new DashboardService.TimeSlot(420, "07:00", "7:00 AM"));
    assertThat(view.timeSlots().get(11))
        .isEqualTo(new DashboardService.TimeSlot(750, "12:30", "12:30 PM"));
    assertThat(view.calendarEntries()).isEmpty();
    assertThat(view.overview().rows()).isEmpty();
  }
}
