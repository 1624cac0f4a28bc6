package io.b2mash.timesheet.timeentry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.b2mash.timesheet.TestcontainersConfiguration;
import io.b2mash.timesheet.chargecode.ChargeCode;
import io.b2mash.timesheet.chargecode.ChargeCodeRepository;
import java.time.LocalDate;
import java.time.LocalTime;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class TimeEntryRepositoryIntegrationTest {

  private static final LocalDate WEEK_START = LocalDate.of(2024, 1, 4);
  private static final LocalDate WEEK_END = LocalDate.of(2024, 1, 10);

  @Autowired private TimeEntryRepository timeEntryRepository;
  @Autowired private ChargeCodeRepository chargeCodeRepository;
  @Autowired private TimeEntryService timeEntryService;

  @Test
  void findByUserIdAndDateBetween_ordersByDateThenStartAndIncludesBothEnds() {
    long userId = 1001L;
    var code = saveCode(userId, "4410", "02", "Platform upgrade");
    saveEntry(userId, code, "2024-01-06", "08:00", "09:00");
    saveEntry(userId, code, "2024-01-10", "16:00", "17:00");
    saveEntry(userId, code, "2024-01-04", "13:00", "14:00");
    saveEntry(userId, code, "2024-01-11", "09:00", "10:00");
    saveEntry(userId, code, "2024-01-04", "09:00", "10:30");
    saveEntry(userId, code, "2024-01-03", "09:00", "10:00");

    var found = timeEntryRepository.findByUserIdAndDateBetween(userId, WEEK_START, WEEK_END);

    assertThat(found)
        .extracting(TimeEntry::getEntryDate, TimeEntry::getStartTime)
        .containsExactly(
            tuple(LocalDate.of(2024, 1, 4), LocalTime.of(9, 0)),
            tuple(LocalDate.of(2024, 1, 4), LocalTime.of(13, 0)),
            tuple(LocalDate.of(2024, 1, 6), LocalTime.of(8, 0)),
            tuple(LocalDate.of(2024, 1, 10), LocalTime.of(16, 0)));
  }

  @Test
  void findByUserIdAndDateBetween_excludesOtherUsersEntries() {
    long userId = 1002L;
    long otherUserId = 1003L;
    var own = saveCode(userId, "4410", "02", "Platform upgrade");
    var foreign = saveCode(otherUserId, "4410", "02", "Platform upgrade");
    saveEntry(userId, own, "2024-01-05", "09:00", "10:00");
    saveEntry(otherUserId, foreign, "2024-01-05", "11:00", "12:00");

    var found = timeEntryRepository.findByUserIdAndDateBetween(userId, WEEK_START, WEEK_END);

    assertThat(found).extracting(TimeEntry::getUserId).containsOnly(userId);
    assertThat(found).hasSize(1);
  }

  @Test
  void findByIdAndUserId_isScopedToOwner() {
    long userId = 1004L;
    var code = saveCode(userId, "1000", "01", "Admin");
    var entry = saveEntry(userId, code, "2024-01-05", "09:00", "10:00");

    assertThat(timeEntryRepository.findByIdAndUserId(entry.getId(), userId)).isPresent();
    assertThat(timeEntryRepository.findByIdAndUserId(entry.getId(), 9999L)).isEmpty();
  }

  @Test
  void fetchEntries_labelsStoredEntriesWithTheirChargeCode() {
    long userId = 1005L;
    var admin = saveCode(userId, "1000", "01", "Admin");
    var platform = saveCode(userId, "4410", "02", "Platform upgrade");
    saveEntry(userId, platform, "2024-01-08", "13:00", "14:15");
    saveEntry(userId, admin, "2024-01-08", "08:00", "08:30");

    var views = timeEntryService.fetchEntries(userId, WEEK_START, WEEK_END);

    assertThat(views)
        .extracting(EntryView::chargeCodeLabel, EntryView::durationMinutes)
        .containsExactly(tuple("1000-01 Admin", 30), tuple("4410-02 Platform upgrade", 75));
  }

  private ChargeCode saveCode(long userId, String project, String task, String description) {
    return chargeCodeRepository.save(new ChargeCode(userId, project, task, description, true));
  }

  private TimeEntry saveEntry(
      long userId, ChargeCode code, String date, String start, String end) {
    var startTime = TimeArithmetic.parseTime(start);
    var endTime = TimeArithmetic.parseTime(end);
    var normalized =
        new NormalizedEntry(
            code.getId(),
            TimeArithmetic.parseDate(date),
            startTime,
            endTime,
            TimeArithmetic.durationMinutes(startTime, endTime),
            "Work on " + code.getLabel());
    return timeEntryRepository.save(new TimeEntry(userId, normalized));
  }
}
