package io.b2mash.timesheet.timeentry;

import io.b2mash.timesheet.exception.EntryValidationException;
import io.b2mash.timesheet.exception.InvalidStateException;
import io.b2mash.timesheet.exception.ResourceNotFoundException;
import io.b2mash.timesheet.web.RequestHeaders;
import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TimeEntryController {

  private final TimeEntryService timeEntryService;

  public TimeEntryController(TimeEntryService timeEntryService) {
    this.timeEntryService = timeEntryService;
  }

  @GetMapping("/api/time-entries")
  public ResponseEntity<List<EntryView>> listEntries(
      @RequestHeader(RequestHeaders.USER_ID) Long userId,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end) {
    LocalDate startDate = parseRangeDate(start, LocalDate.now());
    LocalDate endDate = parseRangeDate(end, startDate);
    return ResponseEntity.ok(timeEntryService.fetchEntries(userId, startDate, endDate));
  }

  @GetMapping("/api/time-entries/{id}")
  public ResponseEntity<EntryView> getEntry(
      @RequestHeader(RequestHeaders.USER_ID) Long userId, @PathVariable Long id) {
    return timeEntryService
        .fetchEntry(id, userId)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new ResourceNotFoundException("TimeEntry", id));
  }

  @PostMapping("/api/time-entries")
  public ResponseEntity<EntryView> createEntry(
      @RequestHeader(RequestHeaders.USER_ID) Long userId,
      @RequestBody(required = false) TimeEntryPayload payload) {
    var created =
        timeEntryService.createEntry(userId, payload != null ? payload : TimeEntryPayload.empty());
    return ResponseEntity.created(URI.create("/api/time-entries/" + created.id())).body(created);
  }

  @PutMapping("/api/time-entries/{id}")
  public ResponseEntity<EntryView> updateEntry(
      @RequestHeader(RequestHeaders.USER_ID) Long userId,
      @PathVariable Long id,
      @RequestBody(required = false) TimeEntryPayload payload) {
    var updated =
        timeEntryService.updateEntry(
            id, userId, payload != null ? payload : TimeEntryPayload.empty());
    return ResponseEntity.ok(updated);
  }

  @DeleteMapping("/api/time-entries/{id}")
  public ResponseEntity<Void> deleteEntry(
      @RequestHeader(RequestHeaders.USER_ID) Long userId, @PathVariable Long id) {
    timeEntryService.deleteEntry(id, userId);
    return ResponseEntity.noContent().build();
  }

  /** Blank means absent. */
  private static LocalDate parseRangeDate(String value, LocalDate fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return TimeArithmetic.parseDate(value.strip());
    } catch (EntryValidationException e) {
      throw new InvalidStateException("Invalid date range", "Dates must use YYYY-MM-DD");
    }
  }
}
