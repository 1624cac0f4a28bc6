package io.b2mash.timesheet.dashboard;

import io.b2mash.timesheet.web.RequestHeaders;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DashboardController {

  private final DashboardService dashboardService;

  public DashboardController(DashboardService dashboardService) {
    this.dashboardService = dashboardService;
  }

  /** Week containing {@code date}; a missing or malformed date shows the current week. */
  @GetMapping("/api/dashboard")
  public ResponseEntity<DashboardService.WeekView> getWeekView(
      @RequestHeader(RequestHeaders.USER_ID) Long userId,
      @RequestParam(required = false) String date) {
    return ResponseEntity.ok(dashboardService.getWeekView(userId, parseAnchor(date)));
  }

  private static LocalDate parseAnchor(String date) {
    if (date == null || date.isBlank()) {
      return LocalDate.now();
    }
    try {
      return LocalDate.parse(date.strip());
    } catch (DateTimeParseException e) {
      return LocalDate.now();
    }
  }
}
