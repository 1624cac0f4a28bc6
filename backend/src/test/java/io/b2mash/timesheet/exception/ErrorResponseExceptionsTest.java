package io.b2mash.timesheet.exception;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ErrorResponseExceptionsTest {

  @Test
  void invalidState_isBadRequestWithTitleAndDetail() {
    var ex = new InvalidStateException("Invalid date range", "Dates must use YYYY-MM-DD");

    assertThat(ex.getStatusCode().value()).isEqualTo(400);
    assertThat(ex.getBody().getTitle()).isEqualTo("Invalid date range");
    assertThat(ex.getBody().getDetail()).isEqualTo("Dates must use YYYY-MM-DD");
  }

  @Test
  void resourceConflict_isConflict() {
    var ex = new ResourceConflictException("Duplicate charge code", "Charge code already exists.");

    assertThat(ex.getStatusCode().value()).isEqualTo(409);
    assertThat(ex.getBody().getStatus()).isEqualTo(409);
    assertThat(ex.getBody().getDetail()).isEqualTo("Charge code already exists.");
  }

  @Test
  void resourceNotFound_namesTypeAndId() {
    var ex = new ResourceNotFoundException("TimeEntry", 100L);

    assertThat(ex.getStatusCode().value()).isEqualTo(404);
    assertThat(ex.getBody().getTitle()).isEqualTo("TimeEntry not found");
    assertThat(ex.getBody().getDetail()).isEqualTo("No timeentry found with id 100");
  }

  @Test
  void entryValidation_exposesKindAsProperty() {
    var ex = EntryValidationException.ownership();

    assertThat(ex.getStatusCode().value()).isEqualTo(400);
    assertThat(ex.getBody().getTitle()).isEqualTo("Invalid time entry");
    assertThat(ex.getBody().getProperties()).containsEntry("errorKind", "OWNERSHIP");
    assertThat(ex.getMessage()).isEqualTo("Invalid charge code.");
  }
}
