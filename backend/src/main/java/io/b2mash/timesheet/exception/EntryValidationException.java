package io.b2mash.timesheet.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Rejection of a time entry payload. Carries a single {@link ValidationErrorKind} and the message
 * shown to the user; the problem detail exposes the kind as the {@code errorKind} property.
 */
public class EntryValidationException extends ErrorResponseException {

  private final ValidationErrorKind kind;

  public EntryValidationException(ValidationErrorKind kind, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(kind, detail), null);
    this.kind = kind;
  }

  public static EntryValidationException missingField() {
    return new EntryValidationException(
        ValidationErrorKind.MISSING_FIELD, "Missing required fields.");
  }

  public static EntryValidationException parse() {
    return new EntryValidationException(ValidationErrorKind.PARSE, "Invalid payload.");
  }

  public static EntryValidationException ordering() {
    return new EntryValidationException(
        ValidationErrorKind.ORDERING, "Start time must be before end time.");
  }

  public static EntryValidationException requiredField() {
    return new EntryValidationException(
        ValidationErrorKind.REQUIRED_FIELD, "Activity text is required.");
  }

  public static EntryValidationException ownership() {
    return new EntryValidationException(ValidationErrorKind.OWNERSHIP, "Invalid charge code.");
  }

  public ValidationErrorKind getKind() {
    return kind;
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(ValidationErrorKind kind, String detail) {
    var problem = Problems.of(HttpStatus.BAD_REQUEST, "Invalid time entry", detail);
    problem.setProperty("errorKind", kind.name());
    return problem;
  }
}
