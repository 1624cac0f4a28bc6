package io.b2mash.timesheet.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** The write would duplicate a row the user already has. */
public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, Problems.of(HttpStatus.CONFLICT, title, detail), null);
  }
}
