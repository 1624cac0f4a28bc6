package io.b2mash.timesheet.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** A request that is well-formed but not acceptable, such as a reversed date range. */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, Problems.of(HttpStatus.BAD_REQUEST, title, detail), null);
  }
}
