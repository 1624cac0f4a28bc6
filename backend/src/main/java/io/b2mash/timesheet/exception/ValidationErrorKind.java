package io.b2mash.timesheet.exception;

/** Categories of time entry payload rejection, in the order the normalizer checks them. */
public enum ValidationErrorKind {
  MISSING_FIELD,
  PARSE,
  ORDERING,
  REQUIRED_FIELD,
  OWNERSHIP
}
