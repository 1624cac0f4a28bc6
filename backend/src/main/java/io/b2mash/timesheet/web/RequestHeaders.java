package io.b2mash.timesheet.web;

/** Headers set by the upstream gateway that authenticates the caller. */
public final class RequestHeaders {

  public static final String USER_ID = "X-User-Id";

  private RequestHeaders() {}
}
