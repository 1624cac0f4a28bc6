package io.b2mash.timesheet.timeentry;

/**
 * Inbound create/update request. Every field is raw text; a null or blank field means "not
 * supplied" and falls back to the stored entry on update.
 */
public record TimeEntryPayload(
    String chargeCodeId,
    String entryDate,
    String startTime,
    String endTime,
    String activityText) {

  public static TimeEntryPayload empty() {
    return new TimeEntryPayload(null, null, null, null, null);
  }
}
