package io.b2mash.timesheet.timeentry;

import io.b2mash.timesheet.chargecode.ChargeCodeService;
import io.b2mash.timesheet.exception.EntryValidationException;
import java.time.LocalDate;
import java.time.LocalTime;
import org.springframework.stereotype.Component;

/**
 * Turns a raw {@link TimeEntryPayload} into a {@link NormalizedEntry}.
 *
 * <p>Each field comes from the payload when it is present and non-blank, otherwise from the stored
 * entry being updated. Checks run in a fixed order and the first failure is thrown as an {@link
 * EntryValidationException}: missing fields, unparsable values, start not before end, blank
 * activity text, then charge code ownership. Nothing is persisted here.
 */
@Component
public class EntryPayloadNormalizer {

  private final ChargeCodeService chargeCodeService;

  public EntryPayloadNormalizer(ChargeCodeService chargeCodeService) {
    this.chargeCodeService = chargeCodeService;
  }

  public NormalizedEntry normalize(Long ownerId, TimeEntryPayload payload) {
    return normalize(ownerId, payload, null);
  }

  /**
   * @param existing the stored entry used as fallback for omitted fields, or null on create
   */
  public NormalizedEntry normalize(Long ownerId, TimeEntryPayload payload, EntryView existing) {
    String chargeCodeRaw =
        valueOrDefault(
            payload.chargeCodeId(), existing != null ? existing.chargeCodeId().toString() : null);
    String entryDateRaw =
        valueOrDefault(
            payload.entryDate(), existing != null ? existing.entryDate().toString() : null);
    String startTimeRaw =
        valueOrDefault(
            payload.startTime(),
            existing != null ? TimeArithmetic.formatTime(existing.startTime()) : null);
    String endTimeRaw =
        valueOrDefault(
            payload.endTime(),
            existing != null ? TimeArithmetic.formatTime(existing.endTime()) : null);
    String activityText =
        valueOrDefault(payload.activityText(), existing != null ? existing.activityText() : "");

    if (chargeCodeRaw == null
        || entryDateRaw == null
        || startTimeRaw == null
        || endTimeRaw == null) {
      throw EntryValidationException.missingField();
    }

    Long chargeCodeId = parseChargeCodeId(chargeCodeRaw);
    LocalDate entryDate = TimeArithmetic.parseDate(entryDateRaw);
    LocalTime startTime = TimeArithmetic.parseTime(startTimeRaw);
    LocalTime endTime = TimeArithmetic.parseTime(endTimeRaw);

    if (!startTime.isBefore(endTime)) {
      throw EntryValidationException.ordering();
    }

    activityText = activityText == null ? "" : activityText.strip();
    if (activityText.isEmpty()) {
      throw EntryValidationException.requiredField();
    }

    if (!chargeCodeService.ownsChargeCode(ownerId, chargeCodeId)) {
      throw EntryValidationException.ownership();
    }

    return new NormalizedEntry(
        chargeCodeId,
        entryDate,
        startTime,
        endTime,
        TimeArithmetic.durationMinutes(startTime, endTime),
        activityText);
  }

  private static String valueOrDefault(String value, String fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return value.strip();
  }

  private static Long parseChargeCodeId(String raw) {
    try {
      return Long.valueOf(raw);
    } catch (NumberFormatException e) {
      throw EntryValidationException.parse();
    }
  }
}
