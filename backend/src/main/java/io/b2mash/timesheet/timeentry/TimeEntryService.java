package io.b2mash.timesheet.timeentry;

import io.b2mash.timesheet.chargecode.ChargeCode;
import io.b2mash.timesheet.chargecode.ChargeCodeRepository;
import io.b2mash.timesheet.exception.InvalidStateException;
import io.b2mash.timesheet.exception.ResourceNotFoundException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TimeEntryService {

  private static final Logger log = LoggerFactory.getLogger(TimeEntryService.class);

  private final TimeEntryRepository timeEntryRepository;
  private final ChargeCodeRepository chargeCodeRepository;
  private final EntryPayloadNormalizer normalizer;

  public TimeEntryService(
      TimeEntryRepository timeEntryRepository,
      ChargeCodeRepository chargeCodeRepository,
      EntryPayloadNormalizer normalizer) {
    this.timeEntryRepository = timeEntryRepository;
    this.chargeCodeRepository = chargeCodeRepository;
    this.normalizer = normalizer;
  }

  /** Entries of the user between both dates inclusive, ordered by date then start time. */
  @Transactional(readOnly = true)
  public List<EntryView> fetchEntries(Long userId, LocalDate from, LocalDate to) {
    if (from.isAfter(to)) {
      throw new InvalidStateException(
          "Invalid date range", "'start' date must be on or before 'end' date");
    }
    return toViews(timeEntryRepository.findByUserIdAndDateBetween(userId, from, to));
  }

  @Transactional(readOnly = true)
  public Optional<EntryView> fetchEntry(Long entryId, Long userId) {
    return timeEntryRepository
        .findByIdAndUserId(entryId, userId)
        .map(entry -> toViews(List.of(entry)).get(0));
  }

  @Transactional
  public EntryView createEntry(Long userId, TimeEntryPayload payload) {
    var normalized = normalizer.normalize(userId, payload);
    var saved = timeEntryRepository.save(new TimeEntry(userId, normalized));
    log.info(
        "Created time entry {} for user {} on {} ({} min)",
        saved.getId(),
        userId,
        saved.getEntryDate(),
        saved.getDurationMinutes());
    return toViews(List.of(saved)).get(0);
  }

  /**
   * Partial update: fields omitted from the payload keep their stored values. The duration is
   * recomputed from the resulting times.
   */
  @Transactional
  public EntryView updateEntry(Long entryId, Long userId, TimeEntryPayload payload) {
    var entry =
        timeEntryRepository
            .findByIdAndUserId(entryId, userId)
            .orElseThrow(() -> new ResourceNotFoundException("TimeEntry", entryId));
    var existing = toViews(List.of(entry)).get(0);

    entry.apply(normalizer.normalize(userId, payload, existing));
    var saved = timeEntryRepository.save(entry);
    log.info("Updated time entry {} for user {}", entryId, userId);
    return toViews(List.of(saved)).get(0);
  }

  @Transactional
  public void deleteEntry(Long entryId, Long userId) {
    var entry =
        timeEntryRepository
            .findByIdAndUserId(entryId, userId)
            .orElseThrow(() -> new ResourceNotFoundException("TimeEntry", entryId));
    timeEntryRepository.delete(entry);
    log.info("Deleted time entry {} for user {}", entryId, userId);
  }

  /**
   * Batch-loads the charge codes referenced by the given entries and labels each entry. Input order
   * is preserved.
   */
  private List<EntryView> toViews(List<TimeEntry> entries) {
    if (entries.isEmpty()) {
      return List.of();
    }
    var ids = entries.stream().map(TimeEntry::getChargeCodeId).distinct().toList();
    Map<Long, ChargeCode> codes =
        chargeCodeRepository.findAllById(ids).stream()
            .collect(Collectors.toMap(ChargeCode::getId, Function.identity()));

    return entries.stream()
        .map(
            entry -> {
              var chargeCode = codes.get(entry.getChargeCodeId());
              if (chargeCode == null) {
                throw new IllegalStateException(
                    "Time entry "
                        + entry.getId()
                        + " references missing charge code "
                        + entry.getChargeCodeId());
              }
              return EntryView.from(entry, chargeCode);
            })
        .toList();
  }
}
