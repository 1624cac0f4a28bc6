package io.b2mash.timesheet.chargecode;

import io.b2mash.timesheet.exception.InvalidStateException;
import io.b2mash.timesheet.exception.ResourceConflictException;
import io.b2mash.timesheet.exception.ResourceNotFoundException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ChargeCodeService {

  private static final Logger log = LoggerFactory.getLogger(ChargeCodeService.class);

  private final ChargeCodeRepository chargeCodeRepository;

  public ChargeCodeService(ChargeCodeRepository chargeCodeRepository) {
    this.chargeCodeRepository = chargeCodeRepository;
  }

  /** All of the user's charge codes, active or not, ordered by project then task number. */
  @Transactional(readOnly = true)
  public List<ChargeCode> listChargeCodes(Long userId) {
    return chargeCodeRepository.findByUserIdOrdered(userId);
  }

  @Transactional(readOnly = true)
  public boolean ownsChargeCode(Long userId, Long chargeCodeId) {
    return chargeCodeRepository.existsByIdAndUserId(chargeCodeId, userId);
  }

  @Transactional(readOnly = true)
  public boolean chargeCodeExists(Long userId, String projectNumber, String taskNumber) {
    return chargeCodeRepository.existsByUserIdAndProjectNumberAndTaskNumber(
        userId, projectNumber, taskNumber);
  }

  @Transactional
  public ChargeCode createChargeCode(
      Long userId, String projectNumber, String taskNumber, String description, boolean active) {
    String project = requireText(projectNumber, "Project number is required.");
    String task = requireText(taskNumber, "Task number is required.");
    String desc = requireText(description, "Description is required.");

    if (chargeCodeExists(userId, project, task)) {
      throw new ResourceConflictException(
          "Duplicate charge code", "Charge code already exists.");
    }

    var saved = chargeCodeRepository.save(new ChargeCode(userId, project, task, desc, active));
    log.info("Created charge code {} ({}-{}) for user {}", saved.getId(), project, task, userId);
    return saved;
  }

  @Transactional
  public ChargeCode setActive(Long userId, Long chargeCodeId, boolean active) {
    var chargeCode =
        chargeCodeRepository
            .findByIdAndUserId(chargeCodeId, userId)
            .orElseThrow(() -> new ResourceNotFoundException("ChargeCode", chargeCodeId));
    chargeCode.setActive(active);
    log.info("Set charge code {} active={} for user {}", chargeCodeId, active, userId);
    return chargeCodeRepository.save(chargeCode);
  }

  private static String requireText(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new InvalidStateException("Invalid charge code", message);
    }
    return value.strip();
  }
}
