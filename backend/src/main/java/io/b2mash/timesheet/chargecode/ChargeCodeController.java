package io.b2mash.timesheet.chargecode;

import io.b2mash.timesheet.web.RequestHeaders;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ChargeCodeController {

  private final ChargeCodeService chargeCodeService;

  public ChargeCodeController(ChargeCodeService chargeCodeService) {
    this.chargeCodeService = chargeCodeService;
  }

  @GetMapping("/api/charge-codes")
  public ResponseEntity<List<ChargeCodeResponse>> listChargeCodes(
      @RequestHeader(RequestHeaders.USER_ID) Long userId) {
    var codes = chargeCodeService.listChargeCodes(userId);
    return ResponseEntity.ok(codes.stream().map(ChargeCodeResponse::from).toList());
  }

  @PostMapping("/api/charge-codes")
  public ResponseEntity<ChargeCodeResponse> createChargeCode(
      @RequestHeader(RequestHeaders.USER_ID) Long userId,
      @Valid @RequestBody CreateChargeCodeRequest request) {
    var created =
        chargeCodeService.createChargeCode(
            userId,
            request.projectNumber(),
            request.taskNumber(),
            request.description(),
            request.active() != null ? request.active() : true);
    return ResponseEntity.created(URI.create("/api/charge-codes/" + created.getId()))
        .body(ChargeCodeResponse.from(created));
  }

  @PatchMapping("/api/charge-codes/{id}/active")
  public ResponseEntity<ChargeCodeResponse> setActive(
      @RequestHeader(RequestHeaders.USER_ID) Long userId,
      @PathVariable Long id,
      @Valid @RequestBody SetActiveRequest request) {
    var updated = chargeCodeService.setActive(userId, id, request.active());
    return ResponseEntity.ok(ChargeCodeResponse.from(updated));
  }

  // --- DTOs ---

  public record CreateChargeCodeRequest(
      @NotBlank(message = "projectNumber is required") String projectNumber,
      @NotBlank(message = "taskNumber is required") String taskNumber,
      @NotBlank(message = "description is required") String description,
      Boolean active) {}

  public record SetActiveRequest(@NotNull(message = "active is required") Boolean active) {}

  public record ChargeCodeResponse(
      Long id,
      String projectNumber,
      String taskNumber,
      String description,
      String label,
      boolean active) {

    public static ChargeCodeResponse from(ChargeCode chargeCode) {
      return new ChargeCodeResponse(
          chargeCode.getId(),
          chargeCode.getProjectNumber(),
          chargeCode.getTaskNumber(),
          chargeCode.getDescription(),
          chargeCode.getLabel(),
          chargeCode.isActive());
    }
  }
}
