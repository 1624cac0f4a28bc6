package io.b2mash.timesheet.timeentry;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

@Entity
@Table(name = "time_entries")
public class TimeEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private Long userId;

  @Column(name = "charge_code_id", nullable = false)
  private Long chargeCodeId;

  @Column(name = "entry_date", nullable = false)
  private LocalDate entryDate;

  @Column(name = "start_time", nullable = false)
  private LocalTime startTime;

  @Column(name = "end_time", nullable = false)
  private LocalTime endTime;

  @Column(name = "duration_minutes", nullable = false)
  private int durationMinutes;

  @Column(name = "activity_text", nullable = false, columnDefinition = "TEXT")
  private String activityText;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TimeEntry() {}

  public TimeEntry(Long userId, NormalizedEntry normalized) {
    this.userId = userId;
    apply(normalized);
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  /** Overwrites every user-editable field with the normalized values. */
  public void apply(NormalizedEntry normalized) {
    this.chargeCodeId = normalized.chargeCodeId();
    this.entryDate = normalized.entryDate();
    this.startTime = normalized.startTime();
    this.endTime = normalized.endTime();
    this.durationMinutes = normalized.durationMinutes();
    this.activityText = normalized.activityText();
    this.updatedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Long getUserId() {
    return userId;
  }

  public Long getChargeCodeId() {
    return chargeCodeId;
  }

  public LocalDate getEntryDate() {
    return entryDate;
  }

  public LocalTime getStartTime() {
    return startTime;
  }

  public LocalTime getEndTime() {
    return endTime;
  }

  public int getDurationMinutes() {
    return durationMinutes;
  }

  public String getActivityText() {
    return activityText;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
