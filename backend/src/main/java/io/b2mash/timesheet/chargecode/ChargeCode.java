package io.b2mash.timesheet.chargecode;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(
    name = "charge_codes",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_charge_codes_user_project_task",
            columnNames = {"user_id", "project_number", "task_number"}))
public class ChargeCode {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private Long userId;

  @Column(name = "project_number", nullable = false, updatable = false)
  private String projectNumber;

  @Column(name = "task_number", nullable = false, updatable = false)
  private String taskNumber;

  @Column(name = "description", nullable = false)
  private String description;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  protected ChargeCode() {}

  public ChargeCode(
      Long userId, String projectNumber, String taskNumber, String description, boolean active) {
    this.userId = userId;
    this.projectNumber = projectNumber;
    this.taskNumber = taskNumber;
    this.description = description;
    this.active = active;
  }

  public Long getId() {
    return id;
  }

  public Long getUserId() {
    return userId;
  }

  public String getProjectNumber() {
    return projectNumber;
  }

  public String getTaskNumber() {
    return taskNumber;
  }

  public String getDescription() {
    return description;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  /** Display label, e.g. {@code "4410-02 Platform upgrade"}. */
  public String getLabel() {
    return projectNumber + "-" + taskNumber + " " + description;
  }
}
