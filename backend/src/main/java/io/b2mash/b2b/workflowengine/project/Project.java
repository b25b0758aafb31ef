package io.b2mash.b2b.workflowengine.project;

import io.b2mash.b2b.workflowengine.task.TaskPriority;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "projects")
public class Project {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "firm_id", nullable = false)
  private UUID firmId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "client_id", nullable = false)
  private UUID clientId;

  @Column(name = "work_type_id", nullable = false)
  private UUID workTypeId;

  @Column(name = "template_id")
  private UUID templateId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ProjectStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "priority", nullable = false, length = 10)
  private TaskPriority priority;

  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Column(name = "task_dependency_mode", nullable = false)
  private boolean taskDependencyMode;

  // Derived from the Kanban column; never set independently.
  @Column(name = "current_status_id")
  private UUID currentStatusId;

  @Column(name = "created_by")
  private UUID createdBy;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  protected Project() {}

  public Project(
      UUID firmId,
      String name,
      UUID clientId,
      UUID workTypeId,
      UUID templateId,
      LocalDate startDate,
      LocalDate dueDate,
      TaskPriority priority,
      boolean taskDependencyMode,
      UUID currentStatusId,
      UUID createdBy) {
    this.firmId = firmId;
    this.name = name;
    this.clientId = clientId;
    this.workTypeId = workTypeId;
    this.templateId = templateId;
    this.startDate = startDate;
    this.dueDate = dueDate;
    this.priority = priority != null ? priority : TaskPriority.MEDIUM;
    this.taskDependencyMode = taskDependencyMode;
    this.currentStatusId = currentStatusId;
    this.createdBy = createdBy;
    this.status = ProjectStatus.ACTIVE;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Applies the workflow position derived from the project's tasks. Flips the project between
   * ACTIVE and COMPLETED, stamping or clearing the completion time.
   */
  public void syncWorkflowState(UUID currentStatusId, boolean completed) {
    this.currentStatusId = currentStatusId;
    if (completed && status != ProjectStatus.COMPLETED) {
      this.status = ProjectStatus.COMPLETED;
      this.completedAt = Instant.now();
    } else if (!completed && status == ProjectStatus.COMPLETED) {
      this.status = ProjectStatus.ACTIVE;
      this.completedAt = null;
    }
    this.updatedAt = Instant.now();
  }

  public void changeDependencyMode(boolean taskDependencyMode) {
    this.taskDependencyMode = taskDependencyMode;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getFirmId() {
    return firmId;
  }

  public String getName() {
    return name;
  }

  public UUID getClientId() {
    return clientId;
  }

  public UUID getWorkTypeId() {
    return workTypeId;
  }

  public UUID getTemplateId() {
    return templateId;
  }

  public ProjectStatus getStatus() {
    return status;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public boolean isTaskDependencyMode() {
    return taskDependencyMode;
  }

  public UUID getCurrentStatusId() {
    return currentStatusId;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }
}
