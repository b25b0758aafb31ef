package io.b2mash.b2b.workflowengine.task;

import io.b2mash.b2b.workflowengine.workflow.TaskStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "tasks")
public class Task {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "firm_id", nullable = false)
  private UUID firmId;

  // Null for standalone tasks.
  @Column(name = "project_id")
  private UUID projectId;

  @Column(name = "title", nullable = false, length = 200)
  private String title;

  @Column(name = "description", length = 4000)
  private String description;

  @Column(name = "status_id", nullable = false)
  private UUID statusId;

  @Enumerated(EnumType.STRING)
  @Column(name = "priority", nullable = false, length = 10)
  private TaskPriority priority;

  @Column(name = "assignee_id")
  private UUID assigneeId;

  @Column(name = "estimated_hours", precision = 10, scale = 2)
  private BigDecimal estimatedHours;

  @Column(name = "due_date")
  private LocalDate dueDate;

  // TemplateTask this task was instantiated from; drives the stage ladder position.
  @Column(name = "template_task_origin_id")
  private UUID templateTaskOriginId;

  @Column(name = "is_recurring", nullable = false)
  private boolean recurring;

  @Column(name = "recurrence_rule", length = 100)
  private String recurrenceRule;

  @Column(name = "next_due_date")
  private LocalDate nextDueDate;

  @Column(name = "last_completed_on")
  private LocalDate lastCompletedOn;

  // Set on generated instances only; points at the recurring master.
  @Column(name = "master_task_id")
  private UUID masterTaskId;

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

  @Column(name = "completed_by")
  private UUID completedBy;

  protected Task() {}

  public Task(
      UUID firmId,
      UUID projectId,
      String title,
      String description,
      TaskStatus status,
      TaskPriority priority,
      UUID assigneeId,
      BigDecimal estimatedHours,
      LocalDate dueDate,
      UUID templateTaskOriginId,
      UUID createdBy) {
    this.firmId = firmId;
    this.projectId = projectId;
    this.title = title;
    this.description = description;
    this.statusId = status.getId();
    this.priority = priority != null ? priority : TaskPriority.MEDIUM;
    this.assigneeId = assigneeId;
    this.estimatedHours = estimatedHours;
    this.dueDate = dueDate;
    this.templateTaskOriginId = templateTaskOriginId;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
    if (status.isTerminal()) {
      this.completedAt = this.createdAt;
      this.completedBy = createdBy;
    }
  }

  /**
   * Builds the next instance of a recurring master. Copies the master's descriptive fields and
   * origin, starts in the given status and links back through {@code masterTaskId}.
   */
  public static Task newRecurringInstance(Task master, LocalDate dueDate, TaskStatus status) {
    var instance =
        new Task(
            master.firmId,
            master.projectId,
            master.title,
            master.description,
            status,
            master.priority,
            master.assigneeId,
            master.estimatedHours,
            dueDate,
            master.templateTaskOriginId,
            master.createdBy);
    instance.masterTaskId = master.id;
    return instance;
  }

  /**
   * Moves the task to a new stage. Entering a terminal stage stamps completion, leaving one clears
   * it.
   */
  public void changeStatus(TaskStatus status, UUID actorId) {
    boolean wasCompleted = completedAt != null;
    this.statusId = status.getId();
    if (status.isTerminal() && !wasCompleted) {
      this.completedAt = Instant.now();
      this.completedBy = actorId;
    } else if (!status.isTerminal()) {
      this.completedAt = null;
      this.completedBy = null;
    }
    this.updatedAt = Instant.now();
  }

  public void configureRecurrence(String rule, LocalDate nextDueDate) {
    this.recurring = true;
    this.recurrenceRule = rule;
    this.nextDueDate = nextDueDate;
    this.updatedAt = Instant.now();
  }

  public void clearRecurrence() {
    this.recurring = false;
    this.recurrenceRule = null;
    this.nextDueDate = null;
    this.updatedAt = Instant.now();
  }

  /** Records a completion date on a master. Keeps the latest date seen. */
  public void recordCompletion(LocalDate completedOn) {
    if (lastCompletedOn == null || completedOn.isAfter(lastCompletedOn)) {
      this.lastCompletedOn = completedOn;
      this.updatedAt = Instant.now();
    }
  }

  public void scheduleNextOccurrence(LocalDate nextDueDate) {
    this.nextDueDate = nextDueDate;
    this.updatedAt = Instant.now();
  }

  public boolean isCompleted() {
    return completedAt != null;
  }

  public boolean isRecurringInstance() {
    return masterTaskId != null;
  }

  public UUID getId() {
    return id;
  }

  public UUID getFirmId() {
    return firmId;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public UUID getStatusId() {
    return statusId;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public UUID getAssigneeId() {
    return assigneeId;
  }

  public BigDecimal getEstimatedHours() {
    return estimatedHours;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public UUID getTemplateTaskOriginId() {
    return templateTaskOriginId;
  }

  public boolean isRecurring() {
    return recurring;
  }

  public String getRecurrenceRule() {
    return recurrenceRule;
  }

  public LocalDate getNextDueDate() {
    return nextDueDate;
  }

  public LocalDate getLastCompletedOn() {
    return lastCompletedOn;
  }

  public UUID getMasterTaskId() {
    return masterTaskId;
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

  public UUID getCompletedBy() {
    return completedBy;
  }
}
