package io.b2mash.b2b.workflowengine.template;

import io.b2mash.b2b.workflowengine.exception.InvalidStateException;
import io.b2mash.b2b.workflowengine.task.TaskPriority;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "template_tasks")
public class TemplateTask {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  // Parent FK stored as plain UUID, no @ManyToOne. ON DELETE CASCADE handles template removal.
  @Column(name = "template_id", nullable = false)
  private UUID templateId;

  // Maps to Task.title on instantiation and to TaskStatus.name on compilation.
  @Column(name = "title", nullable = false, length = 200)
  private String title;

  @Column(name = "description", length = 2000)
  private String description;

  @Column(name = "position", nullable = false)
  private int position;

  // At most one of daysFromStart / recurrenceRule is set.
  @Column(name = "days_from_start")
  private Integer daysFromStart;

  @Column(name = "recurrence_rule", length = 100)
  private String recurrenceRule;

  @Column(name = "estimated_hours", precision = 10, scale = 2)
  private BigDecimal estimatedHours;

  @Enumerated(EnumType.STRING)
  @Column(name = "default_priority", nullable = false, length = 10)
  private TaskPriority defaultPriority;

  @Column(name = "default_assignee_id")
  private UUID defaultAssigneeId;

  // Stage generated for this task by TemplateCompiler.
  @Column(name = "default_status_id")
  private UUID defaultStatusId;

  // Template-local: other TemplateTask IDs of the same template.
  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(
      name = "template_task_dependencies",
      joinColumns = @JoinColumn(name = "template_task_id"))
  @Column(name = "depends_on_template_task_id", nullable = false)
  private Set<UUID> dependencies = new HashSet<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TemplateTask() {}

  public TemplateTask(
      UUID templateId,
      String title,
      String description,
      int position,
      Integer daysFromStart,
      String recurrenceRule,
      BigDecimal estimatedHours,
      TaskPriority defaultPriority,
      UUID defaultAssigneeId) {
    if (daysFromStart != null && recurrenceRule != null) {
      throw new InvalidStateException(
          "Ambiguous due date",
          "Template task '" + title + "' sets both days from start and a recurrence rule");
    }
    if (daysFromStart != null && daysFromStart < 0) {
      throw new InvalidStateException(
          "Invalid due date offset",
          "Template task '" + title + "' has a negative days from start: " + daysFromStart);
    }
    this.templateId = templateId;
    this.title = title;
    this.description = description;
    this.position = position;
    this.daysFromStart = daysFromStart;
    this.recurrenceRule = recurrenceRule;
    this.estimatedHours = estimatedHours;
    this.defaultPriority = defaultPriority != null ? defaultPriority : TaskPriority.MEDIUM;
    this.defaultAssigneeId = defaultAssigneeId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void linkDefaultStatus(UUID statusId) {
    this.defaultStatusId = statusId;
    this.updatedAt = Instant.now();
  }

  public void replaceDependencies(Set<UUID> templateTaskIds) {
    this.dependencies.clear();
    this.dependencies.addAll(templateTaskIds);
    this.updatedAt = Instant.now();
  }

  public boolean isRecurring() {
    return recurrenceRule != null;
  }

  public UUID getId() {
    return id;
  }

  public UUID getTemplateId() {
    return templateId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public int getPosition() {
    return position;
  }

  public Integer getDaysFromStart() {
    return daysFromStart;
  }

  public String getRecurrenceRule() {
    return recurrenceRule;
  }

  public BigDecimal getEstimatedHours() {
    return estimatedHours;
  }

  public TaskPriority getDefaultPriority() {
    return defaultPriority;
  }

  public UUID getDefaultAssigneeId() {
    return defaultAssigneeId;
  }

  public UUID getDefaultStatusId() {
    return defaultStatusId;
  }

  public Set<UUID> getDependencies() {
    return Set.copyOf(dependencies);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
