package io.b2mash.b2b.workflowengine.workflow;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One ordered stage of a {@link WorkType}. Positions are 1-based and contiguous; position 1 is the
 * only default stage and position N the only terminal stage.
 */
@Entity
@Table(name = "task_statuses")
public class TaskStatus {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "firm_id", nullable = false)
  private UUID firmId;

  @Column(name = "work_type_id", nullable = false)
  private UUID workTypeId;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "color", nullable = false, length = 7)
  private String color;

  @Column(name = "position", nullable = false)
  private int position;

  @Column(name = "is_default", nullable = false)
  private boolean defaultStage;

  @Column(name = "is_terminal", nullable = false)
  private boolean terminal;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TaskStatus() {}

  public TaskStatus(
      UUID firmId,
      UUID workTypeId,
      String name,
      String color,
      int position,
      boolean defaultStage,
      boolean terminal) {
    this.firmId = firmId;
    this.workTypeId = workTypeId;
    this.name = name;
    this.color = color;
    this.position = position;
    this.defaultStage = defaultStage;
    this.terminal = terminal;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getFirmId() {
    return firmId;
  }

  public UUID getWorkTypeId() {
    return workTypeId;
  }

  public String getName() {
    return name;
  }

  public String getColor() {
    return color;
  }

  public int getPosition() {
    return position;
  }

  public boolean isDefault() {
    return defaultStage;
  }

  public boolean isTerminal() {
    return terminal;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
