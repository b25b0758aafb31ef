package io.b2mash.b2b.workflowengine.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Directed edge: {@code taskId} cannot start until {@code dependsOnTaskId} is completed. */
@Entity
@Table(name = "task_dependencies")
public class TaskDependency {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "firm_id", nullable = false)
  private UUID firmId;

  @Column(name = "task_id", nullable = false)
  private UUID taskId;

  @Column(name = "depends_on_task_id", nullable = false)
  private UUID dependsOnTaskId;

  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TaskDependency() {}

  public TaskDependency(UUID firmId, UUID taskId, UUID dependsOnTaskId, UUID createdBy) {
    this.firmId = firmId;
    this.taskId = taskId;
    this.dependsOnTaskId = dependsOnTaskId;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getFirmId() {
    return firmId;
  }

  public UUID getTaskId() {
    return taskId;
  }

  public UUID getDependsOnTaskId() {
    return dependsOnTaskId;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
