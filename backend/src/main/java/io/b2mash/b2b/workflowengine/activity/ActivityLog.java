package io.b2mash.b2b.workflowengine.activity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "activity_logs")
public class ActivityLog {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "firm_id")
  private UUID firmId;

  @Column(name = "message", nullable = false, length = 1000)
  private String message;

  @Column(name = "actor_id")
  private UUID actorId;

  @Column(name = "project_id")
  private UUID projectId;

  @Column(name = "task_id")
  private UUID taskId;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  protected ActivityLog() {}

  public ActivityLog(
      UUID firmId, String message, UUID actorId, UUID projectId, UUID taskId, Instant occurredAt) {
    this.firmId = firmId;
    this.message = message;
    this.actorId = actorId;
    this.projectId = projectId;
    this.taskId = taskId;
    this.occurredAt = occurredAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getFirmId() {
    return firmId;
  }

  public String getMessage() {
    return message;
  }

  public UUID getActorId() {
    return actorId;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getTaskId() {
    return taskId;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
