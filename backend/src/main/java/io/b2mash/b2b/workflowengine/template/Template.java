package io.b2mash.b2b.workflowengine.template;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "templates")
public class Template {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "firm_id", nullable = false)
  private UUID firmId;

  @Column(name = "name", nullable = false, length = 120)
  private String name;

  @Column(name = "description", length = 2000)
  private String description;

  // Work type generated by TemplateCompiler; null until the template is compiled.
  @Column(name = "work_type_id")
  private UUID workTypeId;

  @Column(name = "task_dependency_mode", nullable = false)
  private boolean taskDependencyMode;

  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Template() {}

  public Template(
      UUID firmId, String name, String description, boolean taskDependencyMode, UUID createdBy) {
    this.firmId = firmId;
    this.name = name;
    this.description = description;
    this.taskDependencyMode = taskDependencyMode;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(String name, String description, boolean taskDependencyMode) {
    this.name = name;
    this.description = description;
    this.taskDependencyMode = taskDependencyMode;
    this.updatedAt = Instant.now();
  }

  public void linkWorkType(UUID workTypeId) {
    this.workTypeId = workTypeId;
    this.updatedAt = Instant.now();
  }

  public boolean isCompiled() {
    return workTypeId != null;
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

  public String getDescription() {
    return description;
  }

  public UUID getWorkTypeId() {
    return workTypeId;
  }

  public boolean isTaskDependencyMode() {
    return taskDependencyMode;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
