package io.b2mash.b2b.workflowengine.workflow;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Firm-scoped workflow category. Owns the ordered {@link TaskStatus} stages. */
@Entity
@Table(name = "work_types")
public class WorkType {

  public static final String DEFAULT_COLOR = "#3b82f6";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "firm_id", nullable = false)
  private UUID firmId;

  @Column(name = "name", nullable = false, length = 120)
  private String name;

  @Column(name = "description", length = 2000)
  private String description;

  @Column(name = "color", nullable = false, length = 7)
  private String color;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected WorkType() {}

  public WorkType(UUID firmId, String name, String description) {
    this.firmId = firmId;
    this.name = name;
    this.description = description;
    this.color = DEFAULT_COLOR;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void rename(String name, String description) {
    this.name = name;
    this.description = description;
    this.updatedAt = Instant.now();
  }

  /** Detaches this work type from its template. Existing projects keep using its stages. */
  public void retire() {
    this.active = false;
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

  public String getDescription() {
    return description;
  }

  public String getColor() {
    return color;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
