package io.b2mash.b2b.workflowengine.activity;

import java.time.Instant;
import java.util.UUID;

/**
 * Published by workflow services inside their transaction. Delivered to the activity sink only
 * after the transaction commits.
 */
public record ActivityLoggedEvent(
    UUID firmId, String message, UUID actorId, UUID projectId, UUID taskId, Instant occurredAt) {

  public static ActivityLoggedEvent forProject(
      UUID firmId, UUID projectId, UUID actorId, String message) {
    return new ActivityLoggedEvent(firmId, message, actorId, projectId, null, Instant.now());
  }

  public static ActivityLoggedEvent forTask(
      UUID firmId, UUID projectId, UUID taskId, UUID actorId, String message) {
    return new ActivityLoggedEvent(firmId, message, actorId, projectId, taskId, Instant.now());
  }

  public static ActivityLoggedEvent forFirm(UUID firmId, UUID actorId, String message) {
    return new ActivityLoggedEvent(firmId, message, actorId, null, null, Instant.now());
  }
}
