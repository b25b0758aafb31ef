package io.b2mash.b2b.workflowengine.project.dto;

import io.b2mash.b2b.workflowengine.task.TaskPriority;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Input for {@code ProjectInstantiator.instantiate}.
 *
 * @param dependencyModeOverride null inherits the template's dependency mode
 * @param name null derives "client - template"
 */
public record InstantiateProjectRequest(
    @NotNull(message = "templateId is required") UUID templateId,
    @NotNull(message = "clientId is required") UUID clientId,
    @NotNull(message = "startDate is required") LocalDate startDate,
    LocalDate dueDate,
    Boolean dependencyModeOverride,
    @Size(max = 255, message = "name must be at most 255 characters") String name,
    TaskPriority priority) {

  public static InstantiateProjectRequest of(
      UUID templateId, UUID clientId, LocalDate startDate) {
    return new InstantiateProjectRequest(templateId, clientId, startDate, null, null, null, null);
  }
}
