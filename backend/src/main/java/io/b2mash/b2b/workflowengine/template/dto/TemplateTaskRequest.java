package io.b2mash.b2b.workflowengine.template.dto;

import io.b2mash.b2b.workflowengine.task.TaskPriority;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * One template task. Its position is its index in the enclosing list (1-based).
 *
 * @param dependsOnPositions positions of other tasks in the same list this task depends on
 */
public record TemplateTaskRequest(
    @NotBlank(message = "title is required")
        @Size(max = 200, message = "title must be at most 200 characters")
        String title,
    @Size(max = 2000, message = "description must be at most 2000 characters") String description,
    @PositiveOrZero(message = "daysFromStart must not be negative") Integer daysFromStart,
    @Size(max = 100, message = "recurrenceRule must be at most 100 characters")
        String recurrenceRule,
    @DecimalMin(value = "0.0", message = "estimatedHours must not be negative")
        BigDecimal estimatedHours,
    TaskPriority defaultPriority,
    UUID defaultAssigneeId,
    List<Integer> dependsOnPositions) {

  public static TemplateTaskRequest offset(String title, int daysFromStart) {
    return new TemplateTaskRequest(
        title, null, daysFromStart, null, null, null, null, List.of());
  }

  public static TemplateTaskRequest recurring(String title, String recurrenceRule) {
    return new TemplateTaskRequest(
        title, null, null, recurrenceRule, null, null, null, List.of());
  }

  public TemplateTaskRequest dependingOn(Integer... positions) {
    return new TemplateTaskRequest(
        title,
        description,
        daysFromStart,
        recurrenceRule,
        estimatedHours,
        defaultPriority,
        defaultAssigneeId,
        List.of(positions));
  }
}
