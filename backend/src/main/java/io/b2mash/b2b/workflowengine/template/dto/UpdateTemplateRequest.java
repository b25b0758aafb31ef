package io.b2mash.b2b.workflowengine.template.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Template update. A null {@code tasks} keeps the current task list; a non-null list replaces it
 * and recompiles the template.
 */
public record UpdateTemplateRequest(
    @NotBlank(message = "name is required")
        @Size(max = 120, message = "name must be at most 120 characters")
        String name,
    @Size(max = 2000, message = "description must be at most 2000 characters") String description,
    boolean taskDependencyMode,
    @Valid List<TemplateTaskRequest> tasks) {}
