package io.b2mash.b2b.workflowengine.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when a template that already has instantiated projects is deleted or has its task list
 * replaced. Projects keep pointing at their template tasks, so those rows must not change.
 */
public class TemplateInUseException extends ErrorResponseException {

  private final UUID templateId;

  public TemplateInUseException(UUID templateId, String detail) {
    super(HttpStatus.CONFLICT, createProblem(templateId, detail), null);
    this.templateId = templateId;
  }

  public UUID getTemplateId() {
    return templateId;
  }

  private static ProblemDetail createProblem(UUID templateId, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Template in use");
    problem.setDetail("Template " + templateId + " has instantiated projects. " + detail);
    problem.setProperty("templateId", templateId);
    return problem;
  }
}
