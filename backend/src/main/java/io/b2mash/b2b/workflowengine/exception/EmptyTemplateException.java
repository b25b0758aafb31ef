package io.b2mash.b2b.workflowengine.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Raised when a template without tasks is compiled or instantiated. */
public class EmptyTemplateException extends ErrorResponseException {

  private final UUID templateId;

  public EmptyTemplateException(UUID templateId) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(templateId), null);
    this.templateId = templateId;
  }

  public UUID getTemplateId() {
    return templateId;
  }

  private static ProblemDetail createProblem(UUID templateId) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Template has no tasks");
    problem.setDetail("Template " + templateId + " has no tasks to build workflow stages from");
    return problem;
  }
}
