package io.b2mash.b2b.workflowengine.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when a concurrent modification is detected while a stage cascade is being applied. The
 * whole cascade is rolled back; callers may reload and retry.
 */
public class StaleCascadeException extends ErrorResponseException {

  private final UUID projectId;

  public StaleCascadeException(UUID projectId, String detail) {
    this(projectId, detail, null);
  }

  public StaleCascadeException(UUID projectId, String detail, Throwable cause) {
    super(HttpStatus.CONFLICT, createProblem(projectId, detail), cause);
    this.projectId = projectId;
  }

  /** The project whose cascade was rolled back, or null for a standalone task. */
  public UUID getProjectId() {
    return projectId;
  }

  private static ProblemDetail createProblem(UUID projectId, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail(projectId != null ? "Project " + projectId + ": " + detail : detail);
    return problem;
  }
}
