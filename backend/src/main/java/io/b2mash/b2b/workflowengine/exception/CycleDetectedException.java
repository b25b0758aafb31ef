package io.b2mash.b2b.workflowengine.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when adding the edge "{@code taskId} depends on {@code dependsOnId}" would close a cycle
 * in the dependency graph. The graph is left unchanged.
 */
public class CycleDetectedException extends ErrorResponseException {

  private final UUID taskId;
  private final UUID dependsOnId;

  public CycleDetectedException(UUID taskId, UUID dependsOnId) {
    super(HttpStatus.CONFLICT, createProblem(taskId, dependsOnId), null);
    this.taskId = taskId;
    this.dependsOnId = dependsOnId;
  }

  public UUID getTaskId() {
    return taskId;
  }

  public UUID getDependsOnId() {
    return dependsOnId;
  }

  private static ProblemDetail createProblem(UUID taskId, UUID dependsOnId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Circular dependency");
    problem.setDetail(
        "Making " + taskId + " depend on " + dependsOnId + " would create a circular dependency");
    return problem;
  }
}
