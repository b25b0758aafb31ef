package io.b2mash.b2b.workflowengine.exception;

import java.net.URI;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A workflow operation that the current state of a task, project or template does not allow,
 * e.g. generating occurrences from a recurring instance or moving a project to a Kanban column
 * its workflow does not have. Thrown before anything is written.
 */
public class InvalidStateException extends ErrorResponseException {

  public static final URI PROBLEM_TYPE = URI.create("urn:workflow-engine:invalid-state");

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setType(PROBLEM_TYPE);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
