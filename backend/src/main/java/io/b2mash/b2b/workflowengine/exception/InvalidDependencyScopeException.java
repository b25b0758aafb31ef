package io.b2mash.b2b.workflowengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Raised when a dependency would reference a task outside the owning firm or template. */
public class InvalidDependencyScopeException extends ErrorResponseException {

  public InvalidDependencyScopeException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid dependency scope");
    problem.setDetail(detail);
    return problem;
  }
}
