package io.b2mash.b2b.workflowengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class UnknownRecurrenceRuleException extends ErrorResponseException {

  private final String rule;

  public UnknownRecurrenceRuleException(String rule) {
    super(HttpStatus.BAD_REQUEST, createProblem(rule), null);
    this.rule = rule;
  }

  public String getRule() {
    return rule;
  }

  private static ProblemDetail createProblem(String rule) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Unknown recurrence rule");
    problem.setDetail("Cannot compute a due date for recurrence rule '" + rule + "'");
    return problem;
  }
}
