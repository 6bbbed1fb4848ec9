package io.b2mash.secops.bridge.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvalidToolArgumentException extends ErrorResponseException {

  private final String argument;

  public InvalidToolArgumentException(String argument, String reason) {
    super(HttpStatus.BAD_REQUEST, createProblem(argument, reason), null);
    this.argument = argument;
  }

  public String getArgument() {
    return argument;
  }

  private static ProblemDetail createProblem(String argument, String reason) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid tool argument");
    problem.setDetail(argument + ": " + reason);
    problem.setProperty("argument", argument);
    return problem;
  }
}
