package io.b2mash.secops.bridge.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ToolNotFoundException extends ErrorResponseException {

  public ToolNotFoundException(String toolName) {
    super(
        HttpStatus.NOT_FOUND,
        createProblem("Tool not found", "No tool registered with name " + toolName),
        null);
  }

  public static ToolNotFoundException forResource(String uri) {
    return new ToolNotFoundException(
        "Resource not found", "No resource registered with uri " + uri);
  }

  private ToolNotFoundException(String title, String detail) {
    super(HttpStatus.NOT_FOUND, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
