package io.b2mash.secops.bridge.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidToolArgumentException.class)
  public ResponseEntity<ProblemDetail> handleInvalidArgument(
      InvalidToolArgumentException ex, HttpServletRequest request) {
    log.warn(
        "Invalid tool argument: path={}, argument={}, detail={}",
        request.getRequestURI(),
        ex.getArgument(),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ex.getBody());
  }

  @ExceptionHandler(ToolExecutionException.class)
  public ResponseEntity<ProblemDetail> handleToolExecution(
      ToolExecutionException ex, HttpServletRequest request) {
    log.error("Tool {} failed unexpectedly: {}", ex.getToolName(), ex.getMessage(), ex);
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Tool execution failed");
    problem.setDetail("Tool " + ex.getToolName() + " failed: " + ex.getCause().getMessage());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }
}
