package io.b2mash.secops.bridge.exception;

/** Unexpected failure inside a tool handler, as opposed to a remote error reported as a value. */
public class ToolExecutionException extends RuntimeException {

  private final String toolName;

  public ToolExecutionException(String toolName, RuntimeException cause) {
    super("Tool " + toolName + " failed", cause);
    this.toolName = toolName;
  }

  public String getToolName() {
    return toolName;
  }
}
