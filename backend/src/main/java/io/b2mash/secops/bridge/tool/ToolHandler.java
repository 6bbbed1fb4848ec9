package io.b2mash.secops.bridge.tool;

/** Executes one tool call. The returned value must be JSON-serializable. */
@FunctionalInterface
public interface ToolHandler {

  Object handle(ToolArguments arguments);
}
