package io.b2mash.secops.bridge.tool;

/** Registration callback handed to each {@link ToolModule}. */
public interface ToolRegistrar {

  /** Registers a tool; the registry adds the configured name prefix. */
  void addTool(String name, String description, ToolHandler handler);

  void addResource(String uri, String name, String description, String text);
}
