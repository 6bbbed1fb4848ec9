package io.b2mash.secops.bridge.tool;

/** A group of tools over one platform API area. */
public interface ToolModule {

  void registerTools(ToolRegistrar registrar);

  /** Text resources (filter guides) published alongside the tools. */
  default void registerResources(ToolRegistrar registrar) {}
}
