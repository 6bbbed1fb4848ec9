package io.b2mash.secops.bridge.tool;

/** A registered tool. {@code name} already carries the prefix. */
public record ToolDescriptor(String name, String module, String description, ToolHandler handler) {}
