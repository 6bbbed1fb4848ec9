package io.b2mash.secops.bridge.tool;

/** A registered text resource. */
public record ResourceDescriptor(
    String uri, String name, String module, String description, String text) {}
