package io.b2mash.secops.bridge.tool;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a tool module. The {@link ToolRegistry} discovers beans annotated with
 * this at startup and registers the tools they declare.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface ToolModuleComponent {
  /** Module name used by {@code secops.bridge.enabled-modules} (e.g., "detections", "ngsiem"). */
  String name();
}
