package io.b2mash.secops.bridge.module;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.springframework.core.io.ClassPathResource;

/** Loads the filter-language guides bundled under {@code fql/} on the classpath. */
public final class FqlGuides {

  private static final String GUIDE_PATH = "fql/%s.md";

  private FqlGuides() {}

  /**
   * Returns the guide text for {@code name} (e.g. {@code "detections"}).
   *
   * @throws IllegalStateException if the guide is not on the classpath
   */
  public static String load(String name) {
    var path = GUIDE_PATH.formatted(name);
    try (InputStream is = new ClassPathResource(path).getInputStream()) {
      return new String(is.readAllBytes(), StandardCharsets.UTF_8).strip();
    } catch (IOException e) {
      throw new IllegalStateException("Missing FQL guide " + path, e);
    }
  }
}
