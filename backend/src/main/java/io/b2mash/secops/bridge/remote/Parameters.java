package io.b2mash.secops.bridge.remote;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Parameter preparation shared by every outbound call. */
public final class Parameters {

  private Parameters() {}

  /**
   * Returns an insertion-ordered copy of {@code params} with null-valued entries removed. A null
   * map yields an empty map.
   */
  public static Map<String, Object> prepare(Map<String, ?> params) {
    if (params == null || params.isEmpty()) {
      return Map.of();
    }
    var prepared = new LinkedHashMap<String, Object>();
    params.forEach(
        (key, value) -> {
          if (value != null) {
            prepared.put(key, value);
          }
        });
    return Collections.unmodifiableMap(prepared);
  }

  /** Builds an ordered map from alternating key/value pairs. Values may be null. */
  public static Map<String, Object> of(Object... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("Parameters must be given as key/value pairs");
    }
    var map = new LinkedHashMap<String, Object>();
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put((String) keyValues[i], keyValues[i + 1]);
    }
    return map;
  }
}
