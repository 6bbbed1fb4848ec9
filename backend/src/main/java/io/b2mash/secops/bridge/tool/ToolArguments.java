package io.b2mash.secops.bridge.tool;

import io.b2mash.secops.bridge.exception.InvalidToolArgumentException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Typed, validated access to the JSON object a tool was called with. Absent and null arguments
 * are treated alike.
 */
public final class ToolArguments {

  private final Map<String, Object> values;

  public ToolArguments(Map<String, Object> values) {
    this.values = values != null ? values : Map.of();
  }

  public static ToolArguments of(Map<String, Object> values) {
    return new ToolArguments(values);
  }

  public String optionalString(String name) {
    Object value = values.get(name);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw new InvalidToolArgumentException(name, "must be a string");
    }
    return text;
  }

  public String string(String name, String defaultValue) {
    String value = optionalString(name);
    return value != null ? value : defaultValue;
  }

  public String requiredString(String name) {
    String value = optionalString(name);
    if (value == null || value.isBlank()) {
      throw new InvalidToolArgumentException(name, "is required");
    }
    return value;
  }

  public Integer optionalInt(String name) {
    Object value = values.get(name);
    if (value == null) {
      return null;
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      long number = ((Number) value).longValue();
      if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
        throw new InvalidToolArgumentException(name, "is out of range");
      }
      return (int) number;
    }
    if (value instanceof String text) {
      try {
        return Integer.parseInt(text.strip());
      } catch (NumberFormatException e) {
        throw new InvalidToolArgumentException(name, "must be an integer");
      }
    }
    throw new InvalidToolArgumentException(name, "must be an integer");
  }

  /**
   * Integer argument bounded to {@code [min, max]}; {@code defaultValue} (may be null) when
   * absent.
   */
  public Integer intInRange(String name, Integer defaultValue, int min, int max) {
    Integer value = optionalInt(name);
    if (value == null) {
      return defaultValue;
    }
    if (value < min || value > max) {
      throw new InvalidToolArgumentException(
          name, "must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  public boolean bool(String name, boolean defaultValue) {
    Object value = values.get(name);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean flag) {
      return flag;
    }
    if (value instanceof String text
        && (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false"))) {
      return Boolean.parseBoolean(text);
    }
    throw new InvalidToolArgumentException(name, "must be a boolean");
  }

  /** List of strings, empty when absent; a single string is accepted as a one-element list. */
  public List<String> stringList(String name) {
    Object value = values.get(name);
    List<String> result = new ArrayList<>();
    if (value instanceof String text) {
      if (!text.isBlank()) {
        result.add(text);
      }
    } else if (value instanceof Collection<?> items) {
      for (Object item : items) {
        if (!(item instanceof String text) || text.isBlank()) {
          throw new InvalidToolArgumentException(name, "must contain only non-empty strings");
        }
        result.add(text);
      }
    } else if (value != null) {
      throw new InvalidToolArgumentException(name, "must be a list of strings");
    }
    return List.copyOf(result);
  }

  public List<String> requiredStringList(String name) {
    List<String> result = stringList(name);
    if (result.isEmpty()) {
      throw new InvalidToolArgumentException(name, "requires at least one value");
    }
    return result;
  }

  /** Restricts a string argument to a fixed set of values. */
  public String oneOf(String name, String defaultValue, Collection<String> allowed) {
    String value = string(name, defaultValue);
    if (value != null && !allowed.contains(value)) {
      throw new InvalidToolArgumentException(name, "must be one of " + allowed);
    }
    return value;
  }
}
