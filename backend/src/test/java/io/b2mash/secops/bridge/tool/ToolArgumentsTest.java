package io.b2mash.secops.bridge.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.secops.bridge.exception.InvalidToolArgumentException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolArgumentsTest {

  @Test
  void missingAndNullArgumentsFallBackToDefaults() {
    var values = new HashMap<String, Object>();
    values.put("limit", null);
    var args = ToolArguments.of(values);

    assertThat(args.intInRange("limit", 10, 1, 100)).isEqualTo(10);
    assertThat(args.string("sort", "created_timestamp.desc")).isEqualTo("created_timestamp.desc");
    assertThat(args.bool("include_hidden", true)).isTrue();
    assertThat(args.stringList("ids")).isEmpty();
  }

  @Test
  void acceptsNumericStringsAndLongs() {
    var args = ToolArguments.of(Map.of("limit", "25", "offset", 5L));

    assertThat(args.optionalInt("limit")).isEqualTo(25);
    assertThat(args.optionalInt("offset")).isEqualTo(5);
  }

  @Test
  void rejectsLimitOutsideRange() {
    var args = ToolArguments.of(Map.of("limit", 10000));

    assertThatThrownBy(() -> args.intInRange("limit", 10, 1, 9999))
        .isInstanceOf(InvalidToolArgumentException.class)
        .hasMessageContaining("must be between 1 and 9999 (was 10000)");
  }

  @Test
  void rejectsNonIntegerValues() {
    assertThatThrownBy(() -> ToolArguments.of(Map.of("limit", 1.5)).optionalInt("limit"))
        .isInstanceOf(InvalidToolArgumentException.class)
        .hasMessageContaining("must be an integer");
    assertThatThrownBy(() -> ToolArguments.of(Map.of("limit", "ten")).optionalInt("limit"))
        .isInstanceOf(InvalidToolArgumentException.class)
        .hasMessageContaining("must be an integer");
    assertThatThrownBy(
            () -> ToolArguments.of(Map.of("limit", Long.MAX_VALUE)).optionalInt("limit"))
        .isInstanceOf(InvalidToolArgumentException.class)
        .hasMessageContaining("is out of range");
  }

  @Test
  void requiredStringRejectsBlank() {
    var args = ToolArguments.of(Map.of("query_string", "  "));

    assertThatThrownBy(() -> args.requiredString("query_string"))
        .isInstanceOf(InvalidToolArgumentException.class)
        .hasMessageContaining("is required");
  }

  @Test
  void stringListAcceptsSingleStringAndLists() {
    assertThat(ToolArguments.of(Map.of("ids", "abc")).stringList("ids")).containsExactly("abc");
    assertThat(ToolArguments.of(Map.of("ids", List.of("a", "b"))).stringList("ids"))
        .containsExactly("a", "b");
  }

  @Test
  void stringListRejectsBlankOrNonStringItems() {
    assertThatThrownBy(
            () -> ToolArguments.of(Map.of("ids", Arrays.asList("a", ""))).stringList("ids"))
        .isInstanceOf(InvalidToolArgumentException.class)
        .hasMessageContaining("must contain only non-empty strings");
    assertThatThrownBy(() -> ToolArguments.of(Map.of("ids", 42)).stringList("ids"))
        .isInstanceOf(InvalidToolArgumentException.class)
        .hasMessageContaining("must be a list of strings");
  }

  @Test
  void requiredStringListNeedsAValue() {
    assertThatThrownBy(() -> ToolArguments.of(Map.of("ids", List.of())).requiredStringList("ids"))
        .isInstanceOf(InvalidToolArgumentException.class)
        .hasMessageContaining("requires at least one value");
  }

  @Test
  void oneOfRestrictsValues() {
    var args = ToolArguments.of(Map.of("format", "xml"));

    assertThatThrownBy(() -> args.oneOf("format", "json", List.of("json", "csv")))
        .isInstanceOf(InvalidToolArgumentException.class)
        .hasMessageContaining("must be one of [json, csv]");
    assertThat(ToolArguments.of(Map.of()).oneOf("format", "json", List.of("json", "csv")))
        .isEqualTo("json");
  }

  @Test
  void boolAcceptsStringForms() {
    assertThat(ToolArguments.of(Map.of("flag", "FALSE")).bool("flag", true)).isFalse();
    assertThatThrownBy(() -> ToolArguments.of(Map.of("flag", "yes")).bool("flag", true))
        .isInstanceOf(InvalidToolArgumentException.class);
  }
}
