package io.b2mash.secops.bridge.response;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class OperationErrorTest {

  @Test
  void toMap_omitsAbsentFields() {
    assertThat(OperationError.of("Something failed").toMap())
        .containsOnlyKeys("error")
        .containsEntry("error", "Something failed");
  }

  @Test
  void rejectsBlankMessage() {
    assertThatThrownBy(() -> OperationError.of(" ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsResolutionWithoutScopes() {
    assertThatThrownBy(() -> new OperationError("m", null, "op", List.of(), "grant scopes"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsScopesWithoutResolution() {
    assertThatThrownBy(() -> new OperationError("m", null, "op", List.of("Alerts:read"), null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void toListOutput_wrapsErrorInList() {
    var result = ApiResult.failure(OperationError.of("boom"));

    assertThat(result.toListOutput()).isEqualTo(List.of(OperationError.of("boom").toMap()));
  }
}
