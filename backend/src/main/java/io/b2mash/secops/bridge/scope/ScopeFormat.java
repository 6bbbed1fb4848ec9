package io.b2mash.secops.bridge.scope;

/** Validates the {@code Resource:permission} shape of a scope string. */
public final class ScopeFormat {

  private ScopeFormat() {}

  public static boolean isValid(String scope) {
    if (scope == null || scope.isEmpty() || !scope.equals(scope.strip())) {
      return false;
    }
    int colon = scope.indexOf(':');
    if (colon < 0 || colon != scope.lastIndexOf(':')) {
      return false;
    }
    String resource = scope.substring(0, colon);
    String permission = scope.substring(colon + 1);
    return !resource.isEmpty()
        && !permission.isEmpty()
        && resource.equals(resource.strip())
        && permission.equals(permission.strip());
  }
}
