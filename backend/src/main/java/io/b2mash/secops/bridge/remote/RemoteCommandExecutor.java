package io.b2mash.secops.bridge.remote;

/**
 * Issues a named remote operation and returns the raw platform response. Implementations must be
 * safe to share across concurrent tool calls.
 */
public interface RemoteCommandExecutor {

  RemoteResponse execute(String operation, RemoteRequest request);
}
