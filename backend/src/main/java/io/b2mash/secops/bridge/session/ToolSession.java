package io.b2mash.secops.bridge.session;

import java.time.Instant;

/**
 * Activity record for one agent session, keyed by the {@code Mcp-Session-Id} header.
 *
 * @param toolCalls number of tool invocations made under this session
 */
public record ToolSession(String id, Instant createdAt, Instant lastActivity, long toolCalls) {

  public static ToolSession start(String id, Instant now) {
    return new ToolSession(id, now, now, 0);
  }

  /** Copy with the activity timestamp moved to {@code now} and one more call counted. */
  public ToolSession recordCall(Instant now) {
    return new ToolSession(id, createdAt, now, toolCalls + 1);
  }
}
