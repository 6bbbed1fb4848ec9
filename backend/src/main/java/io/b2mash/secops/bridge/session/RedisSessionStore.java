package io.b2mash.secops.bridge.session;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis-backed session store for multi-instance deployments. Each session is a hash under {@code
 * mcp:session:<id>}; Redis key expiry removes idle sessions, so {@link #sweepExpired} has nothing
 * to do.
 */
@Component
@ConditionalOnProperty(name = "secops.session.store", havingValue = "redis")
public class RedisSessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

  static final String KEY_PREFIX = "mcp:session:";

  private static final String CREATED_AT = "created_at";
  private static final String LAST_ACTIVITY = "last_activity";
  private static final String TOOL_CALLS = "tool_calls";

  private final StringRedisTemplate redisTemplate;
  private final Duration ttl;

  public RedisSessionStore(StringRedisTemplate redisTemplate, SessionProperties properties) {
    this.redisTemplate = redisTemplate;
    this.ttl = properties.idleTimeout();
    log.info("Initialized Redis session store with TTL={}", ttl);
  }

  @Override
  public Optional<ToolSession> get(String sessionId) {
    Map<Object, Object> fields = redisTemplate.opsForHash().entries(key(sessionId));
    if (fields == null || fields.isEmpty()) {
      return Optional.empty();
    }
    var createdAt = fields.get(CREATED_AT);
    var lastActivity = fields.get(LAST_ACTIVITY);
    var toolCalls = fields.get(TOOL_CALLS);
    if (createdAt == null || lastActivity == null || toolCalls == null) {
      return discard(sessionId, "missing fields " + fields.keySet());
    }
    try {
      return Optional.of(
          new ToolSession(
              sessionId,
              Instant.parse(createdAt.toString()),
              Instant.parse(lastActivity.toString()),
              Long.parseLong(toolCalls.toString())));
    } catch (DateTimeParseException | NumberFormatException e) {
      return discard(sessionId, e.getMessage());
    }
  }

  private Optional<ToolSession> discard(String sessionId, String reason) {
    log.error("Discarding malformed session {}: {}", sessionId, reason);
    delete(sessionId);
    return Optional.empty();
  }

  @Override
  public void set(ToolSession session) {
    var fields = new LinkedHashMap<String, String>();
    fields.put(CREATED_AT, session.createdAt().toString());
    fields.put(LAST_ACTIVITY, session.lastActivity().toString());
    fields.put(TOOL_CALLS, Long.toString(session.toolCalls()));
    var key = key(session.id());
    redisTemplate.opsForHash().putAll(key, fields);
    redisTemplate.expire(key, ttl);
  }

  /**
   * Field-level updates only: {@code HINCRBY} counts the call, so concurrent calls from several
   * instances never overwrite each other.
   */
  @Override
  public ToolSession recordCall(String sessionId, Instant now) {
    var key = key(sessionId);
    var hash = redisTemplate.opsForHash();
    hash.putIfAbsent(key, CREATED_AT, now.toString());
    hash.put(key, LAST_ACTIVITY, now.toString());
    Long toolCalls = hash.increment(key, TOOL_CALLS, 1L);
    redisTemplate.expire(key, ttl);

    Object createdAt = hash.get(key, CREATED_AT);
    Instant created = now;
    if (createdAt != null) {
      try {
        created = Instant.parse(createdAt.toString());
      } catch (DateTimeParseException e) {
        log.warn("Session {} has malformed {}: {}", sessionId, CREATED_AT, createdAt);
      }
    }
    return new ToolSession(sessionId, created, now, toolCalls != null ? toolCalls : 1L);
  }

  @Override
  public boolean delete(String sessionId) {
    return Boolean.TRUE.equals(redisTemplate.delete(key(sessionId)));
  }

  @Override
  public int sweepExpired(Duration maxIdle) {
    return 0;
  }

  private static String key(String sessionId) {
    return KEY_PREFIX + sessionId;
  }
}
