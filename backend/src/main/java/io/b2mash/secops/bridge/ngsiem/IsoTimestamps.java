package io.b2mash.secops.bridge.ngsiem;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/** Conversion of ISO 8601 timestamps to the epoch milliseconds the search API expects. */
public final class IsoTimestamps {

  private IsoTimestamps() {}

  /**
   * Converts {@code 2025-01-01T00:00:00Z} style input to Unix epoch milliseconds. A trailing
   * {@code Z} is read as {@code +00:00}; timestamps without an offset are taken as UTC and a bare
   * date means midnight UTC. Sub-millisecond digits are truncated.
   *
   * @throws DateTimeParseException if the input is not an ISO 8601 date-time
   */
  public static long toEpochMillis(String isoTimestamp) {
    if (isoTimestamp == null || isoTimestamp.isBlank()) {
      throw new DateTimeParseException("Timestamp is empty", String.valueOf(isoTimestamp), 0);
    }
    String normalized = isoTimestamp.strip();
    if (normalized.endsWith("Z")) {
      normalized = normalized.substring(0, normalized.length() - 1) + "+00:00";
    }
    if (normalized.indexOf('T') < 0) {
      return LocalDate.parse(normalized).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }
    try {
      return OffsetDateTime.parse(normalized).toInstant().toEpochMilli();
    } catch (DateTimeParseException e) {
      return LocalDateTime.parse(normalized).toInstant(ZoneOffset.UTC).toEpochMilli();
    }
  }
}
