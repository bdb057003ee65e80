package com.killradar.killfeed.parser;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Reads the event time from the field variants upstream has used over time.
 *
 * <p>Accepts ISO-8601 with an offset, naive ISO date-times (read as UTC), and epoch seconds or
 * milliseconds.
 */
public final class KillmailTimes {
  private static final List<String> ROOT_FIELDS = List.of("killmail_time", "kill_time", "killTime");
  private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

  private KillmailTimes() {}

  public static Optional<Instant> extract(JsonNode raw) {
    for (String field : ROOT_FIELDS) {
      Optional<Instant> parsed = parse(raw.path(field));
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    return parse(raw.path("zkb").path("time"));
  }

  static Optional<Instant> parse(JsonNode value) {
    if (value.isIntegralNumber()) {
      long epoch = value.asLong();
      return Optional.of(epoch > EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch));
    }
    if (!value.isTextual()) {
      return Optional.empty();
    }
    return parse(value.asText());
  }

  static Optional<Instant> parse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String normalized = text.trim().replace(' ', 'T');
    try {
      return Optional.of(OffsetDateTime.parse(normalized).toInstant());
    } catch (DateTimeParseException ignored) {
      // No offset; fall through to the naive form.
    }
    try {
      return Optional.of(LocalDateTime.parse(normalized).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }
}
