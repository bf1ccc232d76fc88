package com.altivion.api.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Reads report timestamps the way sensors send them: ISO-8601 with or without an offset
 * (UTC assumed when absent), or epoch seconds/milliseconds.
 */
public class LenientInstantDeserializer extends StdScalarDeserializer<Instant> {
  private static final long EPOCH_MILLIS_THRESHOLD = 10_000_000_000L;

  public LenientInstantDeserializer() {
    super(Instant.class);
  }

  @Override
  public Instant deserialize(JsonParser parser, DeserializationContext context) throws IOException {
    JsonToken token = parser.currentToken();
    if (token == JsonToken.VALUE_NUMBER_INT) {
      return fromEpoch(parser.getLongValue());
    }
    if (token == JsonToken.VALUE_STRING) {
      String text = parser.getText();
      try {
        return parse(text);
      } catch (DateTimeParseException ex) {
        return (Instant) context.handleWeirdStringValue(
            Instant.class, text, "expected ISO-8601 date-time or epoch seconds/ms");
      }
    }
    return (Instant) context.handleUnexpectedToken(Instant.class, parser);
  }

  /**
   * Parses an ISO-8601 date-time (offset optional, UTC assumed) or an epoch value.
   *
   * @param raw non-blank text
   * @return parsed instant
   * @throws DateTimeParseException when the text is neither form
   */
  public static Instant parse(String raw) {
    String value = raw.trim();
    if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
      try {
        return fromEpoch(Long.parseLong(value));
      } catch (NumberFormatException ex) {
        throw new DateTimeParseException("epoch value out of range", value, 0, ex);
      }
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException ignored) {
      // no offset, fall through to local date-time
    }
    return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
  }

  private static Instant fromEpoch(long epoch) {
    return epoch > EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
  }
}
