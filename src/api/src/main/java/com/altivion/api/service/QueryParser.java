package com.altivion.api.service;

import com.altivion.api.api.BadRequestException;
import com.altivion.api.model.LenientInstantDeserializer;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Utility class for parsing and validating read endpoint query parameters.
 */
public final class QueryParser {

  private QueryParser() {}

  /**
   * Parses a trailing window expressed in minutes.
   *
   * @param name parameter name used in error messages
   * @param raw raw query value
   * @param defaultMinutes value used when absent
   * @param maxMinutes hard upper bound
   * @return validated window in minutes
   */
  public static int parseMinutes(String name, String raw, int defaultMinutes, int maxMinutes) {
    if (raw == null || raw.isBlank()) {
      return defaultMinutes;
    }
    int parsed = parsePositiveInt(name, raw);
    if (parsed > maxMinutes) {
      throw new BadRequestException(name + " must be <= " + maxMinutes);
    }
    return parsed;
  }

  /**
   * Parses and clamps a total row cap.
   *
   * @param raw raw {@code max_points} query value
   * @param defaultLimit default value when absent
   * @param maxLimit hard upper bound
   * @return effective limit
   */
  public static int parseMaxPoints(String raw, int defaultLimit, int maxLimit) {
    if (raw == null || raw.isBlank()) {
      return Math.min(defaultLimit, maxLimit);
    }
    return Math.min(parsePositiveInt("max_points", raw), maxLimit);
  }

  /**
   * Parses a required latitude or longitude.
   *
   * @param name parameter name used in error messages
   * @param raw raw query value
   * @return parsed coordinate
   */
  public static double parseCoordinate(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new BadRequestException(name + " is required");
    }
    double value;
    try {
      value = Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new BadRequestException(name + " must be numeric");
    }
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new BadRequestException(name + " must be finite");
    }
    return value;
  }

  /**
   * Parses a required instant from ISO-8601 (offset optional, UTC assumed) or epoch.
   *
   * @param name parameter name used in error messages
   * @param raw raw query value
   * @return parsed instant
   */
  public static Instant parseTimestamp(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new BadRequestException(name + " is required");
    }

    try {
      return LenientInstantDeserializer.parse(raw);
    } catch (DateTimeParseException ex) {
      throw new BadRequestException(name + " must be ISO8601 or epoch seconds/ms");
    }
  }

  /**
   * Normalizes an optional string filter.
   *
   * @param raw raw query value
   * @return trimmed value or {@code null} when blank
   */
  public static String optionalText(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    return raw.trim();
  }

  private static int parsePositiveInt(String name, String raw) {
    try {
      int parsed = Integer.parseInt(raw.trim());
      if (parsed <= 0) {
        throw new BadRequestException(name + " must be > 0");
      }
      return parsed;
    } catch (NumberFormatException ex) {
      throw new BadRequestException(name + " must be an integer");
    }
  }
}
