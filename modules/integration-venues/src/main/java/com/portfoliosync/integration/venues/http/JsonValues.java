package com.portfoliosync.integration.venues.http;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Lenient readers for the loosely typed JSON the venues return. */
public final class JsonValues {
  private static final long SECONDS_THRESHOLD = 100_000_000_000L;
  private static final BigDecimal NANOS = BigDecimal.valueOf(1_000_000_000L);

  private JsonValues() {}

  public static String text(JsonNode node, String... fields) {
    if (node == null) {
      return null;
    }
    for (String field : fields) {
      JsonNode value = node.get(field);
      if (value != null && !value.isNull() && value.isValueNode()) {
        String text = value.asText().trim();
        if (!text.isEmpty()) {
          return text;
        }
      }
    }
    return null;
  }

  public static String upper(String value) {
    return value == null || value.isBlank() ? null : value.trim().toUpperCase(Locale.ROOT);
  }

  public static BigDecimal decimal(JsonNode node, String... fields) {
    if (node == null) {
      return null;
    }
    for (String field : fields) {
      BigDecimal value = decimal(node.get(field));
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  /**
   * Reads numbers, numeric strings, {@code {"value": ...}} wrappers and {@code {"units", "nano"}}
   * money/quotation objects.
   */
  public static BigDecimal decimal(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return null;
    }
    if (value.isNumber()) {
      return value.decimalValue();
    }
    if (value.isTextual()) {
      String text = value.asText().trim();
      if (text.isEmpty()) {
        return null;
      }
      try {
        return new BigDecimal(text);
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    if (value.isObject()) {
      if (value.has("units") || value.has("nano") || value.has("nanos")) {
        return quotation(value);
      }
      if (value.has("value")) {
        return decimal(value.get("value"));
      }
    }
    return null;
  }

  public static BigDecimal quotation(JsonNode value) {
    BigDecimal units = decimal(value.get("units"));
    BigDecimal nano = decimal(value.has("nano") ? value.get("nano") : value.get("nanos"));
    if (units == null && nano == null) {
      return null;
    }
    BigDecimal whole = units == null ? BigDecimal.ZERO : units;
    BigDecimal fraction = nano == null ? BigDecimal.ZERO : nano.divide(NANOS);
    return whole.add(fraction).stripTrailingZeros();
  }

  public static BigDecimal scaled(BigDecimal raw, int decimals) {
    return raw == null ? null : raw.movePointLeft(decimals).stripTrailingZeros();
  }

  public static BigDecimal abs(BigDecimal value) {
    return value == null ? null : value.abs();
  }

  public static Instant instant(JsonNode node, String... fields) {
    if (node == null) {
      return null;
    }
    for (String field : fields) {
      Instant value = instant(node.get(field));
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  /** Epoch seconds or milliseconds (numeric or string), or ISO-8601 with UTC assumed. */
  public static Instant instant(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return null;
    }
    if (value.isNumber()) {
      return fromEpoch(value.asLong());
    }
    if (!value.isTextual()) {
      return null;
    }
    return parseInstant(value.asText());
  }

  public static Instant parseInstant(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    String candidate = text.trim();
    if (candidate.chars().allMatch(Character::isDigit)) {
      try {
        return fromEpoch(Long.parseLong(candidate));
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    try {
      return OffsetDateTime.parse(candidate).toInstant();
    } catch (DateTimeParseException ignored) {
      // fall through to zone-less forms
    }
    try {
      return LocalDateTime.parse(candidate.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException ignored) {
      // fall through to a plain date
    }
    try {
      return LocalDate.parse(candidate).atStartOfDay(ZoneOffset.UTC).toInstant();
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  public static JsonNode firstArray(JsonNode node, String... fields) {
    if (node == null) {
      return null;
    }
    for (String field : fields) {
      JsonNode value = node.get(field);
      if (value != null && value.isArray()) {
        return value;
      }
    }
    return null;
  }

  public static List<JsonNode> elements(JsonNode array) {
    List<JsonNode> items = new ArrayList<>();
    if (array != null && array.isArray()) {
      array.forEach(items::add);
    }
    return items;
  }

  private static Instant fromEpoch(long value) {
    return Math.abs(value) < SECONDS_THRESHOLD ? Instant.ofEpochSecond(value) : Instant.ofEpochMilli(value);
  }
}
