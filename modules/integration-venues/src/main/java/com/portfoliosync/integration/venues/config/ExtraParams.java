package com.portfoliosync.integration.venues.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueConfigurationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Typed access to an integration's free-form {@code extra_params} object. */
final class ExtraParams {
  private final Venue venue;
  private final JsonNode node;

  ExtraParams(Venue venue, JsonNode node) {
    this.venue = venue;
    this.node = node == null || node.isNull() ? MissingNode.getInstance() : node;
  }

  Optional<String> string(String key) {
    JsonNode value = node.get(key);
    if (value == null || value.isNull() || !value.isValueNode()) {
      return Optional.empty();
    }
    String text = value.asText().trim();
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  boolean bool(String key, boolean defaultValue) {
    JsonNode value = node.get(key);
    if (value == null || value.isNull()) {
      return defaultValue;
    }
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    String text = value.asText().trim().toLowerCase(Locale.ROOT);
    return switch (text) {
      case "true", "1", "yes", "on" -> true;
      case "false", "0", "no", "off", "" -> false;
      default -> throw invalid(key, "must be a boolean");
    };
  }

  long positiveLong(String key, long defaultValue) {
    JsonNode value = node.get(key);
    if (value == null || value.isNull()) {
      return defaultValue;
    }
    long parsed;
    if (value.isIntegralNumber()) {
      parsed = value.longValue();
    } else {
      try {
        parsed = Long.parseLong(value.asText().trim());
      } catch (NumberFormatException ex) {
        throw invalid(key, "must be an integer");
      }
    }
    if (parsed <= 0) {
      throw invalid(key, "must be > 0");
    }
    return parsed;
  }

  Duration seconds(String key, Duration defaultValue) {
    JsonNode value = node.get(key);
    if (value == null || value.isNull()) {
      return defaultValue;
    }
    double seconds;
    if (value.isNumber()) {
      seconds = value.doubleValue();
    } else {
      try {
        seconds = Double.parseDouble(value.asText().trim());
      } catch (NumberFormatException ex) {
        throw invalid(key, "must be a number of seconds");
      }
    }
    if (!(seconds > 0.0d)) {
      throw invalid(key, "must be > 0");
    }
    return Duration.ofMillis(Math.round(seconds * 1000.0d));
  }

  /** Accepts a JSON array or a comma-separated string. Items are trimmed; blanks dropped. */
  List<String> list(String key) {
    JsonNode value = node.get(key);
    List<String> items = new ArrayList<>();
    if (value == null || value.isNull()) {
      return items;
    }
    if (value.isArray()) {
      value.forEach(item -> items.add(item.asText()));
    } else if (value.isTextual()) {
      items.addAll(Arrays.asList(value.asText().split(",")));
    } else {
      throw invalid(key, "must be a list or comma-separated string");
    }
    return items.stream().map(String::trim).filter(item -> !item.isEmpty()).toList();
  }

  List<String> upperList(String key, List<String> defaultValue) {
    List<String> items = list(key).stream().map(item -> item.toUpperCase(Locale.ROOT)).toList();
    return items.isEmpty() ? defaultValue : items;
  }

  Optional<URI> uri(String key) {
    Optional<String> value = string(key);
    if (value.isEmpty()) {
      return Optional.empty();
    }
    try {
      URI uri = new URI(value.get());
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw invalid(key, "must be an absolute URL");
      }
      return Optional.of(uri);
    } catch (URISyntaxException ex) {
      throw invalid(key, "must be a valid URL");
    }
  }

  double rateLimit(String key, double defaultValue) {
    JsonNode limits = node.get("rate_limits");
    if (limits == null || !limits.isObject() || !limits.has(key)) {
      return defaultValue;
    }
    double value = limits.get(key).asDouble(-1.0d);
    if (!(value > 0.0d)) {
      throw invalid("rate_limits." + key, "must be > 0");
    }
    return value;
  }

  JsonNode node(String key) {
    return node.path(key);
  }

  VenueConfigurationException invalid(String key, String problem) {
    return new VenueConfigurationException(venue, venue.code() + " option " + key + " " + problem);
  }
}
