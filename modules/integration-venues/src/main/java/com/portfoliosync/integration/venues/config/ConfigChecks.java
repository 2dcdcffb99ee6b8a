package com.portfoliosync.integration.venues.config;

import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueConfigurationException;
import java.time.Duration;

final class ConfigChecks {
  private ConfigChecks() {}

  static String require(Venue venue, String value, String name) {
    if (value == null || value.isBlank()) {
      throw new VenueConfigurationException(venue, venue.code() + " " + name + " is required");
    }
    return value.trim();
  }

  static <T> T requireValue(Venue venue, T value, String name) {
    if (value == null) {
      throw new VenueConfigurationException(venue, venue.code() + " " + name + " is required");
    }
    return value;
  }

  static void requirePositive(Venue venue, Duration value, String name) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new VenueConfigurationException(venue, venue.code() + " " + name + " must be > 0");
    }
  }

  static void requirePositive(Venue venue, double value, String name) {
    if (!(value > 0.0d)) {
      throw new VenueConfigurationException(venue, venue.code() + " " + name + " must be > 0");
    }
  }
}
