package com.portfoliosync.integration.venues;

public class VenueConfigurationException extends VenueException {
  public VenueConfigurationException(Venue venue, String message) {
    super(venue, message);
  }
}
