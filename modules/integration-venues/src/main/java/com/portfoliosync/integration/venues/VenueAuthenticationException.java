package com.portfoliosync.integration.venues;

public class VenueAuthenticationException extends VenueException {
  public VenueAuthenticationException(Venue venue, String message) {
    super(venue, message);
  }

  public VenueAuthenticationException(Venue venue, String message, Throwable cause) {
    super(venue, message, cause);
  }
}
