package com.portfoliosync.integration.venues;

public class VenueException extends RuntimeException {
  private final Venue venue;

  public VenueException(Venue venue, String message) {
    super(message);
    this.venue = venue;
  }

  public VenueException(Venue venue, String message, Throwable cause) {
    super(message, cause);
    this.venue = venue;
  }

  public Venue venue() {
    return venue;
  }

  /** Whether repeating the same call later may succeed without any change on our side. */
  public boolean isTransient() {
    return false;
  }
}
