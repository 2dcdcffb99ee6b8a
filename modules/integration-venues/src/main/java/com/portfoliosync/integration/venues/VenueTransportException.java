package com.portfoliosync.integration.venues;

/** Connection failures and timeouts: the request never produced an HTTP status. */
public class VenueTransportException extends VenueException {
  public VenueTransportException(Venue venue, String message, Throwable cause) {
    super(venue, message, cause);
  }

  @Override
  public boolean isTransient() {
    return true;
  }
}
