package com.portfoliosync.worker.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.config.IntegrationCredentials;
import java.util.Optional;

public record IntegrationRecord(
    long id,
    long portfolioId,
    long userId,
    String exchangeName,
    IntegrationCredentials credentials,
    JsonNode extraParams) {

  public Optional<Venue> venue() {
    return Venue.fromExchangeName(exchangeName);
  }
}
