package com.portfoliosync.worker.connection;

import com.portfoliosync.domain.ledger.SourceType;
import com.portfoliosync.integration.venues.Venue;
import java.util.Optional;

/** Routes an exchange name to the sync queue of its venue category. */
public final class SourceQueues {
  private SourceQueues() {}

  public static Optional<SourceType> resolve(String exchangeName) {
    return Venue.fromExchangeName(exchangeName).map(SourceQueues::forVenue);
  }

  public static SourceType forVenue(Venue venue) {
    return switch (venue.kind()) {
      case CRYPTO_EXCHANGE -> SourceType.CRYPTO;
      case RU_BROKER -> SourceType.RU_BROKERS;
      case WALLET -> SourceType.TON;
    };
  }
}
