package com.portfoliosync.integration.venues;

import com.portfoliosync.integration.venues.auth.TokenUpdateListener;
import com.portfoliosync.integration.venues.bcs.BcsAdapter;
import com.portfoliosync.integration.venues.binance.BinanceAdapter;
import com.portfoliosync.integration.venues.bybit.BybitAdapter;
import com.portfoliosync.integration.venues.config.BcsConfig;
import com.portfoliosync.integration.venues.config.BinanceConfig;
import com.portfoliosync.integration.venues.config.BybitConfig;
import com.portfoliosync.integration.venues.config.FinamConfig;
import com.portfoliosync.integration.venues.config.OkxConfig;
import com.portfoliosync.integration.venues.config.TBankConfig;
import com.portfoliosync.integration.venues.config.TonConfig;
import com.portfoliosync.integration.venues.config.VenueConfig;
import com.portfoliosync.integration.venues.finam.FinamAdapter;
import com.portfoliosync.integration.venues.okx.OkxAdapter;
import com.portfoliosync.integration.venues.tbank.TBankAdapter;
import com.portfoliosync.integration.venues.ton.TonAdapter;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/** Maps each venue to the factory of its adapter. */
public class VenueAdapterRegistry {
  private final Map<Venue, VenueAdapterFactory> factories;
  private final VenueSupport support;

  public VenueAdapterRegistry(VenueSupport support) {
    this(support, defaultFactories());
  }

  public VenueAdapterRegistry(VenueSupport support, Map<Venue, VenueAdapterFactory> factories) {
    this.support = Objects.requireNonNull(support, "support must not be null");
    this.factories = Map.copyOf(factories);
  }

  public static Map<Venue, VenueAdapterFactory> defaultFactories() {
    Map<Venue, VenueAdapterFactory> factories = new EnumMap<>(Venue.class);
    factories.put(Venue.BINANCE, (config, support, tokens) -> new BinanceAdapter((BinanceConfig) config, support));
    factories.put(Venue.BYBIT, (config, support, tokens) -> new BybitAdapter((BybitConfig) config, support));
    factories.put(Venue.OKX, (config, support, tokens) -> new OkxAdapter((OkxConfig) config, support));
    factories.put(Venue.TBANK, (config, support, tokens) -> new TBankAdapter((TBankConfig) config, support));
    factories.put(Venue.BCS, (config, support, tokens) -> new BcsAdapter((BcsConfig) config, support, tokens));
    factories.put(Venue.FINAM, (config, support, tokens) -> new FinamAdapter((FinamConfig) config, support));
    factories.put(Venue.TON, (config, support, tokens) -> new TonAdapter((TonConfig) config, support));
    return factories;
  }

  public boolean supports(Venue venue) {
    return factories.containsKey(venue);
  }

  public VenueAdapter create(VenueConfig config, TokenUpdateListener tokenListener) {
    VenueAdapterFactory factory = factories.get(config.venue());
    if (factory == null) {
      throw new VenueConfigurationException(config.venue(), "No adapter registered for venue " + config.venue().code());
    }
    return factory.create(config, support, tokenListener == null ? TokenUpdateListener.NONE : tokenListener);
  }
}
