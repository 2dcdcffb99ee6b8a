package com.portfoliosync.integration.venues;

import com.portfoliosync.integration.venues.auth.TokenUpdateListener;
import com.portfoliosync.integration.venues.config.VenueConfig;

@FunctionalInterface
public interface VenueAdapterFactory {
  VenueAdapter create(VenueConfig config, VenueSupport support, TokenUpdateListener tokenListener);
}
