package com.portfoliosync.worker.config;

import com.portfoliosync.domain.ledger.ActivityNormalizer;
import com.portfoliosync.domain.ledger.AssetCatalog;
import com.portfoliosync.domain.ledger.DedupeKeyGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LedgerConfiguration {

  @Bean
  public DedupeKeyGenerator dedupeKeyGenerator() {
    return new DedupeKeyGenerator();
  }

  @Bean
  public ActivityNormalizer activityNormalizer(
      AssetCatalog assetCatalog, DedupeKeyGenerator dedupeKeyGenerator) {
    return new ActivityNormalizer(assetCatalog, dedupeKeyGenerator);
  }
}
