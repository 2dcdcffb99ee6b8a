package com.portfoliosync.worker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.integration.venues.VenueAdapterRegistry;
import com.portfoliosync.integration.venues.VenueRetrySettings;
import com.portfoliosync.integration.venues.VenueSupport;
import com.portfoliosync.integration.venues.config.VenueConfigParser;
import com.portfoliosync.integration.venues.http.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class VenueConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock syncClock() {
    return Clock.systemUTC();
  }

  /**
   * Adapter fan-out nests futures (snapshot parts, then per-symbol calls), so the pool grows past
   * its core size instead of queueing.
   */
  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean(name = "venueExecutor")
  public ExecutorService venueExecutor(VenueProperties properties) {
    ThreadPoolExecutor executor =
        new ThreadPoolExecutor(
            Math.max(1, properties.getExecutorThreads()),
            Integer.MAX_VALUE,
            60L,
            TimeUnit.SECONDS,
            new SynchronousQueue<>(),
            new CustomizableThreadFactory("venue-io-"));
    executor.allowCoreThreadTimeOut(true);
    return executor;
  }

  @Bean
  @ConditionalOnMissingBean
  public HttpClient venueHttpClient(VenueProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(properties.getConnectTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public VenueSupport venueSupport(
      HttpClient venueHttpClient,
      @Qualifier("taskObjectMapper") ObjectMapper objectMapper,
      Clock syncClock,
      MeterRegistry meterRegistry,
      @Qualifier("venueExecutor") ExecutorService venueExecutor,
      VenueProperties properties) {
    VenueProperties.Retry retry = properties.getRetry();
    VenueRetrySettings retrySettings =
        new VenueRetrySettings(
            retry.getMaxAttempts(), retry.getBaseBackoff(), retry.getMaxBackoff(), retry.isJitterEnabled());
    return new VenueSupport(
        venueHttpClient,
        objectMapper,
        syncClock,
        meterRegistry,
        venueExecutor,
        retrySettings,
        Sleeper.THREAD);
  }

  @Bean
  @ConditionalOnMissingBean
  public VenueAdapterRegistry venueAdapterRegistry(VenueSupport venueSupport) {
    return new VenueAdapterRegistry(venueSupport);
  }

  @Bean
  @ConditionalOnMissingBean
  public VenueConfigParser venueConfigParser() {
    return new VenueConfigParser();
  }
}
