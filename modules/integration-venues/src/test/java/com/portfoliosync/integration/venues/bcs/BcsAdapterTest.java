package com.portfoliosync.integration.venues.bcs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.portfoliosync.integration.venues.PathDispatcher;
import com.portfoliosync.integration.venues.VenueAuthenticationException;
import com.portfoliosync.integration.venues.VenueSupportFixture;
import com.portfoliosync.integration.venues.auth.RefreshedTokens;
import com.portfoliosync.integration.venues.config.BcsConfig;
import com.portfoliosync.integration.venues.model.ActivityQuery;
import com.portfoliosync.integration.venues.model.Balance;
import com.portfoliosync.integration.venues.model.Position;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BcsAdapterTest {
  private MockWebServer server;
  private PathDispatcher dispatcher;
  private VenueSupportFixture fixture;
  private final List<RefreshedTokens> persisted = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    dispatcher = new PathDispatcher();
    server.setDispatcher(dispatcher);
    server.start();
    fixture = new VenueSupportFixture();
  }

  @AfterEach
  void tearDown() throws Exception {
    fixture.close();
    server.shutdown();
  }

  private BcsAdapter adapter(String accessToken) {
    BcsConfig config =
        new BcsConfig(
            server.url("/").uri(),
            null,
            accessToken,
            "refresh-1",
            accessToken == null ? null : VenueSupportFixture.NOW.plusSeconds(3600),
            null,
            BcsConfig.DEFAULT_REFRESH_MARGIN,
            Duration.ofSeconds(3),
            10);
    return new BcsAdapter(config, fixture.support(), persisted::add);
  }

  @Test
  void shouldRefreshMissingAccessTokenAndPersistRotation() throws Exception {
    dispatcher.json(
        BcsAdapter.TOKEN_PATH,
        "{\"access_token\":\"access-2\",\"refresh_token\":\"refresh-2\",\"expires_in\":1800,\"refresh_expires_in\":86400}");
    dispatcher.json(
        BcsAdapter.LIMITS_PATH,
        """
        {"data":{"moneyLimits":[{"currencyCode":"rub","quantity":{"value":"1200"},"blocked":"200"}]}}
        """);

    List<Balance> balances = adapter(null).fetchBalances();

    assertEquals(1, balances.size());
    assertEquals("RUB", balances.get(0).asset());
    assertEquals(0, new BigDecimal("1200").compareTo(balances.get(0).free()));
    assertEquals(0, new BigDecimal("200").compareTo(balances.get(0).locked()));

    RecordedRequest tokenRequest = dispatcher.requests(BcsAdapter.TOKEN_PATH).get(0);
    String form = tokenRequest.getBody().readUtf8();
    assertTrue(form.contains("grant_type=refresh_token"));
    assertTrue(form.contains("refresh_token=refresh-1"));
    assertTrue(form.contains("client_id=trade-api-read"));
    assertEquals("Bearer access-2", dispatcher.requests(BcsAdapter.LIMITS_PATH).get(0).getHeader("Authorization"));
    assertEquals(1, persisted.size());
    assertEquals("refresh-2", persisted.get(0).refreshToken());
    assertEquals(VenueSupportFixture.NOW.plusSeconds(1800), persisted.get(0).accessExpiresAt());
  }

  @Test
  void shouldRefreshOnceAfterUnauthorizedResponse() {
    AtomicInteger limitCalls = new AtomicInteger();
    dispatcher.json(BcsAdapter.TOKEN_PATH, "{\"access_token\":\"access-2\",\"expires_in\":1800}");
    dispatcher.route(
        BcsAdapter.LIMITS_PATH,
        request -> {
          limitCalls.incrementAndGet();
          return "Bearer access-2".equals(request.getHeader("Authorization"))
              ? PathDispatcher.ok("{\"depoLimit\":[{\"ticker\":\"SBER\",\"quantity\":{\"value\":\"5\"},\"averagePrice\":\"250\"}]}")
              : new MockResponse().setResponseCode(401).setBody("{}");
        });

    List<Position> positions = adapter("access-1").fetchPositions(List.of());

    assertEquals(1, positions.size());
    assertEquals("SBER", positions.get(0).symbol());
    assertEquals(2, limitCalls.get());
    assertEquals(1, dispatcher.requests(BcsAdapter.TOKEN_PATH).size());
  }

  @Test
  void shouldFailWhenRefreshIsRejected() {
    dispatcher.route(
        BcsAdapter.TOKEN_PATH,
        request -> new MockResponse().setResponseCode(400).setBody("{\"error\":\"invalid_grant\"}"));

    assertThrows(VenueAuthenticationException.class, () -> adapter(null).fetchBalances());
    assertTrue(persisted.isEmpty());
  }

  @Test
  void shouldFallBackToPortfolioWhenLimitsHaveNoMoney() {
    dispatcher.json(BcsAdapter.LIMITS_PATH, "{\"data\":{}}");
    dispatcher.json(
        BcsAdapter.PORTFOLIO_PATH,
        """
        [{"upperType":"CURRENCY","currency":"usd","quantity":"15","balanceValue":"15"},
         {"upperType":"STOCK","ticker":"YDEX","quantity":"2","balancePrice":"4000","currentPrice":"4100"}]
        """);

    List<Balance> balances = adapter("access-1").fetchBalances();

    assertEquals(1, balances.size());
    assertEquals("USD", balances.get(0).asset());
  }

  @Test
  void shouldTreatUnavailableOrderHistoryAsEmpty() {
    dispatcher.route(BcsAdapter.ORDERS_PATH, request -> new MockResponse().setResponseCode(404).setBody("{}"));

    assertTrue(adapter("access-1").fetchActivities(ActivityQuery.since(null, 50)).isEmpty());
  }
}
