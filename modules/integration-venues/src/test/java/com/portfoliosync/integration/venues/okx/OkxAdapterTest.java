package com.portfoliosync.integration.venues.okx;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.portfoliosync.integration.venues.PathDispatcher;
import com.portfoliosync.integration.venues.VenueApiException;
import com.portfoliosync.integration.venues.VenueSupportFixture;
import com.portfoliosync.integration.venues.config.OkxConfig;
import com.portfoliosync.integration.venues.http.HmacSigner;
import com.portfoliosync.integration.venues.model.ActivityLine;
import com.portfoliosync.integration.venues.model.ActivityQuery;
import com.portfoliosync.integration.venues.model.Balance;
import com.portfoliosync.integration.venues.model.SymbolSplitter;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OkxAdapterTest {
  private MockWebServer server;
  private PathDispatcher dispatcher;
  private VenueSupportFixture fixture;
  private OkxAdapter adapter;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    dispatcher = new PathDispatcher();
    server.setDispatcher(dispatcher);
    server.start();
    fixture = new VenueSupportFixture();
    OkxConfig config =
        new OkxConfig(
            server.url("/").uri(),
            "okx-key",
            "okx-secret",
            "okx-pass",
            true,
            Duration.ofSeconds(3),
            List.of(),
            List.of("SPOT"),
            SymbolSplitter.DEFAULT_QUOTE_ASSETS,
            1000.0d);
    adapter = new OkxAdapter(config, fixture.support());
  }

  @AfterEach
  void tearDown() throws Exception {
    fixture.close();
    server.shutdown();
  }

  @Test
  void shouldSignWithMillisecondTimestampAndDemoHeader() {
    dispatcher.json(
        "/api/v5/account/balance",
        """
        {"code":"0","data":[{"details":[{"ccy":"USDT","availBal":"80","frozenBal":"20","eq":"100"}]}]}
        """);

    List<Balance> balances = adapter.fetchBalances();

    assertEquals(1, balances.size());
    RecordedRequest request = dispatcher.requests("/api/v5/account/balance").get(0);
    String timestamp = "2026-03-01T12:00:00.000Z";
    assertEquals(timestamp, request.getHeader("OK-ACCESS-TIMESTAMP"));
    assertEquals(
        HmacSigner.hmacSha256Base64("okx-secret", timestamp + "GET/api/v5/account/balance"),
        request.getHeader("OK-ACCESS-SIGN"));
    assertEquals("okx-pass", request.getHeader("OK-ACCESS-PASSPHRASE"));
    assertEquals("1", request.getHeader("x-simulated-trading"));
  }

  @Test
  void shouldRaiseAuthErrorForRejectedKeyCode() {
    dispatcher.json("/api/v5/account/balance", "{\"code\":\"50111\",\"msg\":\"Invalid OK-ACCESS-KEY\"}");

    VenueApiException error = assertThrows(VenueApiException.class, () -> adapter.fetchBalances());

    assertTrue(error.isUnauthorized());
  }

  @Test
  void shouldFilterActivitiesBeforeSinceLocally() {
    dispatcher.json(
        "/api/v5/trade/fills",
        """
        {"code":"0","data":[
          {"tradeId":"1","instId":"BTC-USDT","side":"buy","fillSz":"0.1","fillPx":"60000","fee":"-0.5","feeCcy":"USDT","ts":"1772200000000"},
          {"tradeId":"2","instId":"ETH-USDT","side":"sell","fillSz":"1","fillPx":"3000","fee":"-0.3","feeCcy":"USDT","ts":"1772360000000"}]}
        """);
    dispatcher.json("/api/v5/asset/deposit-history", "{\"code\":\"0\",\"data\":[]}");
    dispatcher.json("/api/v5/asset/withdrawal-history", "{\"code\":\"0\",\"data\":[]}");
    dispatcher.json("/api/v5/asset/convert/history", "{\"code\":\"0\",\"data\":[]}");

    List<ActivityLine> activities =
        adapter.fetchActivities(ActivityQuery.since(Instant.parse("2026-03-01T00:00:00Z"), 100));

    assertEquals(1, activities.size());
    ActivityLine fill = activities.get(0);
    assertEquals("ETH", fill.baseAsset());
    assertEquals("USDT", fill.quoteAsset());
    assertEquals("sell", fill.side());
    assertEquals(0, fill.fee().compareTo(new BigDecimal("0.3")));
  }
}
