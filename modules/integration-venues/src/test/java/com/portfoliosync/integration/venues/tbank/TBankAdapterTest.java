package com.portfoliosync.integration.venues.tbank;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.integration.venues.PathDispatcher;
import com.portfoliosync.integration.venues.VenueSupportFixture;
import com.portfoliosync.integration.venues.config.TBankConfig;
import com.portfoliosync.integration.venues.model.ActivityLine;
import com.portfoliosync.integration.venues.model.ActivityQuery;
import com.portfoliosync.integration.venues.model.Balance;
import com.portfoliosync.integration.venues.model.Position;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TBankAdapterTest {
  private static final String PREFIX = "/tinkoff.public.invest.api.contract.v1.";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private MockWebServer server;
  private PathDispatcher dispatcher;
  private VenueSupportFixture fixture;
  private TBankAdapter adapter;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    dispatcher = new PathDispatcher();
    server.setDispatcher(dispatcher);
    server.start();
    fixture = new VenueSupportFixture();
    TBankConfig config =
        new TBankConfig(server.url("/").uri(), "t.secret", null, Duration.ofSeconds(3), Duration.ofDays(30), 200, 100);
    adapter = new TBankAdapter(config, fixture.support());
    dispatcher.json(PREFIX + "UsersService/GetAccounts", "{\"accounts\":[{\"id\":\"2000\"},{\"id\":\"3000\"}]}");
  }

  @AfterEach
  void tearDown() throws Exception {
    fixture.close();
    server.shutdown();
  }

  @Test
  void shouldMergeMoneyWithWithdrawLimits() {
    dispatcher.json(
        PREFIX + "OperationsService/GetPositions",
        """
        {"money":[{"currency":"rub","units":"1000","nano":0}],"blocked":[{"currency":"rub","units":"50","nano":0}],
         "securities":[]}
        """);
    dispatcher.json(
        PREFIX + "OperationsService/GetWithdrawLimits",
        """
        {"money":[{"currency":"rub","units":"900","nano":0},{"currency":"usd","units":"10","nano":500000000}],
         "blocked":[]}
        """);

    List<Balance> balances = adapter.fetchBalances();

    Balance rub = balances.stream().filter(balance -> "RUB".equals(balance.asset())).findFirst().orElseThrow();
    assertEquals(0, new BigDecimal("900").compareTo(rub.free()));
    assertEquals(0, new BigDecimal("50").compareTo(rub.locked()));
    assertEquals(0, new BigDecimal("950").compareTo(rub.total()));
    Balance usd = balances.stream().filter(balance -> "USD".equals(balance.asset())).findFirst().orElseThrow();
    assertEquals(0, new BigDecimal("10.5").compareTo(usd.total()));
  }

  @Test
  void shouldOverlayPortfolioPricesOnPositions() throws Exception {
    dispatcher.json(
        PREFIX + "OperationsService/GetPositions",
        "{\"money\":[],\"securities\":[{\"ticker\":\"SBER\",\"figi\":\"BBG004730N88\",\"balance\":\"20\"}]}");
    dispatcher.json(
        PREFIX + "OperationsService/GetPortfolio",
        """
        {"positions":[{"ticker":"SBER","quantity":{"units":"20","nano":0},
          "averagePositionPrice":{"currency":"rub","units":"250","nano":0},
          "currentPrice":{"currency":"rub","units":"280","nano":0},
          "expectedYield":{"units":"600","nano":0}}]}
        """);

    List<Position> positions = adapter.fetchPositions(List.of());

    assertEquals(1, positions.size());
    Position sber = positions.get(0);
    assertEquals("SBER", sber.symbol());
    assertEquals(0, new BigDecimal("20").compareTo(sber.size()));
    assertEquals(0, new BigDecimal("250").compareTo(sber.entryPrice()));
    assertEquals(0, new BigDecimal("280").compareTo(sber.markPrice()));
    assertEquals("RUB", sber.currency());

    RecordedRequest request = dispatcher.requests(PREFIX + "OperationsService/GetPositions").get(0);
    assertEquals("Bearer t.secret", request.getHeader("Authorization"));
    JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
    assertEquals("2000", body.path("accountId").asText());
  }

  @Test
  void shouldParseOperationsAndTrackCursor() throws Exception {
    dispatcher.json(
        PREFIX + "OperationsService/GetOperationsByCursor",
        """
        {"hasNext":true,"nextCursor":"cursor-2","items":[
          {"id":"op-1","type":"OPERATION_TYPE_BUY","ticker":"GAZP","quantity":"10",
           "payment":{"currency":"rub","units":"-1650","nano":0},
           "commission":{"currency":"rub","units":"-1","nano":-500000000},
           "date":"2026-02-27T10:00:00Z"},
          {"id":"op-2","type":"OPERATION_TYPE_INPUT","payment":{"currency":"rub","units":"5000","nano":0},
           "date":"2026-02-26T09:00:00Z"}]}
        """);

    List<ActivityLine> activities = adapter.fetchActivities(ActivityQuery.since(null, 100));

    assertEquals(2, activities.size());
    ActivityLine input = activities.get(0);
    assertEquals("input", input.activityType());
    assertNull(input.side());
    ActivityLine buy = activities.get(1);
    assertEquals("buy", buy.activityType());
    assertEquals("BUY", buy.side());
    assertEquals(0, new BigDecimal("165").compareTo(buy.price()));
    assertEquals("RUB", buy.quoteAsset());
    assertEquals("cursor-2", adapter.lastCursor().orElseThrow());

    RecordedRequest request = dispatcher.requests(PREFIX + "OperationsService/GetOperationsByCursor").get(0);
    JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
    assertEquals("OPERATION_STATE_EXECUTED", body.path("state").asText());
    assertEquals("2026-01-30T12:00:00Z", body.path("from").asText());
  }

  @Test
  void shouldStripOperationTypePrefix() {
    assertEquals("dividend", TBankAdapter.operationType("OPERATION_TYPE_DIVIDEND"));
    assertNull(TBankAdapter.operationType(""));
    assertEquals("SELL", TBankAdapter.inferSide("sell_card"));
    assertNull(TBankAdapter.inferSide("coupon"));
  }
}
