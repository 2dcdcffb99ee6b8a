package com.portfoliosync.integration.venues.bybit;

import static com.portfoliosync.integration.venues.http.JsonValues.abs;
import static com.portfoliosync.integration.venues.http.JsonValues.decimal;
import static com.portfoliosync.integration.venues.http.JsonValues.elements;
import static com.portfoliosync.integration.venues.http.JsonValues.instant;
import static com.portfoliosync.integration.venues.http.JsonValues.text;
import static com.portfoliosync.integration.venues.http.VenueHttpClient.params;

import com.fasterxml.jackson.databind.JsonNode;
import com.portfoliosync.integration.venues.AbstractVenueAdapter;
import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueApiException;
import com.portfoliosync.integration.venues.VenueSupport;
import com.portfoliosync.integration.venues.config.BybitConfig;
import com.portfoliosync.integration.venues.http.HmacSigner;
import com.portfoliosync.integration.venues.http.IntervalRateLimiter;
import com.portfoliosync.integration.venues.http.RequestRateLimiter;
import com.portfoliosync.integration.venues.http.VenueHttpClient;
import com.portfoliosync.integration.venues.model.Activities;
import com.portfoliosync.integration.venues.model.ActivityLine;
import com.portfoliosync.integration.venues.model.ActivityQuery;
import com.portfoliosync.integration.venues.model.Balance;
import com.portfoliosync.integration.venues.model.Position;
import com.portfoliosync.integration.venues.model.PositionSide;
import com.portfoliosync.integration.venues.model.SymbolSplitter;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpHeaders;

/** Bybit v5 unified account. Errors arrive as HTTP 200 with a non-zero {@code retCode}. */
public class BybitAdapter extends AbstractVenueAdapter {
  private static final int RATE_LIMITED = 10006;
  private static final int SERVER_BUSY = 10016;

  private final BybitConfig config;
  private final VenueHttpClient http;
  private final RequestRateLimiter limiter;

  public BybitAdapter(BybitConfig config, VenueSupport support) {
    super(support);
    this.config = config;
    this.http = support.httpClientFor(Venue.BYBIT, config.timeout());
    this.limiter = new IntervalRateLimiter(config.requestsPerSecond());
  }

  @Override
  public Venue venue() {
    return Venue.BYBIT;
  }

  @Override
  public List<Balance> fetchBalances() {
    JsonNode response =
        signedGet("wallet balance", "/v5/account/wallet-balance", params("accountType", config.accountType()));
    List<JsonNode> accounts = resultList(response);
    List<Balance> balances = new ArrayList<>();
    if (accounts.isEmpty()) {
      return balances;
    }
    for (JsonNode coin : elements(accounts.get(0).path("coin"))) {
      String asset = text(coin, "coin");
      if (asset == null) {
        continue;
      }
      balances.add(
          new Balance(
              asset,
              decimal(coin, "availableToWithdraw"),
              decimal(coin, "locked"),
              decimal(coin, "walletBalance")));
    }
    return balances;
  }

  @Override
  public List<Position> fetchPositions(List<String> categories) {
    List<String> selected =
        categories == null || categories.isEmpty() ? config.positionCategories() : categories;
    List<Position> positions = new ArrayList<>();
    for (String category : selected) {
      String key = category.toLowerCase(Locale.ROOT);
      JsonNode response =
          signedGet(
              "positions",
              "/v5/position/list",
              params("category", key, "settleCoin", config.settleCoins().get(key)));
      for (JsonNode item : resultList(response)) {
        String symbol = text(item, "symbol");
        BigDecimal size = decimal(item, "size");
        if (symbol == null || size == null || size.signum() == 0) {
          continue;
        }
        positions.add(
            new Position(
                symbol,
                PositionSide.resolve(text(item, "side"), size),
                size.abs(),
                decimal(item, "entryPrice", "avgPrice"),
                decimal(item, "markPrice"),
                decimal(item, "unrealisedPnl"),
                decimal(item, "leverage"),
                text(item, "settleCoin")));
      }
    }
    return positions;
  }

  @Override
  public List<ActivityLine> fetchActivities(ActivityQuery query) {
    String since = query.since() == null ? null : String.valueOf(query.since().toEpochMilli());
    String limit = String.valueOf(Math.min(query.limit(), 100));
    List<String> quotes = query.quoteAssets();

    List<ActivityLine> activities = new ArrayList<>();
    activities.addAll(
        parseTrades(
            signedGet("spot executions", "/v5/execution/list", params("category", "spot", "limit", limit, "startTime", since)),
            "spot_trade",
            quotes));
    for (String category : List.of("linear", "inverse")) {
      activities.addAll(
          parseTrades(
              signedGet(
                  category + " executions",
                  "/v5/execution/list",
                  params("category", category, "limit", limit, "startTime", since)),
              "futures_trade",
              quotes));
    }
    activities.addAll(
        parseTransfers(
            signedGet("deposits", "/v5/asset/deposit/query-record", params("limit", limit, "startTime", since)),
            "deposit"));
    activities.addAll(
        parseTransfers(
            signedGet("withdrawals", "/v5/asset/withdraw/query-record", params("limit", limit, "startTime", since)),
            "withdrawal"));
    activities.addAll(
        parseConversions(
            signedGet("conversions", "/v5/asset/exchange/order-record", params("limit", limit, "startTime", since))));
    return Activities.sortAndCap(activities, query.limit());
  }

  private JsonNode signedGet(String action, String path, Map<String, String> params) {
    String query = VenueHttpClient.queryString(params);
    return http.send(
        action,
        limiter,
        () -> {
          String timestamp = String.valueOf(support.clock().millis());
          String recvWindow = String.valueOf(config.recvWindowMs());
          String signature =
              HmacSigner.hmacSha256Hex(config.apiSecret(), timestamp + config.apiKey() + recvWindow + query);
          return http.request(VenueHttpClient.resolve(config.baseUri(), path, query))
              .header("X-BAPI-API-KEY", config.apiKey())
              .header("X-BAPI-TIMESTAMP", timestamp)
              .header("X-BAPI-RECV-WINDOW", recvWindow)
              .header("X-BAPI-SIGN", signature)
              .GET()
              .build();
        },
        body -> {
          int retCode = body.path("retCode").asInt(0);
          if (retCode != 0) {
            throw new VenueApiException(
                Venue.BYBIT, action, statusForRetCode(retCode), HttpHeaders.EMPTY, body.toString());
          }
        });
  }

  static int statusForRetCode(int retCode) {
    return switch (retCode) {
      case RATE_LIMITED -> 429;
      case SERVER_BUSY -> 503;
      case 10003, 10004, 10005, 33004 -> 401;
      default -> 400;
    };
  }

  private static List<JsonNode> resultList(JsonNode response) {
    JsonNode result = response.path("result");
    for (String key : List.of("list", "rows")) {
      if (result.path(key).isArray()) {
        return elements(result.path(key));
      }
    }
    return List.of();
  }

  private static List<ActivityLine> parseTrades(JsonNode response, String activityType, List<String> quotes) {
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode trade : resultList(response)) {
      String symbol = text(trade, "symbol");
      String side = text(trade, "side");
      activities.add(
          ActivityLine.builder(activityType)
              .symbol(symbol)
              .assets(SymbolSplitter.split(symbol, quotes))
              .side(side == null ? null : side.toLowerCase(Locale.ROOT))
              .amount(abs(decimal(trade, "execQty", "qty", "size")))
              .price(decimal(trade, "execPrice", "price"))
              .fee(decimal(trade, "execFee", "fee"), text(trade, "feeToken", "feeCurrency"))
              .timestamp(instant(trade, "execTime", "execTimeMs", "timestamp"))
              .raw(trade)
              .build());
    }
    return activities;
  }

  private static List<ActivityLine> parseTransfers(JsonNode response, String activityType) {
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode item : resultList(response)) {
      String coin = text(item, "coin");
      activities.add(
          ActivityLine.builder(activityType)
              .baseAsset(coin)
              .amount(decimal(item, "amount", "qty"))
              .fee(decimal(item, "fee", "withdrawFee"), coin)
              .timestamp(instant(item, "successAt", "createdTime", "createTime"))
              .raw(item)
              .build());
    }
    return activities;
  }

  private static List<ActivityLine> parseConversions(JsonNode response) {
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode item : resultList(response)) {
      activities.add(
          ActivityLine.builder("conversion")
              .baseAsset(text(item, "fromCoin"))
              .quoteAsset(text(item, "toCoin"))
              .amount(decimal(item, "fromAmount"))
              .price(decimal(item, "toAmount"))
              .timestamp(instant(item, "exchangeTime", "createdTime"))
              .raw(item)
              .build());
    }
    return activities;
  }
}
