package com.portfoliosync.integration.venues.okx;

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
import com.portfoliosync.integration.venues.config.OkxConfig;
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
import java.net.http.HttpRequest;
import java.time.format.DateTimeFormatter;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** OKX v5. Histories have no start filter on the wire, so they are filtered by time locally. */
public class OkxAdapter extends AbstractVenueAdapter {
  static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private final OkxConfig config;
  private final VenueHttpClient http;
  private final RequestRateLimiter limiter;

  public OkxAdapter(OkxConfig config, VenueSupport support) {
    super(support);
    this.config = config;
    this.http = support.httpClientFor(Venue.OKX, config.timeout());
    this.limiter = new IntervalRateLimiter(config.requestsPerSecond());
  }

  @Override
  public Venue venue() {
    return Venue.OKX;
  }

  @Override
  public List<Balance> fetchBalances() {
    JsonNode response = signedGet("balance", "/api/v5/account/balance", Map.of());
    List<Balance> balances = new ArrayList<>();
    for (JsonNode account : elements(response.path("data"))) {
      List<JsonNode> details =
          account.path("details").isArray() ? elements(account.path("details")) : List.of(account);
      for (JsonNode detail : details) {
        String asset = text(detail, "ccy");
        if (asset == null) {
          continue;
        }
        BigDecimal free = decimal(detail, "availBal", "availEq");
        BigDecimal locked = decimal(detail, "frozenBal");
        BigDecimal total = decimal(detail, "eq", "bal");
        balances.add(
            total == null
                ? Balance.ofFreeAndLocked(asset, free, locked)
                : new Balance(asset, free, locked, total));
      }
    }
    return balances;
  }

  @Override
  public List<Position> fetchPositions(List<String> categories) {
    List<String> instTypes = categories == null || categories.isEmpty() ? config.positionInstTypes() : categories;
    List<Position> positions = new ArrayList<>();
    for (String instType : instTypes) {
      JsonNode response =
          signedGet("positions", "/api/v5/account/positions", params("instType", instType.toUpperCase(Locale.ROOT)));
      for (JsonNode item : elements(response.path("data"))) {
        String symbol = text(item, "instId");
        BigDecimal size = decimal(item, "pos");
        if (symbol == null || size == null || size.signum() == 0) {
          continue;
        }
        positions.add(
            new Position(
                symbol,
                PositionSide.resolve(text(item, "posSide"), size),
                size.abs(),
                decimal(item, "avgPx"),
                decimal(item, "markPx"),
                decimal(item, "upl"),
                decimal(item, "lever"),
                text(item, "ccy")));
      }
    }
    return positions;
  }

  @Override
  public List<ActivityLine> fetchActivities(ActivityQuery query) {
    String limit = String.valueOf(Math.min(query.limit(), 100));
    List<ActivityLine> activities = new ArrayList<>();
    for (String instType : config.fillInstTypes()) {
      String activityType = "SPOT".equalsIgnoreCase(instType) ? "spot_trade" : "futures_trade";
      JsonNode fills = signedGet("fills", "/api/v5/trade/fills", params("instType", instType, "limit", limit));
      activities.addAll(parseFills(fills, activityType, query.quoteAssets()));
    }
    activities.addAll(
        parseTransfers(signedGet("deposits", "/api/v5/asset/deposit-history", params("limit", limit)), "deposit"));
    activities.addAll(
        parseTransfers(
            signedGet("withdrawals", "/api/v5/asset/withdrawal-history", params("limit", limit)), "withdrawal"));
    activities.addAll(
        parseConversions(signedGet("conversions", "/api/v5/asset/convert/history", params("limit", limit))));
    return Activities.sortAndCap(Activities.since(activities, query.since()), query.limit());
  }

  private JsonNode signedGet(String action, String path, Map<String, String> params) {
    String query = VenueHttpClient.queryString(params);
    String requestPath = query.isEmpty() ? path : path + "?" + query;
    return http.send(
        action,
        limiter,
        () -> {
          String timestamp = TIMESTAMP_FORMAT.format(support.clock().instant());
          String signature = HmacSigner.hmacSha256Base64(config.apiSecret(), timestamp + "GET" + requestPath);
          HttpRequest.Builder builder =
              http.request(VenueHttpClient.resolve(config.baseUri(), path, query))
                  .header("OK-ACCESS-KEY", config.apiKey())
                  .header("OK-ACCESS-SIGN", signature)
                  .header("OK-ACCESS-TIMESTAMP", timestamp)
                  .header("OK-ACCESS-PASSPHRASE", config.passphrase());
          if (config.demo()) {
            builder.header("x-simulated-trading", "1");
          }
          return builder.GET().build();
        },
        body -> {
          String code = body.path("code").asText("0");
          if (!"0".equals(code) && !code.isEmpty()) {
            throw new VenueApiException(Venue.OKX, action, statusForCode(code), null, body.toString());
          }
        });
  }

  static int statusForCode(String code) {
    return switch (code) {
      case "50011", "50061" -> 429;
      case "50001", "50004", "50013", "50026" -> 503;
      case "50100", "50101", "50102", "50103", "50104", "50105", "50111", "50112", "50113" -> 401;
      default -> 400;
    };
  }

  private static List<ActivityLine> parseFills(JsonNode response, String activityType, List<String> quotes) {
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode fill : elements(response.path("data"))) {
      String symbol = text(fill, "instId");
      String side = text(fill, "side");
      BigDecimal fee = decimal(fill, "fee");
      activities.add(
          ActivityLine.builder(activityType)
              .symbol(symbol)
              .assets(SymbolSplitter.split(symbol, quotes))
              .side(side == null ? null : side.toLowerCase(Locale.ROOT))
              .amount(abs(decimal(fill, "fillSz", "sz")))
              .price(decimal(fill, "fillPx", "px"))
              .fee(abs(fee), text(fill, "feeCcy"))
              .timestamp(instant(fill, "ts"))
              .raw(fill)
              .build());
    }
    return activities;
  }

  private static List<ActivityLine> parseTransfers(JsonNode response, String activityType) {
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode item : elements(response.path("data"))) {
      String coin = text(item, "ccy");
      activities.add(
          ActivityLine.builder(activityType)
              .baseAsset(coin)
              .amount(decimal(item, "amt"))
              .fee(decimal(item, "fee"), coin)
              .timestamp(instant(item, "ts"))
              .raw(item)
              .build());
    }
    return activities;
  }

  private static List<ActivityLine> parseConversions(JsonNode response) {
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode item : elements(response.path("data"))) {
      activities.add(
          ActivityLine.builder("conversion")
              .baseAsset(text(item, "fromCcy"))
              .quoteAsset(text(item, "toCcy"))
              .amount(decimal(item, "fromSz"))
              .price(decimal(item, "toSz"))
              .timestamp(instant(item, "ts", "cTime"))
              .raw(item)
              .build());
    }
    return activities;
  }
}
