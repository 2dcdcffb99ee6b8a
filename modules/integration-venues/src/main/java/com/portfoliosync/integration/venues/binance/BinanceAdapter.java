package com.portfoliosync.integration.venues.binance;

import static com.portfoliosync.integration.venues.http.JsonValues.abs;
import static com.portfoliosync.integration.venues.http.JsonValues.decimal;
import static com.portfoliosync.integration.venues.http.JsonValues.elements;
import static com.portfoliosync.integration.venues.http.JsonValues.instant;
import static com.portfoliosync.integration.venues.http.JsonValues.text;
import static com.portfoliosync.integration.venues.http.VenueHttpClient.params;

import com.fasterxml.jackson.databind.JsonNode;
import com.portfoliosync.integration.venues.AbstractVenueAdapter;
import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueException;
import com.portfoliosync.integration.venues.VenueSupport;
import com.portfoliosync.integration.venues.config.BinanceConfig;
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
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Semaphore;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

public class BinanceAdapter extends AbstractVenueAdapter {
  static final int SYMBOL_CONCURRENCY = 5;
  private static final List<String> DEFAULT_CATEGORIES = List.of("um", "cm");

  private final BinanceConfig config;
  private final VenueHttpClient http;
  private final BinanceRequestSigner signer;
  private final RequestRateLimiter limiter;

  public BinanceAdapter(BinanceConfig config, VenueSupport support) {
    super(support);
    this.config = config;
    this.http = support.httpClientFor(Venue.BINANCE, config.timeout());
    this.signer = new BinanceRequestSigner(config.apiSecret(), config.recvWindowMs(), support.clock());
    this.limiter = new IntervalRateLimiter(config.requestsPerSecond());
  }

  @Override
  public Venue venue() {
    return Venue.BINANCE;
  }

  @Override
  public List<Balance> fetchBalances() {
    JsonNode account = signedGet("account", config.spotBaseUri(), "/api/v3/account", Map.of());
    List<Balance> balances = new ArrayList<>();
    for (JsonNode item : elements(account.path("balances"))) {
      String asset = text(item, "asset");
      if (asset == null) {
        continue;
      }
      balances.add(Balance.ofFreeAndLocked(asset, decimal(item, "free"), decimal(item, "locked")));
    }
    return balances;
  }

  @Override
  public List<Position> fetchPositions(List<String> categories) {
    List<String> selected = categories == null || categories.isEmpty() ? DEFAULT_CATEGORIES : categories;
    List<Position> positions = new ArrayList<>();
    for (String category : selected) {
      switch (category.toLowerCase(Locale.ROOT)) {
        case "um" -> positions.addAll(
            parsePositions(signedGet("um account", config.usdMarginedBaseUri(), "/fapi/v2/account", Map.of())));
        case "cm" -> positions.addAll(
            parsePositions(signedGet("cm account", config.coinMarginedBaseUri(), "/dapi/v1/account", Map.of())));
        default -> {
          // unknown categories are ignored
        }
      }
    }
    return positions;
  }

  @Override
  public List<ActivityLine> fetchActivities(ActivityQuery query) {
    List<String> quotes = query.quoteAssets();
    String since = query.since() == null ? null : String.valueOf(query.since().toEpochMilli());
    String limit = String.valueOf(query.limit());

    List<ActivityLine> activities = new ArrayList<>();
    List<String> spotSymbols =
        resolveSymbols(config.spotSymbols(), config.spotBaseUri(), "/api/v3/exchangeInfo", quotes);
    activities.addAll(
        tradesForSymbols(
            spotSymbols,
            symbol ->
                parseSpotTrades(
                    signedGet(
                        "spot trades",
                        config.spotBaseUri(),
                        "/api/v3/myTrades",
                        params("symbol", symbol, "limit", limit, "startTime", since)),
                    quotes)));
    List<String> umSymbols =
        resolveSymbols(config.usdMarginedSymbols(), config.usdMarginedBaseUri(), "/fapi/v1/exchangeInfo", quotes);
    activities.addAll(
        tradesForSymbols(
            umSymbols,
            symbol ->
                parseFuturesTrades(
                    signedGet(
                        "um trades",
                        config.usdMarginedBaseUri(),
                        "/fapi/v1/userTrades",
                        params("symbol", symbol, "limit", limit, "startTime", since)),
                    quotes)));
    List<String> cmSymbols =
        resolveSymbols(config.coinMarginedSymbols(), config.coinMarginedBaseUri(), "/dapi/v1/exchangeInfo", quotes);
    activities.addAll(
        tradesForSymbols(
            cmSymbols,
            symbol ->
                parseFuturesTrades(
                    signedGet(
                        "cm trades",
                        config.coinMarginedBaseUri(),
                        "/dapi/v1/userTrades",
                        params("symbol", symbol, "limit", limit, "startTime", since)),
                    quotes)));
    activities.addAll(
        parseTransfers(
            signedGet(
                "deposits",
                config.spotBaseUri(),
                "/sapi/v1/capital/deposit/hisrec",
                params("startTime", since, "limit", limit)),
            "deposit"));
    activities.addAll(
        parseTransfers(
            signedGet(
                "withdrawals",
                config.spotBaseUri(),
                "/sapi/v1/capital/withdraw/history",
                params("startTime", since, "limit", limit)),
            "withdrawal"));
    activities.addAll(
        parseConversions(
            signedGet(
                "conversions",
                config.spotBaseUri(),
                "/sapi/v1/convert/tradeFlow",
                params("startTime", since, "limit", limit))));
    return Activities.sortAndCap(activities, query.limit());
  }

  private List<String> resolveSymbols(List<String> configured, URI baseUri, String path, List<String> quotes) {
    if (!configured.isEmpty()) {
      return configured;
    }
    JsonNode info = http.get("exchange info", limiter, () -> VenueHttpClient.resolve(baseUri, path, ""));
    Set<String> quoteSet =
        quotes.stream().map(quote -> quote.toUpperCase(Locale.ROOT)).collect(Collectors.toSet());
    List<String> symbols = new ArrayList<>();
    for (JsonNode item : elements(info.path("symbols"))) {
      String status = text(item, "status");
      if (status != null && !"TRADING".equals(status)) {
        continue;
      }
      String symbol = text(item, "symbol");
      String quote = text(item, "quoteAsset");
      if (symbol != null && (quoteSet.isEmpty() || (quote != null && quoteSet.contains(quote.toUpperCase(Locale.ROOT))))) {
        symbols.add(symbol.toUpperCase(Locale.ROOT));
      }
    }
    return symbols;
  }

  private List<ActivityLine> tradesForSymbols(
      List<String> symbols, Function<String, List<ActivityLine>> fetcher) {
    if (symbols.isEmpty()) {
      return List.of();
    }
    Semaphore permits = new Semaphore(SYMBOL_CONCURRENCY);
    List<CompletableFuture<List<ActivityLine>>> futures =
        symbols.stream()
            .map(
                symbol ->
                    CompletableFuture.supplyAsync(
                        () -> withPermit(permits, () -> fetcher.apply(symbol)), support.executor()))
            .toList();
    try {
      CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
    } catch (CompletionException ex) {
      futures.forEach(future -> future.cancel(true));
      throw unwrap(ex);
    }
    List<ActivityLine> activities = new ArrayList<>();
    futures.forEach(future -> activities.addAll(future.join()));
    return activities;
  }

  private <T> T withPermit(Semaphore permits, Supplier<T> task) {
    try {
      permits.acquire();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new VenueException(Venue.BINANCE, "Interrupted waiting for a symbol slot", ex);
    }
    try {
      return task.get();
    } finally {
      permits.release();
    }
  }

  private JsonNode signedGet(String action, URI baseUri, String path, Map<String, String> params) {
    return http.send(
        action,
        limiter,
        () ->
            http.request(VenueHttpClient.resolve(baseUri, path, signer.signedQuery(params)))
                .header("X-MBX-APIKEY", config.apiKey())
                .GET()
                .build());
  }

  private static List<Position> parsePositions(JsonNode account) {
    List<Position> positions = new ArrayList<>();
    for (JsonNode item : elements(account.path("positions"))) {
      String symbol = text(item, "symbol");
      BigDecimal amount = decimal(item, "positionAmt");
      if (symbol == null || amount == null || amount.signum() == 0) {
        continue;
      }
      positions.add(
          new Position(
              symbol,
              PositionSide.resolve(text(item, "positionSide"), amount),
              amount.abs(),
              decimal(item, "entryPrice"),
              decimal(item, "markPrice"),
              decimal(item, "unRealizedProfit", "unrealizedProfit"),
              decimal(item, "leverage"),
              null));
    }
    return positions;
  }

  private static List<ActivityLine> parseSpotTrades(JsonNode trades, List<String> quotes) {
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode trade : elements(trades)) {
      String symbol = text(trade, "symbol");
      activities.add(
          ActivityLine.builder("spot_trade")
              .symbol(symbol)
              .assets(SymbolSplitter.split(symbol, quotes))
              .side(trade.path("isBuyer").asBoolean(false) ? "buy" : "sell")
              .amount(decimal(trade, "qty"))
              .price(decimal(trade, "price"))
              .fee(decimal(trade, "commission"), text(trade, "commissionAsset"))
              .timestamp(instant(trade, "time"))
              .raw(trade)
              .build());
    }
    return activities;
  }

  private static List<ActivityLine> parseFuturesTrades(JsonNode trades, List<String> quotes) {
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode trade : elements(trades)) {
      String symbol = text(trade, "symbol");
      String side = text(trade, "side", "positionSide");
      activities.add(
          ActivityLine.builder("futures_trade")
              .symbol(symbol)
              .assets(SymbolSplitter.split(symbol, quotes))
              .side(side == null ? null : side.toLowerCase(Locale.ROOT))
              .amount(abs(decimal(trade, "qty")))
              .price(decimal(trade, "price"))
              .fee(decimal(trade, "commission"), text(trade, "commissionAsset"))
              .timestamp(instant(trade, "time"))
              .raw(trade)
              .build());
    }
    return activities;
  }

  private static List<ActivityLine> parseTransfers(JsonNode response, String activityType) {
    JsonNode items = response;
    if (!response.isArray()) {
      items = response.has("depositList") ? response.path("depositList") : response.path("withdrawList");
    }
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode item : elements(items)) {
      String coin = text(item, "coin", "asset");
      activities.add(
          ActivityLine.builder(activityType)
              .baseAsset(coin)
              .amount(decimal(item, "amount"))
              .fee(decimal(item, "transactionFee", "fee"), coin)
              .timestamp(instant(item, "insertTime", "applyTime", "successTime"))
              .raw(item)
              .build());
    }
    return activities;
  }

  private static List<ActivityLine> parseConversions(JsonNode response) {
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode item : elements(response.path("list"))) {
      activities.add(
          ActivityLine.builder("conversion")
              .baseAsset(text(item, "fromAsset"))
              .quoteAsset(text(item, "toAsset"))
              .amount(decimal(item, "fromAmount"))
              .price(decimal(item, "toAmount"))
              .timestamp(instant(item, "createTime", "timestamp"))
              .raw(item)
              .build());
    }
    return activities;
  }
}
