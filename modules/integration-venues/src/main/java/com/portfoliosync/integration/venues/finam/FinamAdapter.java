package com.portfoliosync.integration.venues.finam;

import static com.portfoliosync.integration.venues.http.JsonValues.decimal;
import static com.portfoliosync.integration.venues.http.JsonValues.elements;
import static com.portfoliosync.integration.venues.http.JsonValues.firstArray;
import static com.portfoliosync.integration.venues.http.JsonValues.instant;
import static com.portfoliosync.integration.venues.http.JsonValues.text;
import static com.portfoliosync.integration.venues.http.JsonValues.upper;

import com.fasterxml.jackson.databind.JsonNode;
import com.portfoliosync.integration.venues.AbstractVenueAdapter;
import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueApiException;
import com.portfoliosync.integration.venues.VenueAuthenticationException;
import com.portfoliosync.integration.venues.VenueSupport;
import com.portfoliosync.integration.venues.auth.AccessTokenCache;
import com.portfoliosync.integration.venues.auth.AccessTokenCache.IssuedToken;
import com.portfoliosync.integration.venues.config.FinamConfig;
import com.portfoliosync.integration.venues.http.RequestRateLimiter;
import com.portfoliosync.integration.venues.http.SlidingWindowRateLimiter;
import com.portfoliosync.integration.venues.http.VenueHttpClient;
import com.portfoliosync.integration.venues.model.Activities;
import com.portfoliosync.integration.venues.model.ActivityLine;
import com.portfoliosync.integration.venues.model.ActivityQuery;
import com.portfoliosync.integration.venues.model.Balance;
import com.portfoliosync.integration.venues.model.Position;
import java.math.BigDecimal;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/** Finam Trade API v1. The account secret is exchanged for a short-lived session JWT. */
public class FinamAdapter extends AbstractVenueAdapter {
  static final Duration SESSION_TTL = Duration.ofMinutes(14);
  static final Duration SESSION_MARGIN = Duration.ofSeconds(20);

  private final FinamConfig config;
  private final VenueHttpClient http;
  private final AccessTokenCache session;
  private final RequestRateLimiter authLimiter;
  private final RequestRateLimiter accountsLimiter;

  public FinamAdapter(FinamConfig config, VenueSupport support) {
    super(support);
    this.config = config;
    this.http = support.httpClientFor(Venue.FINAM, config.timeout());
    this.session = new AccessTokenCache(this::openSession, SESSION_MARGIN, support.clock(), null);
    this.authLimiter = SlidingWindowRateLimiter.perMinute(config.authPerMinute());
    this.accountsLimiter = SlidingWindowRateLimiter.perMinute(config.accountsPerMinute());
  }

  @Override
  public Venue venue() {
    return Venue.FINAM;
  }

  @Override
  public List<Balance> fetchBalances() {
    JsonNode account = authorizedGet("account", accountPath(""), "");
    List<Balance> balances = new ArrayList<>();
    for (JsonNode cash : elements(account.path("cash"))) {
      String currency = upper(text(cash, "currency_code", "currencyCode", "currency"));
      BigDecimal amount = decimal(cash);
      if (currency != null) {
        balances.add(new Balance(currency, amount, null, amount));
      }
    }
    return balances;
  }

  @Override
  public List<Position> fetchPositions(List<String> categories) {
    JsonNode account = authorizedGet("account", accountPath(""), "");
    List<Position> positions = new ArrayList<>();
    for (JsonNode row : elements(account.path("positions"))) {
      String symbol = text(row, "symbol");
      if (symbol == null) {
        continue;
      }
      positions.add(
          Position.holding(
              symbol,
              decimal(row, "quantity"),
              decimal(row, "average_price", "averagePrice"),
              decimal(row, "current_price", "currentPrice"),
              decimal(row, "unrealized_pnl", "unrealizedPnl"),
              upper(text(row, "currency"))));
    }
    return positions;
  }

  /** Trades and cash transactions over {@code [since, now]}, merged by time. */
  @Override
  public List<ActivityLine> fetchActivities(ActivityQuery query) {
    Instant until = support.clock().instant();
    Instant since = query.since() != null ? query.since() : until.minus(config.defaultLookback());
    if (since.isAfter(until)) {
      Instant swap = since;
      since = until;
      until = swap;
    }
    String interval =
        VenueHttpClient.queryString(
            VenueHttpClient.params(
                "interval.start_time", since.toString(),
                "interval.end_time", until.toString(),
                "limit", String.valueOf(query.limit())));

    CompletableFuture<List<ActivityLine>> trades =
        CompletableFuture.supplyAsync(
            () -> parseTrades(authorizedGet("trades", accountPath("/trades"), interval)), support.executor());
    CompletableFuture<List<ActivityLine>> transactions =
        CompletableFuture.supplyAsync(
            () -> parseTransactions(authorizedGet("transactions", accountPath("/transactions"), interval)),
            support.executor());
    List<ActivityLine> activities = new ArrayList<>();
    try {
      activities.addAll(trades.join());
      activities.addAll(transactions.join());
    } catch (CompletionException ex) {
      trades.cancel(true);
      transactions.cancel(true);
      throw unwrap(ex);
    }
    return Activities.sortAndCap(activities, query.limit());
  }

  static List<ActivityLine> parseTrades(JsonNode response) {
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode trade : elements(firstArray(response, "trades", "items"))) {
      JsonNode fee = trade.path("fee");
      activities.add(
          ActivityLine.builder("trade")
              .symbol(text(trade, "symbol"))
              .side(normalizeSide(text(trade, "side")))
              .amount(decimal(trade, "size"))
              .price(decimal(trade, "price"))
              .fee(decimal(fee), upper(text(fee, "currency_code", "currency")))
              .timestamp(instant(trade, "timestamp"))
              .raw(trade)
              .build());
    }
    return activities;
  }

  static List<ActivityLine> parseTransactions(JsonNode response) {
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode transaction : elements(firstArray(response, "transactions", "items"))) {
      String category = text(transaction, "category", "transaction_category");
      JsonNode change = transaction.path("change");
      JsonNode trade = transaction.path("trade");
      activities.add(
          ActivityLine.builder(category == null ? "transaction" : category.toLowerCase(Locale.ROOT))
              .symbol(text(transaction, "symbol"))
              .quoteAsset(upper(text(change, "currency_code", "currencyCode", "currency")))
              .side(normalizeSide(text(trade, "side")))
              .amount(decimal(trade, "size"))
              .price(decimal(trade, "price"))
              .timestamp(instant(transaction, "timestamp"))
              .raw(transaction)
              .build());
    }
    return activities;
  }

  static String normalizeSide(String side) {
    if (side == null) {
      return null;
    }
    String upper = side.toUpperCase(Locale.ROOT);
    if (upper.contains("BUY")) {
      return "BUY";
    }
    return upper.contains("SELL") ? "SELL" : null;
  }

  private String accountPath(String suffix) {
    return "/v1/accounts/" + VenueHttpClient.encode(config.accountId()) + suffix;
  }

  /** A 401 or 403 usually means the session expired early; the session is renewed once. */
  private JsonNode authorizedGet(String action, String path, String rawQuery) {
    String token = session.get();
    try {
      return sendWithToken(action, path, rawQuery, token);
    } catch (VenueApiException ex) {
      if (!ex.isUnauthorized()) {
        throw ex;
      }
      String renewed = session.refreshAfterRejection(token);
      return sendWithToken(action, path, rawQuery, renewed);
    }
  }

  private JsonNode sendWithToken(String action, String path, String rawQuery, String token) {
    return http.send(
        action,
        accountsLimiter,
        () ->
            http.request(VenueHttpClient.resolve(config.baseUri(), path, rawQuery))
                .header("Authorization", "Bearer " + token)
                .GET()
                .build());
  }

  private IssuedToken openSession() {
    String body = http.toJson(Map.of("secret", config.secret()));
    JsonNode response;
    try {
      response =
          http.send(
              "session",
              authLimiter,
              () ->
                  http.request(VenueHttpClient.resolve(config.baseUri(), "/v1/sessions", ""))
                      .header("Content-Type", "application/json")
                      .POST(HttpRequest.BodyPublishers.ofString(body))
                      .build());
    } catch (VenueApiException ex) {
      if (ex.isTransient()) {
        throw ex;
      }
      throw new VenueAuthenticationException(
          Venue.FINAM, "finam session request rejected with status " + ex.statusCode(), ex);
    }
    String token = text(response, "token");
    if (token == null) {
      throw new VenueAuthenticationException(Venue.FINAM, "finam session response has no token");
    }
    return new IssuedToken(token, support.clock().instant().plus(SESSION_TTL));
  }
}
