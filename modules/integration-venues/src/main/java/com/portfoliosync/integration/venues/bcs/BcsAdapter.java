package com.portfoliosync.integration.venues.bcs;

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
import com.portfoliosync.integration.venues.auth.RefreshedTokens;
import com.portfoliosync.integration.venues.auth.TokenUpdateListener;
import com.portfoliosync.integration.venues.config.BcsConfig;
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
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * BCS Trade API. Access tokens come from the Keycloak refresh-token grant; rotated tokens are
 * handed to the {@link TokenUpdateListener} so the next run starts from them.
 */
public class BcsAdapter extends AbstractVenueAdapter {
  private static final Logger log = LoggerFactory.getLogger(BcsAdapter.class);

  static final String TOKEN_PATH = "/trade-api-keycloak/realms/tradeapi/protocol/openid-connect/token";
  static final String LIMITS_PATH = "/trade-api-bff-limit/api/v1/limits";
  static final String PORTFOLIO_PATH = "/trade-api-bff-portfolio/api/v1/portfolio";
  static final String ORDERS_PATH = "/trade-api-bff-operations/api/v1/orders";
  private static final Duration MIN_ACCESS_TTL = Duration.ofMinutes(10);

  private final BcsConfig config;
  private final VenueHttpClient http;
  private final TokenUpdateListener tokenListener;
  private final AccessTokenCache tokens;
  private final RequestRateLimiter limitsLimiter;
  private final RequestRateLimiter portfolioLimiter;
  private final RequestRateLimiter ordersLimiter;

  private volatile String refreshToken;

  public BcsAdapter(BcsConfig config, VenueSupport support, TokenUpdateListener tokenListener) {
    super(support);
    this.config = config;
    this.http = support.httpClientFor(Venue.BCS, config.timeout());
    this.tokenListener = tokenListener == null ? TokenUpdateListener.NONE : tokenListener;
    this.refreshToken = config.refreshToken();
    IssuedToken initial =
        config.accessToken() == null ? null : new IssuedToken(config.accessToken(), config.accessExpiresAt());
    this.tokens = new AccessTokenCache(this::refreshAccessToken, config.tokenRefreshMargin(), support.clock(), initial);
    this.limitsLimiter = SlidingWindowRateLimiter.perSecond(config.requestsPerSecond());
    this.portfolioLimiter = SlidingWindowRateLimiter.perSecond(config.requestsPerSecond());
    this.ordersLimiter = SlidingWindowRateLimiter.perSecond(config.requestsPerSecond());
  }

  @Override
  public Venue venue() {
    return Venue.BCS;
  }

  @Override
  public List<Balance> fetchBalances() {
    List<Balance> balances = parseLimitBalances(authorizedGet("limits", LIMITS_PATH, "", limitsLimiter));
    if (!balances.isEmpty()) {
      return balances;
    }
    return parsePortfolioBalances(portfolioItems());
  }

  @Override
  public List<Position> fetchPositions(List<String> categories) {
    List<Position> positions = parseLimitPositions(authorizedGet("limits", LIMITS_PATH, "", limitsLimiter));
    if (!positions.isEmpty()) {
      return positions;
    }
    return parsePortfolioPositions(portfolioItems());
  }

  /** Order history is not exposed to every token scope, so an HTTP error means no activities. */
  @Override
  public List<ActivityLine> fetchActivities(ActivityQuery query) {
    Map<String, String> params =
        VenueHttpClient.params(
            "limit", String.valueOf(query.limit()),
            "since", query.since() == null ? null : query.since().toString());
    JsonNode response;
    try {
      response = authorizedGet("orders", ORDERS_PATH, VenueHttpClient.queryString(params), ordersLimiter);
    } catch (VenueApiException ex) {
      log.info("bcs order history unavailable status={}", ex.statusCode());
      return List.of();
    }
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode order : elements(firstArray(response, "items", "orders", "list", "data"))) {
      activities.add(
          ActivityLine.builder("order")
              .symbol(text(order, "ticker", "symbol", "isin"))
              .quoteAsset(upper(text(order, "currency", "currencyCode")))
              .side(text(order, "side", "operation"))
              .amount(decimal(order, "qty", "quantity", "lots"))
              .price(decimal(order, "price"))
              .fee(decimal(order, "fee"), upper(text(order, "feeCurrency")))
              .timestamp(instant(order, "time", "createdAt", "timestamp"))
              .raw(order)
              .build());
    }
    return Activities.sortAndCap(activities, query.limit());
  }

  private List<JsonNode> portfolioItems() {
    JsonNode response = authorizedGet("portfolio", PORTFOLIO_PATH, "", portfolioLimiter);
    if (response.isArray()) {
      return elements(response);
    }
    return elements(firstArray(response, "data", "items", "list", "rows"));
  }

  static List<Balance> parseLimitBalances(JsonNode payload) {
    JsonNode root = payload.path("data").isObject() ? payload.path("data") : payload;
    JsonNode rows =
        firstArray(
            root, "moneyLimits", "currencies", "currencyLimits", "money", "cash", "limitsByCurrency", "items", "list");
    List<Balance> balances = new ArrayList<>();
    for (JsonNode row : elements(rows)) {
      String asset = upper(text(row, "currencyCode", "currency", "asset"));
      if (asset == null) {
        continue;
      }
      BigDecimal quantity = decimal(row, "quantity");
      BigDecimal free = decimal(row, "free", "available", "availableAmount");
      BigDecimal locked = decimal(row, "locked", "blocked", "reserved");
      BigDecimal total = decimal(row, "total", "balance", "amount");
      free = free != null ? free : quantity;
      total = total != null ? total : quantity;
      if (total == null && free != null && locked != null) {
        total = free.add(locked);
      }
      balances.add(new Balance(asset, free, locked, total));
    }
    return balances;
  }

  static List<Position> parseLimitPositions(JsonNode payload) {
    JsonNode root = payload.path("data").isObject() ? payload.path("data") : payload;
    List<Position> positions = new ArrayList<>();
    for (JsonNode row : elements(root.path("depoLimit"))) {
      addPosition(
          positions,
          row,
          decimal(row, "quantity", "lots"),
          decimal(row, "pnl", "unrealizedPnl"));
    }
    for (JsonNode row : elements(root.path("futureHolding"))) {
      addPosition(
          positions,
          row,
          decimal(row, "totalNet", "positionValue"),
          decimal(row, "varMargin", "realVarMargin"));
    }
    if (!positions.isEmpty()) {
      return positions;
    }
    JsonNode rows = firstArray(root, "positions", "securities", "instruments", "instrumentLimits", "items", "list");
    for (JsonNode row : elements(rows)) {
      addPosition(
          positions,
          row,
          decimal(row, "qty", "quantity", "balance", "lots"),
          decimal(row, "pnl", "unrealizedPnl"));
    }
    return positions;
  }

  private static void addPosition(List<Position> positions, JsonNode row, BigDecimal quantity, BigDecimal pnl) {
    String symbol = text(row, "ticker", "symbol", "isin", "figi");
    if (symbol == null) {
      return;
    }
    positions.add(
        Position.holding(
            symbol,
            quantity,
            decimal(row, "averagePrice", "avgPrice", "entryPrice"),
            decimal(row, "price", "currentPrice", "marketPrice"),
            pnl,
            upper(text(row, "currency", "currencyCode"))));
  }

  static List<Balance> parsePortfolioBalances(List<JsonNode> items) {
    List<Balance> balances = new ArrayList<>();
    for (JsonNode row : items) {
      if (!isMoney(row)) {
        continue;
      }
      String asset = upper(text(row, "currency", "ticker", "baseAssetTicker"));
      if (asset == null) {
        continue;
      }
      BigDecimal free = decimal(row, "quantity");
      BigDecimal locked = decimal(row, "locked", "lockedForFutures");
      BigDecimal total = decimal(row, "balanceValue", "quantity");
      balances.add(new Balance(asset, free, locked, total));
    }
    return balances;
  }

  static List<Position> parsePortfolioPositions(List<JsonNode> items) {
    List<Position> positions = new ArrayList<>();
    for (JsonNode row : items) {
      String symbol = text(row, "ticker", "baseAssetTicker", "displayName");
      if (isMoney(row) || symbol == null) {
        continue;
      }
      positions.add(
          Position.holding(
              symbol,
              decimal(row, "quantity"),
              decimal(row, "balancePrice"),
              decimal(row, "currentPrice"),
              decimal(row, "unrealizedPL"),
              upper(text(row, "currency"))));
    }
    return positions;
  }

  private static boolean isMoney(JsonNode row) {
    return "CURRENCY".equals(text(row, "upperType")) || "moneyLimit".equals(text(row, "type"));
  }

  /** Sends with the cached access token and retries once with a fresh token after a 401. */
  private JsonNode authorizedGet(String action, String path, String rawQuery, RequestRateLimiter limiter) {
    String token = tokens.get();
    try {
      return http.send(action, limiter, bearerGet(path, rawQuery, token));
    } catch (VenueApiException ex) {
      if (ex.statusCode() != 401) {
        throw ex;
      }
      log.info("bcs rejected access token action={}, refreshing", action);
      String refreshed = tokens.refreshAfterRejection(token);
      return http.send(action, limiter, bearerGet(path, rawQuery, refreshed));
    }
  }

  private Supplier<HttpRequest> bearerGet(String path, String rawQuery, String token) {
    return () ->
        http.request(VenueHttpClient.resolve(config.baseUri(), path, rawQuery))
            .header("Authorization", "Bearer " + token)
            .GET()
            .build();
  }

  private IssuedToken refreshAccessToken() {
    String form =
        VenueHttpClient.queryString(
            VenueHttpClient.params(
                "client_id", config.clientId(),
                "refresh_token", refreshToken,
                "grant_type", "refresh_token"));
    JsonNode response;
    try {
      response =
          http.send(
              "token refresh",
              RequestRateLimiter.UNLIMITED,
              () ->
                  http.request(VenueHttpClient.resolve(config.baseUri(), TOKEN_PATH, ""))
                      .header("Content-Type", "application/x-www-form-urlencoded")
                      .POST(HttpRequest.BodyPublishers.ofString(form))
                      .build());
    } catch (VenueApiException ex) {
      if (ex.isTransient()) {
        throw ex;
      }
      throw new VenueAuthenticationException(
          Venue.BCS, "bcs token refresh rejected with status " + ex.statusCode(), ex);
    }
    String accessToken = text(response, "access_token");
    if (accessToken == null) {
      throw new VenueAuthenticationException(Venue.BCS, "bcs token response has no access_token");
    }
    Instant now = support.clock().instant();
    String rotated = text(response, "refresh_token");
    if (rotated != null) {
      refreshToken = rotated;
    }
    Instant accessExpiresAt = now.plus(accessTtl(decimal(response, "expires_in")));
    BigDecimal refreshSeconds = decimal(response, "refresh_expires_in");
    Instant refreshExpiresAt =
        refreshSeconds == null ? config.refreshExpiresAt() : now.plusSeconds(refreshSeconds.longValue());

    tokenListener.onTokensRefreshed(
        new RefreshedTokens(accessToken, refreshToken, accessExpiresAt, refreshExpiresAt));
    log.info("bcs access token refreshed expiresAt={}", accessExpiresAt);
    return new IssuedToken(accessToken, accessExpiresAt);
  }

  /** Without {@code expires_in} the token is kept long enough to outlive the refresh margin. */
  private Duration accessTtl(BigDecimal expiresIn) {
    if (expiresIn != null && expiresIn.signum() > 0) {
      return Duration.ofSeconds(expiresIn.longValue());
    }
    Duration margined = config.tokenRefreshMargin().multipliedBy(2);
    return margined.compareTo(MIN_ACCESS_TTL) > 0 ? margined : MIN_ACCESS_TTL;
  }
}
