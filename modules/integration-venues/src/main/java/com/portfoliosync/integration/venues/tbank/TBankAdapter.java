package com.portfoliosync.integration.venues.tbank;

import static com.portfoliosync.integration.venues.http.JsonValues.decimal;
import static com.portfoliosync.integration.venues.http.JsonValues.elements;
import static com.portfoliosync.integration.venues.http.JsonValues.instant;
import static com.portfoliosync.integration.venues.http.JsonValues.text;
import static com.portfoliosync.integration.venues.http.JsonValues.upper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.portfoliosync.integration.venues.AbstractVenueAdapter;
import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueConfigurationException;
import com.portfoliosync.integration.venues.VenueSupport;
import com.portfoliosync.integration.venues.config.TBankConfig;
import com.portfoliosync.integration.venues.http.RequestRateLimiter;
import com.portfoliosync.integration.venues.http.SlidingWindowRateLimiter;
import com.portfoliosync.integration.venues.http.VenueHttpClient;
import com.portfoliosync.integration.venues.model.Activities;
import com.portfoliosync.integration.venues.model.ActivityLine;
import com.portfoliosync.integration.venues.model.ActivityQuery;
import com.portfoliosync.integration.venues.model.Balance;
import com.portfoliosync.integration.venues.model.Position;
import java.math.BigDecimal;
import java.math.MathContext;
import java.net.http.HttpRequest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** T-Invest API through its REST gateway. Every method is a JSON POST. */
public class TBankAdapter extends AbstractVenueAdapter {
  private static final String SERVICE_PREFIX = "/tinkoff.public.invest.api.contract.v1.";
  private static final String OPERATION_TYPE_PREFIX = "OPERATION_TYPE_";

  private final TBankConfig config;
  private final VenueHttpClient http;
  private final RequestRateLimiter operationsLimiter;
  private final RequestRateLimiter usersLimiter;

  private volatile String resolvedAccountId;
  private volatile String lastCursor;

  public TBankAdapter(TBankConfig config, VenueSupport support) {
    super(support);
    this.config = config;
    this.http = support.httpClientFor(Venue.TBANK, config.timeout());
    this.operationsLimiter = SlidingWindowRateLimiter.perMinute(config.operationsPerMinute());
    this.usersLimiter = SlidingWindowRateLimiter.perMinute(config.usersPerMinute());
    this.resolvedAccountId = config.accountId();
  }

  @Override
  public Venue venue() {
    return Venue.TBANK;
  }

  @Override
  public List<Balance> fetchBalances() {
    String accountId = accountId();
    Map<String, BigDecimal[]> merged = new LinkedHashMap<>();
    JsonNode positions = call("positions", "OperationsService/GetPositions", accountBody(accountId), operationsLimiter);
    JsonNode limits =
        call("withdraw limits", "OperationsService/GetWithdrawLimits", accountBody(accountId), operationsLimiter);
    accumulate(merged, positions);
    accumulate(merged, limits);

    List<Balance> balances = new ArrayList<>();
    merged.forEach(
        (currency, values) -> {
          if (values[0] != null || values[1] != null) {
            balances.add(Balance.ofFreeAndLocked(currency, values[0], values[1]));
          }
        });
    return balances;
  }

  /**
   * Free and blocked money by currency. A later response overrides the amounts an earlier one
   * reported for the same currency.
   */
  private static void accumulate(Map<String, BigDecimal[]> merged, JsonNode response) {
    Map<String, BigDecimal[]> current = new LinkedHashMap<>();
    for (JsonNode money : elements(response.path("money"))) {
      String currency = upper(text(money, "currency"));
      if (currency != null) {
        BigDecimal[] values = current.computeIfAbsent(currency, key -> new BigDecimal[2]);
        values[0] = add(values[0], decimal(money));
      }
    }
    for (JsonNode money : elements(response.path("blocked"))) {
      String currency = upper(text(money, "currency"));
      if (currency != null) {
        BigDecimal[] values = current.computeIfAbsent(currency, key -> new BigDecimal[2]);
        values[1] = add(values[1], decimal(money));
      }
    }
    current.forEach(
        (currency, values) -> {
          BigDecimal[] target = merged.computeIfAbsent(currency, key -> new BigDecimal[2]);
          if (values[0] != null) {
            target[0] = values[0];
          }
          if (values[1] != null) {
            target[1] = values[1];
          }
        });
  }

  @Override
  public List<Position> fetchPositions(List<String> categories) {
    String accountId = accountId();
    JsonNode positions = call("positions", "OperationsService/GetPositions", accountBody(accountId), operationsLimiter);
    JsonNode portfolio = call("portfolio", "OperationsService/GetPortfolio", accountBody(accountId), operationsLimiter);

    List<Position> base = new ArrayList<>();
    for (String field : List.of("securities", "futures", "options")) {
      for (JsonNode row : elements(positions.path(field))) {
        String symbol = text(row, "ticker", "figi", "instrumentUid", "uid");
        BigDecimal quantity = decimal(row, "balance");
        if (symbol == null) {
          continue;
        }
        base.add(
            Position.holding(
                symbol,
                quantity,
                decimal(row, "averagePositionPrice"),
                decimal(row, "currentPrice"),
                decimal(row, "expectedYield"),
                upper(text(row, "currency"))));
      }
    }
    Map<String, Position> overlay = new LinkedHashMap<>();
    for (JsonNode row : elements(portfolio.path("positions"))) {
      String symbol = text(row, "ticker", "figi", "instrumentUid", "uid");
      if (symbol == null) {
        continue;
      }
      JsonNode averagePrice = row.path("averagePositionPrice");
      overlay.put(
          symbol,
          Position.holding(
              symbol,
              decimal(row, "quantity"),
              decimal(averagePrice),
              decimal(row, "currentPrice"),
              decimal(row, "expectedYield"),
              upper(Optional.ofNullable(text(row, "currency")).orElse(text(averagePrice, "currency")))));
    }
    if (base.isEmpty()) {
      return List.copyOf(overlay.values());
    }
    return base.stream().map(position -> merge(position, overlay.get(position.symbol()))).toList();
  }

  static Position merge(Position base, Position overlay) {
    if (overlay == null) {
      return base;
    }
    return Position.holding(
        base.symbol(),
        base.size() != null ? base.size() : overlay.size(),
        overlay.entryPrice() != null ? overlay.entryPrice() : base.entryPrice(),
        overlay.markPrice() != null ? overlay.markPrice() : base.markPrice(),
        overlay.unrealizedPnl() != null ? overlay.unrealizedPnl() : base.unrealizedPnl(),
        overlay.currency() != null ? overlay.currency() : base.currency());
  }

  @Override
  public List<ActivityLine> fetchActivities(ActivityQuery query) {
    String accountId = accountId();
    Instant now = support.clock().instant();
    Instant since = query.since() != null ? query.since() : now.minus(config.defaultLookback());

    ObjectNode body = accountBody(accountId);
    body.put("from", since.toString());
    body.put("to", now.toString());
    body.put("limit", query.limit());
    body.put("state", "OPERATION_STATE_EXECUTED");
    if (query.cursor() != null) {
      body.put("cursor", query.cursor());
    }
    JsonNode response = call("operations", "OperationsService/GetOperationsByCursor", body, operationsLimiter);
    String nextCursor = text(response, "nextCursor");
    lastCursor = nextCursor;

    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode operation : elements(response.path("items"))) {
      activities.add(parseOperation(operation));
    }
    return Activities.sortAndCap(activities, query.limit());
  }

  @Override
  public Optional<String> lastCursor() {
    return Optional.ofNullable(lastCursor);
  }

  static ActivityLine parseOperation(JsonNode operation) {
    String type = operationType(text(operation, "type", "operationType"));
    BigDecimal quantity = decimal(operation, "quantity");
    BigDecimal price = decimal(operation, "price");
    BigDecimal payment = decimal(operation, "payment");
    if (price == null && quantity != null && quantity.signum() != 0 && payment != null) {
      price = payment.abs().divide(quantity.abs(), MathContext.DECIMAL64);
    }
    String quote = upper(text(operation.path("price"), "currency"));
    if (quote == null) {
      quote = upper(text(operation.path("payment"), "currency"));
    }
    return ActivityLine.builder(type == null ? "operation" : type)
        .symbol(text(operation, "ticker", "figi", "instrumentUid", "uid"))
        .quoteAsset(quote)
        .side(inferSide(type))
        .amount(quantity)
        .price(price)
        .fee(decimal(operation, "commission"), upper(text(operation.path("commission"), "currency")))
        .timestamp(instant(operation, "date"))
        .raw(operation)
        .build();
  }

  static String operationType(String value) {
    if (value == null) {
      return null;
    }
    String name = value.replace(OPERATION_TYPE_PREFIX, "").trim().toLowerCase(Locale.ROOT);
    return name.isEmpty() ? null : name;
  }

  static String inferSide(String operationType) {
    if (operationType == null) {
      return null;
    }
    String upper = operationType.toUpperCase(Locale.ROOT);
    if (upper.contains("BUY")) {
      return "BUY";
    }
    if (upper.contains("SELL")) {
      return "SELL";
    }
    return null;
  }

  private String accountId() {
    String accountId = resolvedAccountId;
    if (accountId != null) {
      return accountId;
    }
    JsonNode response =
        call("accounts", "UsersService/GetAccounts", http.objectMapper().createObjectNode(), usersLimiter);
    List<JsonNode> accounts = elements(response.path("accounts"));
    if (accounts.isEmpty() || text(accounts.get(0), "id") == null) {
      throw new VenueConfigurationException(Venue.TBANK, "tbank token has no accessible accounts");
    }
    resolvedAccountId = text(accounts.get(0), "id");
    return resolvedAccountId;
  }

  private ObjectNode accountBody(String accountId) {
    ObjectNode body = http.objectMapper().createObjectNode();
    body.put("accountId", accountId);
    return body;
  }

  private JsonNode call(String action, String method, JsonNode body, RequestRateLimiter limiter) {
    String payload = http.toJson(body);
    return http.send(
        action,
        limiter,
        () ->
            http.request(VenueHttpClient.resolve(config.baseUri(), SERVICE_PREFIX + method, ""))
                .header("Authorization", "Bearer " + config.token())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build());
  }

  private static BigDecimal add(BigDecimal left, BigDecimal right) {
    if (left == null) {
      return right;
    }
    return right == null ? left : left.add(right);
  }
}
