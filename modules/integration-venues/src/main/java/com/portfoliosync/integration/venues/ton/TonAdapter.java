package com.portfoliosync.integration.venues.ton;

import static com.portfoliosync.integration.venues.http.JsonValues.decimal;
import static com.portfoliosync.integration.venues.http.JsonValues.elements;
import static com.portfoliosync.integration.venues.http.JsonValues.firstArray;
import static com.portfoliosync.integration.venues.http.JsonValues.instant;
import static com.portfoliosync.integration.venues.http.JsonValues.scaled;
import static com.portfoliosync.integration.venues.http.JsonValues.text;

import com.fasterxml.jackson.databind.JsonNode;
import com.portfoliosync.integration.venues.AbstractVenueAdapter;
import com.portfoliosync.integration.venues.Venue;
import com.portfoliosync.integration.venues.VenueApiException;
import com.portfoliosync.integration.venues.VenueException;
import com.portfoliosync.integration.venues.VenueSupport;
import com.portfoliosync.integration.venues.config.TonConfig;
import com.portfoliosync.integration.venues.http.IntervalRateLimiter;
import com.portfoliosync.integration.venues.http.RequestRateLimiter;
import com.portfoliosync.integration.venues.http.VenueHttpClient;
import com.portfoliosync.integration.venues.model.Activities;
import com.portfoliosync.integration.venues.model.ActivityLine;
import com.portfoliosync.integration.venues.model.ActivityQuery;
import com.portfoliosync.integration.venues.model.Balance;
import com.portfoliosync.integration.venues.model.Position;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only TON wallet access. Toncenter provides the native balance and raw transactions; TonAPI,
 * when configured, adds jettons, staking and decoded events.
 */
public class TonAdapter extends AbstractVenueAdapter {
  private static final Logger log = LoggerFactory.getLogger(TonAdapter.class);

  public static final int TON_DECIMALS = 9;
  private static final String NATIVE_ASSET = "TON";

  private final TonConfig config;
  private final VenueHttpClient http;
  private final RequestRateLimiter toncenterLimiter;
  private final RequestRateLimiter tonapiLimiter;

  private volatile Set<String> addressVariants;

  public TonAdapter(TonConfig config, VenueSupport support) {
    super(support);
    this.config = config;
    this.http = support.httpClientFor(Venue.TON, config.timeout());
    this.toncenterLimiter = new IntervalRateLimiter(config.requestsPerSecond());
    this.tonapiLimiter = new IntervalRateLimiter(config.requestsPerSecond());
  }

  @Override
  public Venue venue() {
    return Venue.TON;
  }

  @Override
  public List<Balance> fetchBalances() {
    List<Balance> balances = new ArrayList<>();
    JsonNode response = toncenter("balance", "/getAddressBalance", VenueHttpClient.params("address", config.address()));
    BigDecimal nativeBalance = scaled(decimal(response, "result"), TON_DECIMALS);
    if (nativeBalance != null) {
      balances.add(new Balance(NATIVE_ASSET, nativeBalance, null, nativeBalance));
    }
    if (config.includeJettons() && config.tonapiBaseUri() != null) {
      try {
        balances.addAll(fetchJettonBalances());
      } catch (VenueApiException ex) {
        if (!isTonapiUnavailable(ex)) {
          throw ex;
        }
        log.info("tonapi jettons unavailable status={}, keeping native balance only", ex.statusCode());
      }
    }
    return balances;
  }

  private List<Balance> fetchJettonBalances() {
    JsonNode response =
        tonapi("jettons", "/v2/accounts/" + encodedAddress() + "/jettons", VenueHttpClient.params("limit", "200"));
    List<Balance> balances = new ArrayList<>();
    for (JsonNode item : elements(firstArray(response, "balances", "items", "jettons"))) {
      JsonNode jetton = item.path("jetton");
      String symbol = text(jetton, "symbol", "name", "address");
      BigDecimal amount = applyDecimals(decimal(item, "balance", "amount"), jetton.path("decimals"));
      if (symbol != null && amount != null) {
        balances.add(new Balance(symbol, amount, null, amount));
      }
    }
    return balances;
  }

  /** Staking pools as positions; unavailable staking data means no positions. */
  @Override
  public List<Position> fetchPositions(List<String> categories) {
    if (!config.includeStaking() || config.tonapiBaseUri() == null) {
      return List.of();
    }
    JsonNode response;
    try {
      response = tonapi("staking", "/v2/accounts/" + encodedAddress() + "/staking", Map.of());
    } catch (VenueApiException ex) {
      log.info("tonapi staking unavailable status={}", ex.statusCode());
      return List.of();
    }
    List<Position> positions = new ArrayList<>();
    for (JsonNode item : elements(firstArray(response, "items", "positions", "pools"))) {
      String pool = text(item, "pool", "name", "pool_name");
      BigDecimal amount = scaled(decimal(item, "amount", "balance", "staked"), TON_DECIMALS);
      String currency = text(item, "currency");
      positions.add(
          Position.holding(
              pool == null ? "TON Staking" : pool,
              amount,
              null,
              null,
              null,
              currency == null ? NATIVE_ASSET : currency));
    }
    return positions;
  }

  /**
   * Decoded TonAPI events first. Throttling, rejected keys or an empty event list fall back to the
   * raw Toncenter transaction messages.
   */
  @Override
  public List<ActivityLine> fetchActivities(ActivityQuery query) {
    List<ActivityLine> activities = List.of();
    if (config.tonapiBaseUri() != null) {
      try {
        activities = fetchTonapiEvents(query);
      } catch (VenueApiException ex) {
        if (!isTonapiUnavailable(ex)) {
          throw ex;
        }
        log.info("tonapi events unavailable status={}, falling back to toncenter", ex.statusCode());
      }
    }
    if (activities.isEmpty()) {
      activities = fetchToncenterTransactions(query);
    }
    return Activities.sortAndCap(activities, query.limit());
  }

  private List<ActivityLine> fetchTonapiEvents(ActivityQuery query) {
    JsonNode response =
        tonapi(
            "events",
            "/v2/accounts/" + encodedAddress() + "/events",
            VenueHttpClient.params("limit", String.valueOf(query.limit())));
    Set<String> variants = addressVariants();
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode event : elements(firstArray(response, "events", "items", "list"))) {
      Instant timestamp = instant(event, "timestamp", "utime", "time");
      if (isBefore(timestamp, query.since())) {
        continue;
      }
      BigDecimal fee = scaled(decimal(event, "fee", "event_fee", "total_fee"), TON_DECIMALS);
      JsonNode actions = event.has("actions") ? event.get("actions") : event.path("action");
      for (JsonNode action : actions.isArray() ? elements(actions) : List.of(actions)) {
        ActivityLine parsed = parseEventAction(action, variants, timestamp, fee);
        if (parsed != null) {
          activities.add(parsed);
        }
      }
    }
    return activities;
  }

  private List<ActivityLine> fetchToncenterTransactions(ActivityQuery query) {
    JsonNode response =
        toncenter(
            "transactions",
            "/getTransactions",
            VenueHttpClient.params("address", config.address(), "limit", String.valueOf(query.limit())));
    Set<String> variants = addressVariants();
    List<ActivityLine> activities = new ArrayList<>();
    for (JsonNode transaction : elements(response.path("result"))) {
      Instant timestamp = instant(transaction, "utime", "timestamp");
      if (isBefore(timestamp, query.since())) {
        continue;
      }
      List<JsonNode> messages = new ArrayList<>();
      if (transaction.path("in_msg").isObject()) {
        messages.add(transaction.get("in_msg"));
      }
      messages.addAll(elements(transaction.path("out_msgs")));
      for (JsonNode message : messages) {
        ActivityLine parsed = parseMessage(message, variants, timestamp);
        if (parsed != null) {
          activities.add(parsed);
        }
      }
    }
    return activities;
  }

  static ActivityLine parseEventAction(JsonNode action, Set<String> variants, Instant timestamp, BigDecimal fee) {
    if (action == null || !action.isObject()) {
      return null;
    }
    String type = text(action, "type", "action_type", "actionType");
    String key = type == null ? "" : type.toLowerCase(Locale.ROOT);
    JsonNode payload = actionPayload(action, type);
    if (key.contains("transfer")) {
      if (key.contains("jetton")) {
        JsonNode jetton = payload.path("jetton");
        String symbol = text(jetton, "symbol", "name", "address");
        Integer decimals = jetton.path("decimals").canConvertToInt() ? jetton.path("decimals").asInt() : null;
        return transfer(
            payload, "transfer", symbol == null ? "JETTON" : symbol, decimals, variants, timestamp, fee, action);
      }
      if (key.contains("nft")) {
        JsonNode nft = payload.has("nft") ? payload.get("nft") : payload.path("item");
        String symbol = nft.isObject() ? text(nft, "name", "address") : text(payload, "nft");
        return transfer(
            payload, "nft_transfer", symbol == null ? "NFT" : symbol, null, variants, timestamp, fee, action);
      }
      // after jetton: "jettontransfer" also contains "ton"
      if (key.contains("ton")) {
        return transfer(payload, "transfer", NATIVE_ASSET, TON_DECIMALS, variants, timestamp, fee, action);
      }
    }
    if (key.isEmpty()) {
      return null;
    }
    return ActivityLine.builder(key)
        .fee(fee, fee == null ? null : NATIVE_ASSET)
        .timestamp(timestamp)
        .raw(action)
        .build();
  }

  private static ActivityLine transfer(
      JsonNode payload,
      String prefix,
      String asset,
      Integer decimals,
      Set<String> variants,
      Instant timestamp,
      BigDecimal fee,
      JsonNode raw) {
    String direction = direction(
        address(payload, "sender", "from", "source"), address(payload, "recipient", "to", "destination"), variants);
    BigDecimal amount = decimal(payload, "amount", "value");
    if (amount != null && decimals != null) {
      amount = scaled(amount, decimals);
    }
    if (amount == null && "nft_transfer".equals(prefix)) {
      amount = BigDecimal.ONE;
    }
    return ActivityLine.builder(direction == null ? prefix : prefix + "_" + direction)
        .baseAsset(asset)
        .side(direction)
        .amount(amount)
        .fee(fee, fee == null ? null : NATIVE_ASSET)
        .timestamp(timestamp)
        .raw(raw)
        .build();
  }

  static ActivityLine parseMessage(JsonNode message, Set<String> variants, Instant timestamp) {
    BigDecimal amount = scaled(decimal(message, "value", "amount"), TON_DECIMALS);
    if (amount == null || amount.signum() == 0) {
      return null;
    }
    String direction =
        direction(address(message, "source", "from"), address(message, "destination", "to"), variants);
    return ActivityLine.builder(direction == null ? "transfer" : "transfer_" + direction)
        .baseAsset(NATIVE_ASSET)
        .side(direction)
        .amount(amount)
        .timestamp(timestamp)
        .raw(message)
        .build();
  }

  /** {@code in} when the wallet receives, {@code out} when it sends, null when neither matches. */
  static String direction(String sender, String recipient, Set<String> variants) {
    if (matches(recipient, variants)) {
      return "in";
    }
    return matches(sender, variants) ? "out" : null;
  }

  private static boolean matches(String candidate, Set<String> variants) {
    if (candidate == null) {
      return false;
    }
    return variants.stream().anyMatch(candidate::equalsIgnoreCase);
  }

  private static JsonNode actionPayload(JsonNode action, String type) {
    if (type != null) {
      for (String key : List.of(type, type.toLowerCase(Locale.ROOT))) {
        if (action.path(key).isObject()) {
          return action.get(key);
        }
      }
    }
    for (String key : List.of("payload", "data")) {
      if (action.path(key).isObject()) {
        return action.get(key);
      }
    }
    return action;
  }

  private static String address(JsonNode node, String... fields) {
    for (String field : fields) {
      JsonNode value = node.path(field);
      if (value.isTextual() && !value.asText().isBlank()) {
        return value.asText();
      }
      if (value.isObject()) {
        String nested = text(value, "address", "raw", "raw_address", "account", "account_address");
        if (nested != null) {
          return nested;
        }
      }
    }
    return null;
  }

  private static BigDecimal applyDecimals(BigDecimal raw, JsonNode decimals) {
    if (raw == null || !decimals.canConvertToInt() && !decimals.isTextual()) {
      return raw;
    }
    try {
      return scaled(raw, Integer.parseInt(decimals.asText().trim()));
    } catch (NumberFormatException ex) {
      return raw;
    }
  }

  private static boolean isBefore(Instant timestamp, Instant since) {
    return since != null && timestamp != null && timestamp.isBefore(since);
  }

  private static boolean isTonapiUnavailable(VenueApiException ex) {
    return ex.isUnauthorized() || ex.isRateLimitError();
  }

  /** The configured address plus the raw and (non-)bounceable forms TonAPI reports for it. */
  private Set<String> addressVariants() {
    Set<String> cached = addressVariants;
    if (cached != null) {
      return cached;
    }
    Set<String> variants = new LinkedHashSet<>();
    variants.add(config.address());
    if (config.tonapiBaseUri() != null) {
      try {
        JsonNode response = tonapi("address", "/v2/address/" + encodedAddress(), Map.of());
        for (String field : List.of("raw_form", "raw_address", "bounceable", "non_bounceable", "address")) {
          JsonNode value = response.path(field);
          String form = value.isObject() ? text(value, "b64url", "b64") : text(response, field);
          if (form != null) {
            variants.add(form);
          }
        }
      } catch (VenueApiException ex) {
        log.debug("tonapi address lookup failed status={}", ex.statusCode());
      }
    }
    addressVariants = Set.copyOf(variants);
    return addressVariants;
  }

  private String encodedAddress() {
    return VenueHttpClient.encode(config.address());
  }

  private JsonNode toncenter(String action, String path, Map<String, String> params) {
    Map<String, String> query = new LinkedHashMap<>(params);
    if (config.toncenterApiKey() != null) {
      query.putIfAbsent("api_key", config.toncenterApiKey());
    }
    URI uri = VenueHttpClient.resolve(config.toncenterBaseUri(), path, query);
    return http.send(
        action,
        toncenterLimiter,
        () -> withKey(http.request(uri), config.toncenterApiKey()).GET().build(),
        body -> {
          if (body.path("ok").isBoolean() && !body.path("ok").asBoolean()) {
            throw new VenueException(Venue.TON, "toncenter " + action + " failed: " + text(body, "error"));
          }
        });
  }

  private JsonNode tonapi(String action, String path, Map<String, String> params) {
    URI uri = VenueHttpClient.resolve(config.tonapiBaseUri(), path, params);
    return http.send(action, tonapiLimiter, () -> withKey(http.request(uri), config.tonapiApiKey()).GET().build());
  }

  private static HttpRequest.Builder withKey(HttpRequest.Builder builder, String apiKey) {
    return apiKey == null ? builder : builder.header("X-API-Key", apiKey);
  }
}
