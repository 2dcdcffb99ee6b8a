package com.portfoliosync.domain.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.portfoliosync.integration.venues.model.ActivityLine;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds {@code integration_dedupe_key} values that stay stable across re-runs of the same sync.
 *
 * <p>A vendor id from the raw payload wins, scoped by the activity's instrument because trade ids
 * are numbered per symbol on several venues. Otherwise the key carries a SHA-256 of the
 * activity's fields serialized as JSON with sorted keys.
 */
public class DedupeKeyGenerator {
  public static final int MAX_KEY_LENGTH = 240;

  static final List<String> EXTERNAL_ID_FIELDS =
      List.of(
          "id",
          "tradeId",
          "trade_id",
          "orderId",
          "order_id",
          "txId",
          "txid",
          "tx_id",
          "transaction_id",
          "hash",
          "uuid",
          "uid",
          "transferId",
          "transfer_id",
          "withdrawOrderId",
          "depositId",
          "clientOrderId");

  private final ObjectMapper canonicalMapper;

  public DedupeKeyGenerator() {
    this.canonicalMapper =
        JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();
  }

  public String key(long integrationId, ActivityLine activity) {
    return key(integrationId, activity, null);
  }

  /** {@code suffix} separates the legs of one activity, e.g. {@code from} and {@code to}. */
  public String key(long integrationId, ActivityLine activity, String suffix) {
    String externalId = externalId(activity.raw());
    String identity;
    if (externalId == null) {
      identity = sha256(canonicalJson(activity));
    } else {
      String scope = instrumentScope(activity);
      identity = scope == null ? externalId : scope + ":" + externalId;
    }
    String key = integrationId + ":" + activity.activityType() + ":" + identity;
    if (suffix != null && !suffix.isBlank()) {
      key = key + ":" + suffix;
    }
    return key.length() > MAX_KEY_LENGTH ? sha256(key) : key;
  }

  static String instrumentScope(ActivityLine activity) {
    if (activity.symbol() != null && !activity.symbol().isBlank()) {
      return activity.symbol().trim().toUpperCase(Locale.ROOT);
    }
    if (activity.baseAsset() == null || activity.baseAsset().isBlank()) {
      return null;
    }
    String base = activity.baseAsset().trim().toUpperCase(Locale.ROOT);
    if (activity.quoteAsset() == null || activity.quoteAsset().isBlank()) {
      return base;
    }
    return base + "/" + activity.quoteAsset().trim().toUpperCase(Locale.ROOT);
  }

  static String externalId(JsonNode raw) {
    if (raw == null || !raw.isObject()) {
      return null;
    }
    for (String field : EXTERNAL_ID_FIELDS) {
      JsonNode value = raw.get(field);
      if (value == null || !value.isValueNode() || value.isNull()) {
        continue;
      }
      if (value.isNumber() && value.decimalValue().signum() == 0 || value.isBoolean() && !value.asBoolean()) {
        continue;
      }
      String text = value.asText().trim();
      if (!text.isEmpty()) {
        return text;
      }
    }
    return null;
  }

  String canonicalJson(ActivityLine activity) {
    Map<String, Object> payload = new TreeMap<>();
    payload.put("activity_type", activity.activityType());
    payload.put("symbol", activity.symbol());
    payload.put("base_asset", activity.baseAsset());
    payload.put("quote_asset", activity.quoteAsset());
    payload.put("side", activity.side());
    payload.put("amount", plain(activity.amount()));
    payload.put("price", plain(activity.price()));
    payload.put("timestamp", activity.timestamp() == null ? null : activity.timestamp().toString());
    payload.put(
        "raw",
        activity.raw() != null && activity.raw().isObject()
            ? canonicalMapper.convertValue(activity.raw(), Object.class)
            : null);
    try {
      return canonicalMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize activity for dedupe key", ex);
    }
  }

  private static String plain(BigDecimal value) {
    return value == null ? null : value.stripTrailingZeros().toPlainString();
  }

  static String sha256(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }
}
