package com.portfoliosync.worker.sync;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/** Incremental-sync state kept in {@code integrations.extra_params}. */
final class SyncCursor {
  static final String LAST_SYNC_AT = "last_sync_at";
  static final String LAST_CURSOR = "last_cursor";
  static final String SYNC_LIMIT = "sync_limit";
  static final String WALLET_CURSORS = "wallet_cursors";

  private SyncCursor() {}

  /** ISO-8601 instant of the last sync; values without an offset are read as UTC. */
  static Instant lastSyncAt(JsonNode extraParams) {
    String value = text(extraParams, LAST_SYNC_AT);
    if (value == null) {
      return null;
    }
    String iso = value.trim().replace(' ', 'T');
    try {
      if (iso.length() == 10) {
        return LocalDate.parse(iso).atStartOfDay(ZoneOffset.UTC).toInstant();
      }
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(iso, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime offsetDateTime) {
        return offsetDateTime.toInstant();
      }
      return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  /** Cursor fields of one wallet; wallets of a TON integration advance independently. */
  static JsonNode walletState(JsonNode extraParams, long walletId) {
    if (extraParams == null) {
      return null;
    }
    JsonNode state = extraParams.path(WALLET_CURSORS).get(String.valueOf(walletId));
    return state != null && state.isObject() ? state : null;
  }

  static String lastCursor(JsonNode extraParams) {
    return text(extraParams, LAST_CURSOR);
  }

  static int limit(JsonNode extraParams, int fallback) {
    JsonNode node = extraParams == null ? null : extraParams.get(SYNC_LIMIT);
    if (node != null && !node.isNull()) {
      int configured = node.isNumber() ? node.asInt() : parseInt(node.asText());
      if (configured > 0) {
        return configured;
      }
    }
    return fallback > 0 ? fallback : 200;
  }

  private static int parseInt(String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      return 0;
    }
  }

  private static String text(JsonNode extraParams, String field) {
    if (extraParams == null) {
      return null;
    }
    JsonNode node = extraParams.get(field);
    if (node == null || node.isNull() || !node.isValueNode()) {
      return null;
    }
    String text = node.asText();
    return text.isBlank() ? null : text;
  }
}
