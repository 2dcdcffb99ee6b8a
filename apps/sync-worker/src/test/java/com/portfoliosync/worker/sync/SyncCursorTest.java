package com.portfoliosync.worker.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SyncCursorTest {
  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void readsLastSyncAtInSeveralIsoShapes() throws Exception {
    assertEquals(Instant.parse("2026-02-28T23:00:00Z"), SyncCursor.lastSyncAt(json("{\"last_sync_at\":\"2026-03-01T02:00:00+03:00\"}")));
    assertEquals(Instant.parse("2026-03-01T02:00:00Z"), SyncCursor.lastSyncAt(json("{\"last_sync_at\":\"2026-03-01 02:00:00\"}")));
    assertEquals(Instant.parse("2026-03-01T00:00:00Z"), SyncCursor.lastSyncAt(json("{\"last_sync_at\":\"2026-03-01\"}")));
  }

  @Test
  void unreadableOrMissingLastSyncAtMeansFullSync() throws Exception {
    assertNull(SyncCursor.lastSyncAt(json("{\"last_sync_at\":\"yesterday\"}")));
    assertNull(SyncCursor.lastSyncAt(json("{}")));
    assertNull(SyncCursor.lastSyncAt(null));
  }

  @Test
  void limitPrefersPositiveSyncLimit() throws Exception {
    assertEquals(50, SyncCursor.limit(json("{\"sync_limit\":50}"), 200));
    assertEquals(75, SyncCursor.limit(json("{\"sync_limit\":\"75\"}"), 200));
    assertEquals(120, SyncCursor.limit(json("{\"sync_limit\":0}"), 120));
    assertEquals(200, SyncCursor.limit(json("{}"), 0));
  }

  @Test
  void readsOpaqueCursor() throws Exception {
    assertEquals("lt:4711", SyncCursor.lastCursor(json("{\"last_cursor\":\"lt:4711\"}")));
    assertNull(SyncCursor.lastCursor(json("{\"last_cursor\":\" \"}")));
  }

  @Test
  void readsWalletStateByWalletId() throws Exception {
    JsonNode extra =
        json(
            """
            {"last_sync_at":"2026-03-01T00:00:00Z",
             "wallet_cursors":{"7":{"last_sync_at":"2026-02-01T00:00:00Z","last_cursor":"lt:9"},"8":"broken"}}
            """);

    assertEquals(Instant.parse("2026-02-01T00:00:00Z"), SyncCursor.lastSyncAt(SyncCursor.walletState(extra, 7)));
    assertEquals("lt:9", SyncCursor.lastCursor(SyncCursor.walletState(extra, 7)));
    assertNull(SyncCursor.walletState(extra, 8));
    assertNull(SyncCursor.lastSyncAt(SyncCursor.walletState(extra, 9)));
  }

  private JsonNode json(String value) throws Exception {
    return objectMapper.readTree(value);
  }
}
