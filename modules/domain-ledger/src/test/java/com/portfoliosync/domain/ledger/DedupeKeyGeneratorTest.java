package com.portfoliosync.domain.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.integration.venues.model.ActivityLine;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DedupeKeyGeneratorTest {
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final DedupeKeyGenerator generator = new DedupeKeyGenerator();

  @Test
  void shouldPreferVendorIdInFieldOrder() throws Exception {
    ActivityLine line =
        ActivityLine.builder("deposit")
            .raw(objectMapper.readTree("{\"txId\":\"0xabc\",\"orderId\":\"o-1\",\"id\":\"\"}"))
            .build();

    assertEquals("5:deposit:o-1", generator.key(5L, line));
    assertEquals("5:deposit:o-1:from", generator.key(5L, line, "from"));
  }

  @Test
  void shouldScopeVendorIdBySymbol() throws Exception {
    ActivityLine btc =
        ActivityLine.builder("spot_trade").symbol("BTCUSDT").raw(objectMapper.readTree("{\"id\":1}")).build();
    ActivityLine eth =
        ActivityLine.builder("spot_trade").symbol("ETHUSDT").raw(objectMapper.readTree("{\"id\":1}")).build();
    ActivityLine deposit =
        ActivityLine.builder("deposit").baseAsset("usdt").raw(objectMapper.readTree("{\"txId\":\"0xabc\"}")).build();

    assertEquals("7:spot_trade:BTCUSDT:1", generator.key(7L, btc));
    assertNotEquals(generator.key(7L, btc), generator.key(7L, eth));
    assertEquals("7:deposit:USDT:0xabc", generator.key(7L, deposit));
  }

  @Test
  void shouldIgnoreZeroAndBlankIds() throws Exception {
    assertNull(DedupeKeyGenerator.externalId(objectMapper.readTree("{\"id\":0,\"hash\":\" \"}")));
    assertEquals("77", DedupeKeyGenerator.externalId(objectMapper.readTree("{\"id\":0,\"uid\":77}")));
    assertNull(DedupeKeyGenerator.externalId(objectMapper.readTree("[1,2]")));
  }

  @Test
  void shouldHashStableContentWhenNoIdPresent() throws Exception {
    ActivityLine first =
        ActivityLine.builder("transfer_in")
            .baseAsset("TON")
            .amount(new BigDecimal("1.50"))
            .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
            .raw(objectMapper.readTree("{\"b\":1,\"a\":{\"y\":2,\"x\":1}}"))
            .build();
    ActivityLine reordered =
        ActivityLine.builder("transfer_in")
            .baseAsset("TON")
            .amount(new BigDecimal("1.5"))
            .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
            .raw(objectMapper.readTree("{\"a\":{\"x\":1,\"y\":2},\"b\":1}"))
            .build();
    ActivityLine later =
        ActivityLine.builder("transfer_in")
            .baseAsset("TON")
            .amount(new BigDecimal("1.5"))
            .timestamp(Instant.parse("2026-03-01T10:00:01Z"))
            .build();

    String key = generator.key(11L, first);

    assertTrue(key.matches("11:transfer_in:[0-9a-f]{64}"));
    assertEquals(key, generator.key(11L, reordered));
    assertNotEquals(key, generator.key(11L, later));
  }

  @Test
  void shouldRehashOverlongKeys() throws Exception {
    String longId = "x".repeat(300);
    ActivityLine line =
        ActivityLine.builder("deposit").raw(objectMapper.readTree("{\"hash\":\"" + longId + "\"}")).build();

    String key = generator.key(1L, line);

    assertEquals(64, key.length());
    assertEquals(DedupeKeyGenerator.sha256("1:deposit:" + longId), key);
  }
}
