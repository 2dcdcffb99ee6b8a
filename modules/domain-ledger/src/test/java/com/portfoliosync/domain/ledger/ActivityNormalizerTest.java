package com.portfoliosync.domain.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.domain.ledger.NormalizationResult.Normalized;
import com.portfoliosync.domain.ledger.NormalizationResult.Skipped;
import com.portfoliosync.integration.venues.model.ActivityLine;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ActivityNormalizerTest {
  private static final Instant EXECUTED_AT = Instant.parse("2026-03-01T10:00:00Z");
  private static final NormalizationContext BINANCE =
      new NormalizationContext(7L, 3L, SourceType.CRYPTO, "binance");
  private static final NormalizationContext TBANK =
      new NormalizationContext(9L, 4L, SourceType.RU_BROKERS, "tbank");

  private final ObjectMapper objectMapper = new ObjectMapper();
  private RecordingAssetCatalog catalog;
  private ActivityNormalizer normalizer;

  @BeforeEach
  void setUp() {
    catalog = new RecordingAssetCatalog();
    normalizer = new ActivityNormalizer(catalog, new DedupeKeyGenerator());
  }

  @Test
  void shouldMapTradeWithSideToBuy() throws Exception {
    ActivityLine trade =
        ActivityLine.builder("spot_trade")
            .symbol("BTCUSDT")
            .baseAsset("btc")
            .quoteAsset("usdt")
            .side("BUY")
            .amount(new BigDecimal("0.5"))
            .price(new BigDecimal("60000"))
            .timestamp(EXECUTED_AT)
            .raw(objectMapper.readTree("{\"id\":12345}"))
            .build();

    Normalized result = assertInstanceOf(Normalized.class, normalizer.normalize(BINANCE, trade));

    TransactionDraft draft = result.drafts().get(0);
    assertEquals(TransactionType.BUY, draft.type());
    assertEquals("USDT", draft.priceCurrency());
    assertEquals("7:spot_trade:BTCUSDT:12345", draft.dedupeKey());
    assertEquals(3L, draft.portfolioId());
    assertEquals(EXECUTED_AT, draft.executedAt());
    AssetCatalog.AssetSpec asset = catalog.spec(draft.assetId());
    assertEquals("BTC", asset.symbol());
    assertEquals("crypto", asset.assetTypeCode());
    assertEquals("binance:BTC", asset.marketUrl());
    assertEquals("BTC", asset.currency());
  }

  @Test
  void shouldExpandConversionIntoTwoLegs() {
    ActivityLine conversion =
        ActivityLine.builder("conversion")
            .baseAsset("BTC")
            .quoteAsset("USDT")
            .amount(new BigDecimal("0.01"))
            .price(new BigDecimal("500"))
            .timestamp(EXECUTED_AT)
            .build();

    Normalized result = assertInstanceOf(Normalized.class, normalizer.normalize(BINANCE, conversion));

    assertEquals(2, result.drafts().size());
    TransactionDraft from = result.drafts().get(0);
    TransactionDraft to = result.drafts().get(1);
    assertEquals("BTC", catalog.spec(from.assetId()).symbol());
    assertEquals(0, new BigDecimal("0.01").compareTo(from.amount()));
    assertEquals(0, new BigDecimal("500").compareTo(from.price()));
    assertEquals("USDT", from.priceCurrency());
    assertTrue(from.dedupeKey().endsWith(":from"));
    assertEquals("USDT", catalog.spec(to.assetId()).symbol());
    assertEquals(0, new BigDecimal("500").compareTo(to.amount()));
    assertEquals(0, new BigDecimal("0.01").compareTo(to.price()));
    assertEquals("BTC", to.priceCurrency());
    assertTrue(to.dedupeKey().endsWith(":to"));
    assertTrue(result.skippedLegs().isEmpty());
  }

  @Test
  void shouldKeepResolvableConversionLegAndReportTheOther() {
    ActivityLine conversion =
        ActivityLine.builder("exchange").baseAsset("BTC").amount(new BigDecimal("0.01")).build();

    Normalized result = assertInstanceOf(Normalized.class, normalizer.normalize(BINANCE, conversion));

    assertEquals(1, result.drafts().size());
    assertEquals(List.of(SkipReason.MISSING_ASSET), result.skippedLegs());
  }

  @Test
  void shouldSkipConversionWithoutAnyLeg() {
    ActivityLine conversion = ActivityLine.builder("conversion").baseAsset("BTC").quoteAsset("USDT").build();

    Skipped result = assertInstanceOf(Skipped.class, normalizer.normalize(BINANCE, conversion));

    assertEquals(SkipReason.MISSING_AMOUNT, result.reason());
    assertEquals(0, catalog.size());
  }

  @Test
  void shouldSkipUnsupportedTypesSilently() {
    ActivityLine dividend = ActivityLine.builder("dividend").symbol("SBER").amount(BigDecimal.TEN).build();
    ActivityLine tradeWithoutSide = ActivityLine.builder("trade").symbol("SBER").amount(BigDecimal.TEN).build();

    assertEquals(
        SkipReason.UNSUPPORTED_TYPE, assertInstanceOf(Skipped.class, normalizer.normalize(TBANK, dividend)).reason());
    assertEquals(
        SkipReason.UNSUPPORTED_TYPE,
        assertInstanceOf(Skipped.class, normalizer.normalize(TBANK, tradeWithoutSide)).reason());
  }

  @Test
  void shouldReportMissingAssetAndAmount() {
    ActivityLine noAsset = ActivityLine.builder("deposit").symbol("  ").amount(BigDecimal.ONE).build();
    ActivityLine noAmount = ActivityLine.builder("deposit").symbol("RUB").build();

    assertEquals(
        SkipReason.MISSING_ASSET, assertInstanceOf(Skipped.class, normalizer.normalize(TBANK, noAsset)).reason());
    assertEquals(
        SkipReason.MISSING_AMOUNT, assertInstanceOf(Skipped.class, normalizer.normalize(TBANK, noAmount)).reason());
  }

  @Test
  void shouldResolveRuBrokerCurrencyAndStockTypes() {
    ActivityLine deposit = ActivityLine.builder("input").symbol("rub").amount(new BigDecimal("5000")).build();
    ActivityLine buy =
        ActivityLine.builder("buy").symbol("SBER").side("buy").amount(BigDecimal.TEN).price(new BigDecimal("250")).build();

    TransactionDraft depositDraft = normalizer.normalize(TBANK, deposit).drafts().get(0);
    TransactionDraft buyDraft = normalizer.normalize(TBANK, buy).drafts().get(0);

    assertEquals(TransactionType.DEPOSIT, depositDraft.type());
    assertEquals("currency", catalog.spec(depositDraft.assetId()).assetTypeCode());
    assertEquals("stock_ru", catalog.spec(buyDraft.assetId()).assetTypeCode());
    assertEquals("tbank:SBER", catalog.spec(buyDraft.assetId()).marketUrl());
  }

  @Test
  void shouldMapTypeVariants() {
    assertEquals(TransactionType.FUTURES_SELL, ActivityNormalizer.mapType("FUTURES_TRADE", "Sell"));
    assertEquals(TransactionType.DEPOSIT, ActivityNormalizer.mapType("nft_transfer_in", null));
    assertEquals(TransactionType.DEPOSIT, ActivityNormalizer.mapType("jetton_in", null));
    assertEquals(TransactionType.WITHDRAWAL, ActivityNormalizer.mapType("transfer_out", null));
    assertEquals(TransactionType.WITHDRAWAL, ActivityNormalizer.mapType("output", null));
    assertEquals(TransactionType.CONVERSION, ActivityNormalizer.mapType("currency_exchange", null));
    assertNull(ActivityNormalizer.mapType("futures_trade", null));
    assertNull(ActivityNormalizer.mapType(null, "buy"));
  }

  @Test
  void shouldCountSkipsAcrossBatch() {
    List<ActivityLine> lines =
        List.of(
            ActivityLine.builder("deposit").symbol("USDT").amount(BigDecimal.ONE).build(),
            ActivityLine.builder("deposit").amount(BigDecimal.ONE).build(),
            ActivityLine.builder("withdrawal").symbol("USDT").build(),
            ActivityLine.builder("conversion").baseAsset("BTC").amount(BigDecimal.ONE).build(),
            ActivityLine.builder("rebate").symbol("BNB").amount(BigDecimal.ONE).build());

    NormalizationSummary summary = normalizer.normalizeAll(BINANCE, lines);

    assertEquals(2, summary.drafts().size());
    assertEquals(2, summary.skipped(SkipReason.MISSING_ASSET));
    assertEquals(1, summary.skipped(SkipReason.MISSING_AMOUNT));
    assertEquals(1, summary.skipped(SkipReason.UNSUPPORTED_TYPE));
  }
}
