package com.portfoliosync.domain.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class AssetTypeResolverTest {
  @Test
  void shouldResolveCryptoForExchangesAndWallets() {
    assertEquals("crypto", AssetTypeResolver.resolve(SourceType.CRYPTO, "USD"));
    assertEquals("crypto", AssetTypeResolver.resolve(SourceType.TON, "TON"));
  }

  @Test
  void shouldSplitRuBrokerSymbolsIntoCurrencyAndStock() {
    assertEquals("currency", AssetTypeResolver.resolve(SourceType.RU_BROKERS, "kzt"));
    assertEquals("stock_ru", AssetTypeResolver.resolve(SourceType.RU_BROKERS, "GAZP"));
    assertEquals("stock_ru", AssetTypeResolver.resolve(SourceType.RU_BROKERS, null));
  }
}
