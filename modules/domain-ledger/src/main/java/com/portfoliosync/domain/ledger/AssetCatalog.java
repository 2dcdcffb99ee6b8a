package com.portfoliosync.domain.ledger;

/**
 * Lookup of assets by {@code (symbol, asset type)}. Implementations create the asset type and the
 * asset on first sight and must be safe under concurrent creation of the same pair.
 */
public interface AssetCatalog {
  long getOrCreate(AssetSpec spec);

  record AssetSpec(String symbol, String assetTypeCode, String marketUrl, String currency) {
    public AssetSpec {
      if (symbol == null || symbol.isBlank()) {
        throw new LedgerDomainException("symbol must not be blank");
      }
      if (assetTypeCode == null || assetTypeCode.isBlank()) {
        throw new LedgerDomainException("assetTypeCode must not be blank");
      }
      currency = currency == null || currency.isBlank() ? symbol : currency;
    }
  }
}
