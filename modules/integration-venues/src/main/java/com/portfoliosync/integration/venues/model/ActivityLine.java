package com.portfoliosync.integration.venues.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * One venue-reported activity. Conversions carry the source leg in {@code baseAsset}/{@code
 * amount} and the target leg in {@code quoteAsset}/{@code price}.
 */
public record ActivityLine(
    String activityType,
    String symbol,
    String baseAsset,
    String quoteAsset,
    String side,
    BigDecimal amount,
    BigDecimal price,
    BigDecimal fee,
    String feeCurrency,
    Instant timestamp,
    JsonNode raw) {
  public ActivityLine {
    if (activityType == null || activityType.isBlank()) {
      throw new IllegalArgumentException("activityType is required");
    }
    if (raw == null) {
      raw = MissingNode.getInstance();
    }
  }

  public static Builder builder(String activityType) {
    return new Builder(activityType);
  }

  public static final class Builder {
    private final String activityType;
    private String symbol;
    private String baseAsset;
    private String quoteAsset;
    private String side;
    private BigDecimal amount;
    private BigDecimal price;
    private BigDecimal fee;
    private String feeCurrency;
    private Instant timestamp;
    private JsonNode raw;

    private Builder(String activityType) {
      this.activityType = activityType;
    }

    public Builder symbol(String symbol) {
      this.symbol = symbol;
      return this;
    }

    public Builder baseAsset(String baseAsset) {
      this.baseAsset = baseAsset;
      return this;
    }

    public Builder quoteAsset(String quoteAsset) {
      this.quoteAsset = quoteAsset;
      return this;
    }

    public Builder assets(SymbolSplitter.SplitSymbol split) {
      this.baseAsset = split.base();
      this.quoteAsset = split.quote();
      return this;
    }

    public Builder side(String side) {
      this.side = side;
      return this;
    }

    public Builder amount(BigDecimal amount) {
      this.amount = amount;
      return this;
    }

    public Builder price(BigDecimal price) {
      this.price = price;
      return this;
    }

    public Builder fee(BigDecimal fee, String feeCurrency) {
      this.fee = fee;
      this.feeCurrency = feeCurrency;
      return this;
    }

    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder raw(JsonNode raw) {
      this.raw = raw;
      return this;
    }

    public ActivityLine build() {
      return new ActivityLine(
          activityType,
          symbol,
          baseAsset,
          quoteAsset,
          side,
          amount,
          price,
          fee,
          feeCurrency,
          timestamp,
          raw);
    }
  }
}
