package com.portfoliosync.domain.ledger;

import com.portfoliosync.domain.ledger.AssetCatalog.AssetSpec;
import com.portfoliosync.domain.ledger.NormalizationResult.Normalized;
import com.portfoliosync.domain.ledger.NormalizationResult.Skipped;
import com.portfoliosync.integration.venues.model.ActivityLine;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Turns venue activity lines into ledger transaction drafts. Data-shape problems never throw;
 * they come back as {@link Skipped} results or skipped legs.
 */
public class ActivityNormalizer {
  private static final Set<String> TRADE_TYPES = Set.of("spot_trade", "trade", "order", "buy", "sell");
  private static final Set<String> DEPOSIT_TYPES = Set.of("deposit", "input", "transfer_in");
  private static final Set<String> WITHDRAWAL_TYPES = Set.of("withdraw", "withdrawal", "output", "transfer_out");
  private static final Set<String> CONVERSION_TYPES = Set.of("conversion", "exchange", "currency_exchange");

  private final AssetCatalog assetCatalog;
  private final DedupeKeyGenerator dedupeKeys;

  public ActivityNormalizer(AssetCatalog assetCatalog, DedupeKeyGenerator dedupeKeys) {
    this.assetCatalog = Objects.requireNonNull(assetCatalog, "assetCatalog must not be null");
    this.dedupeKeys = Objects.requireNonNull(dedupeKeys, "dedupeKeys must not be null");
  }

  public NormalizationResult normalize(NormalizationContext context, ActivityLine activity) {
    TransactionType type = mapType(activity.activityType(), activity.side());
    if (type == null) {
      return new Skipped(SkipReason.UNSUPPORTED_TYPE);
    }
    String base = symbol(activity.baseAsset());
    if (base == null) {
      base = symbol(activity.symbol());
    }
    String quote = symbol(activity.quoteAsset());
    if (type == TransactionType.CONVERSION) {
      return conversion(context, activity, base, quote);
    }
    if (base == null) {
      return new Skipped(SkipReason.MISSING_ASSET);
    }
    if (activity.amount() == null) {
      return new Skipped(SkipReason.MISSING_AMOUNT);
    }
    TransactionDraft draft =
        draft(
            context,
            activity,
            type,
            base,
            activity.amount(),
            activity.price(),
            quote,
            dedupeKeys.key(context.integrationId(), activity));
    return new Normalized(List.of(draft), List.of());
  }

  /** Normalizes every line and tallies the skips. */
  public NormalizationSummary normalizeAll(NormalizationContext context, List<ActivityLine> activities) {
    NormalizationSummary.Builder summary = NormalizationSummary.builder();
    for (ActivityLine activity : activities) {
      summary.add(normalize(context, activity));
    }
    return summary.build();
  }

  /**
   * The from-leg gives up {@code amount} of the base asset and the to-leg receives the target
   * amount, carried in {@code price}, of the quote asset. Each leg prices itself in the other.
   */
  private NormalizationResult conversion(
      NormalizationContext context, ActivityLine activity, String base, String quote) {
    BigDecimal amount = activity.amount();
    BigDecimal targetAmount = activity.price();
    List<TransactionDraft> drafts = new ArrayList<>(2);
    List<SkipReason> skipped = new ArrayList<>(2);

    SkipReason fromMissing = missing(base, amount);
    if (fromMissing == null) {
      drafts.add(
          draft(
              context,
              activity,
              TransactionType.CONVERSION,
              base,
              amount,
              targetAmount,
              quote,
              dedupeKeys.key(context.integrationId(), activity, "from")));
    } else {
      skipped.add(fromMissing);
    }

    SkipReason toMissing = missing(quote, targetAmount);
    if (toMissing == null) {
      drafts.add(
          draft(
              context,
              activity,
              TransactionType.CONVERSION,
              quote,
              targetAmount,
              amount,
              base,
              dedupeKeys.key(context.integrationId(), activity, "to")));
    } else {
      skipped.add(toMissing);
    }

    if (drafts.isEmpty()) {
      return new Skipped(skipped.get(0));
    }
    return new Normalized(drafts, skipped);
  }

  private TransactionDraft draft(
      NormalizationContext context,
      ActivityLine activity,
      TransactionType type,
      String symbol,
      BigDecimal amount,
      BigDecimal price,
      String priceCurrency,
      String dedupeKey) {
    long assetId =
        assetCatalog.getOrCreate(
            new AssetSpec(
                symbol,
                AssetTypeResolver.resolve(context.sourceType(), symbol),
                AssetTypeResolver.marketUrl(context.venueCode(), symbol),
                symbol));
    return new TransactionDraft(
        context.portfolioId(),
        assetId,
        context.integrationId(),
        type,
        amount,
        price,
        priceCurrency,
        activity.timestamp(),
        dedupeKey);
  }

  private static SkipReason missing(String symbol, BigDecimal amount) {
    if (symbol == null) {
      return SkipReason.MISSING_ASSET;
    }
    return amount == null ? SkipReason.MISSING_AMOUNT : null;
  }

  static TransactionType mapType(String activityType, String side) {
    String type = activityType == null ? "" : activityType.trim().toLowerCase(Locale.ROOT);
    String normalizedSide = side == null ? "" : side.trim().toLowerCase(Locale.ROOT);

    if (TRADE_TYPES.contains(type)) {
      if ("buy".equals(normalizedSide)) {
        return TransactionType.BUY;
      }
      if ("sell".equals(normalizedSide)) {
        return TransactionType.SELL;
      }
    }
    if ("futures_trade".equals(type)) {
      if ("buy".equals(normalizedSide)) {
        return TransactionType.FUTURES_BUY;
      }
      if ("sell".equals(normalizedSide)) {
        return TransactionType.FUTURES_SELL;
      }
    }
    if (DEPOSIT_TYPES.contains(type) || type.contains("transfer_in") || type.endsWith("_in")) {
      return TransactionType.DEPOSIT;
    }
    if (WITHDRAWAL_TYPES.contains(type) || type.contains("transfer_out") || type.endsWith("_out")) {
      return TransactionType.WITHDRAWAL;
    }
    if (CONVERSION_TYPES.contains(type)) {
      return TransactionType.CONVERSION;
    }
    return null;
  }

  static String symbol(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim().toUpperCase(Locale.ROOT);
    return trimmed.isEmpty() ? null : trimmed;
  }
}
