package com.portfoliosync.domain.ledger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Drafts of a whole activity batch with skip counters per reason. */
public record NormalizationSummary(List<TransactionDraft> drafts, Map<SkipReason, Integer> skipped) {
  public NormalizationSummary {
    drafts = List.copyOf(drafts);
    skipped = Map.copyOf(skipped);
  }

  public int skipped(SkipReason reason) {
    return skipped.getOrDefault(reason, 0);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final List<TransactionDraft> drafts = new ArrayList<>();
    private final Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);

    private Builder() {}

    public Builder add(NormalizationResult result) {
      if (result instanceof NormalizationResult.Normalized normalized) {
        drafts.addAll(normalized.drafts());
        normalized.skippedLegs().forEach(this::skip);
      } else if (result instanceof NormalizationResult.Skipped skippedResult) {
        skip(skippedResult.reason());
      }
      return this;
    }

    private void skip(SkipReason reason) {
      skipped.merge(reason, 1, Integer::sum);
    }

    public NormalizationSummary build() {
      return new NormalizationSummary(drafts, skipped);
    }
  }
}
