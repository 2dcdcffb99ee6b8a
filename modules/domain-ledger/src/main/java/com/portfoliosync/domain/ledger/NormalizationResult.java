package com.portfoliosync.domain.ledger;

import java.util.List;
import java.util.Objects;

public sealed interface NormalizationResult {

  List<TransactionDraft> drafts();

  /** At least one draft; legs that could not be resolved are listed in {@code skippedLegs}. */
  record Normalized(List<TransactionDraft> drafts, List<SkipReason> skippedLegs) implements NormalizationResult {
    public Normalized {
      drafts = List.copyOf(drafts);
      skippedLegs = List.copyOf(skippedLegs);
      if (drafts.isEmpty()) {
        throw new LedgerDomainException("Normalized result needs at least one draft");
      }
    }
  }

  record Skipped(SkipReason reason) implements NormalizationResult {
    public Skipped {
      Objects.requireNonNull(reason, "reason must not be null");
    }

    @Override
    public List<TransactionDraft> drafts() {
      return List.of();
    }
  }
}
