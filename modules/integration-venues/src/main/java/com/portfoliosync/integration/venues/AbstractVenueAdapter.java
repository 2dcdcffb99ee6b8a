package com.portfoliosync.integration.venues;

import com.portfoliosync.integration.venues.model.ActivityLine;
import com.portfoliosync.integration.venues.model.Balance;
import com.portfoliosync.integration.venues.model.Position;
import com.portfoliosync.integration.venues.model.Snapshot;
import com.portfoliosync.integration.venues.model.SnapshotRequest;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

public abstract class AbstractVenueAdapter implements VenueAdapter {
  protected final VenueSupport support;

  protected AbstractVenueAdapter(VenueSupport support) {
    this.support = support;
  }

  @Override
  public Snapshot fetchSnapshot(SnapshotRequest request) {
    Executor executor = support.executor();
    CompletableFuture<List<Balance>> balances =
        CompletableFuture.supplyAsync(this::fetchBalances, executor);
    CompletableFuture<List<Position>> positions =
        CompletableFuture.supplyAsync(() -> fetchPositions(request.positionCategories()), executor);
    CompletableFuture<List<ActivityLine>> activities =
        CompletableFuture.supplyAsync(() -> fetchActivities(request.activities()), executor);
    try {
      CompletableFuture.allOf(balances, positions, activities).join();
      return new Snapshot(balances.join(), positions.join(), activities.join());
    } catch (CompletionException ex) {
      balances.cancel(true);
      positions.cancel(true);
      activities.cancel(true);
      throw unwrap(ex);
    }
  }

  /** Rethrows the original failure of an async task instead of its completion wrapper. */
  protected RuntimeException unwrap(CompletionException ex) {
    Throwable cause = ex.getCause();
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return new VenueException(venue(), venue().code() + " snapshot failed", cause);
  }
}
