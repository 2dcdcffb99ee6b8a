package com.portfoliosync.integration.venues;

import com.portfoliosync.integration.venues.model.ActivityLine;
import com.portfoliosync.integration.venues.model.ActivityQuery;
import com.portfoliosync.integration.venues.model.Balance;
import com.portfoliosync.integration.venues.model.Position;
import com.portfoliosync.integration.venues.model.Snapshot;
import com.portfoliosync.integration.venues.model.SnapshotRequest;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to one account at one venue. Implementations throw {@link VenueException}
 * subtypes; {@link VenueException#isTransient()} tells callers whether a later retry may help.
 */
public interface VenueAdapter extends AutoCloseable {
  Venue venue();

  List<Balance> fetchBalances();

  /** Open positions; an empty category list means the venue's defaults. */
  List<Position> fetchPositions(List<String> categories);

  /** Activities ascending by timestamp, undated first, capped at {@code query.limit()}. */
  List<ActivityLine> fetchActivities(ActivityQuery query);

  /** Balances, positions and activities fetched concurrently. */
  Snapshot fetchSnapshot(SnapshotRequest request);

  /** Pagination token observed by the last activities fetch, for venues that page by cursor. */
  default Optional<String> lastCursor() {
    return Optional.empty();
  }

  @Override
  default void close() {}
}
