package com.portfoliosync.integration.venues.model;

import java.util.List;

public record SnapshotRequest(ActivityQuery activities, List<String> positionCategories) {
  public SnapshotRequest {
    if (activities == null) {
      throw new IllegalArgumentException("activities query is required");
    }
    positionCategories = positionCategories == null ? List.of() : List.copyOf(positionCategories);
  }

  public static SnapshotRequest of(ActivityQuery activities) {
    return new SnapshotRequest(activities, List.of());
  }
}
