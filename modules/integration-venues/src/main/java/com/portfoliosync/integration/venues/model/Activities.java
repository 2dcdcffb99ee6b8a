package com.portfoliosync.integration.venues.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class Activities {
  private static final Comparator<ActivityLine> BY_TIMESTAMP =
      Comparator.comparing(
          ActivityLine::timestamp, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

  private Activities() {}

  /** Orders ascending by timestamp with undated activities first, then truncates to {@code limit}. */
  public static List<ActivityLine> sortAndCap(List<ActivityLine> activities, int limit) {
    List<ActivityLine> sorted = new ArrayList<>(activities);
    sorted.sort(BY_TIMESTAMP);
    if (limit > 0 && sorted.size() > limit) {
      return List.copyOf(sorted.subList(0, limit));
    }
    return List.copyOf(sorted);
  }

  public static List<ActivityLine> since(List<ActivityLine> activities, Instant since) {
    if (since == null) {
      return activities;
    }
    return activities.stream()
        .filter(line -> line.timestamp() == null || !line.timestamp().isBefore(since))
        .toList();
  }
}
