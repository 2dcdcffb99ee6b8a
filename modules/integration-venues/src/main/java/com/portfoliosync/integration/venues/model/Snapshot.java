package com.portfoliosync.integration.venues.model;

import java.util.List;

public record Snapshot(List<Balance> balances, List<Position> positions, List<ActivityLine> activities) {
  public Snapshot {
    balances = balances == null ? List.of() : List.copyOf(balances);
    positions = positions == null ? List.of() : List.copyOf(positions);
    activities = activities == null ? List.of() : List.copyOf(activities);
  }
}
