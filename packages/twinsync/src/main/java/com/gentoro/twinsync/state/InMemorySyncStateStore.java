package com.gentoro.twinsync.state;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySyncStateStore implements SyncStateStore {
  private final Map<String, Instant> runs = new ConcurrentHashMap<>();

  @Override
  public Optional<Instant> lastRun(String rootExternalId) {
    return Optional.ofNullable(runs.get(rootExternalId));
  }

  @Override
  public void recordRun(String rootExternalId, Instant completedAt) {
    runs.put(rootExternalId, completedAt);
  }
}
