package com.gentoro.twinsync.state;

import java.time.Instant;
import java.util.Optional;

/** Remembers when the forward sync last completed for a given root. */
public interface SyncStateStore {

  Optional<Instant> lastRun(String rootExternalId);

  void recordRun(String rootExternalId, Instant completedAt);
}
