package com.gentoro.twinsync.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.twinsync.exception.SerializationException;
import com.gentoro.twinsync.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Last-run timestamps in a JSON file:
 *
 * <pre>
 * {"last_executions": [{"root_asset_ext_id": "plant-1", "timestamp_UTC": 1700000000.0}]}
 * </pre>
 *
 * Timestamps are epoch seconds with fractional part. Writes go through a temp file and a move.
 */
public class FileSyncStateStore implements SyncStateStore {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(FileSyncStateStore.class);

  private final Path file;

  public FileSyncStateStore(Path file) {
    this.file = file;
  }

  public static class StateDocument {
    @JsonProperty("last_executions")
    public List<Execution> lastExecutions = new ArrayList<>();
  }

  public static class Execution {
    @JsonProperty("root_asset_ext_id")
    public String rootAssetExternalId;

    @JsonProperty("timestamp_UTC")
    public double timestampUtc;

    public Execution() {}

    Execution(String root, double ts) {
      this.rootAssetExternalId = root;
      this.timestampUtc = ts;
    }
  }

  @Override
  public synchronized Optional<Instant> lastRun(String rootExternalId) {
    return read().lastExecutions.stream()
        .filter(e -> rootExternalId.equals(e.rootAssetExternalId))
        .map(e -> toInstant(e.timestampUtc))
        .findFirst();
  }

  @Override
  public synchronized void recordRun(String rootExternalId, Instant completedAt) {
    StateDocument doc = read();
    doc.lastExecutions.removeIf(e -> rootExternalId.equals(e.rootAssetExternalId));
    doc.lastExecutions.add(new Execution(rootExternalId, toSeconds(completedAt)));
    write(doc);
    log.debug("Recorded forward run for '{}' at {}", rootExternalId, completedAt);
  }

  private StateDocument read() {
    if (!Files.isRegularFile(file)) {
      return new StateDocument();
    }
    try {
      StateDocument doc =
          JacksonUtility.getJsonMapper().readValue(file.toFile(), StateDocument.class);
      if (doc.lastExecutions == null) doc.lastExecutions = new ArrayList<>();
      return doc;
    } catch (IOException e) {
      throw new SerializationException("Failed to read sync state file: " + file, e);
    }
  }

  private void write(StateDocument doc) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Path tmp = Files.createTempFile(parent, "sync-state", ".json");
      JacksonUtility.getJsonMapper().writeValue(tmp.toFile(), doc);
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new SerializationException("Failed to write sync state file: " + file, e);
    }
  }

  static double toSeconds(Instant instant) {
    return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
  }

  static Instant toInstant(double seconds) {
    long whole = (long) Math.floor(seconds);
    long nanos = Math.round((seconds - whole) * 1_000_000) * 1_000L;
    return Instant.ofEpochSecond(whole, nanos);
  }
}
