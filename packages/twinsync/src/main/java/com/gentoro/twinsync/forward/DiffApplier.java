package com.gentoro.twinsync.forward;

import com.gentoro.twinsync.diff.TwinGraphDiff;
import com.gentoro.twinsync.diff.TwinGraphDiff.RelationshipUpdate;
import com.gentoro.twinsync.diff.TwinGraphDiff.TwinUpdate;
import com.gentoro.twinsync.exception.ExceptionUtil;
import com.gentoro.twinsync.exception.ReconciliationException;
import com.gentoro.twinsync.forward.progress.ProgressSink;
import com.gentoro.twinsync.model.Twin;
import com.gentoro.twinsync.model.TwinRelationship;
import com.gentoro.twinsync.twin.TwinGraphClient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues the writes of a {@link TwinGraphDiff} in four tiers:
 *
 * <ol>
 *   <li>twin creates and updates
 *   <li>relationship deletes
 *   <li>relationship creates and updates
 *   <li>twin deletes
 * </ol>
 *
 * Writes inside a tier run concurrently. A tier completes fully before the next one starts, and a
 * failed write stops the run after its tier.
 */
public class DiffApplier {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(DiffApplier.class);

  record Write(String description, Runnable action) {}

  record Tier(String id, String label, List<Write> writes) {}

  private final TwinGraphClient client;
  private final Executor executor;
  private final ProgressSink progress;

  public DiffApplier(TwinGraphClient client, Executor executor, ProgressSink progress) {
    this.client = client;
    this.executor = executor;
    this.progress = progress;
  }

  /** @param now creation time stamped on new relationships */
  public void apply(TwinGraphDiff diff, Instant now) {
    for (Tier tier : tiers(diff, now)) {
      run(tier);
    }
  }

  List<Tier> tiers(TwinGraphDiff diff, Instant now) {
    List<Write> upserts = new ArrayList<>();
    for (Twin t : diff.twinCreates()) {
      upserts.add(new Write("create twin " + t.twinId(), () -> client.upsertTwin(t)));
    }
    for (TwinUpdate u : diff.twinUpdates()) {
      upserts.add(
          new Write("update twin " + u.twinId(), () -> client.updateTwin(u.twinId(), u.patch())));
    }

    List<Write> relDeletes = new ArrayList<>();
    for (TwinRelationship r : diff.relationshipDeletes()) {
      relDeletes.add(
          new Write(
              "delete relationship " + r.key(),
              () -> client.deleteRelationship(r.sourceTwinId(), r.relationshipId())));
    }

    List<Write> relWrites = new ArrayList<>();
    for (TwinRelationship r : diff.relationshipCreates()) {
      TwinRelationship stamped = r.createdAt() == null ? r.withCreatedAt(now) : r;
      relWrites.add(
          new Write("create relationship " + r.key(), () -> client.upsertRelationship(stamped)));
    }
    for (RelationshipUpdate u : diff.relationshipUpdates()) {
      TwinRelationship r = u.relationship();
      relWrites.add(
          new Write(
              "update relationship " + r.key(),
              () -> client.updateRelationship(r.sourceTwinId(), r.relationshipId(), u.patch())));
    }

    List<Write> twinDeletes = new ArrayList<>();
    for (String id : diff.twinDeletes()) {
      twinDeletes.add(new Write("delete twin " + id, () -> client.deleteTwin(id)));
    }

    return List.of(
        new Tier("tier-1-twin-upserts", "Twin creates and updates", upserts),
        new Tier("tier-2-relationship-deletes", "Relationship deletes", relDeletes),
        new Tier("tier-3-relationship-writes", "Relationship creates and updates", relWrites),
        new Tier("tier-4-twin-deletes", "Twin deletes", twinDeletes));
  }

  private void run(Tier tier) {
    if (tier.writes().isEmpty()) {
      return;
    }
    progress.beginStage(tier.id(), tier.label(), tier.writes().size());
    AtomicLong done = new AtomicLong();
    List<CompletableFuture<Void>> futures = new ArrayList<>();
    for (Write w : tier.writes()) {
      Runnable task =
          () -> {
            w.action().run();
            progress.step(tier.id(), done.incrementAndGet(), w.description(), Map.of());
          };
      futures.add(
          executor == null
              ? CompletableFuture.completedFuture(null).thenRun(task)
              : CompletableFuture.runAsync(task, executor));
    }

    List<Throwable> failures = new ArrayList<>();
    for (int i = 0; i < futures.size(); i++) {
      try {
        futures.get(i).join();
      } catch (CompletionException e) {
        Throwable cause = ExceptionUtil.unwrap(e);
        log.error(
            "Write failed in {}: {}: {}",
            tier.id(),
            tier.writes().get(i).description(),
            cause.toString());
        failures.add(cause);
      }
    }
    if (failures.isEmpty()) {
      progress.endStageOk(tier.id(), Map.of("writes", tier.writes().size()));
      return;
    }
    progress.endStageError(
        tier.id(), failures.get(0).getMessage(), Map.of("failed", failures.size()));
    throw new ReconciliationException(
        failures.size() + " of " + tier.writes().size() + " write(s) failed in " + tier.id(),
        Map.of("tier", tier.id(), "failed", failures.size(), "total", tier.writes().size()),
        failures.get(0));
  }
}
