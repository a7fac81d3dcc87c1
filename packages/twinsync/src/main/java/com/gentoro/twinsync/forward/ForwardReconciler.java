package com.gentoro.twinsync.forward;

import com.gentoro.twinsync.SyncContext;
import com.gentoro.twinsync.ambiguity.Ambiguity;
import com.gentoro.twinsync.ambiguity.AmbiguityDetector;
import com.gentoro.twinsync.diff.GraphDiffer;
import com.gentoro.twinsync.diff.TwinGraphDiff;
import com.gentoro.twinsync.exception.ExceptionUtil;
import com.gentoro.twinsync.exception.TwinSyncException;
import com.gentoro.twinsync.forward.progress.LoggingProgressSink;
import com.gentoro.twinsync.forward.progress.ProgressSink;
import com.gentoro.twinsync.identity.IdentityNormalizer;
import com.gentoro.twinsync.model.ProjectedGraph;
import com.gentoro.twinsync.model.SourceGraph;
import com.gentoro.twinsync.query.QueryBatcher;
import com.gentoro.twinsync.state.SyncStateStore;
import com.gentoro.twinsync.utility.JacksonUtility;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One full source-to-twin pass: read the source subtree, read the twin projection, diff, write in
 * tiers, record the run. Only one pass runs at a time; a call made while another pass holds the
 * lock returns a {@link ReconcileResult.Status#SKIPPED} result.
 *
 * <p>Failures never escape {@link #reconcile()}: they are logged and returned in the result, and
 * the last-run timestamp is left untouched.
 */
public class ForwardReconciler {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(ForwardReconciler.class);

  private final String rootExternalId;
  private final SourceGraphReader sourceReader;
  private final ProjectionReader projectionReader;
  private final GraphDiffer differ;
  private final AmbiguityDetector detector;
  private final DiffApplier applier;
  private final SyncStateStore stateStore;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  public ForwardReconciler(SyncContext ctx) {
    this(ctx, new LoggingProgressSink(log, 2000L, 50L));
  }

  public ForwardReconciler(SyncContext ctx, ProgressSink progress) {
    this.rootExternalId = ctx.settings().rootExternalId();
    this.detector = new AmbiguityDetector();
    this.sourceReader = new SourceGraphReader(ctx.source(), detector, ctx.executor());
    this.projectionReader =
        new ProjectionReader(
            new QueryBatcher(ctx.twins(), ctx.settings().batchSize(), ctx.executor()));
    this.differ = new GraphDiffer();
    this.applier = new DiffApplier(ctx.twins(), ctx.executor(), progress);
    this.stateStore = ctx.stateStore();
    this.clock = ctx.clock();
  }

  public ReconcileResult reconcile() {
    if (!lock.tryLock()) {
      log.warn("Forward reconcile for '{}' already running; skipping", rootExternalId);
      return ReconcileResult.skipped(rootExternalId, clock.instant());
    }
    try {
      return runPass();
    } finally {
      lock.unlock();
    }
  }

  private ReconcileResult runPass() {
    Instant started = clock.instant();
    String rootTwinId = IdentityNormalizer.toTwinId(rootExternalId);
    log.info("Forward reconcile of '{}' started", rootExternalId);
    try {
      Optional<Instant> lastRun = stateStore.lastRun(rootExternalId);
      SourceGraph source = sourceReader.read(rootExternalId);
      ProjectedGraph current = projectionReader.read(rootTwinId);
      checkConsistency(lastRun, current);

      List<Ambiguity> ambiguities = detector.detect(current);
      TwinGraphDiff diff = differ.diff(source, current);
      log.info("Diff for '{}' has {} write(s)", rootExternalId, diff.totalOperations());
      applier.apply(diff, started);

      stateStore.recordRun(rootExternalId, started);
      ReconcileResult result =
          ReconcileResult.succeeded(
              rootExternalId, started, clock.instant(), diff, ambiguities.size());
      log.info("Forward reconcile finished: {}", JacksonUtility.toJson(result.summary()));
      return result;
    } catch (RuntimeException e) {
      TwinSyncException failure = ExceptionUtil.asTwinSyncException(e);
      ReconcileResult result =
          ReconcileResult.failed(rootExternalId, started, clock.instant(), failure);
      log.error(
          "Forward reconcile failed: {} at {}",
          JacksonUtility.toJson(result.summary()),
          ExceptionUtil.formatCompactStackTrace(failure));
      return result;
    }
  }

  private void checkConsistency(Optional<Instant> lastRun, ProjectedGraph current) {
    if (lastRun.isPresent() && !current.hasRoot()) {
      log.error(
          "Root '{}' was last synced at {} but its twin is missing; rebuilding from scratch",
          rootExternalId,
          lastRun.get());
    } else if (lastRun.isEmpty() && current.hasRoot()) {
      log.warn(
          "No recorded run for '{}' but its twin already exists; it will be reconciled in place",
          rootExternalId);
    }
  }
}
