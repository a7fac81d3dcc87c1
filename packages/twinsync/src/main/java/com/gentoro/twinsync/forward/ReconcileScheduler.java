package com.gentoro.twinsync.forward;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/** Triggers {@link ForwardReconciler#reconcile()} with a fixed delay between runs. */
public class ReconcileScheduler implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(ReconcileScheduler.class);

  private final ForwardReconciler reconciler;
  private final Duration interval;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final ScheduledExecutorService timer =
      Executors.newSingleThreadScheduledExecutor(
          r -> {
            Thread t = new Thread(r, "twinsync-scheduler");
            t.setDaemon(true);
            return t;
          });

  public ReconcileScheduler(ForwardReconciler reconciler, Duration interval) {
    this.reconciler = reconciler;
    this.interval = interval;
  }

  public void start() {
    log.info("Scheduling forward reconcile every {}", interval);
    timer.scheduleWithFixedDelay(
        this::pollOnce, 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Runs one pass unless one is already in progress. Returns the result, or null when skipped. */
  ReconcileResult pollOnce() {
    if (!running.compareAndSet(false, true)) {
      return null;
    }
    try {
      ReconcileResult result = reconciler.reconcile();
      if (!result.ok()) {
        log.warn("Forward reconcile ended with status {}", result.status());
      }
      return result;
    } catch (RuntimeException e) {
      // an exception escaping here cancels the schedule
      log.error("Unexpected failure in scheduled reconcile", e);
      return null;
    } finally {
      running.set(false);
    }
  }

  @Override
  public void close() {
    timer.shutdownNow();
  }
}
