package com.gentoro.twinsync.reverse;

import com.gentoro.twinsync.exception.ExceptionUtil;
import com.gentoro.twinsync.exception.TwinSyncException;
import com.gentoro.twinsync.retry.Sleeper;
import com.gentoro.twinsync.utility.JacksonUtility;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-threaded consumption loop: polls the notification source and applies each event in
 * delivery order. A failing notification is logged and counted; it never stops the loop.
 */
public class NotificationConsumer implements Runnable {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(NotificationConsumer.class);

  private final ChangeNotificationSource notifications;
  private final ReverseApplier applier;
  private final Duration pollInterval;
  private final Sleeper sleeper;
  private final AtomicBoolean running = new AtomicBoolean(false);

  private final AtomicLong applied = new AtomicLong();
  private final AtomicLong noOps = new AtomicLong();
  private final AtomicLong rejected = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();

  public NotificationConsumer(
      ChangeNotificationSource notifications,
      ReverseApplier applier,
      Duration pollInterval,
      Sleeper sleeper) {
    this.notifications = notifications;
    this.applier = applier;
    this.pollInterval = pollInterval;
    this.sleeper = sleeper;
  }

  /** Counters since construction. */
  public record Stats(long applied, long noOps, long rejected, long failed) {
    public long total() {
      return applied + noOps + rejected + failed;
    }
  }

  @Override
  public void run() {
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("Notification consumer is already running");
    }
    log.info("Notification consumer started, polling every {}", pollInterval);
    try {
      while (running.get() && !Thread.currentThread().isInterrupted()) {
        int handled;
        try {
          handled = pollOnce();
        } catch (TwinSyncException e) {
          log.error("Polling notifications failed: {}", e.getMessage(), e);
          handled = 0;
        }
        if (handled == 0) {
          sleeper.sleep(pollInterval.toMillis());
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      running.set(false);
      log.info("Notification consumer stopped: {}", JacksonUtility.toJson(stats()));
    }
  }

  public void stop() {
    running.set(false);
  }

  public boolean isRunning() {
    return running.get();
  }

  /** Drains one poll of notifications; returns how many were handled. */
  public int pollOnce() {
    List<ChangeEvent> events = notifications.poll();
    for (ChangeEvent event : events) {
      handle(event);
    }
    return events.size();
  }

  void handle(ChangeEvent event) {
    log.info("Notification {} '{}' at {}", event.kind(), event.subject(), event.time());
    try {
      ApplyOutcome outcome = applier.apply(event);
      switch (outcome) {
        case APPLIED -> applied.incrementAndGet();
        case NO_OP -> noOps.incrementAndGet();
        case REJECTED -> rejected.incrementAndGet();
      }
    } catch (RuntimeException e) {
      failed.incrementAndGet();
      log.error(
          "Notification {} '{}' failed: {} at {}",
          event.kind(),
          event.subject(),
          JacksonUtility.toJson(ExceptionUtil.toErrorDetails(e)),
          ExceptionUtil.formatCompactStackTrace(e));
    }
  }

  public Stats stats() {
    return new Stats(applied.get(), noOps.get(), rejected.get(), failed.get());
  }
}
