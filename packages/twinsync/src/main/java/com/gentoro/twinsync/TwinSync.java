package com.gentoro.twinsync;

import com.gentoro.twinsync.config.ConfigurationProvider;
import com.gentoro.twinsync.config.StartupParameters;
import com.gentoro.twinsync.config.SyncSettings;
import com.gentoro.twinsync.exception.StateException;
import com.gentoro.twinsync.forward.ForwardReconciler;
import com.gentoro.twinsync.forward.ReconcileResult;
import com.gentoro.twinsync.forward.ReconcileScheduler;
import com.gentoro.twinsync.logging.LoggingService;
import com.gentoro.twinsync.reverse.JsonLinesNotificationSource;
import com.gentoro.twinsync.reverse.NotificationConsumer;
import com.gentoro.twinsync.reverse.ReverseApplier;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Application shell: loads configuration, wires the sync context, then either runs one forward
 * pass or schedules forward passes and consumes twin graph notifications until shutdown.
 */
public class TwinSync {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(TwinSync.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private SyncContext context;
  private ForwardReconciler reconciler;
  private ReconcileScheduler scheduler;
  private NotificationConsumer consumer;
  private Thread consumerThread;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public TwinSync(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());
    SyncSettings settings = SyncSettings.from(configuration());
    this.context = SyncContext.create(settings);
    this.reconciler = new ForwardReconciler(context);
    log.info(
        "TwinSync initialized for root '{}' (source: {}, twins: {})",
        settings.rootExternalId(),
        settings.sourceDriver(),
        settings.twinDriver());
  }

  /** Runs a single forward pass and releases resources. */
  public ReconcileResult runOnce() {
    try {
      return reconciler().reconcile();
    } finally {
      shutdown();
    }
  }

  /** Starts the forward schedule and, when a change feed is configured, the reverse consumer. */
  public void start() {
    SyncSettings settings = context().settings();
    this.scheduler = new ReconcileScheduler(reconciler(), settings.forwardInterval());
    scheduler.start();
    if (settings.notificationsFile() != null) {
      this.consumer =
          new NotificationConsumer(
              new JsonLinesNotificationSource(Path.of(settings.notificationsFile())),
              new ReverseApplier(context),
              settings.notificationPollInterval(),
              context.sleeper());
      this.consumerThread = new Thread(consumer, "twinsync-notifications");
      consumerThread.setDaemon(true);
      consumerThread.start();
    } else {
      log.info("No change feed configured; reverse synchronization is disabled");
    }
  }

  /** Blocks until a shutdown signal is received, then releases resources. */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "twinsync-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    try {
      if (scheduler != null) {
        scheduler.close();
      }
      if (consumer != null) {
        consumer.stop();
        consumerThread.interrupt();
      }
      if (context != null) {
        context.close();
      }
      log.info("TwinSync stopped");
    } finally {
      shutdownLatch.countDown();
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("TwinSync not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public SyncContext context() {
    if (context == null) {
      throw new StateException("TwinSync not initialized. Call initialize() first.");
    }
    return context;
  }

  public ForwardReconciler reconciler() {
    if (reconciler == null) {
      throw new StateException("TwinSync not initialized. Call initialize() first.");
    }
    return reconciler;
  }
}
