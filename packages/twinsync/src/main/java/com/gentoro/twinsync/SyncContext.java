package com.gentoro.twinsync;

import com.gentoro.twinsync.config.SyncSettings;
import com.gentoro.twinsync.http.OkHttpFactory;
import com.gentoro.twinsync.model.Node;
import com.gentoro.twinsync.retry.Sleeper;
import com.gentoro.twinsync.source.SourceGraphClient;
import com.gentoro.twinsync.source.cdf.CdfSourceGraphClient;
import com.gentoro.twinsync.source.memory.InMemorySourceGraph;
import com.gentoro.twinsync.state.FileSyncStateStore;
import com.gentoro.twinsync.state.InMemorySyncStateStore;
import com.gentoro.twinsync.state.SyncStateStore;
import com.gentoro.twinsync.twin.TwinGraphClient;
import com.gentoro.twinsync.twin.adt.AdtTwinGraphClient;
import com.gentoro.twinsync.twin.memory.InMemoryTwinGraph;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Everything a sync component needs: settings, both graph clients, the bounded executor used for
 * concurrent reads and tier writes, the last-run store, a clock and a sleeper.
 */
public final class SyncContext implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(SyncContext.class);

  private final SyncSettings settings;
  private final SourceGraphClient source;
  private final TwinGraphClient twins;
  private final ExecutorService executor;
  private final SyncStateStore stateStore;
  private final Clock clock;
  private final Sleeper sleeper;

  public SyncContext(
      SyncSettings settings,
      SourceGraphClient source,
      TwinGraphClient twins,
      ExecutorService executor,
      SyncStateStore stateStore,
      Clock clock,
      Sleeper sleeper) {
    this.settings = settings;
    this.source = source;
    this.twins = twins;
    this.executor = executor;
    this.stateStore = stateStore;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /** In-memory stores and a bounded pool; what tests and local runs use. */
  public static SyncContext inMemory(
      SyncSettings settings, SourceGraphClient source, TwinGraphClient twins) {
    return new SyncContext(
        settings,
        source,
        twins,
        newExecutor(settings.parallelism()),
        new InMemorySyncStateStore(),
        Clock.systemUTC(),
        Sleeper.SYSTEM);
  }

  /** Builds the drivers selected by the settings. */
  public static SyncContext create(SyncSettings settings) {
    Sleeper sleeper = Sleeper.SYSTEM;
    SourceGraphClient source;
    if (SyncSettings.DRIVER_CDF.equals(settings.sourceDriver())) {
      source =
          new CdfSourceGraphClient(
              OkHttpFactory.create(
                  settings.cdfBaseUrl(), settings::cdfToken, settings.retryPolicy(), sleeper),
              settings.cdfProject());
    } else {
      log.warn("Using the in-memory source graph; nothing will be read from a remote store");
      InMemorySourceGraph memory = new InMemorySourceGraph();
      String root = settings.rootExternalId();
      memory.createNode(new Node(root, null, root, null, Map.of(), null));
      source = memory;
    }
    TwinGraphClient twins;
    if (SyncSettings.DRIVER_ADT.equals(settings.twinDriver())) {
      twins =
          new AdtTwinGraphClient(
              OkHttpFactory.create(
                  settings.adtBaseUrl(), settings::adtToken, settings.retryPolicy(), sleeper),
              settings.adtApiVersion(),
              settings.maxQueryLength());
    } else {
      log.warn("Using the in-memory twin graph; nothing will be written to a remote store");
      twins = new InMemoryTwinGraph(settings.maxQueryLength());
    }
    SyncStateStore state =
        settings.stateFile() == null
            ? new InMemorySyncStateStore()
            : new FileSyncStateStore(Path.of(settings.stateFile()));
    return new SyncContext(
        settings,
        source,
        twins,
        newExecutor(settings.parallelism()),
        state,
        Clock.systemUTC(),
        sleeper);
  }

  static ExecutorService newExecutor(int parallelism) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory factory =
        r -> {
          Thread t = new Thread(r, "twinsync-worker-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        };
    return Executors.newFixedThreadPool(parallelism, factory);
  }

  public SyncSettings settings() {
    return settings;
  }

  public SourceGraphClient source() {
    return source;
  }

  public TwinGraphClient twins() {
    return twins;
  }

  public ExecutorService executor() {
    return executor;
  }

  public SyncStateStore stateStore() {
    return stateStore;
  }

  public Clock clock() {
    return clock;
  }

  public Sleeper sleeper() {
    return sleeper;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    closeClient(source);
    closeClient(twins);
  }

  private static void closeClient(AutoCloseable client) {
    try {
      client.close();
    } catch (Exception e) {
      log.warn("Failed to close {}: {}", client.getClass().getSimpleName(), e.toString());
    }
  }
}
