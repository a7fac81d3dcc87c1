package com.gentoro.twinsync.config;

import com.gentoro.twinsync.exception.ConfigException;
import com.gentoro.twinsync.retry.RetryPolicy;
import java.time.Duration;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Typed view over the {@code twinsync.*} configuration tree.
 *
 * @param rootExternalId external id of the source graph node whose subtree is synchronized
 * @param sourceDriver {@code in-memory} or {@code cdf}
 * @param twinDriver {@code in-memory} or {@code adt}
 * @param stateFile path of the last-run JSON file, {@code null} keeps state in memory
 * @param notificationsFile JSON-lines change feed for the reverse path, {@code null} disables it
 */
public record SyncSettings(
    String rootExternalId,
    Duration forwardInterval,
    int parallelism,
    int batchSize,
    int maxQueryLength,
    RetryPolicy retryPolicy,
    String sourceDriver,
    String cdfBaseUrl,
    String cdfProject,
    String cdfToken,
    String twinDriver,
    String adtBaseUrl,
    String adtApiVersion,
    String adtToken,
    String stateFile,
    String notificationsFile,
    Duration notificationPollInterval) {

  public static final String DRIVER_IN_MEMORY = "in-memory";
  public static final String DRIVER_CDF = "cdf";
  public static final String DRIVER_ADT = "adt";

  public static final int DEFAULT_BATCH_SIZE = 100;
  public static final int DEFAULT_MAX_QUERY_LENGTH = 8000;

  public SyncSettings {
    if (rootExternalId == null || rootExternalId.isBlank()) {
      throw new ConfigException("twinsync.root-external-id must be set");
    }
    if (parallelism < 1) {
      throw new ConfigException("twinsync.forward.parallelism must be >= 1");
    }
    if (batchSize < 1 || batchSize > DEFAULT_BATCH_SIZE) {
      throw new ConfigException(
          "twinsync.forward.batch-size must be between 1 and " + DEFAULT_BATCH_SIZE);
    }
    if (DRIVER_CDF.equals(sourceDriver) && (blank(cdfBaseUrl) || blank(cdfProject))) {
      throw new ConfigException("twinsync.source.cdf.base-url and project are required");
    }
    if (DRIVER_ADT.equals(twinDriver) && blank(adtBaseUrl)) {
      throw new ConfigException("twinsync.twin.adt.base-url is required");
    }
  }

  /** Minimal in-memory settings, mostly for tests and local runs. */
  public static SyncSettings inMemory(String rootExternalId) {
    return new SyncSettings(
        rootExternalId,
        Duration.ofMinutes(1),
        4,
        DEFAULT_BATCH_SIZE,
        DEFAULT_MAX_QUERY_LENGTH,
        RetryPolicy.DEFAULT,
        DRIVER_IN_MEMORY,
        null,
        null,
        null,
        DRIVER_IN_MEMORY,
        null,
        null,
        null,
        null,
        null,
        Duration.ofSeconds(1));
  }

  public static SyncSettings from(Configuration cfg) {
    RetryPolicy retry =
        new RetryPolicy(
            cfg.getInt("twinsync.retry.max-attempts", RetryPolicy.DEFAULT.maxAttempts()),
            cfg.getLong("twinsync.retry.base-backoff-ms", RetryPolicy.DEFAULT.baseBackoffMs()),
            cfg.getLong("twinsync.retry.max-backoff-ms", RetryPolicy.DEFAULT.maxBackoffMs()));
    return new SyncSettings(
        value(cfg, "twinsync.root-external-id"),
        Duration.ofSeconds(cfg.getLong("twinsync.forward.interval-seconds", 60L)),
        cfg.getInt("twinsync.forward.parallelism", 4),
        cfg.getInt("twinsync.forward.batch-size", DEFAULT_BATCH_SIZE),
        cfg.getInt("twinsync.forward.max-query-length", DEFAULT_MAX_QUERY_LENGTH),
        retry,
        driver(cfg, "twinsync.source.driver", DRIVER_CDF),
        value(cfg, "twinsync.source.cdf.base-url"),
        value(cfg, "twinsync.source.cdf.project"),
        value(cfg, "twinsync.source.cdf.token"),
        driver(cfg, "twinsync.twin.driver", DRIVER_ADT),
        value(cfg, "twinsync.twin.adt.base-url"),
        valueOr(cfg, "twinsync.twin.adt.api-version", "2023-10-31"),
        value(cfg, "twinsync.twin.adt.token"),
        value(cfg, "twinsync.state.file"),
        value(cfg, "twinsync.reverse.notifications-file"),
        Duration.ofMillis(cfg.getLong("twinsync.reverse.poll-interval-ms", 1000L)));
  }

  private static String driver(Configuration cfg, String key, String alternative) {
    String driver = valueOr(cfg, key, DRIVER_IN_MEMORY);
    if (!DRIVER_IN_MEMORY.equals(driver) && !alternative.equals(driver)) {
      throw new ConfigException(
          "Unsupported driver '" + driver + "' for " + key,
          Map.of("supported", DRIVER_IN_MEMORY + "," + alternative));
    }
    return driver;
  }

  private static String valueOr(Configuration cfg, String key, String fallback) {
    String v = value(cfg, key);
    return v == null ? fallback : v;
  }

  /** Blank values and unresolved {@code ${...}} references read as absent. */
  private static String value(Configuration cfg, String key) {
    String v = cfg.getString(key, null);
    if (v == null) return null;
    v = v.trim();
    if (v.isEmpty() || (v.startsWith("${") && v.endsWith("}"))) return null;
    return v;
  }

  private static boolean blank(String s) {
    return s == null || s.isBlank();
  }
}
