package com.gentoro.twinsync.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.twinsync.exception.ConfigException;
import com.gentoro.twinsync.retry.RetryPolicy;
import java.time.Duration;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SyncSettingsTest {

  @Test
  void readsYamlWithDefaultsForMissingKeys() {
    // Arrange
    Configuration cfg = new ConfigurationProvider("classpath:twinsync-test.yaml").config();

    // Act
    SyncSettings settings = SyncSettings.from(cfg);

    // Assert
    assertEquals("plant 1", settings.rootExternalId());
    assertEquals(Duration.ofSeconds(5), settings.forwardInterval());
    assertEquals(2, settings.parallelism());
    assertEquals(50, settings.batchSize());
    assertEquals(SyncSettings.DEFAULT_MAX_QUERY_LENGTH, settings.maxQueryLength());
    assertEquals(new RetryPolicy(3, 10L, 100L), settings.retryPolicy());
    assertEquals(SyncSettings.DRIVER_IN_MEMORY, settings.sourceDriver());
    assertEquals(SyncSettings.DRIVER_IN_MEMORY, settings.twinDriver());
    assertEquals("2023-10-31", settings.adtApiVersion());
    assertNull(settings.stateFile(), "unresolved env reference reads as absent");
    assertNull(settings.notificationsFile());
    assertEquals(Duration.ofMillis(250), settings.notificationPollInterval());
  }

  @Test
  @DisplayName("remote drivers need their endpoints")
  void remoteDriversNeedEndpoints() {
    Configuration cfg = new ConfigurationProvider("classpath:twinsync-adt.yaml").config();

    assertThrows(ConfigException.class, () -> SyncSettings.from(cfg));
  }

  @Test
  void unknownDriverIsRejected() {
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("twinsync.root-external-id", "root");
    cfg.setProperty("twinsync.twin.driver", "neo4j");

    ConfigException e = assertThrows(ConfigException.class, () -> SyncSettings.from(cfg));
    assertEquals("in-memory,adt", e.getContext().get("supported"));
  }

  @Test
  void missingRootIsRejected() {
    assertThrows(ConfigException.class, () -> SyncSettings.from(new BaseConfiguration()));
    assertThrows(ConfigException.class, () -> SyncSettings.inMemory(" "));
  }

  @Test
  void batchSizeIsBoundedByTheQueryIdLimit() {
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("twinsync.root-external-id", "root");
    cfg.setProperty("twinsync.forward.batch-size", 101);

    assertThrows(ConfigException.class, () -> SyncSettings.from(cfg));
  }
}
