package com.gentoro.twinsync.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.twinsync.exception.ConfigException;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaultsToScheduledModeWithBundledConfiguration() {
    StartupParameters params = new StartupParameters(new String[0]);

    assertEquals(StartupParameters.MODE_SCHEDULED, params.mode());
    assertEquals(ConfigurationProvider.DEFAULT_LOCATION, params.configFile());
  }

  @Test
  void readsFlagValuesAndBareFlags() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--mode", "once", "--verbose", "--config-file", "file:/tmp/t.yaml"});

    assertEquals("once", params.mode());
    assertEquals("file:/tmp/t.yaml", params.configFile());
    assertTrue(params.isPresent("verbose"));
    assertTrue(params.get("verbose").isEmpty());
    assertFalse(params.isPresent("other"));
  }

  @Test
  void rejectsUnknownModeAndMissingConfigValue() {
    assertThrows(ConfigException.class, () -> new StartupParameters(new String[] {"--mode", "x"}));
    assertThrows(
        ConfigException.class, () -> new StartupParameters(new String[] {"--config-file"}));
  }
}
