package com.gentoro.twinsync;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class TwinSyncAppTest {

  @Test
  void helpExitsCleanly() {
    assertEquals(0, TwinSyncApp.run(new String[] {"--mode", "help"}));
  }

  @Test
  void singlePassAgainstInMemoryGraphsSucceeds() {
    String[] args = {"--mode", "once", "--config-file", "classpath:twinsync-test.yaml"};

    int code = TwinSyncApp.run(args);

    assertEquals(0, code);
  }

  @Test
  void badArgumentsExitWithUsageError() {
    assertEquals(2, TwinSyncApp.run(new String[] {"--mode", "forever"}));
  }
}
