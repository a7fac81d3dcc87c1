package com.gentoro.twinsync;

import com.gentoro.twinsync.config.StartupParameters;
import com.gentoro.twinsync.forward.ReconcileResult;

public class TwinSyncApp {

  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(TwinSyncApp.class);

  static final String USAGE =
      String.join(
          System.lineSeparator(),
          "Usage: twinsync [--mode scheduled|once|help] [--config-file <location>]",
          "  --mode scheduled   forward passes on an interval plus the change feed (default)",
          "  --mode once        a single forward pass, exit code 1 on failure",
          "  --mode help        print this message",
          "  --config-file      classpath:<name>, file:<path> or a plain path"
              + " (default classpath:application.yaml)");

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    try {
      TwinSync app = new TwinSync(args);
      String mode = app.startupParameters().mode();
      if (StartupParameters.MODE_HELP.equals(mode)) {
        System.out.println(USAGE);
        return 0;
      }
      app.initialize();
      if (StartupParameters.MODE_ONCE.equals(mode)) {
        ReconcileResult result = app.runOnce();
        return result.ok() ? 0 : 1;
      }
      app.start();
      app.waitShutdownSignal();
      return 0;
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.err.println(USAGE);
      return 2;
    }
  }
}
