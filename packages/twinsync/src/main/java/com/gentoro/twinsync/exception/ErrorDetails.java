package com.gentoro.twinsync.exception;

import java.time.Instant;
import java.util.Map;

/**
 * Structured error information for logs and run summaries.
 *
 * @param type simple class name of the original throwable
 */
public record ErrorDetails(
    String type,
    String message,
    TwinSyncErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {

  public boolean is(TwinSyncErrorCode expected) {
    return code == expected;
  }
}
