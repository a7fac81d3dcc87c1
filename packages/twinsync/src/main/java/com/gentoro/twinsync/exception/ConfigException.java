package com.gentoro.twinsync.exception;

import java.util.Map;

/** Missing or invalid configuration. */
public class ConfigException extends TwinSyncException {
  public ConfigException(String message) {
    super(TwinSyncErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(TwinSyncErrorCode.CONFIGURATION_ERROR, message, cause);
  }

  public ConfigException(String message, Map<String, ?> context) {
    super(TwinSyncErrorCode.CONFIGURATION_ERROR, message, context);
  }

  public ConfigException(String message, Map<String, ?> context, Throwable cause) {
    super(TwinSyncErrorCode.CONFIGURATION_ERROR, message, context, cause);
  }
}
