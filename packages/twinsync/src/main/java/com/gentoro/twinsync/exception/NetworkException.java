package com.gentoro.twinsync.exception;

import java.util.Map;

/** Transport failure talking to either graph, after retries. */
public class NetworkException extends TwinSyncException {
  public NetworkException(String message) {
    super(TwinSyncErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(TwinSyncErrorCode.NETWORK_ERROR, message, cause);
  }

  public NetworkException(String message, Map<String, ?> context) {
    super(TwinSyncErrorCode.NETWORK_ERROR, message, context);
  }

  public NetworkException(String message, Map<String, ?> context, Throwable cause) {
    super(TwinSyncErrorCode.NETWORK_ERROR, message, context, cause);
  }
}
