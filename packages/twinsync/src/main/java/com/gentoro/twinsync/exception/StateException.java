package com.gentoro.twinsync.exception;

import java.util.Map;

/** Operation attempted in an invalid state. */
public class StateException extends TwinSyncException {
  public StateException(String message) {
    super(TwinSyncErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(TwinSyncErrorCode.FAILED_PRECONDITION, message, cause);
  }

  public StateException(String message, Map<String, ?> context) {
    super(TwinSyncErrorCode.FAILED_PRECONDITION, message, context);
  }

  public StateException(String message, Map<String, ?> context, Throwable cause) {
    super(TwinSyncErrorCode.FAILED_PRECONDITION, message, context, cause);
  }
}
