package com.gentoro.twinsync.exception;

import java.util.Map;

/** Input that does not match the expected twin or event shape. */
public class ValidationException extends TwinSyncException {
  public ValidationException(String message) {
    super(TwinSyncErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(TwinSyncErrorCode.INVALID_ARGUMENT, message, cause);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(TwinSyncErrorCode.INVALID_ARGUMENT, message, context);
  }

  public ValidationException(String message, Map<String, ?> context, Throwable cause) {
    super(TwinSyncErrorCode.INVALID_ARGUMENT, message, context, cause);
  }
}
