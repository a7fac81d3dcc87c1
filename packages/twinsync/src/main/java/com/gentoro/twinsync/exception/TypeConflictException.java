package com.gentoro.twinsync.exception;

import java.util.Map;

/** Datapoint value type does not match the established timeseries type. */
public class TypeConflictException extends TwinSyncException {
  public TypeConflictException(String message) {
    super(TwinSyncErrorCode.TYPE_CONFLICT, message);
  }

  public TypeConflictException(String message, Throwable cause) {
    super(TwinSyncErrorCode.TYPE_CONFLICT, message, cause);
  }

  public TypeConflictException(String message, Map<String, ?> context) {
    super(TwinSyncErrorCode.TYPE_CONFLICT, message, context);
  }

  public TypeConflictException(String message, Map<String, ?> context, Throwable cause) {
    super(TwinSyncErrorCode.TYPE_CONFLICT, message, context, cause);
  }
}
