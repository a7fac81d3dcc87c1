package com.gentoro.twinsync.exception;

import java.util.Map;

/** Entity expected on one side of the sync was not found. */
public class NotFoundException extends TwinSyncException {
  public NotFoundException(String message) {
    super(TwinSyncErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(TwinSyncErrorCode.NOT_FOUND, message, cause);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(TwinSyncErrorCode.NOT_FOUND, message, context);
  }

  public NotFoundException(String message, Map<String, ?> context, Throwable cause) {
    super(TwinSyncErrorCode.NOT_FOUND, message, context, cause);
  }
}
