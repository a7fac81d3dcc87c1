package com.gentoro.twinsync.exception;

import java.util.Map;

/** Create rejected because the entity already exists. */
public class AlreadyExistsException extends TwinSyncException {
  public AlreadyExistsException(String message) {
    super(TwinSyncErrorCode.ALREADY_EXISTS, message);
  }

  public AlreadyExistsException(String message, Throwable cause) {
    super(TwinSyncErrorCode.ALREADY_EXISTS, message, cause);
  }

  public AlreadyExistsException(String message, Map<String, ?> context) {
    super(TwinSyncErrorCode.ALREADY_EXISTS, message, context);
  }

  public AlreadyExistsException(String message, Map<String, ?> context, Throwable cause) {
    super(TwinSyncErrorCode.ALREADY_EXISTS, message, context, cause);
  }
}
