package com.gentoro.twinsync.exception;

import java.util.Map;

/** JSON or YAML (de)serialization failure. */
public class SerializationException extends TwinSyncException {
  public SerializationException(String message) {
    super(TwinSyncErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(TwinSyncErrorCode.SERIALIZATION_ERROR, message, cause);
  }

  public SerializationException(String message, Map<String, ?> context) {
    super(TwinSyncErrorCode.SERIALIZATION_ERROR, message, context);
  }

  public SerializationException(String message, Map<String, ?> context, Throwable cause) {
    super(TwinSyncErrorCode.SERIALIZATION_ERROR, message, context, cause);
  }
}
