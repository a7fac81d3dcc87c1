package com.gentoro.twinsync.exception;

import java.util.Map;

/** A twin query exceeded the remote limits (id count or text length). Fatal for the pass. */
public class QueryLimitException extends TwinSyncException {
  public QueryLimitException(String message) {
    super(TwinSyncErrorCode.RESOURCE_EXHAUSTED, message);
  }

  public QueryLimitException(String message, Throwable cause) {
    super(TwinSyncErrorCode.RESOURCE_EXHAUSTED, message, cause);
  }

  public QueryLimitException(String message, Map<String, ?> context) {
    super(TwinSyncErrorCode.RESOURCE_EXHAUSTED, message, context);
  }

  public QueryLimitException(String message, Map<String, ?> context, Throwable cause) {
    super(TwinSyncErrorCode.RESOURCE_EXHAUSTED, message, context, cause);
  }
}
