package com.gentoro.twinsync.exception;

import java.util.Map;

/** A reconcile pass failed while applying a write tier. */
public class ReconciliationException extends TwinSyncException {
  public ReconciliationException(String message) {
    super(TwinSyncErrorCode.RECONCILIATION_ERROR, message);
  }

  public ReconciliationException(String message, Throwable cause) {
    super(TwinSyncErrorCode.RECONCILIATION_ERROR, message, cause);
  }

  public ReconciliationException(String message, Map<String, ?> context) {
    super(TwinSyncErrorCode.RECONCILIATION_ERROR, message, context);
  }

  public ReconciliationException(String message, Map<String, ?> context, Throwable cause) {
    super(TwinSyncErrorCode.RECONCILIATION_ERROR, message, context, cause);
  }
}
