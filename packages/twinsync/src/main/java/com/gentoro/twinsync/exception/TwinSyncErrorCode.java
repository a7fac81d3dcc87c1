package com.gentoro.twinsync.exception;

/**
 * Stable error codes carried by every {@link TwinSyncException}. Logged alongside the message so
 * failures can be grouped without parsing text.
 */
public enum TwinSyncErrorCode {
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  ALREADY_EXISTS,
  RESOURCE_EXHAUSTED,
  ABORTED,

  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,

  TYPE_CONFLICT,
  RECONCILIATION_ERROR,
}
