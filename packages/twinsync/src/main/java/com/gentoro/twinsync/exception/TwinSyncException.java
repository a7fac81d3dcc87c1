package com.gentoro.twinsync.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception of the sync engine. Carries a {@link TwinSyncErrorCode} and an immutable
 * map of diagnostic details (entity ids, HTTP status, tier name, ...).
 */
public class TwinSyncException extends RuntimeException {
  private final TwinSyncErrorCode code;
  private final Map<String, Object> context;

  public TwinSyncException(TwinSyncErrorCode code, String message) {
    this(code, message, null, null);
  }

  public TwinSyncException(TwinSyncErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  public TwinSyncException(TwinSyncErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public TwinSyncException(
      TwinSyncErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public TwinSyncErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>(input);
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName());
    sb.append("{code=").append(code).append(", message=").append(getMessage());
    if (!context.isEmpty()) sb.append(", context=").append(context);
    if (getCause() != null) sb.append(", cause=").append(getCause().getClass().getSimpleName());
    return sb.append('}').toString();
  }
}
