package com.gentoro.twinsync.exception;

import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Helpers for turning throwables into structured details and unwrapping async failures. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. Code and context of a {@link
   * TwinSyncException} are preserved, anything else maps to {@link TwinSyncErrorCode#UNKNOWN}.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof TwinSyncException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        TwinSyncErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Single-line summary of the top stack frames, e.g. {@code a.B.c (B.java:42) > a.D.e (D.java:7)}.
   *
   * @param maxFrames frames to include; {@code <= 0} includes all
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /** Strips {@link CompletionException}/{@link ExecutionException} wrappers. */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Returns the throwable as a {@link TwinSyncException}, wrapping foreign exceptions as {@link
   * TwinSyncErrorCode#UNKNOWN}.
   */
  public static TwinSyncException asTwinSyncException(Throwable t) {
    Throwable root = unwrap(t);
    if (root instanceof TwinSyncException ex) {
      return ex;
    }
    return new TwinSyncException(TwinSyncErrorCode.UNKNOWN, safeMessage(root.getMessage()), root);
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
