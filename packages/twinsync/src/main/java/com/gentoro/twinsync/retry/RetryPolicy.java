package com.gentoro.twinsync.retry;

import com.gentoro.twinsync.exception.ConfigException;

/**
 * Capped exponential backoff: attempt {@code n} (1-based) waits {@code base * 2^(n-1)} ms, with the
 * exponent clamped at 8 and the result capped at {@code maxBackoffMs}.
 *
 * @param maxAttempts total attempts including the first one
 */
public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
  public static final RetryPolicy DEFAULT = new RetryPolicy(5, 200L, 10_000L);
  public static final RetryPolicy NONE = new RetryPolicy(1, 0L, 0L);

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new ConfigException("maxAttempts must be >= 1, got " + maxAttempts);
    }
    if (baseBackoffMs < 0 || maxBackoffMs < baseBackoffMs) {
      throw new ConfigException(
          "Invalid backoff bounds: base=" + baseBackoffMs + ", max=" + maxBackoffMs);
    }
  }

  public long backoffMs(int attempt) {
    int exponent = Math.min(8, Math.max(0, attempt - 1));
    return Math.min(maxBackoffMs, baseBackoffMs * (1L << exponent));
  }

  public boolean hasAttemptsLeft(int attemptsMade) {
    return attemptsMade < maxAttempts;
  }
}
