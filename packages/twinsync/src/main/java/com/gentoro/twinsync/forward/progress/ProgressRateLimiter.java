package com.gentoro.twinsync.forward.progress;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-stage throttle for step events. A step passes when {@code minIntervalMs} elapsed since the
 * last accepted one of the same stage, or the completed count moved by at least {@code minDelta}.
 * The first step of a stage always passes.
 */
public class ProgressRateLimiter {
  private final long minIntervalMs;
  private final long minDelta;
  private final Map<String, long[]> lastAccepted = new ConcurrentHashMap<>();

  public ProgressRateLimiter(long minIntervalMs, long minDelta) {
    this.minIntervalMs = Math.max(0, minIntervalMs);
    this.minDelta = Math.max(0, minDelta);
  }

  /** Whether a step of {@code stage} at {@code nowMs} with {@code completed} units should emit. */
  public boolean tryAcquire(String stage, long nowMs, long completed) {
    long[] state = lastAccepted.computeIfAbsent(stage, k -> new long[] {Long.MIN_VALUE, 0L});
    synchronized (state) {
      boolean first = state[0] == Long.MIN_VALUE;
      if (first
          || nowMs - state[0] >= minIntervalMs
          || Math.abs(completed - state[1]) >= minDelta) {
        state[0] = nowMs;
        state[1] = completed;
        return true;
      }
      return false;
    }
  }

  public void reset(String stage) {
    lastAccepted.remove(stage);
  }
}
