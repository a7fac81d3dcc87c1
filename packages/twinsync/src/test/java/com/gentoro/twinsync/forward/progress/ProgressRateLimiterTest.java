package com.gentoro.twinsync.forward.progress;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ProgressRateLimiterTest {

  @Test
  void allowsFirstEventAndDeltaBasedEvents() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(300, 2);

    // first event of a stage passes
    assertTrue(limiter.tryAcquire("tier-1", 0, 0));

    // inside the interval and below the delta
    assertFalse(limiter.tryAcquire("tier-1", 100, 1));

    // delta reached
    assertTrue(limiter.tryAcquire("tier-1", 150, 2));

    // interval elapsed without progress
    assertTrue(limiter.tryAcquire("tier-1", 500, 2));
  }

  @Test
  void stagesAreThrottledIndependently() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(1000, 50);

    assertTrue(limiter.tryAcquire("tier-1", 0, 1));
    assertTrue(limiter.tryAcquire("tier-2", 10, 1));
    assertFalse(limiter.tryAcquire("tier-1", 20, 2));

    limiter.reset("tier-1");

    assertTrue(limiter.tryAcquire("tier-1", 30, 3));
  }
}
