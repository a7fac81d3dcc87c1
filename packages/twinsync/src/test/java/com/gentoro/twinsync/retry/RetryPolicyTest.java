package com.gentoro.twinsync.retry;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.twinsync.exception.ConfigException;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void backoffDoublesUntilCapped() {
    RetryPolicy policy = RetryPolicy.DEFAULT;

    assertEquals(200L, policy.backoffMs(1));
    assertEquals(400L, policy.backoffMs(2));
    assertEquals(3200L, policy.backoffMs(5));
    assertEquals(10_000L, policy.backoffMs(7));
    assertEquals(10_000L, policy.backoffMs(500));
  }

  @Test
  void attemptsIncludeTheFirstCall() {
    RetryPolicy policy = new RetryPolicy(3, 10L, 100L);

    assertTrue(policy.hasAttemptsLeft(2));
    assertFalse(policy.hasAttemptsLeft(3));
    assertFalse(RetryPolicy.NONE.hasAttemptsLeft(1));
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(ConfigException.class, () -> new RetryPolicy(0, 10L, 100L));
    assertThrows(ConfigException.class, () -> new RetryPolicy(3, 100L, 10L));
  }
}
