package com.gentoro.twinsync.forward;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.twinsync.exception.StateException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ReconcileSchedulerTest {

  private final ForwardReconciler reconciler = mock(ForwardReconciler.class);

  @Test
  void pollReturnsTheRunResult() {
    ReconcileResult skipped = ReconcileResult.skipped("root", Instant.EPOCH);
    when(reconciler.reconcile()).thenReturn(skipped);

    try (ReconcileScheduler scheduler = new ReconcileScheduler(reconciler, Duration.ofMinutes(1))) {
      assertSame(skipped, scheduler.pollOnce());
    }
  }

  @Test
  void unexpectedExceptionDoesNotEscape() {
    when(reconciler.reconcile()).thenThrow(new StateException("boom"));

    try (ReconcileScheduler scheduler = new ReconcileScheduler(reconciler, Duration.ofMinutes(1))) {
      assertNull(scheduler.pollOnce());
      // the guard is released after a failure
      assertNull(scheduler.pollOnce());
    }
    verify(reconciler, times(2)).reconcile();
  }

  @Test
  void startRunsImmediately() {
    when(reconciler.reconcile()).thenReturn(ReconcileResult.skipped("root", Instant.EPOCH));

    try (ReconcileScheduler scheduler = new ReconcileScheduler(reconciler, Duration.ofHours(1))) {
      scheduler.start();

      verify(reconciler, timeout(5000).atLeastOnce()).reconcile();
    }
  }
}
