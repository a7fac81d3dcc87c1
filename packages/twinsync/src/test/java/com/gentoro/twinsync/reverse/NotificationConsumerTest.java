package com.gentoro.twinsync.reverse;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.twinsync.exception.NotFoundException;
import com.gentoro.twinsync.exception.TwinSyncErrorCode;
import com.gentoro.twinsync.exception.TwinSyncException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationConsumerTest {

  @Mock private ChangeNotificationSource notifications;
  @Mock private ReverseApplier applier;

  private static ChangeEvent event(String subject) {
    return new ChangeEvent(EventKind.NODE_DELETED, subject, Instant.EPOCH, null, Map.of());
  }

  @Test
  void failingNotificationDoesNotStopTheOthers() {
    // Arrange
    ChangeEvent a = event("a");
    ChangeEvent b = event("b");
    ChangeEvent c = event("c");
    ChangeEvent d = event("d");
    when(notifications.poll()).thenReturn(List.of(a, b, c, d));
    when(applier.apply(a)).thenReturn(ApplyOutcome.APPLIED);
    when(applier.apply(b)).thenThrow(new NotFoundException("gone"));
    when(applier.apply(c)).thenReturn(ApplyOutcome.REJECTED);
    when(applier.apply(d)).thenReturn(ApplyOutcome.NO_OP);
    NotificationConsumer consumer =
        new NotificationConsumer(notifications, applier, Duration.ofMillis(10), millis -> {});

    // Act
    int handled = consumer.pollOnce();

    // Assert
    assertEquals(4, handled);
    assertEquals(new NotificationConsumer.Stats(1, 1, 1, 1), consumer.stats());
    assertEquals(4, consumer.stats().total());
    verify(applier).apply(d);
  }

  @Test
  void loopSleepsWhenIdleAndStops() throws Exception {
    // Arrange
    CountDownLatch slept = new CountDownLatch(2);
    when(notifications.poll())
        .thenThrow(new TwinSyncException(TwinSyncErrorCode.IO_ERROR, "disk"))
        .thenReturn(List.of());
    NotificationConsumer consumer =
        new NotificationConsumer(
            notifications, applier, Duration.ofMillis(5), millis -> slept.countDown());
    Thread loop = new Thread(consumer);

    // Act
    loop.start();
    assertTrue(slept.await(5, TimeUnit.SECONDS));
    consumer.stop();
    loop.join(5000);

    // Assert
    assertFalse(loop.isAlive());
    assertFalse(consumer.isRunning());
    verify(applier, never()).apply(any());
  }

  @Test
  void interruptEndsTheLoop() throws Exception {
    when(notifications.poll()).thenReturn(List.of());
    NotificationConsumer consumer =
        new NotificationConsumer(
            notifications,
            applier,
            Duration.ofMillis(5),
            millis -> {
              throw new InterruptedException();
            });

    consumer.run();

    assertFalse(consumer.isRunning());
    assertTrue(Thread.interrupted());
  }
}
