package com.gentoro.dirsearch.progress;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class DeadlineProgressSinkTest {

  @Test
  void cancelsOnceBudgetIsSpent() {
    AtomicLong now = new AtomicLong(1_000);
    DeadlineProgressSink sink =
        new DeadlineProgressSink(NoOpProgressSink.INSTANCE, Duration.ofMillis(500), now::get);

    assertFalse(sink.isCancelled());
    assertEquals(500, sink.remainingMs());

    now.set(1_499);
    assertFalse(sink.isCancelled());

    now.set(1_500);
    assertTrue(sink.isCancelled());
    assertEquals(0, sink.remainingMs());
  }

  @Test
  void delegatesEventsAndCancellation() {
    ProgressSink delegate = mock(ProgressSink.class);
    when(delegate.isCancelled()).thenReturn(true);
    DeadlineProgressSink sink = new DeadlineProgressSink(delegate, Duration.ofHours(1));

    sink.beginStage("walk", "Walking directory", 0);
    sink.step("walk", 3, "a.txt", Map.of());
    sink.endStageOk("walk", Map.of());

    assertTrue(sink.isCancelled());
    verify(delegate).beginStage("walk", "Walking directory", 0);
    verify(delegate).step("walk", 3, "a.txt", Map.of());
    verify(delegate).endStageOk("walk", Map.of());
  }

  @Test
  void zeroBudgetMeansNoDeadline() {
    ProgressSink inner = NoOpProgressSink.INSTANCE;
    assertSame(inner, DeadlineProgressSink.wrap(inner, Duration.ZERO));
    assertSame(inner, DeadlineProgressSink.wrap(inner, null));
    assertInstanceOf(DeadlineProgressSink.class, DeadlineProgressSink.wrap(inner, Duration.ofSeconds(1)));
  }
}
