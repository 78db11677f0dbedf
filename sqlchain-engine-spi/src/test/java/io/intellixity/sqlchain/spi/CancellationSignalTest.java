package io.intellixity.sqlchain.spi;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class CancellationSignalTest {
  @Test
  void callbacksRunOnceAndRemovedOnesNever() {
    CancellationSignal signal = new CancellationSignal();
    AtomicInteger kept = new AtomicInteger();
    AtomicInteger removed = new AtomicInteger();
    signal.onCancel(kept::incrementAndGet);
    signal.onCancel(removed::incrementAndGet).close();

    signal.cancel();
    signal.cancel();
    assertTrue(signal.isCancelled());
    assertEquals(1, kept.get());
    assertEquals(0, removed.get());
  }

  @Test
  void lateRegistrationRunsImmediately() {
    CancellationSignal signal = new CancellationSignal();
    signal.cancel();
    AtomicInteger calls = new AtomicInteger();
    signal.onCancel(calls::incrementAndGet);
    assertEquals(1, calls.get());
  }

  @Test
  void registrationRacingCancelRunsExactlyOnce() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      for (int round = 0; round < 500; round++) {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        CyclicBarrier go = new CyclicBarrier(2);
        Future<?> register = pool.submit(() -> {
          go.await();
          signal.onCancel(calls::incrementAndGet);
          return null;
        });
        Future<?> cancel = pool.submit(() -> {
          go.await();
          signal.cancel();
          return null;
        });
        register.get(10, TimeUnit.SECONDS);
        cancel.get(10, TimeUnit.SECONDS);
        assertEquals(1, calls.get(), "round " + round);
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void failingCallbackDoesNotStopTheOthers() {
    CancellationSignal signal = new CancellationSignal();
    AtomicInteger calls = new AtomicInteger();
    signal.onCancel(() -> {
      throw new IllegalStateException("driver refused");
    });
    signal.onCancel(calls::incrementAndGet);
    signal.cancel();
    assertEquals(1, calls.get());
  }
}
