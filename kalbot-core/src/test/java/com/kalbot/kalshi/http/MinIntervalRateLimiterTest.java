package com.kalbot.kalshi.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MinIntervalRateLimiterTest {

  @Test
  void firstPermitIsImmediate() {
    MinIntervalRateLimiter limiter = new MinIntervalRateLimiter(Duration.ofSeconds(10));

    long start = System.nanoTime();
    limiter.acquire();

    assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(1_000L);
  }

  @Test
  void sequentialPermitsAreSpacedByTheInterval() {
    MinIntervalRateLimiter limiter = new MinIntervalRateLimiter(Duration.ofMillis(20));

    long start = System.nanoTime();
    for (int i = 0; i < 10; i++) {
      limiter.acquire();
    }
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertThat(elapsedMs).isGreaterThanOrEqualTo(9 * 20L);
  }

  @Test
  void concurrentCallersDoNotBurstThrough() throws Exception {
    long intervalMs = 40;
    MinIntervalRateLimiter limiter = new MinIntervalRateLimiter(Duration.ofMillis(intervalMs));
    int callers = 8;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    CountDownLatch go = new CountDownLatch(1);
    List<Long> permits = Collections.synchronizedList(new ArrayList<>());
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        futures.add(pool.submit(() -> {
          go.await();
          limiter.acquire();
          permits.add(System.nanoTime());
          return null;
        }));
      }
      long start = System.nanoTime();
      go.countDown();
      for (Future<?> f : futures) {
        f.get(10, TimeUnit.SECONDS);
      }
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

      assertThat(elapsedMs).isGreaterThanOrEqualTo((callers - 1) * intervalMs);
      List<Long> sorted = new ArrayList<>(permits);
      Collections.sort(sorted);
      for (int i = 1; i < sorted.size(); i++) {
        long gapMs = TimeUnit.NANOSECONDS.toMillis(sorted.get(i) - sorted.get(i - 1));
        // small allowance for the time between the permit and recording it
        assertThat(gapMs).as("gap %d", i).isGreaterThanOrEqualTo(intervalMs - 10);
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void interruptedWaiterFailsWithTransportException() throws Exception {
    MinIntervalRateLimiter limiter = new MinIntervalRateLimiter(Duration.ofSeconds(30));
    limiter.acquire();

    List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
    Thread waiter = new Thread(() -> {
      try {
        limiter.acquire();
      } catch (Throwable t) {
        failures.add(t);
        failures.add(new AssertionError("interrupt flag " + Thread.currentThread().isInterrupted()));
      }
    });
    waiter.start();
    Thread.sleep(50);
    waiter.interrupt();
    waiter.join(5_000);

    assertThat(failures).hasSize(2);
    assertThat(failures.get(0)).isInstanceOf(KalshiTransportException.class);
    assertThat(failures.get(1)).hasMessage("interrupt flag true");
  }

  @Test
  void rejectsNegativeInterval() {
    assertThatThrownBy(() -> new MinIntervalRateLimiter(Duration.ofMillis(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
