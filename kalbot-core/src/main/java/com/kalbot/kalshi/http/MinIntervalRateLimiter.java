package com.kalbot.kalshi.http;

import lombok.NonNull;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps consecutive permits at least {@code minInterval} apart across every caller sharing the instance.
 *
 * <p>Reading the last permit time, sleeping out the remainder and recording the new permit time
 * happen under one fair lock, so concurrent callers queue in arrival order instead of all
 * observing a stale timestamp and bursting through together. The lock never covers the network send.
 */
public final class MinIntervalRateLimiter implements RequestRateLimiter {

  private final long minIntervalNanos;
  private final ReentrantLock lock = new ReentrantLock(true);

  // guarded by lock
  private long lastPermitNanos;
  private boolean anyPermitIssued;

  public MinIntervalRateLimiter(@NonNull Duration minInterval) {
    if (minInterval.isNegative()) {
      throw new IllegalArgumentException("minInterval must not be negative");
    }
    this.minIntervalNanos = minInterval.toNanos();
  }

  @Override
  public void acquire() {
    try {
      lock.lockInterruptibly();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new KalshiTransportException("Interrupted while waiting for the request rate limiter", e);
    }
    try {
      if (anyPermitIssued) {
        long remaining = minIntervalNanos - (System.nanoTime() - lastPermitNanos);
        while (remaining > 0) {
          TimeUnit.NANOSECONDS.sleep(remaining);
          remaining = minIntervalNanos - (System.nanoTime() - lastPermitNanos);
        }
      }
      lastPermitNanos = System.nanoTime();
      anyPermitIssued = true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new KalshiTransportException("Interrupted while waiting for the request rate limiter", e);
    } finally {
      lock.unlock();
    }
  }

  public Duration minInterval() {
    return Duration.ofNanos(minIntervalNanos);
  }
}
