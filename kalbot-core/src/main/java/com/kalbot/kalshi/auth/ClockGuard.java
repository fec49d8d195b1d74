package com.kalbot.kalshi.auth;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wall-clock milliseconds that never go backwards within the process.
 *
 * No NTP correction is attempted. When the underlying clock steps back further than the
 * tolerated skew a warning is logged, since the exchange will likely reject our timestamps.
 */
@Slf4j
public final class ClockGuard {

  private final Clock clock;
  private final long maxSkewMillis;
  private final AtomicLong lastIssued = new AtomicLong(Long.MIN_VALUE);

  public ClockGuard(@NonNull Clock clock, @NonNull Duration maxSkew) {
    this.clock = clock;
    this.maxSkewMillis = Math.max(0, maxSkew.toMillis());
  }

  public long nowMs() {
    long wall = clock.millis();
    long issued = lastIssued.accumulateAndGet(wall, Math::max);
    if (issued - wall > maxSkewMillis) {
      log.warn("wall clock is {}ms behind the last issued request timestamp (tolerance {}ms)",
          issued - wall, maxSkewMillis);
    }
    return issued;
  }

  public long maxSkewMillis() {
    return maxSkewMillis;
  }
}
