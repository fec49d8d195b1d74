package com.kalbot.kalshi.http;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Capped exponential backoff. Used by callers for idempotent GETs and by the stream manager
 * between reconnect attempts; the request pipeline never applies it on its own.
 */
@Slf4j
public record RetryPolicy(
    boolean enabled,
    int maxAttempts,
    long initialBackoffMillis,
    long maxBackoffMillis
) {

  public RetryPolicy {
    maxAttempts = Math.max(1, maxAttempts);
    initialBackoffMillis = Math.max(0, initialBackoffMillis);
    maxBackoffMillis = Math.max(initialBackoffMillis, maxBackoffMillis);
  }

  public static RetryPolicy none() {
    return new RetryPolicy(false, 1, 0, 0);
  }

  /**
   * Delay before retry number {@code attempt} (1-based).
   */
  public long backoffMillis(int attempt) {
    if (attempt <= 1) {
      return initialBackoffMillis;
    }
    long delay = initialBackoffMillis;
    for (int i = 1; i < attempt && delay < maxBackoffMillis; i++) {
      delay = delay == 0 ? 0 : delay * 2;
    }
    return Math.min(delay, maxBackoffMillis);
  }

  /**
   * Runs {@code call}, repeating it after retryable failures. Non-idempotent verbs run exactly once.
   */
  public <T> T call(HttpMethod method, Supplier<T> call) {
    boolean repeatable = enabled && method.isIdempotent();
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        return call.get();
      } catch (RuntimeException e) {
        if (!repeatable || attempt >= maxAttempts || !isRetryable(e)) {
          throw e;
        }
        long delay = backoffMillis(attempt);
        log.debug("retrying after {} (attempt {}/{}, backoff {}ms)", e.toString(), attempt, maxAttempts, delay);
        try {
          Thread.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new KalshiTransportException("Retry interrupted", ie);
        }
      }
    }
  }

  static boolean isRetryable(RuntimeException e) {
    if (e instanceof KalshiHttpException http) {
      return http.isRetryable();
    }
    return e instanceof KalshiTransportException;
  }
}
