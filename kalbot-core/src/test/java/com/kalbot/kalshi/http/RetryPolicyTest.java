package com.kalbot.kalshi.http;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

  @Test
  void backoffDoublesUntilTheCap() {
    RetryPolicy policy = new RetryPolicy(true, 10, 500, 30_000);

    assertThat(policy.backoffMillis(1)).isEqualTo(500);
    assertThat(policy.backoffMillis(2)).isEqualTo(1_000);
    assertThat(policy.backoffMillis(3)).isEqualTo(2_000);
    assertThat(policy.backoffMillis(7)).isEqualTo(30_000);
    assertThat(policy.backoffMillis(1_000)).isEqualTo(30_000);
  }

  @Test
  void retriesTransportFailuresAndServerErrors() {
    RetryPolicy policy = new RetryPolicy(true, 3, 1, 2);
    AtomicInteger calls = new AtomicInteger();

    String result = policy.call(HttpMethod.GET, () -> {
      int n = calls.incrementAndGet();
      if (n == 1) {
        throw new KalshiTransportException("reset", new IOException("reset"));
      }
      if (n == 2) {
        throw new KalshiHttpException("GET", "/x", 503, "busy");
      }
      return "ok";
    });

    assertThat(result).isEqualTo("ok");
    assertThat(calls).hasValue(3);
  }

  @Test
  void clientErrorsAreNotRetried() {
    RetryPolicy policy = new RetryPolicy(true, 5, 1, 2);
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(() -> policy.call(HttpMethod.GET, () -> {
      calls.incrementAndGet();
      throw new KalshiHttpException("GET", "/x", 404, "{\"error\":\"not found\"}");
    })).isInstanceOf(KalshiHttpException.class);

    assertThat(calls).hasValue(1);
  }

  @Test
  void givesUpAfterMaxAttempts() {
    RetryPolicy policy = new RetryPolicy(true, 2, 1, 1);
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(() -> policy.call(HttpMethod.GET, () -> {
      calls.incrementAndGet();
      throw new KalshiHttpException("GET", "/x", 429, "slow down");
    })).isInstanceOf(KalshiHttpException.class);

    assertThat(calls).hasValue(2);
  }

  @Test
  void nonIdempotentVerbsAreNeverRepeated() {
    RetryPolicy policy = new RetryPolicy(true, 5, 1, 1);

    for (HttpMethod method : List.of(HttpMethod.POST, HttpMethod.PUT, HttpMethod.DELETE)) {
      AtomicInteger calls = new AtomicInteger();
      assertThatThrownBy(() -> policy.call(method, () -> {
        calls.incrementAndGet();
        throw new KalshiHttpException(method.name(), "/trade-api/v2/portfolio/orders", 503, "unavailable");
      })).isInstanceOf(KalshiHttpException.class);

      assertThat(calls).as(method.name()).hasValue(1);
    }
  }

  @Test
  void disabledPolicyCallsOnce() {
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(() -> RetryPolicy.none().call(HttpMethod.GET, () -> {
      calls.incrementAndGet();
      throw new KalshiTransportException("down");
    })).isInstanceOf(KalshiTransportException.class);

    assertThat(calls).hasValue(1);
  }
}
