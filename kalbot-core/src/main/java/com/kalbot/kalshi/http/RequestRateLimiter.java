package com.kalbot.kalshi.http;

/**
 * Gate every REST send passes before it is signed.
 */
public interface RequestRateLimiter {

  /**
   * Blocks the caller until it may send.
   */
  void acquire();

  static RequestRateLimiter noop() {
    return () -> {
    };
  }
}
