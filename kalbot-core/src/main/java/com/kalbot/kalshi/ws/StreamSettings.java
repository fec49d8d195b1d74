package com.kalbot.kalshi.ws;

import com.kalbot.config.KalbotProperties;
import com.kalbot.kalshi.http.RetryPolicy;
import lombok.NonNull;

import java.time.Duration;

/**
 * @param maxReconnectAttempts consecutive failed handshakes before giving up, 0 for no limit
 */
public record StreamSettings(
    @NonNull Duration heartbeatInterval,
    @NonNull Duration heartbeatTimeout,
    @NonNull RetryPolicy reconnectBackoff,
    int maxReconnectAttempts,
    @NonNull Duration connectTimeout
) {

  public StreamSettings {
    if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
      throw new IllegalArgumentException("heartbeatInterval must be positive");
    }
    if (heartbeatTimeout.compareTo(heartbeatInterval) < 0) {
      throw new IllegalArgumentException("heartbeatTimeout must not be shorter than heartbeatInterval");
    }
    maxReconnectAttempts = Math.max(0, maxReconnectAttempts);
  }

  public static StreamSettings from(KalbotProperties.Stream cfg) {
    return new StreamSettings(
        Duration.ofMillis(cfg.heartbeatIntervalMillis()),
        Duration.ofMillis(cfg.heartbeatTimeoutMillis()),
        new RetryPolicy(true, Integer.MAX_VALUE, cfg.reconnectInitialBackoffMillis(), cfg.reconnectMaxBackoffMillis()),
        cfg.maxReconnectAttempts(),
        Duration.ofMillis(cfg.connectTimeoutMillis())
    );
  }
}
