package com.kalbot.kalshi.ws;

/**
 * Connection-level notifications, kept apart from subscription data.
 */
public interface ConnectionListener {

  default void onStateChange(ConnectionState from, ConnectionState to) {
  }

  /**
   * Errors not tied to one subscription, including {@link ConnectionExhaustedException}.
   */
  default void onConnectionError(Throwable error) {
  }

  static ConnectionListener noop() {
    return new ConnectionListener() {
    };
  }
}
