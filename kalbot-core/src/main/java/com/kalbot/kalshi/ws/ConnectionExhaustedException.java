package com.kalbot.kalshi.ws;

import com.kalbot.kalshi.KalshiClientException;

/**
 * The reconnect budget ran out. The connection is closed and will not come back on its own.
 */
public class ConnectionExhaustedException extends KalshiClientException {

  private final int attempts;

  public ConnectionExhaustedException(int attempts, Throwable lastFailure) {
    super("Stream connection gave up after %d failed handshakes".formatted(attempts), lastFailure);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }
}
