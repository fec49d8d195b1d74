package com.kalbot.kalshi;

/**
 * Root of every failure raised by the Kalshi client.
 */
public class KalshiClientException extends RuntimeException {

  public KalshiClientException(String message) {
    super(message);
  }

  public KalshiClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
