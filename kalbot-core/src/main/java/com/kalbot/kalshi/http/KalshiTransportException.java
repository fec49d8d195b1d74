package com.kalbot.kalshi.http;

import com.kalbot.kalshi.KalshiClientException;

/**
 * The request never produced a usable HTTP response: connection failure, timeout, interruption
 * or an undecodable payload. Safe to retry only for idempotent calls.
 */
public class KalshiTransportException extends KalshiClientException {

  public KalshiTransportException(String message) {
    super(message);
  }

  public KalshiTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
