package com.kalbot.kalshi.auth;

import com.kalbot.kalshi.KalshiClientException;

/**
 * The credential cannot produce a signature. Never retryable.
 */
public class SigningException extends KalshiClientException {

  public SigningException(String message) {
    super(message);
  }

  public SigningException(String message, Throwable cause) {
    super(message, cause);
  }
}
