package com.kalbot.kalshi.http;

import com.kalbot.kalshi.KalshiClientException;

/**
 * The exchange answered with a non-2xx status. The response body is kept verbatim.
 */
public class KalshiHttpException extends KalshiClientException {

  private static final int MAX_BODY_IN_MESSAGE = 512;

  private final int statusCode;
  private final String body;

  public KalshiHttpException(String method, String path, int statusCode, String body) {
    super("HTTP %d from %s %s: %s".formatted(statusCode, method, path, abbreviate(body)));
    this.statusCode = statusCode;
    this.body = body == null ? "" : body;
  }

  public int statusCode() {
    return statusCode;
  }

  public String body() {
    return body;
  }

  /**
   * Throttling and server-side failures; whether to actually retry is still the caller's call.
   */
  public boolean isRetryable() {
    return statusCode == 429 || statusCode >= 500;
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
  }
}
