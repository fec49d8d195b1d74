package com.kalbot.kalshi.http;

public enum HttpMethod {
  GET(true),
  POST(false),
  PUT(false),
  DELETE(false);

  private final boolean idempotent;

  HttpMethod(boolean idempotent) {
    this.idempotent = idempotent;
  }

  /**
   * Only idempotent calls may be repeated by a caller after a failure. Order placement and
   * cancellation must never be blindly re-sent.
   */
  public boolean isIdempotent() {
    return idempotent;
  }
}
