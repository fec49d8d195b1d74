package com.kalbot.kalshi.ws;

import com.kalbot.kalshi.KalshiClientException;

public class FrameDecodeException extends KalshiClientException {

  public FrameDecodeException(String message) {
    super(message);
  }

  public FrameDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
