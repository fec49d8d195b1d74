package com.kalbot.kalshi.ws;

import java.util.concurrent.CompletableFuture;

/**
 * One physical websocket. Sends are issued from a single thread.
 */
public interface StreamSocket {

  CompletableFuture<Void> sendText(String text);

  CompletableFuture<Void> ping();

  /**
   * Best-effort close; never throws.
   */
  void close();

  /**
   * Inbound side of a socket, called from transport threads.
   */
  interface Listener {

    void onText(String text);

    /**
     * Any liveness signal that is not a text frame: pong or server ping.
     */
    void onHeartbeat();

    void onClosed(int statusCode, String reason);

    void onError(Throwable error);
  }
}
