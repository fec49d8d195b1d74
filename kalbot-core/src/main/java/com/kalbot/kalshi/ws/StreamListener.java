package com.kalbot.kalshi.ws;

/**
 * Receives the frames routed to one subscription. Invoked on the stream dispatch thread, never on
 * the thread that owns the socket.
 */
public interface StreamListener {

  void onMessage(SubscriptionIntent subscription, StreamEvent.Data event);

  default void onSubscribed(SubscriptionIntent subscription, long sid) {
  }

  default void onError(SubscriptionIntent subscription, StreamEvent.Error error) {
  }
}
