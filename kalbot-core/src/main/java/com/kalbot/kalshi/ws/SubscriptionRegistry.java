package com.kalbot.kalshi.ws;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Desired subscription state of one logical stream connection, in insertion order.
 *
 * <p>Written by subscribe/unsubscribe callers, read by the connection manager when it replays
 * after a reconnect. Every access holds the same monitor. Once closed the registry is empty and
 * refuses new intents.
 */
@Slf4j
public final class SubscriptionRegistry {

  private static final String CORRELATION_PREFIX = "c";

  private final Object lock = new Object();
  private final Map<String, Subscriber> subscribers = new LinkedHashMap<>();
  private long nextSequence = 1;
  private boolean closed;

  public SubscriptionIntent add(@NonNull ChannelKind channel, List<String> marketTickers, @NonNull StreamListener listener) {
    synchronized (lock) {
      if (closed) {
        throw new IllegalStateException("Subscription registry is closed");
      }
      String correlationId = CORRELATION_PREFIX + nextSequence++;
      SubscriptionIntent intent = new SubscriptionIntent(correlationId, channel, marketTickers);
      subscribers.put(correlationId, new Subscriber(intent, listener));
      log.debug("subscription {} added: channel={} tickers={}", correlationId, channel.wireName(), intent.marketTickers());
      return intent;
    }
  }

  /**
   * @return false when the id is unknown or was already removed
   */
  public boolean remove(String correlationId) {
    if (correlationId == null) {
      return false;
    }
    synchronized (lock) {
      boolean removed = subscribers.remove(correlationId) != null;
      if (removed) {
        log.debug("subscription {} removed", correlationId);
      }
      return removed;
    }
  }

  public List<SubscriptionIntent> snapshot() {
    synchronized (lock) {
      List<SubscriptionIntent> intents = new ArrayList<>(subscribers.size());
      for (Subscriber s : subscribers.values()) {
        intents.add(s.intent());
      }
      return List.copyOf(intents);
    }
  }

  public Optional<Subscriber> get(String correlationId) {
    synchronized (lock) {
      return Optional.ofNullable(subscribers.get(correlationId));
    }
  }

  public boolean contains(String correlationId) {
    synchronized (lock) {
      return subscribers.containsKey(correlationId);
    }
  }

  public List<Subscriber> subscribersOf(ChannelKind channel) {
    synchronized (lock) {
      return subscribers.values().stream()
          .filter(s -> s.intent().channel() == channel)
          .toList();
    }
  }

  public int size() {
    synchronized (lock) {
      return subscribers.size();
    }
  }

  public void close() {
    synchronized (lock) {
      closed = true;
      subscribers.clear();
    }
  }

  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }

  public record Subscriber(SubscriptionIntent intent, StreamListener listener) {
  }
}
