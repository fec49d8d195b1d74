package com.kalbot.kalshi.ws;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Websocket channels and the event types each of them emits.
 */
public enum ChannelKind {
  TICKER("ticker", "ticker"),
  TICKER_V2("ticker_v2", "ticker_v2"),
  ORDERBOOK_DELTA("orderbook_delta", "orderbook_snapshot", "orderbook_delta"),
  TRADE("trade", "trade"),
  FILL("fill", "fill"),
  MARKET_LIFECYCLE_V2("market_lifecycle_v2", "market_lifecycle_v2");

  private final String wireName;
  private final List<String> eventTypes;

  ChannelKind(String wireName, String... eventTypes) {
    this.wireName = wireName;
    this.eventTypes = List.of(eventTypes);
  }

  public String wireName() {
    return wireName;
  }

  public boolean emits(String eventType) {
    return eventTypes.contains(eventType);
  }

  public static Optional<ChannelKind> fromWireName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(k -> k.wireName.equals(normalized))
        .findFirst();
  }

  public static Optional<ChannelKind> forEventType(String eventType) {
    if (eventType == null) {
      return Optional.empty();
    }
    return Arrays.stream(values())
        .filter(k -> k.emits(eventType))
        .findFirst();
  }
}
