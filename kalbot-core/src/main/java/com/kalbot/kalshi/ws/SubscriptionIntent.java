package com.kalbot.kalshi.ws;

import lombok.NonNull;

import java.util.List;

/**
 * What a caller asked to receive. Outlives any single socket: it is re-sent after every reconnect.
 *
 * @param correlationId client-generated, never reused while the logical connection lives
 * @param marketTickers empty means every market on the channel
 */
public record SubscriptionIntent(
    @NonNull String correlationId,
    @NonNull ChannelKind channel,
    List<String> marketTickers
) {

  public SubscriptionIntent {
    marketTickers = marketTickers == null ? List.of() : List.copyOf(marketTickers);
  }
}
