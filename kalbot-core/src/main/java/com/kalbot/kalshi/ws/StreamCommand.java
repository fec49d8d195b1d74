package com.kalbot.kalshi.ws;

import java.util.List;

/**
 * Client-to-exchange websocket commands. {@code id} is the per-command message id the exchange
 * echoes back in its acknowledgement.
 */
public interface StreamCommand {

  long id();

  record Subscribe(long id, List<String> channels, List<String> marketTickers) implements StreamCommand {
    public Subscribe {
      channels = List.copyOf(channels);
      marketTickers = marketTickers == null ? List.of() : List.copyOf(marketTickers);
    }
  }

  record Unsubscribe(long id, List<Long> sids) implements StreamCommand {
    public Unsubscribe {
      sids = List.copyOf(sids);
    }
  }
}
