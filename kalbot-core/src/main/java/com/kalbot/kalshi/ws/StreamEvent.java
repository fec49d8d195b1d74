package com.kalbot.kalshi.ws;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Exchange-to-client websocket frames after shape validation.
 */
public interface StreamEvent {

  String type();

  /**
   * Ack for a subscribe command; binds the server-side {@code sid} to that command.
   */
  record Subscribed(long id, String channel, long sid) implements StreamEvent {
    @Override
    public String type() {
      return "subscribed";
    }
  }

  record Unsubscribed(Long id, long sid) implements StreamEvent {
    @Override
    public String type() {
      return "unsubscribed";
    }
  }

  /**
   * @param id the failed command's id, null for connection-wide errors
   */
  record Error(Long id, int code, String message) implements StreamEvent {
    @Override
    public String type() {
      return "error";
    }
  }

  /**
   * Market data. {@code sid} ties it to one subscription; frames without one are broadcast to
   * every subscriber of the channel that emits {@code type}.
   */
  record Data(String type, Long sid, Long seq, JsonNode msg) implements StreamEvent {
  }
}
