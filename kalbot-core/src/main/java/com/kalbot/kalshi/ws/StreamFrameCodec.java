package com.kalbot.kalshi.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.NonNull;

/**
 * JSON wire format of the websocket.
 *
 * <pre>
 * command: {"id":1,"cmd":"subscribe","params":{"channels":["ticker"],"market_tickers":["X"]}}
 * event:   {"id":1,"type":"subscribed","msg":{"channel":"ticker","sid":7}}
 *          {"type":"ticker","sid":7,"seq":3,"msg":{...}}
 * </pre>
 *
 * Decoding checks the shape of every field it reads and rejects the frame otherwise.
 */
public final class StreamFrameCodec {

  private final ObjectMapper objectMapper;

  public StreamFrameCodec(@NonNull ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(@NonNull StreamCommand command) {
    ObjectNode root = objectMapper.createObjectNode();
    root.put("id", command.id());
    ObjectNode params = objectMapper.createObjectNode();
    if (command instanceof StreamCommand.Subscribe subscribe) {
      root.put("cmd", "subscribe");
      ArrayNode channels = params.putArray("channels");
      subscribe.channels().forEach(channels::add);
      if (!subscribe.marketTickers().isEmpty()) {
        ArrayNode tickers = params.putArray("market_tickers");
        subscribe.marketTickers().forEach(tickers::add);
      }
    } else if (command instanceof StreamCommand.Unsubscribe unsubscribe) {
      root.put("cmd", "unsubscribe");
      ArrayNode sids = params.putArray("sids");
      unsubscribe.sids().forEach(sids::add);
    } else {
      throw new IllegalArgumentException("Unsupported stream command " + command.getClass().getSimpleName());
    }
    root.set("params", params);
    try {
      return objectMapper.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed encoding stream command id=" + command.id(), e);
    }
  }

  public StreamEvent decode(String text) {
    if (text == null || text.isBlank()) {
      throw new FrameDecodeException("empty frame");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(text);
    } catch (JsonProcessingException e) {
      throw new FrameDecodeException("frame is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new FrameDecodeException("frame is not a JSON object");
    }

    String type = requiredText(root, "type");
    Long id = optionalLong(root, "id");
    Long sid = optionalLong(root, "sid");
    JsonNode msg = root.get("msg");

    switch (type) {
      case "subscribed" -> {
        if (id == null) {
          throw new FrameDecodeException("subscribed frame without id");
        }
        JsonNode body = requiredObject(msg, "subscribed");
        return new StreamEvent.Subscribed(id, requiredText(body, "channel"), requiredLong(body, "sid"));
      }
      case "unsubscribed" -> {
        Long unsubscribedSid = sid;
        if (unsubscribedSid == null && msg != null && msg.isObject()) {
          unsubscribedSid = optionalLong(msg, "sid");
        }
        if (unsubscribedSid == null) {
          throw new FrameDecodeException("unsubscribed frame without sid");
        }
        return new StreamEvent.Unsubscribed(id, unsubscribedSid);
      }
      case "error" -> {
        JsonNode body = requiredObject(msg, "error");
        Long code = optionalLong(body, "code");
        JsonNode message = body.get("msg");
        return new StreamEvent.Error(id, code == null ? 0 : code.intValue(),
            message == null || message.isNull() ? "" : message.asText());
      }
      default -> {
        return new StreamEvent.Data(type, sid, optionalLong(root, "seq"), requiredObject(msg, type));
      }
    }
  }

  private static JsonNode requiredObject(JsonNode node, String type) {
    if (node == null || !node.isObject()) {
      throw new FrameDecodeException("'" + type + "' frame without a msg object");
    }
    return node;
  }

  private static String requiredText(JsonNode node, String field) {
    JsonNode v = node.get(field);
    if (v == null || !v.isTextual() || v.asText().isBlank()) {
      throw new FrameDecodeException("missing or non-text field '" + field + "'");
    }
    return v.asText();
  }

  private static long requiredLong(JsonNode node, String field) {
    Long v = optionalLong(node, field);
    if (v == null) {
      throw new FrameDecodeException("missing field '" + field + "'");
    }
    return v;
  }

  private static Long optionalLong(JsonNode node, String field) {
    JsonNode v = node.get(field);
    if (v == null || v.isNull()) {
      return null;
    }
    if (!v.isIntegralNumber()) {
      throw new FrameDecodeException("field '" + field + "' is not an integer");
    }
    return v.asLong();
  }
}
