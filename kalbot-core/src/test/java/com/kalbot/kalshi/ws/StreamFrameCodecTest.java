package com.kalbot.kalshi.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamFrameCodecTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final StreamFrameCodec codec = new StreamFrameCodec(objectMapper);

  @Test
  void encodesSubscribeWithTickers() throws Exception {
    String json = codec.encode(new StreamCommand.Subscribe(3, List.of("orderbook_delta"), List.of("KXBTC-25")));

    JsonNode node = objectMapper.readTree(json);
    assertThat(node.path("id").asLong()).isEqualTo(3);
    assertThat(node.path("cmd").asText()).isEqualTo("subscribe");
    assertThat(node.path("params").path("channels").get(0).asText()).isEqualTo("orderbook_delta");
    assertThat(node.path("params").path("market_tickers").get(0).asText()).isEqualTo("KXBTC-25");
  }

  @Test
  void omitsTickersForChannelWideSubscriptions() throws Exception {
    JsonNode node = objectMapper.readTree(codec.encode(new StreamCommand.Subscribe(1, List.of("fill"), List.of())));

    assertThat(node.path("params").has("market_tickers")).isFalse();
  }

  @Test
  void encodesUnsubscribeBySid() throws Exception {
    JsonNode node = objectMapper.readTree(codec.encode(new StreamCommand.Unsubscribe(9, List.of(4L))));

    assertThat(node.path("cmd").asText()).isEqualTo("unsubscribe");
    assertThat(node.path("params").path("sids").get(0).asLong()).isEqualTo(4L);
  }

  @Test
  void decodesSubscribedAck() {
    StreamEvent event = codec.decode("{\"id\":1,\"type\":\"subscribed\",\"msg\":{\"channel\":\"ticker\",\"sid\":7}}");

    assertThat(event).isEqualTo(new StreamEvent.Subscribed(1, "ticker", 7));
  }

  @Test
  void decodesDataFrame() {
    StreamEvent event = codec.decode(
        "{\"type\":\"orderbook_delta\",\"sid\":7,\"seq\":12,\"msg\":{\"market_ticker\":\"X\",\"price\":44,\"delta\":-3}}");

    assertThat(event).isInstanceOfSatisfying(StreamEvent.Data.class, data -> {
      assertThat(data.type()).isEqualTo("orderbook_delta");
      assertThat(data.sid()).isEqualTo(7L);
      assertThat(data.seq()).isEqualTo(12L);
      assertThat(data.msg().path("delta").asInt()).isEqualTo(-3);
    });
  }

  @Test
  void decodesErrorWithAndWithoutCode() {
    assertThat(codec.decode("{\"id\":2,\"type\":\"error\",\"msg\":{\"code\":6,\"msg\":\"Already subscribed\"}}"))
        .isEqualTo(new StreamEvent.Error(2L, 6, "Already subscribed"));
    assertThat(codec.decode("{\"type\":\"error\",\"msg\":{\"msg\":\"boom\"}}"))
        .isEqualTo(new StreamEvent.Error(null, 0, "boom"));
  }

  @Test
  void decodesUnsubscribedSidFromEitherPlace() {
    assertThat(codec.decode("{\"id\":5,\"type\":\"unsubscribed\",\"sid\":3}"))
        .isEqualTo(new StreamEvent.Unsubscribed(5L, 3));
    assertThat(codec.decode("{\"type\":\"unsubscribed\",\"msg\":{\"sid\":3}}"))
        .isEqualTo(new StreamEvent.Unsubscribed(null, 3));
  }

  @Test
  void rejectsMalformedFrames() {
    List<String> frames = List.of(
        "",
        "not json",
        "[1,2]",
        "{\"sid\":1,\"msg\":{}}",
        "{\"type\":\"ticker\",\"sid\":\"seven\",\"msg\":{}}",
        "{\"type\":\"ticker\",\"sid\":7}",
        "{\"type\":\"subscribed\",\"msg\":{\"channel\":\"ticker\",\"sid\":7}}",
        "{\"id\":1,\"type\":\"subscribed\",\"msg\":{\"channel\":\"ticker\"}}",
        "{\"type\":\"unsubscribed\"}"
    );
    for (String frame : frames) {
      assertThatThrownBy(() -> codec.decode(frame)).as(frame).isInstanceOf(FrameDecodeException.class);
    }
  }
}
