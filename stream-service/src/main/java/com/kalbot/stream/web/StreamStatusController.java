package com.kalbot.stream.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.kalbot.config.KalbotProperties;
import com.kalbot.kalshi.api.KalshiExchangeApiClient;
import com.kalbot.kalshi.http.KalshiHttpException;
import com.kalbot.kalshi.http.KalshiTransportException;
import com.kalbot.kalshi.ws.StreamConnectionManager;
import com.kalbot.stream.ingest.MarketStreamRunner;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class StreamStatusController {

  private final @NonNull KalbotProperties properties;
  private final @NonNull StreamConnectionManager stream;
  private final @NonNull MarketStreamRunner runner;
  private final @NonNull KalshiExchangeApiClient exchangeApi;

  @GetMapping("/stream/status")
  public ResponseEntity<StreamStatusResponse> streamStatus() {
    return ResponseEntity.ok(new StreamStatusResponse(
        properties.kalshi().environment().name(),
        properties.stream().enabled(),
        stream.state().name(),
        stream.subscriptions().size(),
        runner.messageCount(),
        runner.errorCount(),
        runner.activeTickerCount(),
        runner.lastMessageAtMillis()
    ));
  }

  @GetMapping("/exchange/status")
  public ResponseEntity<JsonNode> exchangeStatus() {
    try {
      return ResponseEntity.ok(exchangeApi.getExchangeStatus());
    } catch (KalshiHttpException e) {
      log.warn("exchange status failed: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY).build();
    } catch (KalshiTransportException e) {
      log.warn("exchange status unreachable: {}", e.toString());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
  }

  public record StreamStatusResponse(
      String environment,
      boolean streamEnabled,
      String connectionState,
      int subscriptions,
      long messagesReceived,
      long subscriptionErrors,
      int activeTickers,
      long lastMessageAtMillis
  ) {
  }
}
