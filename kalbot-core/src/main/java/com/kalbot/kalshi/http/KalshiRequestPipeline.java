package com.kalbot.kalshi.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kalbot.kalshi.auth.ClockGuard;
import com.kalbot.kalshi.auth.RequestSigner;
import com.kalbot.kalshi.auth.SignedRequestContext;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * The single path every authenticated REST call takes:
 * rate-limit permit, one timestamp, signature, headers, send, decode.
 *
 * <p>Failures surface as {@link KalshiHttpException} or {@link KalshiTransportException} and are
 * never retried here, whatever the verb.
 */
@Slf4j
public final class KalshiRequestPipeline {

  private final HttpRequestFactory requestFactory;
  private final KalshiHttpTransport transport;
  private final RequestSigner signer;
  private final ClockGuard clockGuard;
  private final RequestRateLimiter rateLimiter;
  private final ObjectMapper objectMapper;
  private final Duration timeout;

  public KalshiRequestPipeline(
      @NonNull URI baseUri,
      @NonNull KalshiHttpTransport transport,
      @NonNull RequestSigner signer,
      @NonNull ClockGuard clockGuard,
      @NonNull RequestRateLimiter rateLimiter,
      @NonNull ObjectMapper objectMapper,
      @NonNull Duration timeout
  ) {
    this.requestFactory = new HttpRequestFactory(baseUri);
    this.transport = transport;
    this.signer = signer;
    this.clockGuard = clockGuard;
    this.rateLimiter = rateLimiter;
    this.objectMapper = objectMapper;
    this.timeout = timeout;
  }

  public JsonNode execute(HttpMethod method, String path) {
    return execute(method, path, Map.of(), null, JsonNode.class);
  }

  public JsonNode execute(HttpMethod method, String path, Map<String, String> query) {
    return execute(method, path, query, null, JsonNode.class);
  }

  public JsonNode execute(HttpMethod method, String path, Map<String, String> query, RequestBody body) {
    return execute(method, path, query, body, JsonNode.class);
  }

  public <T> T execute(
      @NonNull HttpMethod method,
      @NonNull String path,
      Map<String, String> query,
      RequestBody body,
      @NonNull Class<T> responseType
  ) {
    rateLimiter.acquire();

    long timestampMs = clockGuard.nowMs();
    long signedAtNanos = System.nanoTime();
    SignedRequestContext context = signer.sign(timestampMs, method.name(), path);

    HttpRequest.Builder builder = requestFactory.request(path, query)
        .timeout(timeout)
        .header("Accept", "application/json");
    context.headers().forEach(builder::header);

    if (body != null) {
      builder.header("Content-Type", "application/json")
          .method(method.name(), HttpRequest.BodyPublishers.ofString(toJson(body.render(timestampMs), path)));
    } else {
      builder.method(method.name(), HttpRequest.BodyPublishers.noBody());
    }

    long ageMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - signedAtNanos);
    if (ageMs > clockGuard.maxSkewMillis()) {
      log.warn("{} {} signed {}ms before send, exchange may reject the timestamp", method, path, ageMs);
    }
    log.debug("{} {} ts={}", method, path, timestampMs);
    return transport.sendJson(builder.build(), responseType);
  }

  private String toJson(Object body, String path) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed serializing request body for " + path, e);
    }
  }
}
