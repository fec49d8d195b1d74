package com.kalbot.kalshi.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.kalbot.kalshi.http.HttpMethod;
import com.kalbot.kalshi.http.KalshiRequestPipeline;
import com.kalbot.kalshi.http.RequestBody;
import com.kalbot.kalshi.http.RetryPolicy;
import lombok.NonNull;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Pass-through wrappers over a handful of {@code trade-api/v2} endpoints.
 *
 * GETs go through the caller-side {@link RetryPolicy}; order placement and cancellation are sent
 * exactly once.
 */
public final class KalshiExchangeApiClient {

  private final KalshiRequestPipeline pipeline;
  private final String apiPrefix;
  private final RetryPolicy getRetry;

  public KalshiExchangeApiClient(@NonNull KalshiRequestPipeline pipeline, @NonNull String apiPrefix, @NonNull RetryPolicy getRetry) {
    this.pipeline = pipeline;
    this.apiPrefix = apiPrefix.endsWith("/") ? apiPrefix.substring(0, apiPrefix.length() - 1) : apiPrefix;
    this.getRetry = getRetry;
  }

  public JsonNode getExchangeStatus() {
    return get(KalshiPaths.EXCHANGE_STATUS, Map.of());
  }

  public JsonNode getExchangeSchedule() {
    return get(KalshiPaths.EXCHANGE_SCHEDULE, Map.of());
  }

  public JsonNode getBalance() {
    return get(KalshiPaths.PORTFOLIO_BALANCE, Map.of());
  }

  public JsonNode getMarket(String ticker) {
    return get(KalshiPaths.MARKETS + "/" + segment(ticker, "ticker"), Map.of());
  }

  public JsonNode getMarketOrderbook(String ticker, Integer depth) {
    Map<String, String> query = new LinkedHashMap<>();
    if (depth != null) {
      query.put("depth", Integer.toString(Math.max(0, depth)));
    }
    return get(KalshiPaths.MARKETS + "/" + segment(ticker, "ticker") + "/orderbook", query);
  }

  public JsonNode getOrders(String ticker, String status, Integer limit, String cursor) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("ticker", ticker);
    query.put("status", status);
    query.put("limit", limit == null ? null : Integer.toString(Math.max(1, limit)));
    query.put("cursor", cursor);
    return get(KalshiPaths.PORTFOLIO_ORDERS, query);
  }

  /**
   * Submits an order. The body is sent as given; field semantics are the caller's concern.
   */
  public JsonNode createOrder(@NonNull Map<String, Object> order) {
    Map<String, Object> body = new LinkedHashMap<>();
    order.forEach((k, v) -> {
      if (v != null) {
        body.put(k, v);
      }
    });
    return pipeline.execute(HttpMethod.POST, apiPrefix + KalshiPaths.PORTFOLIO_ORDERS, Map.of(), RequestBody.of(body));
  }

  public JsonNode cancelOrder(String orderId) {
    return pipeline.execute(HttpMethod.DELETE, apiPrefix + KalshiPaths.PORTFOLIO_ORDERS + "/" + segment(orderId, "orderId"));
  }

  private JsonNode get(String path, Map<String, String> query) {
    return getRetry.call(HttpMethod.GET, () -> pipeline.execute(HttpMethod.GET, apiPrefix + path, query));
  }

  private static String segment(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return URLEncoder.encode(Objects.requireNonNull(value).trim(), StandardCharsets.UTF_8);
  }
}
