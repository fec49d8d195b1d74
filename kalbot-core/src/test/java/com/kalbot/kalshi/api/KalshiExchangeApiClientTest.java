package com.kalbot.kalshi.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.kalbot.kalshi.http.HttpMethod;
import com.kalbot.kalshi.http.KalshiHttpException;
import com.kalbot.kalshi.http.KalshiRequestPipeline;
import com.kalbot.kalshi.http.RequestBody;
import com.kalbot.kalshi.http.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KalshiExchangeApiClientTest {

  @Mock
  KalshiRequestPipeline pipeline;

  @Test
  void getsRetryOnServerErrors() {
    JsonNode ok = JsonNodeFactory.instance.objectNode().put("trading_active", true);
    when(pipeline.execute(eq(HttpMethod.GET), eq("/trade-api/v2/exchange/status"), anyMap()))
        .thenThrow(new KalshiHttpException("GET", "/trade-api/v2/exchange/status", 502, "bad gateway"))
        .thenReturn(ok);
    KalshiExchangeApiClient client = new KalshiExchangeApiClient(pipeline, "/trade-api/v2/", new RetryPolicy(true, 3, 1, 1));

    assertThat(client.getExchangeStatus().path("trading_active").asBoolean()).isTrue();
    verify(pipeline, times(2)).execute(eq(HttpMethod.GET), eq("/trade-api/v2/exchange/status"), anyMap());
  }

  @SuppressWarnings("unchecked")
  @Test
  void ordersQueryDropsUnsetFilters() {
    when(pipeline.execute(eq(HttpMethod.GET), eq("/trade-api/v2/portfolio/orders"), anyMap()))
        .thenReturn(JsonNodeFactory.instance.objectNode());
    KalshiExchangeApiClient client = new KalshiExchangeApiClient(pipeline, "/trade-api/v2", RetryPolicy.none());

    client.getOrders("KXBTC", null, 50, null);

    ArgumentCaptor<Map<String, String>> query = ArgumentCaptor.forClass(Map.class);
    verify(pipeline).execute(eq(HttpMethod.GET), eq("/trade-api/v2/portfolio/orders"), query.capture());
    assertThat(query.getValue()).containsEntry("ticker", "KXBTC").containsEntry("limit", "50");
    assertThat(query.getValue().get("status")).isNull();
  }

  @Test
  void createOrderIsSentOnceEvenWhenTheExchangeFails() {
    when(pipeline.execute(eq(HttpMethod.POST), eq("/trade-api/v2/portfolio/orders"), anyMap(), any(RequestBody.class)))
        .thenThrow(new KalshiHttpException("POST", "/trade-api/v2/portfolio/orders", 503, "unavailable"));
    KalshiExchangeApiClient client = new KalshiExchangeApiClient(pipeline, "/trade-api/v2", new RetryPolicy(true, 5, 1, 1));

    Map<String, Object> order = new LinkedHashMap<>();
    order.put("ticker", "KXBTC");
    order.put("side", "yes");
    order.put("yes_price", null);

    assertThatThrownBy(() -> client.createOrder(order)).isInstanceOf(KalshiHttpException.class);
    verify(pipeline, times(1)).execute(eq(HttpMethod.POST), eq("/trade-api/v2/portfolio/orders"), anyMap(), any(RequestBody.class));
  }

  @Test
  void marketTickerIsEncodedIntoThePath() {
    when(pipeline.execute(eq(HttpMethod.GET), eq("/trade-api/v2/markets/KX%2FODD/orderbook"), anyMap()))
        .thenReturn(JsonNodeFactory.instance.objectNode());
    KalshiExchangeApiClient client = new KalshiExchangeApiClient(pipeline, "/trade-api/v2", RetryPolicy.none());

    client.getMarketOrderbook("KX/ODD", 10);

    verify(pipeline).execute(eq(HttpMethod.GET), eq("/trade-api/v2/markets/KX%2FODD/orderbook"), eq(Map.of("depth", "10")));
  }

  @Test
  void blankIdentifiersAreRejectedBeforeAnyRequest() {
    KalshiExchangeApiClient client = new KalshiExchangeApiClient(pipeline, "/trade-api/v2", RetryPolicy.none());

    assertThatThrownBy(() -> client.cancelOrder(" ")).isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(pipeline);
  }
}
