package com.kalbot.kalshi.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Issues one HTTP exchange and classifies the outcome. Never retries.
 */
@Slf4j
public final class KalshiHttpTransport {

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  public KalshiHttpTransport(@NonNull HttpClient httpClient, @NonNull ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  public HttpResponse<String> send(HttpRequest request) {
    String method = request.method();
    String path = request.uri().getRawPath();
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new KalshiTransportException("%s %s failed: %s".formatted(method, path, e), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new KalshiTransportException("%s %s interrupted".formatted(method, path), e);
    }
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      log.debug("{} {} -> HTTP {}", method, path, status);
      throw new KalshiHttpException(method, path, status, response.body());
    }
    return response;
  }

  public <T> T sendJson(HttpRequest request, Class<T> type) {
    HttpResponse<String> response = send(request);
    String body = response.body();
    try {
      if (body == null || body.isBlank()) {
        return objectMapper.treeToValue(objectMapper.createObjectNode(), type);
      }
      if (type == JsonNode.class) {
        return type.cast(objectMapper.readTree(body));
      }
      return objectMapper.readValue(body, type);
    } catch (JsonProcessingException e) {
      throw new KalshiTransportException("Failed decoding %s response from %s %s"
          .formatted(type.getSimpleName(), request.method(), request.uri().getRawPath()), e);
    }
  }
}
