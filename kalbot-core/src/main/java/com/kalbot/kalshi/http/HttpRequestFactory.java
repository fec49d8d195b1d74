package com.kalbot.kalshi.http;

import lombok.NonNull;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Builds request URIs against one host. Query parameters with null values are left out.
 */
public final class HttpRequestFactory {

  private final String base;

  public HttpRequestFactory(@NonNull URI baseUri) {
    String s = baseUri.toString();
    this.base = s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
  }

  public HttpRequest.Builder request(String path, Map<String, String> query) {
    return HttpRequest.newBuilder(uri(path, query));
  }

  public URI uri(String path, Map<String, String> query) {
    if (path == null || !path.startsWith("/")) {
      throw new IllegalArgumentException("path must start with '/': " + path);
    }
    return URI.create(base + path + queryString(query));
  }

  static String queryString(Map<String, String> query) {
    if (query == null || query.isEmpty()) {
      return "";
    }
    StringJoiner joiner = new StringJoiner("&", "?", "");
    joiner.setEmptyValue("");
    query.forEach((k, v) -> {
      if (k != null && v != null) {
        joiner.add(encode(k) + "=" + encode(v));
      }
    });
    return joiner.toString();
  }

  private static String encode(String s) {
    return URLEncoder.encode(s, StandardCharsets.UTF_8);
  }
}
