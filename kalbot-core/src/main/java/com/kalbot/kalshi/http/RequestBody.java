package com.kalbot.kalshi.http;

/**
 * JSON body rendered with the same timestamp that signs the request, so timestamp fields in the
 * body can never disagree with the {@code KALSHI-ACCESS-TIMESTAMP} header.
 */
@FunctionalInterface
public interface RequestBody {

  Object render(long timestampMs);

  static RequestBody of(Object body) {
    return timestampMs -> body;
  }
}
