package com.kalbot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix="kalbot")
public record KalbotProperties(
    @Valid Kalshi kalshi,
    @Valid Stream stream
) {

  public KalbotProperties {
    if (kalshi == null) {
      kalshi = defaultKalshi();
    }
    if (stream == null) {
      stream = defaultStream();
    }
  }

  private static List<String> sanitizeStringList(List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  private static Kalshi defaultKalshi() {
    return new Kalshi(null, null, null, null, null, null, null, null);
  }

  private static Rest defaultRest() {
    return new Rest(null, null, null);
  }

  private static RateLimit defaultRateLimit() {
    return new RateLimit(null, null);
  }

  private static Retry defaultRetry() {
    return new Retry(null, null, null, null);
  }

  private static Auth defaultAuth() {
    return new Auth(null, null, null);
  }

  private static Stream defaultStream() {
    return new Stream(null, null, null, null, null, null, null, null, null);
  }

  public enum KalshiEnvironment {
    DEMO("https://demo-api.kalshi.co", "wss://demo-api.kalshi.co"),
    PROD("https://api.elections.kalshi.com", "wss://api.elections.kalshi.com");

    private final String restUrl;
    private final String wsUrl;

    KalshiEnvironment(String restUrl, String wsUrl) {
      this.restUrl = restUrl;
      this.wsUrl = wsUrl;
    }

    public String restUrl() {
      return restUrl;
    }

    public String wsUrl() {
      return wsUrl;
    }
  }

  public record Kalshi(
      KalshiEnvironment environment,
      /**
       * Overrides the environment's REST host when set.
       */
      String restUrl,
      /**
       * Overrides the environment's websocket host when set.
       */
      String wsUrl,
      String apiPrefix,
      String wsPath,
      /**
       * Largest tolerated backwards step of the wall clock before a warning is logged.
       * Kalshi rejects requests whose timestamp is too far from its own clock.
       */
      @NotNull @PositiveOrZero Long maxClockSkewMillis,
      @Valid Rest rest,
      @Valid Auth auth
  ) {
    public Kalshi {
      if (environment == null) {
        environment = KalshiEnvironment.DEMO;
      }
      if (restUrl == null || restUrl.isBlank()) {
        restUrl = environment.restUrl();
      }
      if (wsUrl == null || wsUrl.isBlank()) {
        wsUrl = environment.wsUrl();
      }
      if (apiPrefix == null || apiPrefix.isBlank()) {
        apiPrefix = "/trade-api/v2";
      }
      if (wsPath == null || wsPath.isBlank()) {
        wsPath = "/trade-api/ws/v2";
      }
      if (maxClockSkewMillis == null) {
        maxClockSkewMillis = 5_000L;
      }
      if (rest == null) {
        rest = defaultRest();
      }
      if (auth == null) {
        auth = defaultAuth();
      }
    }
  }

  public record Rest(
      @Valid RateLimit rateLimit,
      @Valid Retry retry,
      @NotNull @Positive Long timeoutMillis
  ) {
    public Rest {
      if (rateLimit == null) {
        rateLimit = defaultRateLimit();
      }
      if (retry == null) {
        retry = defaultRetry();
      }
      if (timeoutMillis == null) {
        timeoutMillis = 10_000L;
      }
    }
  }

  /**
   * Minimum spacing between consecutive REST sends, shared by every caller in the process.
   */
  public record RateLimit(
      @NotNull Boolean enabled,
      @NotNull @PositiveOrZero Long minIntervalMillis
  ) {
    public RateLimit {
      if (enabled == null) {
        enabled = true;
      }
      if (minIntervalMillis == null) {
        minIntervalMillis = 100L;
      }
    }
  }

  /**
   * Caller-side retry for idempotent GETs. The request pipeline itself never retries.
   */
  public record Retry(
      @NotNull Boolean enabled,
      @NotNull @Min(1) Integer maxAttempts,
      @NotNull @PositiveOrZero Long initialBackoffMillis,
      @NotNull @PositiveOrZero Long maxBackoffMillis
  ) {
    public Retry {
      if (enabled == null) {
        enabled = true;
      }
      if (maxAttempts == null) {
        maxAttempts = 3;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 200L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 2_000L;
      }
    }
  }

  /**
   * Where the credential loader finds the API key. Either {@code privateKeyPath} or
   * {@code privateKeyPem} must be set when REST or streaming is used.
   */
  public record Auth(
      String keyId,
      String privateKeyPath,
      String privateKeyPem
  ) {
    @Override
    public String toString() {
      return "Auth[keyId=" + keyId + ", privateKeyPath=" + privateKeyPath
          + ", privateKeyPem=" + (privateKeyPem == null ? "null" : "***") + "]";
    }
  }

  public record Stream(
      @NotNull Boolean enabled,
      /**
       * Ping cadence while connected.
       */
      @NotNull @Positive Long heartbeatIntervalMillis,
      /**
       * Treat the socket as dead when nothing (data, ack or pong) arrived for this long.
       */
      @NotNull @Positive Long heartbeatTimeoutMillis,
      @NotNull @PositiveOrZero Long reconnectInitialBackoffMillis,
      @NotNull @PositiveOrZero Long reconnectMaxBackoffMillis,
      /**
       * Consecutive failed handshakes tolerated before the connection is closed for good.
       * 0 means retry forever.
       */
      @NotNull @PositiveOrZero Integer maxReconnectAttempts,
      @NotNull @Positive Long connectTimeoutMillis,
      List<String> channels,
      List<String> marketTickers
  ) {
    public Stream {
      if (enabled == null) {
        enabled = false;
      }
      if (heartbeatIntervalMillis == null) {
        heartbeatIntervalMillis = 10_000L;
      }
      if (heartbeatTimeoutMillis == null) {
        heartbeatTimeoutMillis = 30_000L;
      }
      if (reconnectInitialBackoffMillis == null) {
        reconnectInitialBackoffMillis = 500L;
      }
      if (reconnectMaxBackoffMillis == null) {
        reconnectMaxBackoffMillis = 30_000L;
      }
      if (maxReconnectAttempts == null) {
        maxReconnectAttempts = 0;
      }
      if (connectTimeoutMillis == null) {
        connectTimeoutMillis = 10_000L;
      }
      channels = sanitizeStringList(channels);
      marketTickers = sanitizeStringList(marketTickers);
    }
  }
}
