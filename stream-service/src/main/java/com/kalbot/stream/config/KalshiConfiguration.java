package com.kalbot.stream.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kalbot.config.KalbotProperties;
import com.kalbot.kalshi.api.KalshiExchangeApiClient;
import com.kalbot.kalshi.auth.ClockGuard;
import com.kalbot.kalshi.auth.KalshiCredential;
import com.kalbot.kalshi.auth.RequestSigner;
import com.kalbot.kalshi.http.KalshiHttpTransport;
import com.kalbot.kalshi.http.KalshiRequestPipeline;
import com.kalbot.kalshi.http.MinIntervalRateLimiter;
import com.kalbot.kalshi.http.RequestRateLimiter;
import com.kalbot.kalshi.http.RetryPolicy;
import com.kalbot.kalshi.ws.ConnectionListener;
import com.kalbot.kalshi.ws.ConnectionState;
import com.kalbot.kalshi.ws.JdkWebSocketTransport;
import com.kalbot.kalshi.ws.StreamConnectionManager;
import com.kalbot.kalshi.ws.StreamSettings;
import com.kalbot.stream.auth.PemCredentialLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class KalshiConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public HttpClient httpClient() {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();
  }

  @Bean
  public KalshiCredential kalshiCredential(KalbotProperties properties) {
    return PemCredentialLoader.load(properties.kalshi().auth());
  }

  @Bean
  public RequestSigner requestSigner(KalshiCredential credential) {
    return new RequestSigner(credential);
  }

  @Bean
  public ClockGuard clockGuard(KalbotProperties properties, Clock clock) {
    return new ClockGuard(clock, Duration.ofMillis(properties.kalshi().maxClockSkewMillis()));
  }

  /**
   * One limiter for the whole process: every pipeline and every call site shares this window.
   */
  @Bean
  public RequestRateLimiter requestRateLimiter(KalbotProperties properties) {
    return buildRateLimiter(properties.kalshi().rest().rateLimit());
  }

  @Bean
  public KalshiRequestPipeline kalshiRequestPipeline(
      KalbotProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      RequestSigner signer,
      ClockGuard clockGuard,
      RequestRateLimiter rateLimiter
  ) {
    KalbotProperties.Kalshi kalshi = properties.kalshi();
    return new KalshiRequestPipeline(
        URI.create(kalshi.restUrl()),
        new KalshiHttpTransport(httpClient, objectMapper),
        signer,
        clockGuard,
        rateLimiter,
        objectMapper,
        Duration.ofMillis(kalshi.rest().timeoutMillis())
    );
  }

  @Bean
  public KalshiExchangeApiClient kalshiExchangeApiClient(KalbotProperties properties, KalshiRequestPipeline pipeline) {
    KalbotProperties.Kalshi kalshi = properties.kalshi();
    return new KalshiExchangeApiClient(pipeline, kalshi.apiPrefix(), buildRetryPolicy(kalshi.rest().retry()));
  }

  @Bean(destroyMethod = "close")
  public StreamConnectionManager streamConnectionManager(
      KalbotProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      RequestSigner signer,
      ClockGuard clockGuard
  ) {
    KalbotProperties.Kalshi kalshi = properties.kalshi();
    StreamSettings settings = StreamSettings.from(properties.stream());
    return new StreamConnectionManager(
        URI.create(kalshi.wsUrl()),
        kalshi.wsPath(),
        new JdkWebSocketTransport(httpClient, settings.connectTimeout()),
        signer,
        clockGuard,
        objectMapper,
        settings,
        new LoggingConnectionListener()
    );
  }

  private static RequestRateLimiter buildRateLimiter(KalbotProperties.RateLimit cfg) {
    if (cfg == null || !cfg.enabled()) {
      return RequestRateLimiter.noop();
    }
    if (cfg.minIntervalMillis() <= 0) {
      return RequestRateLimiter.noop();
    }
    return new MinIntervalRateLimiter(Duration.ofMillis(cfg.minIntervalMillis()));
  }

  private static RetryPolicy buildRetryPolicy(KalbotProperties.Retry cfg) {
    if (cfg == null) {
      return RetryPolicy.none();
    }
    return new RetryPolicy(
        cfg.enabled(),
        Math.max(1, cfg.maxAttempts()),
        Math.max(0, cfg.initialBackoffMillis()),
        Math.max(0, cfg.maxBackoffMillis())
    );
  }

  static final class LoggingConnectionListener implements ConnectionListener {

    @Override
    public void onStateChange(ConnectionState from, ConnectionState to) {
      log.info("kalshi stream {} -> {}", from, to);
    }

    @Override
    public void onConnectionError(Throwable error) {
      log.error("kalshi stream error: {}", error.toString());
    }
  }
}
