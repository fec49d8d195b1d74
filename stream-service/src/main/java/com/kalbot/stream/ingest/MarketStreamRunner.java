package com.kalbot.stream.ingest;

import com.kalbot.config.KalbotProperties;
import com.kalbot.kalshi.ws.ChannelKind;
import com.kalbot.kalshi.ws.StreamConnectionManager;
import com.kalbot.kalshi.ws.StreamEvent;
import com.kalbot.kalshi.ws.StreamListener;
import com.kalbot.kalshi.ws.SubscriptionIntent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Starts the market stream once the application is up and subscribes the configured channels.
 *
 * Keeps the last frame per market ticker so the status endpoint can show what is flowing.
 */
@Component
@Slf4j
public class MarketStreamRunner implements StreamListener {

  private final KalbotProperties properties;
  private final StreamConnectionManager stream;
  private final Clock clock;

  private final AtomicBoolean initOnce = new AtomicBoolean(false);
  private final AtomicLong messages = new AtomicLong(0);
  private final AtomicLong errors = new AtomicLong(0);
  private final Map<String, Long> lastMessageAtByTicker = new ConcurrentHashMap<>();
  private final List<String> subscriptionIds = new ArrayList<>();

  private final Counter messagesCounter;
  private final Counter errorsCounter;

  private volatile long lastMessageAtMillis;

  public MarketStreamRunner(
      KalbotProperties properties,
      StreamConnectionManager stream,
      Clock clock,
      MeterRegistry meterRegistry
  ) {
    this.properties = properties;
    this.stream = stream;
    this.clock = clock;

    this.messagesCounter = Counter.builder("kalshi.stream.messages")
        .description("Market data frames routed to subscribers")
        .register(meterRegistry);
    this.errorsCounter = Counter.builder("kalshi.stream.subscription.errors")
        .description("Subscriptions rejected by the exchange")
        .register(meterRegistry);
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onReady() {
    if (!initOnce.compareAndSet(false, true)) {
      return;
    }
    KalbotProperties.Stream cfg = properties.stream();
    if (!cfg.enabled()) {
      log.info("kalshi market stream is disabled");
      return;
    }

    for (String name : cfg.channels()) {
      Optional<ChannelKind> channel = ChannelKind.fromWireName(name);
      if (channel.isEmpty()) {
        log.warn("ignoring unknown stream channel '{}'", name);
        continue;
      }
      SubscriptionIntent intent = stream.subscribe(channel.get(), cfg.marketTickers(), this);
      synchronized (subscriptionIds) {
        subscriptionIds.add(intent.correlationId());
      }
      log.info("subscribed {} channel={} tickers={}", intent.correlationId(), name, cfg.marketTickers());
    }
    stream.start();
  }

  @Override
  public void onMessage(SubscriptionIntent subscription, StreamEvent.Data event) {
    long now = clock.millis();
    messages.incrementAndGet();
    messagesCounter.increment();
    lastMessageAtMillis = now;
    String ticker = event.msg().path("market_ticker").asText("");
    if (!ticker.isEmpty()) {
      lastMessageAtByTicker.put(ticker, now);
    }
    if (log.isDebugEnabled()) {
      log.debug("{} {} sid={} seq={} ticker={}", subscription.correlationId(), event.type(), event.sid(), event.seq(), ticker);
    }
  }

  @Override
  public void onSubscribed(SubscriptionIntent subscription, long sid) {
    log.info("subscription {} ({}) acknowledged, sid={}", subscription.correlationId(), subscription.channel().wireName(), sid);
  }

  @Override
  public void onError(SubscriptionIntent subscription, StreamEvent.Error error) {
    errors.incrementAndGet();
    errorsCounter.increment();
    log.warn("subscription {} rejected: code={} {}", subscription.correlationId(), error.code(), error.message());
  }

  public long messageCount() {
    return messages.get();
  }

  public long errorCount() {
    return errors.get();
  }

  public long lastMessageAtMillis() {
    return lastMessageAtMillis;
  }

  public int activeTickerCount() {
    return lastMessageAtByTicker.size();
  }

  public List<String> subscriptionIds() {
    synchronized (subscriptionIds) {
      return List.copyOf(subscriptionIds);
    }
  }
}
