package com.kalbot.kalshi.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kalbot.kalshi.KalshiClientException;
import com.kalbot.kalshi.auth.ClockGuard;
import com.kalbot.kalshi.auth.RequestSigner;
import com.kalbot.kalshi.auth.SigningException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Owns the logical stream connection: handshake, heartbeat, reconnect with backoff, and replay of
 * the registry's desired subscriptions onto every new socket.
 *
 * <p>All socket and state handling runs on one loop thread; transport callbacks only enqueue work
 * onto it. Subscriber callbacks run on a separate dispatch thread so a slow listener cannot delay
 * heartbeat checks or reconnects.
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED -> RECONNECTING -> CONNECTING -> ...
 *                      \______________________/
 * any state -> CLOSED (close() or reconnect budget exhausted)
 * </pre>
 */
@Slf4j
public final class StreamConnectionManager implements AutoCloseable {

  private final URI uri;
  private final String wsPath;
  private final StreamTransport transport;
  private final RequestSigner signer;
  private final ClockGuard clockGuard;
  private final StreamFrameCodec codec;
  private final StreamSettings settings;
  private final ConnectionListener connectionListener;
  private final SubscriptionRegistry registry = new SubscriptionRegistry();

  private final ScheduledThreadPoolExecutor loop = newLoop();
  private final ExecutorService dispatcher = Executors.newSingleThreadExecutor(r -> {
    Thread t = new Thread(r, "kalshi-stream-dispatch");
    t.setDaemon(true);
    return t;
  });

  private final AtomicBoolean closeRequested = new AtomicBoolean(false);
  private volatile ConnectionState state = ConnectionState.DISCONNECTED;

  // loop thread only
  private StreamSocket socket;
  private long generation;
  private long lostBeforeReadyGeneration = -1;
  private int failedHandshakes;
  private long lastInboundNanos;
  private long nextCommandId = 1;
  private ScheduledFuture<?> heartbeat;
  private final Map<Long, String> pendingCommands = new HashMap<>();
  private final Map<Long, String> correlationBySid = new HashMap<>();
  private final Map<String, Long> sidByCorrelation = new HashMap<>();
  private final Set<String> sentOnSocket = new HashSet<>();

  public StreamConnectionManager(
      @NonNull URI wsBaseUri,
      @NonNull String wsPath,
      @NonNull StreamTransport transport,
      @NonNull RequestSigner signer,
      @NonNull ClockGuard clockGuard,
      @NonNull ObjectMapper objectMapper,
      @NonNull StreamSettings settings,
      @NonNull ConnectionListener connectionListener
  ) {
    String base = wsBaseUri.toString();
    this.uri = URI.create((base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + wsPath);
    this.wsPath = wsPath;
    this.transport = transport;
    this.signer = signer;
    this.clockGuard = clockGuard;
    this.codec = new StreamFrameCodec(objectMapper);
    this.settings = settings;
    this.connectionListener = connectionListener;
  }

  public void start() {
    onLoop(() -> {
      if (state != ConnectionState.DISCONNECTED) {
        return;
      }
      log.info("stream connecting to {}", uri);
      transition(ConnectionState.CONNECTING);
      openSocket();
    });
  }

  /**
   * Records the intent and, when a socket is up, sends it right away. Otherwise it goes out with
   * the next replay.
   *
   * @throws IllegalStateException after {@link #close()}
   */
  public SubscriptionIntent subscribe(@NonNull ChannelKind channel, List<String> marketTickers, @NonNull StreamListener listener) {
    SubscriptionIntent intent = registry.add(channel, marketTickers, listener);
    onLoop(() -> {
      if (state == ConnectionState.CONNECTED && registry.contains(intent.correlationId())) {
        sendSubscribe(intent);
      }
    });
    return intent;
  }

  /**
   * @return false when the id was unknown or already unsubscribed
   */
  public boolean unsubscribe(String correlationId) {
    if (!registry.remove(correlationId)) {
      return false;
    }
    onLoop(() -> {
      sentOnSocket.remove(correlationId);
      Long sid = sidByCorrelation.remove(correlationId);
      if (sid == null) {
        // ack still pending: handled when the subscribed frame arrives
        return;
      }
      correlationBySid.remove(sid);
      if (state == ConnectionState.CONNECTED) {
        send(new StreamCommand.Unsubscribe(nextCommandId++, List.of(sid)));
      }
    });
    return true;
  }

  public List<SubscriptionIntent> subscriptions() {
    return registry.snapshot();
  }

  public ConnectionState state() {
    return state;
  }

  public boolean isConnected() {
    return state == ConnectionState.CONNECTED;
  }

  /**
   * Terminal. Releases the socket and both threads and clears the registry; never reconnects again.
   */
  @Override
  public void close() {
    if (!closeRequested.compareAndSet(false, true)) {
      return;
    }
    try {
      loop.submit(this::shutdownOnLoop).get(5, TimeUnit.SECONDS);
    } catch (RejectedExecutionException e) {
      log.debug("stream loop already stopped");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (Exception e) {
      log.warn("stream shutdown did not complete cleanly: {}", e.toString());
    }
    // queued handshake results still run and release their sockets; delayed reconnects are dropped
    loop.shutdown();
    dispatcher.shutdown();
  }

  private void openSocket() {
    long gen = ++generation;
    Map<String, String> headers;
    try {
      headers = signer.sign(clockGuard.nowMs(), "GET", wsPath).headers();
    } catch (SigningException e) {
      log.error("stream handshake cannot be signed, closing: {}", e.getMessage());
      shutdownOnLoop();
      notifyConnectionError(e);
      stopThreads();
      return;
    }

    CompletableFuture<StreamSocket> connecting;
    try {
      connecting = transport.connect(uri, headers, new SocketListener(gen));
    } catch (RuntimeException e) {
      connecting = CompletableFuture.failedFuture(e);
    }
    CompletableFuture<StreamSocket> handshake = connecting;
    handshake.whenComplete((s, err) -> deliverConnectResult(gen, s, err));
    // the timeout gives up on the attempt, the handshake itself may still produce a socket later
    handshake.copy()
        .orTimeout(settings.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete((s, err) -> {
          if (err instanceof TimeoutException) {
            deliverConnectResult(gen, null, err);
          }
        });
  }

  private void deliverConnectResult(long gen, StreamSocket newSocket, Throwable error) {
    if (newSocket != null && closeRequested.get()) {
      newSocket.close();
      return;
    }
    if (!onLoop(() -> onConnectResult(gen, newSocket, error)) && newSocket != null) {
      newSocket.close();
    }
  }

  private void onConnectResult(long gen, StreamSocket newSocket, Throwable error) {
    if (state != ConnectionState.CONNECTING || gen != generation) {
      // closed, superseded, or this attempt already timed out
      if (newSocket != null) {
        newSocket.close();
      }
      return;
    }
    if (error == null && lostBeforeReadyGeneration == gen) {
      error = new KalshiClientException("socket closed during handshake");
      newSocket.close();
    }
    if (error != null) {
      onHandshakeFailed(error);
      return;
    }

    socket = newSocket;
    failedHandshakes = 0;
    lastInboundNanos = System.nanoTime();
    resetSocketState();
    transition(ConnectionState.CONNECTED);

    List<SubscriptionIntent> desired = registry.snapshot();
    log.info("stream connected, replaying {} subscription(s)", desired.size());
    for (SubscriptionIntent intent : desired) {
      sendSubscribe(intent);
    }

    long period = settings.heartbeatInterval().toMillis();
    heartbeat = loop.scheduleAtFixedRate(() -> safely(this::heartbeatTick), period, period, TimeUnit.MILLISECONDS);
  }

  private void onHandshakeFailed(Throwable error) {
    failedHandshakes++;
    int budget = settings.maxReconnectAttempts();
    log.warn("stream handshake failed (attempt {}{}): {}", failedHandshakes,
        budget > 0 ? "/" + budget : "", error.toString());
    if (budget > 0 && failedHandshakes >= budget) {
      ConnectionExhaustedException exhausted = new ConnectionExhaustedException(failedHandshakes, error);
      log.error("stream reconnect budget exhausted after {} attempts, closing", failedHandshakes);
      shutdownOnLoop();
      notifyConnectionError(exhausted);
      stopThreads();
      return;
    }
    scheduleReconnect();
  }

  private void onSocketLost(long gen, String reason) {
    if (gen != generation) {
      return;
    }
    if (state == ConnectionState.CONNECTING) {
      lostBeforeReadyGeneration = gen;
      return;
    }
    if (state != ConnectionState.CONNECTED) {
      return;
    }
    log.warn("stream connection lost: {}", reason);
    abandonSocket();
    scheduleReconnect();
  }

  private void scheduleReconnect() {
    transition(ConnectionState.RECONNECTING);
    long delay = settings.reconnectBackoff().backoffMillis(Math.max(1, failedHandshakes));
    log.info("stream reconnecting in {}ms", delay);
    loop.schedule(() -> safely(() -> {
      if (state == ConnectionState.RECONNECTING) {
        transition(ConnectionState.CONNECTING);
        openSocket();
      }
    }), delay, TimeUnit.MILLISECONDS);
  }

  private void heartbeatTick() {
    if (state != ConnectionState.CONNECTED || socket == null) {
      return;
    }
    long silentMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastInboundNanos);
    if (silentMillis > settings.heartbeatTimeout().toMillis()) {
      onSocketLost(generation, "no inbound traffic for " + silentMillis + "ms");
      return;
    }
    long gen = generation;
    socket.ping().whenComplete((ignored, err) -> {
      if (err != null) {
        onLoop(() -> onSocketLost(gen, "ping failed: " + err));
      }
    });
  }

  private void handleFrame(long gen, String text) {
    if (gen != generation || state != ConnectionState.CONNECTED) {
      return;
    }
    lastInboundNanos = System.nanoTime();

    StreamEvent event;
    try {
      event = codec.decode(text);
    } catch (FrameDecodeException e) {
      log.warn("dropping malformed stream frame ({}): {}", e.getMessage(), abbreviate(text));
      return;
    }

    if (event instanceof StreamEvent.Subscribed subscribed) {
      onSubscribed(subscribed);
    } else if (event instanceof StreamEvent.Unsubscribed unsubscribed) {
      if (unsubscribed.id() != null) {
        pendingCommands.remove(unsubscribed.id());
      }
      String correlationId = correlationBySid.remove(unsubscribed.sid());
      if (correlationId != null) {
        sidByCorrelation.remove(correlationId);
      }
      log.debug("stream sid {} unsubscribed", unsubscribed.sid());
    } else if (event instanceof StreamEvent.Error error) {
      onError(error);
    } else if (event instanceof StreamEvent.Data data) {
      onData(data);
    }
  }

  private void onSubscribed(StreamEvent.Subscribed subscribed) {
    String correlationId = pendingCommands.remove(subscribed.id());
    if (correlationId == null) {
      log.warn("dropping subscribed ack for unknown command id {}", subscribed.id());
      return;
    }
    if (!registry.contains(correlationId)) {
      // unsubscribed while the ack was in flight
      send(new StreamCommand.Unsubscribe(nextCommandId++, List.of(subscribed.sid())));
      return;
    }
    correlationBySid.put(subscribed.sid(), correlationId);
    sidByCorrelation.put(correlationId, subscribed.sid());
    log.debug("subscription {} bound to sid {} ({})", correlationId, subscribed.sid(), subscribed.channel());
    dispatch(correlationId, (intent, listener) -> listener.onSubscribed(intent, subscribed.sid()));
  }

  private void onError(StreamEvent.Error error) {
    String correlationId = error.id() == null ? null : pendingCommands.remove(error.id());
    if (correlationId != null) {
      sentOnSocket.remove(correlationId);
      log.warn("stream rejected subscription {}: code={} {}", correlationId, error.code(), error.message());
      dispatch(correlationId, (intent, listener) -> listener.onError(intent, error));
      return;
    }
    log.warn("stream error id={} code={}: {}", error.id(), error.code(), error.message());
    notifyConnectionError(new KalshiClientException(
        "stream error code=%d: %s".formatted(error.code(), error.message())));
  }

  private void onData(StreamEvent.Data data) {
    if (data.sid() != null) {
      String correlationId = correlationBySid.get(data.sid());
      if (correlationId == null) {
        log.debug("dropping '{}' frame for unknown sid {}", data.type(), data.sid());
        return;
      }
      dispatch(correlationId, (intent, listener) -> listener.onMessage(intent, data));
      return;
    }
    Optional<ChannelKind> channel = ChannelKind.forEventType(data.type());
    if (channel.isEmpty()) {
      log.debug("dropping '{}' frame without sid for unknown channel", data.type());
      return;
    }
    for (SubscriptionRegistry.Subscriber subscriber : registry.subscribersOf(channel.get())) {
      dispatchTo(subscriber, l -> l.onMessage(subscriber.intent(), data));
    }
  }

  private void sendSubscribe(SubscriptionIntent intent) {
    if (!sentOnSocket.add(intent.correlationId())) {
      return;
    }
    long commandId = nextCommandId++;
    pendingCommands.put(commandId, intent.correlationId());
    send(new StreamCommand.Subscribe(commandId, List.of(intent.channel().wireName()), intent.marketTickers()));
  }

  private void send(StreamCommand command) {
    if (socket == null) {
      return;
    }
    long gen = generation;
    socket.sendText(codec.encode(command)).whenComplete((ignored, err) -> {
      if (err != null) {
        onLoop(() -> onSocketLost(gen, "send failed: " + err));
      }
    });
  }

  private void abandonSocket() {
    generation++;
    if (heartbeat != null) {
      heartbeat.cancel(false);
      heartbeat = null;
    }
    if (socket != null) {
      socket.close();
      socket = null;
    }
    resetSocketState();
  }

  private void resetSocketState() {
    pendingCommands.clear();
    correlationBySid.clear();
    sidByCorrelation.clear();
    sentOnSocket.clear();
  }

  private void shutdownOnLoop() {
    if (state == ConnectionState.CLOSED) {
      return;
    }
    abandonSocket();
    registry.close();
    transition(ConnectionState.CLOSED);
    log.info("stream closed");
  }

  private void stopThreads() {
    closeRequested.set(true);
    loop.shutdown();
    dispatcher.shutdown();
  }

  private void transition(ConnectionState next) {
    ConnectionState previous = state;
    if (previous == next) {
      return;
    }
    if (!previous.canTransitionTo(next)) {
      throw new IllegalStateException("illegal stream transition " + previous + " -> " + next);
    }
    state = next;
    log.debug("stream {} -> {}", previous, next);
    submitToDispatcher(() -> connectionListener.onStateChange(previous, next));
  }

  private void dispatch(String correlationId, SubscriberCallback callback) {
    registry.get(correlationId).ifPresent(subscriber ->
        dispatchTo(subscriber, l -> callback.accept(subscriber.intent(), l)));
  }

  private void dispatchTo(SubscriptionRegistry.Subscriber subscriber, Consumer<StreamListener> callback) {
    submitToDispatcher(() -> callback.accept(subscriber.listener()));
  }

  private void notifyConnectionError(Throwable error) {
    submitToDispatcher(() -> connectionListener.onConnectionError(error));
  }

  private void submitToDispatcher(Runnable callback) {
    try {
      dispatcher.execute(() -> {
        try {
          callback.run();
        } catch (Exception e) {
          log.warn("stream listener failed: {}", e.toString());
        }
      });
    } catch (RejectedExecutionException e) {
      log.debug("stream dispatcher stopped, dropping callback");
    }
  }

  /**
   * @return false when the loop has stopped and the task was dropped
   */
  private boolean onLoop(Runnable task) {
    try {
      loop.execute(() -> safely(task));
      return true;
    } catch (RejectedExecutionException e) {
      log.debug("stream loop stopped, dropping task");
      return false;
    }
  }

  private static ScheduledThreadPoolExecutor newLoop() {
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
      Thread t = new Thread(r, "kalshi-stream");
      t.setDaemon(true);
      return t;
    });
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }

  private void safely(Runnable task) {
    try {
      task.run();
    } catch (Exception e) {
      log.error("stream loop task failed", e);
    }
  }

  private static String abbreviate(String text) {
    if (text == null) {
      return "null";
    }
    return text.length() <= 200 ? text : text.substring(0, 200) + "...";
  }

  @FunctionalInterface
  private interface SubscriberCallback {
    void accept(SubscriptionIntent intent, StreamListener listener);
  }

  private final class SocketListener implements StreamSocket.Listener {

    private final long gen;

    private SocketListener(long gen) {
      this.gen = gen;
    }

    @Override
    public void onText(String text) {
      onLoop(() -> handleFrame(gen, text));
    }

    @Override
    public void onHeartbeat() {
      onLoop(() -> {
        if (gen == generation) {
          lastInboundNanos = System.nanoTime();
        }
      });
    }

    @Override
    public void onClosed(int statusCode, String reason) {
      onLoop(() -> onSocketLost(gen, "closed by server (" + statusCode + " " + reason + ")"));
    }

    @Override
    public void onError(Throwable error) {
      onLoop(() -> onSocketLost(gen, error.toString()));
    }
  }
}
