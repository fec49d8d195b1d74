package com.kalbot.kalshi.ws;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * {@link StreamTransport} over {@code java.net.http.WebSocket}.
 */
@Slf4j
public final class JdkWebSocketTransport implements StreamTransport {

  private static final ByteBuffer EMPTY = ByteBuffer.allocate(0);

  private final HttpClient httpClient;
  private final Duration connectTimeout;

  public JdkWebSocketTransport(@NonNull HttpClient httpClient, @NonNull Duration connectTimeout) {
    this.httpClient = httpClient;
    this.connectTimeout = connectTimeout;
  }

  @Override
  public CompletableFuture<StreamSocket> connect(URI uri, Map<String, String> headers, StreamSocket.Listener listener) {
    WebSocket.Builder builder = httpClient.newWebSocketBuilder().connectTimeout(connectTimeout);
    headers.forEach(builder::header);
    return builder.buildAsync(uri, new ListenerAdapter(listener))
        .thenApply(JdkSocket::new);
  }

  private static final class JdkSocket implements StreamSocket {

    private final WebSocket webSocket;
    // java.net.http.WebSocket rejects a send while the previous one is still pending
    private CompletableFuture<?> lastSend = CompletableFuture.completedFuture(null);

    private JdkSocket(WebSocket webSocket) {
      this.webSocket = webSocket;
    }

    @Override
    public synchronized CompletableFuture<Void> sendText(String text) {
      CompletableFuture<Void> next = lastSend
          .handle((ignored, err) -> null)
          .thenCompose(ignored -> webSocket.sendText(text, true))
          .thenApply(ws -> null);
      lastSend = next;
      return next;
    }

    @Override
    public synchronized CompletableFuture<Void> ping() {
      CompletableFuture<Void> next = lastSend
          .handle((ignored, err) -> null)
          .thenCompose(ignored -> webSocket.sendPing(EMPTY))
          .thenApply(ws -> null);
      lastSend = next;
      return next;
    }

    @Override
    public void close() {
      try {
        webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "client closing")
            .orTimeout(2, TimeUnit.SECONDS)
            .whenComplete((ws, err) -> webSocket.abort());
      } catch (RuntimeException e) {
        log.debug("websocket close failed: {}", e.toString());
        webSocket.abort();
      }
    }
  }

  static final class ListenerAdapter implements WebSocket.Listener {

    private final StreamSocket.Listener delegate;
    private final StringBuilder partial = new StringBuilder();

    ListenerAdapter(StreamSocket.Listener delegate) {
      this.delegate = delegate;
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      partial.append(data);
      if (last) {
        String text = partial.toString();
        partial.setLength(0);
        delegate.onText(text);
      }
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onPing(WebSocket webSocket, ByteBuffer message) {
      delegate.onHeartbeat();
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
      delegate.onHeartbeat();
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      delegate.onClosed(statusCode, reason);
      return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      delegate.onError(error);
    }
  }
}
