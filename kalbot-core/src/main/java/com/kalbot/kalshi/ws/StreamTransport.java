package com.kalbot.kalshi.ws;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Opens sockets for the connection manager.
 */
@FunctionalInterface
public interface StreamTransport {

  CompletableFuture<StreamSocket> connect(URI uri, Map<String, String> headers, StreamSocket.Listener listener);
}
