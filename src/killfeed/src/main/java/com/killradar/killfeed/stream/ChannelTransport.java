package com.killradar.killfeed.stream;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/** Text-frame socket used by {@link KillStreamClient}. */
public interface ChannelTransport {

  CompletableFuture<Connection> open(URI uri, Listener listener, Duration connectTimeout);

  interface Connection {
    /** Sends one complete text frame; frames go out in call order. */
    CompletableFuture<Void> send(String text);

    /** Drops the socket without waiting for a close handshake. */
    void close();
  }

  /** Callbacks arrive on transport threads. */
  interface Listener {
    void onText(String text);

    void onClosed(int statusCode, String reason);

    void onError(Throwable error);
  }
}
