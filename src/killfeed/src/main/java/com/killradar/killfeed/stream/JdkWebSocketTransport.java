package com.killradar.killfeed.stream;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.springframework.stereotype.Component;

/** {@link ChannelTransport} over the JDK WebSocket client. */
@Component
public class JdkWebSocketTransport implements ChannelTransport {
  private final HttpClient httpClient;

  public JdkWebSocketTransport(HttpClient httpClient) {
    this.httpClient = httpClient;
  }

  @Override
  public CompletableFuture<Connection> open(URI uri, Listener listener, Duration connectTimeout) {
    return httpClient.newWebSocketBuilder()
        .connectTimeout(connectTimeout)
        .buildAsync(uri, new FrameListener(listener))
        .thenApply(JdkConnection::new);
  }

  private static final class JdkConnection implements Connection {
    private final WebSocket webSocket;
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    private JdkConnection(WebSocket webSocket) {
      this.webSocket = webSocket;
    }

    // WebSocket allows one outstanding send; chain each frame after the previous one.
    @Override
    public synchronized CompletableFuture<Void> send(String text) {
      CompletableFuture<Void> next = tail
          .handle((ignored, error) -> null)
          .thenCompose(ignored -> webSocket.sendText(text, true))
          .thenApply(ws -> null);
      tail = next;
      return next;
    }

    @Override
    public void close() {
      webSocket.abort();
    }
  }

  private static final class FrameListener implements WebSocket.Listener {
    private final Listener listener;
    private final StringBuilder buffer = new StringBuilder();

    private FrameListener(Listener listener) {
      this.listener = listener;
    }

    @Override
    public void onOpen(WebSocket webSocket) {
      webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      buffer.append(data);
      if (last) {
        String text = buffer.toString();
        buffer.setLength(0);
        listener.onText(text);
      }
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      listener.onClosed(statusCode, reason);
      return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      listener.onError(error);
    }
  }
}
