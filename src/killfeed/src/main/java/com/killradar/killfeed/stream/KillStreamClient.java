package com.killradar.killfeed.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.killradar.killfeed.config.StreamProperties;
import com.killradar.killfeed.dispatch.KillEventProcessor;
import com.killradar.killfeed.subscription.SubscriptionDiff;
import com.killradar.killfeed.subscription.SubscriptionManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Owns the single upstream kill stream connection.
 *
 * <p>Every field below the "actor state" marker is read and written only on the client's own
 * single-threaded scheduler. Public methods enqueue work there and return immediately, and
 * transport callbacks are enqueued the same way, so no locking is needed.
 *
 * <p>Each connect attempt gets a new generation number. Callbacks carry the generation they
 * were created for; anything from an older attempt is dropped, which makes duplicate or late
 * disconnect signals harmless.
 */
@Component
public class KillStreamClient {
  private static final Logger log = LoggerFactory.getLogger(KillStreamClient.class);
  private static final String HEARTBEAT_TOPIC = "phoenix";
  private static final String JOIN_EVENT = "phx_join";
  static final String SUBSCRIBE_EVENT = "subscribe_systems";
  static final String UNSUBSCRIBE_EVENT = "unsubscribe_systems";

  private final ChannelTransport transport;
  private final PhoenixCodec codec;
  private final KillEventProcessor eventProcessor;
  private final Supplier<Set<Long>> desiredSystems;
  private final StreamProperties properties;
  private final ReconnectPolicy reconnectPolicy;
  private final RandomGenerator random;
  private final Clock clock;
  private final ScheduledExecutorService executor;
  private final Counter reconnectCounter;

  private volatile ConnectionState stateView = ConnectionState.DISCONNECTED;
  private final AtomicInteger subscribedCount = new AtomicInteger();

  // actor state
  private ConnectionState state = ConnectionState.DISCONNECTED;
  private long generation;
  private long refCounter;
  private int retryCount;
  private int cycleCount;
  private String lastError;
  private Duration nextRetryDelay;
  private Instant connectedAt;
  private ChannelTransport.Connection connection;
  private String joinRef;
  private Set<Long> joiningSystems = Set.of();
  private final Set<Long> subscribed = new TreeSet<>();
  private final Map<String, PendingPush> pendingPushes = new HashMap<>();
  private final List<DeferredPush> deferredPushes = new ArrayList<>();
  private ScheduledFuture<?> reconnectTimer;
  private ScheduledFuture<?> connectTimeoutTimer;
  private ScheduledFuture<?> heartbeatTimer;
  private ScheduledFuture<?> healthTimer;
  private boolean stopped;

  @Autowired
  public KillStreamClient(
      ChannelTransport transport,
      ObjectMapper objectMapper,
      KillEventProcessor eventProcessor,
      ObjectProvider<SubscriptionManager> subscriptionManager,
      StreamProperties properties,
      RandomGenerator jitterRandom,
      Clock clock,
      MeterRegistry meterRegistry) {
    this(
        transport,
        new PhoenixCodec(objectMapper),
        eventProcessor,
        () -> subscriptionManager.getObject().desiredSystems(),
        properties,
        jitterRandom,
        clock,
        meterRegistry,
        Executors.newSingleThreadScheduledExecutor(runnable -> {
          Thread thread = new Thread(runnable, "killfeed-stream");
          thread.setDaemon(true);
          return thread;
        }));
  }

  KillStreamClient(
      ChannelTransport transport,
      PhoenixCodec codec,
      KillEventProcessor eventProcessor,
      Supplier<Set<Long>> desiredSystems,
      StreamProperties properties,
      RandomGenerator random,
      Clock clock,
      MeterRegistry meterRegistry,
      ScheduledExecutorService executor) {
    this.transport = transport;
    this.codec = codec;
    this.eventProcessor = eventProcessor;
    this.desiredSystems = desiredSystems;
    this.properties = properties;
    this.reconnectPolicy = ReconnectPolicy.from(properties);
    this.random = random;
    this.clock = clock;
    this.executor = executor;
    this.reconnectCounter = Counter.builder("killfeed.stream.reconnects.total")
        .description("Scheduled stream reconnects")
        .register(meterRegistry);
    Gauge.builder("killfeed.stream.connected", this, client -> client.stateView == ConnectionState.CONNECTED ? 1 : 0)
        .description("1 while the stream channel is joined")
        .register(meterRegistry);
    Gauge.builder("killfeed.stream.subscribed.systems", subscribedCount, AtomicInteger::get)
        .description("Locations subscribed on the live channel")
        .register(meterRegistry);
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!properties.enabled()) {
      log.info("Kill stream disabled");
      return;
    }
    start();
  }

  /** Schedules the first connect after a small random delay and starts the health check. */
  public void start() {
    long minMs = properties.initialJitterMin().toMillis();
    long maxMs = Math.max(minMs, properties.initialJitterMax().toMillis());
    long jitterMs = random.nextLong(minMs, maxMs + 1);
    enqueue(() -> {
      if (healthTimer == null) {
        long intervalMs = properties.healthCheckInterval().toMillis();
        healthTimer = executor.scheduleWithFixedDelay(this::healthCheck, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
      }
      log.info("Kill stream connecting in {}ms", jitterMs);
      reconnectTimer = executor.schedule(this::connectNow, jitterMs, TimeUnit.MILLISECONDS);
    });
  }

  /** Connects unless a connection is already being made or live. */
  public void connect() {
    enqueue(this::connectNow);
  }

  /** Drops whatever exists and connects immediately, bypassing the backoff. */
  public void reconnect() {
    enqueue(this::forceReconnect);
  }

  /**
   * Adds locations to the live channel.
   *
   * @return the live subscription set once upstream acknowledged, or immediately when nothing
   *     had to be pushed; fails with {@link PushFailedException} when the push was rejected
   */
  public CompletableFuture<Set<Long>> subscribe(Collection<Long> systems) {
    CompletableFuture<Set<Long>> result = new CompletableFuture<>();
    Set<Long> requested = Set.copyOf(systems);
    if (!enqueue(() -> push(SUBSCRIBE_EVENT, requested, true, result))) {
      result.completeExceptionally(new IllegalStateException("stream client stopped"));
    }
    return result;
  }

  /** Removes locations from the live channel; see {@link #subscribe(Collection)}. */
  public CompletableFuture<Set<Long>> unsubscribe(Collection<Long> systems) {
    CompletableFuture<Set<Long>> result = new CompletableFuture<>();
    Set<Long> requested = Set.copyOf(systems);
    if (!enqueue(() -> push(UNSUBSCRIBE_EVENT, requested, false, result))) {
      result.completeExceptionally(new IllegalStateException("stream client stopped"));
    }
    return result;
  }

  public CompletableFuture<StreamStatus> status() {
    CompletableFuture<StreamStatus> result = new CompletableFuture<>();
    if (!enqueue(() -> result.complete(snapshot()))) {
      result.complete(snapshot());
    }
    return result;
  }

  /** Last published state; safe to read from any thread. */
  public ConnectionState currentState() {
    return stateView;
  }

  @PreDestroy
  public void stop() {
    enqueue(() -> {
      stopped = true;
      cancel(healthTimer);
      cancel(reconnectTimer);
      tearDown("shutdown");
      generation++;
      setState(ConnectionState.DISCONNECTED);
    });
    executor.shutdown();
    try {
      if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private void connectNow() {
    if (stopped) {
      return;
    }
    if (state != ConnectionState.DISCONNECTED) {
      log.debug("Connect ignored while {}", state);
      return;
    }
    cancel(reconnectTimer);
    reconnectTimer = null;
    nextRetryDelay = null;

    long attempt = ++generation;
    setState(ConnectionState.CONNECTING);
    URI uri = socketUri();
    log.info("Connecting to kill stream {} (retry {}, cycle {})", uri, retryCount, cycleCount);
    connectTimeoutTimer = executor.schedule(
        () -> handleDisconnect(attempt, "connect_timeout"),
        properties.connectTimeout().toMillis(),
        TimeUnit.MILLISECONDS);

    CompletableFuture<ChannelTransport.Connection> opening;
    try {
      opening = transport.open(uri, new AttemptListener(attempt), properties.connectTimeout());
    } catch (RuntimeException ex) {
      handleDisconnect(attempt, "transport_error: " + describe(ex));
      return;
    }
    opening.whenComplete((opened, error) -> {
      if (!enqueue(() -> onTransportOpened(attempt, opened, error)) && opened != null) {
        opened.close();
      }
    });
  }

  private void onTransportOpened(long attempt, ChannelTransport.Connection opened, Throwable error) {
    if (attempt != generation || state != ConnectionState.CONNECTING) {
      if (opened != null) {
        opened.close();
      }
      return;
    }
    if (error != null) {
      handleDisconnect(attempt, "transport_error: " + describe(error));
      return;
    }
    connection = opened;
    joinRef = nextRef();
    joiningSystems = currentDesiredSystems();
    ObjectNode payload = codec.systemsPayload(joiningSystems);
    payload.put("client_identifier", properties.clientIdentifier());
    log.debug("Joining {} with {} systems", properties.topic(), joiningSystems.size());
    send(attempt, new PhoenixMessage(joinRef, joinRef, properties.topic(), JOIN_EVENT, payload));
  }

  private Set<Long> currentDesiredSystems() {
    try {
      return new TreeSet<>(desiredSystems.get());
    } catch (RuntimeException ex) {
      log.warn("Could not resolve desired systems, joining with none", ex);
      return Set.of();
    }
  }

  private void handleFrame(long attempt, String text) {
    if (attempt != generation) {
      return;
    }
    PhoenixMessage message;
    try {
      message = codec.decode(text);
    } catch (IllegalArgumentException ex) {
      log.warn("Dropping malformed stream frame: {}", ex.getMessage());
      return;
    }
    Runnable handler = switch (ChannelEvent.fromWire(message.event())) {
      case REPLY -> () -> handleReply(attempt, message);
      case KILLMAIL_UPDATE -> () -> handleKillmailUpdate(message);
      case KILL_COUNT_UPDATE -> () -> handleKillCountUpdate(message);
      case CHANNEL_CLOSED -> () -> handleChannelClosed(attempt, message);
      case UNKNOWN -> () -> log.debug("Ignoring {} on {}", message.event(), message.topic());
    };
    handler.run();
  }

  private void handleReply(long attempt, PhoenixMessage message) {
    String status = message.payload().path("status").asText();
    JsonNode response = message.payload().path("response");
    if (state == ConnectionState.CONNECTING && message.ref() != null && message.ref().equals(joinRef)) {
      if ("ok".equals(status)) {
        onJoined(attempt);
      } else {
        handleDisconnect(attempt, "join_rejected: " + response);
      }
      return;
    }

    // Heartbeat replies carry refs that were never registered.
    PendingPush push = message.ref() == null ? null : pendingPushes.remove(message.ref());
    if (push == null) {
      return;
    }
    cancel(push.timeout());
    if ("ok".equals(status)) {
      log.info("{} acknowledged for {} systems", push.event(), push.systems().size());
      push.result().complete(Set.copyOf(subscribed));
    } else {
      revert(push);
      push.result().completeExceptionally(
          new PushFailedException(push.event() + " rejected: " + response));
    }
  }

  private void handleKillmailUpdate(PhoenixMessage message) {
    JsonNode payload = message.payload();
    JsonNode systemId = payload.path("system_id");
    if (!systemId.canConvertToLong()) {
      log.warn("killmail_update without system_id, dropping");
      return;
    }
    List<JsonNode> killmails = new ArrayList<>();
    for (JsonNode killmail : payload.path("killmails")) {
      killmails.add(killmail);
    }
    if (!killmails.isEmpty()) {
      eventProcessor.onKillmailUpdate(systemId.asLong(), killmails);
    }
  }

  private void handleKillCountUpdate(PhoenixMessage message) {
    JsonNode payload = message.payload();
    if (!payload.path("system_id").canConvertToLong() || !payload.path("count").canConvertToLong()) {
      log.warn("kill_count_update missing system_id or count, dropping");
      return;
    }
    eventProcessor.onKillCountUpdate(payload.get("system_id").asLong(), payload.get("count").asLong());
  }

  private void handleChannelClosed(long attempt, PhoenixMessage message) {
    if (properties.topic().equals(message.topic())) {
      handleDisconnect(attempt, "channel_closed: " + message.event());
    }
  }

  private void onJoined(long attempt) {
    cancel(connectTimeoutTimer);
    connectTimeoutTimer = null;
    setState(ConnectionState.CONNECTED);
    retryCount = 0;
    cycleCount = 0;
    lastError = null;
    connectedAt = clock.instant();
    subscribed.clear();
    subscribed.addAll(joiningSystems);
    subscribedCount.set(subscribed.size());
    List<DeferredPush> deferred = new ArrayList<>(deferredPushes);
    deferredPushes.clear();
    for (DeferredPush request : deferred) {
      push(request.event(), request.systems(), request.adding(), request.result());
    }
    long heartbeatMs = properties.heartbeatInterval().toMillis();
    heartbeatTimer = executor.scheduleAtFixedRate(
        () -> sendHeartbeat(attempt), heartbeatMs, heartbeatMs, TimeUnit.MILLISECONDS);
    log.info("Joined {} with {} systems", properties.topic(), subscribed.size());
  }

  private void sendHeartbeat(long attempt) {
    if (attempt != generation || state != ConnectionState.CONNECTED) {
      return;
    }
    send(attempt, new PhoenixMessage(null, nextRef(), HEARTBEAT_TOPIC, "heartbeat", codec.emptyPayload()));
  }

  /** Single entry point for every failure: transport, join, channel close and timeouts. */
  private void handleDisconnect(long attempt, String reason) {
    if (attempt != generation) {
      log.debug("Ignoring stale disconnect ({})", reason);
      return;
    }
    if (state == ConnectionState.DISCONNECTED) {
      log.debug("Ignoring duplicate disconnect ({})", reason);
      return;
    }
    tearDown(reason);
    generation++;
    setState(ConnectionState.DISCONNECTED);
    lastError = reason;
    if (stopped) {
      return;
    }

    ReconnectPolicy.Backoff backoff = reconnectPolicy.next(retryCount, cycleCount);
    retryCount = backoff.retryCount();
    cycleCount = backoff.cycleCount();
    nextRetryDelay = backoff.delay();
    reconnectTimer = executor.schedule(this::connectNow, backoff.delay().toMillis(), TimeUnit.MILLISECONDS);
    reconnectCounter.increment();
    log.warn("Kill stream disconnected ({}), reconnecting in {}s (retry {}, cycle {})",
        reason, backoff.delay().toSeconds(), retryCount, cycleCount);
  }

  private void forceReconnect() {
    log.info("Forced reconnect requested while {}", state);
    cancel(reconnectTimer);
    reconnectTimer = null;
    nextRetryDelay = null;
    tearDown("reconnect_requested");
    generation++;
    setState(ConnectionState.DISCONNECTED);
    connectNow();
  }

  private void healthCheck() {
    boolean timerPending = reconnectTimer != null && !reconnectTimer.isDone();
    if (state == ConnectionState.DISCONNECTED && !timerPending) {
      log.warn("Kill stream disconnected with no reconnect scheduled, connecting");
      connectNow();
    } else {
      log.debug("Kill stream health: {} ({} systems)", state, subscribed.size());
    }
  }

  private void push(String event, Set<Long> requested, boolean adding, CompletableFuture<Set<Long>> result) {
    if (state == ConnectionState.CONNECTING && joinRef != null) {
      // The join already went out with an older desired set; replay once it is acknowledged.
      deferredPushes.add(new DeferredPush(event, requested, adding, result));
      return;
    }
    if (state != ConnectionState.CONNECTED || connection == null) {
      // The next join carries the desired set.
      result.complete(Set.copyOf(subscribed));
      return;
    }
    Set<Long> diff = adding
        ? SubscriptionDiff.additions(requested, subscribed)
        : SubscriptionDiff.removals(requested, subscribed);
    if (diff.isEmpty()) {
      result.complete(Set.copyOf(subscribed));
      return;
    }
    apply(diff, adding);

    String ref = nextRef();
    ScheduledFuture<?> timeout = executor.schedule(
        () -> failPush(ref, "push_timeout"), properties.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
    pendingPushes.put(ref, new PendingPush(event, diff, adding, result, timeout));
    connection.send(codec.encode(new PhoenixMessage(joinRef, ref, properties.topic(), event, codec.systemsPayload(diff))))
        .whenComplete((ignored, error) -> {
          if (error != null) {
            enqueue(() -> failPush(ref, "send_failed: " + describe(error)));
          }
        });
  }

  private void failPush(String ref, String reason) {
    PendingPush push = pendingPushes.remove(ref);
    if (push == null) {
      return;
    }
    cancel(push.timeout());
    revert(push);
    log.warn("{} for {} systems failed: {}", push.event(), push.systems().size(), reason);
    push.result().completeExceptionally(new PushFailedException(push.event() + " failed: " + reason));
  }

  private void revert(PendingPush push) {
    apply(push.systems(), !push.adding());
  }

  private void apply(Set<Long> systems, boolean adding) {
    if (adding) {
      subscribed.addAll(systems);
    } else {
      subscribed.removeAll(systems);
    }
    subscribedCount.set(subscribed.size());
  }

  private void tearDown(String reason) {
    cancel(connectTimeoutTimer);
    connectTimeoutTimer = null;
    cancel(heartbeatTimer);
    heartbeatTimer = null;
    for (String ref : new ArrayList<>(pendingPushes.keySet())) {
      failPush(ref, reason);
    }
    if (connection != null) {
      connection.close();
      connection = null;
    }
    joinRef = null;
    connectedAt = null;
    subscribed.clear();
    subscribedCount.set(0);
    // Not sent; the next join carries the desired set.
    for (DeferredPush request : deferredPushes) {
      request.result().complete(Set.of());
    }
    deferredPushes.clear();
  }

  private void send(long attempt, PhoenixMessage message) {
    connection.send(codec.encode(message)).whenComplete((ignored, error) -> {
      if (error != null) {
        enqueue(() -> handleDisconnect(attempt, "send_failed: " + describe(error)));
      }
    });
  }

  private StreamStatus snapshot() {
    return new StreamStatus(
        state, retryCount, cycleCount, lastError, Set.copyOf(subscribed), nextRetryDelay, connectedAt);
  }

  private void setState(ConnectionState next) {
    state = next;
    stateView = next;
  }

  private String nextRef() {
    return String.valueOf(++refCounter);
  }

  URI socketUri() {
    String base = properties.serverUrl().replaceAll("/+$", "");
    if (base.startsWith("http://")) {
      base = "ws://" + base.substring("http://".length());
    } else if (base.startsWith("https://")) {
      base = "wss://" + base.substring("https://".length());
    }
    return URI.create(base + "/socket/websocket?vsn=" + properties.vsn());
  }

  private boolean enqueue(Runnable task) {
    try {
      executor.execute(() -> {
        try {
          task.run();
        } catch (RuntimeException ex) {
          log.error("Kill stream task failed", ex);
        }
      });
      return true;
    } catch (RejectedExecutionException ex) {
      log.debug("Kill stream client stopped, dropping task");
      return false;
    }
  }

  private static void cancel(ScheduledFuture<?> future) {
    if (future != null) {
      future.cancel(false);
    }
  }

  private static String describe(Throwable error) {
    Throwable current = error;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    String message = current.getMessage();
    return message == null || message.isBlank()
        ? current.getClass().getSimpleName()
        : current.getClass().getSimpleName() + ": " + message;
  }

  private record PendingPush(
      String event,
      Set<Long> systems,
      boolean adding,
      CompletableFuture<Set<Long>> result,
      ScheduledFuture<?> timeout) {}

  private record DeferredPush(
      String event, Set<Long> systems, boolean adding, CompletableFuture<Set<Long>> result) {}

  private final class AttemptListener implements ChannelTransport.Listener {
    private final long attempt;

    private AttemptListener(long attempt) {
      this.attempt = attempt;
    }

    @Override
    public void onText(String text) {
      enqueue(() -> handleFrame(attempt, text));
    }

    @Override
    public void onClosed(int statusCode, String reason) {
      enqueue(() -> handleDisconnect(attempt, "closed: " + statusCode + " " + reason));
    }

    @Override
    public void onError(Throwable error) {
      enqueue(() -> handleDisconnect(attempt, "transport_error: " + describe(error)));
    }
  }
}
