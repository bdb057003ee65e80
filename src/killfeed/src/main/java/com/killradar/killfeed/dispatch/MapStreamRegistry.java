package com.killradar.killfeed.dispatch;

import com.killradar.killfeed.config.KillfeedProperties;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Server-Sent Events consumers, one per open map view.
 *
 * <p>Each stream declares the locations it displays. The union of those locations and the
 * statically configured ones is what the ingestion side keeps subscribed; every open or close
 * publishes a {@link TrackedSystemsChangedEvent}. A heartbeat keeps idle connections alive
 * through proxies.
 */
@Service
public class MapStreamRegistry implements ConsumerRegistry, TrackedSystemsProvider {
  private static final Logger log = LoggerFactory.getLogger(MapStreamRegistry.class);
  private static final long STREAM_TIMEOUT_MS = 0L;

  private final ApplicationEventPublisher eventPublisher;
  private final KillfeedProperties properties;
  private final Clock clock;
  private final Map<String, SseKillConsumer> consumers = new ConcurrentHashMap<>();
  private final ScheduledExecutorService scheduler =
      Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "killfeed-sse-heartbeat");
        thread.setDaemon(true);
        return thread;
      });

  private volatile boolean started = false;

  public MapStreamRegistry(
      ApplicationEventPublisher eventPublisher,
      KillfeedProperties properties,
      Clock clock) {
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Opens a stream for the given locations and registers it as a consumer.
   *
   * @param systems locations the map displays
   * @return emitter that receives kill events and heartbeats
   */
  public SseEmitter openStream(Set<Long> systems) {
    startIfNeeded();

    SseEmitter emitter = createEmitter();
    SseKillConsumer consumer = new SseKillConsumer(UUID.randomUUID().toString(), Set.copyOf(systems), emitter);
    consumers.put(consumer.id(), consumer);

    emitter.onCompletion(() -> remove(consumer));
    emitter.onTimeout(() -> remove(consumer));
    emitter.onError(ex -> remove(consumer));

    Map<String, Object> connected = new LinkedHashMap<>();
    connected.put("stream_id", consumer.id());
    connected.put("systems", new TreeSet<>(systems));
    connected.put("timestamp", clock.instant().toString());
    send(consumer, "connected", connected);

    publishTrackedSystems();
    return emitter;
  }

  @Override
  public Collection<KillConsumer> consumers() {
    return List.copyOf(consumers.values());
  }

  @Override
  public Set<Long> trackedSystems() {
    Set<Long> tracked = new TreeSet<>(properties.subscription().staticSystems());
    for (SseKillConsumer consumer : consumers.values()) {
      tracked.addAll(consumer.systems());
    }
    return tracked;
  }

  public int openStreams() {
    return consumers.size();
  }

  SseEmitter createEmitter() {
    return new SseEmitter(STREAM_TIMEOUT_MS);
  }

  private synchronized void startIfNeeded() {
    if (started) {
      return;
    }
    started = true;
    long intervalMs = properties.sse().heartbeatInterval().toMillis();
    scheduler.scheduleWithFixedDelay(this::heartbeat, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  private void heartbeat() {
    try {
      Map<String, Object> payload = Map.of("timestamp", clock.instant().toString());
      for (SseKillConsumer consumer : consumers.values()) {
        send(consumer, "heartbeat", payload);
      }
    } catch (Exception ex) {
      log.warn("Kill stream heartbeat failed", ex);
    }
  }

  private void remove(SseKillConsumer consumer) {
    if (consumers.remove(consumer.id()) != null) {
      log.debug("Kill stream {} closed", consumer.id());
      publishTrackedSystems();
    }
  }

  private void publishTrackedSystems() {
    eventPublisher.publishEvent(new TrackedSystemsChangedEvent(trackedSystems()));
  }

  private boolean send(SseKillConsumer consumer, String eventName, Object payload) {
    try {
      consumer.emitter().send(SseEmitter.event().name(eventName).data(payload));
      return true;
    } catch (Exception ex) {
      remove(consumer);
      if (clientGone(ex)) {
        log.debug("Kill stream {} went away during {}: {}", consumer.id(), eventName, ex.getMessage());
        close(consumer.emitter(), null);
      } else {
        log.warn("Delivering {} to kill stream {} failed", eventName, consumer.id(), ex);
        close(consumer.emitter(), ex);
      }
      return false;
    }
  }

  @PreDestroy
  public void stop() {
    scheduler.shutdownNow();
    for (SseKillConsumer consumer : consumers.values()) {
      close(consumer.emitter(), null);
    }
    consumers.clear();
  }

  /** Writes to a closed SSE response surface as an IOException somewhere in the chain. */
  static boolean clientGone(Throwable error) {
    for (Throwable cause = error; cause != null; cause = cause.getCause()) {
      if (cause instanceof IOException) {
        return true;
      }
    }
    return false;
  }

  private static void close(SseEmitter emitter, Exception failure) {
    try {
      if (failure == null) {
        emitter.complete();
      } else {
        emitter.completeWithError(failure);
      }
    } catch (IllegalStateException ex) {
      log.debug("Kill stream emitter already closed: {}", ex.getMessage());
    }
  }

  private final class SseKillConsumer implements KillConsumer {
    private final String id;
    private final Set<Long> systems;
    private final SseEmitter emitter;

    private SseKillConsumer(String id, Set<Long> systems, SseEmitter emitter) {
      this.id = id;
      this.systems = systems;
      this.emitter = emitter;
    }

    @Override
    public String id() {
      return id;
    }

    Set<Long> systems() {
      return systems;
    }

    SseEmitter emitter() {
      return emitter;
    }

    @Override
    public boolean watches(long systemId) {
      return systems.contains(systemId);
    }

    @Override
    public void deliver(KillEvent event) {
      if (!send(this, event.type().eventName(), event.toPayload())) {
        throw new IllegalStateException("stream " + id + " is closed");
      }
    }
  }
}
