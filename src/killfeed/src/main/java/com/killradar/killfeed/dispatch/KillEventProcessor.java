package com.killradar.killfeed.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.killradar.killfeed.cache.KillStore;
import com.killradar.killfeed.config.KillfeedProperties;
import com.killradar.killfeed.config.StreamProperties;
import com.killradar.killfeed.model.Killmail;
import com.killradar.killfeed.parser.KillmailParser;
import com.killradar.killfeed.parser.ParseResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Hands inbound stream events to worker lanes, then parses, stores and dispatches them.
 *
 * <p>A location always maps to the same single-threaded lane, so its events are processed and
 * delivered in arrival order. The caller (the connection's event loop) never blocks on parsing,
 * and a batch that fails only affects itself.
 */
@Component
public class KillEventProcessor {
  private static final Logger log = LoggerFactory.getLogger(KillEventProcessor.class);

  private final KillmailParser parser;
  private final KillStore killStore;
  private final KillDispatcher dispatcher;
  private final Clock clock;
  private final Duration streamCutoff;
  private final List<Executor> lanes;
  private final List<ExecutorService> ownedLanes;
  private final Counter killmailEventCounter;
  private final Counter countEventCounter;
  private final Counter failedBatchCounter;

  @Autowired
  public KillEventProcessor(
      KillmailParser parser,
      KillStore killStore,
      KillDispatcher dispatcher,
      KillfeedProperties properties,
      StreamProperties streamProperties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this(parser, killStore, dispatcher, properties, clock, meterRegistry, newLanes(streamProperties.workers()));
  }

  KillEventProcessor(
      KillmailParser parser,
      KillStore killStore,
      KillDispatcher dispatcher,
      KillfeedProperties properties,
      Clock clock,
      MeterRegistry meterRegistry,
      List<? extends Executor> lanes) {
    this.parser = parser;
    this.killStore = killStore;
    this.dispatcher = dispatcher;
    this.clock = clock;
    this.streamCutoff = properties.parser().streamCutoff();
    this.lanes = List.copyOf(lanes);
    List<ExecutorService> owned = new ArrayList<>();
    for (Executor lane : lanes) {
      if (lane instanceof ExecutorService) {
        owned.add((ExecutorService) lane);
      }
    }
    this.ownedLanes = owned;
    this.killmailEventCounter = eventCounter(meterRegistry, "killmail_update");
    this.countEventCounter = eventCounter(meterRegistry, "kill_count_update");
    this.failedBatchCounter = eventCounter(meterRegistry, "failed_batch");
  }

  public void onKillmailUpdate(long systemId, List<JsonNode> rawKillmails) {
    killmailEventCounter.increment();
    submit(systemId, () -> processKillmails(systemId, rawKillmails));
  }

  public void onKillCountUpdate(long systemId, long count) {
    countEventCounter.increment();
    submit(systemId, () -> {
      killStore.storeReportedCount(systemId, count);
      dispatcher.dispatch(KillEvent.count(systemId, count, clock.instant()));
    });
  }

  private void processKillmails(long systemId, List<JsonNode> rawKillmails) {
    Instant cutoff = clock.instant().minus(streamCutoff);
    List<Killmail> stored = new ArrayList<>();
    for (JsonNode raw : rawKillmails) {
      try {
        ParseResult result = parser.parse(raw, cutoff, systemId);
        if (result.outcome() == ParseResult.Outcome.STORED) {
          stored.add(result.killmail());
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to process streamed killmail for system {}", systemId, ex);
      }
    }
    if (stored.isEmpty()) {
      return;
    }
    int delivered = dispatcher.dispatch(KillEvent.killmails(systemId, stored, clock.instant()));
    log.debug("System {}: stored {} of {} killmails, delivered to {} consumers",
        systemId, stored.size(), rawKillmails.size(), delivered);
  }

  private void submit(long systemId, Runnable task) {
    Executor lane = lanes.get(Math.floorMod(Long.hashCode(systemId), lanes.size()));
    try {
      lane.execute(() -> {
        try {
          task.run();
        } catch (Exception ex) {
          failedBatchCounter.increment();
          log.error("Event processing failed for system {}", systemId, ex);
        }
      });
    } catch (RejectedExecutionException ex) {
      log.warn("Dropping event for system {}: processor is shutting down", systemId);
    }
  }

  /** Stops the worker lanes, letting queued batches finish for a short grace period. */
  @PreDestroy
  public void stop() {
    for (ExecutorService lane : ownedLanes) {
      lane.shutdown();
    }
    try {
      for (ExecutorService lane : ownedLanes) {
        if (!lane.awaitTermination(5, TimeUnit.SECONDS)) {
          lane.shutdownNow();
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static List<ExecutorService> newLanes(int workers) {
    int count = Math.max(1, workers);
    List<ExecutorService> lanes = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      String name = "killfeed-lane-" + i;
      lanes.add(Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
      }));
    }
    return lanes;
  }

  private static Counter eventCounter(MeterRegistry meterRegistry, String event) {
    return Counter.builder("killfeed.stream.events.total")
        .description("Inbound stream events (by event)")
        .tag("event", event)
        .register(meterRegistry);
  }
}
