package com.killradar.killfeed.fetch;

import com.killradar.killfeed.config.KillfeedProperties;
import com.killradar.killfeed.dispatch.KillDispatcher;
import com.killradar.killfeed.dispatch.KillEvent;
import com.killradar.killfeed.dispatch.TrackedSystemsProvider;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Cold-start backfill so maps show recent activity before the live stream delivers anything.
 *
 * <p>A quick pass pulls the latest kill of every tracked location in one bulk request, then an
 * expanded pass walks each location's pages for the wider window. Locations are processed in
 * small batches to stay gentle on the upstream.
 */
@Component
public class KillsPreloader {
  private static final Logger log = LoggerFactory.getLogger(KillsPreloader.class);

  private final KillmailFetcher fetcher;
  private final KillDispatcher dispatcher;
  private final TrackedSystemsProvider trackedSystemsProvider;
  private final KillfeedProperties.Preload properties;
  private final int maxPages;
  private final Clock clock;
  private final Executor executor;

  @Autowired
  public KillsPreloader(
      KillmailFetcher fetcher,
      KillDispatcher dispatcher,
      TrackedSystemsProvider trackedSystemsProvider,
      KillfeedProperties properties,
      Clock clock) {
    this(fetcher, dispatcher, trackedSystemsProvider, properties, clock, Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "killfeed-preload");
      thread.setDaemon(true);
      return thread;
    }));
  }

  KillsPreloader(
      KillmailFetcher fetcher,
      KillDispatcher dispatcher,
      TrackedSystemsProvider trackedSystemsProvider,
      KillfeedProperties properties,
      Clock clock,
      Executor executor) {
    this.fetcher = fetcher;
    this.dispatcher = dispatcher;
    this.trackedSystemsProvider = trackedSystemsProvider;
    this.properties = properties.preload();
    this.maxPages = properties.fetcher().maxPages();
    this.clock = clock;
    this.executor = executor;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!properties.enabled()) {
      log.info("Kill preloading disabled");
      return;
    }
    executor.execute(this::preload);
  }

  void preload() {
    try {
      List<Long> systems = new ArrayList<>(trackedSystemsProvider.trackedSystems());
      if (systems.isEmpty()) {
        log.info("No tracked systems to preload");
        return;
      }
      log.info("Preloading kills for {} systems", systems.size());

      Map<Long, SystemFetchResult> quick =
          fetcher.fetchSystemsBulk(systems, properties.quickSinceHours(), properties.quickLimit());
      int quickKills = publish(quick);
      List<Long> quickFailures = new ArrayList<>();
      quick.forEach((systemId, result) -> {
        if (!result.ok()) {
          quickFailures.add(systemId);
        }
      });
      if (!quickFailures.isEmpty()) {
        log.warn("Quick preload failed for {} systems, retrying them individually", quickFailures.size());
        FetchOptions fallback =
            new FetchOptions(properties.quickSinceHours(), properties.quickLimit(), false, 1);
        quickKills += runInBatches(quickFailures, fallback);
      }

      FetchOptions expanded =
          new FetchOptions(properties.expandedSinceHours(), properties.expandedLimit(), true, maxPages);
      int expandedKills = runInBatches(systems, expanded);
      log.info("Preload complete: {} quick and {} expanded killmails", quickKills, expandedKills);
    } catch (Exception ex) {
      log.error("Kill preload failed", ex);
    }
  }

  private int runInBatches(List<Long> systems, FetchOptions options) {
    int batchSize = Math.max(1, properties.concurrency());
    int total = 0;
    for (int start = 0; start < systems.size(); start += batchSize) {
      List<Long> batch = systems.subList(start, Math.min(systems.size(), start + batchSize));
      total += publish(fetcher.fetchSystems(batch, options));
    }
    return total;
  }

  private int publish(Map<Long, SystemFetchResult> results) {
    int total = 0;
    for (SystemFetchResult result : results.values()) {
      if (!result.ok() || result.killmails().isEmpty()) {
        continue;
      }
      total += result.killmails().size();
      dispatcher.dispatch(KillEvent.preload(result.systemId(), result.killmails(), clock.instant()));
    }
    return total;
  }
}
