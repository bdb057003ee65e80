package com.killradar.killfeed.subscription;

import com.killradar.killfeed.dispatch.TrackedSystemsChangedEvent;
import com.killradar.killfeed.dispatch.TrackedSystemsProvider;
import com.killradar.killfeed.stream.KillStreamClient;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Decides which locations the stream should carry.
 *
 * <p>The desired set is the tracked locations (open map streams plus configured static ones)
 * together with locations requested explicitly through the API. The live set belongs to
 * {@link KillStreamClient}, which diffs every request against it and only pushes non-empty
 * changes, so repeated requests are free.
 */
@Service
public class SubscriptionManager {
  private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

  private final KillStreamClient streamClient;
  private final TrackedSystemsProvider trackedSystemsProvider;
  private final Set<Long> requested = new ConcurrentSkipListSet<>();

  public SubscriptionManager(KillStreamClient streamClient, TrackedSystemsProvider trackedSystemsProvider) {
    this.streamClient = streamClient;
    this.trackedSystemsProvider = trackedSystemsProvider;
  }

  /**
   * Validates the batch, then adds it to the live channel.
   *
   * @throws InvalidSystemIdsException when any id is implausible; nothing is applied
   */
  public CompletableFuture<Set<Long>> subscribe(Collection<Long> systemIds) {
    Set<Long> systems = SystemIdValidator.requireValid(systemIds);
    requested.addAll(systems);
    log.debug("Subscribe requested for {}", systems);
    return streamClient.subscribe(systems);
  }

  /**
   * Validates the batch, then removes it from the live channel.
   *
   * @throws InvalidSystemIdsException when any id is implausible; nothing is applied
   */
  public CompletableFuture<Set<Long>> unsubscribe(Collection<Long> systemIds) {
    Set<Long> systems = SystemIdValidator.requireValid(systemIds);
    requested.removeAll(systems);
    log.debug("Unsubscribe requested for {}", systems);
    return streamClient.unsubscribe(systems);
  }

  /** Locations the channel should carry right now; used as the join payload. */
  public Set<Long> desiredSystems() {
    Set<Long> desired = new TreeSet<>(requested);
    for (Long systemId : trackedSystemsProvider.trackedSystems()) {
      if (SystemIdValidator.isValid(systemId)) {
        desired.add(systemId);
      }
    }
    return desired;
  }

  /** Brings the live set in line with the desired one: missing ids are added, obsolete ones removed. */
  public CompletableFuture<SubscriptionDiff> reconcile() {
    return streamClient.status().thenCompose(status -> {
      SubscriptionDiff diff = SubscriptionDiff.between(desiredSystems(), status.subscribedSystems());
      if (diff.isEmpty()) {
        return CompletableFuture.completedFuture(diff);
      }
      log.info("Reconciling subscriptions: +{} -{}", diff.toAdd().size(), diff.toRemove().size());
      CompletableFuture<Set<Long>> added = diff.toAdd().isEmpty()
          ? CompletableFuture.completedFuture(status.subscribedSystems())
          : streamClient.subscribe(diff.toAdd());
      CompletableFuture<Set<Long>> removed = diff.toRemove().isEmpty()
          ? CompletableFuture.completedFuture(status.subscribedSystems())
          : streamClient.unsubscribe(diff.toRemove());
      return CompletableFuture.allOf(added, removed).thenApply(ignored -> diff);
    });
  }

  @Scheduled(
      fixedDelayString = "${killfeed.subscription.reconcile-ms}",
      initialDelayString = "${killfeed.subscription.reconcile-ms}")
  public void scheduledReconcile() {
    reconcileLogged("scheduled");
  }

  @EventListener
  public void onTrackedSystemsChanged(TrackedSystemsChangedEvent event) {
    log.debug("Tracked systems changed ({} systems)", event.trackedSystems().size());
    reconcileLogged("tracked systems changed");
  }

  private void reconcileLogged(String trigger) {
    reconcile().whenComplete((diff, error) -> {
      if (error != null) {
        log.warn("Subscription reconcile ({}) failed: {}", trigger, error.getMessage());
      }
    });
  }
}
