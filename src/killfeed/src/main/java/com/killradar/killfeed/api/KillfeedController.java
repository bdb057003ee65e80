package com.killradar.killfeed.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.killradar.killfeed.config.StreamProperties;
import com.killradar.killfeed.dispatch.MapStreamRegistry;
import com.killradar.killfeed.fetch.FetchOptions;
import com.killradar.killfeed.fetch.KillmailFetcher;
import com.killradar.killfeed.fetch.SystemFetchResult;
import com.killradar.killfeed.http.KillsServiceClient;
import com.killradar.killfeed.http.RetryOutcome;
import com.killradar.killfeed.http.UpstreamUnavailableException;
import com.killradar.killfeed.model.Killmail;
import com.killradar.killfeed.stream.KillStreamClient;
import com.killradar.killfeed.stream.PushFailedException;
import com.killradar.killfeed.stream.StreamStatus;
import com.killradar.killfeed.subscription.SubscriptionManager;
import com.killradar.killfeed.subscription.SystemIdValidator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST surface of the kill feed.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/kills/stream}: SSE kill events for the requested locations</li>
 *   <li>{@code GET /api/kills/system/{id}}, {@code POST /api/kills/systems}: paginated fetch</li>
 *   <li>{@code GET /api/kills/cached/{id}}, {@code GET /api/kills/count/{id}},
 *       {@code GET /api/killmail/{id}}: cache-first reads</li>
 *   <li>{@code /api/stream/*}: connection status and forced reconnect</li>
 *   <li>{@code /api/subscriptions}: live channel subscriptions</li>
 *   <li>{@code /api/webhooks}: upstream webhook registrations</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class KillfeedController {
  private static final int DEFAULT_CACHED_LIMIT = 50;

  private final KillmailFetcher fetcher;
  private final MapStreamRegistry streamRegistry;
  private final KillStreamClient streamClient;
  private final SubscriptionManager subscriptionManager;
  private final KillsServiceClient killsServiceClient;
  private final Duration pushTimeout;

  public KillfeedController(
      KillmailFetcher fetcher,
      MapStreamRegistry streamRegistry,
      KillStreamClient streamClient,
      SubscriptionManager subscriptionManager,
      KillsServiceClient killsServiceClient,
      StreamProperties streamProperties) {
    this.fetcher = fetcher;
    this.streamRegistry = streamRegistry;
    this.streamClient = streamClient;
    this.subscriptionManager = subscriptionManager;
    this.killsServiceClient = killsServiceClient;
    this.pushTimeout = streamProperties.connectTimeout().plusSeconds(1);
  }

  /**
   * Opens an SSE stream of kill events.
   *
   * @param systems comma-separated location ids
   * @return emitter sending {@code connected}, kill and {@code heartbeat} events
   */
  @GetMapping(path = "/kills/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream(@RequestParam("systems") String systems) {
    return streamRegistry.openStream(SystemIdValidator.requireValid(parseIdList(systems)));
  }

  @GetMapping("/kills/system/{systemId}")
  public Map<String, Object> systemKills(
      @PathVariable("systemId") long systemId,
      @RequestParam(value = "since_hours", required = false) Integer sinceHours,
      @RequestParam(value = "limit", required = false) Integer limit,
      @RequestParam(value = "force", defaultValue = "false") boolean force) {
    SystemIdValidator.requireValid(List.of(systemId));
    SystemFetchResult result = fetcher.fetchSystem(systemId, options(sinceHours, limit, force));
    if (!result.ok()) {
      throw new UpstreamUnavailableException("system " + systemId + ": " + result.error());
    }
    return resultPayload(result);
  }

  /** Per-location results; a failed location is reported in place and does not fail the request. */
  @PostMapping("/kills/systems")
  public Map<String, Object> systemsKills(@RequestBody SystemsKillsRequest request) {
    Set<Long> systems = SystemIdValidator.requireValid(request.systemIds());
    Map<Long, SystemFetchResult> results =
        fetcher.fetchSystems(systems, options(request.sinceHours(), request.limit(), false));
    Map<String, Object> byId = new LinkedHashMap<>();
    results.forEach((systemId, result) -> byId.put(String.valueOf(systemId), resultPayload(result)));
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("systems", byId);
    return body;
  }

  @GetMapping("/kills/cached/{systemId}")
  public Map<String, Object> cachedKills(
      @PathVariable("systemId") long systemId,
      @RequestParam(value = "limit", required = false) Integer limit) {
    SystemIdValidator.requireValid(List.of(systemId));
    int effectiveLimit = limit == null ? DEFAULT_CACHED_LIMIT : limit;
    if (effectiveLimit <= 0) {
      throw new BadRequestException("limit must be positive");
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("system_id", systemId);
    body.put("killmails", payloads(fetcher.cachedKills(systemId, effectiveLimit)));
    return body;
  }

  @GetMapping("/kills/count/{systemId}")
  public Map<String, Object> killCount(@PathVariable("systemId") long systemId) {
    SystemIdValidator.requireValid(List.of(systemId));
    KillmailFetcher.KillCount count = fetcher.killCount(systemId);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("system_id", count.systemId());
    body.put("count", count.rolling());
    body.put("reported_count", count.reported());
    return body;
  }

  @GetMapping("/killmail/{killmailId}")
  public Map<String, Object> killmail(@PathVariable("killmailId") long killmailId) {
    return fetcher.fetchKillmail(killmailId)
        .map(Killmail::toPayload)
        .orElseThrow(() -> new NotFoundException("killmail " + killmailId + " not found"));
  }

  @GetMapping("/stream/status")
  public Map<String, Object> streamStatus() {
    return statusPayload(await(streamClient.status()));
  }

  @PostMapping("/stream/reconnect")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public Map<String, Object> reconnect() {
    streamClient.reconnect();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "reconnecting");
    return body;
  }

  @PostMapping("/subscriptions")
  public Map<String, Object> subscribe(@RequestBody SubscriptionRequest request) {
    return subscriptionPayload(await(subscriptionManager.subscribe(request.systemsOrEmpty())));
  }

  @DeleteMapping("/subscriptions")
  public Map<String, Object> unsubscribe(@RequestBody SubscriptionRequest request) {
    return subscriptionPayload(await(subscriptionManager.unsubscribe(request.systemsOrEmpty())));
  }

  /** Registers a push callback with the upstream service for the given locations. */
  @PostMapping("/webhooks")
  @ResponseStatus(HttpStatus.CREATED)
  public Map<String, Object> registerWebhook(@RequestBody WebhookRequest request) {
    if (request.subscriberId() == null || request.subscriberId().isBlank()) {
      throw new BadRequestException("subscriber_id is required");
    }
    if (request.callbackUrl() == null || request.callbackUrl().isBlank()) {
      throw new BadRequestException("callback_url is required");
    }
    Set<Long> systems = SystemIdValidator.requireValid(request.systems());
    RetryOutcome<String> outcome =
        killsServiceClient.subscribe(request.subscriberId(), systems, request.callbackUrl());
    if (!outcome.success()) {
      throw new UpstreamUnavailableException("webhook registration: " + outcome.error());
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("subscriber_id", request.subscriberId());
    body.put("subscription_id", outcome.value());
    body.put("systems", systems);
    return body;
  }

  /** Removing an unknown registration succeeds. */
  @DeleteMapping("/webhooks/{subscriberId}")
  public Map<String, Object> removeWebhook(@PathVariable("subscriberId") String subscriberId) {
    RetryOutcome<Boolean> outcome = killsServiceClient.unsubscribe(subscriberId);
    if (!outcome.success()) {
      throw new UpstreamUnavailableException("webhook removal: " + outcome.error());
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("subscriber_id", subscriberId);
    body.put("removed", true);
    return body;
  }

  public record SystemsKillsRequest(
      @JsonProperty("system_ids") List<Long> systemIds,
      @JsonProperty("since_hours") Integer sinceHours,
      @JsonProperty("limit") Integer limit) {}

  public record SubscriptionRequest(@JsonProperty("systems") List<Long> systems) {
    List<Long> systemsOrEmpty() {
      return systems == null ? List.of() : systems;
    }
  }

  public record WebhookRequest(
      @JsonProperty("subscriber_id") String subscriberId,
      @JsonProperty("systems") List<Long> systems,
      @JsonProperty("callback_url") String callbackUrl) {}

  private FetchOptions options(Integer sinceHours, Integer limit, boolean force) {
    try {
      return fetcher.options(sinceHours, limit, force);
    } catch (IllegalArgumentException ex) {
      throw new BadRequestException(ex.getMessage());
    }
  }

  private <T> T await(CompletableFuture<T> future) {
    try {
      return future.get(pushTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof RuntimeException) {
        throw (RuntimeException) ex.getCause();
      }
      throw new IllegalStateException(ex.getCause());
    } catch (TimeoutException ex) {
      throw new PushFailedException("no reply from stream client within " + pushTimeout.toSeconds() + "s");
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while waiting for stream client", ex);
    }
  }

  private static List<Long> parseIdList(String raw) {
    List<Long> ids = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return ids;
    }
    for (String part : raw.split(",")) {
      String trimmed = part.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      try {
        ids.add(Long.parseLong(trimmed));
      } catch (NumberFormatException ex) {
        throw new BadRequestException("invalid system id: " + trimmed);
      }
    }
    return ids;
  }

  private static Map<String, Object> resultPayload(SystemFetchResult result) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("system_id", result.systemId());
    body.put("status", result.status().name().toLowerCase(Locale.ROOT));
    body.put("pages_fetched", result.pagesFetched());
    body.put("killmails", payloads(result.killmails()));
    if (result.error() != null) {
      body.put("error", result.error());
    }
    return body;
  }

  private static List<Map<String, Object>> payloads(List<Killmail> killmails) {
    List<Map<String, Object>> items = new ArrayList<>(killmails.size());
    for (Killmail killmail : killmails) {
      items.add(killmail.toPayload());
    }
    return items;
  }

  private static Map<String, Object> subscriptionPayload(Set<Long> live) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("subscribed_systems", new TreeSet<>(live));
    return body;
  }

  private static Map<String, Object> statusPayload(StreamStatus status) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("state", status.state().name().toLowerCase(Locale.ROOT));
    body.put("retry_count", status.retryCount());
    body.put("cycle_count", status.cycleCount());
    body.put("last_error", status.lastError());
    body.put("subscribed_systems", new TreeSet<>(status.subscribedSystems()));
    body.put("next_retry_seconds", status.nextRetryDelay() == null ? null : status.nextRetryDelay().toSeconds());
    body.put("connected_at", status.connectedAt() == null ? null : status.connectedAt().toString());
    return body;
  }
}
