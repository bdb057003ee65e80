package com.killradar.killfeed.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.killradar.killfeed.config.KillfeedProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Request/response client for the upstream kills service.
 *
 * <p>Responses carry a {@code data} envelope on success and an {@code error} field on failure.
 * Rate limiting (429), server errors and I/O failures are retried; other client errors and
 * {@code error} payloads are terminal.
 */
@Component
public class KillsServiceClient {
  private static final Logger log = LoggerFactory.getLogger(KillsServiceClient.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Retrier retrier;
  private final KillfeedProperties.Fetcher properties;
  private final MeterRegistry meterRegistry;
  private final Timer requestTimer;

  public KillsServiceClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Retrier retrier,
      KillfeedProperties properties,
      MeterRegistry meterRegistry) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.retrier = retrier;
    this.properties = properties.fetcher();
    this.meterRegistry = meterRegistry;
    this.requestTimer = Timer.builder("killfeed.upstream.http.duration")
        .description("Kills service HTTP request duration (seconds)")
        .register(meterRegistry);
  }

  public RetryOutcome<List<JsonNode>> fetchKillsPage(long systemId, int sinceHours, int limit, int page) {
    URI uri = uri(String.format("/kills/system/%d?since_hours=%d&limit=%d&page=%d", systemId, sinceHours, limit, page));
    return retrier.run(
        "kills page " + systemId + "#" + page,
        () -> exchange("kills_page", get(uri), KillsServiceClient::killsArray));
  }

  public RetryOutcome<Map<Long, List<JsonNode>>> fetchSystemsKills(
      Collection<Long> systemIds, int sinceHours, int limit) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("system_ids", List.copyOf(systemIds));
    body.put("since_hours", sinceHours);
    body.put("limit", limit);
    HttpRequest request = post(uri("/kills/systems"), body);
    return retrier.run(
        "kills for " + systemIds.size() + " systems",
        () -> exchange("kills_systems", request, KillsServiceClient::systemsKills));
  }

  public RetryOutcome<List<JsonNode>> fetchCachedKills(long systemId) {
    URI uri = uri("/kills/cached/" + systemId);
    return retrier.run("cached kills " + systemId, () -> exchange("kills_cached", get(uri), KillsServiceClient::killsArray));
  }

  public RetryOutcome<Long> fetchKillCount(long systemId) {
    URI uri = uri("/kills/count/" + systemId);
    return retrier.run(
        "kill count " + systemId,
        () -> exchange("kill_count", get(uri), data -> data.path("count").asLong(0)));
  }

  public RetryOutcome<JsonNode> fetchKillmail(long killmailId) {
    URI uri = uri("/killmail/" + killmailId);
    return retrier.run("killmail " + killmailId, () -> exchange("killmail", get(uri), Function.identity()));
  }

  /** Registers a webhook subscriber; returns the subscription id assigned upstream. */
  public RetryOutcome<String> subscribe(String subscriberId, Collection<Long> systemIds, String callbackUrl) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("subscriber_id", subscriberId);
    body.put("system_ids", List.copyOf(systemIds));
    body.put("callback_url", callbackUrl);
    HttpRequest request = post(uri("/subscriptions"), body);
    return retrier.run(
        "subscribe " + subscriberId,
        () -> exchange("subscribe", request, data -> data.path("subscription_id").asText(subscriberId)));
  }

  /** Removes a webhook subscriber. An unknown subscriber is already unsubscribed. */
  public RetryOutcome<Boolean> unsubscribe(String subscriberId) {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(uri("/subscriptions/" + subscriberId))
        .timeout(properties.requestTimeout())
        .header("Accept", "application/json")
        .DELETE()
        .build();
    RetryOutcome<Boolean> outcome =
        retrier.run("unsubscribe " + subscriberId, () -> exchange("unsubscribe", request, data -> Boolean.TRUE));
    if (outcome.notFound()) {
      return RetryOutcome.success(Boolean.TRUE, outcome.attempts());
    }
    return outcome;
  }

  /** Single probe, no retries, bounded by its own timeout rather than the request timeout. */
  public boolean healthy(Duration timeout) {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(uri("/health"))
        .timeout(timeout)
        .header("Accept", "application/json")
        .GET()
        .build();
    Attempt<Boolean> attempt = exchange("health", request, data -> Boolean.TRUE);
    return attempt.kind() == Attempt.Kind.SUCCESS;
  }

  <T> Attempt<T> exchange(String operation, HttpRequest request, Function<JsonNode, T> extractor) {
    long startNs = System.nanoTime();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
      int status = response.statusCode();
      if (status == 429) {
        count(operation, "rate_limited");
        return Attempt.rateLimited("rate limited (429)");
      }
      if (status == 404) {
        count(operation, "not_found");
        return Attempt.terminal(RetryOutcome.NOT_FOUND);
      }
      if (status >= 500) {
        count(operation, "server_error");
        return Attempt.retryable("server error (" + status + ")");
      }
      if (status >= 400) {
        count(operation, "client_error");
        return Attempt.terminal("client error (" + status + "): " + errorMessage(response.body()));
      }

      JsonNode root = response.body() == null || response.body().isBlank()
          ? objectMapper.createObjectNode()
          : objectMapper.readTree(response.body());
      if (root.hasNonNull("error")) {
        count(operation, "error_payload");
        return Attempt.terminal(root.path("error").asText());
      }
      count(operation, "success");
      JsonNode data = root.has("data") ? root.path("data") : root;
      return Attempt.success(extractor.apply(data));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      count(operation, "exception");
      return Attempt.terminal("interrupted");
    } catch (IOException ex) {
      requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
      count(operation, "exception");
      log.debug("Kills service {} request failed: {}", operation, ex.toString());
      return Attempt.retryable(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  private static List<JsonNode> killsArray(JsonNode data) {
    JsonNode kills = data.isArray() ? data : data.path("kills");
    List<JsonNode> result = new ArrayList<>();
    for (JsonNode kill : kills) {
      if (kill.isObject()) {
        result.add(kill);
      }
    }
    return result;
  }

  private static Map<Long, List<JsonNode>> systemsKills(JsonNode data) {
    JsonNode systems = data.has("systems_kills") ? data.path("systems_kills") : data;
    Map<Long, List<JsonNode>> result = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = systems.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      try {
        result.put(Long.parseLong(entry.getKey()), killsArray(entry.getValue()));
      } catch (NumberFormatException ex) {
        log.debug("Ignoring non-numeric system key {}", entry.getKey());
      }
    }
    return result;
  }

  private String errorMessage(String body) {
    if (body == null || body.isBlank()) {
      return "";
    }
    try {
      JsonNode root = objectMapper.readTree(body);
      return root.path("error").asText(body);
    } catch (IOException ex) {
      return body;
    }
  }

  private HttpRequest get(URI uri) {
    return HttpRequest.newBuilder()
        .uri(uri)
        .timeout(properties.requestTimeout())
        .header("Accept", "application/json")
        .GET()
        .build();
  }

  private HttpRequest post(URI uri, Map<String, Object> body) {
    String json;
    try {
      json = objectMapper.writeValueAsString(body);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Unserializable request body", ex);
    }
    return HttpRequest.newBuilder()
        .uri(uri)
        .timeout(properties.requestTimeout())
        .header("Accept", "application/json")
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json))
        .build();
  }

  private URI uri(String path) {
    String baseUrl = properties.baseUrl();
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalStateException("Kills service base URL is missing.");
    }
    return URI.create(baseUrl.replaceAll("/+$", "") + path);
  }

  private void count(String operation, String outcome) {
    Counter.builder("killfeed.upstream.http.requests.total")
        .description("Kills service HTTP requests (by operation and outcome)")
        .tag("operation", operation)
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
  }
}
