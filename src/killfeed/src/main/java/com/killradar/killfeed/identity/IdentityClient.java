package com.killradar.killfeed.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.killradar.killfeed.cache.KillStore;
import com.killradar.killfeed.config.KillfeedProperties;
import com.killradar.killfeed.http.Attempt;
import com.killradar.killfeed.http.Retrier;
import com.killradar.killfeed.http.RetryOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves ids to display names against the public identity API, with cached results.
 *
 * <p>Timeouts, 429 and 5xx responses are retried; 404 is cached as a negative result so the
 * same unknown id is not looked up again until the negative entry expires.
 */
@Service
public class IdentityClient {
  private static final Logger log = LoggerFactory.getLogger(IdentityClient.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Retrier retrier;
  private final KillStore killStore;
  private final KillfeedProperties.Identity properties;
  private final MeterRegistry meterRegistry;

  public IdentityClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Retrier retrier,
      KillStore killStore,
      KillfeedProperties properties,
      MeterRegistry meterRegistry) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.retrier = retrier;
    this.killStore = killStore;
    this.properties = properties.identity();
    this.meterRegistry = meterRegistry;
  }

  public Optional<IdentityName> lookup(IdentityKind kind, Long id) {
    if (id == null || id <= 0) {
      return Optional.empty();
    }

    Optional<String> cached = killStore.identity(kind.cacheName(), id);
    if (cached.isPresent()) {
      count(kind, "cache_hit");
      return fromCache(cached.get());
    }

    RetryOutcome<IdentityName> outcome =
        retrier.run(kind.cacheName() + " lookup " + id, () -> fetch(kind, id));
    if (outcome.success()) {
      count(kind, "resolved");
      cache(kind, id, outcome.value());
      return Optional.of(outcome.value());
    }
    if (outcome.notFound()) {
      count(kind, "not_found");
      cache(kind, id, null);
      return Optional.empty();
    }
    count(kind, "failed");
    log.debug("{} lookup for {} failed: {}", kind.cacheName(), id, outcome.error());
    return Optional.empty();
  }

  private Attempt<IdentityName> fetch(IdentityKind kind, long id) {
    String baseUrl = properties.baseUrl().replaceAll("/+$", "");
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + kind.path(id)))
        .timeout(properties.timeout())
        .header("Accept", "application/json")
        .GET()
        .build();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      int status = response.statusCode();
      if (status == 404) {
        return Attempt.terminal(RetryOutcome.NOT_FOUND);
      }
      if (status == 429 || status == 420) {
        return Attempt.rateLimited("rate limited (" + status + ")");
      }
      if (status >= 500) {
        return Attempt.retryable("server error (" + status + ")");
      }
      if (status >= 400) {
        return Attempt.terminal("client error (" + status + ")");
      }
      JsonNode root = objectMapper.readTree(response.body());
      String name = root.path("name").asText(null);
      if (name == null || name.isBlank()) {
        return Attempt.terminal(RetryOutcome.NOT_FOUND);
      }
      String ticker = root.hasNonNull("ticker") ? root.path("ticker").asText() : null;
      return Attempt.success(new IdentityName(name, ticker));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return Attempt.terminal("interrupted");
    } catch (IOException ex) {
      return Attempt.retryable(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  private Optional<IdentityName> fromCache(String json) {
    try {
      JsonNode node = objectMapper.readTree(json);
      if (node.path("not_found").asBoolean(false)) {
        return Optional.empty();
      }
      return Optional.of(new IdentityName(
          node.path("name").asText(null),
          node.hasNonNull("ticker") ? node.path("ticker").asText() : null));
    } catch (IOException ex) {
      return Optional.empty();
    }
  }

  private void cache(IdentityKind kind, long id, IdentityName name) {
    ObjectNode node = objectMapper.createObjectNode();
    if (name == null) {
      node.put("not_found", true);
    } else {
      node.put("name", name.name());
      node.put("ticker", name.ticker());
    }
    try {
      killStore.putIdentity(kind.cacheName(), id, objectMapper.writeValueAsString(node), name == null);
    } catch (IOException | RuntimeException ex) {
      // Cache write failures only cost a repeated lookup.
      log.debug("Unable to cache {} {}", kind.cacheName(), id, ex);
    }
  }

  private void count(IdentityKind kind, String outcome) {
    Counter.builder("killfeed.identity.lookups.total")
        .description("Identity lookups (by kind and outcome)")
        .tag("kind", kind.cacheName())
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
  }
}
