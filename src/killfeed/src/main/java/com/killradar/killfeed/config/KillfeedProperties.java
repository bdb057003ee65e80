package com.killradar.killfeed.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "killfeed")
public record KillfeedProperties(
    Cache cache,
    Parser parser,
    Fetcher fetcher,
    Retry retry,
    Identity identity,
    Subscription subscription,
    Preload preload,
    Sse sse) {

  public record Cache(
      String backend,
      String keyPrefix,
      Duration killmailTtl,
      Duration killCountTtl,
      Duration freshnessBase,
      double freshnessJitterRatio,
      Duration freshnessMin,
      Duration identityTtl,
      Duration identityNotFoundTtl) {}

  public record Parser(Duration streamCutoff, Duration recentWindow) {}

  public record Fetcher(
      String baseUrl,
      int pageSize,
      int maxPages,
      int sinceHours,
      Duration requestTimeout,
      Duration systemTimeout,
      int concurrency) {}

  public record Retry(
      int maxAttempts,
      Duration baseDelay,
      Duration maxDelay,
      Duration expiry,
      double jitterRatio) {}

  public record Identity(String baseUrl, Duration timeout) {}

  public record Subscription(long reconcileMs, List<Long> staticSystems) {
    public Subscription {
      staticSystems = staticSystems == null ? List.of() : List.copyOf(staticSystems);
    }
  }

  public record Preload(
      boolean enabled,
      int quickSinceHours,
      int quickLimit,
      int expandedSinceHours,
      int expandedLimit,
      int concurrency) {}

  public record Sse(Duration heartbeatInterval) {}
}
