package com.killradar.killfeed.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "killfeed.stream")
public record StreamProperties(
    boolean enabled,
    String serverUrl,
    String vsn,
    String topic,
    String clientIdentifier,
    Duration connectTimeout,
    List<Duration> retryDelays,
    Duration cycleDelay,
    Duration initialJitterMin,
    Duration initialJitterMax,
    Duration heartbeatInterval,
    Duration healthCheckInterval,
    int workers) {

  public StreamProperties {
    retryDelays = retryDelays == null || retryDelays.isEmpty()
        ? List.of(Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofSeconds(120))
        : List.copyOf(retryDelays);
  }
}
