package com.killradar.killfeed.stream;

import com.killradar.killfeed.config.StreamProperties;
import com.killradar.killfeed.http.KillsServiceClient;
import java.time.Duration;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of the ingestion side: stream connection state and upstream reachability.
 *
 * <p>A disconnected stream is reported as down only when streaming is enabled; the reconnect
 * loop recovers on its own, so the probe never triggers anything.
 */
@Component("killfeed")
public class KillfeedHealthIndicator implements HealthIndicator {
  static final Duration UPSTREAM_PROBE_TIMEOUT = Duration.ofSeconds(2);

  private final KillStreamClient streamClient;
  private final KillsServiceClient killsServiceClient;
  private final StreamProperties properties;

  public KillfeedHealthIndicator(
      KillStreamClient streamClient, KillsServiceClient killsServiceClient, StreamProperties properties) {
    this.streamClient = streamClient;
    this.killsServiceClient = killsServiceClient;
    this.properties = properties;
  }

  @Override
  public Health health() {
    ConnectionState state = streamClient.currentState();
    boolean upstreamHealthy = killsServiceClient.healthy(UPSTREAM_PROBE_TIMEOUT);
    boolean streamOk = !properties.enabled() || state == ConnectionState.CONNECTED;
    Health.Builder builder = streamOk && upstreamHealthy ? Health.up() : Health.down();
    return builder
        .withDetail("streamEnabled", properties.enabled())
        .withDetail("streamState", state.name())
        .withDetail("upstreamHealthy", upstreamHealthy)
        .build();
  }
}
