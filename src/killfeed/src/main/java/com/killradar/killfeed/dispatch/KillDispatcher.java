package com.killradar.killfeed.dispatch;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Republishes an event to every consumer watching its location.
 *
 * <p>Delivery is best-effort: a consumer that throws is logged and skipped, the rest still
 * receive the event.
 */
@Component
public class KillDispatcher {
  private static final Logger log = LoggerFactory.getLogger(KillDispatcher.class);

  private final ConsumerRegistry registry;
  private final Counter deliveredCounter;
  private final Counter failedCounter;

  public KillDispatcher(ConsumerRegistry registry, MeterRegistry meterRegistry) {
    this.registry = registry;
    this.deliveredCounter = Counter.builder("killfeed.dispatch.deliveries.total")
        .description("Consumer deliveries (by outcome)")
        .tag("outcome", "delivered")
        .register(meterRegistry);
    this.failedCounter = Counter.builder("killfeed.dispatch.deliveries.total")
        .description("Consumer deliveries (by outcome)")
        .tag("outcome", "failed")
        .register(meterRegistry);
  }

  /** Returns the number of consumers that accepted the event. */
  public int dispatch(KillEvent event) {
    int delivered = 0;
    for (KillConsumer consumer : registry.consumers()) {
      if (!consumer.watches(event.systemId())) {
        continue;
      }
      try {
        consumer.deliver(event);
        delivered++;
        deliveredCounter.increment();
      } catch (RuntimeException ex) {
        failedCounter.increment();
        log.warn("Delivery of {} for system {} to consumer {} failed", event.type(), event.systemId(), consumer.id(), ex);
      }
    }
    return delivered;
  }
}
