package com.killradar.killfeed.dispatch;

import java.util.Collection;

public interface ConsumerRegistry {

  /** Snapshot of the consumers currently registered. */
  Collection<KillConsumer> consumers();
}
