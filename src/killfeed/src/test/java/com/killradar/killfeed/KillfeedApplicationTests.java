package com.killradar.killfeed;

import static org.assertj.core.api.Assertions.assertThat;

import com.killradar.killfeed.cache.InMemoryKillCache;
import com.killradar.killfeed.cache.KillCache;
import com.killradar.killfeed.stream.ConnectionState;
import com.killradar.killfeed.stream.KillStreamClient;
import com.killradar.killfeed.subscription.SubscriptionManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
    "killfeed.cache.backend=memory",
    "killfeed.stream.enabled=false",
    "killfeed.preload.enabled=false",
    "killfeed.scheduling.enabled=false",
    "killfeed.subscription.static-systems=30000142"
})
class KillfeedApplicationTests {

  @Autowired private KillCache killCache;
  @Autowired private KillStreamClient streamClient;
  @Autowired private SubscriptionManager subscriptionManager;

  @Test
  void contextLoadsWithMemoryCacheAndIdleStream() {
    assertThat(killCache).isInstanceOf(InMemoryKillCache.class);
    assertThat(streamClient.currentState()).isEqualTo(ConnectionState.DISCONNECTED);
    assertThat(subscriptionManager.desiredSystems()).containsExactly(30000142L);
  }
}
