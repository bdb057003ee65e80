package com.killradar.killfeed.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.killradar.killfeed.MutableClock;
import com.killradar.killfeed.TestFixtures;
import com.killradar.killfeed.TestKillmails;
import com.killradar.killfeed.cache.FreshnessPolicy;
import com.killradar.killfeed.cache.InMemoryKillCache;
import com.killradar.killfeed.cache.KillStore;
import com.killradar.killfeed.config.KillfeedProperties;
import com.killradar.killfeed.http.KillsServiceClient;
import com.killradar.killfeed.http.RetryOutcome;
import com.killradar.killfeed.http.UpstreamUnavailableException;
import com.killradar.killfeed.identity.IdentityClient;
import com.killradar.killfeed.model.Killmail;
import com.killradar.killfeed.parser.KillmailEnricher;
import com.killradar.killfeed.parser.KillmailParser;
import com.killradar.killfeed.parser.ParseResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KillmailFetcherTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
  private final Map<Long, JsonNode> fullRecords = new HashMap<>();

  private KillsServiceClient client;
  private IdentityClient identityClient;
  private KillStore store;
  private KillmailFetcher fetcher;

  @BeforeEach
  void setUp() {
    client = mock(KillsServiceClient.class);
    identityClient = mock(IdentityClient.class);
    when(client.fetchKillmail(anyLong())).thenAnswer(invocation -> {
      JsonNode full = fullRecords.get(invocation.<Long>getArgument(0));
      return full == null ? RetryOutcome.failure(RetryOutcome.NOT_FOUND, 1) : RetryOutcome.success(full, 1);
    });
    build(TestFixtures.properties());
  }

  @Test
  void shortPageEndsFetchAndCountsRecentKills() {
    stubPage(TestFixtures.JITA, 200, 1, partials(TestFixtures.JITA, 1, 3, 10));

    SystemFetchResult result = fetcher.fetchSystem(TestFixtures.JITA, fetcher.defaultOptions());

    assertThat(result.status()).isEqualTo(SystemFetchResult.Status.FETCHED);
    assertThat(result.pagesFetched()).isEqualTo(1);
    assertThat(result.killmails()).extracting(Killmail::killmailId).containsExactly(1L, 2L, 3L);
    assertThat(store.killCount(TestFixtures.JITA)).isEqualTo(3);
    assertThat(store.recentlyFetched(TestFixtures.JITA)).isTrue();
    verify(client, never()).fetchKillsPage(TestFixtures.JITA, 24, 200, 2);
  }

  @Test
  void firstOlderRecordHaltsPagination() {
    build(TestFixtures.properties(6, 5));
    List<JsonNode> page = new ArrayList<>(partials(TestFixtures.JITA, 1, 4, 30));
    page.add(partialWithFull(5L, TestFixtures.JITA, clock.instant().minus(Duration.ofHours(25))));
    page.add(partialWithFull(6L, TestFixtures.JITA, clock.instant().minus(Duration.ofHours(26))));
    stubPage(TestFixtures.JITA, 6, 1, page);

    SystemFetchResult result = fetcher.fetchSystem(TestFixtures.JITA, fetcher.defaultOptions());

    assertThat(result.killmails()).extracting(Killmail::killmailId).containsExactly(1L, 2L, 3L, 4L);
    assertThat(store.getKillmail(5L)).isEmpty();
    verify(client, never()).fetchKillmail(6L);
    verify(client, never()).fetchKillsPage(TestFixtures.JITA, 24, 6, 2);
  }

  @Test
  void fullPageAdvancesUntilMaxPages() {
    build(TestFixtures.properties(2, 2));
    stubPage(TestFixtures.JITA, 2, 1, partials(TestFixtures.JITA, 1, 2, 5));
    stubPage(TestFixtures.JITA, 2, 2, partials(TestFixtures.JITA, 3, 4, 5));

    SystemFetchResult result = fetcher.fetchSystem(TestFixtures.JITA, fetcher.defaultOptions());

    assertThat(result.pagesFetched()).isEqualTo(2);
    assertThat(result.killmails()).hasSize(4);
    verify(client, never()).fetchKillsPage(TestFixtures.JITA, 24, 2, 3);
  }

  @Test
  void recentlyFetchedSystemIsServedFromCache() {
    store.markFetched(TestFixtures.JITA);

    SystemFetchResult result = fetcher.fetchSystem(TestFixtures.JITA, fetcher.defaultOptions());

    assertThat(result.status()).isEqualTo(SystemFetchResult.Status.CACHED);
    verify(client, never()).fetchKillsPage(anyLong(), anyInt(), anyInt(), anyInt());
  }

  @Test
  void forceIgnoresFreshness() {
    store.markFetched(TestFixtures.JITA);
    stubPage(TestFixtures.JITA, 200, 1, partials(TestFixtures.JITA, 1, 1, 5));

    SystemFetchResult result = fetcher.fetchSystem(TestFixtures.JITA, fetcher.options(null, null, true));

    assertThat(result.status()).isEqualTo(SystemFetchResult.Status.FETCHED);
    assertThat(result.killmails()).hasSize(1);
  }

  @Test
  void limitStopsEarly() {
    stubPage(TestFixtures.JITA, 200, 1, partials(TestFixtures.JITA, 1, 5, 5));

    SystemFetchResult result = fetcher.fetchSystem(TestFixtures.JITA, fetcher.options(24, 2, false));

    assertThat(result.killmails()).extracting(Killmail::killmailId).containsExactly(1L, 2L);
    verify(client, never()).fetchKillmail(3L);
  }

  @Test
  void cachedRecordIsReusedWithoutFullFetch() {
    stubPage(TestFixtures.JITA, 200, 1, partials(TestFixtures.JITA, 1, 1, 5));
    fetcher.fetchSystem(TestFixtures.JITA, fetcher.defaultOptions());

    SystemFetchResult again = fetcher.fetchSystem(TestFixtures.JITA, fetcher.options(null, null, true));

    assertThat(again.killmails()).hasSize(1);
    verify(client, times(1)).fetchKillmail(1L);
    assertThat(store.killCount(TestFixtures.JITA)).isEqualTo(1);
  }

  @Test
  void npcFlagOnFullRecordDropsKill() {
    ObjectNode partial = TestKillmails.partial(1L, TestFixtures.JITA, minutesAgo(5));
    fullRecords.put(1L, TestKillmails.raw(1L, TestFixtures.JITA, minutesAgo(5), true));
    List<JsonNode> page = new ArrayList<>();
    page.add(partial);
    page.addAll(partials(TestFixtures.JITA, 2, 2, 6));
    stubPage(TestFixtures.JITA, 200, 1, page);

    SystemFetchResult result = fetcher.fetchSystem(TestFixtures.JITA, fetcher.defaultOptions());

    assertThat(result.killmails()).extracting(Killmail::killmailId).containsExactly(2L);
    assertThat(store.getKillmail(1L)).isEmpty();
  }

  @Test
  void failedFullFetchSkipsOnlyThatRecord() {
    List<JsonNode> page = new ArrayList<>(partials(TestFixtures.JITA, 1, 2, 5));
    page.add(1, TestKillmails.partial(9L, TestFixtures.JITA, minutesAgo(6)));
    stubPage(TestFixtures.JITA, 200, 1, page);

    SystemFetchResult result = fetcher.fetchSystem(TestFixtures.JITA, fetcher.defaultOptions());

    assertThat(result.status()).isEqualTo(SystemFetchResult.Status.FETCHED);
    assertThat(result.killmails()).extracting(Killmail::killmailId).containsExactly(1L, 2L);
  }

  @Test
  void failedPageFailsSystemWithoutMarkingFresh() {
    when(client.fetchKillsPage(TestFixtures.JITA, 24, 200, 1))
        .thenReturn(RetryOutcome.failure("retries exhausted: server error (503)", 3));

    SystemFetchResult result = fetcher.fetchSystem(TestFixtures.JITA, fetcher.defaultOptions());

    assertThat(result.status()).isEqualTo(SystemFetchResult.Status.FAILED);
    assertThat(result.error()).contains("503");
    assertThat(store.recentlyFetched(TestFixtures.JITA)).isFalse();
  }

  @Test
  void siblingFailureDoesNotAffectOtherSystems() {
    stubPage(TestFixtures.JITA, 200, 1, partials(TestFixtures.JITA, 1, 2, 5));
    when(client.fetchKillsPage(TestFixtures.AMARR, 24, 200, 1))
        .thenReturn(RetryOutcome.failure("retries exhausted: timeout", 3));

    Map<Long, SystemFetchResult> results =
        fetcher.fetchSystems(List.of(TestFixtures.JITA, TestFixtures.AMARR), fetcher.defaultOptions());

    assertThat(results.get(TestFixtures.JITA).status()).isEqualTo(SystemFetchResult.Status.FETCHED);
    assertThat(results.get(TestFixtures.JITA).killmails()).hasSize(2);
    assertThat(results.get(TestFixtures.AMARR).status()).isEqualTo(SystemFetchResult.Status.FAILED);
  }

  @Test
  void queuedSystemTimeoutStartsWhenItsFetchStarts() {
    ExecutorService single = Executors.newSingleThreadExecutor();
    try {
      KillfeedProperties properties = withSystemTimeout(Duration.ofMillis(2000));
      store = newStore(properties);
      fetcher = new KillmailFetcher(client, parser(store, properties), store, properties, clock, single);
      slowPage(TestFixtures.JITA, 1200, partials(TestFixtures.JITA, 1, 1, 5));
      slowPage(TestFixtures.AMARR, 1200, partials(TestFixtures.AMARR, 2, 2, 5));

      Map<Long, SystemFetchResult> results =
          fetcher.fetchSystems(List.of(TestFixtures.JITA, TestFixtures.AMARR), fetcher.defaultOptions());

      assertThat(results.get(TestFixtures.JITA).status()).isEqualTo(SystemFetchResult.Status.FETCHED);
      assertThat(results.get(TestFixtures.AMARR).status()).isEqualTo(SystemFetchResult.Status.FETCHED);
      assertThat(results.get(TestFixtures.AMARR).killmails()).hasSize(1);
    } finally {
      single.shutdownNow();
    }
  }

  @Test
  void systemRunningPastItsTimeoutFails() {
    ExecutorService single = Executors.newSingleThreadExecutor();
    try {
      KillfeedProperties properties = withSystemTimeout(Duration.ofMillis(200));
      store = newStore(properties);
      fetcher = new KillmailFetcher(client, parser(store, properties), store, properties, clock, single);
      slowPage(TestFixtures.JITA, 1500, partials(TestFixtures.JITA, 1, 1, 5));

      Map<Long, SystemFetchResult> results =
          fetcher.fetchSystems(List.of(TestFixtures.JITA), fetcher.defaultOptions());

      assertThat(results.get(TestFixtures.JITA).status()).isEqualTo(SystemFetchResult.Status.FAILED);
      assertThat(results.get(TestFixtures.JITA).error()).isEqualTo("timeout");
    } finally {
      single.shutdownNow();
    }
  }

  @Test
  void pulledAndPushedRecordsMatch() {
    Instant killTime = minutesAgo(7);
    stubPage(TestFixtures.JITA, 200, 1, List.of(partialWithFull(77L, TestFixtures.JITA, killTime)));
    Killmail pulled = fetcher.fetchSystem(TestFixtures.JITA, fetcher.defaultOptions()).killmails().get(0);

    KillmailParser pushParser = parser(newStore(TestFixtures.properties()), TestFixtures.properties());
    ParseResult pushed =
        pushParser.parse(TestKillmails.raw(77L, TestFixtures.JITA, killTime), clock.instant().minus(Duration.ofHours(1)), null);

    assertThat(pushed.killmail().withoutEnrichment()).isEqualTo(pulled.withoutEnrichment());
  }

  @Test
  void bulkFetchAppliesLimitPerSystem() {
    Map<Long, List<JsonNode>> bySystem = new HashMap<>();
    bySystem.put(TestFixtures.JITA, List.of(
        TestKillmails.raw(1L, TestFixtures.JITA, minutesAgo(5)),
        TestKillmails.raw(2L, TestFixtures.JITA, minutesAgo(6))));
    when(client.fetchSystemsKills(List.of(TestFixtures.JITA, TestFixtures.AMARR), 1, 1))
        .thenReturn(RetryOutcome.success(bySystem, 1));

    Map<Long, SystemFetchResult> results =
        fetcher.fetchSystemsBulk(List.of(TestFixtures.JITA, TestFixtures.AMARR), 1, 1);

    assertThat(results.get(TestFixtures.JITA).killmails()).extracting(Killmail::killmailId).containsExactly(1L);
    assertThat(results.get(TestFixtures.AMARR).killmails()).isEmpty();
    assertThat(results.get(TestFixtures.AMARR).ok()).isTrue();
  }

  @Test
  void killmailLookupUsesCacheThenUpstream() {
    fullRecords.put(55L, TestKillmails.raw(55L, TestFixtures.JITA, clock.instant().minus(Duration.ofDays(3))));

    assertThat(fetcher.fetchKillmail(55L)).map(Killmail::killmailId).contains(55L);
    assertThat(fetcher.fetchKillmail(55L)).isPresent();
    verify(client, times(1)).fetchKillmail(55L);

    assertThat(fetcher.fetchKillmail(56L)).isEmpty();
  }

  @Test
  void killmailLookupFailureIsSurfaced() {
    when(client.fetchKillmail(57L)).thenReturn(RetryOutcome.failure("retries exhausted: timeout", 3));

    assertThatThrownBy(() -> fetcher.fetchKillmail(57L))
        .isInstanceOf(UpstreamUnavailableException.class)
        .hasMessageContaining("timeout");
  }

  @Test
  void killCountFallsBackToUpstreamAndRemembersIt() {
    when(client.fetchKillCount(TestFixtures.JITA)).thenReturn(RetryOutcome.success(12L, 1));

    KillmailFetcher.KillCount first = fetcher.killCount(TestFixtures.JITA);
    KillmailFetcher.KillCount second = fetcher.killCount(TestFixtures.JITA);

    assertThat(first.reported()).isEqualTo(12L);
    assertThat(first.rolling()).isZero();
    assertThat(second.reported()).isEqualTo(12L);
    verify(client, times(1)).fetchKillCount(TestFixtures.JITA);
  }

  @Test
  void cachedKillsPullsUpstreamCacheWhenEmpty() {
    when(client.fetchCachedKills(TestFixtures.JITA)).thenReturn(RetryOutcome.success(
        List.of(TestKillmails.raw(3L, TestFixtures.JITA, minutesAgo(3))), 1));

    List<Killmail> cached = fetcher.cachedKills(TestFixtures.JITA, 10);

    assertThat(cached).extracting(Killmail::killmailId).containsExactly(3L);
  }

  @Test
  void cachedKillsWithNothingLocalAndUpstreamDownIsEmpty() {
    when(client.fetchCachedKills(TestFixtures.DODIXIE)).thenReturn(RetryOutcome.failure("retries exhausted", 3));

    assertThat(fetcher.cachedKills(TestFixtures.DODIXIE, 10)).isEmpty();
    verifyNoInteractions(identityClient);
  }

  private void build(KillfeedProperties properties) {
    store = newStore(properties);
    fetcher = new KillmailFetcher(client, parser(store, properties), store, properties, clock, Runnable::run);
  }

  private void slowPage(long systemId, long delayMs, List<JsonNode> partials) {
    when(client.fetchKillsPage(systemId, 24, 200, 1)).thenAnswer(invocation -> {
      Thread.sleep(delayMs);
      return RetryOutcome.success(partials, 1);
    });
  }

  private static KillfeedProperties withSystemTimeout(Duration systemTimeout) {
    KillfeedProperties base = TestFixtures.properties();
    KillfeedProperties.Fetcher fetcher = base.fetcher();
    return new KillfeedProperties(
        base.cache(),
        base.parser(),
        new KillfeedProperties.Fetcher(
            fetcher.baseUrl(), fetcher.pageSize(), fetcher.maxPages(), fetcher.sinceHours(),
            fetcher.requestTimeout(), systemTimeout, 1),
        base.retry(),
        base.identity(),
        base.subscription(),
        base.preload(),
        base.sse());
  }

  private KillStore newStore(KillfeedProperties properties) {
    return new KillStore(
        new InMemoryKillCache(new FreshnessPolicy(properties.cache(), new SplittableRandom(11)), clock),
        new ObjectMapper(),
        properties);
  }

  private KillmailParser parser(KillStore killStore, KillfeedProperties properties) {
    return new KillmailParser(
        killStore, new KillmailEnricher(identityClient), properties, clock, new SimpleMeterRegistry());
  }

  private void stubPage(long systemId, int pageSize, int page, List<JsonNode> partials) {
    when(client.fetchKillsPage(systemId, 24, pageSize, page)).thenReturn(RetryOutcome.success(partials, 1));
  }

  /** Consecutive ids, each a minute older than the previous, with full records registered. */
  private List<JsonNode> partials(long systemId, long firstId, long lastId, long firstMinutesAgo) {
    List<JsonNode> page = new ArrayList<>();
    for (long id = firstId; id <= lastId; id++) {
      page.add(partialWithFull(id, systemId, minutesAgo(firstMinutesAgo + (id - firstId))));
    }
    return page;
  }

  private JsonNode partialWithFull(long id, long systemId, Instant killTime) {
    ObjectNode full = TestKillmails.raw(id, systemId, killTime);
    full.remove("zkb");
    fullRecords.put(id, full);
    return TestKillmails.partial(id, systemId, killTime);
  }

  private Instant minutesAgo(long minutes) {
    return clock.instant().minus(Duration.ofMinutes(minutes));
  }
}
