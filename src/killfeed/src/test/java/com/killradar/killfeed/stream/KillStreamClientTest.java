package com.killradar.killfeed.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.killradar.killfeed.MutableClock;
import com.killradar.killfeed.TestFixtures;
import com.killradar.killfeed.config.StreamProperties;
import com.killradar.killfeed.dispatch.KillEventProcessor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class KillStreamClientTest {

  private static final String TOPIC = "killmails:lobby";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final PhoenixCodec codec = new PhoenixCodec(objectMapper);
  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
  private final Set<Long> desired = new TreeSet<>(Set.of(TestFixtures.JITA));

  private ManualScheduledExecutor executor;
  private FakeTransport transport;
  private KillEventProcessor processor;
  private SimpleMeterRegistry meterRegistry;
  private KillStreamClient client;

  @BeforeEach
  void setUp() {
    executor = new ManualScheduledExecutor();
    transport = new FakeTransport();
    processor = mock(KillEventProcessor.class);
    meterRegistry = new SimpleMeterRegistry();
    client = client(TestFixtures.streamProperties());
  }

  @Test
  void firstConnectWaitsForStartupJitter() {
    client.start();
    executor.runUntilIdle();

    assertThat(transport.connections).isEmpty();
    assertThat(executor.pendingOneShotDelays()).singleElement()
        .satisfies(delay -> assertThat(delay).isBetween(50L, 999L));

    executor.advance(Duration.ofSeconds(1));
    assertThat(transport.connections).hasSize(1);
    assertThat(transport.openedUris).containsExactly(URI.create("ws://kills.test:4004/socket/websocket?vsn=2.0.0"));
  }

  @Test
  void joinCarriesDesiredSystemsAndClientIdentifier() {
    desired.add(TestFixtures.AMARR);
    client.start();
    executor.advance(Duration.ofSeconds(1));

    PhoenixMessage join = codec.decode(transport.last().lastSent());

    assertThat(join.event()).isEqualTo("phx_join");
    assertThat(join.topic()).isEqualTo(TOPIC);
    assertThat(join.joinRef()).isEqualTo(join.ref());
    assertThat(longs(join.payload().path("systems"))).containsExactly(TestFixtures.JITA, TestFixtures.AMARR);
    assertThat(join.payload().path("client_identifier").asText()).isEqualTo("killradar-test");
    assertThat(status().state()).isEqualTo(ConnectionState.CONNECTING);
  }

  @Test
  void okJoinReplyConnectsAndRecordsSubscribedSet() {
    connectAndJoin();

    StreamStatus status = status();
    assertThat(status.state()).isEqualTo(ConnectionState.CONNECTED);
    assertThat(status.subscribedSystems()).containsExactly(TestFixtures.JITA);
    assertThat(status.connectedAt()).isEqualTo(clock.instant());
    assertThat(client.currentState()).isEqualTo(ConnectionState.CONNECTED);
    assertThat(meterRegistry.get("killfeed.stream.connected").gauge().value()).isEqualTo(1.0);
  }

  @Test
  void failedAttemptsBackOffThenCoolDown() {
    transport.mode(FakeTransport.Mode.FAIL);
    client.start();
    executor.advance(Duration.ofSeconds(1));

    assertThat(status().nextRetryDelay()).isEqualTo(Duration.ofSeconds(30));
    executor.advance(Duration.ofSeconds(30));
    assertThat(status().nextRetryDelay()).isEqualTo(Duration.ofSeconds(60));
    executor.advance(Duration.ofSeconds(60));
    assertThat(status().nextRetryDelay()).isEqualTo(Duration.ofSeconds(120));
    executor.advance(Duration.ofSeconds(120));

    StreamStatus cooling = status();
    assertThat(cooling.nextRetryDelay()).isEqualTo(Duration.ofMinutes(10));
    assertThat(cooling.retryCount()).isZero();
    assertThat(cooling.cycleCount()).isEqualTo(1);
    assertThat(cooling.lastError()).contains("Connection refused");

    executor.advance(Duration.ofMinutes(10));
    StreamStatus nextCycle = status();
    assertThat(nextCycle.nextRetryDelay()).isEqualTo(Duration.ofSeconds(30));
    assertThat(nextCycle.retryCount()).isEqualTo(1);
    assertThat(nextCycle.cycleCount()).isEqualTo(1);
    assertThat(transport.connections).hasSize(5);
    assertThat(meterRegistry.get("killfeed.stream.reconnects.total").counter().count()).isEqualTo(5.0);
  }

  @Test
  void successfulJoinResetsCounters() {
    transport.mode(FakeTransport.Mode.FAIL);
    client.start();
    executor.advance(Duration.ofSeconds(1));
    executor.advance(Duration.ofSeconds(30));
    assertThat(status().retryCount()).isEqualTo(2);

    transport.mode(FakeTransport.Mode.SUCCEED);
    executor.advance(Duration.ofSeconds(60));
    replyOk(joinRef());

    StreamStatus status = status();
    assertThat(status.state()).isEqualTo(ConnectionState.CONNECTED);
    assertThat(status.retryCount()).isZero();
    assertThat(status.cycleCount()).isZero();
    assertThat(status.lastError()).isNull();
    assertThat(status.nextRetryDelay()).isNull();
  }

  @Test
  void connectTimeoutCountsAsDisconnect() {
    transport.mode(FakeTransport.Mode.HANG);
    client.start();
    executor.advance(Duration.ofSeconds(1));
    FakeTransport.FakeConnection hung = transport.last();

    executor.advance(Duration.ofSeconds(10));

    StreamStatus status = status();
    assertThat(status.state()).isEqualTo(ConnectionState.DISCONNECTED);
    assertThat(status.lastError()).isEqualTo("connect_timeout");
    assertThat(status.nextRetryDelay()).isEqualTo(Duration.ofSeconds(30));

    hung.pendingOpen.complete(hung);
    executor.runUntilIdle();
    assertThat(hung.closed).isTrue();
    assertThat(status().state()).isEqualTo(ConnectionState.DISCONNECTED);
  }

  @Test
  void rejectedJoinDisconnects() {
    client.start();
    executor.advance(Duration.ofSeconds(1));
    String ref = joinRef();

    server(ref, ref, TOPIC, "phx_reply", "{\"status\":\"error\",\"response\":{\"reason\":\"unauthorized\"}}");

    StreamStatus status = status();
    assertThat(status.state()).isEqualTo(ConnectionState.DISCONNECTED);
    assertThat(status.lastError()).startsWith("join_rejected").contains("unauthorized");
    assertThat(transport.last().closed).isTrue();
  }

  @Test
  void duplicateDisconnectSignalsScheduleOneReconnect() {
    connectAndJoin();
    FakeTransport.FakeConnection live = transport.last();

    live.listener.onClosed(1006, "abnormal");
    live.listener.onError(new IllegalStateException("socket reset"));
    server(null, null, TOPIC, "phx_error", "{}");
    executor.runUntilIdle();

    StreamStatus status = status();
    assertThat(status.state()).isEqualTo(ConnectionState.DISCONNECTED);
    assertThat(status.retryCount()).isEqualTo(1);
    assertThat(status.lastError()).startsWith("closed: 1006");
    assertThat(status.subscribedSystems()).isEmpty();
    assertThat(executor.pendingOneShotDelays()).containsExactly(30_000L);
    assertThat(meterRegistry.get("killfeed.stream.reconnects.total").counter().count()).isEqualTo(1.0);
  }

  @Test
  void callbacksFromReplacedConnectionAreIgnored() {
    connectAndJoin();
    FakeTransport.FakeConnection first = transport.last();
    client.reconnect();
    executor.runUntilIdle();
    replyOk(joinRef());
    assertThat(status().state()).isEqualTo(ConnectionState.CONNECTED);

    first.listener.onClosed(1000, "late");
    first.listener.onText(frame(null, null, TOPIC, "kill_count_update", "{\"system_id\":30000142,\"count\":9}"));
    executor.runUntilIdle();

    assertThat(status().state()).isEqualTo(ConnectionState.CONNECTED);
    verifyNoInteractions(processor);
  }

  @Test
  void channelCloseOnOurTopicDisconnects() {
    connectAndJoin();

    server(null, null, TOPIC, "phx_close", "{}");

    assertThat(status().lastError()).isEqualTo("channel_closed: phx_close");
  }

  @Test
  void forcedReconnectBypassesBackoff() {
    connectAndJoin();
    FakeTransport.FakeConnection first = transport.last();

    client.reconnect();
    executor.runUntilIdle();

    assertThat(first.closed).isTrue();
    assertThat(transport.connections).hasSize(2);
    assertThat(status().state()).isEqualTo(ConnectionState.CONNECTING);
    assertThat(meterRegistry.get("killfeed.stream.reconnects.total").counter().count()).isZero();
  }

  @Test
  void connectWhileConnectedIsIgnored() {
    connectAndJoin();

    client.connect();
    executor.runUntilIdle();

    assertThat(transport.connections).hasSize(1);
  }

  @Test
  void heartbeatsAreSentWhileConnected() {
    connectAndJoin();

    executor.advance(Duration.ofSeconds(30));

    PhoenixMessage heartbeat = codec.decode(transport.last().lastSent());
    assertThat(heartbeat.topic()).isEqualTo("phoenix");
    assertThat(heartbeat.event()).isEqualTo("heartbeat");
    assertThat(heartbeat.joinRef()).isNull();
  }

  @Test
  void subscribingAlreadySubscribedSystemSendsNothing() {
    connectAndJoin();
    int sentBefore = transport.last().sent.size();

    CompletableFuture<Set<Long>> result = client.subscribe(List.of(TestFixtures.JITA));
    executor.runUntilIdle();

    assertThat(result).isCompletedWithValue(Set.of(TestFixtures.JITA));
    assertThat(transport.last().sent).hasSize(sentBefore);
  }

  @Test
  void subscribePushesOnlyTheDifferenceAndCompletesOnAck() {
    connectAndJoin();

    CompletableFuture<Set<Long>> result = client.subscribe(List.of(TestFixtures.JITA, TestFixtures.AMARR));
    executor.runUntilIdle();

    PhoenixMessage push = codec.decode(transport.last().lastSent());
    assertThat(push.event()).isEqualTo(KillStreamClient.SUBSCRIBE_EVENT);
    assertThat(longs(push.payload().path("systems"))).containsExactly(TestFixtures.AMARR);
    assertThat(result).isNotDone();
    assertThat(status().subscribedSystems()).containsExactlyInAnyOrder(TestFixtures.JITA, TestFixtures.AMARR);

    replyOk(push.ref());

    assertThat(result).isCompletedWithValueMatching(
        systems -> systems.equals(Set.of(TestFixtures.JITA, TestFixtures.AMARR)));
  }

  @Test
  void rejectedPushRevertsSubscribedSet() {
    connectAndJoin();

    CompletableFuture<Set<Long>> result = client.subscribe(List.of(TestFixtures.AMARR));
    executor.runUntilIdle();
    PhoenixMessage push = codec.decode(transport.last().lastSent());
    server(push.joinRef(), push.ref(), TOPIC, "phx_reply", "{\"status\":\"error\",\"response\":{\"reason\":\"too_many\"}}");

    assertThat(result).isCompletedExceptionally();
    assertThat(result.handle((value, error) -> error).join())
        .isInstanceOf(PushFailedException.class)
        .hasMessageContaining("too_many");
    assertThat(status().subscribedSystems()).containsExactly(TestFixtures.JITA);
  }

  @Test
  void unacknowledgedPushTimesOutAndReverts() {
    connectAndJoin();

    CompletableFuture<Set<Long>> result = client.unsubscribe(List.of(TestFixtures.JITA));
    executor.runUntilIdle();
    assertThat(status().subscribedSystems()).isEmpty();

    executor.advance(Duration.ofSeconds(10));

    assertThat(result).isCompletedExceptionally();
    assertThat(status().subscribedSystems()).containsExactly(TestFixtures.JITA);
  }

  @Test
  void pushSendFailureReverts() {
    connectAndJoin();
    transport.last().failSends = true;

    CompletableFuture<Set<Long>> result = client.subscribe(List.of(TestFixtures.AMARR));
    executor.runUntilIdle();

    assertThat(result).isCompletedExceptionally();
    assertThat(status().subscribedSystems()).containsExactly(TestFixtures.JITA);
  }

  @Test
  void pendingPushFailsWhenConnectionDrops() {
    connectAndJoin();
    CompletableFuture<Set<Long>> result = client.subscribe(List.of(TestFixtures.AMARR));
    executor.runUntilIdle();

    transport.last().listener.onClosed(1001, "going away");
    executor.runUntilIdle();

    assertThat(result).isCompletedExceptionally();
    assertThat(status().subscribedSystems()).isEmpty();
  }

  @Test
  void subscribeWhileDisconnectedCompletesWithoutPush() {
    CompletableFuture<Set<Long>> result = client.subscribe(List.of(TestFixtures.AMARR));
    executor.runUntilIdle();

    assertThat(result).isCompletedWithValue(Set.of());
    assertThat(transport.connections).isEmpty();
  }

  @Test
  void subscribeDuringJoinIsPushedOnceJoined() {
    client.start();
    executor.advance(Duration.ofSeconds(1));
    String ref = joinRef();

    desired.add(TestFixtures.AMARR);
    CompletableFuture<Set<Long>> result = client.subscribe(List.of(TestFixtures.AMARR));
    executor.runUntilIdle();
    assertThat(result).isNotDone();
    assertThat(transport.last().sent).hasSize(1);

    replyOk(ref);

    PhoenixMessage push = codec.decode(transport.last().lastSent());
    assertThat(push.event()).isEqualTo(KillStreamClient.SUBSCRIBE_EVENT);
    assertThat(longs(push.payload().path("systems"))).containsExactly(TestFixtures.AMARR);
    assertThat(status().subscribedSystems()).containsExactlyInAnyOrder(TestFixtures.JITA, TestFixtures.AMARR);

    replyOk(push.ref());
    assertThat(result).isCompletedWithValueMatching(
        systems -> systems.equals(Set.of(TestFixtures.JITA, TestFixtures.AMARR)));
  }

  @Test
  void unsubscribeDuringJoinIsPushedOnceJoined() {
    client.start();
    executor.advance(Duration.ofSeconds(1));
    String ref = joinRef();

    desired.remove(TestFixtures.JITA);
    CompletableFuture<Set<Long>> result = client.unsubscribe(List.of(TestFixtures.JITA));
    replyOk(ref);

    PhoenixMessage push = codec.decode(transport.last().lastSent());
    assertThat(push.event()).isEqualTo(KillStreamClient.UNSUBSCRIBE_EVENT);
    assertThat(longs(push.payload().path("systems"))).containsExactly(TestFixtures.JITA);
    replyOk(push.ref());
    assertThat(result).isCompletedWithValue(Set.of());
  }

  @Test
  void requestsQueuedDuringJoinCompleteWhenJoinFails() {
    client.start();
    executor.advance(Duration.ofSeconds(1));
    String ref = joinRef();

    CompletableFuture<Set<Long>> result = client.subscribe(List.of(TestFixtures.AMARR));
    server(ref, ref, TOPIC, "phx_reply", "{\"status\":\"error\",\"response\":{}}");

    assertThat(result).isCompletedWithValue(Set.of());
    assertThat(transport.last().sent).hasSize(1);
  }

  @Test
  void inboundEventsReachTheProcessor() {
    connectAndJoin();

    server(null, null, TOPIC, "killmail_update",
        "{\"system_id\":30000142,\"killmails\":[{\"killmail_id\":1},{\"killmail_id\":2}]}");
    server(null, null, TOPIC, "kill_count_update", "{\"system_id\":30002187,\"count\":6}");
    server(null, null, TOPIC, "killmail_update", "{\"killmails\":[{\"killmail_id\":3}]}");
    transport.last().listener.onText("garbage");
    executor.runUntilIdle();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<JsonNode>> killmails = ArgumentCaptor.forClass(List.class);
    verify(processor).onKillmailUpdate(eq(TestFixtures.JITA), killmails.capture());
    assertThat(killmails.getValue()).hasSize(2);
    verify(processor).onKillCountUpdate(TestFixtures.AMARR, 6L);
    verify(processor, times(1)).onKillmailUpdate(anyLong(), anyList());
    assertThat(status().state()).isEqualTo(ConnectionState.CONNECTED);
  }

  @Test
  void recoversOnceUpstreamComesBack() {
    transport.mode(FakeTransport.Mode.FAIL);
    client.start();
    executor.advance(Duration.ofSeconds(1));
    transport.mode(FakeTransport.Mode.SUCCEED);

    executor.advance(Duration.ofMinutes(5));
    replyOk(joinRef());

    assertThat(status().state()).isEqualTo(ConnectionState.CONNECTED);
    assertThat(transport.connections).hasSize(2);
  }

  @Test
  void stopClosesConnectionAndRejectsFurtherWork() {
    connectAndJoin();
    FakeTransport.FakeConnection live = transport.last();

    client.stop();

    assertThat(live.closed).isTrue();
    assertThat(client.currentState()).isEqualTo(ConnectionState.DISCONNECTED);
    CompletableFuture<Set<Long>> late = client.subscribe(List.of(TestFixtures.AMARR));
    assertThat(late).isCompletedExceptionally();
  }

  @Test
  void httpServerUrlIsConvertedToWebSocketScheme() {
    StreamProperties base = TestFixtures.streamProperties();
    StreamProperties https = new StreamProperties(
        true, "https://kills.example.com/", base.vsn(), base.topic(), base.clientIdentifier(),
        base.connectTimeout(), base.retryDelays(), base.cycleDelay(), base.initialJitterMin(),
        base.initialJitterMax(), base.heartbeatInterval(), base.healthCheckInterval(), base.workers());

    assertThat(client(https).socketUri())
        .isEqualTo(URI.create("wss://kills.example.com/socket/websocket?vsn=2.0.0"));
  }

  private KillStreamClient client(StreamProperties properties) {
    return new KillStreamClient(
        transport,
        codec,
        processor,
        () -> desired,
        properties,
        new SplittableRandom(7),
        clock,
        meterRegistry,
        executor);
  }

  private void connectAndJoin() {
    client.start();
    executor.advance(Duration.ofSeconds(1));
    replyOk(joinRef());
  }

  private String joinRef() {
    return codec.decode(transport.last().sent.get(0)).ref();
  }

  private void replyOk(String ref) {
    server(ref, ref, TOPIC, "phx_reply", "{\"status\":\"ok\",\"response\":{}}");
  }

  private void server(String joinRef, String ref, String topic, String event, String payload) {
    transport.last().listener.onText(frame(joinRef, ref, topic, event, payload));
    executor.runUntilIdle();
  }

  private String frame(String joinRef, String ref, String topic, String event, String payload) {
    try {
      return codec.encode(new PhoenixMessage(joinRef, ref, topic, event, objectMapper.readTree(payload)));
    } catch (Exception ex) {
      throw new IllegalArgumentException(ex);
    }
  }

  private StreamStatus status() {
    CompletableFuture<StreamStatus> status = client.status();
    executor.runUntilIdle();
    try {
      return status.join();
    } catch (CompletionException ex) {
      throw new AssertionError(ex);
    }
  }

  private static List<Long> longs(JsonNode array) {
    List<Long> values = new ArrayList<>();
    array.forEach(node -> values.add(node.asLong()));
    return values;
  }
}
