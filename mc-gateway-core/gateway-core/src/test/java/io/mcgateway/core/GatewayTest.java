package io.mcgateway.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.mcgateway.core.binding.BindingNotification;
import io.mcgateway.core.binding.BindingSettlement;
import io.mcgateway.core.command.CommandReply;
import io.mcgateway.core.command.CommandRequest;
import io.mcgateway.core.config.GatewayConfig;
import io.mcgateway.core.route.ForwardEvent;
import io.mcgateway.core.route.ForwardTarget;
import io.mcgateway.core.route.RelaySettings;
import io.mcgateway.core.route.RouteResult;
import io.mcgateway.core.session.AttachResult;
import io.mcgateway.core.session.SessionConnector;
import io.mcgateway.core.status.QueryOutcome;
import io.mcgateway.core.status.QueryResult;
import io.mcgateway.core.testing.FakeTransport;
import io.mcgateway.core.testing.ManualScheduler;
import io.mcgateway.core.testing.MutableClock;
import io.mcgateway.core.testing.RecordingChatPlatform;
import io.mcgateway.protocol.ChatPayload;
import io.mcgateway.protocol.Message;
import io.mcgateway.protocol.MessageCodec;
import io.mcgateway.protocol.StatusSnapshot;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GatewayTest {
    private static final ForwardTarget GROUP = ForwardTarget.parse("aiocqhttp:GroupMessage:123456");

    private final MutableClock clock = MutableClock.atEpoch();
    private final ManualScheduler scheduler = new ManualScheduler(clock);
    private final RecordingChatPlatform platform = new RecordingChatPlatform();
    private final List<String> dialed = new ArrayList<>();
    private Gateway gateway;

    @BeforeEach
    void setUp() {
        GatewayConfig config = GatewayConfig.builder()
            .servers(List.of(
                new GatewayConfig.ServerConfig(
                    "lobby",
                    "secret-lobby",
                    null,
                    Set.of(GROUP),
                    EnumSet.allOf(ForwardEvent.class),
                    null
                ),
                new GatewayConfig.ServerConfig(
                    "creative",
                    "secret-creative",
                    URI.create("ws://127.0.0.1:25580/gateway"),
                    Set.of(),
                    Set.of(ForwardEvent.CHAT),
                    null
                )
            ))
            .relaySettings(new RelaySettings("#mc", Set.of()))
            .build();
        SessionConnector connector = (identity, handler) -> {
            dialed.add(identity.serverId());
            return new FakeTransport("dial-" + dialed.size()).bind(handler);
        };
        gateway = new Gateway(config, platform, scheduler, clock, server -> connector, http -> {
            throw new IllegalStateException("no HTTP fallback configured");
        });
        gateway.start();
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Test
    void inboundChatAndPresenceReachTheChatPlatform() {
        FakeTransport lobby = attachLobby();

        lobby.receive("{\"type\":\"CHAT\",\"payload\":{\"content\":\"hello\",\"sender\":\"Steve\"}}");
        lobby.peerClose(1006, "abnormal");

        assertEquals(List.of("online:lobby", "offline:lobby"), platform.events);
        List<String> texts = new ArrayList<>();
        for (RecordingChatPlatform.Delivered delivered : platform.deliveries) {
            texts.add(delivered.delivery().text());
        }
        assertEquals("[lobby] server is online", texts.get(0));
        assertEquals("[lobby] <Steve> hello", texts.get(1));
        assertTrue(texts.get(2).startsWith("[lobby] server went offline"));
        assertEquals("lobby", platform.deliveries.get(1).delivery().message().serverId());
    }

    @Test
    void dialedServersAreConnectedOnStartAndNotWhitelisted() {
        scheduler.runDue();

        assertEquals(List.of("creative"), dialed);
        AttachResult inbound = gateway.registry().attach("creative", "secret-creative", new FakeTransport("t1"));
        assertFalse(inbound.accepted());
    }

    @Test
    void serverIssuedBindingCodeCompletesThroughCommandAndResult() throws Exception {
        FakeTransport lobby = attachLobby();
        lobby.receive("{\"type\":\"BIND_CODE_ISSUED\",\"payload\":{\"code\":\"735104\","
            + "\"playerUuid\":\"uuid-steve\",\"playerName\":\"Steve\"}}");

        BindingNotification notification = platform.notifications.get(0);
        assertEquals("735104", notification.code());
        assertEquals("lobby:uuid-steve", notification.privateSessionId());

        CommandReply reply = gateway.commands().dispatch(CommandRequest.parse("bind 735104", "discord", "alice", false));
        assertTrue(reply.success());

        Message confirm = new MessageCodec().decode(lobby.sentOfType("BIND_CONFIRM").get(0));
        lobby.receive("{\"type\":\"BIND_RESULT\",\"correlationId\":\"" + confirm.correlationId()
            + "\",\"payload\":{\"success\":true,\"code\":\"735104\"}}");

        BindingSettlement settlement = platform.settlements.get(0);
        assertTrue(settlement.success());
        assertEquals("alice", settlement.accountId());
        assertEquals("discord", settlement.platform());
    }

    @Test
    void forcedReissueCancelsEarlierCode() {
        FakeTransport lobby = attachLobby();
        lobby.receive("{\"type\":\"BIND_CODE_ISSUED\",\"payload\":{\"code\":\"111111\",\"playerUuid\":\"uuid-steve\"}}");
        lobby.receive("{\"type\":\"BIND_CODE_ISSUED\",\"payload\":{\"code\":\"222222\",\"playerUuid\":\"uuid-steve\","
            + "\"force\":true}}");

        CommandReply stale = gateway.commands().dispatch(CommandRequest.parse("bind 111111", "discord", "alice", false));
        CommandReply fresh = gateway.commands().dispatch(CommandRequest.parse("bind 222222", "discord", "alice", false));

        assertFalse(stale.success());
        assertTrue(fresh.success());
    }

    @Test
    void statusResponseFrameCompletesPendingQuery() throws Exception {
        FakeTransport lobby = attachLobby();

        CompletableFuture<QueryResult<StatusSnapshot>> query = gateway.statusQueries().queryStatusAsync("lobby");
        Message request = new MessageCodec().decode(lobby.sentOfType("STATUS_REQUEST").get(0));
        lobby.receive("{\"type\":\"STATUS_RESPONSE\",\"correlationId\":\"" + request.correlationId() + "\","
            + "\"payload\":{\"query\":\"status\",\"status\":{\"version\":\"1.21\",\"onlinePlayers\":4,"
            + "\"maxPlayers\":50,\"tps\":[20.0]}}}");

        QueryResult<StatusSnapshot> result = query.join();
        assertEquals(QueryOutcome.OK, result.outcome());
        assertEquals("1.21", result.value().version());
        assertEquals(4, result.value().onlinePlayers());
    }

    @Test
    void closeDetachesEverySession() {
        FakeTransport lobby = attachLobby();

        gateway.close();

        assertFalse(lobby.isOpen());
        assertTrue(gateway.registry().list().isEmpty());
    }

    @Test
    void prefixedPlatformLineIsRelayedToServersForwardingToThatSession() throws Exception {
        FakeTransport lobby = attachLobby();

        Map<String, RouteResult> relayed = gateway.relayFromPlatform(GROUP, "alice", "  #mc hello from discord ");
        Map<String, RouteResult> unprefixed = gateway.relayFromPlatform(GROUP, "alice", "just chatting");
        Map<String, RouteResult> unrelated = gateway.relayFromPlatform(
            ForwardTarget.parse("aiocqhttp:GroupMessage:999"),
            "bob",
            "#mc hi"
        );

        assertEquals(Map.of("lobby", RouteResult.SENT), relayed);
        assertTrue(unprefixed.isEmpty());
        assertTrue(unrelated.isEmpty());
        List<String> chats = lobby.sentOfType("CHAT");
        assertEquals(1, chats.size());
        Message chat = new MessageCodec().decode(chats.get(0));
        ChatPayload payload = chat.payloadAs(ChatPayload.class);
        assertEquals("hello from discord", payload.content());
        assertEquals("alice", payload.sender());
        assertEquals("aiocqhttp", payload.platform());
        assertTrue(payload.isBroadcast());
    }

    @Test
    void playerSessionIdTargetsOnePlayer() throws Exception {
        FakeTransport lobby = attachLobby();

        RouteResult toPlayer = gateway.relay().sendToSession("lobby:uuid-steve", "discord", "alice", "welcome back");
        RouteResult toServer = gateway.relay().sendToSession("lobby", "discord", "alice", "hello all");
        RouteResult offline = gateway.relay().sendToSession("creative:uuid-alex", "discord", "alice", "hi");

        assertEquals(RouteResult.SENT, toPlayer);
        assertEquals(RouteResult.SENT, toServer);
        assertFalse(offline.accepted());
        List<String> chats = lobby.sentOfType("CHAT");
        ChatPayload privateLine = new MessageCodec().decode(chats.get(0)).payloadAs(ChatPayload.class);
        ChatPayload broadcast = new MessageCodec().decode(chats.get(1)).payloadAs(ChatPayload.class);
        assertEquals("uuid-steve", privateLine.targetPlayerUuid());
        assertTrue(broadcast.isBroadcast());
    }

    @Test
    void hangingDialsDoNotHoldBackTimers() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch dialing = new CountDownLatch(2);
        SessionConnector hanging = (identity, handler) -> {
            dialing.countDown();
            try {
                release.await();
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            }
            throw new IOException("connect timed out");
        };
        GatewayConfig config = GatewayConfig.builder()
            .servers(List.of(
                dialedServer("alpha", "ws://127.0.0.1:25581/gateway"),
                dialedServer("beta", "ws://127.0.0.1:25582/gateway")
            ))
            .build();
        Gateway threaded = Gateway.create(config, new RecordingChatPlatform(), server -> hanging, http -> {
            throw new IllegalStateException("no HTTP fallback configured");
        });
        try {
            threaded.start();
            assertTrue(dialing.await(5, TimeUnit.SECONDS));

            CountDownLatch fired = new CountDownLatch(1);
            long scheduledAt = System.nanoTime();
            threaded.scheduler().schedule(fired::countDown, Duration.ofMillis(20));

            assertTrue(fired.await(2, TimeUnit.SECONDS));
            assertTrue(System.nanoTime() - scheduledAt < TimeUnit.SECONDS.toNanos(1));
        } finally {
            threaded.close();
            release.countDown();
        }
    }

    private static GatewayConfig.ServerConfig dialedServer(String serverId, String url) {
        return new GatewayConfig.ServerConfig(
            serverId,
            "secret-" + serverId,
            URI.create(url),
            Set.of(),
            EnumSet.allOf(ForwardEvent.class),
            null
        );
    }

    private FakeTransport attachLobby() {
        FakeTransport transport = new FakeTransport("lobby-1");
        AttachResult result = gateway.registry().attach("lobby", "secret-lobby", transport);
        transport.bind(result.session());
        return transport;
    }
}
