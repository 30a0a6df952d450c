package io.mcgateway.core.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.mcgateway.core.binding.BindingCoordinator;
import io.mcgateway.core.binding.BindingSettings;
import io.mcgateway.core.route.ForwardTarget;
import io.mcgateway.core.route.ForwardingTable;
import io.mcgateway.core.route.Router;
import io.mcgateway.core.session.DuplicatePolicy;
import io.mcgateway.core.session.ServerIdentity;
import io.mcgateway.core.session.SessionRegistry;
import io.mcgateway.core.session.SessionSettings;
import io.mcgateway.core.status.StatusFallback;
import io.mcgateway.core.status.StatusQueryFacade;
import io.mcgateway.core.testing.FakeTransport;
import io.mcgateway.core.testing.ManualScheduler;
import io.mcgateway.core.testing.MutableClock;
import io.mcgateway.core.testing.RecordingChatPlatform;
import io.mcgateway.core.testing.RecordingSessionListener;
import io.mcgateway.protocol.MemoryUsage;
import io.mcgateway.protocol.MessageCodec;
import io.mcgateway.protocol.PlayerInfo;
import io.mcgateway.protocol.PlayerList;
import io.mcgateway.protocol.StatusSnapshot;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CommandDispatcherTest {
    private final MutableClock clock = MutableClock.atEpoch();
    private final ManualScheduler scheduler = new ManualScheduler(clock);
    private final RecordingChatPlatform platform = new RecordingChatPlatform();
    private final FakeTransport lobby = new FakeTransport("lobby-1");
    private SessionRegistry registry;
    private BindingCoordinator bindings;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(
            List.of(
                new ServerIdentity("lobby", "secret-lobby"),
                new ServerIdentity("survival", "secret-survival"),
                new ServerIdentity("creative", "secret-creative")
            ),
            SessionSettings.defaults(),
            DuplicatePolicy.SUPERSEDE,
            scheduler,
            clock,
            new MessageCodec(),
            new RecordingSessionListener()
        );
        registry.attach("lobby", "secret-lobby", lobby);
        lobby.clearSent();
        Router router = new Router(
            registry,
            platform,
            ForwardingTable.builder()
                .forward("lobby", Set.of(ForwardTarget.parse("aiocqhttp:GroupMessage:1")))
                .forward("survival", Set.of(ForwardTarget.parse("aiocqhttp:GroupMessage:2")))
                .build()
        );
        bindings = new BindingCoordinator(router, platform, BindingSettings.defaults(), length -> "482913", scheduler, clock);
        StatusQueryFacade statusQueries = new StatusQueryFacade(
            registry,
            router,
            Map.of("survival", new FixedFallback()),
            scheduler,
            clock,
            Duration.ofSeconds(5),
            Runnable::run
        );
        dispatcher = new CommandDispatcher(registry, router, statusQueries, bindings, new ReplyFormatter());
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void parseStripsPrefixAndServerSelector() {
        CommandRequest request = CommandRequest.parse("/mc SAY @survival hello  world", "discord", "alice", false);

        assertEquals("say", request.command());
        assertEquals("survival", request.serverId());
        assertEquals("hello  world", request.argument());
        assertEquals("help", CommandRequest.parse("/mc", "discord", "alice", false).command());
        CommandRequest plain = CommandRequest.parse("status", "discord", "alice", false);
        assertNull(plain.serverId());
        assertEquals("", plain.argument());
    }

    @Test
    void sayGoesToTheOnlyConnectedServer() {
        CommandReply reply = dispatch("say hello from discord", false);

        assertTrue(reply.success());
        assertEquals("lobby", reply.serverId());
        assertEquals("Message sent to lobby", reply.text());
        String frame = lobby.sentOfType("CHAT").get(0);
        assertTrue(frame.contains("\"content\":\"hello from discord\""));
        assertTrue(frame.contains("\"platform\":\"discord\""));
    }

    @Test
    void sayToWhitelistedButAbsentServerReportsNotConnected() {
        CommandReply reply = dispatch("say @creative hi", false);

        assertFalse(reply.success());
        assertEquals("Server creative is not connected", reply.text());
    }

    @Test
    void sayWithoutTextShowsUsage() {
        CommandReply reply = dispatch("say @lobby", false);

        assertFalse(reply.success());
        assertTrue(reply.text().startsWith("Usage: say"));
    }

    @Test
    void severalConnectedServersRequireExplicitSelection() {
        registry.attach("survival", "secret-survival", new FakeTransport("survival-1"));

        CommandReply reply = dispatch("players", false);

        assertFalse(reply.success());
        assertTrue(reply.text().contains("creative, lobby, survival"));
    }

    @Test
    void serverCommandRequiresAdmin() {
        CommandReply denied = dispatch("cmd @lobby /say hi", false);

        assertFalse(denied.success());
        assertTrue(lobby.sentOfType("COMMAND").isEmpty());

        CommandReply allowed = dispatch("cmd @lobby /say hi", true);

        assertTrue(allowed.success());
        assertEquals("Command sent to lobby", allowed.text());
        String frame = lobby.sentOfType("COMMAND").get(0);
        assertTrue(frame.contains("\"command\":\"say hi\""));
        assertTrue(frame.contains("\"correlationId\""));
    }

    @Test
    void statusUsesFallbackForDisconnectedServer() {
        CommandReply reply = dispatch("status @survival", false);

        assertTrue(reply.success());
        assertEquals(
            String.join("\n",
                "Server status [survival]",
                "Online: yes",
                "Version: 1.20.4",
                "Players: 2/20",
                "TPS: 19.9 / 20.0 / 20.0",
                "Memory: 1024MB / 4096MB (25.0%)",
                "Online players: Steve, Alex"
            ),
            reply.text()
        );
    }

    @Test
    void playersListsEveryPlayer() {
        CommandReply reply = dispatch("players @survival", false);

        assertTrue(reply.text().contains("Online: 2/20"));
        assertTrue(reply.text().contains("- Steve | hp 20/20 | Lv.30 | SURVIVAL | world | 42ms"));
        assertTrue(reply.text().contains("- Alex"));
    }

    @Test
    void statusOfUnknownServerNamesIt() {
        CommandReply reply = dispatch("status @skyblock", false);

        assertFalse(reply.success());
        assertEquals("Unknown server: skyblock", reply.text());
    }

    @Test
    void bindConfirmsPendingCode() {
        bindings.issue("lobby", "uuid-steve", "Steve");

        CommandReply first = dispatch("bind 482913", false);
        CommandReply second = dispatch("bind 482913", false);

        assertTrue(first.success());
        assertEquals("lobby", first.serverId());
        assertEquals("Binding confirmed for Steve on lobby", first.text());
        assertEquals(1, lobby.sentOfType("BIND_CONFIRM").size());
        assertFalse(second.success());
        assertEquals("Binding code 482913 was already used", second.text());
    }

    @Test
    void infoSummarizesSessionsAndTargets() {
        CommandReply reply = dispatch("info", false);

        assertTrue(reply.text().contains("- lobby: CONNECTED (listener)"));
        assertTrue(reply.text().endsWith("Forward targets: 2"));
    }

    @Test
    void reconnectDropsConnectedTransport() {
        CommandReply reply = dispatch("reconnect @lobby", false);

        assertTrue(reply.success());
        assertEquals("Reconnecting lobby", reply.text());
        assertFalse(lobby.isOpen());
    }

    @Test
    void unknownCommandShowsHelp() {
        CommandReply reply = dispatch("fly", false);

        assertFalse(reply.success());
        assertTrue(reply.text().startsWith("Unknown command: fly"));
        assertTrue(reply.text().contains("bind <code>"));
    }

    private CommandReply dispatch(String line, boolean admin) {
        return dispatcher.dispatch(CommandRequest.parse(line, "discord", "alice", admin));
    }

    private static final class FixedFallback implements StatusFallback {
        @Override
        public StatusSnapshot fetchStatus() {
            return new StatusSnapshot(
                true,
                "1.20.4",
                2,
                20,
                List.of(19.94d, 20.0d, 20.0d, 20.0d),
                new MemoryUsage(1024, 4096),
                List.of("Steve", "Alex")
            );
        }

        @Override
        public PlayerList fetchPlayers() {
            return new PlayerList(
                2,
                20,
                List.of(
                    new PlayerInfo("Steve", "uuid-steve", 20.0d, 20.0d, 30, "SURVIVAL", "world", 42),
                    PlayerInfo.named("Alex")
                )
            );
        }
    }
}
