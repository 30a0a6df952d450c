package io.mcgateway.core.status;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.mcgateway.core.route.ForwardingTable;
import io.mcgateway.core.route.Router;
import io.mcgateway.core.session.DuplicatePolicy;
import io.mcgateway.core.session.ServerIdentity;
import io.mcgateway.core.session.SessionRegistry;
import io.mcgateway.core.session.SessionSettings;
import io.mcgateway.core.testing.FakeTransport;
import io.mcgateway.core.testing.ManualScheduler;
import io.mcgateway.core.testing.MutableClock;
import io.mcgateway.core.testing.RecordingChatPlatform;
import io.mcgateway.core.testing.RecordingSessionListener;
import io.mcgateway.protocol.Message;
import io.mcgateway.protocol.MessageCodec;
import io.mcgateway.protocol.MessageType;
import io.mcgateway.protocol.StatusResponsePayload;
import io.mcgateway.protocol.StatusSnapshot;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StatusPollerTest {
    private final MutableClock clock = MutableClock.atEpoch();
    private final ManualScheduler scheduler = new ManualScheduler(clock);
    private final MessageCodec codec = new MessageCodec();
    private final FakeTransport lobby = new FakeTransport("lobby-1");
    private SessionRegistry registry;
    private StatusQueryFacade queries;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(
            List.of(new ServerIdentity("lobby", "secret-lobby"), new ServerIdentity("survival", "secret-survival")),
            SessionSettings.defaults(),
            DuplicatePolicy.SUPERSEDE,
            scheduler,
            clock,
            codec,
            new RecordingSessionListener()
        );
        registry.attach("lobby", "secret-lobby", lobby);
        Router router = new Router(registry, new RecordingChatPlatform(), ForwardingTable.empty());
        queries = new StatusQueryFacade(registry, router, Map.of(), scheduler, clock, Duration.ofSeconds(5), Runnable::run);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void pollQueriesOnlyConnectedServersAndKeepsTheAnswer() throws Exception {
        StatusPoller poller = new StatusPoller(registry, queries, scheduler, clock, Duration.ofMinutes(5));

        int queried = poller.poll();
        Message request = codec.decode(lobby.sentOfType("STATUS_REQUEST").get(0));
        queries.onResponse(request.replyWith(
            MessageType.STATUS_RESPONSE,
            StatusResponsePayload.of(new StatusSnapshot(true, "1.21", 6, 20, List.of(20.0d), null, List.of()))
        ));

        assertEquals(1, queried);
        StatusPoller.PolledStatus polled = poller.latest("lobby").orElseThrow();
        assertEquals("1.21", polled.status().version());
        assertEquals(clock.instant(), polled.polledAt());
        assertTrue(poller.latest("survival").isEmpty());
    }

    @Test
    void unansweredPollKeepsThePreviousSnapshot() throws Exception {
        StatusPoller poller = new StatusPoller(registry, queries, scheduler, clock, Duration.ofMinutes(5));
        poller.poll();
        Message request = codec.decode(lobby.sentOfType("STATUS_REQUEST").get(0));
        queries.onResponse(request.replyWith(
            MessageType.STATUS_RESPONSE,
            StatusResponsePayload.of(new StatusSnapshot(true, "1.21", 6, 20, List.of(20.0d), null, List.of()))
        ));

        poller.poll();
        queries.close();

        assertEquals(6, poller.latest("lobby").orElseThrow().status().onlinePlayers());
        assertEquals(1, poller.snapshot().size());
    }

    @Test
    void startSchedulesPollsAtTheInterval() {
        StatusPoller poller = new StatusPoller(registry, queries, scheduler, clock, Duration.ofSeconds(30));
        int before = scheduler.activeTasks();

        poller.start();
        poller.start();

        assertEquals(before + 1, scheduler.activeTasks());
        poller.close();
        assertEquals(before, scheduler.activeTasks());
    }

    @Test
    void zeroIntervalDisablesPolling() {
        StatusPoller poller = new StatusPoller(registry, queries, scheduler, clock, Duration.ZERO);
        int before = scheduler.activeTasks();

        poller.start();

        assertEquals(before, scheduler.activeTasks());
        assertThrows(
            IllegalArgumentException.class,
            () -> new StatusPoller(registry, queries, scheduler, clock, Duration.ofSeconds(-1))
        );
    }
}
