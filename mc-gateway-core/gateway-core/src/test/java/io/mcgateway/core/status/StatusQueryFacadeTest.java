package io.mcgateway.core.status;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
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
import io.mcgateway.protocol.PlayerInfo;
import io.mcgateway.protocol.PlayerList;
import io.mcgateway.protocol.QueryKind;
import io.mcgateway.protocol.StatusRequestPayload;
import io.mcgateway.protocol.StatusResponsePayload;
import io.mcgateway.protocol.StatusSnapshot;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StatusQueryFacadeTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final MutableClock clock = MutableClock.atEpoch();
    private final ManualScheduler scheduler = new ManualScheduler(clock);
    private final MessageCodec codec = new MessageCodec();
    private final FakeTransport lobby = new FakeTransport("lobby-1");
    private final FakeTransport survival = new FakeTransport("survival-1");
    private SessionRegistry registry;
    private Router router;

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
            codec,
            new RecordingSessionListener()
        );
        registry.attach("lobby", "secret-lobby", lobby);
        registry.attach("survival", "secret-survival", survival);
        router = new Router(registry, new RecordingChatPlatform(), ForwardingTable.empty());
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void concurrentQueriesToDifferentServersNeverCrossDeliver() throws Exception {
        StatusQueryFacade facade = facade(Map.of());

        CompletableFuture<QueryResult<StatusSnapshot>> lobbyQuery = facade.queryStatusAsync("lobby");
        CompletableFuture<QueryResult<StatusSnapshot>> survivalQuery = facade.queryStatusAsync("survival");
        Message lobbyRequest = lastRequest(lobby);
        Message survivalRequest = lastRequest(survival);

        assertNotEquals(lobbyRequest.correlationId(), survivalRequest.correlationId());
        assertEquals(QueryKind.STATUS, lobbyRequest.payloadAs(StatusRequestPayload.class).query());

        Message crossed = survivalRequest
            .replyWith(MessageType.STATUS_RESPONSE, StatusResponsePayload.of(snapshot("1.20.4", 3)))
            .withServerId("lobby");
        assertFalse(facade.onResponse(crossed));

        assertTrue(facade.onResponse(
            survivalRequest.replyWith(MessageType.STATUS_RESPONSE, StatusResponsePayload.of(snapshot("1.21", 7)))
        ));
        assertTrue(survivalQuery.isDone());
        assertFalse(lobbyQuery.isDone());
        assertEquals(7, survivalQuery.join().value().onlinePlayers());

        assertTrue(facade.onResponse(
            lobbyRequest.replyWith(MessageType.STATUS_RESPONSE, StatusResponsePayload.of(snapshot("1.20.4", 3)))
        ));
        assertEquals("1.20.4", lobbyQuery.join().value().version());
        assertEquals(0, facade.pendingCount());
    }

    @Test
    void concurrentQueriesToOneServerAnsweredInReverseOrderReachTheirOwnWaiters() throws Exception {
        StatusQueryFacade facade = facade(Map.of());

        CompletableFuture<QueryResult<StatusSnapshot>> first = facade.queryStatusAsync("lobby");
        Message firstRequest = lastRequest(lobby);
        CompletableFuture<QueryResult<StatusSnapshot>> second = facade.queryStatusAsync("lobby");
        Message secondRequest = lastRequest(lobby);

        assertNotEquals(firstRequest.correlationId(), secondRequest.correlationId());
        assertEquals(2, facade.pendingCount());

        assertTrue(facade.onResponse(
            secondRequest.replyWith(MessageType.STATUS_RESPONSE, StatusResponsePayload.of(snapshot("second", 2)))
        ));
        assertTrue(second.isDone());
        assertFalse(first.isDone());

        assertTrue(facade.onResponse(
            firstRequest.replyWith(MessageType.STATUS_RESPONSE, StatusResponsePayload.of(snapshot("first", 1)))
        ));
        assertEquals("first", first.join().value().version());
        assertEquals(1, first.join().value().onlinePlayers());
        assertEquals("second", second.join().value().version());
        assertEquals(0, facade.pendingCount());
    }

    @Test
    void statusAndPlayerQueriesToOneServerAnsweredInReverseOrderStaySeparate() throws Exception {
        StatusQueryFacade facade = facade(Map.of());

        CompletableFuture<QueryResult<StatusSnapshot>> status = facade.queryStatusAsync("lobby");
        Message statusRequest = lastRequest(lobby);
        CompletableFuture<QueryResult<PlayerList>> players = facade.queryPlayersAsync("lobby");
        Message playersRequest = lastRequest(lobby);

        PlayerList list = new PlayerList(2, 20, List.of(PlayerInfo.named("Steve"), PlayerInfo.named("Alex")));
        assertTrue(facade.onResponse(playersRequest.replyWith(MessageType.STATUS_RESPONSE, StatusResponsePayload.of(list))));
        assertFalse(status.isDone());
        assertTrue(facade.onResponse(
            statusRequest.replyWith(MessageType.STATUS_RESPONSE, StatusResponsePayload.of(snapshot("1.21", 2)))
        ));

        assertEquals(List.of("Steve", "Alex"), List.of(
            players.join().value().players().get(0).name(),
            players.join().value().players().get(1).name()
        ));
        assertEquals("1.21", status.join().value().version());
        assertEquals(0, facade.pendingCount());
    }

    @Test
    void responseWithWrongQueryKindLeavesWaiterPending() throws Exception {
        StatusQueryFacade facade = facade(Map.of());

        CompletableFuture<QueryResult<PlayerList>> players = facade.queryPlayersAsync("lobby");
        Message request = lastRequest(lobby);

        assertFalse(facade.onResponse(
            request.replyWith(MessageType.STATUS_RESPONSE, StatusResponsePayload.of(snapshot("1.21", 1)))
        ));
        assertFalse(players.isDone());

        PlayerList list = new PlayerList(1, 20, List.of(PlayerInfo.named("Steve")));
        assertTrue(facade.onResponse(request.replyWith(MessageType.STATUS_RESPONSE, StatusResponsePayload.of(list))));
        assertEquals("Steve", players.join().value().players().get(0).name());
    }

    @Test
    void unansweredQueryTimesOutAndLateResponseIsDiscarded() throws Exception {
        StatusQueryFacade facade = facade(Map.of());

        CompletableFuture<QueryResult<StatusSnapshot>> query = facade.queryStatusAsync("lobby");
        Message request = lastRequest(lobby);
        scheduler.advance(TIMEOUT);

        assertTrue(query.isDone());
        assertEquals(QueryOutcome.TIMEOUT, query.join().outcome());
        assertEquals(0, facade.pendingCount());
        assertFalse(facade.onResponse(
            request.replyWith(MessageType.STATUS_RESPONSE, StatusResponsePayload.of(snapshot("1.21", 1)))
        ));
    }

    @Test
    void sweepRemovesOverdueWaiters() {
        StatusQueryFacade facade = facade(Map.of());
        CompletableFuture<QueryResult<StatusSnapshot>> query = facade.queryStatusAsync("lobby");

        clock.advance(TIMEOUT.plusSeconds(1));
        facade.sweep();

        assertEquals(QueryOutcome.TIMEOUT, query.join().outcome());
    }

    @Test
    void unknownAndDisconnectedServersFailFast() {
        StatusQueryFacade facade = facade(Map.of());

        assertEquals(QueryOutcome.SERVER_NOT_FOUND, facade.queryStatus("skyblock").outcome());
        assertEquals(QueryOutcome.SERVER_NOT_CONNECTED, facade.queryStatus("creative").outcome());
        assertEquals(0, facade.pendingCount());
    }

    @Test
    void fallbackAnswersWhenServerIsNotConnected() {
        StubFallback fallback = new StubFallback();
        StatusQueryFacade facade = facade(Map.of("creative", fallback));

        QueryResult<StatusSnapshot> status = facade.queryStatus("creative");
        QueryResult<PlayerList> players = facade.queryPlayers("creative");

        assertTrue(status.isOk());
        assertEquals("1.19.2", status.value().version());
        assertEquals(2, players.value().online());
        assertEquals(2, fallback.calls);
    }

    @Test
    void fallbackFailureIsReported() {
        StubFallback fallback = new StubFallback();
        fallback.failure = new IOException("HTTP 502");
        StatusQueryFacade facade = facade(Map.of("creative", fallback));

        QueryResult<StatusSnapshot> status = facade.queryStatus("creative");

        assertEquals(QueryOutcome.FAILED, status.outcome());
        assertEquals("HTTP 502", status.message());
    }

    @Test
    void closeFailsPendingQueries() {
        StatusQueryFacade facade = facade(Map.of());
        CompletableFuture<QueryResult<StatusSnapshot>> query = facade.queryStatusAsync("lobby");

        facade.close();

        assertEquals(QueryOutcome.FAILED, query.join().outcome());
        assertEquals(0, facade.pendingCount());
    }

    private StatusQueryFacade facade(Map<String, StatusFallback> fallbacks) {
        return new StatusQueryFacade(registry, router, fallbacks, scheduler, clock, TIMEOUT, Runnable::run);
    }

    private Message lastRequest(FakeTransport transport) throws Exception {
        List<String> frames = transport.sentOfType("STATUS_REQUEST");
        return codec.decode(frames.get(frames.size() - 1));
    }

    private static StatusSnapshot snapshot(String version, int online) {
        return new StatusSnapshot(true, version, online, 20, List.of(20.0d), null, List.of());
    }

    private static final class StubFallback implements StatusFallback {
        private IOException failure;
        private int calls;

        @Override
        public StatusSnapshot fetchStatus() throws IOException {
            calls++;
            if (failure != null) {
                throw failure;
            }
            return snapshot("1.19.2", 2);
        }

        @Override
        public PlayerList fetchPlayers() throws IOException {
            calls++;
            if (failure != null) {
                throw failure;
            }
            return new PlayerList(2, 20, List.of(PlayerInfo.named("Steve"), PlayerInfo.named("Alex")));
        }
    }
}
