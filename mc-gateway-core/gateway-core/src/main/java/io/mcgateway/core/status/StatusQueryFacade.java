package io.mcgateway.core.status;

import io.mcgateway.core.TaskScheduler;
import io.mcgateway.core.route.RouteResult;
import io.mcgateway.core.route.Router;
import io.mcgateway.core.session.DeliveryMode;
import io.mcgateway.core.session.Session;
import io.mcgateway.core.session.SessionRegistry;
import io.mcgateway.protocol.Message;
import io.mcgateway.protocol.MessageType;
import io.mcgateway.protocol.PlayerList;
import io.mcgateway.protocol.QueryKind;
import io.mcgateway.protocol.StatusRequestPayload;
import io.mcgateway.protocol.StatusResponsePayload;
import io.mcgateway.protocol.StatusSnapshot;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Correlated STATUS_REQUEST/STATUS_RESPONSE over the live session, with an optional HTTP fallback per server.
 *
 * <p>Every request registers a fresh correlation id before it is sent. A response completes a waiter only when its
 * correlation id, server id and query kind all match.
 */
public final class StatusQueryFacade implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(StatusQueryFacade.class);

    private final ConcurrentHashMap<String, PendingQuery> pending = new ConcurrentHashMap<>();
    private final SessionRegistry registry;
    private final Router router;
    private final Map<String, StatusFallback> fallbacks;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration timeout;
    private final Executor fallbackExecutor;

    public StatusQueryFacade(
        SessionRegistry registry,
        Router router,
        Map<String, StatusFallback> fallbacks,
        TaskScheduler scheduler,
        Clock clock,
        Duration timeout
    ) {
        this(registry, router, fallbacks, scheduler, clock, timeout, ForkJoinPool.commonPool());
    }

    public StatusQueryFacade(
        SessionRegistry registry,
        Router router,
        Map<String, StatusFallback> fallbacks,
        TaskScheduler scheduler,
        Clock clock,
        Duration timeout,
        Executor fallbackExecutor
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.router = Objects.requireNonNull(router, "router");
        this.fallbacks = Map.copyOf(Objects.requireNonNull(fallbacks, "fallbacks"));
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.fallbackExecutor = Objects.requireNonNull(fallbackExecutor, "fallbackExecutor");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
    }

    public QueryResult<StatusSnapshot> queryStatus(String serverId) {
        return queryStatusAsync(serverId).join();
    }

    public QueryResult<PlayerList> queryPlayers(String serverId) {
        return queryPlayersAsync(serverId).join();
    }

    public CompletableFuture<QueryResult<StatusSnapshot>> queryStatusAsync(String serverId) {
        return query(serverId, QueryKind.STATUS).thenApply(result -> {
            if (!result.isOk()) {
                return QueryResult.<StatusSnapshot>failed(result.outcome(), result.message());
            }
            return QueryResult.ok(result.value().status());
        });
    }

    public CompletableFuture<QueryResult<PlayerList>> queryPlayersAsync(String serverId) {
        return query(serverId, QueryKind.PLAYERS).thenApply(result -> {
            if (!result.isOk()) {
                return QueryResult.<PlayerList>failed(result.outcome(), result.message());
            }
            return QueryResult.ok(result.value().players());
        });
    }

    /**
     * Completes the waiter registered under the response's correlation id.
     *
     * @return false when the response was stale or did not match its request
     */
    public boolean onResponse(Message response) {
        Objects.requireNonNull(response, "response");
        if (response.type() != MessageType.STATUS_RESPONSE || !response.hasCorrelationId()) {
            LOGGER.warn("Discarding uncorrelated status response [serverId={}, type={}]", response.serverId(), response.type());
            return false;
        }
        PendingQuery waiter = pending.get(response.correlationId());
        StatusResponsePayload payload = response.payloadAs(StatusResponsePayload.class);
        if (waiter == null) {
            LOGGER.warn(
                "Discarding stale status response [serverId={}, correlationId={}]",
                response.serverId(),
                response.correlationId()
            );
            return false;
        }
        if (!waiter.serverId.equals(response.serverId()) || waiter.kind != payload.query()) {
            LOGGER.warn(
                "Discarding mismatched status response [serverId={}, expectedServerId={}, query={}, expectedQuery={}]",
                response.serverId(),
                waiter.serverId,
                payload.query(),
                waiter.kind
            );
            return false;
        }
        if (!pending.remove(response.correlationId(), waiter)) {
            return false;
        }
        return waiter.future.complete(QueryResult.ok(payload));
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Removes waiters past their deadline whose timeout task never ran.
     */
    public void sweep() {
        Instant now = clock.instant();
        for (Map.Entry<String, PendingQuery> entry : pending.entrySet()) {
            PendingQuery waiter = entry.getValue();
            if (!now.isBefore(waiter.deadline)) {
                expire(entry.getKey(), waiter);
            }
        }
    }

    @Override
    public void close() {
        List<String> ids = new ArrayList<>(pending.keySet());
        for (String correlationId : ids) {
            PendingQuery waiter = pending.remove(correlationId);
            if (waiter != null) {
                waiter.future.complete(QueryResult.failed(QueryOutcome.FAILED, "gateway closed"));
            }
        }
    }

    private CompletableFuture<QueryResult<StatusResponsePayload>> query(String serverId, QueryKind kind) {
        Objects.requireNonNull(serverId, "serverId");
        Optional<Session> session = registry.lookup(serverId);
        if (session.isEmpty() || !session.get().isConnected()) {
            StatusFallback fallback = fallbacks.get(serverId);
            if (fallback != null) {
                return viaFallback(serverId, kind, fallback);
            }
            if (session.isEmpty() && !registry.knownServerIds().contains(serverId)) {
                return CompletableFuture.completedFuture(
                    QueryResult.failed(QueryOutcome.SERVER_NOT_FOUND, "server not found: " + serverId)
                );
            }
            return CompletableFuture.completedFuture(
                QueryResult.failed(QueryOutcome.SERVER_NOT_CONNECTED, "server not connected: " + serverId)
            );
        }

        Message request = Message.request(MessageType.STATUS_REQUEST, serverId, new StatusRequestPayload(kind));
        String correlationId = request.correlationId();
        PendingQuery waiter = new PendingQuery(serverId, kind, clock.instant().plus(timeout));
        pending.put(correlationId, waiter);
        TaskScheduler.ScheduledTask timeoutTask = scheduler.schedule(() -> expire(correlationId, waiter), timeout);
        waiter.future.whenComplete((ignored, failure) -> timeoutTask.cancel());

        RouteResult routed = router.routeOutbound(serverId, request, DeliveryMode.PROMPT);
        if (!routed.accepted()) {
            if (pending.remove(correlationId, waiter)) {
                waiter.future.complete(
                    routed == RouteResult.SERVER_NOT_FOUND
                        ? QueryResult.failed(QueryOutcome.SERVER_NOT_FOUND, "server not found: " + serverId)
                        : QueryResult.failed(QueryOutcome.SERVER_NOT_CONNECTED, "server not connected: " + serverId)
                );
            }
        } else {
            LOGGER.debug("Status query sent [serverId={}, query={}, correlationId={}]", serverId, kind, correlationId);
        }
        return waiter.future;
    }

    private CompletableFuture<QueryResult<StatusResponsePayload>> viaFallback(
        String serverId,
        QueryKind kind,
        StatusFallback fallback
    ) {
        LOGGER.debug("Using HTTP fallback for status query [serverId={}, query={}]", serverId, kind);
        return CompletableFuture.supplyAsync(() -> {
            try {
                StatusResponsePayload payload = kind == QueryKind.STATUS
                    ? StatusResponsePayload.of(fallback.fetchStatus())
                    : StatusResponsePayload.of(fallback.fetchPlayers());
                return QueryResult.ok(payload);
            } catch (IOException | RuntimeException failure) {
                LOGGER.warn("HTTP fallback failed [serverId={}, query={}]", serverId, kind, failure);
                return QueryResult.<StatusResponsePayload>failed(QueryOutcome.FAILED, failure.getMessage());
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                throw new CompletionException(interrupted);
            }
        }, fallbackExecutor).exceptionally(failure ->
            QueryResult.failed(QueryOutcome.FAILED, "fallback interrupted")
        );
    }

    private void expire(String correlationId, PendingQuery waiter) {
        if (pending.remove(correlationId, waiter)) {
            LOGGER.warn(
                "Status query timed out [serverId={}, query={}, correlationId={}]",
                waiter.serverId,
                waiter.kind,
                correlationId
            );
            waiter.future.complete(
                QueryResult.failed(QueryOutcome.TIMEOUT, "no response from " + waiter.serverId + " within " + timeout.toMillis() + "ms")
            );
        }
    }

    private static final class PendingQuery {
        private final String serverId;
        private final QueryKind kind;
        private final Instant deadline;
        private final CompletableFuture<QueryResult<StatusResponsePayload>> future = new CompletableFuture<>();

        private PendingQuery(String serverId, QueryKind kind, Instant deadline) {
            this.serverId = serverId;
            this.kind = kind;
            this.deadline = deadline;
        }
    }
}
