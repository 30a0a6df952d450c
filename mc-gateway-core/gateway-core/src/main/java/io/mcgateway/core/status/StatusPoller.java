package io.mcgateway.core.status;

import io.mcgateway.core.TaskScheduler;
import io.mcgateway.core.session.SessionInfo;
import io.mcgateway.core.session.SessionRegistry;
import io.mcgateway.core.session.SessionState;
import io.mcgateway.protocol.StatusSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks every connected server for its status on a fixed interval and keeps the latest answer per server.
 */
public final class StatusPoller implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(StatusPoller.class);

    private final ConcurrentHashMap<String, PolledStatus> latest = new ConcurrentHashMap<>();
    private final SessionRegistry registry;
    private final StatusQueryFacade queries;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration interval;

    private TaskScheduler.ScheduledTask pollTask;

    /**
     * @param interval time between polls; zero disables polling
     */
    public StatusPoller(
        SessionRegistry registry,
        StatusQueryFacade queries,
        TaskScheduler scheduler,
        Clock clock,
        Duration interval
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.queries = Objects.requireNonNull(queries, "queries");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must be >= 0");
        }
    }

    public synchronized void start() {
        if (interval.isZero()) {
            LOGGER.info("Status polling disabled");
            return;
        }
        if (pollTask == null) {
            pollTask = scheduler.scheduleAtFixedRate(this::poll, interval, interval);
            LOGGER.info("Status polling started [intervalMs={}]", interval.toMillis());
        }
    }

    /**
     * Sends one status query to each connected server. Answers arrive asynchronously.
     *
     * @return number of servers queried
     */
    public int poll() {
        int queried = 0;
        for (SessionInfo info : registry.list()) {
            if (info.state() != SessionState.CONNECTED) {
                continue;
            }
            String serverId = info.serverId();
            queries.queryStatusAsync(serverId).whenComplete((result, failure) -> record(serverId, result, failure));
            queried++;
        }
        LOGGER.debug("Status poll sent [servers={}]", queried);
        return queried;
    }

    public Optional<PolledStatus> latest(String serverId) {
        return serverId == null ? Optional.empty() : Optional.ofNullable(latest.get(serverId));
    }

    public Map<String, PolledStatus> snapshot() {
        return Map.copyOf(latest);
    }

    @Override
    public synchronized void close() {
        if (pollTask != null) {
            pollTask.cancel();
            pollTask = null;
        }
    }

    private void record(String serverId, QueryResult<StatusSnapshot> result, Throwable failure) {
        if (failure != null) {
            LOGGER.warn("Status poll failed [serverId={}]", serverId, failure);
            return;
        }
        if (!result.isOk()) {
            LOGGER.debug("Status poll unanswered [serverId={}, outcome={}, message={}]", serverId, result.outcome(), result.message());
            return;
        }
        latest.put(serverId, new PolledStatus(serverId, result.value(), clock.instant()));
    }

    public record PolledStatus(String serverId, StatusSnapshot status, Instant polledAt) {
        public PolledStatus {
            serverId = Objects.requireNonNull(serverId, "serverId");
            status = Objects.requireNonNull(status, "status");
            polledAt = Objects.requireNonNull(polledAt, "polledAt");
        }
    }
}
