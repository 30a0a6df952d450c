package io.mcgateway.core.binding;

import io.mcgateway.core.ChatPlatform;
import io.mcgateway.core.TaskScheduler;
import io.mcgateway.core.route.RouteResult;
import io.mcgateway.core.route.Router;
import io.mcgateway.core.session.DeliveryMode;
import io.mcgateway.protocol.BindConfirmPayload;
import io.mcgateway.protocol.BindResultPayload;
import io.mcgateway.protocol.Message;
import io.mcgateway.protocol.MessageType;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and confirms short-lived binding codes between a game player and a chat-platform account.
 *
 * <p>Codes are unique among live pending requests across all servers, so a confirmation needs only the code.
 * A request leaves {@code PENDING} through compare-and-set; concurrent confirmations of one code produce exactly
 * one {@link BindingOutcome#BOUND}. Settled requests stay visible for the retention period so that late callers get
 * {@code CODE_EXPIRED} or {@code ALREADY_CONFIRMED} rather than {@code CODE_NOT_FOUND}.
 */
public final class BindingCoordinator implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(BindingCoordinator.class);
    private static final int MAX_CODE_ATTEMPTS = 32;

    private final ConcurrentHashMap<String, BindingRequest> byCode = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, BindingRequest> byCorrelation = new ConcurrentHashMap<>();
    private final Router router;
    private final ChatPlatform platform;
    private final BindingSettings settings;
    private final BindingCodeGenerator codeGenerator;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private TaskScheduler.ScheduledTask sweepTask;

    public BindingCoordinator(
        Router router,
        ChatPlatform platform,
        BindingSettings settings,
        BindingCodeGenerator codeGenerator,
        TaskScheduler scheduler,
        Clock clock
    ) {
        this.router = Objects.requireNonNull(router, "router");
        this.platform = Objects.requireNonNull(platform, "platform");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.codeGenerator = Objects.requireNonNull(codeGenerator, "codeGenerator");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void start() {
        if (sweepTask == null) {
            sweepTask = scheduler.scheduleAtFixedRate(this::sweep, settings.sweepInterval(), settings.sweepInterval());
        }
    }

    /**
     * Generates a fresh code for a player. Earlier codes for the same player stay valid until they expire.
     */
    public BindingRequest issue(String serverId, String playerUuid, String playerName) {
        Objects.requireNonNull(serverId, "serverId");
        Objects.requireNonNull(playerUuid, "playerUuid");
        Instant now = clock.instant();
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String code = codeGenerator.nextCode(settings.codeLength());
            BindingRequest request = new BindingRequest(code, serverId, playerUuid, playerName, now, now.plus(settings.ttl()));
            if (claim(request, now)) {
                LOGGER.info("Issued binding code [serverId={}, playerUuid={}, expiresAt={}]", serverId, playerUuid, request.expiresAt());
                notifyIssued(request);
                return request;
            }
        }
        throw new IllegalStateException("Unable to allocate a unique binding code after " + MAX_CODE_ATTEMPTS + " attempts");
    }

    /**
     * Records a code that the game server generated itself. A code held by a different live pending request or by a
     * confirmed request awaiting its BIND_RESULT is refused; the same player re-announcing a pending code replaces the
     * previous request. Expired and cancelled holders are displaced.
     */
    public Optional<BindingRequest> register(
        String serverId,
        String code,
        String playerUuid,
        String playerName,
        Instant expiresAt
    ) {
        Objects.requireNonNull(serverId, "serverId");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(playerUuid, "playerUuid");
        Instant now = clock.instant();
        Instant expiry = expiresAt == null || !expiresAt.isAfter(now) ? now.plus(settings.ttl()) : expiresAt;
        BindingRequest request = new BindingRequest(code.trim(), serverId, playerUuid, playerName, now, expiry);

        AtomicReference<BindingRequest> displaced = new AtomicReference<>();
        BindingRequest stored = byCode.compute(request.code(), (key, existing) -> {
            if (existing == null) {
                return request;
            }
            if (isReplaceable(existing, now)) {
                displaced.set(existing);
                return request;
            }
            if (existing.serverId().equals(serverId)
                && existing.playerUuid().equals(playerUuid)
                && existing.transition(BindingStatus.PENDING, BindingStatus.CANCELLED, now)) {
                displaced.set(existing);
                return request;
            }
            return existing;
        });
        if (stored != request) {
            LOGGER.warn(
                "Refusing binding code still in use [serverId={}, playerUuid={}, holderServerId={}, holderStatus={}]",
                serverId,
                playerUuid,
                stored.serverId(),
                stored.status()
            );
            return Optional.empty();
        }
        retire(displaced.get(), now);
        LOGGER.info("Registered binding code [serverId={}, playerUuid={}, expiresAt={}]", serverId, playerUuid, expiry);
        notifyIssued(request);
        return Optional.of(request);
    }

    public BindingConfirmation confirm(String code, String confirmingPlatform, String accountId) {
        Objects.requireNonNull(confirmingPlatform, "confirmingPlatform");
        Objects.requireNonNull(accountId, "accountId");
        String normalized = code == null ? "" : code.trim();
        BindingRequest request = byCode.get(normalized);
        if (request == null) {
            return BindingConfirmation.rejected(BindingOutcome.CODE_NOT_FOUND, normalized);
        }

        Instant now = clock.instant();
        if (request.status() == BindingStatus.PENDING && request.isExpiredAt(now)) {
            request.transition(BindingStatus.PENDING, BindingStatus.EXPIRED, now);
        }
        if (!request.transition(BindingStatus.PENDING, BindingStatus.CONFIRMED, now)) {
            BindingOutcome outcome = rejectionFor(request.status());
            LOGGER.info("Binding confirmation rejected [serverId={}, outcome={}]", request.serverId(), outcome);
            return BindingConfirmation.rejected(outcome, normalized);
        }

        Message confirmMessage = Message.request(
            MessageType.BIND_CONFIRM,
            request.serverId(),
            new BindConfirmPayload(confirmingPlatform, request.code(), accountId)
        );
        request.confirmedBy(confirmingPlatform, accountId, confirmMessage.correlationId());
        byCorrelation.put(confirmMessage.correlationId(), request);

        RouteResult delivery = router.routeOutbound(request.serverId(), confirmMessage, DeliveryMode.QUEUED);
        if (!delivery.accepted()) {
            byCorrelation.remove(confirmMessage.correlationId(), request);
            request.serverResult().completeExceptionally(
                new IllegalStateException("server not connected: " + request.serverId())
            );
            LOGGER.warn("Binding confirmed but BIND_CONFIRM not routable [serverId={}, delivery={}]", request.serverId(), delivery);
        } else {
            LOGGER.info(
                "Binding confirmed [serverId={}, playerUuid={}, platform={}, delivery={}]",
                request.serverId(),
                request.playerUuid(),
                confirmingPlatform,
                delivery
            );
        }
        return new BindingConfirmation(BindingOutcome.BOUND, request.code(), request, delivery, request.serverResult());
    }

    public boolean cancel(String code) {
        BindingRequest request = code == null ? null : byCode.get(code.trim());
        if (request == null) {
            return false;
        }
        boolean cancelled = request.transition(BindingStatus.PENDING, BindingStatus.CANCELLED, clock.instant());
        if (cancelled) {
            LOGGER.info("Binding code cancelled [serverId={}, playerUuid={}]", request.serverId(), request.playerUuid());
        }
        return cancelled;
    }

    /**
     * Cancels every live pending code of one player, used when the server forces a fresh code.
     */
    public int cancelPending(String serverId, String playerUuid) {
        Instant now = clock.instant();
        int cancelled = 0;
        for (BindingRequest request : byCode.values()) {
            if (request.serverId().equals(serverId)
                && request.playerUuid().equals(playerUuid)
                && request.isLivePendingAt(now)
                && request.transition(BindingStatus.PENDING, BindingStatus.CANCELLED, now)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            LOGGER.info("Cancelled pending binding codes [serverId={}, playerUuid={}, count={}]", serverId, playerUuid, cancelled);
        }
        return cancelled;
    }

    /**
     * Settles a confirmed request with the game server's BIND_RESULT and evicts it.
     *
     * @return false when the result matches no confirmed request
     */
    public boolean acknowledge(Message bindResult) {
        Objects.requireNonNull(bindResult, "bindResult");
        BindResultPayload payload = bindResult.payloadAs(BindResultPayload.class);
        BindingRequest request = bindResult.hasCorrelationId() ? byCorrelation.get(bindResult.correlationId()) : null;
        if (request == null && payload.code() != null) {
            BindingRequest candidate = byCode.get(payload.code());
            if (candidate != null && candidate.status() == BindingStatus.CONFIRMED) {
                request = candidate;
            }
        }
        if (request == null || !request.serverId().equals(bindResult.serverId())) {
            LOGGER.warn(
                "Discarding unmatched BIND_RESULT [serverId={}, correlationId={}]",
                bindResult.serverId(),
                bindResult.correlationId()
            );
            return false;
        }

        evict(request);
        request.serverResult().complete(payload);
        BindingSettlement settlement = new BindingSettlement(
            request.serverId(),
            request.code(),
            request.playerUuid(),
            request.platform(),
            request.accountId(),
            payload.success(),
            payload.message()
        );
        try {
            platform.onBindingResult(settlement);
        } catch (RuntimeException failure) {
            LOGGER.warn("Chat platform rejected binding result [serverId={}]", request.serverId(), failure);
        }
        return true;
    }

    public Optional<BindingRequest> lookup(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byCode.get(code.trim()));
    }

    public int pendingCount() {
        Instant now = clock.instant();
        int count = 0;
        for (BindingRequest request : byCode.values()) {
            if (request.isLivePendingAt(now)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Expires overdue pending requests and evicts settled requests older than the retention period.
     */
    public void sweep() {
        Instant now = clock.instant();
        List<BindingRequest> evictions = new ArrayList<>();
        for (BindingRequest request : byCode.values()) {
            if (request.status() == BindingStatus.PENDING && request.isExpiredAt(now)) {
                if (request.transition(BindingStatus.PENDING, BindingStatus.EXPIRED, now)) {
                    LOGGER.debug("Binding code expired [serverId={}, playerUuid={}]", request.serverId(), request.playerUuid());
                }
            }
            Instant settledAt = request.settledAt();
            if (request.status() != BindingStatus.PENDING
                && settledAt != null
                && !now.isBefore(settledAt.plus(settings.retention()))) {
                evictions.add(request);
            }
        }
        for (BindingRequest request : evictions) {
            evict(request);
            request.serverResult().completeExceptionally(
                new TimeoutException("No BIND_RESULT from " + request.serverId() + " for code " + request.code())
            );
        }
        if (!evictions.isEmpty()) {
            LOGGER.debug("Evicted settled binding requests [count={}]", evictions.size());
        }
    }

    @Override
    public synchronized void close() {
        if (sweepTask != null) {
            sweepTask.cancel();
            sweepTask = null;
        }
    }

    private boolean claim(BindingRequest request, Instant now) {
        AtomicReference<BindingRequest> displaced = new AtomicReference<>();
        BindingRequest stored = byCode.compute(request.code(), (key, existing) -> {
            if (existing == null) {
                return request;
            }
            if (isReplaceable(existing, now)) {
                displaced.set(existing);
                return request;
            }
            return existing;
        });
        retire(displaced.get(), now);
        return stored == request;
    }

    /**
     * A confirmed request holds its code until the server answers or retention evicts it.
     */
    private static boolean isReplaceable(BindingRequest existing, Instant now) {
        switch (existing.status()) {
            case EXPIRED:
            case CANCELLED:
                return true;
            case PENDING:
                return existing.isExpiredAt(now);
            default:
                return false;
        }
    }

    private void retire(BindingRequest displaced, Instant now) {
        if (displaced == null) {
            return;
        }
        displaced.transition(BindingStatus.PENDING, BindingStatus.EXPIRED, now);
        String correlationId = displaced.correlationId();
        if (correlationId != null) {
            byCorrelation.remove(correlationId, displaced);
        }
        displaced.serverResult().completeExceptionally(
            new IllegalStateException("Binding code " + displaced.code() + " was reused")
        );
    }

    private void evict(BindingRequest request) {
        byCode.remove(request.code(), request);
        String correlationId = request.correlationId();
        if (correlationId != null) {
            byCorrelation.remove(correlationId, request);
        }
    }

    private void notifyIssued(BindingRequest request) {
        try {
            platform.notifyBinding(request.notification());
        } catch (RuntimeException failure) {
            LOGGER.warn("Chat platform rejected binding notification [serverId={}]", request.serverId(), failure);
        }
    }

    private static BindingOutcome rejectionFor(BindingStatus status) {
        switch (status) {
            case CONFIRMED:
                return BindingOutcome.ALREADY_CONFIRMED;
            case EXPIRED:
                return BindingOutcome.CODE_EXPIRED;
            default:
                return BindingOutcome.CODE_NOT_FOUND;
        }
    }
}
