package io.mcgateway.core.binding;

import io.mcgateway.protocol.BindResultPayload;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

public final class BindingRequest {
    private final String code;
    private final String serverId;
    private final String playerUuid;
    private final String playerName;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private final AtomicReference<BindingStatus> status = new AtomicReference<>(BindingStatus.PENDING);
    private final CompletableFuture<BindResultPayload> serverResult = new CompletableFuture<>();

    private volatile Instant settledAt;
    private volatile String platform;
    private volatile String accountId;
    private volatile String correlationId;

    BindingRequest(String code, String serverId, String playerUuid, String playerName, Instant issuedAt, Instant expiresAt) {
        this.code = Objects.requireNonNull(code, "code");
        this.serverId = Objects.requireNonNull(serverId, "serverId");
        this.playerUuid = Objects.requireNonNull(playerUuid, "playerUuid");
        this.playerName = playerName;
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must be after issuedAt");
        }
    }

    public String code() {
        return code;
    }

    public String serverId() {
        return serverId;
    }

    public String playerUuid() {
        return playerUuid;
    }

    public String playerName() {
        return playerName;
    }

    public Instant issuedAt() {
        return issuedAt;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public BindingStatus status() {
        return status.get();
    }

    public Instant settledAt() {
        return settledAt;
    }

    public String platform() {
        return platform;
    }

    public String accountId() {
        return accountId;
    }

    String correlationId() {
        return correlationId;
    }

    CompletableFuture<BindResultPayload> serverResult() {
        return serverResult;
    }

    boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    boolean isLivePendingAt(Instant now) {
        return status.get() == BindingStatus.PENDING && !isExpiredAt(now);
    }

    /**
     * Leaves {@code expected} for {@code next}. Exactly one caller can win each transition.
     */
    boolean transition(BindingStatus expected, BindingStatus next, Instant at) {
        if (!status.compareAndSet(expected, next)) {
            return false;
        }
        settledAt = at;
        return true;
    }

    void confirmedBy(String confirmingPlatform, String confirmingAccountId, String confirmCorrelationId) {
        this.platform = confirmingPlatform;
        this.accountId = confirmingAccountId;
        this.correlationId = confirmCorrelationId;
    }

    BindingNotification notification() {
        return new BindingNotification(serverId, code, playerUuid, playerName, issuedAt, expiresAt);
    }

    @Override
    public String toString() {
        return "BindingRequest[code=" + code + ", serverId=" + serverId + ", playerUuid=" + playerUuid
            + ", status=" + status.get() + ", expiresAt=" + expiresAt + "]";
    }
}
