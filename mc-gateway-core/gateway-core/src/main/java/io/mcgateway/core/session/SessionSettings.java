package io.mcgateway.core.session;

import java.time.Duration;
import java.util.Objects;

public record SessionSettings(
    Duration heartbeatInterval,
    Duration heartbeatTimeout,
    ReconnectPolicy reconnectPolicy,
    int queueCapacity,
    int maxInitialAttempts
) {
    public SessionSettings {
        heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        heartbeatTimeout = Objects.requireNonNull(heartbeatTimeout, "heartbeatTimeout");
        reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must be > 0");
        }
        if (heartbeatTimeout.compareTo(heartbeatInterval) <= 0) {
            throw new IllegalArgumentException("heartbeatTimeout must be greater than heartbeatInterval");
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0");
        }
        if (maxInitialAttempts <= 0) {
            throw new IllegalArgumentException("maxInitialAttempts must be > 0");
        }
    }

    public static SessionSettings defaults() {
        return new SessionSettings(Duration.ofSeconds(5), Duration.ofSeconds(15), ReconnectPolicy.defaults(), 256, 3);
    }
}
