package io.mcgateway.core.binding;

import java.time.Duration;
import java.util.Objects;

public record BindingSettings(Duration ttl, Duration sweepInterval, Duration retention, int codeLength) {
    public BindingSettings {
        ttl = Objects.requireNonNull(ttl, "ttl");
        sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
        retention = Objects.requireNonNull(retention, "retention");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        if (sweepInterval.isZero() || sweepInterval.isNegative()) {
            throw new IllegalArgumentException("sweepInterval must be > 0");
        }
        if (retention.isNegative()) {
            throw new IllegalArgumentException("retention must be >= 0");
        }
        if (codeLength < 4 || codeLength > 12) {
            throw new IllegalArgumentException("codeLength must be between 4 and 12");
        }
    }

    public static BindingSettings defaults() {
        return new BindingSettings(Duration.ofMinutes(5), Duration.ofSeconds(30), Duration.ofMinutes(10), 6);
    }
}
