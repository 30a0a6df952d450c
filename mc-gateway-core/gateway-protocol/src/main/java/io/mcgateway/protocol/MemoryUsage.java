package io.mcgateway.protocol;

public record MemoryUsage(long usedMb, long maxMb) {
    public MemoryUsage {
        if (usedMb < 0 || maxMb < 0) {
            throw new IllegalArgumentException("memory figures must be >= 0");
        }
    }

    public double usagePercent() {
        if (maxMb == 0) {
            return 0.0d;
        }
        return usedMb * 100.0d / maxMb;
    }
}
