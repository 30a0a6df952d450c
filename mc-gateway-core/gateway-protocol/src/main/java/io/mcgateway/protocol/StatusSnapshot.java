package io.mcgateway.protocol;

import java.util.List;
import java.util.Objects;

public record StatusSnapshot(
    boolean online,
    String version,
    int onlinePlayers,
    int maxPlayers,
    List<Double> tps,
    MemoryUsage memory,
    List<String> players
) {
    public StatusSnapshot {
        version = version == null ? "unknown" : version;
        tps = List.copyOf(Objects.requireNonNull(tps, "tps"));
        players = List.copyOf(Objects.requireNonNull(players, "players"));
        if (onlinePlayers < 0 || maxPlayers < 0) {
            throw new IllegalArgumentException("player counts must be >= 0");
        }
    }

    public static StatusSnapshot offline() {
        return new StatusSnapshot(false, "unknown", 0, 0, List.of(), null, List.of());
    }
}
