package io.mcgateway.protocol;

import java.util.List;
import java.util.Objects;

public record PlayerList(int online, int max, List<PlayerInfo> players) {
    public PlayerList {
        players = List.copyOf(Objects.requireNonNull(players, "players"));
        if (online < 0 || max < 0) {
            throw new IllegalArgumentException("player counts must be >= 0");
        }
    }
}
