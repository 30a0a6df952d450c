package io.mcgateway.protocol;

import java.util.Objects;

public record PlayerInfo(
    String name,
    String uuid,
    Double health,
    Double maxHealth,
    Integer level,
    String gameMode,
    String world,
    Integer ping
) {
    public PlayerInfo {
        name = Objects.requireNonNull(name, "name");
    }

    public static PlayerInfo named(String name) {
        return new PlayerInfo(name, null, null, null, null, null, null, null);
    }
}
