package io.mcgateway.protocol;

import java.util.Objects;

public record PlayerEventPayload(PlayerEventKind kind, String playerName, String playerUuid) implements Payload {
    public PlayerEventPayload {
        kind = Objects.requireNonNull(kind, "kind");
        playerName = Objects.requireNonNull(playerName, "playerName");
        playerUuid = Objects.requireNonNull(playerUuid, "playerUuid");
    }
}
