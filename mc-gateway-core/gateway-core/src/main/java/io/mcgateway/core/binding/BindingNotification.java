package io.mcgateway.core.binding;

import java.time.Instant;

public record BindingNotification(
    String serverId,
    String code,
    String playerUuid,
    String playerName,
    Instant issuedAt,
    Instant expiresAt
) {
    /**
     * Private-chat session id for the player, qualified by server so that two servers never collide.
     */
    public String privateSessionId() {
        return serverId + ":" + playerUuid;
    }
}
