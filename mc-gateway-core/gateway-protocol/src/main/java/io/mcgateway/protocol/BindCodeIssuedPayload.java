package io.mcgateway.protocol;

import java.util.Objects;

/**
 * Binding code announced by a game server. {@code expiresAt} is epoch milliseconds and optional; when absent
 * the gateway applies its own TTL.
 */
public record BindCodeIssuedPayload(
    String code,
    String playerUuid,
    String playerName,
    Long expiresAt,
    boolean force
) implements Payload {
    public BindCodeIssuedPayload {
        code = Objects.requireNonNull(code, "code");
        playerUuid = Objects.requireNonNull(playerUuid, "playerUuid");
    }
}
