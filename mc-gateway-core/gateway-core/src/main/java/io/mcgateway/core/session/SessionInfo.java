package io.mcgateway.core.session;

import java.time.Instant;

public record SessionInfo(
    String serverId,
    SessionState state,
    boolean dialed,
    Instant lastSeen,
    int queuedMessages,
    long droppedMessages,
    int reconnectAttempts
) {
}
