package io.mcgateway.core.status;

import io.mcgateway.protocol.PlayerList;
import io.mcgateway.protocol.StatusSnapshot;
import java.io.IOException;

/**
 * Polling path used when a server has no connected session. Implementations block the calling thread.
 */
public interface StatusFallback {
    StatusSnapshot fetchStatus() throws IOException, InterruptedException;

    PlayerList fetchPlayers() throws IOException, InterruptedException;
}
