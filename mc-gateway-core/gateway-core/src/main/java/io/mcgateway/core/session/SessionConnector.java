package io.mcgateway.core.session;

import java.io.IOException;

@FunctionalInterface
public interface SessionConnector {
    /**
     * Opens a transport to the game server, blocking until the channel is open. Authentication happens afterwards
     * over the returned transport.
     */
    GatewayTransport open(ServerIdentity identity, TransportHandler handler) throws IOException;
}
