package io.mcgateway.core.session;

/**
 * One open duplex text channel to a game server. Implementations deliver inbound frames and the close event to a
 * {@link TransportHandler}.
 */
public interface GatewayTransport {
    String id();

    void send(String frame);

    void close(int code, String reason);

    boolean isOpen();
}
