package io.mcgateway.core.session;

public interface TransportHandler {
    void onFrame(GatewayTransport transport, String frame);

    void onClosed(GatewayTransport transport, int code, String reason);
}
