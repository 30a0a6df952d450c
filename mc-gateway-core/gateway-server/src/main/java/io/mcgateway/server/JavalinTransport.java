package io.mcgateway.server;

import io.javalin.websocket.WsContext;
import io.mcgateway.core.session.GatewayTransport;
import io.mcgateway.core.session.TransportHandler;
import java.util.Objects;

/**
 * Listener-side transport over one Jetty WebSocket session accepted by {@link GatewayServer}.
 */
final class JavalinTransport implements GatewayTransport {
    private final WsContext ctx;
    private volatile TransportHandler handler;

    JavalinTransport(WsContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    void bind(TransportHandler transportHandler) {
        this.handler = Objects.requireNonNull(transportHandler, "transportHandler");
    }

    void deliverFrame(String frame) {
        TransportHandler current = handler;
        if (current != null) {
            current.onFrame(this, frame);
        }
    }

    void deliverClose(int code, String reason) {
        TransportHandler current = handler;
        if (current != null) {
            current.onClosed(this, code, reason);
        }
    }

    @Override
    public String id() {
        return ctx.sessionId();
    }

    @Override
    public void send(String frame) {
        if (!isOpen()) {
            throw new IllegalStateException("WebSocket session " + id() + " is closed");
        }
        ctx.send(frame);
    }

    @Override
    public void close(int code, String reason) {
        if (isOpen()) {
            ctx.closeSession(code, reason);
        }
    }

    @Override
    public boolean isOpen() {
        return ctx.session.isOpen();
    }
}
