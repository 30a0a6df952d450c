package io.mcgateway.server;

import io.mcgateway.core.session.GatewayTransport;
import io.mcgateway.core.session.ServerIdentity;
import io.mcgateway.core.session.SessionConnector;
import io.mcgateway.core.session.TransportHandler;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dials a game server that listens for the gateway. Credentials are sent afterwards in an AUTH frame by the session.
 */
public final class WebSocketDialer implements SessionConnector {
    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketDialer.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final URI url;
    private final Duration connectTimeout;

    public WebSocketDialer(URI url) {
        this(url, DEFAULT_CONNECT_TIMEOUT);
    }

    public WebSocketDialer(URI url, Duration connectTimeout) {
        this.url = Objects.requireNonNull(url, "url");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new IllegalArgumentException("connectTimeout must be > 0");
        }
    }

    @Override
    public GatewayTransport open(ServerIdentity identity, TransportHandler handler) throws IOException {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(handler, "handler");
        DialedTransport transport = new DialedTransport(url, identity.serverId(), handler);
        boolean connected;
        try {
            connected = transport.connectBlocking(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            transport.close();
            throw new InterruptedIOException("Interrupted while dialing " + url);
        }
        if (!connected) {
            transport.close();
            throw new IOException("Unable to connect to " + url + " within " + connectTimeout.toMillis() + "ms");
        }
        LOGGER.info("Dialed game server [serverId={}, url={}]", identity.serverId(), url);
        return transport;
    }

    static final class DialedTransport extends WebSocketClient implements GatewayTransport {
        private final String id;
        private final TransportHandler handler;

        DialedTransport(URI url, String serverId, TransportHandler handler) {
            super(url);
            this.id = serverId + "@" + url.getAuthority();
            this.handler = handler;
            setConnectionLostTimeout(0);
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
            LOGGER.debug("WebSocket opened [transport={}, status={}]", id, handshake.getHttpStatus());
        }

        @Override
        public void onMessage(String message) {
            handler.onFrame(this, message);
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            LOGGER.debug("WebSocket closed [transport={}, code={}, remote={}]", id, code, remote);
            handler.onClosed(this, code, reason);
        }

        @Override
        public void onError(Exception failure) {
            LOGGER.warn("WebSocket error [transport={}]", id, failure);
        }
    }
}
