package io.mcgateway.core.session;

public enum SessionState {
    CONNECTING,
    AUTHENTICATING,
    CONNECTED,
    RECONNECTING,
    CLOSED
}
