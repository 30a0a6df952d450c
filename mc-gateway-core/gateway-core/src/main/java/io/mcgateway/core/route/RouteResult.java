package io.mcgateway.core.route;

public enum RouteResult {
    SENT,
    QUEUED,
    SERVER_NOT_FOUND,
    SERVER_NOT_CONNECTED;

    public boolean accepted() {
        return this == SENT || this == QUEUED;
    }
}
