package io.mcgateway.core.session;

public enum SendResult {
    SENT,
    QUEUED,
    NOT_CONNECTED
}
