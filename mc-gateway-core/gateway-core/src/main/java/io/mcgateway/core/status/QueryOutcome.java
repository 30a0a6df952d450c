package io.mcgateway.core.status;

public enum QueryOutcome {
    OK,
    SERVER_NOT_FOUND,
    SERVER_NOT_CONNECTED,
    TIMEOUT,
    FAILED
}
