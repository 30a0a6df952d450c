package io.mcgateway.core.session;

public enum DuplicatePolicy {
    /** Close the active connection and keep the newcomer. */
    SUPERSEDE,
    /** Keep the active connection and close the newcomer. */
    REJECT
}
