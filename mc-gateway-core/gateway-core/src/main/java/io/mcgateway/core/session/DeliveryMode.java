package io.mcgateway.core.session;

public enum DeliveryMode {
    /** Queue in any non-connected state and deliver once the session is next connected. */
    QUEUED,
    /** Deliver now; queue only while the session is recovering from a lost connection. */
    PROMPT
}
