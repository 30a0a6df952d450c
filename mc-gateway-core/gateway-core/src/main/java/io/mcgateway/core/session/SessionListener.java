package io.mcgateway.core.session;

import io.mcgateway.protocol.Message;

public interface SessionListener {
    void onInbound(Session session, Message message);

    void onStateChanged(Session session, SessionState previous, SessionState current, String reason);

    void onAuthenticationFailed(Session session, String reason);
}
