package io.mcgateway.core.route;

import io.mcgateway.protocol.MessageType;
import java.util.Locale;

public enum ForwardEvent {
    CHAT,
    PLAYER_EVENT,
    SERVER_STATUS;

    static ForwardEvent of(MessageType type) {
        if (type == MessageType.CHAT) {
            return CHAT;
        }
        if (type == MessageType.PLAYER_EVENT) {
            return PLAYER_EVENT;
        }
        return null;
    }

    /**
     * Accepts the enum name in any case and the legacy names {@code join_leave} and {@code status}.
     */
    public static ForwardEvent parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Forward event must not be blank");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("JOIN_LEAVE")) {
            return PLAYER_EVENT;
        }
        if (normalized.equals("STATUS")) {
            return SERVER_STATUS;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException unknown) {
            throw new IllegalArgumentException("Unknown forward event: " + raw, unknown);
        }
    }
}
