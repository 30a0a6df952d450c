package io.mcgateway.protocol;

import java.util.Locale;

public enum PlayerEventKind {
    JOIN,
    LEAVE;

    static PlayerEventKind fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("JOINED".equals(normalized) || "PLAYER_JOIN".equals(normalized)) {
            return JOIN;
        }
        if ("QUIT".equals(normalized) || "LEFT".equals(normalized) || "PLAYER_LEAVE".equals(normalized)) {
            return LEAVE;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException unknown) {
            return null;
        }
    }
}
