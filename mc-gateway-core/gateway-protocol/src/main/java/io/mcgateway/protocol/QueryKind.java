package io.mcgateway.protocol;

import java.util.Locale;

public enum QueryKind {
    STATUS,
    PLAYERS;

    static QueryKind fromWire(String value) {
        if (value == null) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException unknown) {
            return null;
        }
    }
}
