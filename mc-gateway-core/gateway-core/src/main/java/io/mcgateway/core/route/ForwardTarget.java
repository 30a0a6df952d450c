package io.mcgateway.core.route;

import java.util.Objects;

/**
 * Chat-platform destination written as {@code platform:message_type:session_id}. The session id may itself
 * contain colons.
 */
public record ForwardTarget(String platform, String messageType, String sessionId) {
    public ForwardTarget {
        platform = requireText(platform, "platform");
        messageType = requireText(messageType, "messageType");
        sessionId = requireText(sessionId, "sessionId");
    }

    public static ForwardTarget parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        String[] parts = raw.trim().split(":", 3);
        if (parts.length != 3) {
            throw new IllegalArgumentException(
                "Forward target must look like platform:message_type:session_id but was '" + raw + "'"
            );
        }
        return new ForwardTarget(parts[0], parts[1], parts[2]);
    }

    public String asString() {
        return platform + ":" + messageType + ":" + sessionId;
    }

    @Override
    public String toString() {
        return asString();
    }

    private static String requireText(String value, String fieldName) {
        Objects.requireNonNull(value, fieldName);
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return trimmed;
    }
}
