package io.mcgateway.core.route;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Which chat-platform lines are relayed into the game. A blank prefix turns relaying off; an empty session set
 * accepts every origin.
 */
public record RelaySettings(String prefix, Set<ForwardTarget> sessions) {
    private static final RelaySettings DISABLED = new RelaySettings("", Set.of());

    public RelaySettings {
        prefix = prefix == null ? "" : prefix.trim();
        sessions = Set.copyOf(Objects.requireNonNull(sessions, "sessions"));
    }

    public static RelaySettings disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return !prefix.isEmpty();
    }

    public boolean allows(ForwardTarget origin) {
        return sessions.isEmpty() || sessions.contains(origin);
    }

    /**
     * The text after the prefix, or empty when the line does not carry the prefix or nothing follows it.
     */
    public Optional<String> strip(String text) {
        if (!isEnabled() || text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (!trimmed.startsWith(prefix)) {
            return Optional.empty();
        }
        String body = trimmed.substring(prefix.length()).trim();
        return body.isEmpty() ? Optional.empty() : Optional.of(body);
    }
}
