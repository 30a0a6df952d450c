package io.mcgateway.core.session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;

public record ServerIdentity(String serverId, String token) {
    public ServerIdentity {
        serverId = Objects.requireNonNull(serverId, "serverId").trim();
        token = Objects.requireNonNull(token, "token");
        if (serverId.isEmpty()) {
            throw new IllegalArgumentException("serverId must not be blank");
        }
        if (token.isBlank()) {
            throw new IllegalArgumentException("token must not be blank for server " + serverId);
        }
    }

    public boolean matches(String presentedToken) {
        if (presentedToken == null) {
            return false;
        }
        return MessageDigest.isEqual(
            token.getBytes(StandardCharsets.UTF_8),
            presentedToken.getBytes(StandardCharsets.UTF_8)
        );
    }

    public String maskedToken() {
        if (token.length() <= 4) {
            return "****";
        }
        return token.substring(0, 2) + "****" + token.substring(token.length() - 2);
    }

    @Override
    public String toString() {
        return "ServerIdentity[serverId=" + serverId + ", token=" + maskedToken() + "]";
    }
}
