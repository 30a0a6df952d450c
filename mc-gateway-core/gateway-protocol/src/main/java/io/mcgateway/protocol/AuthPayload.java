package io.mcgateway.protocol;

import java.util.Objects;

public record AuthPayload(String token) implements Payload {
    public AuthPayload {
        token = Objects.requireNonNull(token, "token");
    }

    @Override
    public String toString() {
        return "AuthPayload[token=***]";
    }
}
