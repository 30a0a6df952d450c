package io.mcgateway.protocol;

import java.util.Objects;

public record ErrorPayload(String code, String message) implements Payload {
    public static final String AUTH_FAILED = "AUTH_FAILED";

    public ErrorPayload {
        message = Objects.requireNonNull(message, "message");
    }
}
