package io.mcgateway.protocol;

import java.util.Objects;

public record CommandPayload(String command, String sender) implements Payload {
    public CommandPayload {
        command = Objects.requireNonNull(command, "command");
        if (command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
    }
}
