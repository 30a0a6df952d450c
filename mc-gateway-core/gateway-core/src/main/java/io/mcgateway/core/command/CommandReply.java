package io.mcgateway.core.command;

import java.util.Objects;

public record CommandReply(boolean success, String serverId, String text) {
    public CommandReply {
        text = Objects.requireNonNull(text, "text");
    }

    static CommandReply ok(String serverId, String text) {
        return new CommandReply(true, serverId, text);
    }

    static CommandReply failed(String serverId, String text) {
        return new CommandReply(false, serverId, text);
    }
}
