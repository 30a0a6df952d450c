package io.mcgateway.core.route;

import io.mcgateway.protocol.Message;
import java.util.Objects;

/**
 * What a chat platform receives for one forwarded event. {@code message} is null for server status notices.
 */
public record Delivery(String serverId, ForwardEvent event, Message message, String text) {
    public Delivery {
        serverId = Objects.requireNonNull(serverId, "serverId");
        event = Objects.requireNonNull(event, "event");
        text = Objects.requireNonNull(text, "text");
    }
}
