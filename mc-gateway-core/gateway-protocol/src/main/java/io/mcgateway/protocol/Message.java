package io.mcgateway.protocol;

import java.util.Objects;
import java.util.UUID;

public record Message(
    MessageType type,
    String serverId,
    Payload payload,
    String correlationId,
    Long timestamp
) {
    public Message {
        type = Objects.requireNonNull(type, "type");
        payload = Objects.requireNonNull(payload, "payload");
        if (!type.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException(
                "Payload " + payload.getClass().getSimpleName() + " does not match message type " + type
            );
        }
    }

    public static Message of(MessageType type, String serverId, Payload payload) {
        return new Message(type, serverId, payload, null, null);
    }

    public static Message request(MessageType type, String serverId, Payload payload) {
        return new Message(type, serverId, payload, UUID.randomUUID().toString(), null);
    }

    public static Message control(MessageType type, String serverId) {
        return new Message(type, serverId, EmptyPayload.INSTANCE, null, null);
    }

    public Message withServerId(String newServerId) {
        return new Message(type, newServerId, payload, correlationId, timestamp);
    }

    public Message withTimestamp(long epochMillis) {
        return new Message(type, serverId, payload, correlationId, epochMillis);
    }

    public Message replyWith(MessageType replyType, Payload replyPayload) {
        return new Message(replyType, serverId, replyPayload, correlationId, null);
    }

    public <T extends Payload> T payloadAs(Class<T> expected) {
        if (!expected.isInstance(payload)) {
            throw new IllegalStateException(type + " does not carry " + expected.getSimpleName());
        }
        return expected.cast(payload);
    }

    public boolean hasCorrelationId() {
        return correlationId != null && !correlationId.isBlank();
    }
}
