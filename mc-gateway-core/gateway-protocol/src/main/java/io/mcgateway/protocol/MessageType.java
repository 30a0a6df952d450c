package io.mcgateway.protocol;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public enum MessageType {
    CHAT(ChatPayload.class),
    COMMAND(CommandPayload.class),
    COMMAND_RESULT(CommandResultPayload.class),
    STATUS_REQUEST(StatusRequestPayload.class),
    STATUS_RESPONSE(StatusResponsePayload.class),
    PLAYER_EVENT(PlayerEventPayload.class),
    BIND_CODE_ISSUED(BindCodeIssuedPayload.class),
    BIND_CONFIRM(BindConfirmPayload.class),
    BIND_RESULT(BindResultPayload.class),
    ERROR(ErrorPayload.class),
    PING(EmptyPayload.class),
    PONG(EmptyPayload.class),
    AUTH(AuthPayload.class),
    AUTH_REQUIRED(EmptyPayload.class),
    CONNECTION_ACK(ConnectionAckPayload.class),
    AUTH_FAILED(ErrorPayload.class);

    private static final Map<String, MessageType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (MessageType type : values()) {
            BY_WIRE_NAME.put(type.name(), type);
        }
        BY_WIRE_NAME.put("MESSAGE_FORWARD", CHAT);
        BY_WIRE_NAME.put("MESSAGE_INCOMING", CHAT);
        BY_WIRE_NAME.put("HEARTBEAT", PING);
        BY_WIRE_NAME.put("HEARTBEAT_ACK", PONG);
        BY_WIRE_NAME.put("BIND_CONFIRM_REQUEST", BIND_CONFIRM);
        BY_WIRE_NAME.put("BIND_CONFIRM_RESPONSE", BIND_RESULT);
        BY_WIRE_NAME.put("AUTH_SUCCESS", CONNECTION_ACK);
    }

    private final Class<? extends Payload> payloadType;

    MessageType(Class<? extends Payload> payloadType) {
        this.payloadType = payloadType;
    }

    public Class<? extends Payload> payloadType() {
        return payloadType;
    }

    public String wireName() {
        return name();
    }

    public boolean isControl() {
        return this == PING || this == PONG || this == AUTH || this == AUTH_REQUIRED
            || this == CONNECTION_ACK || this == AUTH_FAILED;
    }

    public static MessageType fromWire(String value) {
        Objects.requireNonNull(value, "value");
        MessageType type = BY_WIRE_NAME.get(value.trim().toUpperCase(Locale.ROOT));
        if (type == null) {
            throw new IllegalArgumentException("Unknown message type: " + value);
        }
        return type;
    }
}
