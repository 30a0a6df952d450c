package io.mcgateway.protocol;

public record EmptyPayload() implements Payload {
    public static final EmptyPayload INSTANCE = new EmptyPayload();
}
