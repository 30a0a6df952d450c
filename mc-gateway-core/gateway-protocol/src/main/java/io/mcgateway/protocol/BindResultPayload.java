package io.mcgateway.protocol;

public record BindResultPayload(boolean success, String code, String message) implements Payload {
}
