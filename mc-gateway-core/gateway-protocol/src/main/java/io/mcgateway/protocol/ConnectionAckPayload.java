package io.mcgateway.protocol;

public record ConnectionAckPayload(String serverId) implements Payload {
}
