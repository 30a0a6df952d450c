package io.mcgateway.protocol;

public interface Payload {
}
