package io.mcgateway.protocol;

public record CommandResultPayload(boolean success, String output) implements Payload {
    public CommandResultPayload {
        output = output == null ? "" : output;
    }
}
