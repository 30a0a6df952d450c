package io.mcgateway.protocol;

import java.util.Objects;

public record StatusRequestPayload(QueryKind query) implements Payload {
    public StatusRequestPayload {
        query = Objects.requireNonNull(query, "query");
    }
}
