package io.mcgateway.protocol;

import java.util.Objects;

public record StatusResponsePayload(QueryKind query, StatusSnapshot status, PlayerList players) implements Payload {
    public StatusResponsePayload {
        query = Objects.requireNonNull(query, "query");
        if (query == QueryKind.STATUS && status == null) {
            throw new IllegalArgumentException("status body is required for STATUS responses");
        }
        if (query == QueryKind.PLAYERS && players == null) {
            throw new IllegalArgumentException("players body is required for PLAYERS responses");
        }
    }

    public static StatusResponsePayload of(StatusSnapshot status) {
        return new StatusResponsePayload(QueryKind.STATUS, status, null);
    }

    public static StatusResponsePayload of(PlayerList players) {
        return new StatusResponsePayload(QueryKind.PLAYERS, null, players);
    }
}
