package io.mcgateway.core.status;

import java.util.Objects;

/**
 * Typed result of a status or player query. {@code value} is set only for {@link QueryOutcome#OK}.
 */
public record QueryResult<T>(QueryOutcome outcome, T value, String message) {
    public QueryResult {
        outcome = Objects.requireNonNull(outcome, "outcome");
        if (outcome == QueryOutcome.OK && value == null) {
            throw new IllegalArgumentException("value is required for OK results");
        }
    }

    public static <T> QueryResult<T> ok(T value) {
        return new QueryResult<>(QueryOutcome.OK, value, null);
    }

    public static <T> QueryResult<T> failed(QueryOutcome outcome, String message) {
        if (outcome == QueryOutcome.OK) {
            throw new IllegalArgumentException("failed result needs a non-OK outcome");
        }
        return new QueryResult<>(outcome, null, message);
    }

    public boolean isOk() {
        return outcome == QueryOutcome.OK;
    }
}
