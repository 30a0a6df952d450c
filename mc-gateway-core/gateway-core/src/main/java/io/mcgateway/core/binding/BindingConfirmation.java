package io.mcgateway.core.binding;

import io.mcgateway.core.route.RouteResult;
import io.mcgateway.protocol.BindResultPayload;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Result of a confirmation attempt. Only {@link BindingOutcome#BOUND} carries a request, the routing result of the
 * BIND_CONFIRM message and a future completed by the game server's BIND_RESULT.
 */
public record BindingConfirmation(
    BindingOutcome outcome,
    String code,
    BindingRequest request,
    RouteResult delivery,
    CompletableFuture<BindResultPayload> serverResult
) {
    public BindingConfirmation {
        outcome = Objects.requireNonNull(outcome, "outcome");
    }

    static BindingConfirmation rejected(BindingOutcome outcome, String code) {
        return new BindingConfirmation(outcome, code, null, null, null);
    }

    public boolean bound() {
        return outcome == BindingOutcome.BOUND;
    }
}
