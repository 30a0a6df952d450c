package io.mcgateway.core.session;

import java.util.Objects;
import java.util.Optional;

public record AttachResult(Outcome outcome, Session session, String reason) {
    public AttachResult {
        outcome = Objects.requireNonNull(outcome, "outcome");
    }

    static AttachResult accepted(Outcome outcome, Session session) {
        return new AttachResult(outcome, Objects.requireNonNull(session, "session"), null);
    }

    static AttachResult failed(Outcome outcome, String reason) {
        return new AttachResult(outcome, null, reason);
    }

    public boolean accepted() {
        return outcome == Outcome.ATTACHED || outcome == Outcome.SUPERSEDED;
    }

    public Optional<Session> sessionIfAccepted() {
        return accepted() ? Optional.of(session) : Optional.empty();
    }

    public enum Outcome {
        ATTACHED,
        SUPERSEDED,
        AUTHENTICATION_FAILED,
        DUPLICATE_REJECTED,
        DETACHED
    }
}
