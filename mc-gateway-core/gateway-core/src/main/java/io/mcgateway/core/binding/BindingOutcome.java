package io.mcgateway.core.binding;

public enum BindingOutcome {
    BOUND,
    CODE_NOT_FOUND,
    CODE_EXPIRED,
    ALREADY_CONFIRMED
}
