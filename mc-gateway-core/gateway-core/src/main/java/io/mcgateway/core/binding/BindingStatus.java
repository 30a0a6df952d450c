package io.mcgateway.core.binding;

public enum BindingStatus {
    PENDING,
    CONFIRMED,
    EXPIRED,
    CANCELLED
}
