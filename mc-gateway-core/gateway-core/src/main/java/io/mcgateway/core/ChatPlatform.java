package io.mcgateway.core;

import io.mcgateway.core.binding.BindingNotification;
import io.mcgateway.core.binding.BindingSettlement;
import io.mcgateway.core.route.Delivery;
import io.mcgateway.core.route.ForwardTarget;

/**
 * Boundary to the chat platform's own dispatch framework. Every callback is pushed by the gateway; an exception
 * thrown here is logged and never reaches a transport thread.
 */
public interface ChatPlatform {
    void deliver(ForwardTarget target, Delivery delivery);

    default void notifyBinding(BindingNotification notification) {
    }

    default void onBindingResult(BindingSettlement settlement) {
    }

    default void onServerOnline(String serverId) {
    }

    default void onServerOffline(String serverId, String reason) {
    }

    default void onAuthenticationFailed(String serverId, String reason) {
    }
}
