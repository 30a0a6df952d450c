package io.mcgateway.core.testing;

import io.mcgateway.core.ChatPlatform;
import io.mcgateway.core.binding.BindingNotification;
import io.mcgateway.core.binding.BindingSettlement;
import io.mcgateway.core.route.Delivery;
import io.mcgateway.core.route.ForwardTarget;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;

public final class RecordingChatPlatform implements ChatPlatform {
    public final List<Delivered> deliveries = new CopyOnWriteArrayList<>();
    public final List<BindingNotification> notifications = new CopyOnWriteArrayList<>();
    public final List<BindingSettlement> settlements = new CopyOnWriteArrayList<>();
    public final List<String> events = new CopyOnWriteArrayList<>();
    private final Set<ForwardTarget> failingTargets = new CopyOnWriteArraySet<>();

    public void failFor(ForwardTarget target) {
        failingTargets.add(target);
    }

    @Override
    public void deliver(ForwardTarget target, Delivery delivery) {
        if (failingTargets.contains(target)) {
            throw new IllegalStateException("platform unavailable for " + target);
        }
        deliveries.add(new Delivered(target, delivery));
    }

    @Override
    public void notifyBinding(BindingNotification notification) {
        notifications.add(notification);
    }

    @Override
    public void onBindingResult(BindingSettlement settlement) {
        settlements.add(settlement);
    }

    @Override
    public void onServerOnline(String serverId) {
        events.add("online:" + serverId);
    }

    @Override
    public void onServerOffline(String serverId, String reason) {
        events.add("offline:" + serverId);
    }

    @Override
    public void onAuthenticationFailed(String serverId, String reason) {
        events.add("auth-failed:" + serverId);
    }

    public record Delivered(ForwardTarget target, Delivery delivery) {
    }
}
