package io.mcgateway.server;

import io.mcgateway.core.ChatPlatform;
import io.mcgateway.core.binding.BindingNotification;
import io.mcgateway.core.binding.BindingSettlement;
import io.mcgateway.core.route.Delivery;
import io.mcgateway.core.route.ForwardTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stand-alone chat platform that writes every forwarded event to the log. Used when the gateway runs without a chat
 * host embedding it.
 */
public final class LoggingChatPlatform implements ChatPlatform {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingChatPlatform.class);

    @Override
    public void deliver(ForwardTarget target, Delivery delivery) {
        LOGGER.info("Forward [target={}, event={}] {}", target, delivery.event(), delivery.text());
    }

    @Override
    public void notifyBinding(BindingNotification notification) {
        LOGGER.info(
            "Binding code issued [serverId={}, player={}, session={}, expiresAt={}]",
            notification.serverId(),
            notification.playerName() == null ? notification.playerUuid() : notification.playerName(),
            notification.privateSessionId(),
            notification.expiresAt()
        );
    }

    @Override
    public void onBindingResult(BindingSettlement settlement) {
        LOGGER.info(
            "Binding settled [serverId={}, playerUuid={}, platform={}, success={}]",
            settlement.serverId(),
            settlement.playerUuid(),
            settlement.platform(),
            settlement.success()
        );
    }

    @Override
    public void onServerOnline(String serverId) {
        LOGGER.info("Game server online [serverId={}]", serverId);
    }

    @Override
    public void onServerOffline(String serverId, String reason) {
        LOGGER.info("Game server offline [serverId={}, reason={}]", serverId, reason);
    }

    @Override
    public void onAuthenticationFailed(String serverId, String reason) {
        LOGGER.warn("Game server authentication failed [serverId={}, reason={}]", serverId, reason);
    }
}
