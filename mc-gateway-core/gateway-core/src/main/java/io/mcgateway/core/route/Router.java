package io.mcgateway.core.route;

import io.mcgateway.core.ChatPlatform;
import io.mcgateway.core.session.DeliveryMode;
import io.mcgateway.core.session.SendResult;
import io.mcgateway.core.session.Session;
import io.mcgateway.core.session.SessionRegistry;
import io.mcgateway.protocol.Message;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Router {
    private static final Logger LOGGER = LoggerFactory.getLogger(Router.class);

    private final SessionRegistry registry;
    private final ChatPlatform platform;
    private final EventFormatter formatter;
    private volatile ForwardingTable forwarding;

    public Router(SessionRegistry registry, ChatPlatform platform, ForwardingTable forwarding) {
        this(registry, platform, forwarding, new EventFormatter());
    }

    public Router(SessionRegistry registry, ChatPlatform platform, ForwardingTable forwarding, EventFormatter formatter) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.platform = Objects.requireNonNull(platform, "platform");
        this.forwarding = Objects.requireNonNull(forwarding, "forwarding");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    public ForwardingTable forwarding() {
        return forwarding;
    }

    public void replaceForwarding(ForwardingTable table) {
        this.forwarding = Objects.requireNonNull(table, "table");
        LOGGER.info("Forwarding table replaced [servers={}]", table.serverIds().size());
    }

    /**
     * Fans an inbound game event out to every configured target. A failing target is logged and skipped.
     *
     * @return number of successful deliveries
     */
    public int forwardInbound(Message message) {
        Objects.requireNonNull(message, "message");
        ForwardEvent event = ForwardEvent.of(message.type());
        if (event == null || message.serverId() == null) {
            LOGGER.debug("Not forwarding {} [serverId={}]", message.type(), message.serverId());
            return 0;
        }
        return deliver(message.serverId(), event, message, formatter.render(message));
    }

    public int forwardServerStatus(String serverId, boolean online, String reason) {
        String text = online ? formatter.serverOnline(serverId) : formatter.serverOffline(serverId, reason);
        return deliver(serverId, ForwardEvent.SERVER_STATUS, null, text);
    }

    public RouteResult routeOutbound(String serverId, Message message, DeliveryMode mode) {
        Objects.requireNonNull(message, "message");
        Optional<Session> session = registry.lookup(serverId);
        if (session.isEmpty()) {
            LOGGER.debug("No session for outbound {} [serverId={}]", message.type(), serverId);
            return RouteResult.SERVER_NOT_FOUND;
        }
        SendResult result = session.get().send(message.withServerId(serverId), mode);
        switch (result) {
            case SENT:
                return RouteResult.SENT;
            case QUEUED:
                return RouteResult.QUEUED;
            default:
                return RouteResult.SERVER_NOT_CONNECTED;
        }
    }

    private int deliver(String serverId, ForwardEvent event, Message message, String text) {
        Set<ForwardTarget> targets = forwarding.targetsFor(serverId, event);
        if (targets.isEmpty()) {
            return 0;
        }
        Delivery delivery = new Delivery(serverId, event, message, text);
        int delivered = 0;
        for (ForwardTarget target : targets) {
            try {
                platform.deliver(target, delivery);
                delivered++;
            } catch (RuntimeException failure) {
                LOGGER.warn("Forwarding failed [serverId={}, target={}, event={}]", serverId, target, event, failure);
            }
        }
        LOGGER.debug("Forwarded {} [serverId={}, delivered={}/{}]", event, serverId, delivered, targets.size());
        return delivered;
    }
}
