package io.mcgateway.core.route;

import io.mcgateway.core.session.DeliveryMode;
import io.mcgateway.core.session.SessionRegistry;
import io.mcgateway.protocol.ChatPayload;
import io.mcgateway.protocol.Message;
import io.mcgateway.protocol.MessageType;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carries chat-platform lines into the game as outbound {@code CHAT} messages.
 *
 * <p>A game session id is {@code serverId} for a server-wide broadcast or {@code serverId:playerUuid} for one
 * player, the same ids that binding notifications use for their private sessions.
 */
public final class PlatformRelay {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlatformRelay.class);

    private final Router router;
    private final SessionRegistry registry;
    private final RelaySettings settings;

    public PlatformRelay(Router router, SessionRegistry registry, RelaySettings settings) {
        this.router = Objects.requireNonNull(router, "router");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public RelaySettings settings() {
        return settings;
    }

    /**
     * Sends {@code text} to the server, or to one player on it, named by {@code sessionId}.
     */
    public RouteResult sendToSession(String sessionId, String platform, String sender, String text) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        String trimmedId = sessionId.trim();
        int separator = trimmedId.indexOf(':');
        String serverId = separator < 0 ? trimmedId : trimmedId.substring(0, separator);
        String playerUuid = separator < 0 ? null : trimToNull(trimmedId.substring(separator + 1));
        if (serverId.isEmpty()) {
            throw new IllegalArgumentException("sessionId must start with a serverId: " + sessionId);
        }

        ChatPayload payload = playerUuid == null
            ? ChatPayload.broadcast(text.trim(), platform, sender)
            : ChatPayload.toPlayer(text.trim(), platform, sender, playerUuid);
        RouteResult result = router.routeOutbound(serverId, Message.of(MessageType.CHAT, serverId, payload), DeliveryMode.PROMPT);
        if (result == RouteResult.SERVER_NOT_FOUND && registry.knownServerIds().contains(serverId)) {
            result = RouteResult.SERVER_NOT_CONNECTED;
        }
        LOGGER.debug("Relayed chat line [serverId={}, playerUuid={}, sender={}, result={}]", serverId, playerUuid, sender, result);
        return result;
    }

    /**
     * Relays a prefixed line from a chat session to every server that forwards to that session. Lines without the
     * prefix, from sessions outside the whitelist, or with nothing after the prefix are left alone.
     *
     * @return per-server route results; empty when the line was not relayed
     */
    public Map<String, RouteResult> autoForward(ForwardTarget origin, String sender, String text) {
        Objects.requireNonNull(origin, "origin");
        Optional<String> body = settings.strip(text);
        if (body.isEmpty()) {
            return Map.of();
        }
        if (!settings.allows(origin)) {
            LOGGER.debug("Not relaying from session outside the relay whitelist [origin={}]", origin);
            return Map.of();
        }
        Set<String> servers = router.forwarding().serversForwardingTo(origin);
        if (servers.isEmpty()) {
            LOGGER.debug("No server forwards to relay origin [origin={}]", origin);
            return Map.of();
        }
        Map<String, RouteResult> results = new LinkedHashMap<>();
        for (String serverId : servers) {
            results.put(serverId, sendToSession(serverId, origin.platform(), sender, body.get()));
        }
        LOGGER.info("Relayed chat line into the game [origin={}, sender={}, results={}]", origin, sender, results);
        return results;
    }

    private static String trimToNull(String value) {
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
