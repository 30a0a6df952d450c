package io.mcgateway.core.route;

import io.mcgateway.protocol.ChatPayload;
import io.mcgateway.protocol.Message;
import io.mcgateway.protocol.PlayerEventKind;
import io.mcgateway.protocol.PlayerEventPayload;

/**
 * Plain-text rendering handed to chat platforms alongside the structured message.
 */
public class EventFormatter {
    public String chat(String serverId, ChatPayload chat) {
        String name = chat.displayName() == null ? "Unknown" : chat.displayName();
        return "[" + serverId + "] <" + name + "> " + chat.content();
    }

    public String playerEvent(String serverId, PlayerEventPayload event) {
        String verb = event.kind() == PlayerEventKind.JOIN ? "joined the game" : "left the game";
        return "[" + serverId + "] " + event.playerName() + " " + verb;
    }

    public String serverOnline(String serverId) {
        return "[" + serverId + "] server is online";
    }

    public String serverOffline(String serverId, String reason) {
        return "[" + serverId + "] server went offline" + (reason == null ? "" : " (" + reason + ")");
    }

    String render(Message message) {
        switch (message.type()) {
            case CHAT:
                return chat(message.serverId(), message.payloadAs(ChatPayload.class));
            case PLAYER_EVENT:
                return playerEvent(message.serverId(), message.payloadAs(PlayerEventPayload.class));
            default:
                return "[" + message.serverId() + "] " + message.type();
        }
    }
}
