package io.mcgateway.protocol;

import java.util.Objects;

/**
 * Chat line in either direction. Inbound lines carry the in-game sender; outbound lines carry the chat
 * platform name and, for private delivery, the target player's uuid. A null target means broadcast.
 */
public record ChatPayload(
    String content,
    String sender,
    String senderDisplayName,
    String platform,
    String targetPlayerUuid
) implements Payload {
    public ChatPayload {
        content = Objects.requireNonNull(content, "content");
    }

    public static ChatPayload broadcast(String content, String platform, String sender) {
        return new ChatPayload(content, sender, null, platform, null);
    }

    public static ChatPayload toPlayer(String content, String platform, String sender, String playerUuid) {
        return new ChatPayload(content, sender, null, platform, Objects.requireNonNull(playerUuid, "playerUuid"));
    }

    public String displayName() {
        if (senderDisplayName != null && !senderDisplayName.isBlank()) {
            return senderDisplayName;
        }
        return sender;
    }

    public boolean isBroadcast() {
        return targetPlayerUuid == null;
    }
}
