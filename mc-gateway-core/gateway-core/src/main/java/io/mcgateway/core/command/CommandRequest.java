package io.mcgateway.core.command;

import java.util.Locale;
import java.util.Objects;

/**
 * One chat command, already stripped of the host's command prefix.
 *
 * @param serverId explicit target server, or null to use the default server
 * @param admin whether the sender may run raw server commands
 */
public record CommandRequest(
    String command,
    String argument,
    String serverId,
    String platform,
    String sender,
    boolean admin
) {
    public CommandRequest {
        command = Objects.requireNonNull(command, "command").trim().toLowerCase(Locale.ROOT);
        argument = argument == null ? "" : argument.trim();
        serverId = serverId == null || serverId.isBlank() ? null : serverId.trim();
        platform = Objects.requireNonNull(platform, "platform");
        sender = Objects.requireNonNull(sender, "sender");
    }

    /**
     * Parses {@code "[/mc] <command> [@serverId] [argument...]"}.
     */
    public static CommandRequest parse(String line, String platform, String sender, boolean admin) {
        String rest = Objects.requireNonNull(line, "line").trim();
        if (rest.startsWith("/")) {
            rest = rest.substring(1);
        }
        if (rest.equals("mc") || rest.startsWith("mc ")) {
            rest = rest.substring(2).trim();
        }
        if (rest.isEmpty()) {
            return new CommandRequest("help", "", null, platform, sender, admin);
        }
        String[] head = rest.split("\\s+", 2);
        String command = head[0];
        String remainder = head.length > 1 ? head[1] : "";
        String serverId = null;
        if (remainder.startsWith("@")) {
            String[] target = remainder.split("\\s+", 2);
            serverId = target[0].substring(1);
            remainder = target.length > 1 ? target[1] : "";
        }
        return new CommandRequest(command, remainder, serverId, platform, sender, admin);
    }

    public CommandRequest withServerId(String explicitServerId) {
        return new CommandRequest(command, argument, explicitServerId, platform, sender, admin);
    }
}
