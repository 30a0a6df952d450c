package io.mcgateway.core.command;

import io.mcgateway.core.binding.BindingConfirmation;
import io.mcgateway.core.route.RouteResult;
import io.mcgateway.core.session.SessionInfo;
import io.mcgateway.core.status.QueryResult;
import io.mcgateway.protocol.MemoryUsage;
import io.mcgateway.protocol.PlayerInfo;
import io.mcgateway.protocol.PlayerList;
import io.mcgateway.protocol.StatusSnapshot;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text replies for the command path. Hosts that render richer output subclass this.
 */
public class ReplyFormatter {
    private static final String HELP = String.join(
        "\n",
        "Gateway commands:",
        "  status [@server]          show server status",
        "  players [@server]         list online players",
        "  info                      show connection state of every server",
        "  say [@server] <text>      broadcast a chat line in game",
        "  cmd [@server] <command>   run a server command (admins only)",
        "  reconnect [@server]       force a reconnect",
        "  bind <code>               link your account with an in-game player",
        "  help                      show this help"
    );

    public String status(String serverId, QueryResult<StatusSnapshot> result) {
        if (!result.isOk()) {
            return queryFailure(serverId, result);
        }
        StatusSnapshot status = result.value();
        StringBuilder out = new StringBuilder(256);
        out.append("Server status [").append(serverId).append("]\n");
        out.append("Online: ").append(status.online() ? "yes" : "no");
        if (!status.online()) {
            return out.toString();
        }
        out.append("\nVersion: ").append(status.version());
        out.append("\nPlayers: ").append(status.onlinePlayers()).append('/').append(status.maxPlayers());
        if (!status.tps().isEmpty()) {
            out.append("\nTPS: ").append(tps(status.tps()));
        }
        MemoryUsage memory = status.memory();
        if (memory != null) {
            out.append("\nMemory: ")
                .append(memory.usedMb()).append("MB / ")
                .append(memory.maxMb()).append("MB (")
                .append(String.format(Locale.ROOT, "%.1f", memory.usagePercent())).append("%)");
        }
        if (!status.players().isEmpty()) {
            out.append("\nOnline players: ").append(String.join(", ", status.players()));
        }
        return out.toString();
    }

    public String players(String serverId, QueryResult<PlayerList> result) {
        if (!result.isOk()) {
            return queryFailure(serverId, result);
        }
        PlayerList players = result.value();
        StringBuilder out = new StringBuilder(256);
        out.append("Players [").append(serverId).append("]\n");
        out.append("Online: ").append(players.online()).append('/').append(players.max());
        if (players.players().isEmpty()) {
            out.append("\nNo players online");
            return out.toString();
        }
        for (PlayerInfo player : players.players()) {
            out.append("\n- ").append(player.name());
            if (player.health() != null) {
                out.append(" | hp ").append(Math.round(player.health()));
                if (player.maxHealth() != null) {
                    out.append('/').append(Math.round(player.maxHealth()));
                }
            }
            if (player.level() != null) {
                out.append(" | Lv.").append(player.level());
            }
            if (player.gameMode() != null) {
                out.append(" | ").append(player.gameMode());
            }
            if (player.world() != null) {
                out.append(" | ").append(player.world());
            }
            if (player.ping() != null) {
                out.append(" | ").append(player.ping()).append("ms");
            }
        }
        return out.toString();
    }

    public String info(List<SessionInfo> sessions, int forwardTargets) {
        StringBuilder out = new StringBuilder(256);
        out.append("Gateway connections");
        if (sessions.isEmpty()) {
            out.append("\nNo game server has connected yet");
        }
        for (SessionInfo session : sessions) {
            out.append("\n- ").append(session.serverId())
                .append(": ").append(session.state())
                .append(session.dialed() ? " (dialed)" : " (listener)");
            if (session.queuedMessages() > 0) {
                out.append(", queued ").append(session.queuedMessages());
            }
            if (session.droppedMessages() > 0) {
                out.append(", dropped ").append(session.droppedMessages());
            }
            if (session.reconnectAttempts() > 0) {
                out.append(", reconnect attempts ").append(session.reconnectAttempts());
            }
        }
        out.append("\nForward targets: ").append(forwardTargets);
        return out.toString();
    }

    public String routed(String serverId, String action, RouteResult result) {
        switch (result) {
            case SENT:
                return action + " sent to " + serverId;
            case QUEUED:
                return action + " queued for " + serverId + "; it will be delivered after reconnect";
            case SERVER_NOT_FOUND:
                return "Unknown server: " + serverId;
            default:
                return "Server " + serverId + " is not connected";
        }
    }

    public String binding(BindingConfirmation confirmation) {
        switch (confirmation.outcome()) {
            case BOUND:
                return "Binding confirmed for " + displayPlayer(confirmation) + " on " + confirmation.request().serverId();
            case CODE_EXPIRED:
                return "Binding code " + confirmation.code() + " has expired; request a new one in game";
            case ALREADY_CONFIRMED:
                return "Binding code " + confirmation.code() + " was already used";
            default:
                return "Unknown binding code: " + confirmation.code();
        }
    }

    public String reconnect(String serverId, boolean accepted) {
        return accepted ? "Reconnecting " + serverId : "Unknown server: " + serverId;
    }

    public String serverSelection(List<String> candidates) {
        if (candidates.isEmpty()) {
            return "No game server is configured";
        }
        return "Several servers are available; pick one with @server: " + String.join(", ", candidates);
    }

    public String help() {
        return HELP;
    }

    public String unknownCommand(String command) {
        return "Unknown command: " + command + "\n" + HELP;
    }

    protected String queryFailure(String serverId, QueryResult<?> result) {
        switch (result.outcome()) {
            case SERVER_NOT_FOUND:
                return "Unknown server: " + serverId;
            case SERVER_NOT_CONNECTED:
                return "Server " + serverId + " is not connected";
            case TIMEOUT:
                return "Server " + serverId + " did not answer in time";
            default:
                return "Query failed for " + serverId + ": " + result.message();
        }
    }

    private static String tps(List<Double> values) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < values.size() && i < 3; i++) {
            if (i > 0) {
                out.append(" / ");
            }
            out.append(String.format(Locale.ROOT, "%.1f", values.get(i)));
        }
        return out.toString();
    }

    private static String displayPlayer(BindingConfirmation confirmation) {
        String name = confirmation.request().playerName();
        return name == null ? confirmation.request().playerUuid() : name;
    }
}
