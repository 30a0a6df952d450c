package io.mcgateway.core.command;

import io.mcgateway.core.binding.BindingConfirmation;
import io.mcgateway.core.binding.BindingCoordinator;
import io.mcgateway.core.route.RouteResult;
import io.mcgateway.core.route.Router;
import io.mcgateway.core.session.DeliveryMode;
import io.mcgateway.core.session.Session;
import io.mcgateway.core.session.SessionInfo;
import io.mcgateway.core.session.SessionRegistry;
import io.mcgateway.core.session.SessionState;
import io.mcgateway.core.status.StatusQueryFacade;
import io.mcgateway.protocol.ChatPayload;
import io.mcgateway.protocol.CommandPayload;
import io.mcgateway.protocol.Message;
import io.mcgateway.protocol.MessageType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns parsed chat commands into router, facade and binding calls and renders the outcome as text.
 */
public final class CommandDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(CommandDispatcher.class);

    private final SessionRegistry registry;
    private final Router router;
    private final StatusQueryFacade statusQueries;
    private final BindingCoordinator bindings;
    private final ReplyFormatter formatter;

    public CommandDispatcher(
        SessionRegistry registry,
        Router router,
        StatusQueryFacade statusQueries,
        BindingCoordinator bindings,
        ReplyFormatter formatter
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.router = Objects.requireNonNull(router, "router");
        this.statusQueries = Objects.requireNonNull(statusQueries, "statusQueries");
        this.bindings = Objects.requireNonNull(bindings, "bindings");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    public CommandReply dispatch(CommandRequest request) {
        Objects.requireNonNull(request, "request");
        LOGGER.debug("Dispatching command [command={}, serverId={}, platform={}]", request.command(), request.serverId(), request.platform());
        switch (request.command()) {
            case "help":
                return CommandReply.ok(null, formatter.help());
            case "info":
                return CommandReply.ok(null, formatter.info(registry.list(), totalForwardTargets()));
            case "bind":
                return bind(request);
            case "status":
            case "players":
            case "say":
            case "cmd":
            case "reconnect":
                return onServer(request);
            default:
                return CommandReply.failed(null, formatter.unknownCommand(request.command()));
        }
    }

    private CommandReply onServer(CommandRequest request) {
        Optional<String> selected = selectServer(request);
        if (selected.isEmpty()) {
            return CommandReply.failed(null, formatter.serverSelection(new ArrayList<>(registry.knownServerIds())));
        }
        String serverId = selected.get();
        switch (request.command()) {
            case "status": {
                var result = statusQueries.queryStatus(serverId);
                return new CommandReply(result.isOk(), serverId, formatter.status(serverId, result));
            }
            case "players": {
                var result = statusQueries.queryPlayers(serverId);
                return new CommandReply(result.isOk(), serverId, formatter.players(serverId, result));
            }
            case "say":
                return say(request, serverId);
            case "cmd":
                return command(request, serverId);
            default:
                return reconnect(serverId);
        }
    }

    private CommandReply say(CommandRequest request, String serverId) {
        if (request.argument().isEmpty()) {
            return CommandReply.failed(serverId, "Usage: say [@server] <text>");
        }
        Message chat = Message.of(
            MessageType.CHAT,
            serverId,
            ChatPayload.broadcast(request.argument(), request.platform(), request.sender())
        );
        RouteResult result = route(serverId, chat);
        return new CommandReply(result.accepted(), serverId, formatter.routed(serverId, "Message", result));
    }

    private CommandReply command(CommandRequest request, String serverId) {
        if (!request.admin()) {
            LOGGER.warn("Rejected server command from non-admin [serverId={}, sender={}]", serverId, request.sender());
            return CommandReply.failed(serverId, "Only administrators may run server commands");
        }
        if (request.argument().isEmpty()) {
            return CommandReply.failed(serverId, "Usage: cmd [@server] <command>");
        }
        String raw = request.argument().startsWith("/") ? request.argument().substring(1) : request.argument();
        Message command = Message.request(MessageType.COMMAND, serverId, new CommandPayload(raw, request.sender()));
        RouteResult result = route(serverId, command);
        LOGGER.info("Server command routed [serverId={}, sender={}, result={}]", serverId, request.sender(), result);
        return new CommandReply(result.accepted(), serverId, formatter.routed(serverId, "Command", result));
    }

    /**
     * A whitelisted server without a session has simply not connected yet.
     */
    private RouteResult route(String serverId, Message message) {
        RouteResult result = router.routeOutbound(serverId, message, DeliveryMode.PROMPT);
        if (result == RouteResult.SERVER_NOT_FOUND && registry.knownServerIds().contains(serverId)) {
            return RouteResult.SERVER_NOT_CONNECTED;
        }
        return result;
    }

    private CommandReply reconnect(String serverId) {
        Optional<Session> session = registry.lookup(serverId);
        boolean accepted = session.isPresent() && session.get().requestReconnect();
        return new CommandReply(accepted, serverId, formatter.reconnect(serverId, accepted));
    }

    private CommandReply bind(CommandRequest request) {
        if (request.argument().isEmpty()) {
            return CommandReply.failed(null, "Usage: bind <code>");
        }
        BindingConfirmation confirmation = bindings.confirm(request.argument(), request.platform(), request.sender());
        String serverId = confirmation.bound() ? confirmation.request().serverId() : null;
        return new CommandReply(confirmation.bound(), serverId, formatter.binding(confirmation));
    }

    /**
     * Explicit {@code @server} wins. Otherwise the only configured server, or else the only connected one.
     */
    private Optional<String> selectServer(CommandRequest request) {
        if (request.serverId() != null) {
            return Optional.of(request.serverId());
        }
        Set<String> known = registry.knownServerIds();
        if (known.size() == 1) {
            return Optional.of(known.iterator().next());
        }
        List<String> connected = new ArrayList<>();
        for (SessionInfo session : registry.list()) {
            if (session.state() == SessionState.CONNECTED) {
                connected.add(session.serverId());
            }
        }
        if (connected.size() == 1) {
            return Optional.of(connected.get(0));
        }
        return Optional.empty();
    }

    private int totalForwardTargets() {
        int total = 0;
        for (String serverId : router.forwarding().serverIds()) {
            total += router.forwarding().targetCount(serverId);
        }
        return total;
    }
}
