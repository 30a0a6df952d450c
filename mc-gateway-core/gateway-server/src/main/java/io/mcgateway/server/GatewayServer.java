package io.mcgateway.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.UnauthorizedResponse;
import io.javalin.websocket.WsConfig;
import io.javalin.websocket.WsContext;
import io.mcgateway.core.ChatPlatform;
import io.mcgateway.core.Gateway;
import io.mcgateway.core.binding.BindingConfirmation;
import io.mcgateway.core.command.CommandReply;
import io.mcgateway.core.command.CommandRequest;
import io.mcgateway.core.config.GatewayConfig;
import io.mcgateway.core.route.ForwardTarget;
import io.mcgateway.core.route.RouteResult;
import io.mcgateway.core.session.AttachResult;
import io.mcgateway.core.session.SessionInfo;
import io.mcgateway.core.status.QueryResult;
import io.mcgateway.core.status.StatusPoller;
import io.mcgateway.protocol.MessageCodec;
import io.mcgateway.protocol.PlayerList;
import io.mcgateway.protocol.StatusSnapshot;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hosts the game-server WebSocket endpoint and the admin HTTP API on one Javalin instance.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayServer.class);

    private final Gateway gateway;
    private final ObjectMapper objectMapper;
    private final MessageCodec codec;
    private final ConcurrentMap<String, JavalinTransport> transports = new ConcurrentHashMap<>();

    private Javalin app;

    public GatewayServer(GatewayConfig config, ChatPlatform platform) {
        this(Gateway.create(
            config,
            platform,
            server -> new WebSocketDialer(server.dialUrl()),
            HttpStatusClient::new
        ));
    }

    GatewayServer(Gateway gateway) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.objectMapper = new ObjectMapper();
        this.codec = new MessageCodec(objectMapper);
    }

    public synchronized Javalin start() {
        if (app != null) {
            throw new IllegalStateException("Server is already running");
        }

        GatewayConfig.Listen listen = gateway.config().listen();
        gateway.start();
        Javalin server = Javalin.create(config -> config.showJavalinBanner = false);
        registerRoutes(server, listen.path());
        server.start(listen.host(), listen.port());
        app = server;
        LOGGER.info(
            "Gateway listening [url=ws://{}:{}{}, adminAuth={}]",
            listen.host(),
            server.port(),
            listen.path(),
            gateway.config().hasAdminToken()
        );
        return server;
    }

    public synchronized int port() {
        if (app == null) {
            throw new IllegalStateException("Server is not running");
        }
        return app.port();
    }

    public synchronized void stop() {
        if (app != null) {
            app.stop();
            app = null;
        }
    }

    @Override
    public void close() {
        gateway.close();
        stop();
    }

    public Gateway gateway() {
        return gateway;
    }

    String currentVersion() {
        String version = System.getProperty("mc.gateway.version");
        return version == null || version.isBlank() ? "0.1.0-SNAPSHOT" : version;
    }

    private void registerRoutes(Javalin server, String wsPath) {
        server.ws(wsPath, this::configureWebSocket);

        server.get("/health", ctx -> ctx.json(Map.of("status", "ok")));
        server.get("/version", ctx -> ctx.json(Map.of("version", currentVersion())));

        server.before("/api/*", this::authorizeAdmin);
        server.get("/api/servers", this::handleListServers);
        server.get("/api/servers/{id}/status", this::handleStatus);
        server.get("/api/servers/{id}/players", this::handlePlayers);
        server.post("/api/servers/{id}/commands", this::handleCommand);
        server.post("/api/bindings/confirm", this::handleConfirmBinding);
        server.post("/api/relay", this::handleRelay);
        server.post("/api/sessions/{sessionId}/messages", this::handleSessionMessage);
    }

    private void configureWebSocket(WsConfig ws) {
        ws.onConnect(ctx -> {
            JavalinTransport transport = new JavalinTransport(ctx);
            transports.put(ctx.sessionId(), transport);
            AttachResult result = gateway.registry().attach(ctx.queryParam("serverId"), token(ctx), transport);
            if (result.accepted()) {
                transport.bind(result.session());
            }
        });
        ws.onMessage(ctx -> {
            JavalinTransport transport = transports.get(ctx.sessionId());
            if (transport != null) {
                transport.deliverFrame(ctx.message());
            }
        });
        ws.onClose(ctx -> {
            JavalinTransport transport = transports.remove(ctx.sessionId());
            if (transport != null) {
                transport.deliverClose(ctx.status(), ctx.reason());
            }
        });
        ws.onError(ctx -> LOGGER.warn("WebSocket error [transport={}]", ctx.sessionId(), ctx.error()));
    }

    private String token(WsContext ctx) {
        String token = ctx.queryParam("token");
        if (token != null && !token.isBlank()) {
            return token;
        }
        return bearer(ctx.header("Authorization"));
    }

    private void authorizeAdmin(Context ctx) {
        GatewayConfig config = gateway.config();
        if (!config.hasAdminToken()) {
            return;
        }
        String presented = bearer(ctx.header("Authorization"));
        if (presented == null || !MessageDigest.isEqual(
            presented.getBytes(StandardCharsets.UTF_8),
            config.adminToken().getBytes(StandardCharsets.UTF_8)
        )) {
            throw new UnauthorizedResponse("Admin token required");
        }
    }

    private void handleListServers(Context ctx) {
        List<Map<String, Object>> servers = new ArrayList<>();
        for (SessionInfo info : gateway.registry().list()) {
            Map<String, Object> server = new LinkedHashMap<>();
            server.put("serverId", info.serverId());
            server.put("state", info.state().name());
            server.put("dialed", info.dialed());
            server.put("lastSeen", info.lastSeen() == null ? null : info.lastSeen().toString());
            server.put("queuedMessages", info.queuedMessages());
            server.put("droppedMessages", info.droppedMessages());
            server.put("reconnectAttempts", info.reconnectAttempts());
            Optional<StatusPoller.PolledStatus> polled = gateway.statusPoller().latest(info.serverId());
            if (polled.isPresent()) {
                server.put("lastStatus", codec.writeStatus(polled.get().status()));
                server.put("polledAt", polled.get().polledAt().toString());
            }
            servers.add(server);
        }
        ctx.json(servers);
    }

    private void handleStatus(Context ctx) {
        try {
            QueryResult<StatusSnapshot> result = gateway.statusQueries().queryStatus(ctx.pathParam("id"));
            if (result.isOk()) {
                ctx.json(codec.writeStatus(result.value()));
            } else {
                writeQueryFailure(ctx, result);
            }
        } catch (Exception failure) {
            handleFailure(ctx, failure);
        }
    }

    private void handlePlayers(Context ctx) {
        try {
            QueryResult<PlayerList> result = gateway.statusQueries().queryPlayers(ctx.pathParam("id"));
            if (result.isOk()) {
                ctx.json(codec.writePlayers(result.value()));
            } else {
                writeQueryFailure(ctx, result);
            }
        } catch (Exception failure) {
            handleFailure(ctx, failure);
        }
    }

    private void handleCommand(Context ctx) {
        try {
            CommandBody body = parseBody(ctx, CommandBody.class);
            CommandRequest request = new CommandRequest(
                requiredText(body.command(), "command"),
                body.args(),
                ctx.pathParam("id"),
                body.platform() == null || body.platform().isBlank() ? "admin-api" : body.platform(),
                body.sender() == null || body.sender().isBlank() ? "admin" : body.sender(),
                true
            );
            CommandReply reply = gateway.commands().dispatch(request);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", reply.success());
            response.put("serverId", reply.serverId());
            response.put("text", reply.text());
            ctx.json(response);
        } catch (Exception failure) {
            handleFailure(ctx, failure);
        }
    }

    private void handleConfirmBinding(Context ctx) {
        try {
            ConfirmBody body = parseBody(ctx, ConfirmBody.class);
            BindingConfirmation confirmation = gateway.bindings().confirm(
                requiredText(body.code(), "code"),
                requiredText(body.platform(), "platform"),
                requiredText(body.accountId(), "accountId")
            );
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("outcome", confirmation.outcome().name());
            response.put("code", confirmation.code());
            if (confirmation.bound()) {
                response.put("serverId", confirmation.request().serverId());
                response.put("playerUuid", confirmation.request().playerUuid());
                response.put("delivery", confirmation.delivery().name());
            }
            ctx.status(confirmationStatus(confirmation)).json(response);
        } catch (Exception failure) {
            handleFailure(ctx, failure);
        }
    }

    private void handleRelay(Context ctx) {
        try {
            RelayBody body = parseBody(ctx, RelayBody.class);
            Map<String, RouteResult> results = gateway.relayFromPlatform(
                ForwardTarget.parse(requiredText(body.origin(), "origin")),
                body.sender() == null || body.sender().isBlank() ? "admin" : body.sender(),
                requiredText(body.text(), "text")
            );
            Map<String, String> perServer = new LinkedHashMap<>();
            for (Map.Entry<String, RouteResult> entry : results.entrySet()) {
                perServer.put(entry.getKey(), entry.getValue().name());
            }
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("relayed", !results.isEmpty());
            response.put("results", perServer);
            ctx.json(response);
        } catch (Exception failure) {
            handleFailure(ctx, failure);
        }
    }

    private void handleSessionMessage(Context ctx) {
        try {
            SessionMessageBody body = parseBody(ctx, SessionMessageBody.class);
            RouteResult result = gateway.relay().sendToSession(
                ctx.pathParam("sessionId"),
                body.platform() == null || body.platform().isBlank() ? "admin-api" : body.platform(),
                body.sender() == null || body.sender().isBlank() ? "admin" : body.sender(),
                requiredText(body.text(), "text")
            );
            int status;
            switch (result) {
                case SENT:
                case QUEUED:
                    status = 200;
                    break;
                case SERVER_NOT_FOUND:
                    status = 404;
                    break;
                default:
                    status = 503;
                    break;
            }
            ctx.status(status).json(Map.of("result", result.name()));
        } catch (Exception failure) {
            handleFailure(ctx, failure);
        }
    }

    private int confirmationStatus(BindingConfirmation confirmation) {
        switch (confirmation.outcome()) {
            case BOUND:
                return 200;
            case CODE_NOT_FOUND:
                return 404;
            case CODE_EXPIRED:
                return 410;
            case ALREADY_CONFIRMED:
                return 409;
            default:
                return 500;
        }
    }

    private void writeQueryFailure(Context ctx, QueryResult<?> result) {
        int status;
        switch (result.outcome()) {
            case SERVER_NOT_FOUND:
                status = 404;
                break;
            case SERVER_NOT_CONNECTED:
                status = 503;
                break;
            case TIMEOUT:
                status = 504;
                break;
            default:
                status = 502;
                break;
        }
        Map<String, String> response = new LinkedHashMap<>();
        response.put("outcome", result.outcome().name());
        response.put("error", result.message() == null ? "Unknown error" : result.message());
        ctx.status(status).json(response);
    }

    private <T> T parseBody(Context ctx, Class<T> type) throws IOException {
        if (ctx.body().isBlank()) {
            throw new IllegalArgumentException("Request body must not be empty");
        }
        return objectMapper.readValue(ctx.body(), type);
    }

    private void handleFailure(Context ctx, Exception failure) {
        if (failure instanceof IllegalArgumentException || failure instanceof IOException) {
            ctx.status(400).json(error(failure.getMessage()));
            return;
        }
        LOGGER.warn("Admin request failed [path={}]", ctx.path(), failure);
        ctx.status(500).json(error("Internal server error"));
    }

    private Map<String, String> error(String message) {
        return Map.of("error", message == null ? "Unknown error" : message);
    }

    private static String requiredText(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " is required");
        }
        return value;
    }

    private static String bearer(String header) {
        if (header == null) {
            return null;
        }
        String value = header.trim();
        if (value.regionMatches(true, 0, "Bearer ", 0, 7)) {
            String token = value.substring(7).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    public static void main(String[] args) throws IOException {
        if (args.length < 1) {
            throw new IllegalArgumentException("Usage: GatewayServer <config.yaml>");
        }
        GatewayConfig config = GatewayConfig.load(Path.of(args[0]));
        GatewayServer server = new GatewayServer(config, new LoggingChatPlatform());
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::close));
    }

    private record CommandBody(String command, String args, String sender, String platform) {
    }

    private record ConfirmBody(String code, String platform, String accountId) {
    }

    private record RelayBody(String origin, String sender, String text) {
    }

    private record SessionMessageBody(String text, String sender, String platform) {
    }
}
