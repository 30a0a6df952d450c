package io.mcgateway.core;

import io.mcgateway.core.binding.BindingCodeGenerator;
import io.mcgateway.core.binding.BindingCoordinator;
import io.mcgateway.core.command.CommandDispatcher;
import io.mcgateway.core.command.ReplyFormatter;
import io.mcgateway.core.config.GatewayConfig;
import io.mcgateway.core.route.ForwardTarget;
import io.mcgateway.core.route.PlatformRelay;
import io.mcgateway.core.route.RouteResult;
import io.mcgateway.core.route.Router;
import io.mcgateway.core.session.Session;
import io.mcgateway.core.session.SessionConnector;
import io.mcgateway.core.session.SessionListener;
import io.mcgateway.core.session.SessionRegistry;
import io.mcgateway.core.session.SessionState;
import io.mcgateway.core.status.StatusFallback;
import io.mcgateway.core.status.StatusPoller;
import io.mcgateway.core.status.StatusQueryFacade;
import io.mcgateway.protocol.BindCodeIssuedPayload;
import io.mcgateway.protocol.CommandResultPayload;
import io.mcgateway.protocol.ErrorPayload;
import io.mcgateway.protocol.Message;
import io.mcgateway.protocol.MessageCodec;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One gateway instance: session registry, router, binding coordinator, status queries and the command path, wired
 * from a {@link GatewayConfig}. Several instances can live in one JVM.
 */
public final class Gateway implements SessionListener, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Gateway.class);

    private final GatewayConfig config;
    private final ChatPlatform platform;
    private final TaskScheduler scheduler;
    private final boolean ownsScheduler;
    private final ExecutorService ownedDialExecutor;
    private final Function<GatewayConfig.ServerConfig, SessionConnector> connectors;
    private final SessionRegistry registry;
    private final Router router;
    private final BindingCoordinator bindings;
    private final StatusQueryFacade statusQueries;
    private final StatusPoller statusPoller;
    private final PlatformRelay relay;
    private final CommandDispatcher commands;

    private TaskScheduler.ScheduledTask querySweep;
    private boolean started;

    public Gateway(
        GatewayConfig config,
        ChatPlatform platform,
        TaskScheduler scheduler,
        Clock clock,
        Function<GatewayConfig.ServerConfig, SessionConnector> connectors,
        Function<GatewayConfig.HttpFallback, StatusFallback> fallbacks
    ) {
        this(config, platform, scheduler, false, clock, connectors, fallbacks, BindingCodeGenerator.numeric(), Runnable::run, null);
    }

    /**
     * @param dialExecutor runs the blocking connect of dialed servers; the caller owns it
     */
    public Gateway(
        GatewayConfig config,
        ChatPlatform platform,
        TaskScheduler scheduler,
        Clock clock,
        Function<GatewayConfig.ServerConfig, SessionConnector> connectors,
        Function<GatewayConfig.HttpFallback, StatusFallback> fallbacks,
        Executor dialExecutor
    ) {
        this(config, platform, scheduler, false, clock, connectors, fallbacks, BindingCodeGenerator.numeric(), dialExecutor, null);
    }

    private Gateway(
        GatewayConfig config,
        ChatPlatform platform,
        TaskScheduler scheduler,
        boolean ownsScheduler,
        Clock clock,
        Function<GatewayConfig.ServerConfig, SessionConnector> connectors,
        Function<GatewayConfig.HttpFallback, StatusFallback> fallbacks,
        BindingCodeGenerator codeGenerator,
        Executor dialExecutor,
        ExecutorService ownedDialExecutor
    ) {
        this.config = Objects.requireNonNull(config, "config");
        this.platform = Objects.requireNonNull(platform, "platform");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
        this.ownedDialExecutor = ownedDialExecutor;
        this.connectors = Objects.requireNonNull(connectors, "connectors");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(fallbacks, "fallbacks");

        this.registry = new SessionRegistry(
            config.listenerIdentities(),
            config.sessionSettings(),
            config.duplicatePolicy(),
            scheduler,
            clock,
            new MessageCodec(),
            this,
            Objects.requireNonNull(dialExecutor, "dialExecutor")
        );
        this.router = new Router(registry, platform, config.forwardingTable());
        this.bindings = new BindingCoordinator(router, platform, config.bindingSettings(), codeGenerator, scheduler, clock);

        Map<String, StatusFallback> fallbackByServer = new LinkedHashMap<>();
        for (GatewayConfig.ServerConfig server : config.servers()) {
            if (server.http() != null) {
                fallbackByServer.put(server.serverId(), fallbacks.apply(server.http()));
            }
        }
        this.statusQueries = new StatusQueryFacade(
            registry,
            router,
            fallbackByServer,
            scheduler,
            clock,
            config.statusQueryTimeout()
        );
        this.statusPoller = new StatusPoller(registry, statusQueries, scheduler, clock, config.statusPollInterval());
        this.relay = new PlatformRelay(router, registry, config.relaySettings());
        this.commands = new CommandDispatcher(registry, router, statusQueries, bindings, new ReplyFormatter());
    }

    /**
     * Creates a gateway on its own scheduler threads, its own dial threads and the system clock. Closing the gateway
     * stops them.
     */
    public static Gateway create(
        GatewayConfig config,
        ChatPlatform platform,
        Function<GatewayConfig.ServerConfig, SessionConnector> connectors,
        Function<GatewayConfig.HttpFallback, StatusFallback> fallbacks
    ) {
        ExecutorService dials = newDialExecutor("mc-gateway-dial");
        return new Gateway(
            config,
            platform,
            new ExecutorTaskScheduler("mc-gateway-timer", 2),
            true,
            Clock.systemUTC(),
            connectors,
            fallbacks,
            BindingCodeGenerator.numeric(),
            dials,
            dials
        );
    }

    // One thread per in-flight dial; idle threads exit after a minute.
    private static ExecutorService newDialExecutor(String threadNamePrefix) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, threadNamePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts the binding sweep, the query sweep and the status poll, then begins dialing every server that has a
     * {@code dialUrl}.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        bindings.start();
        querySweep = scheduler.scheduleAtFixedRate(
            statusQueries::sweep,
            config.statusQueryTimeout(),
            config.statusQueryTimeout()
        );
        statusPoller.start();
        for (GatewayConfig.ServerConfig server : config.servers()) {
            if (server.isDialed()) {
                registry.register(server.identity(), connectors.apply(server));
            }
        }
        LOGGER.info(
            "Gateway started [listenerServers={}, dialedServers={}]",
            config.listenerIdentities().size(),
            config.servers().size() - config.listenerIdentities().size()
        );
    }

    public GatewayConfig config() {
        return config;
    }

    public SessionRegistry registry() {
        return registry;
    }

    public Router router() {
        return router;
    }

    public BindingCoordinator bindings() {
        return bindings;
    }

    public StatusQueryFacade statusQueries() {
        return statusQueries;
    }

    public StatusPoller statusPoller() {
        return statusPoller;
    }

    public PlatformRelay relay() {
        return relay;
    }

    public CommandDispatcher commands() {
        return commands;
    }

    TaskScheduler scheduler() {
        return scheduler;
    }

    /**
     * Relays a line typed in a chat session into the game when it carries the relay prefix.
     *
     * @return per-server route results; empty when the line was not relayed
     */
    public Map<String, RouteResult> relayFromPlatform(ForwardTarget origin, String sender, String text) {
        return relay.autoForward(origin, sender, text);
    }

    @Override
    public void onInbound(Session session, Message message) {
        String serverId = session.serverId();
        switch (message.type()) {
            case CHAT:
            case PLAYER_EVENT:
                router.forwardInbound(message);
                break;
            case STATUS_RESPONSE:
                statusQueries.onResponse(message);
                break;
            case BIND_CODE_ISSUED:
                onBindCodeIssued(serverId, message.payloadAs(BindCodeIssuedPayload.class));
                break;
            case BIND_RESULT:
                bindings.acknowledge(message);
                break;
            case COMMAND_RESULT: {
                CommandResultPayload result = message.payloadAs(CommandResultPayload.class);
                LOGGER.info(
                    "Command result [serverId={}, correlationId={}, success={}, output={}]",
                    serverId,
                    message.correlationId(),
                    result.success(),
                    result.output()
                );
                break;
            }
            case ERROR: {
                ErrorPayload error = message.payloadAs(ErrorPayload.class);
                LOGGER.warn("Game server reported an error [serverId={}, code={}, message={}]", serverId, error.code(), error.message());
                break;
            }
            default:
                LOGGER.warn("Ignoring unexpected {} from game server [serverId={}]", message.type(), serverId);
        }
    }

    @Override
    public void onStateChanged(Session session, SessionState previous, SessionState current, String reason) {
        String serverId = session.serverId();
        if (current == SessionState.CONNECTED) {
            try {
                platform.onServerOnline(serverId);
            } catch (RuntimeException failure) {
                LOGGER.warn("Chat platform rejected online notice [serverId={}]", serverId, failure);
            }
            router.forwardServerStatus(serverId, true, reason);
        } else if (previous == SessionState.CONNECTED) {
            try {
                platform.onServerOffline(serverId, reason);
            } catch (RuntimeException failure) {
                LOGGER.warn("Chat platform rejected offline notice [serverId={}]", serverId, failure);
            }
            router.forwardServerStatus(serverId, false, reason);
        }
    }

    @Override
    public void onAuthenticationFailed(Session session, String reason) {
        try {
            platform.onAuthenticationFailed(session.serverId(), reason);
        } catch (RuntimeException failure) {
            LOGGER.warn("Chat platform rejected authentication failure notice [serverId={}]", session.serverId(), failure);
        }
    }

    @Override
    public synchronized void close() {
        if (querySweep != null) {
            querySweep.cancel();
            querySweep = null;
        }
        statusPoller.close();
        bindings.close();
        statusQueries.close();
        registry.close();
        if (ownedDialExecutor != null) {
            ownedDialExecutor.shutdownNow();
        }
        if (ownsScheduler) {
            scheduler.close();
        }
        LOGGER.info("Gateway stopped");
    }

    private void onBindCodeIssued(String serverId, BindCodeIssuedPayload issued) {
        if (issued.force()) {
            bindings.cancelPending(serverId, issued.playerUuid());
        }
        Instant expiresAt = issued.expiresAt() == null ? null : Instant.ofEpochMilli(issued.expiresAt());
        bindings.register(serverId, issued.code(), issued.playerUuid(), issued.playerName(), expiresAt);
    }
}
