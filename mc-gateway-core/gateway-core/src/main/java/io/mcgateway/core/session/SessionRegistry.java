package io.mcgateway.core.session;

import io.mcgateway.core.TaskScheduler;
import io.mcgateway.protocol.MessageCodec;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Table of live sessions keyed by {@code serverId}. Owned by a gateway instance, never shared process-wide.
 */
public final class SessionRegistry implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, ServerIdentity> credentials;
    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final SessionSettings settings;
    private final DuplicatePolicy duplicatePolicy;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final MessageCodec codec;
    private final SessionListener listener;
    private final Executor dialExecutor;

    public SessionRegistry(
        Collection<ServerIdentity> allowedServers,
        SessionSettings settings,
        DuplicatePolicy duplicatePolicy,
        TaskScheduler scheduler,
        Clock clock,
        MessageCodec codec,
        SessionListener listener
    ) {
        this(allowedServers, settings, duplicatePolicy, scheduler, clock, codec, listener, Runnable::run);
    }

    public SessionRegistry(
        Collection<ServerIdentity> allowedServers,
        SessionSettings settings,
        DuplicatePolicy duplicatePolicy,
        TaskScheduler scheduler,
        Clock clock,
        MessageCodec codec,
        SessionListener listener,
        Executor dialExecutor
    ) {
        Objects.requireNonNull(allowedServers, "allowedServers");
        Map<String, ServerIdentity> table = new LinkedHashMap<>();
        for (ServerIdentity identity : allowedServers) {
            if (table.putIfAbsent(identity.serverId(), identity) != null) {
                throw new IllegalArgumentException("Duplicate serverId in whitelist: " + identity.serverId());
            }
        }
        this.credentials = Map.copyOf(table);
        this.settings = Objects.requireNonNull(settings, "settings");
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.dialExecutor = Objects.requireNonNull(dialExecutor, "dialExecutor");

        if (credentials.isEmpty()) {
            LOGGER.warn("No serverId/token whitelist loaded; every inbound connection will be rejected");
        } else {
            LOGGER.info("Whitelist loaded ({}): {}", credentials.size(), String.join(", ", new TreeSet<>(credentials.keySet())));
        }
    }

    /**
     * Authenticates and attaches an inbound transport. A failed authentication closes only the offending transport;
     * any existing session for the same id is left untouched.
     */
    public AttachResult attach(String serverId, String token, GatewayTransport transport) {
        Objects.requireNonNull(transport, "transport");
        if (isBlank(serverId) || isBlank(token)) {
            LOGGER.warn("Rejected connection without credentials [transport={}]", transport.id());
            closeQuietly(transport, CloseCodes.MISSING_CREDENTIALS, "missing serverId/token");
            return AttachResult.failed(AttachResult.Outcome.AUTHENTICATION_FAILED, "missing serverId/token");
        }
        String id = serverId.trim();
        ServerIdentity identity = credentials.get(id);
        if (identity == null || !identity.matches(token)) {
            LOGGER.warn("Rejected connection with invalid credentials [serverId={}, transport={}]", id, transport.id());
            closeQuietly(transport, CloseCodes.INVALID_CREDENTIALS, "invalid token");
            return AttachResult.failed(AttachResult.Outcome.AUTHENTICATION_FAILED, "invalid token");
        }

        while (true) {
            Session session = sessions.computeIfAbsent(id, ignored -> newSession(identity, null));
            if (session.isDialed()) {
                LOGGER.warn("Rejected inbound connection for a dialed server [serverId={}]", id);
                closeQuietly(transport, CloseCodes.DUPLICATE_SERVER, "server is dialed by the gateway");
                return AttachResult.failed(AttachResult.Outcome.DUPLICATE_REJECTED, "server is dialed by the gateway");
            }
            AttachResult.Outcome outcome = session.attachAuthenticated(transport, duplicatePolicy);
            if (outcome == AttachResult.Outcome.DETACHED) {
                sessions.remove(id, session);
                continue;
            }
            if (outcome == AttachResult.Outcome.DUPLICATE_REJECTED) {
                return AttachResult.failed(outcome, "duplicate serverId " + id);
            }
            LOGGER.info("Game server attached [serverId={}, transport={}, outcome={}]", id, transport.id(), outcome);
            return AttachResult.accepted(outcome, session);
        }
    }

    /**
     * Creates a session that dials the game server itself and starts connecting.
     */
    public Session register(ServerIdentity identity, SessionConnector connector) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(connector, "connector");
        Session session = newSession(identity, connector);
        Session existing = sessions.putIfAbsent(identity.serverId(), session);
        if (existing != null) {
            throw new IllegalStateException("Session already registered for serverId " + identity.serverId());
        }
        LOGGER.info("Dialing game server [serverId={}]", identity.serverId());
        session.start();
        return session;
    }

    public boolean detach(String serverId) {
        if (serverId == null) {
            return false;
        }
        Session removed = sessions.remove(serverId);
        if (removed == null) {
            return false;
        }
        removed.close("detached");
        return true;
    }

    public Optional<Session> lookup(String serverId) {
        if (serverId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(serverId));
    }

    public List<SessionInfo> list() {
        List<SessionInfo> snapshot = new ArrayList<>();
        for (Session session : sessions.values()) {
            snapshot.add(session.info());
        }
        snapshot.sort(Comparator.comparing(SessionInfo::serverId));
        return snapshot;
    }

    /**
     * Ids that may hold a session: whitelisted listeners plus dialed servers.
     */
    public Set<String> knownServerIds() {
        Set<String> ids = new TreeSet<>(credentials.keySet());
        ids.addAll(sessions.keySet());
        return ids;
    }

    public Map<String, ServerIdentity> credentials() {
        return credentials;
    }

    @Override
    public void close() {
        for (String serverId : new ArrayList<>(sessions.keySet())) {
            detach(serverId);
        }
    }

    private Session newSession(ServerIdentity identity, SessionConnector connector) {
        return new Session(identity, settings, connector, scheduler, clock, codec, listener, dialExecutor);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static void closeQuietly(GatewayTransport transport, int code, String reason) {
        try {
            transport.close(code, reason);
        } catch (RuntimeException failure) {
            LOGGER.debug("Ignoring failure while closing rejected transport {}", transport.id(), failure);
        }
    }
}
