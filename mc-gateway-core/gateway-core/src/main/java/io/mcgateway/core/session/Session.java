package io.mcgateway.core.session;

import io.mcgateway.core.TaskScheduler;
import io.mcgateway.protocol.AuthPayload;
import io.mcgateway.protocol.ConnectionAckPayload;
import io.mcgateway.protocol.EmptyPayload;
import io.mcgateway.protocol.ErrorPayload;
import io.mcgateway.protocol.MalformedMessageException;
import io.mcgateway.protocol.Message;
import io.mcgateway.protocol.MessageCodec;
import io.mcgateway.protocol.MessageType;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One logical connection to one game server.
 *
 * <p>A session is either <em>dialed</em> (it owns a {@link SessionConnector} and opens transports itself) or
 * <em>listening</em> (transports are attached by the registry when the game server connects in). Both kinds share
 * the same state machine, outbound queue and heartbeat. All state is guarded by a per-session lock; listener
 * callbacks run after the lock is released.
 */
public final class Session implements TransportHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);

    private final ServerIdentity identity;
    private final SessionSettings settings;
    private final SessionConnector connector;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final MessageCodec codec;
    private final SessionListener listener;
    private final Executor dialExecutor;
    private final Object lock = new Object();
    private final ArrayDeque<Message> outboundQueue = new ArrayDeque<>();
    private final AtomicLong droppedMessages = new AtomicLong();

    private SessionState state = SessionState.CONNECTING;
    private GatewayTransport transport;
    private Instant lastSeen;
    private Instant lastHeartbeatAck;
    private int attempts;
    private boolean everConnected;
    private boolean detached;
    private boolean dialing;
    private TaskScheduler.ScheduledTask heartbeatTask;
    private TaskScheduler.ScheduledTask retryTask;
    private TaskScheduler.ScheduledTask authTimeoutTask;

    public Session(
        ServerIdentity identity,
        SessionSettings settings,
        SessionConnector connector,
        TaskScheduler scheduler,
        Clock clock,
        MessageCodec codec,
        SessionListener listener
    ) {
        this(identity, settings, connector, scheduler, clock, codec, listener, Runnable::run);
    }

    /**
     * @param dialExecutor runs the blocking {@link SessionConnector#open} calls so that they never occupy a
     *     scheduler thread
     */
    public Session(
        ServerIdentity identity,
        SessionSettings settings,
        SessionConnector connector,
        TaskScheduler scheduler,
        Clock clock,
        MessageCodec codec,
        SessionListener listener,
        Executor dialExecutor
    ) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.connector = connector;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.dialExecutor = Objects.requireNonNull(dialExecutor, "dialExecutor");
    }

    public String serverId() {
        return identity.serverId();
    }

    public ServerIdentity identity() {
        return identity;
    }

    public boolean isDialed() {
        return connector != null;
    }

    public SessionState state() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isConnected() {
        return state() == SessionState.CONNECTED;
    }

    public SessionInfo info() {
        synchronized (lock) {
            return new SessionInfo(
                identity.serverId(),
                state,
                connector != null,
                lastSeen,
                outboundQueue.size(),
                droppedMessages.get(),
                attempts
            );
        }
    }

    /**
     * Starts the initial connection attempts of a dialed session.
     */
    public void start() {
        if (connector == null) {
            throw new IllegalStateException("Listening session " + serverId() + " is started by attaching a transport");
        }
        synchronized (lock) {
            if (state != SessionState.CONNECTING || retryTask != null || dialing || transport != null) {
                return;
            }
            retryTask = scheduler.schedule(this::retryTick, Duration.ZERO);
        }
    }

    /**
     * Binds a freshly opened transport. Any previous transport is closed with {@link CloseCodes#REPLACED} before
     * the new one can reach {@link SessionState#CONNECTED}.
     *
     * @return false when the session was detached and the transport was refused
     */
    public boolean transportOpened(GatewayTransport newTransport) {
        return openTransport(newTransport, DuplicatePolicy.SUPERSEDE) != AttachResult.Outcome.DETACHED;
    }

    /**
     * Attaches an inbound transport whose credentials the registry has already verified.
     */
    AttachResult.Outcome attachAuthenticated(GatewayTransport newTransport, DuplicatePolicy policy) {
        AttachResult.Outcome outcome = openTransport(newTransport, policy);
        if (outcome == AttachResult.Outcome.ATTACHED || outcome == AttachResult.Outcome.SUPERSEDED) {
            authenticated();
        }
        return outcome;
    }

    private AttachResult.Outcome openTransport(GatewayTransport newTransport, DuplicatePolicy policy) {
        Objects.requireNonNull(newTransport, "newTransport");
        Objects.requireNonNull(policy, "policy");
        List<Runnable> after = new ArrayList<>();
        boolean lost = false;
        boolean replaced;
        synchronized (lock) {
            if (detached) {
                closeQuietly(newTransport, CloseCodes.NORMAL, "session closed");
                return AttachResult.Outcome.DETACHED;
            }
            GatewayTransport previous = transport;
            replaced = previous != null && previous != newTransport && previous.isOpen();
            if (replaced && policy == DuplicatePolicy.REJECT) {
                LOGGER.warn(
                    "Rejecting duplicate connection [serverId={}, active={}, rejected={}]",
                    serverId(),
                    previous.id(),
                    newTransport.id()
                );
                closeQuietly(newTransport, CloseCodes.DUPLICATE_SERVER, "duplicate serverId");
                return AttachResult.Outcome.DUPLICATE_REJECTED;
            }
            transport = newTransport;
            if (previous != null && previous != newTransport) {
                LOGGER.info(
                    "Replacing transport [serverId={}, previous={}, current={}]",
                    serverId(),
                    previous.id(),
                    newTransport.id()
                );
                closeQuietly(previous, CloseCodes.REPLACED, "replaced");
            }
            cancelTimersLocked();
            cancelRetryLocked();
            lastSeen = clock.instant();
            moveTo(SessionState.AUTHENTICATING, "transport opened", after);
            if (connector != null) {
                lost = !sendControlLocked(authMessage());
                GatewayTransport expected = newTransport;
                authTimeoutTask = scheduler.schedule(() -> authenticationTimedOut(expected), settings.heartbeatTimeout());
            }
        }
        fire(after);
        if (lost) {
            transportLost(newTransport, CloseCodes.NORMAL, "unable to send credentials");
        }
        return replaced ? AttachResult.Outcome.SUPERSEDED : AttachResult.Outcome.ATTACHED;
    }

    public void authenticated() {
        List<Runnable> after = new ArrayList<>();
        GatewayTransport current;
        boolean lost;
        synchronized (lock) {
            if (state != SessionState.AUTHENTICATING) {
                LOGGER.debug("Ignoring authentication outside AUTHENTICATING [serverId={}, state={}]", serverId(), state);
                return;
            }
            current = transport;
            cancelTimersLocked();
            attempts = 0;
            everConnected = true;
            lastHeartbeatAck = clock.instant();
            lost = connector == null
                && !sendControlLocked(Message.of(MessageType.CONNECTION_ACK, serverId(), new ConnectionAckPayload(serverId())));
            moveTo(SessionState.CONNECTED, "authenticated", after);
            heartbeatTask = scheduler.scheduleAtFixedRate(
                this::heartbeatTick,
                settings.heartbeatInterval(),
                settings.heartbeatInterval()
            );
            if (!lost) {
                lost = !flushLocked();
            }
        }
        fire(after);
        if (lost) {
            transportLost(current, CloseCodes.NORMAL, "send failed");
        }
    }

    public void authenticationFailed(String reason) {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            if (state == SessionState.CLOSED) {
                return;
            }
            GatewayTransport current = transport;
            transport = null;
            cancelTimersLocked();
            cancelRetryLocked();
            closeQuietly(current, CloseCodes.INVALID_CREDENTIALS, "authentication failed");
            LOGGER.warn("Authentication failed, not retrying [serverId={}, reason={}]", serverId(), reason);
            moveTo(SessionState.CLOSED, "authentication failed: " + reason, after);
            after.add(() -> listener.onAuthenticationFailed(this, reason));
        }
        fire(after);
    }

    public void transportLost(String reason) {
        GatewayTransport current;
        synchronized (lock) {
            current = transport;
        }
        transportLost(current, CloseCodes.NORMAL, reason);
    }

    /**
     * Gracefully shuts the session down. Queued messages are discarded.
     */
    public void close(String reason) {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            detached = true;
            GatewayTransport current = transport;
            transport = null;
            cancelTimersLocked();
            cancelRetryLocked();
            closeQuietly(current, CloseCodes.NORMAL, reason);
            if (!outboundQueue.isEmpty()) {
                LOGGER.warn("Discarding queued messages on close [serverId={}, count={}]", serverId(), outboundQueue.size());
                outboundQueue.clear();
            }
            if (state != SessionState.CLOSED) {
                moveTo(SessionState.CLOSED, reason, after);
            }
        }
        fire(after);
    }

    /**
     * Leaves {@code CLOSED} or {@code RECONNECTING} and restarts the attempt sequence now. A connected session
     * drops its transport first so that a listening peer dials back in.
     *
     * @return false when the session has been detached
     */
    public boolean requestReconnect() {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            if (detached) {
                return false;
            }
            cancelRetryLocked();
            attempts = 0;
            if (state == SessionState.CONNECTED || state == SessionState.AUTHENTICATING) {
                GatewayTransport current = transport;
                transport = null;
                cancelTimersLocked();
                closeQuietly(current, CloseCodes.SERVICE_RESTART, "reconnect requested");
                moveTo(SessionState.RECONNECTING, "reconnect requested", after);
            } else if (state == SessionState.CLOSED) {
                SessionState next = everConnected || connector == null ? SessionState.RECONNECTING : SessionState.CONNECTING;
                moveTo(next, "reconnect requested", after);
            }
            if (connector != null) {
                retryTask = scheduler.schedule(this::retryTick, Duration.ZERO);
            } else {
                scheduleRetryLocked();
            }
        }
        fire(after);
        return true;
    }

    public SendResult send(Message message, DeliveryMode mode) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(mode, "mode");
        Message stamped = message.serverId() == null ? message.withServerId(serverId()) : message;
        SendResult result;
        GatewayTransport current;
        boolean lost = false;
        synchronized (lock) {
            current = transport;
            if (state == SessionState.CONNECTED) {
                enqueueLocked(stamped);
                lost = !flushLocked();
                result = outboundQueue.isEmpty() ? SendResult.SENT : SendResult.QUEUED;
            } else if (mode == DeliveryMode.QUEUED || isRecoveringLocked()) {
                enqueueLocked(stamped);
                result = SendResult.QUEUED;
            } else {
                result = SendResult.NOT_CONNECTED;
            }
        }
        if (lost) {
            transportLost(current, CloseCodes.NORMAL, "send failed");
        }
        return result;
    }

    @Override
    public void onFrame(GatewayTransport source, String frame) {
        Message message;
        try {
            message = codec.decode(frame);
        } catch (MalformedMessageException malformed) {
            LOGGER.warn("Dropping malformed frame [serverId={}, reason={}]", serverId(), malformed.getMessage());
            return;
        }

        Message inbound = null;
        boolean acknowledged = false;
        String authFailure = null;
        boolean lost = false;
        synchronized (lock) {
            if (source != transport) {
                LOGGER.debug("Ignoring frame from stale transport [serverId={}, transport={}]", serverId(), source.id());
                return;
            }
            lastSeen = clock.instant();
            switch (message.type()) {
                case PING:
                    lastHeartbeatAck = lastSeen;
                    lost = !sendControlLocked(
                        new Message(MessageType.PONG, serverId(), EmptyPayload.INSTANCE, message.correlationId(), null)
                    );
                    break;
                case PONG:
                    lastHeartbeatAck = lastSeen;
                    break;
                case AUTH_REQUIRED:
                    if (connector != null && state == SessionState.AUTHENTICATING) {
                        lost = !sendControlLocked(authMessage());
                    }
                    break;
                case CONNECTION_ACK:
                    acknowledged = connector != null && state == SessionState.AUTHENTICATING;
                    break;
                case AUTH_FAILED:
                    if (state == SessionState.AUTHENTICATING) {
                        authFailure = message.payloadAs(ErrorPayload.class).message();
                    }
                    break;
                case AUTH:
                    LOGGER.debug("Ignoring AUTH frame on established transport [serverId={}]", serverId());
                    break;
                case ERROR:
                    ErrorPayload error = message.payloadAs(ErrorPayload.class);
                    if (state == SessionState.AUTHENTICATING && ErrorPayload.AUTH_FAILED.equals(error.code())) {
                        authFailure = error.message();
                    } else {
                        inbound = inboundLocked(message);
                    }
                    break;
                default:
                    inbound = inboundLocked(message);
                    break;
            }
        }

        if (acknowledged) {
            authenticated();
        } else if (authFailure != null) {
            authenticationFailed(authFailure);
        } else if (lost) {
            transportLost(source, CloseCodes.NORMAL, "send failed");
        } else if (inbound != null) {
            Message delivered = inbound;
            fire(List.of(() -> listener.onInbound(this, delivered)));
        }
    }

    @Override
    public void onClosed(GatewayTransport source, int code, String reason) {
        boolean authFailure;
        synchronized (lock) {
            if (source != transport) {
                return;
            }
            authFailure = connector != null
                && state == SessionState.AUTHENTICATING
                && CloseCodes.isAuthenticationFailure(code);
        }
        if (authFailure) {
            authenticationFailed("closed by peer [code=" + code + ", reason=" + reason + "]");
        } else {
            transportLost(source, CloseCodes.NORMAL, "closed by peer [code=" + code + ", reason=" + reason + "]");
        }
    }

    private void transportLost(GatewayTransport expected, int closeCode, String reason) {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            if (expected == null || transport != expected) {
                return;
            }
            if (state != SessionState.AUTHENTICATING && state != SessionState.CONNECTED) {
                return;
            }
            transport = null;
            cancelTimersLocked();
            closeQuietly(expected, closeCode, reason);
            LOGGER.info("Transport lost [serverId={}, state={}, reason={}]", serverId(), state, reason);
            if (connector != null && !everConnected) {
                attempts++;
                if (attempts >= settings.maxInitialAttempts()) {
                    moveTo(SessionState.CLOSED, "initial connection failed after " + attempts + " attempts", after);
                } else {
                    moveTo(SessionState.CONNECTING, reason, after);
                    scheduleRetryLocked();
                }
            } else {
                // a handshake that fails during recovery counts as a spent attempt
                attempts = state == SessionState.CONNECTED ? 0 : attempts + 1;
                if (settings.reconnectPolicy().isExhausted(attempts)) {
                    moveTo(SessionState.CLOSED, "reconnect gave up after " + attempts + " attempts", after);
                } else {
                    moveTo(SessionState.RECONNECTING, reason, after);
                    scheduleRetryLocked();
                }
            }
        }
        fire(after);
    }

    private void retryTick() {
        if (connector != null) {
            attemptConnect();
            return;
        }
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            retryTask = null;
            if (state != SessionState.RECONNECTING) {
                return;
            }
            attempts++;
            if (settings.reconnectPolicy().isExhausted(attempts)) {
                moveTo(SessionState.CLOSED, "peer did not reconnect after " + attempts + " backoff windows", after);
            } else {
                LOGGER.debug("Waiting for peer to reconnect [serverId={}, attempt={}]", serverId(), attempts);
                scheduleRetryLocked();
            }
        }
        fire(after);
    }

    private void attemptConnect() {
        synchronized (lock) {
            retryTask = null;
            if (detached || dialing || (state != SessionState.CONNECTING && state != SessionState.RECONNECTING)) {
                return;
            }
            dialing = true;
        }
        try {
            dialExecutor.execute(this::dial);
        } catch (RejectedExecutionException stopped) {
            synchronized (lock) {
                dialing = false;
            }
            LOGGER.debug("Dial executor stopped, skipping connection attempt [serverId={}]", serverId());
        }
    }

    private void dial() {
        GatewayTransport opened;
        try {
            opened = connector.open(identity, this);
        } catch (IOException | RuntimeException failure) {
            synchronized (lock) {
                dialing = false;
            }
            connectFailed(failure);
            return;
        }
        synchronized (lock) {
            dialing = false;
        }
        transportOpened(opened);
    }

    private void connectFailed(Exception failure) {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            if (state != SessionState.CONNECTING && state != SessionState.RECONNECTING) {
                return;
            }
            attempts++;
            LOGGER.warn(
                "Connection attempt failed [serverId={}, state={}, attempt={}, reason={}]",
                serverId(),
                state,
                attempts,
                failure.getMessage()
            );
            if (state == SessionState.CONNECTING && attempts >= settings.maxInitialAttempts()) {
                moveTo(SessionState.CLOSED, "initial connection failed after " + attempts + " attempts", after);
            } else if (state == SessionState.RECONNECTING && settings.reconnectPolicy().isExhausted(attempts)) {
                moveTo(SessionState.CLOSED, "reconnect gave up after " + attempts + " attempts", after);
            } else {
                scheduleRetryLocked();
            }
        }
        fire(after);
    }

    private void heartbeatTick() {
        GatewayTransport current;
        boolean timedOut = false;
        boolean lost = false;
        synchronized (lock) {
            if (state != SessionState.CONNECTED) {
                return;
            }
            current = transport;
            Duration silence = Duration.between(lastHeartbeatAck, clock.instant());
            if (silence.compareTo(settings.heartbeatTimeout()) > 0) {
                timedOut = true;
            } else {
                lost = !sendControlLocked(Message.request(MessageType.PING, serverId(), EmptyPayload.INSTANCE));
            }
        }
        if (timedOut) {
            LOGGER.warn("Heartbeat timed out [serverId={}, timeout={}]", serverId(), settings.heartbeatTimeout());
            transportLost(current, CloseCodes.HEARTBEAT_TIMEOUT, "heartbeat timeout");
        } else if (lost) {
            transportLost(current, CloseCodes.NORMAL, "heartbeat send failed");
        }
    }

    private void authenticationTimedOut(GatewayTransport expected) {
        synchronized (lock) {
            if (state != SessionState.AUTHENTICATING || transport != expected) {
                return;
            }
        }
        LOGGER.warn("No authentication response [serverId={}, timeout={}]", serverId(), settings.heartbeatTimeout());
        transportLost(expected, CloseCodes.NORMAL, "authentication timed out");
    }

    private Message inboundLocked(Message message) {
        if (state != SessionState.CONNECTED) {
            LOGGER.debug("Dropping {} received while {} [serverId={}]", message.type(), state, serverId());
            return null;
        }
        if (message.serverId() != null && !message.serverId().equals(serverId())) {
            LOGGER.warn(
                "Frame claims a different serverId, using the authenticated one [serverId={}, claimed={}]",
                serverId(),
                message.serverId()
            );
        }
        return message.withServerId(serverId());
    }

    private boolean isRecoveringLocked() {
        return state == SessionState.RECONNECTING || (state == SessionState.AUTHENTICATING && everConnected);
    }

    private void enqueueLocked(Message message) {
        if (outboundQueue.size() >= settings.queueCapacity()) {
            Message evicted = outboundQueue.pollFirst();
            long dropped = droppedMessages.incrementAndGet();
            LOGGER.warn(
                "Outbound queue full, dropped oldest message [serverId={}, type={}, capacity={}, dropped={}]",
                serverId(),
                evicted == null ? null : evicted.type(),
                settings.queueCapacity(),
                dropped
            );
        }
        outboundQueue.addLast(message);
    }

    private boolean flushLocked() {
        while (!outboundQueue.isEmpty()) {
            Message next = outboundQueue.peekFirst();
            if (!sendControlLocked(next)) {
                return false;
            }
            outboundQueue.removeFirst();
        }
        return true;
    }

    private boolean sendControlLocked(Message message) {
        if (transport == null) {
            return false;
        }
        try {
            transport.send(codec.encode(message));
            LOGGER.debug("Sent {} [serverId={}, correlationId={}]", message.type(), serverId(), message.correlationId());
            return true;
        } catch (RuntimeException failure) {
            LOGGER.warn(
                "Send failed [serverId={}, type={}, reason={}]",
                serverId(),
                message.type(),
                failure.getMessage()
            );
            return false;
        }
    }

    private Message authMessage() {
        return Message.of(MessageType.AUTH, serverId(), new AuthPayload(identity.token()));
    }

    private void scheduleRetryLocked() {
        cancelRetryLocked();
        Duration delay = settings.reconnectPolicy().delayForAttempt(attempts);
        retryTask = scheduler.schedule(this::retryTick, delay);
    }

    private void cancelRetryLocked() {
        if (retryTask != null) {
            retryTask.cancel();
            retryTask = null;
        }
    }

    private void cancelTimersLocked() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel();
            heartbeatTask = null;
        }
        if (authTimeoutTask != null) {
            authTimeoutTask.cancel();
            authTimeoutTask = null;
        }
    }

    private void moveTo(SessionState next, String reason, List<Runnable> after) {
        SessionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        LOGGER.info("Session state {} -> {} [serverId={}, reason={}]", previous, next, serverId(), reason);
        after.add(() -> listener.onStateChanged(this, previous, next, reason));
    }

    private void fire(List<Runnable> callbacks) {
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException failure) {
                LOGGER.warn("Session listener failed [serverId={}]", serverId(), failure);
            }
        }
    }

    private static void closeQuietly(GatewayTransport target, int code, String reason) {
        if (target == null || !target.isOpen()) {
            return;
        }
        try {
            target.close(code, reason);
        } catch (RuntimeException failure) {
            LOGGER.debug("Ignoring failure while closing transport {}", target.id(), failure);
        }
    }
}
