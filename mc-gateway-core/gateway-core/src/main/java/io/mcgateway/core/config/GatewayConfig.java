package io.mcgateway.core.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.mcgateway.core.binding.BindingSettings;
import io.mcgateway.core.route.ForwardEvent;
import io.mcgateway.core.route.ForwardTarget;
import io.mcgateway.core.route.ForwardingTable;
import io.mcgateway.core.route.RelaySettings;
import io.mcgateway.core.session.DuplicatePolicy;
import io.mcgateway.core.session.ReconnectPolicy;
import io.mcgateway.core.session.ServerIdentity;
import io.mcgateway.core.session.SessionSettings;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gateway configuration loaded from YAML ({@code .yaml}/{@code .yml}) or JSON. Keys accept camelCase and
 * snake_case; unknown keys are ignored.
 */
public final class GatewayConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayConfig.class);

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 58008;
    public static final String DEFAULT_PATH = "/mc";
    public static final Duration DEFAULT_STATUS_QUERY_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_STATUS_POLL_INTERVAL = Duration.ZERO;

    private final Listen listen;
    private final String adminToken;
    private final SessionSettings sessionSettings;
    private final DuplicatePolicy duplicatePolicy;
    private final BindingSettings bindingSettings;
    private final Duration statusQueryTimeout;
    private final Duration statusPollInterval;
    private final RelaySettings relaySettings;
    private final List<ServerConfig> servers;
    private final Path baseDirectory;

    private GatewayConfig(
        Listen listen,
        String adminToken,
        SessionSettings sessionSettings,
        DuplicatePolicy duplicatePolicy,
        BindingSettings bindingSettings,
        Duration statusQueryTimeout,
        Duration statusPollInterval,
        RelaySettings relaySettings,
        List<ServerConfig> servers,
        Path baseDirectory
    ) {
        this.listen = Objects.requireNonNull(listen, "listen");
        this.adminToken = adminToken;
        this.sessionSettings = Objects.requireNonNull(sessionSettings, "sessionSettings");
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
        this.bindingSettings = Objects.requireNonNull(bindingSettings, "bindingSettings");
        this.statusQueryTimeout = Objects.requireNonNull(statusQueryTimeout, "statusQueryTimeout");
        this.statusPollInterval = Objects.requireNonNull(statusPollInterval, "statusPollInterval");
        this.relaySettings = Objects.requireNonNull(relaySettings, "relaySettings");
        this.servers = List.copyOf(Objects.requireNonNull(servers, "servers"));
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory");
        if (statusQueryTimeout.isZero() || statusQueryTimeout.isNegative()) {
            throw new IllegalArgumentException("statusQueryTimeoutMs must be > 0");
        }
        if (statusPollInterval.isNegative()) {
            throw new IllegalArgumentException("statusPollIntervalMs must be >= 0");
        }
        Set<String> seen = new LinkedHashSet<>();
        for (ServerConfig server : this.servers) {
            if (!seen.add(server.serverId())) {
                throw new IllegalArgumentException("Duplicate serverId in config: " + server.serverId());
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GatewayConfig load(Path configPath) throws IOException {
        ObjectMapper mapper = objectMapperFor(configPath);
        GatewaySpec spec = mapper.readValue(configPath.toFile(), GatewaySpec.class);
        if (spec == null) {
            spec = new GatewaySpec();
        }

        Path base = configPath.toAbsolutePath().normalize().getParent();
        if (base == null) {
            base = Path.of(".").toAbsolutePath().normalize();
        }
        Builder builder = builder().baseDirectory(base);

        if (spec.listen != null) {
            builder.listen(new Listen(
                trimToNull(spec.listen.host) == null ? DEFAULT_HOST : spec.listen.host.trim(),
                spec.listen.port == null ? DEFAULT_PORT : spec.listen.port,
                trimToNull(spec.listen.path) == null ? DEFAULT_PATH : spec.listen.path.trim()
            ));
        }
        if (spec.admin != null) {
            builder.adminToken(trimToNull(spec.admin.token));
        }
        builder.sessionSettings(toSessionSettings(spec));
        if (trimToNull(spec.duplicatePolicy) != null) {
            builder.duplicatePolicy(parseDuplicatePolicy(spec.duplicatePolicy));
        }
        builder.bindingSettings(toBindingSettings(spec.binding));
        if (spec.statusQueryTimeoutMs != null) {
            builder.statusQueryTimeout(Duration.ofMillis(spec.statusQueryTimeoutMs));
        }
        if (spec.statusPollIntervalMs != null) {
            builder.statusPollInterval(Duration.ofMillis(spec.statusPollIntervalMs));
        } else if (spec.statusCheckIntervalSeconds != null) {
            builder.statusPollInterval(Duration.ofSeconds(spec.statusCheckIntervalSeconds));
        }
        builder.relaySettings(toRelaySettings(spec));

        List<ServerConfig> servers = new ArrayList<>();
        if (spec.servers != null) {
            for (ServerSpec serverSpec : spec.servers) {
                servers.add(toServer(serverSpec, base));
            }
        }
        servers.addAll(zipLegacyLists(spec.serverIds, spec.tokens, spec.forwardTargets));
        builder.servers(servers);

        return builder.build();
    }

    public Listen listen() {
        return listen;
    }

    public String adminToken() {
        return adminToken;
    }

    public boolean hasAdminToken() {
        return adminToken != null;
    }

    public SessionSettings sessionSettings() {
        return sessionSettings;
    }

    public DuplicatePolicy duplicatePolicy() {
        return duplicatePolicy;
    }

    public BindingSettings bindingSettings() {
        return bindingSettings;
    }

    public Duration statusQueryTimeout() {
        return statusQueryTimeout;
    }

    public Duration statusPollInterval() {
        return statusPollInterval;
    }

    public RelaySettings relaySettings() {
        return relaySettings;
    }

    public List<ServerConfig> servers() {
        return servers;
    }

    public Path baseDirectory() {
        return baseDirectory;
    }

    /**
     * Whitelist for inbound connections. Dialed servers are excluded; the gateway connects to them instead.
     */
    public List<ServerIdentity> listenerIdentities() {
        List<ServerIdentity> identities = new ArrayList<>();
        for (ServerConfig server : servers) {
            if (!server.isDialed()) {
                identities.add(server.identity());
            }
        }
        return identities;
    }

    public ForwardingTable forwardingTable() {
        ForwardingTable.Builder table = ForwardingTable.builder();
        for (ServerConfig server : servers) {
            table.forward(server.serverId(), server.forwardTargets(), server.forwardEvents());
        }
        return table.build();
    }

    private static SessionSettings toSessionSettings(GatewaySpec spec) {
        SessionSettings defaults = SessionSettings.defaults();
        Duration interval = defaults.heartbeatInterval();
        Duration timeout = defaults.heartbeatTimeout();
        if (spec.heartbeat != null) {
            if (spec.heartbeat.intervalMs != null) {
                interval = Duration.ofMillis(spec.heartbeat.intervalMs);
            }
            if (spec.heartbeat.timeoutMs != null) {
                timeout = Duration.ofMillis(spec.heartbeat.timeoutMs);
            }
        }

        ReconnectPolicy policy = defaults.reconnectPolicy();
        int maxInitialAttempts = defaults.maxInitialAttempts();
        if (spec.reconnect != null) {
            ReconnectSpec reconnect = spec.reconnect;
            policy = new ReconnectPolicy(
                reconnect.initialDelayMs == null ? policy.initialDelay() : Duration.ofMillis(reconnect.initialDelayMs),
                reconnect.maxDelayMs == null ? policy.maxDelay() : Duration.ofMillis(reconnect.maxDelayMs),
                reconnect.multiplier == null ? policy.multiplier() : reconnect.multiplier,
                reconnect.maxAttempts == null ? policy.maxAttempts() : reconnect.maxAttempts
            );
            if (reconnect.maxInitialAttempts != null) {
                maxInitialAttempts = reconnect.maxInitialAttempts;
            }
        }
        int queueCapacity = spec.queueCapacity == null ? defaults.queueCapacity() : spec.queueCapacity;
        return new SessionSettings(interval, timeout, policy, queueCapacity, maxInitialAttempts);
    }

    private static BindingSettings toBindingSettings(BindingSpec spec) {
        BindingSettings defaults = BindingSettings.defaults();
        if (spec == null) {
            return defaults;
        }
        return new BindingSettings(
            spec.ttlSeconds == null ? defaults.ttl() : Duration.ofSeconds(spec.ttlSeconds),
            spec.sweepIntervalMs == null ? defaults.sweepInterval() : Duration.ofMillis(spec.sweepIntervalMs),
            spec.retentionSeconds == null ? defaults.retention() : Duration.ofSeconds(spec.retentionSeconds),
            spec.codeLength == null ? defaults.codeLength() : spec.codeLength
        );
    }

    private static RelaySettings toRelaySettings(GatewaySpec spec) {
        String prefix = spec.autoForwardPrefix;
        JsonNode sessions = spec.autoForwardSessions;
        if (spec.relay != null) {
            if (spec.relay.prefix != null) {
                prefix = spec.relay.prefix;
            }
            if (spec.relay.sessions != null) {
                sessions = spec.relay.sessions;
            }
        }
        Set<ForwardTarget> origins = new LinkedHashSet<>();
        for (String raw : stringList(sessions, false)) {
            origins.add(ForwardTarget.parse(raw));
        }
        if (trimToNull(prefix) == null && !origins.isEmpty()) {
            LOGGER.warn("Relay sessions configured without a relay prefix; relaying stays off");
        }
        return new RelaySettings(prefix, origins);
    }

    private static ServerConfig toServer(ServerSpec spec, Path base) throws IOException {
        String serverId = trimToNull(spec.serverId);
        if (serverId == null) {
            throw new IllegalArgumentException("Missing required server field: serverId");
        }
        String token = trimToNull(spec.token);
        if (token == null && trimToNull(spec.tokenFile) != null) {
            token = trimToNull(Files.readString(resolvePath(base, spec.tokenFile), StandardCharsets.UTF_8));
        }
        if (token == null) {
            throw new IllegalArgumentException("Missing token for server " + serverId);
        }

        Set<ForwardTarget> targets = new LinkedHashSet<>();
        for (String raw : stringList(spec.forwardTargets, false)) {
            targets.add(ForwardTarget.parse(raw));
        }
        Set<ForwardEvent> events = EnumSet.noneOf(ForwardEvent.class);
        for (String raw : stringList(spec.forwardEvents, true)) {
            events.add(ForwardEvent.parse(raw));
        }

        HttpFallback http = null;
        if (spec.http != null && trimToNull(spec.http.baseUrl) != null) {
            String httpToken = trimToNull(spec.http.token);
            http = new HttpFallback(URI.create(spec.http.baseUrl.trim()), httpToken == null ? token : httpToken);
        }
        URI dialUrl = trimToNull(spec.dialUrl) == null ? null : URI.create(spec.dialUrl.trim());
        return new ServerConfig(serverId, token, dialUrl, targets, events.isEmpty() ? ForwardingTable.DEFAULT_EVENTS : events, http);
    }

    private static List<ServerConfig> zipLegacyLists(JsonNode serverIdsNode, JsonNode tokensNode, JsonNode targetsNode) {
        List<String> serverIds = stringList(serverIdsNode, true);
        List<String> tokens = stringList(tokensNode, true);
        if (serverIds.isEmpty() && tokens.isEmpty()) {
            return List.of();
        }
        if (serverIds.size() != tokens.size()) {
            LOGGER.warn(
                "serverIds and tokens differ in length ({} vs {}); extra entries are ignored",
                serverIds.size(),
                tokens.size()
            );
        }
        Set<ForwardTarget> targets = new LinkedHashSet<>();
        for (String raw : stringList(targetsNode, false)) {
            targets.add(ForwardTarget.parse(raw));
        }
        int count = Math.min(serverIds.size(), tokens.size());
        List<ServerConfig> servers = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            servers.add(new ServerConfig(serverIds.get(i), tokens.get(i), null, targets, ForwardingTable.DEFAULT_EVENTS, null));
        }
        return servers;
    }

    /**
     * A list node, or a single string split on newlines (and on commas when {@code splitCommas}). Lines starting
     * with {@code #} are skipped.
     */
    static List<String> stringList(JsonNode node, boolean splitCommas) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                addEntries(values, element.asText(), splitCommas);
            }
            return values;
        }
        addEntries(values, node.asText(), splitCommas);
        return values;
    }

    private static void addEntries(List<String> values, String raw, boolean splitCommas) {
        if (raw == null) {
            return;
        }
        for (String line : raw.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            if (!splitCommas) {
                values.add(trimmed);
                continue;
            }
            for (String part : trimmed.split(",")) {
                String value = part.trim();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
        }
    }

    private static DuplicatePolicy parseDuplicatePolicy(String raw) {
        try {
            return DuplicatePolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException invalid) {
            throw new IllegalArgumentException("duplicatePolicy must be SUPERSEDE or REJECT but was '" + raw + "'", invalid);
        }
    }

    private static Path resolvePath(Path base, String rawPath) {
        Path path = Path.of(rawPath.trim());
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return base.resolve(path).normalize();
    }

    private static ObjectMapper objectMapperFor(Path configPath) {
        String lower = configPath.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper;
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            mapper = new ObjectMapper(new YAMLFactory());
        } else {
            mapper = new ObjectMapper();
        }
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private Listen listen = Listen.defaults();
        private String adminToken;
        private SessionSettings sessionSettings = SessionSettings.defaults();
        private DuplicatePolicy duplicatePolicy = DuplicatePolicy.SUPERSEDE;
        private BindingSettings bindingSettings = BindingSettings.defaults();
        private Duration statusQueryTimeout = DEFAULT_STATUS_QUERY_TIMEOUT;
        private Duration statusPollInterval = DEFAULT_STATUS_POLL_INTERVAL;
        private RelaySettings relaySettings = RelaySettings.disabled();
        private List<ServerConfig> servers = List.of();
        private Path baseDirectory = Path.of(".").toAbsolutePath().normalize();

        private Builder() {
        }

        public Builder listen(Listen listen) {
            this.listen = listen;
            return this;
        }

        public Builder adminToken(String adminToken) {
            this.adminToken = adminToken;
            return this;
        }

        public Builder sessionSettings(SessionSettings sessionSettings) {
            this.sessionSettings = sessionSettings;
            return this;
        }

        public Builder duplicatePolicy(DuplicatePolicy duplicatePolicy) {
            this.duplicatePolicy = duplicatePolicy;
            return this;
        }

        public Builder bindingSettings(BindingSettings bindingSettings) {
            this.bindingSettings = bindingSettings;
            return this;
        }

        public Builder statusQueryTimeout(Duration statusQueryTimeout) {
            this.statusQueryTimeout = statusQueryTimeout;
            return this;
        }

        public Builder statusPollInterval(Duration statusPollInterval) {
            this.statusPollInterval = statusPollInterval;
            return this;
        }

        public Builder relaySettings(RelaySettings relaySettings) {
            this.relaySettings = relaySettings;
            return this;
        }

        public Builder servers(List<ServerConfig> servers) {
            this.servers = servers;
            return this;
        }

        public Builder baseDirectory(Path baseDirectory) {
            this.baseDirectory = baseDirectory;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(
                listen,
                adminToken,
                sessionSettings,
                duplicatePolicy,
                bindingSettings,
                statusQueryTimeout,
                statusPollInterval,
                relaySettings,
                servers,
                baseDirectory
            );
        }
    }

    public record Listen(String host, int port, String path) {
        public Listen {
            host = Objects.requireNonNull(host, "host");
            path = Objects.requireNonNull(path, "path");
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("listen.port must be between 0 and 65535");
            }
            if (!path.startsWith("/")) {
                throw new IllegalArgumentException("listen.path must start with '/'");
            }
        }

        public static Listen defaults() {
            return new Listen(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_PATH);
        }
    }

    public record ServerConfig(
        String serverId,
        String token,
        URI dialUrl,
        Set<ForwardTarget> forwardTargets,
        Set<ForwardEvent> forwardEvents,
        HttpFallback http
    ) {
        public ServerConfig {
            serverId = Objects.requireNonNull(serverId, "serverId");
            token = Objects.requireNonNull(token, "token");
            forwardTargets = Set.copyOf(Objects.requireNonNull(forwardTargets, "forwardTargets"));
            forwardEvents = Set.copyOf(Objects.requireNonNull(forwardEvents, "forwardEvents"));
            if (serverId.isBlank()) {
                throw new IllegalArgumentException("serverId must not be blank");
            }
            if (dialUrl != null && !"ws".equals(dialUrl.getScheme()) && !"wss".equals(dialUrl.getScheme())) {
                throw new IllegalArgumentException("dialUrl must use ws or wss: " + dialUrl);
            }
        }

        public ServerIdentity identity() {
            return new ServerIdentity(serverId, token);
        }

        public boolean isDialed() {
            return dialUrl != null;
        }

        @Override
        public String toString() {
            return "ServerConfig[serverId=" + serverId + ", token=" + identity().maskedToken() + ", dialUrl=" + dialUrl
                + ", forwardTargets=" + forwardTargets + ", forwardEvents=" + forwardEvents + ", http=" + http + "]";
        }
    }

    public record HttpFallback(URI baseUrl, String token) {
        public HttpFallback {
            baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
            if (!"http".equals(baseUrl.getScheme()) && !"https".equals(baseUrl.getScheme())) {
                throw new IllegalArgumentException("http.baseUrl must use http or https: " + baseUrl);
            }
        }

        @Override
        public String toString() {
            return "HttpFallback[baseUrl=" + baseUrl + ", token=" + (token == null ? "none" : "****") + "]";
        }
    }

    static final class GatewaySpec {
        public ListenSpec listen;
        public AdminSpec admin;
        public HeartbeatSpec heartbeat;
        public ReconnectSpec reconnect;

        @JsonAlias({"queue_capacity"})
        public Integer queueCapacity;

        @JsonAlias({"duplicate_policy"})
        public String duplicatePolicy;

        public BindingSpec binding;

        @JsonAlias({"status_query_timeout_ms"})
        public Long statusQueryTimeoutMs;

        @JsonAlias({"status_poll_interval_ms"})
        public Long statusPollIntervalMs;

        @JsonAlias({"status_check_interval"})
        public Long statusCheckIntervalSeconds;

        public RelaySpec relay;

        @JsonAlias({"auto_forward_prefix"})
        public String autoForwardPrefix;

        @JsonAlias({"auto_forward_sessions"})
        public JsonNode autoForwardSessions;

        public List<ServerSpec> servers;

        @JsonAlias({"server_ids", "server_id", "serverId"})
        public JsonNode serverIds;

        @JsonAlias({"token"})
        public JsonNode tokens;

        @JsonAlias({"forward_targets", "forward_target_session"})
        public JsonNode forwardTargets;
    }

    static final class ListenSpec {
        @JsonAlias({"websocket_host"})
        public String host;

        @JsonAlias({"websocket_port"})
        public Integer port;

        public String path;
    }

    static final class RelaySpec {
        public String prefix;

        public JsonNode sessions;
    }

    static final class AdminSpec {
        public String token;
    }

    static final class HeartbeatSpec {
        @JsonAlias({"interval_ms"})
        public Long intervalMs;

        @JsonAlias({"timeout_ms"})
        public Long timeoutMs;
    }

    static final class ReconnectSpec {
        @JsonAlias({"initial_delay_ms"})
        public Long initialDelayMs;

        @JsonAlias({"max_delay_ms"})
        public Long maxDelayMs;

        public Double multiplier;

        @JsonAlias({"max_attempts"})
        public Integer maxAttempts;

        @JsonAlias({"max_initial_attempts"})
        public Integer maxInitialAttempts;
    }

    static final class BindingSpec {
        @JsonAlias({"ttl_seconds"})
        public Long ttlSeconds;

        @JsonAlias({"sweep_interval_ms"})
        public Long sweepIntervalMs;

        @JsonAlias({"retention_seconds"})
        public Long retentionSeconds;

        @JsonAlias({"code_length"})
        public Integer codeLength;
    }

    static final class ServerSpec {
        @JsonAlias({"server_id", "id"})
        public String serverId;

        public String token;

        @JsonAlias({"token_file"})
        public String tokenFile;

        @JsonAlias({"dial_url"})
        public String dialUrl;

        @JsonAlias({"forward_targets", "forward_target_session"})
        public JsonNode forwardTargets;

        @JsonAlias({"forward_events"})
        public JsonNode forwardEvents;

        public HttpSpec http;
    }

    static final class HttpSpec {
        @JsonAlias({"base_url", "url"})
        public String baseUrl;

        public String token;
    }
}
