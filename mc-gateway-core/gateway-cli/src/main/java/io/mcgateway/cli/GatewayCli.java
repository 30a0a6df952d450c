package io.mcgateway.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcgateway.core.config.GatewayConfig;
import io.mcgateway.core.session.ServerIdentity;
import io.mcgateway.protocol.MessageCodec;
import io.mcgateway.server.GatewayServer;
import io.mcgateway.server.HttpStatusClient;
import io.mcgateway.server.LoggingChatPlatform;
import java.io.IOException;
import java.io.PrintWriter;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "mc-gateway",
    mixinStandardHelpOptions = true,
    versionProvider = GatewayCli.VersionProvider.class,
    description = "WebSocket gateway between game servers and chat platforms",
    subcommands = {
        GatewayCli.ServeCommand.class,
        GatewayCli.CheckConfigCommand.class,
        GatewayCli.QueryCommand.class
    }
)
public final class GatewayCli implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG_ERROR = 3;
    static final int EXIT_RUNTIME_ERROR = 4;
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().getOut().println("mc-gateway version " + currentVersion());
        return EXIT_OK;
    }

    static String currentVersion() {
        String version = System.getProperty("mc.gateway.version");
        return version == null || version.isBlank() ? "0.1.0-SNAPSHOT" : version;
    }

    static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new GatewayCli());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setParameterExceptionHandler((ex, args) -> {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_CONFIG_ERROR;
        });
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            cmd.getErr().println(ex.getMessage());
            return EXIT_RUNTIME_ERROR;
        });
        return commandLine;
    }

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    @Command(
        name = "serve",
        mixinStandardHelpOptions = true,
        description = "Run the gateway until the process is interrupted"
    )
    static final class ServeCommand implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Option(names = "--config", required = true, description = "Gateway configuration file (.yaml, .yml or .json)")
        private Path config;

        @Override
        public Integer call() {
            GatewayConfig loaded;
            try {
                loaded = GatewayConfig.load(config);
            } catch (IOException | IllegalArgumentException configFailure) {
                spec.commandLine().getErr().println(configFailure.getMessage());
                return EXIT_CONFIG_ERROR;
            }

            GatewayServer server = new GatewayServer(loaded, new LoggingChatPlatform());
            CountDownLatch stopped = new CountDownLatch(1);
            try {
                server.start();
            } catch (RuntimeException startFailure) {
                server.close();
                spec.commandLine().getErr().println("Unable to start gateway: " + startFailure.getMessage());
                return EXIT_RUNTIME_ERROR;
            }
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.close();
                stopped.countDown();
            }, "mc-gateway-shutdown"));

            try {
                stopped.await();
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                server.close();
            }
            return EXIT_OK;
        }
    }

    @Command(
        name = "check-config",
        mixinStandardHelpOptions = true,
        description = "Validate a configuration file and print the connect URL of every game server"
    )
    static final class CheckConfigCommand implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Option(names = "--config", required = true, description = "Gateway configuration file (.yaml, .yml or .json)")
        private Path config;

        @Override
        public Integer call() {
            GatewayConfig loaded;
            try {
                loaded = GatewayConfig.load(config);
            } catch (IOException | IllegalArgumentException configFailure) {
                spec.commandLine().getErr().println(configFailure.getMessage());
                return EXIT_CONFIG_ERROR;
            }

            PrintWriter out = spec.commandLine().getOut();
            GatewayConfig.Listen listen = loaded.listen();
            String endpoint = "ws://" + listen.host() + ":" + listen.port() + listen.path();
            out.println("Endpoint: " + endpoint);
            out.println("Admin API: " + (loaded.hasAdminToken() ? "bearer token required" : "open"));
            for (GatewayConfig.ServerConfig server : loaded.servers()) {
                ServerIdentity identity = server.identity();
                if (server.isDialed()) {
                    out.println(server.serverId() + " (dialed): " + server.dialUrl());
                } else {
                    out.println(server.serverId() + ": " + endpoint + "?serverId=" + server.serverId()
                        + "&token=" + identity.maskedToken());
                }
                if (server.http() != null) {
                    out.println("  http fallback: " + server.http().baseUrl());
                }
                if (server.forwardTargets().isEmpty()) {
                    out.println("  forwarding: disabled");
                } else {
                    out.println("  forwarding: " + server.forwardTargets().size() + " target(s) " + server.forwardEvents());
                }
            }
            out.flush();
            return EXIT_OK;
        }
    }

    @Command(
        name = "query",
        mixinStandardHelpOptions = true,
        description = "Query a game server's HTTP API for status or players and print the result as JSON"
    )
    static final class QueryCommand implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Option(names = "--url", required = true, description = "Base URL of the game server HTTP API")
        private URI url;

        @Option(names = "--token", description = "Bearer token for the game server HTTP API")
        private String token;

        @Option(names = "--timeout-ms", defaultValue = "5000", description = "Request timeout in milliseconds")
        private long timeoutMs;

        @Option(names = "--out", description = "Write the JSON result to this file instead of standard output")
        private Path out;

        @Parameters(index = "0", description = "What to query: ${COMPLETION-CANDIDATES}")
        private QueryTarget target;

        @Override
        public Integer call() {
            if (timeoutMs <= 0) {
                spec.commandLine().getErr().println("timeout-ms must be > 0");
                return EXIT_CONFIG_ERROR;
            }
            if (!"http".equals(url.getScheme()) && !"https".equals(url.getScheme())) {
                spec.commandLine().getErr().println("url must use http or https: " + url);
                return EXIT_CONFIG_ERROR;
            }
            HttpStatusClient client = new HttpStatusClient(url, token, Duration.ofMillis(timeoutMs));

            MessageCodec codec = new MessageCodec(JSON);
            try {
                ObjectNode result;
                switch (target) {
                    case STATUS:
                        result = codec.writeStatus(client.fetchStatus());
                        break;
                    case PLAYERS:
                        result = codec.writePlayers(client.fetchPlayers());
                        break;
                    default:
                        throw new IllegalStateException("Unsupported query target: " + target);
                }
                String json = JSON.writeValueAsString(result);
                if (out == null) {
                    spec.commandLine().getOut().println(json);
                    spec.commandLine().getOut().flush();
                } else {
                    Path parent = out.toAbsolutePath().getParent();
                    if (parent != null) {
                        Files.createDirectories(parent);
                    }
                    Files.writeString(out, json + System.lineSeparator());
                }
                return EXIT_OK;
            } catch (IOException queryFailure) {
                spec.commandLine().getErr().println("Query failed: " + queryFailure.getMessage());
                return EXIT_RUNTIME_ERROR;
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                spec.commandLine().getErr().println("Query interrupted");
                return EXIT_RUNTIME_ERROR;
            }
        }
    }

    enum QueryTarget {
        STATUS,
        PLAYERS
    }

    public static final class VersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {"mc-gateway " + currentVersion()};
        }
    }
}
