package io.mcgateway.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class GatewayCliTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void executesDefaultCommand() {
        int exitCode = GatewayCli.newCommandLine().execute();

        assertEquals(GatewayCli.EXIT_OK, exitCode);
        assertTrue(GatewayCli.currentVersion().contains("SNAPSHOT") || GatewayCli.currentVersion().matches("\\d+\\.\\d+.*"));
    }

    @Test
    void checkConfigPrintsConnectUrlsWithMaskedTokens(@TempDir Path tempDir) throws IOException {
        Path config = tempDir.resolve("gateway.yaml");
        Files.writeString(config, String.join(
            "\n",
            "listen:",
            "  host: 127.0.0.1",
            "  port: 58008",
            "  path: /mc",
            "servers:",
            "  - serverId: lobby",
            "    token: lobby-secret",
            "    forwardTargets:",
            "      - aiocqhttp:GroupMessage:123456",
            "  - serverId: creative",
            "    token: creative-secret",
            "    dialUrl: ws://127.0.0.1:25580/gateway",
            ""
        ));
        StringWriter out = new StringWriter();
        CommandLine commandLine = GatewayCli.newCommandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("check-config", "--config", config.toString());

        assertEquals(GatewayCli.EXIT_OK, exitCode);
        String printed = out.toString();
        assertTrue(printed.contains("lobby: ws://127.0.0.1:58008/mc?serverId=lobby&token=lo****et"));
        assertTrue(printed.contains("creative (dialed): ws://127.0.0.1:25580/gateway"));
        assertTrue(printed.contains("Admin API: open"));
        assertFalse(printed.contains("lobby-secret"));
    }

    @Test
    void checkConfigRejectsMissingFile(@TempDir Path tempDir) {
        StringWriter err = new StringWriter();
        CommandLine commandLine = GatewayCli.newCommandLine();
        commandLine.setErr(new PrintWriter(err));

        int exitCode = commandLine.execute("check-config", "--config", tempDir.resolve("absent.yaml").toString());

        assertEquals(GatewayCli.EXIT_CONFIG_ERROR, exitCode);
    }

    @Test
    void checkConfigRejectsDuplicateServerIds(@TempDir Path tempDir) throws IOException {
        Path config = tempDir.resolve("gateway.json");
        Files.writeString(config, "{\"servers\":[{\"serverId\":\"lobby\",\"token\":\"a-secret\"},"
            + "{\"serverId\":\"lobby\",\"token\":\"b-secret\"}]}");
        CommandLine commandLine = GatewayCli.newCommandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        int exitCode = commandLine.execute("check-config", "--config", config.toString());

        assertEquals(GatewayCli.EXIT_CONFIG_ERROR, exitCode);
    }

    @Test
    void serveRejectsInvalidConfiguration(@TempDir Path tempDir) throws IOException {
        Path config = tempDir.resolve("gateway.yaml");
        Files.writeString(config, "duplicatePolicy: sometimes\n");
        CommandLine commandLine = GatewayCli.newCommandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        int exitCode = commandLine.execute("serve", "--config", config.toString());

        assertEquals(GatewayCli.EXIT_CONFIG_ERROR, exitCode);
    }

    @Test
    void queryWritesStatusJson(@TempDir Path tempDir) throws IOException {
        Javalin api = Javalin.create(config -> config.showJavalinBanner = false);
        api.get("/api/status", ctx -> {
            if (!"Bearer api-token".equals(ctx.header("Authorization"))) {
                ctx.status(401);
                return;
            }
            ctx.contentType("application/json").result(
                "{\"data\":{\"version\":\"1.21\",\"onlinePlayers\":5,\"maxPlayers\":40,\"tps\":20.0}}"
            );
        });
        api.start("127.0.0.1", 0);
        try {
            Path out = tempDir.resolve("status.json");

            int exitCode = GatewayCli.newCommandLine().execute(
                "query",
                "--url",
                "http://127.0.0.1:" + api.port(),
                "--token",
                "api-token",
                "--out",
                out.toString(),
                "status"
            );

            assertEquals(GatewayCli.EXIT_OK, exitCode);
            JsonNode json = JSON.readTree(Files.readString(out));
            assertEquals("1.21", json.path("version").asText());
            assertEquals(5, json.path("onlinePlayers").asInt());
            assertEquals(20.0, json.path("tps").get(0).asDouble());
        } finally {
            api.stop();
        }
    }

    @Test
    void queryAgainstUnreachableServerIsRuntimeError() throws IOException {
        int unusedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            unusedPort = socket.getLocalPort();
        }
        CommandLine commandLine = GatewayCli.newCommandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        int exitCode = commandLine.execute("query", "--url", "http://127.0.0.1:" + unusedPort, "players");

        assertEquals(GatewayCli.EXIT_RUNTIME_ERROR, exitCode);
    }

    @Test
    void unknownQueryTargetIsConfigError() {
        CommandLine commandLine = GatewayCli.newCommandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        int exitCode = commandLine.execute("query", "--url", "http://127.0.0.1:1", "weather");

        assertEquals(GatewayCli.EXIT_CONFIG_ERROR, exitCode);
    }
}
