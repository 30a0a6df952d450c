package io.mcgateway.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcgateway.core.config.GatewayConfig;
import io.mcgateway.core.status.StatusFallback;
import io.mcgateway.protocol.MessageCodec;
import io.mcgateway.protocol.PlayerList;
import io.mcgateway.protocol.StatusSnapshot;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls the game server's own HTTP API ({@code /api/status}, {@code /api/players}) when no session is connected.
 * Responses may wrap the body in a {@code data} field.
 */
public final class HttpStatusClient implements StatusFallback {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpStatusClient.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final URI baseUrl;
    private final String token;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final MessageCodec codec;

    public HttpStatusClient(GatewayConfig.HttpFallback fallback) {
        this(fallback.baseUrl(), fallback.token(), DEFAULT_TIMEOUT);
    }

    public HttpStatusClient(URI baseUrl, String token, Duration timeout) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.token = token;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = new ObjectMapper();
        this.codec = new MessageCodec(objectMapper);
    }

    @Override
    public StatusSnapshot fetchStatus() throws IOException, InterruptedException {
        return codec.readStatus(fetch("/api/status"));
    }

    @Override
    public PlayerList fetchPlayers() throws IOException, InterruptedException {
        return codec.readPlayers(fetch("/api/players"));
    }

    JsonNode fetch(String path) throws IOException, InterruptedException {
        URI uri = resolve(path);
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET();
        if (token != null && !token.isBlank()) {
            request.header("Authorization", "Bearer " + token);
        }

        HttpResponse<String> response = httpClient.send(
            request.build(),
            HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)
        );
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode() + " from " + uri);
        }
        JsonNode body = objectMapper.readTree(response.body());
        if (body == null || !body.isObject()) {
            throw new IOException("Expected a JSON object from " + uri);
        }
        JsonNode data = body.get("data");
        if (data != null && data.isObject()) {
            body = data;
        }
        LOGGER.debug("HTTP status fetched [url={}]", uri);
        return body;
    }

    private URI resolve(String path) {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }
}
