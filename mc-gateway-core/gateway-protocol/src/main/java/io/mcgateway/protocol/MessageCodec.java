package io.mcgateway.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON framing for {@link Message}. One message per text frame.
 *
 * <p>Encoding writes envelope fields in a fixed order and omits nulls, so equal messages always produce equal
 * bytes. Decoding is lenient about unknown fields but strict about the message type and the fields each
 * payload needs.
 */
public final class MessageCodec {
    private final ObjectMapper mapper;

    public MessageCodec() {
        this(JsonMapper.builder().build());
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String encode(Message message) {
        Objects.requireNonNull(message, "message");
        ObjectNode root = mapper.createObjectNode();
        root.put("type", message.type().wireName());
        putIfPresent(root, "serverId", message.serverId());
        putIfPresent(root, "correlationId", message.correlationId());
        if (message.timestamp() != null) {
            root.put("timestamp", message.timestamp().longValue());
        }
        root.set("payload", writePayload(message.type(), message.payload()));
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException failure) {
            throw new IllegalStateException("Unable to encode " + message.type(), failure);
        }
    }

    public byte[] encodeBytes(Message message) {
        return encode(message).getBytes(StandardCharsets.UTF_8);
    }

    public Message decode(byte[] frame) throws MalformedMessageException {
        Objects.requireNonNull(frame, "frame");
        return decode(new String(frame, StandardCharsets.UTF_8));
    }

    public Message decode(String frame) throws MalformedMessageException {
        if (frame == null || frame.isBlank()) {
            throw new MalformedMessageException("Empty frame");
        }
        JsonNode root;
        try {
            root = mapper.readTree(frame);
        } catch (IOException failure) {
            throw new MalformedMessageException("Frame is not valid JSON", failure);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException("Frame must be a JSON object");
        }

        String rawType = JsonFields.text(root, "type");
        if (rawType == null) {
            throw new MalformedMessageException("Missing required field: type");
        }
        MessageType type;
        try {
            type = MessageType.fromWire(rawType);
        } catch (IllegalArgumentException unknown) {
            throw new MalformedMessageException(unknown.getMessage(), unknown);
        }

        JsonNode payloadNode = JsonFields.node(root, "payload");
        if (!payloadNode.isNull() && !payloadNode.isObject()) {
            throw new MalformedMessageException("payload must be a JSON object [type=" + type + "]");
        }

        Payload payload;
        try {
            payload = readPayload(type, payloadNode, root);
        } catch (IllegalArgumentException | NullPointerException invalid) {
            throw new MalformedMessageException(
                "Invalid " + type + " payload: " + invalid.getMessage(),
                invalid
            );
        }

        Long timestamp;
        try {
            timestamp = JsonFields.longOrNull(root, "timestamp");
        } catch (IllegalArgumentException invalid) {
            throw new MalformedMessageException(invalid.getMessage(), invalid);
        }
        String serverId = JsonFields.text(root, "serverId", "server_id");
        String correlationId = JsonFields.text(root, "correlationId", "correlation_id", "replyTo", "id");
        return new Message(type, serverId, payload, correlationId, timestamp);
    }

    public StatusSnapshot readStatus(JsonNode node) {
        JsonNode memoryNode = JsonFields.node(node, "memory");
        MemoryUsage memory = null;
        if (memoryNode.isObject()) {
            memory = new MemoryUsage(
                JsonFields.longOrDefault(memoryNode, 0L, "usedMb", "used_mb", "used"),
                JsonFields.longOrDefault(memoryNode, 0L, "maxMb", "max_mb", "max")
            );
        }
        List<Double> tps = new ArrayList<>();
        JsonNode tpsNode = JsonFields.node(node, "tps");
        if (tpsNode.isArray()) {
            for (JsonNode value : tpsNode) {
                if (value.isNumber()) {
                    tps.add(value.doubleValue());
                }
            }
        } else if (tpsNode.isNumber()) {
            tps.add(tpsNode.doubleValue());
        }
        List<String> players = new ArrayList<>();
        JsonNode playersNode = JsonFields.node(node, "players", "playerNames", "player_names");
        if (playersNode.isArray()) {
            for (JsonNode value : playersNode) {
                String name = value.isObject() ? JsonFields.text(value, "name") : JsonFields.asText(value);
                if (name != null) {
                    players.add(name);
                }
            }
        }
        return new StatusSnapshot(
            JsonFields.booleanOrDefault(node, true, "online"),
            JsonFields.textOrDefault(node, "unknown", "version", "minecraftVersion", "minecraft_version"),
            JsonFields.intOrDefault(node, players.size(), "onlinePlayers", "online_players"),
            JsonFields.intOrDefault(node, 0, "maxPlayers", "max_players"),
            tps,
            memory,
            players
        );
    }

    public PlayerList readPlayers(JsonNode node) {
        List<PlayerInfo> players = new ArrayList<>();
        JsonNode list = JsonFields.node(node, "players", "list");
        if (list.isArray()) {
            for (JsonNode entry : list) {
                if (entry.isTextual()) {
                    players.add(PlayerInfo.named(entry.asText()));
                    continue;
                }
                String name = JsonFields.text(entry, "name");
                if (name == null) {
                    continue;
                }
                players.add(new PlayerInfo(
                    name,
                    JsonFields.text(entry, "uuid", "playerUuid"),
                    JsonFields.doubleOrNull(entry, "health"),
                    JsonFields.doubleOrNull(entry, "maxHealth", "max_health"),
                    JsonFields.intOrNull(entry, "level"),
                    JsonFields.text(entry, "gameMode", "gamemode", "game_mode"),
                    JsonFields.text(entry, "world"),
                    JsonFields.intOrNull(entry, "ping")
                ));
            }
        }
        return new PlayerList(
            JsonFields.intOrDefault(node, players.size(), "online", "onlinePlayers", "online_players"),
            JsonFields.intOrDefault(node, 0, "max", "maxPlayers", "max_players"),
            players
        );
    }

    public ObjectNode writeStatus(StatusSnapshot status) {
        ObjectNode node = mapper.createObjectNode();
        node.put("online", status.online());
        node.put("version", status.version());
        node.put("onlinePlayers", status.onlinePlayers());
        node.put("maxPlayers", status.maxPlayers());
        ArrayNode tps = node.putArray("tps");
        status.tps().forEach(tps::add);
        if (status.memory() != null) {
            ObjectNode memory = node.putObject("memory");
            memory.put("usedMb", status.memory().usedMb());
            memory.put("maxMb", status.memory().maxMb());
        }
        ArrayNode players = node.putArray("players");
        status.players().forEach(players::add);
        return node;
    }

    public ObjectNode writePlayers(PlayerList playerList) {
        ObjectNode node = mapper.createObjectNode();
        node.put("online", playerList.online());
        node.put("max", playerList.max());
        ArrayNode players = node.putArray("players");
        for (PlayerInfo player : playerList.players()) {
            ObjectNode entry = players.addObject();
            entry.put("name", player.name());
            putIfPresent(entry, "uuid", player.uuid());
            if (player.health() != null) {
                entry.put("health", player.health());
            }
            if (player.maxHealth() != null) {
                entry.put("maxHealth", player.maxHealth());
            }
            if (player.level() != null) {
                entry.put("level", player.level());
            }
            putIfPresent(entry, "gameMode", player.gameMode());
            putIfPresent(entry, "world", player.world());
            if (player.ping() != null) {
                entry.put("ping", player.ping());
            }
        }
        return node;
    }

    private ObjectNode writePayload(MessageType type, Payload payload) {
        ObjectNode node = mapper.createObjectNode();
        switch (type) {
            case CHAT: {
                ChatPayload chat = (ChatPayload) payload;
                node.put("content", chat.content());
                putIfPresent(node, "sender", chat.sender());
                putIfPresent(node, "senderDisplayName", chat.senderDisplayName());
                putIfPresent(node, "platform", chat.platform());
                putIfPresent(node, "targetPlayerUuid", chat.targetPlayerUuid());
                break;
            }
            case COMMAND: {
                CommandPayload command = (CommandPayload) payload;
                node.put("command", command.command());
                putIfPresent(node, "sender", command.sender());
                break;
            }
            case COMMAND_RESULT: {
                CommandResultPayload result = (CommandResultPayload) payload;
                node.put("success", result.success());
                node.put("output", result.output());
                break;
            }
            case STATUS_REQUEST:
                node.put("query", ((StatusRequestPayload) payload).query().name());
                break;
            case STATUS_RESPONSE: {
                StatusResponsePayload response = (StatusResponsePayload) payload;
                node.put("query", response.query().name());
                if (response.status() != null) {
                    node.set("status", writeStatus(response.status()));
                }
                if (response.players() != null) {
                    node.set("players", writePlayers(response.players()));
                }
                break;
            }
            case PLAYER_EVENT: {
                PlayerEventPayload event = (PlayerEventPayload) payload;
                node.put("kind", event.kind().name());
                node.put("playerName", event.playerName());
                node.put("playerUuid", event.playerUuid());
                break;
            }
            case BIND_CODE_ISSUED: {
                BindCodeIssuedPayload issued = (BindCodeIssuedPayload) payload;
                node.put("code", issued.code());
                node.put("playerUuid", issued.playerUuid());
                putIfPresent(node, "playerName", issued.playerName());
                if (issued.expiresAt() != null) {
                    node.put("expiresAt", issued.expiresAt().longValue());
                }
                node.put("force", issued.force());
                break;
            }
            case BIND_CONFIRM: {
                BindConfirmPayload confirm = (BindConfirmPayload) payload;
                node.put("platform", confirm.platform());
                node.put("code", confirm.code());
                node.put("accountId", confirm.accountId());
                break;
            }
            case BIND_RESULT: {
                BindResultPayload result = (BindResultPayload) payload;
                node.put("success", result.success());
                putIfPresent(node, "code", result.code());
                putIfPresent(node, "message", result.message());
                break;
            }
            case ERROR:
            case AUTH_FAILED: {
                ErrorPayload error = (ErrorPayload) payload;
                putIfPresent(node, "code", error.code());
                node.put("message", error.message());
                break;
            }
            case AUTH:
                node.put("token", ((AuthPayload) payload).token());
                break;
            case CONNECTION_ACK:
                putIfPresent(node, "serverId", ((ConnectionAckPayload) payload).serverId());
                break;
            case PING:
            case PONG:
            case AUTH_REQUIRED:
                break;
            default:
                throw new IllegalStateException("Unhandled message type " + type);
        }
        return node;
    }

    private Payload readPayload(MessageType type, JsonNode payload, JsonNode envelope) throws MalformedMessageException {
        switch (type) {
            case CHAT:
                return readChat(payload, envelope);
            case COMMAND:
                return new CommandPayload(
                    required(payload, type, "command", "cmd"),
                    JsonFields.text(payload, "sender")
                );
            case COMMAND_RESULT:
                return new CommandResultPayload(
                    requiredBoolean(payload, type, "success"),
                    JsonFields.rawText(payload, "output", "message")
                );
            case STATUS_REQUEST: {
                String query = JsonFields.text(payload, "query", "kind");
                QueryKind kind = query == null ? QueryKind.STATUS : QueryKind.fromWire(query);
                if (kind == null) {
                    throw new MalformedMessageException("Unknown query kind: " + query);
                }
                return new StatusRequestPayload(kind);
            }
            case STATUS_RESPONSE:
                return readStatusResponse(payload);
            case PLAYER_EVENT: {
                String rawKind = required(payload, type, "kind", "event");
                PlayerEventKind kind = PlayerEventKind.fromWire(rawKind);
                if (kind == null) {
                    throw new MalformedMessageException("Unknown player event kind: " + rawKind);
                }
                return new PlayerEventPayload(
                    kind,
                    required(payload, type, "playerName", "player_name", "name"),
                    required(payload, type, "playerUuid", "player_uuid", "uuid")
                );
            }
            case BIND_CODE_ISSUED:
                return new BindCodeIssuedPayload(
                    required(payload, type, "code"),
                    required(payload, type, "playerUuid", "player_uuid"),
                    JsonFields.text(payload, "playerName", "player_name"),
                    JsonFields.longOrNull(payload, "expiresAt", "expires_at"),
                    JsonFields.booleanOrDefault(payload, false, "force")
                );
            case BIND_CONFIRM:
                return new BindConfirmPayload(
                    required(payload, type, "platform"),
                    required(payload, type, "code"),
                    required(payload, type, "accountId", "account_id")
                );
            case BIND_RESULT:
                return new BindResultPayload(
                    requiredBoolean(payload, type, "success", "ok"),
                    JsonFields.text(payload, "code"),
                    JsonFields.text(payload, "message", "reason")
                );
            case ERROR:
                return new ErrorPayload(
                    JsonFields.text(payload, "code"),
                    required(payload, type, "message")
                );
            case AUTH: {
                String token = JsonFields.text(payload, "token");
                if (token == null) {
                    token = JsonFields.text(envelope, "token");
                }
                if (token == null) {
                    throw new MalformedMessageException("Missing required field token [type=AUTH]");
                }
                return new AuthPayload(token);
            }
            case AUTH_FAILED:
                return new ErrorPayload(
                    ErrorPayload.AUTH_FAILED,
                    JsonFields.textOrDefault(payload, JsonFields.textOrDefault(envelope, "authentication failed", "message"), "message")
                );
            case CONNECTION_ACK:
                return new ConnectionAckPayload(JsonFields.text(payload, "serverId", "server_id"));
            case PING:
            case PONG:
            case AUTH_REQUIRED:
                return EmptyPayload.INSTANCE;
            default:
                throw new MalformedMessageException("Unhandled message type " + type);
        }
    }

    private ChatPayload readChat(JsonNode payload, JsonNode envelope) throws MalformedMessageException {
        String content = JsonFields.rawText(payload, "content", "message");
        if (content == null || content.isBlank()) {
            throw new MalformedMessageException("Missing required field content [type=CHAT]");
        }
        JsonNode player = JsonFields.node(JsonFields.node(envelope, "source"), "player");
        String sender = JsonFields.text(payload, "sender", "playerName", "username");
        if (sender == null) {
            sender = JsonFields.text(player, "name");
        }
        String displayName = JsonFields.text(payload, "senderDisplayName", "displayName");
        if (displayName == null) {
            displayName = JsonFields.text(player, "displayName");
        }
        String platform = JsonFields.text(payload, "platform");
        if (platform == null) {
            platform = JsonFields.text(JsonFields.node(payload, "source"), "platform");
        }
        String targetUuid = JsonFields.text(payload, "targetPlayerUuid");
        if (targetUuid == null) {
            JsonNode target = JsonFields.node(envelope, "target");
            if ("PLAYER".equalsIgnoreCase(JsonFields.text(target, "type"))) {
                targetUuid = JsonFields.text(target, "playerUuid");
            }
        }
        return new ChatPayload(content, sender, displayName, platform, targetUuid);
    }

    private StatusResponsePayload readStatusResponse(JsonNode payload) throws MalformedMessageException {
        String rawQuery = required(payload, MessageType.STATUS_RESPONSE, "query", "kind");
        QueryKind kind = QueryKind.fromWire(rawQuery);
        if (kind == null) {
            throw new MalformedMessageException("Unknown query kind: " + rawQuery);
        }
        if (kind == QueryKind.STATUS) {
            JsonNode status = JsonFields.node(payload, "status");
            if (!status.isObject()) {
                throw new MalformedMessageException("Missing required field status [type=STATUS_RESPONSE]");
            }
            return StatusResponsePayload.of(readStatus(status));
        }
        JsonNode players = JsonFields.node(payload, "players");
        if (!players.isObject()) {
            throw new MalformedMessageException("Missing required field players [type=STATUS_RESPONSE]");
        }
        return StatusResponsePayload.of(readPlayers(players));
    }

    private static String required(JsonNode node, MessageType type, String... names) throws MalformedMessageException {
        String value = JsonFields.text(node, names);
        if (value == null) {
            throw new MalformedMessageException("Missing required field " + names[0] + " [type=" + type + "]");
        }
        return value;
    }

    private static boolean requiredBoolean(JsonNode node, MessageType type, String... names)
        throws MalformedMessageException {
        JsonNode value = JsonFields.node(node, names);
        if (value.isNull()) {
            throw new MalformedMessageException("Missing required field " + names[0] + " [type=" + type + "]");
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            return Boolean.parseBoolean(value.asText().trim());
        }
        throw new MalformedMessageException("Field " + names[0] + " must be a boolean [type=" + type + "]");
    }

    private static void putIfPresent(ObjectNode node, String name, String value) {
        if (value != null) {
            node.put(name, value);
        }
    }
}
