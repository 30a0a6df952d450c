package io.mcgateway.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class MessageCodecTest {
    private final MessageCodec codec = new MessageCodec();

    @Test
    void decodesChatAndIgnoresUnknownOptionalFields() throws Exception {
        Message message = codec.decode("""
            {"type":"CHAT","serverId":"survival","payload":{"content":"hi all","sender":"Steve","colour":"red"},
             "futureField":{"nested":true}}
            """);

        assertEquals(MessageType.CHAT, message.type());
        assertEquals("survival", message.serverId());
        ChatPayload chat = message.payloadAs(ChatPayload.class);
        assertEquals("hi all", chat.content());
        assertEquals("Steve", chat.displayName());
        assertTrue(chat.isBroadcast());
        assertNull(message.correlationId());
    }

    @Test
    void acceptsLegacyForwardShapeWithEnvelopeSource() throws Exception {
        Message message = codec.decode("""
            {"type":"MESSAGE_FORWARD","id":"m-1","timestamp":1700000000000,
             "payload":{"content":"hello"},
             "source":{"player":{"name":"alex","displayName":"Alex"}}}
            """);

        ChatPayload chat = message.payloadAs(ChatPayload.class);
        assertEquals(MessageType.CHAT, message.type());
        assertEquals("alex", chat.sender());
        assertEquals("Alex", chat.displayName());
        assertEquals("m-1", message.correlationId());
        assertEquals(1700000000000L, message.timestamp());
    }

    @Test
    void mapsLegacyTypeNamesAndReplyTo() throws Exception {
        assertEquals(MessageType.PING, codec.decode("{\"type\":\"HEARTBEAT\",\"id\":\"h1\"}").type());
        assertEquals(MessageType.PONG, codec.decode("{\"type\":\"heartbeat_ack\"}").type());
        assertEquals(MessageType.CONNECTION_ACK, codec.decode("{\"type\":\"auth_success\"}").type());

        Message result = codec.decode("""
            {"type":"BIND_CONFIRM_RESPONSE","id":"own-id","replyTo":"req-9","payload":{"success":true,"code":"123456"}}
            """);
        assertEquals(MessageType.BIND_RESULT, result.type());
        assertEquals("req-9", result.correlationId());
        assertTrue(result.payloadAs(BindResultPayload.class).success());
    }

    @Test
    void rejectsUnknownTypeMissingTypeAndNonJson() {
        MalformedMessageException unknown = assertThrows(
            MalformedMessageException.class,
            () -> codec.decode("{\"type\":\"TELEPORT\",\"payload\":{}}")
        );
        assertTrue(unknown.getMessage().contains("TELEPORT"));
        assertThrows(MalformedMessageException.class, () -> codec.decode("{\"payload\":{}}"));
        assertThrows(MalformedMessageException.class, () -> codec.decode("not json"));
        assertThrows(MalformedMessageException.class, () -> codec.decode("[1,2]"));
        assertThrows(MalformedMessageException.class, () -> codec.decode("   "));
    }

    @Test
    void rejectsMissingRequiredPayloadFields() {
        assertThrows(MalformedMessageException.class, () -> codec.decode("{\"type\":\"CHAT\",\"payload\":{}}"));
        assertThrows(MalformedMessageException.class, () -> codec.decode("{\"type\":\"COMMAND\"}"));
        assertThrows(
            MalformedMessageException.class,
            () -> codec.decode("{\"type\":\"BIND_CONFIRM\",\"payload\":{\"platform\":\"qq\",\"code\":\"1\"}}")
        );
        assertThrows(
            MalformedMessageException.class,
            () -> codec.decode("{\"type\":\"PLAYER_EVENT\",\"payload\":{\"kind\":\"DANCE\",\"playerName\":\"a\",\"playerUuid\":\"u\"}}")
        );
        assertThrows(
            MalformedMessageException.class,
            () -> codec.decode("{\"type\":\"STATUS_RESPONSE\",\"payload\":{\"query\":\"STATUS\"}}")
        );
    }

    @Test
    void encodingIsDeterministicAndOmitsNulls() throws Exception {
        Message message = new Message(
            MessageType.CHAT,
            "survival",
            ChatPayload.toPlayer("psst", "qq", "Bot", "uuid-1"),
            "c-1",
            42L
        );

        String first = codec.encode(message);
        String second = codec.encode(codec.decode(first));

        assertEquals(first, second);
        assertEquals(
            "{\"type\":\"CHAT\",\"serverId\":\"survival\",\"correlationId\":\"c-1\",\"timestamp\":42,"
                + "\"payload\":{\"content\":\"psst\",\"sender\":\"Bot\",\"platform\":\"qq\",\"targetPlayerUuid\":\"uuid-1\"}}",
            first
        );
        assertFalse(first.contains("null"));
        assertEquals(first, new String(codec.encodeBytes(message), StandardCharsets.UTF_8));
    }

    @Test
    void statusResponseCarriesTypedSnapshots() throws Exception {
        Message status = codec.decode("""
            {"type":"STATUS_RESPONSE","correlationId":"q1","payload":{"query":"status","status":{
              "online":true,"minecraft_version":"1.20.4","online_players":2,"max_players":20,
              "tps":[19.9,20.0,20.0],"memory":{"used_mb":512,"max_mb":2048},"players":["Steve","Alex"]}}}
            """);

        StatusSnapshot snapshot = status.payloadAs(StatusResponsePayload.class).status();
        assertEquals("1.20.4", snapshot.version());
        assertEquals(2, snapshot.onlinePlayers());
        assertEquals(List.of(19.9, 20.0, 20.0), snapshot.tps());
        assertEquals(25.0, snapshot.memory().usagePercent(), 0.001);
        assertEquals(List.of("Steve", "Alex"), snapshot.players());

        Message players = codec.decode("""
            {"type":"STATUS_RESPONSE","payload":{"query":"PLAYERS","players":{"online":1,"max":10,
              "players":[{"name":"Steve","health":18.5,"max_health":20,"gamemode":"SURVIVAL","ping":31}]}}}
            """);
        PlayerList list = players.payloadAs(StatusResponsePayload.class).players();
        assertEquals(1, list.players().size());
        assertEquals("SURVIVAL", list.players().get(0).gameMode());
        assertEquals(31, list.players().get(0).ping());
    }

    @Test
    void statusRequestDefaultsToStatusQuery() throws Exception {
        Message request = codec.decode("{\"type\":\"STATUS_REQUEST\",\"correlationId\":\"x\"}");

        assertEquals(QueryKind.STATUS, request.payloadAs(StatusRequestPayload.class).query());
    }

    @Test
    void messageRejectsMismatchedPayload() {
        assertThrows(
            IllegalArgumentException.class,
            () -> Message.of(MessageType.COMMAND, "s1", EmptyPayload.INSTANCE)
        );
    }

    @Test
    void authPayloadNeverPrintsToken() {
        assertFalse(new AuthPayload("secret-token").toString().contains("secret-token"));
    }
}
