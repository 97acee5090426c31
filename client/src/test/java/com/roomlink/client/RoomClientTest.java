package com.roomlink.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.roomlink.client.auth.Credentials;
import com.roomlink.client.config.ClientConfig;
import com.roomlink.client.event.EventDispatcher;
import com.roomlink.client.event.EventKind;
import com.roomlink.client.event.RoomEventHandler;
import com.roomlink.client.event.RoomEvents;
import com.roomlink.client.gateway.StaticGatewayResolver;
import com.roomlink.client.metrics.ClientMetrics;
import com.roomlink.client.session.SessionManager;
import com.roomlink.client.session.SessionState;
import com.roomlink.client.support.RoomServerScript;
import com.roomlink.client.support.TestTransport;
import com.roomlink.core.error.EncodingException;
import com.roomlink.core.error.NotConnectedException;
import com.roomlink.core.error.PermissionDeniedException;
import com.roomlink.core.msg.MessageCodec;
import com.roomlink.core.util.JsonUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoomClientTest {
    private static final String ROOM = "testroom";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private TestTransport transport;
    private EventDispatcher dispatcher;
    private RoomClient client;

    @BeforeEach
    void setUp() {
        transport = new TestTransport();
        dispatcher = new EventDispatcher();
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.stop().block(TIMEOUT);
        }
    }

    @Test
    void testActionsBeforeJoin_NotConnected() {
        client = client("guest42");

        assertThrows(NotConnectedException.class, () -> client.sendChat("hi"));
        assertThrows(NotConnectedException.class, () -> client.kick(3));
        assertEquals(SessionState.DISCONNECTED, client.sessionState());
        assertTrue(client.roomState().isEmpty());
    }

    @Test
    void testSendChat_EncodedWithNextReq() throws Exception {
        transport.respondWith(new RoomServerScript(1, false));
        client = client("guest42");
        client.start().block(TIMEOUT);

        client.sendChat("hello everyone");

        JsonNode frame = JsonUtils.readTree(last(transport.sentFrames()));
        assertEquals("msg", frame.get("tc").asText());
        assertEquals(3, frame.get("req").asInt());
        assertEquals("hello everyone", frame.get("text").asText());
    }

    @Test
    void testEmptyChat_ThrowsAndSendsNothing() {
        transport.respondWith(new RoomServerScript(1, false));
        client = client("guest42");
        client.start().block(TIMEOUT);
        int before = transport.sentFrames().size();

        assertThrows(EncodingException.class, () -> client.sendChat(""));
        assertThrows(EncodingException.class, () -> client.setNick("has space"));

        assertEquals(before, transport.sentFrames().size());
    }

    @Test
    void testKickWithoutModeratorRole_PermissionDenied() {
        transport.respondWith(new RoomServerScript(1, false).withUser(2, "bob"));
        client = client("guest42");
        client.start().block(TIMEOUT);
        int before = transport.sentFrames().size();

        assertThrows(PermissionDeniedException.class, () -> client.kick(2));
        assertThrows(PermissionDeniedException.class, () -> client.ban(2));
        assertThrows(PermissionDeniedException.class, () -> client.requestBanList());
        assertThrows(PermissionDeniedException.class, () -> client.approveBroadcast(2));

        assertEquals(before, transport.sentFrames().size());
    }

    @Test
    void testModerator_CanKickAndBan() {
        transport.respondWith(new RoomServerScript(1, true).withUser(2, "bob"));
        client = client("mod");
        client.start().block(TIMEOUT);

        client.kick(2);
        client.ban(2);
        client.unban(77);
        client.requestBanList();
        client.closeBroadcast(2);

        // the first banlist is requested automatically on join
        assertEquals(List.of("login", "join", "banlist", "kick", "ban", "unban", "banlist", "stream_moder_close"),
                transport.sentOpcodes());
    }

    @Test
    void testModeratorMedia_SendsItem() throws Exception {
        transport.respondWith(new RoomServerScript(1, true));
        client = client("mod");
        client.start().block(TIMEOUT);

        client.playMedia("abc123", 180.0, "Song", 0);

        JsonNode frame = JsonUtils.readTree(last(transport.sentFrames()));
        assertEquals("yut_play", frame.get("tc").asText());
        assertEquals("abc123", frame.get("item").get("id").asText());
        assertEquals("Song", frame.get("item").get("title").asText());
    }

    @Test
    void testModeratorPlaylist_SendsCommands() throws Exception {
        transport.respondWith(new RoomServerScript(1, true));
        client = client("mod");
        client.start().block(TIMEOUT);

        client.requestPlaylist();
        client.addToPlaylist("abc123", 180.0, "Song", "thumb.jpg");
        client.removeFromPlaylist("abc123", 180.0, "Song", "thumb.jpg");
        client.setPlaylistMode(true, true);

        List<String> opcodes = transport.sentOpcodes();
        assertEquals(List.of("yut_playlist", "yut_playlist_add", "yut_playlist_remove", "yut_playlist_mode"),
                opcodes.subList(opcodes.size() - 4, opcodes.size()));
        JsonNode mode = JsonUtils.readTree(last(transport.sentFrames())).get("mode");
        assertTrue(mode.get("random").asBoolean());
        assertTrue(mode.get("repeat").asBoolean());
    }

    @Test
    void testPlaylistWithoutModeratorRole_PermissionDenied() {
        transport.respondWith(new RoomServerScript(1, false));
        client = client("guest42");
        client.start().block(TIMEOUT);

        assertThrows(PermissionDeniedException.class, () -> client.requestPlaylist());
        assertThrows(PermissionDeniedException.class, () -> client.setPlaylistMode(false, true));
    }

    @Test
    @DisplayName("Invalid arguments are reported before the connection state")
    void testInvalidActionBeforeJoin_EncodingError() {
        client = client("guest42");

        assertThrows(EncodingException.class, () -> client.sendChat(""));
        assertThrows(EncodingException.class, () -> client.kick(-1));
        assertThrows(NotConnectedException.class, () -> client.sendChat("hi"));
        assertTrue(transport.sentFrames().isEmpty());
    }

    @Test
    void testPrivateMessageAndNick() {
        transport.respondWith(new RoomServerScript(1, false).withUser(2, "bob"));
        client = client("guest42");
        client.start().block(TIMEOUT);

        client.sendPrivate(2, "psst");
        client.setNick("newnick");

        assertEquals(List.of("login", "join", "pvtmsg", "nick"), transport.sentOpcodes());
    }

    @Test
    void testOnOff_RegistersWithDispatcher() {
        List<String> joined = new CopyOnWriteArrayList<>();
        RoomEventHandler<RoomEvents.UserJoined> handler = e -> joined.add(e.getUser().getNick());
        transport.respondWith(new RoomServerScript(1, false));
        client = client("guest42");
        client.on(EventKind.USER_JOINED, handler);
        client.start().block(TIMEOUT);

        transport.serverSends("{\"tc\":\"join\",\"handle\":4,\"nick\":\"dave\"}");
        assertTrue(client.off(EventKind.USER_JOINED, handler));
        transport.serverSends("{\"tc\":\"join\",\"handle\":5,\"nick\":\"erin\"}");

        assertEquals(List.of("dave"), joined);
        assertTrue(client.roomState().orElseThrow().user(5).isPresent());
    }

    @Test
    void testConstructor_ValidatesArguments() {
        ClientConfig config = ClientConfig.builder().build();

        assertThrows(IllegalArgumentException.class, () -> new RoomClient(" ", "nick", null, null, config));
        assertThrows(IllegalArgumentException.class, () -> new RoomClient(ROOM, "nick", "account", null, config));
        assertThrows(IllegalArgumentException.class, () -> new RoomClient(ROOM, "nick", null, null,
                config.toBuilder().gatewayUrl("ws://localhost:1/ws").build()));
    }

    @Test
    @DisplayName("An invalid nick is rejected before anything connects")
    void testConstructor_RejectsInvalidNick() {
        ClientConfig config = ClientConfig.builder().build();

        assertThrows(EncodingException.class, () -> new RoomClient(ROOM, "", null, null, config));
        assertThrows(EncodingException.class, () -> new RoomClient(ROOM, "bad nick", null, null, config));
        assertThrows(EncodingException.class, () -> new RoomClient(ROOM, "x".repeat(33), null, null, config));
    }

    @Test
    void testInboundScheduler_SharedByClients() {
        assertSame(RoomClient.inboundScheduler(), RoomClient.inboundScheduler());
    }

    @Test
    void testConstructor_WithoutNick_IsDisconnected() {
        RoomClient created = new RoomClient(ROOM, null, null, null, ClientConfig.builder().build());

        assertEquals(ROOM, created.getRoom());
        assertEquals(SessionState.DISCONNECTED, created.sessionState());
        assertFalse(created.roomState().isPresent());
    }

    private RoomClient client(String nick) {
        ClientConfig config = ClientConfig.builder()
                .backoffBase(Duration.ofMillis(10))
                .backoffJitter(Duration.ZERO)
                .build();
        SessionManager manager = new SessionManager(ROOM, Credentials.guest(nick), config, transport,
                new StaticGatewayResolver(URI.create("ws://localhost:1/ws"), "tok"),
                new MessageCodec(), dispatcher, new ClientMetrics(new SimpleMeterRegistry(), ROOM),
                Schedulers.immediate(), Clock.systemUTC());
        return new RoomClient(ROOM, dispatcher, manager);
    }

    private static String last(List<String> frames) {
        return frames.get(frames.size() - 1);
    }
}
