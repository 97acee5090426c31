package com.roomlink.client;

import com.roomlink.client.auth.Credentials;
import com.roomlink.client.config.ClientConfig;
import com.roomlink.client.event.EventDispatcher;
import com.roomlink.client.event.EventKind;
import com.roomlink.client.event.RoomEvent;
import com.roomlink.client.event.RoomEventHandler;
import com.roomlink.client.gateway.HttpGatewayResolver;
import com.roomlink.client.gateway.IGatewayResolver;
import com.roomlink.client.gateway.StaticGatewayResolver;
import com.roomlink.client.metrics.ClientMetrics;
import com.roomlink.client.session.ISessionManager;
import com.roomlink.client.session.SessionManager;
import com.roomlink.client.session.SessionState;
import com.roomlink.client.ws.ReactorNettyTransport;
import com.roomlink.core.error.EncodingException;
import com.roomlink.core.error.NotConnectedException;
import com.roomlink.core.error.PermissionDeniedException;
import com.roomlink.core.model.RoomSnapshot;
import com.roomlink.core.model.UserRecord;
import com.roomlink.core.model.UserRole;
import com.roomlink.core.msg.Commands;
import com.roomlink.core.msg.Message;
import com.roomlink.core.msg.MessageCodec;
import com.roomlink.core.util.Nicks;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.time.Clock;
import java.util.Optional;

/**
 * Client for one chat room.
 * <p>
 * Usage:
 * <pre>{@code
 * RoomClient client = new RoomClient("lobby", "alice", null, null, ClientConfig.builder().build());
 * client.on(EventKind.CHAT_RECEIVED, e -> System.out.println(e.getSender().getNick() + ": " + e.getText()));
 * client.start().block();
 * client.sendChat("hello");
 * }</pre>
 * </p>
 * Actions throw synchronously: {@link EncodingException} for invalid arguments (checked first),
 * {@link NotConnectedException} unless the room is joined, and {@link PermissionDeniedException}
 * for moderation without a moderator role. Nothing is sent when an action throws.
 */
public class RoomClient {
    private static final Logger log = LoggerFactory.getLogger(RoomClient.class);

    private static final int RANDOM_NICK_MIN = 5;
    private static final int RANDOM_NICK_MAX = 15;

    private final String room;
    private final EventDispatcher dispatcher;
    private final ISessionManager sessionManager;

    public RoomClient(String room, String nick, String account, String password, ClientConfig config) {
        this(room, nick, account, password, config, new SimpleMeterRegistry());
    }

    public RoomClient(String room, String nick, String account, String password,
                      ClientConfig config, MeterRegistry meterRegistry) {
        requireRoom(room);
        if (nick != null && !Nicks.isValid(nick)) {
            throw new EncodingException("Invalid nick '" + nick + "': 1-" + Nicks.MAX_LENGTH
                    + " characters without whitespace");
        }
        String effectiveNick = nick != null ? nick : Nicks.random(RANDOM_NICK_MIN, RANDOM_NICK_MAX);
        Credentials credentials = account == null
                ? Credentials.guest(effectiveNick)
                : Credentials.account(effectiveNick, account, password);

        ClientMetrics metrics = new ClientMetrics(meterRegistry, room);
        this.room = room;
        this.dispatcher = new EventDispatcher(failure -> {
            EventDispatcher.logFailure(failure);
            metrics.recordHandlerFailure(failure.kind().name());
        });
        this.sessionManager = new SessionManager(room, credentials, config,
                new ReactorNettyTransport(config),
                gatewayResolver(config),
                new MessageCodec(config.getMaxFrameBytes(), config.getMaxTextLength()),
                dispatcher, metrics,
                inboundScheduler(),
                Clock.systemUTC());
        log.debug("Created client for room {} as {}", room, effectiveNick);
    }

    RoomClient(String room, EventDispatcher dispatcher, ISessionManager sessionManager) {
        this.room = requireRoom(room);
        this.dispatcher = dispatcher;
        this.sessionManager = sessionManager;
    }

    private static IGatewayResolver gatewayResolver(ClientConfig config) {
        if (config.getGatewayUrl() != null) {
            if (config.getGatewayToken() == null || config.getGatewayToken().isBlank()) {
                throw new IllegalArgumentException("gatewayToken is required together with gatewayUrl");
            }
            return new StaticGatewayResolver(URI.create(config.getGatewayUrl()), config.getGatewayToken());
        }
        return new HttpGatewayResolver(config.getApiBaseUrl(), config.getUserAgent(), config.getConnectTimeout());
    }

    /**
     * Shared by all clients; each session's inbound flux still runs on a single worker at a time.
     */
    static Scheduler inboundScheduler() {
        return Schedulers.boundedElastic();
    }

    private static String requireRoom(String room) {
        if (room == null || room.isBlank()) {
            throw new IllegalArgumentException("room must not be blank");
        }
        return room;
    }

    /**
     * Starts connecting immediately.
     *
     * @return Mono completing once the room is joined the first time
     */
    public Mono<Void> start() {
        return sessionManager.start();
    }

    public Mono<Void> stop() {
        return sessionManager.stop();
    }

    /**
     * Completes after {@link #stop()}, fails with {@link com.roomlink.core.error.SessionException}
     * when the session gives up.
     */
    public Mono<Void> termination() {
        return sessionManager.termination();
    }

    public String getRoom() {
        return room;
    }

    public SessionState sessionState() {
        return sessionManager.getState();
    }

    /**
     * Immutable snapshot of the room, empty while not connected.
     */
    public Optional<RoomSnapshot> roomState() {
        return sessionManager.roomSnapshot();
    }

    public <E extends RoomEvent> void on(EventKind<E> kind, RoomEventHandler<? super E> handler) {
        dispatcher.register(kind, handler);
    }

    public <E extends RoomEvent> boolean off(EventKind<E> kind, RoomEventHandler<? super E> handler) {
        return dispatcher.unregister(kind, handler);
    }

    public void sendChat(String text) {
        send(Commands.chat(text));
    }

    public void sendPrivate(int handle, String text) {
        send(Commands.privateMessage(text, handle));
    }

    public void setNick(String nick) {
        send(Commands.nick(nick));
    }

    /**
     * Answers a password challenge for the room.
     */
    public void sendRoomPassword(String password) {
        send(Commands.roomPassword(password));
    }

    public void sendCaptcha(String token) {
        send(Commands.captcha(token));
    }

    public void kick(int handle) {
        moderate(Commands.kick(handle));
    }

    public void ban(int handle) {
        moderate(Commands.ban(handle));
    }

    public void unban(int banId) {
        moderate(Commands.unban(banId));
    }

    public void requestBanList() {
        moderate(Commands.banList());
    }

    /**
     * Lets a user waiting in the green room start broadcasting.
     */
    public void approveBroadcast(int handle) {
        moderate(Commands.allowBroadcast(handle));
    }

    public void closeBroadcast(int handle) {
        moderate(Commands.closeBroadcast(handle));
    }

    /**
     * Plays a video for the room; a non-zero offset seeks in the current video.
     */
    public void playMedia(String videoId, double duration, String title, double offset) {
        moderate(Commands.mediaPlay(videoId, duration, title, offset));
    }

    public void pauseMedia(String videoId, double duration, double offset) {
        moderate(Commands.mediaPause(videoId, duration, offset));
    }

    public void stopMedia(String videoId, double duration, double offset) {
        moderate(Commands.mediaStop(videoId, duration, offset));
    }

    /**
     * Asks for the room playlist; the answer arrives as {@link EventKind#PLAYLIST_RECEIVED}.
     */
    public void requestPlaylist() {
        moderate(Commands.playlist());
    }

    public void addToPlaylist(String videoId, double duration, String title, String image) {
        moderate(Commands.playlistAdd(videoId, duration, title, image));
    }

    public void removeFromPlaylist(String videoId, double duration, String title, String image) {
        moderate(Commands.playlistRemove(videoId, duration, title, image));
    }

    public void setPlaylistMode(boolean random, boolean repeat) {
        moderate(Commands.playlistMode(random, repeat));
    }

    private void send(Message command) {
        sessionManager.validate(command);
        requireJoined();
        sessionManager.send(command);
    }

    private void moderate(Message command) {
        sessionManager.validate(command);
        RoomSnapshot snapshot = requireJoined();
        UserRole role = snapshot.self().map(UserRecord::getRole).orElse(UserRole.DEFAULT);
        if (!role.canModerate()) {
            throw new PermissionDeniedException(command.getOpcode().wireName()
                    + " requires moderator rights in room " + room + ", own role is " + role);
        }
        sessionManager.send(command);
    }

    private RoomSnapshot requireJoined() {
        SessionState state = sessionManager.getState();
        Optional<RoomSnapshot> snapshot = sessionManager.roomSnapshot();
        if (state != SessionState.JOINED || snapshot.isEmpty()) {
            throw new NotConnectedException("Room " + room + " is not joined (state " + state + ")");
        }
        return snapshot.get();
    }
}
