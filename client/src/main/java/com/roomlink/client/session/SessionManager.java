package com.roomlink.client.session;

import com.roomlink.client.auth.AuthFlow;
import com.roomlink.client.auth.Credentials;
import com.roomlink.client.auth.Identity;
import com.roomlink.client.config.ClientConfig;
import com.roomlink.client.event.CloseReason;
import com.roomlink.client.event.EventDispatcher;
import com.roomlink.client.event.RoomEvent;
import com.roomlink.client.event.RoomEvents;
import com.roomlink.client.gateway.Gateway;
import com.roomlink.client.gateway.IGatewayResolver;
import com.roomlink.client.metrics.ClientMetrics;
import com.roomlink.client.state.RoomState;
import com.roomlink.client.state.RoomUpdate;
import com.roomlink.client.ws.ITransport;
import com.roomlink.core.error.AuthException;
import com.roomlink.core.error.DecodeException;
import com.roomlink.core.error.EncodingException;
import com.roomlink.core.error.NotConnectedException;
import com.roomlink.core.error.SessionException;
import com.roomlink.core.model.RoomSnapshot;
import com.roomlink.core.model.UserRecord;
import com.roomlink.core.msg.Commands;
import com.roomlink.core.msg.Message;
import com.roomlink.core.msg.MessageCodec;
import com.roomlink.core.msg.Opcode;
import com.roomlink.core.util.BytesUtils;
import com.roomlink.core.util.JitterBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one room session through connect, login, join and reconnect.
 * <p>
 * Inbound frames are handled one at a time on the inbound scheduler: decode, apply to the room
 * state, translate to events, dispatch. Session state only changes on that path and in the
 * lifecycle callbacks, which are guarded by {@code lifecycleLock}; events are never dispatched
 * while that lock is held.
 * </p>
 * <p>
 * A connection that ends without {@link #stop()} is retried with {@link JitterBackoff} until
 * {@link ClientConfig#getMaxReconnectAttempts()} consecutive attempts failed. The counter resets
 * whenever the room is joined. Rejected logins and terminal server close codes are never retried.
 * </p>
 */
public class SessionManager implements ISessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);
    private static final String MDC_ROOM = "room";

    private final String room;
    private final ClientConfig config;
    private final ITransport transport;
    private final IGatewayResolver gatewayResolver;
    private final MessageCodec codec;
    private final EventDispatcher dispatcher;
    private final ClientMetrics metrics;
    private final Scheduler inboundScheduler;
    private final Clock clock;
    private final SessionFactory sessionFactory;
    private final AuthFlow authFlow;
    private final EventTranslator translator;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.DISCONNECTED);
    private final Object lifecycleLock = new Object();
    private final Object sendLock = new Object();

    private volatile Credentials credentials;
    private volatile Session session;
    private volatile Sinks.One<Void> firstJoin = Sinks.one();
    private volatile Sinks.One<Void> termination = Sinks.one();
    private boolean running;
    private Disposable cycle;
    private Disposable backoff;

    public SessionManager(String room, Credentials credentials, ClientConfig config,
                          ITransport transport, IGatewayResolver gatewayResolver, MessageCodec codec,
                          EventDispatcher dispatcher, ClientMetrics metrics,
                          Scheduler inboundScheduler, Clock clock) {
        this.room = room;
        this.credentials = credentials;
        this.config = config;
        this.transport = transport;
        this.gatewayResolver = gatewayResolver;
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.inboundScheduler = inboundScheduler;
        this.clock = clock;
        this.sessionFactory = new SessionFactory(clock);
        this.authFlow = new AuthFlow(config.getAuthTimeout());
        this.translator = new EventTranslator(clock);
    }

    @Override
    public Mono<Void> start() {
        Sinks.One<Void> joined;
        synchronized (lifecycleLock) {
            if (running) {
                return Mono.error(new IllegalStateException("Session for room " + room + " is already running"));
            }
            running = true;
            firstJoin = Sinks.one();
            termination = Sinks.one();
            joined = firstJoin;
        }
        log.info("Starting session for room {} as {}", room, credentials.getNick());
        runCycle(0);
        return joined.asMono();
    }

    @Override
    public Mono<Void> stop() {
        List<RoomEvent> events = new ArrayList<>();
        Sinks.One<Void> joined;
        Sinks.One<Void> terminated;
        synchronized (lifecycleLock) {
            if (!running) {
                return Mono.empty();
            }
            running = false;
            dispose(backoff);
            dispose(cycle);
            backoff = null;
            cycle = null;
            session = null;
            joined = firstJoin;
            terminated = termination;
            if (state.get() != SessionState.DISCONNECTED) {
                addStateChange(events, SessionState.DISCONNECTING);
            }
        }
        log.info("Stopping session for room {}", room);
        dispatcher.dispatchAll(events);

        Sinks.Empty<Void> done = Sinks.empty();
        closeTransport()
                .doFinally(signal -> {
                    transition(SessionState.DISCONNECTED);
                    dispatcher.dispatch(new RoomEvents.SessionClosed(CloseReason.STOPPED, null, 0, Duration.ZERO));
                    joined.tryEmitError(new SessionException("Session for room " + room + " stopped before joining"));
                    terminated.tryEmitEmpty();
                    done.tryEmitEmpty();
                })
                .subscribe();
        return done.asMono();
    }

    @Override
    public void send(Message command) {
        Session s = session;
        if (s == null) {
            throw new NotConnectedException("Session for room " + room + " is not connected");
        }
        send(s, command);
    }

    @Override
    public void validate(Message command) {
        codec.encode(command);
    }

    @Override
    public SessionState getState() {
        return state.get();
    }

    @Override
    public Optional<RoomSnapshot> roomSnapshot() {
        Session s = session;
        RoomState roomState = s == null ? null : s.getRoomState();
        return roomState == null ? Optional.empty() : Optional.of(roomState.snapshot());
    }

    @Override
    public Mono<Void> termination() {
        return termination.asMono();
    }

    /**
     * Nick used for the next login; follows confirmed nick changes of the own user.
     */
    public String getNick() {
        return credentials.getNick();
    }

    private void runCycle(int attempt) {
        Session s;
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            s = sessionFactory.createSession(room, attempt);
            session = s;
        }
        Disposable subscription = connectAndRun(s)
                .subscribe(null, err -> onCycleEnd(s, err), () -> onCycleEnd(s, null));
        synchronized (lifecycleLock) {
            if (running && session == s) {
                cycle = subscription;
            } else {
                subscription.dispose();
            }
        }
    }

    private Mono<Void> connectAndRun(Session s) {
        return Mono.defer(() -> {
                    transition(s, SessionState.CONNECTING);
                    return gatewayResolver.resolve(room);
                })
                .flatMap(gateway -> transport.connect(gateway.getEndpoint(), config.getConnectTimeout())
                        .then(Mono.defer(() -> {
                            log.debug("Connected to {} for room {} (attempt {})", gateway.getEndpoint(), room, s.getAttempt());
                            transition(s, SessionState.AUTHENTICATING);
                            return Mono.when(receiveLoop(s), handshake(s, gateway));
                        })));
    }

    private Mono<Void> handshake(Session s, Gateway gateway) {
        return authFlow.authenticate(credentials, gateway.getToken(),
                        command -> send(s, command), s.getAuthReplies().asFlux())
                .doOnNext(identity -> onAuthenticated(s, identity))
                .then();
    }

    private Mono<Void> receiveLoop(Session s) {
        return transport.inbound()
                .publishOn(inboundScheduler)
                .doOnNext(frame -> metrics.recordInbound(BytesUtils.utf8Length(frame)))
                .concatMap(frame -> codec.decode(frame)
                        .onErrorResume(DecodeException.class, e -> {
                            log.warn("Skipping malformed frame in room {}: {}", room, e.getMessage());
                            metrics.recordDecodeFailure();
                            return Mono.empty();
                        }))
                .concatMap(message -> Mono.fromRunnable(() -> onMessage(s, message))
                        .onErrorResume(e -> {
                            log.warn("Failed to process {} in room {}: {}", message.getOpcode(), room, e.toString());
                            return Mono.empty();
                        }))
                .doOnError(err -> s.getAuthReplies().tryEmitError(err))
                .doOnComplete(() -> s.getAuthReplies().tryEmitComplete())
                .then();
    }

    private void onAuthenticated(Session s, Identity identity) {
        s.setIdentity(identity);
        s.setRoomState(new RoomState(room, clock));
        if (!transition(s, SessionState.JOINING_ROOM)) {
            return;
        }
        send(s, Commands.join(room, config.getUserAgent()));
    }

    private void onMessage(Session s, Message message) {
        if (s != session) {
            log.debug("Dropping {} from a previous connection", message.getOpcode());
            return;
        }
        MDC.put(MDC_ROOM, room);
        try {
            s.touch(clock.instant());
            log.debug("Received {} (req {})", message.getOpcode(), message.getReq());

            if (message.getOpcode() == Opcode.PING) {
                send(s, Commands.pong());
                return;
            }
            if (message.getOpcode() == Opcode.CLOSED) {
                s.setServerCloseCode(message.intValue("error", Session.NO_CLOSE_CODE));
            }

            switch (state.get()) {
                case AUTHENTICATING -> {
                    if (AuthFlow.isAuthReply(message)) {
                        s.getAuthReplies().tryEmitNext(message);
                    } else {
                        log.debug("Ignoring {} before login completed", message.getOpcode());
                    }
                }
                case JOINING_ROOM, JOINED -> onRoomMessage(s, message);
                default -> log.debug("Ignoring {} in state {}", message.getOpcode(), state.get());
            }
        } finally {
            MDC.remove(MDC_ROOM);
        }
    }

    private void onRoomMessage(Session s, Message message) {
        RoomState roomState = s.getRoomState();
        RoomUpdate update = roomState.apply(message);
        Opcode opcode = message.getOpcode();

        if (opcode == Opcode.USERLIST && state.get() == SessionState.JOINING_ROOM) {
            onJoined(s, roomState);
            return;
        }
        if (opcode == Opcode.PASSWORD && config.getRoomPassword() != null) {
            log.info("Room {} asked for a password, answering from configuration", room);
            send(s, Commands.roomPassword(config.getRoomPassword()));
            return;
        }
        if (opcode == Opcode.NICK) {
            trackOwnNick(roomState, update);
        }
        dispatcher.dispatchAll(translator.translate(message, update, roomState));
        if (opcode == Opcode.SYSMSG && isBanNotice(message) && roomState.selfCanModerate()) {
            send(s, Commands.banList());
        }
    }

    private static boolean isBanNotice(Message message) {
        String text = message.text("text");
        return text != null && text.toLowerCase(Locale.ROOT).contains("banned");
    }

    private void onJoined(Session s, RoomState roomState) {
        Duration latency = Duration.between(s.getStartedAt(), clock.instant());
        List<RoomEvent> events = new ArrayList<>(1);
        synchronized (lifecycleLock) {
            if (!running || s != session) {
                log.debug("Dropping join of room {} completed after stop", room);
                return;
            }
            s.setJoined(true);
            addStateChange(events, SessionState.JOINED);
        }
        metrics.recordJoinLatency(latency);
        dispatcher.dispatchAll(events);
        RoomSnapshot snapshot = roomState.snapshot();
        log.info("Joined room {} with {} users in {} ms (attempt {})",
                room, snapshot.getUsers().size(), latency.toMillis(), s.getAttempt());
        dispatcher.dispatch(new RoomEvents.RoomJoined(snapshot));
        firstJoin.tryEmitEmpty();
        if (roomState.selfCanModerate()) {
            send(s, Commands.banList());
        }
    }

    private void trackOwnNick(RoomState roomState, RoomUpdate update) {
        UserRecord after = update.after();
        Integer self = roomState.snapshot().getSelfHandle();
        if (after != null && self != null && self == after.getHandle()) {
            credentials = credentials.withNick(after.getNick());
        }
    }

    private void send(Session s, Message command) {
        String frame;
        synchronized (sendLock) {
            int req = s.currentReq();
            frame = codec.encode(command.withReq(req));
            // advanced before the write: replies may be processed before send returns
            s.advanceReq();
            try {
                transport.send(frame);
            } catch (RuntimeException e) {
                s.releaseReq(req);
                throw e;
            }
        }
        metrics.recordOutbound(BytesUtils.utf8Length(frame));
        log.debug("Sent {}", command.getOpcode());
    }

    private void onCycleEnd(Session s, Throwable err) {
        List<RoomEvent> events = new ArrayList<>();
        Throwable fatal;
        Sinks.One<Void> joined;
        Sinks.One<Void> terminated;
        Mono<Void> closing;
        int nextAttempt;
        Duration delay = Duration.ZERO;

        synchronized (lifecycleLock) {
            if (s != session || !running) {
                return;
            }
            if (err == null) {
                log.info("Connection to room {} closed by server", room);
            } else {
                log.warn("Connection to room {} ended: {}", room, err.toString());
            }
            addStateChange(events, SessionState.DISCONNECTING);
            s.setRoomState(null);
            closing = closeTransport();
            addStateChange(events, SessionState.DISCONNECTED);

            nextAttempt = s.isJoined() ? 1 : s.getAttempt() + 1;
            fatal = fatalCause(s, err);
            if (fatal == null && nextAttempt > config.getMaxReconnectAttempts()) {
                fatal = new SessionException("Gave up on room " + room + " after "
                        + config.getMaxReconnectAttempts() + " reconnect attempts", err);
            }
            if (fatal == null) {
                delay = JitterBackoff.next(nextAttempt - 1,
                        config.getBackoffBase(), config.getBackoffMax(), config.getBackoffJitter());
                events.add(new RoomEvents.SessionClosed(CloseReason.RETRYING, err, nextAttempt, delay));
            } else {
                running = false;
                session = null;
                cycle = null;
                events.add(new RoomEvents.SessionClosed(CloseReason.GAVE_UP, fatal, s.getAttempt(), Duration.ZERO));
            }
            joined = firstJoin;
            terminated = termination;
        }

        dispatcher.dispatchAll(events);

        if (fatal != null) {
            log.error("Session for room {} failed: {}", room, fatal.getMessage());
            closing.subscribe();
            Throwable cause = fatal.getCause();
            Throwable startError = cause instanceof AuthException || cause instanceof EncodingException ? cause : fatal;
            joined.tryEmitError(startError);
            terminated.tryEmitError(fatal);
            return;
        }

        metrics.recordReconnectAttempt();
        log.info("Reconnecting to room {} in {} ms (attempt {}/{})",
                room, delay.toMillis(), nextAttempt, config.getMaxReconnectAttempts());
        Mono<Long> retry = closing.then(Mono.delay(delay));
        synchronized (lifecycleLock) {
            if (running && session == s) {
                backoff = retry.subscribe(tick -> runCycle(nextAttempt));
            }
        }
    }

    private Throwable fatalCause(Session s, Throwable err) {
        if (err instanceof AuthException) {
            return new SessionException("Login to room " + room + " failed: " + err.getMessage(), err);
        }
        if (err instanceof EncodingException) {
            return new SessionException("Cannot encode a command for room " + room + ": " + err.getMessage(), err);
        }
        int code = s.getServerCloseCode();
        if (ServerCloseCodes.isTerminal(code)) {
            return new SessionException("Server ended the session in room " + room + ": "
                    + ServerCloseCodes.describe(code), err);
        }
        if (!config.isReconnect()) {
            return new SessionException("Connection to room " + room + " ended and reconnect is disabled", err);
        }
        return null;
    }

    private Mono<Void> closeTransport() {
        return transport.close()
                .onErrorResume(e -> {
                    log.debug("Error while closing connection for room {}: {}", room, e.toString());
                    return Mono.empty();
                });
    }

    private void transition(SessionState to) {
        List<RoomEvent> events = new ArrayList<>(1);
        addStateChange(events, to);
        dispatcher.dispatchAll(events);
    }

    /**
     * Moves to {@code to} only while {@code s} is the live session of a running manager.
     *
     * @return false when the cycle was stopped or replaced
     */
    private boolean transition(Session s, SessionState to) {
        List<RoomEvent> events = new ArrayList<>(1);
        synchronized (lifecycleLock) {
            if (!running || s != session) {
                return false;
            }
            addStateChange(events, to);
        }
        dispatcher.dispatchAll(events);
        return true;
    }

    private void addStateChange(List<RoomEvent> events, SessionState to) {
        SessionState from = state.getAndSet(to);
        if (from != to) {
            log.info("Room {}: {} -> {}", room, from, to);
            events.add(new RoomEvents.SessionStateChanged(from, to));
        }
    }

    private static void dispose(Disposable disposable) {
        if (disposable != null) {
            disposable.dispose();
        }
    }
}
