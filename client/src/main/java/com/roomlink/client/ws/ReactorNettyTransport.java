package com.roomlink.client.ws;

import com.roomlink.client.config.ClientConfig;
import com.roomlink.core.error.ConnectFailedException;
import com.roomlink.core.error.ConnectionLostException;
import com.roomlink.core.error.NotConnectedException;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Websocket transport on Reactor Netty.
 * <p>
 * Keepalive: a ping frame goes out after {@code pingInterval} without writes; when nothing
 * (frames or pongs) is read for {@code idleTimeout} the connection is dropped and the transport
 * ends {@link TransportState#FAILED}.
 * </p>
 */
public class ReactorNettyTransport implements ITransport {
    private static final Logger log = LoggerFactory.getLogger(ReactorNettyTransport.class);

    public static final String SUBPROTOCOL = "tc";
    private static final Duration CLOSE_HANDSHAKE_TIMEOUT = Duration.ofSeconds(2);

    private final ClientConfig config;
    private final AtomicReference<TransportState> state = new AtomicReference<>(TransportState.IDLE);
    private final Object sendLock = new Object();

    private volatile Link link;

    public ReactorNettyTransport(ClientConfig config) {
        this.config = config;
    }

    /**
     * Resources of one connection attempt.
     */
    private static final class Link {
        final URI uri;
        final Sinks.Many<String> inbound = Sinks.many().unicast().onBackpressureBuffer();
        final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        final Sinks.One<Void> opened = Sinks.one();
        final AtomicBoolean terminated = new AtomicBoolean();
        volatile Disposable subscription;
        volatile WebsocketOutbound ws;
        volatile Throwable failure;
        volatile WebSocketCloseStatus closeStatus;

        Link(URI uri) {
            this.uri = uri;
        }
    }

    @Override
    public Mono<Void> connect(URI uri, Duration timeout) {
        return Mono.defer(() -> {
            TransportState current = state.get();
            if (!current.isTerminal() || !state.compareAndSet(current, TransportState.CONNECTING)) {
                return Mono.error(new IllegalStateException("Cannot connect while transport is " + current));
            }
            Link l = new Link(uri);
            link = l;
            log.debug("Connecting to {}", uri);

            l.subscription = httpClient(timeout)
                    .websocket(WebsocketClientSpec.builder()
                            .protocols(SUBPROTOCOL)
                            .maxFramePayloadLength(config.getMaxFrameBytes())
                            .build())
                    .uri(uri.toString())
                    .handle((inbound, outbound) -> onOpen(l, inbound, outbound))
                    .subscribe(
                            v -> {
                            },
                            err -> terminate(l, err),
                            () -> terminate(l, null));

            return l.opened.asMono()
                    .timeout(timeout)
                    .onErrorMap(TimeoutException.class,
                            e -> new ConnectFailedException("Timed out connecting to " + uri + " after " + timeout, e))
                    .onErrorMap(e -> !(e instanceof ConnectFailedException),
                            e -> new ConnectFailedException("Cannot connect to " + uri + ": " + e.getMessage(), e))
                    .doOnError(e -> abort(l, e))
                    .doOnCancel(() -> {
                        log.debug("Connect to {} cancelled", uri);
                        state.compareAndSet(TransportState.CONNECTING, TransportState.CLOSING);
                        abort(l, null);
                    });
        });
    }

    private HttpClient httpClient(Duration timeout) {
        return HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE))
                .headers(headers -> headers
                        .set(HttpHeaderNames.USER_AGENT, config.getUserAgent())
                        .set(HttpHeaderNames.ORIGIN, config.getOrigin()));
    }

    private Publisher<Void> onOpen(Link l, WebsocketInbound inbound, WebsocketOutbound outbound) {
        l.ws = outbound;
        handleConnectionStateUpdates(l, inbound);
        inbound.receiveCloseStatus().subscribe(status -> l.closeStatus = status);

        if (!state.compareAndSet(TransportState.CONNECTING, TransportState.OPEN)) {
            // stopped while the handshake was in flight
            return outbound.sendClose();
        }
        log.info("Websocket open: {}", l.uri);
        l.opened.tryEmitEmpty();

        Mono<Void> receive = inbound.aggregateFrames(config.getMaxFrameBytes())
                .receiveFrames()
                .doOnNext(frame -> {
                    if (frame instanceof TextWebSocketFrame text) {
                        l.inbound.tryEmitNext(text.text());
                    }
                })
                .then()
                .doFinally(signal -> l.outbound.tryEmitComplete());

        Mono<Void> send = outbound.sendObject(l.outbound.asFlux().map(TextWebSocketFrame::new)).then();

        return Mono.when(receive, send);
    }

    private void handleConnectionStateUpdates(Link l, WebsocketInbound inbound) {
        inbound.withConnection(connection -> {
            long pingIntervalMillis = config.getPingInterval().toMillis();
            long idleTimeoutMillis = config.getIdleTimeout().toMillis();

            connection.onWriteIdle(pingIntervalMillis, () -> connection.outbound()
                            .sendObject(Mono.just(new PingWebSocketFrame()))
                            .then()
                            .subscribe(null, err -> log.debug("Ping to {} failed: {}", l.uri, err.toString())))
                    .onReadIdle(idleTimeoutMillis, () -> {
                        log.warn("Nothing read from {} for {} ms, dropping connection", l.uri, idleTimeoutMillis);
                        l.failure = new ConnectionLostException("No frame or pong received for " + idleTimeoutMillis + " ms");
                        connection.dispose();
                    });
        });
    }

    @Override
    public void send(String frame) {
        synchronized (sendLock) {
            Link l = link;
            TransportState current = state.get();
            if (current != TransportState.OPEN || l == null) {
                throw new NotConnectedException("Cannot send, transport is " + current);
            }
            Sinks.EmitResult result = l.outbound.tryEmitNext(frame);
            if (result.isFailure()) {
                throw new NotConnectedException("Cannot queue frame: " + result);
            }
        }
    }

    @Override
    public Flux<String> inbound() {
        Link l = link;
        return l == null ? Flux.error(new NotConnectedException("Transport was never connected")) : l.inbound.asFlux();
    }

    @Override
    public Mono<Void> close() {
        return Mono.defer(() -> {
            Link l = link;
            TransportState current = state.get();
            if (l == null || current.isTerminal()) {
                return Mono.empty();
            }
            state.set(TransportState.CLOSING);
            log.debug("Closing websocket to {}", l.uri);
            WebsocketOutbound ws = l.ws;
            Mono<Void> handshake = ws == null ? Mono.empty() : ws.sendClose(1001, "GoingAway");
            return handshake
                    .timeout(CLOSE_HANDSHAKE_TIMEOUT, Mono.empty())
                    .onErrorResume(err -> {
                        log.debug("Close handshake with {} failed: {}", l.uri, err.toString());
                        return Mono.empty();
                    })
                    .doFinally(signal -> abort(l, null));
        });
    }

    @Override
    public TransportState getState() {
        return state.get();
    }

    private void abort(Link l, Throwable cause) {
        if (cause != null && l.failure == null) {
            l.failure = cause;
        }
        Disposable subscription = l.subscription;
        if (subscription != null) {
            subscription.dispose();
        }
        terminate(l, cause);
    }

    private void terminate(Link l, Throwable err) {
        if (!l.terminated.compareAndSet(false, true)) {
            return;
        }
        Throwable failure = l.failure != null ? l.failure : err;
        boolean closing = state.get() == TransportState.CLOSING;

        if (link == l) {
            if (closing || (failure == null && l.closeStatus != null)) {
                state.set(TransportState.CLOSED);
                log.info("Websocket closed: {} (status={})", l.uri, l.closeStatus);
                l.inbound.tryEmitComplete();
            } else {
                ConnectionLostException lost = failure instanceof ConnectionLostException c
                        ? c
                        : new ConnectionLostException("Connection to " + l.uri + " ended without close handshake", failure);
                state.set(TransportState.FAILED);
                log.warn("Websocket failed: {}: {}", l.uri, lost.getMessage());
                l.inbound.tryEmitError(lost);
            }
        }
        l.opened.tryEmitError(new ConnectFailedException("Connection to " + l.uri + " ended before it was open", err));
    }
}
