package com.roomlink.client.ws;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;

/**
 * Raw websocket connection, independent of message semantics.
 * <p>
 * A transport instance is reused across reconnects: {@link #connect} is allowed again once the
 * previous connection reached a terminal state.
 * </p>
 */
public interface ITransport {
    /**
     * Opens a connection.
     *
     * @param uri     websocket endpoint
     * @param timeout bound for TCP connect plus websocket handshake
     * @return Mono completing when the connection is open, or failing with
     * {@link com.roomlink.core.error.ConnectFailedException}
     */
    Mono<Void> connect(URI uri, Duration timeout);

    /**
     * Queues a text frame. Frames from concurrent callers are never interleaved.
     *
     * @param frame text frame
     * @throws com.roomlink.core.error.NotConnectedException if the transport is not open
     */
    void send(String frame);

    /**
     * Inbound text frames of the current connection. Completes on a clean close, fails with
     * {@link com.roomlink.core.error.ConnectionLostException} on an abnormal end.
     * Single subscriber.
     */
    Flux<String> inbound();

    /**
     * Closes the current connection with a close handshake; no-op when nothing is open.
     */
    Mono<Void> close();

    TransportState getState();
}
