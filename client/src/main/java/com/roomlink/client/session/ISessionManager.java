package com.roomlink.client.session;

import com.roomlink.core.model.RoomSnapshot;
import com.roomlink.core.msg.Message;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Owns the connect, login, join and reconnect lifecycle of one room session.
 */
public interface ISessionManager {
    /**
     * Begins connecting right away.
     *
     * @return Mono completing when the room is first joined, failing with the error that made the
     * session give up (an {@link com.roomlink.core.error.AuthException} for a rejected login)
     */
    Mono<Void> start();

    /**
     * Cancels any pending reconnect and in-flight connect, closes the connection.
     *
     * @return Mono completing when the connection is closed
     */
    Mono<Void> stop();

    /**
     * Encodes and sends a command on the current connection.
     *
     * @throws com.roomlink.core.error.EncodingException    if the command is invalid; nothing is sent
     * @throws com.roomlink.core.error.NotConnectedException if no connection is open
     */
    void send(Message command);

    /**
     * Checks that a command encodes, without sending it.
     *
     * @throws com.roomlink.core.error.EncodingException if the command is invalid
     */
    void validate(Message command);

    SessionState getState();

    /**
     * Latest room snapshot, empty until the room state exists.
     */
    Optional<RoomSnapshot> roomSnapshot();

    /**
     * Completes after {@link #stop()}, fails with {@link com.roomlink.core.error.SessionException}
     * when the session gives up.
     */
    Mono<Void> termination();
}
