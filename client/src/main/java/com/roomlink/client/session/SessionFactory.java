package com.roomlink.client.session;

import com.roomlink.core.msg.Message;
import reactor.core.publisher.Sinks;

import java.time.Clock;

/**
 * Creates the per-connection {@link Session}.
 */
public class SessionFactory {
    private final Clock clock;

    public SessionFactory(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param room    room name
     * @param attempt reconnect attempt number, 0 for the first connect
     */
    public Session createSession(String room, int attempt) {
        // unicast buffers replies that arrive before the handshake subscribes
        Sinks.Many<Message> authReplies = Sinks.many().unicast().onBackpressureBuffer();
        return new Session(room, attempt, clock.instant(), authReplies);
    }
}
