package com.roomlink.client.session;

import com.roomlink.client.auth.Identity;
import com.roomlink.client.state.RoomState;
import com.roomlink.core.msg.Message;
import lombok.Getter;
import lombok.Setter;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State of one connection cycle: a fresh instance per connect attempt, discarded when the cycle ends.
 */
@Getter
public class Session {
    public static final int NO_CLOSE_CODE = -1;

    private final String room;
    private final int attempt;
    private final Instant startedAt;
    private final AtomicInteger req;
    /**
     * Login replies routed from the inbound path to the auth handshake.
     */
    private final Sinks.Many<Message> authReplies;

    @Setter
    private volatile Identity identity;
    @Setter
    private volatile RoomState roomState;
    @Setter
    private volatile int serverCloseCode = NO_CLOSE_CODE;
    @Setter
    private volatile boolean joined;
    private volatile Instant lastActivity;

    public Session(String room, int attempt, Instant startedAt, Sinks.Many<Message> authReplies) {
        this.room = room;
        this.attempt = attempt;
        this.startedAt = startedAt;
        this.req = new AtomicInteger(1);
        this.authReplies = authReplies;
        this.lastActivity = startedAt;
    }

    /**
     * Request number for the next outbound frame.
     */
    public int currentReq() {
        return req.get();
    }

    /**
     * Called once a frame was encoded with {@link #currentReq()}.
     */
    public void advanceReq() {
        req.incrementAndGet();
    }

    /**
     * Gives {@code req} back after its frame failed to send. No-op when a later frame already took
     * the next number.
     */
    public void releaseReq(int req) {
        this.req.compareAndSet(req + 1, req);
    }

    public void touch(Instant now) {
        lastActivity = now;
    }
}
