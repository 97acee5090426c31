package com.roomlink.core.metrics;

/**
 * Micrometer metric names used by the client.
 * <p>
 * <b>Naming convention:</b> {@code roomlink.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Frames received from the server.
     * <p>
     * Tags: room
     * </p>
     */
    public static final String FRAMES_INBOUND_TOTAL = "roomlink.ws.frames.inbound.total";

    /**
     * Counter: Frames sent to the server.
     * <p>
     * Tags: room
     * </p>
     */
    public static final String FRAMES_OUTBOUND_TOTAL = "roomlink.ws.frames.outbound.total";

    /**
     * Counter: Bytes received from the server.
     */
    public static final String BYTES_INBOUND_TOTAL = "roomlink.ws.bytes.inbound.total";

    /**
     * Counter: Bytes sent to the server.
     */
    public static final String BYTES_OUTBOUND_TOTAL = "roomlink.ws.bytes.outbound.total";

    /**
     * Counter: Inbound frames skipped because they could not be decoded.
     */
    public static final String DECODE_FAILURES_TOTAL = "roomlink.codec.decode.failures.total";

    /**
     * Counter: Event handlers that threw.
     * <p>
     * Tags: room, event
     * </p>
     */
    public static final String HANDLER_FAILURES_TOTAL = "roomlink.dispatch.handler.failures.total";

    /**
     * Counter: Reconnect attempts scheduled after an unplanned disconnect.
     */
    public static final String RECONNECT_ATTEMPTS_TOTAL = "roomlink.session.reconnect.attempts.total";

    /**
     * Timer: Time from connect start until the room snapshot was received.
     */
    public static final String JOIN_LATENCY = "roomlink.session.join.latency";
}
