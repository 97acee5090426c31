package com.roomlink.client.metrics;

import com.roomlink.core.metrics.MetricsNames;
import com.roomlink.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralized metrics for one client session.
 */
public class ClientMetrics {

    private final MeterRegistry registry;
    private final String room;

    private final Counter framesInbound;
    private final Counter framesOutbound;
    private final Counter bytesInbound;
    private final Counter bytesOutbound;
    private final Counter decodeFailures;
    private final Counter reconnectAttempts;

    private final Timer joinLatency;

    public ClientMetrics(MeterRegistry registry, String room) {
        this.registry = registry;
        this.room = room;

        framesInbound = Counter.builder(MetricsNames.FRAMES_INBOUND_TOTAL)
            .tag(MetricsTags.ROOM, room)
            .description("Frames received from the server")
            .register(registry);

        framesOutbound = Counter.builder(MetricsNames.FRAMES_OUTBOUND_TOTAL)
            .tag(MetricsTags.ROOM, room)
            .description("Frames sent to the server")
            .register(registry);

        bytesInbound = Counter.builder(MetricsNames.BYTES_INBOUND_TOTAL)
            .tag(MetricsTags.ROOM, room)
            .baseUnit("bytes")
            .register(registry);

        bytesOutbound = Counter.builder(MetricsNames.BYTES_OUTBOUND_TOTAL)
            .tag(MetricsTags.ROOM, room)
            .baseUnit("bytes")
            .register(registry);

        decodeFailures = Counter.builder(MetricsNames.DECODE_FAILURES_TOTAL)
            .tag(MetricsTags.ROOM, room)
            .description("Inbound frames skipped as malformed")
            .register(registry);

        reconnectAttempts = Counter.builder(MetricsNames.RECONNECT_ATTEMPTS_TOTAL)
            .tag(MetricsTags.ROOM, room)
            .register(registry);

        joinLatency = Timer.builder(MetricsNames.JOIN_LATENCY)
            .tag(MetricsTags.ROOM, room)
            .description("Connect, login and room snapshot")
            .register(registry);
    }

    public void recordInbound(int bytes) {
        framesInbound.increment();
        bytesInbound.increment(bytes);
    }

    public void recordOutbound(int bytes) {
        framesOutbound.increment();
        bytesOutbound.increment(bytes);
    }

    public void recordDecodeFailure() {
        decodeFailures.increment();
    }

    public void recordReconnectAttempt() {
        reconnectAttempts.increment();
    }

    public void recordJoinLatency(Duration duration) {
        joinLatency.record(duration);
    }

    public void recordHandlerFailure(String eventKind) {
        // tag per event kind, registered lazily
        Counter.builder(MetricsNames.HANDLER_FAILURES_TOTAL)
            .tag(MetricsTags.ROOM, room)
            .tag(MetricsTags.EVENT, eventKind)
            .register(registry)
            .increment();
    }
}
