package com.roomlink.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for the room name.
     */
    public static final String ROOM = "room";

    /**
     * Tag key for the event kind.
     */
    public static final String EVENT = "event";

}
