package com.roomlink.client.event;

/**
 * A handler threw while processing an event.
 */
public record HandlerFailure(EventKind<?> kind, RoomEvent event, Throwable error) {
}
