package com.roomlink.client.event;

/**
 * Marker for everything the session delivers to application handlers.
 */
public interface RoomEvent {
    EventKind<?> kind();
}
