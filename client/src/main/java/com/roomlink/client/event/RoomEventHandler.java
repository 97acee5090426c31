package com.roomlink.client.event;

/**
 * Application callback for one event kind. Exceptions are reported to the dispatcher's error
 * sink and do not stop delivery to other handlers.
 */
@FunctionalInterface
public interface RoomEventHandler<E extends RoomEvent> {
    void handle(E event) throws Exception;
}
