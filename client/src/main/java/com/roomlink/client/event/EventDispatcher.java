package com.roomlink.client.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes events to the handlers registered for their kind.
 * <p>
 * One event is delivered at a time; handlers of a kind run in registration order. Handler lists are
 * copy-on-write, so a handler registered while an event is being delivered first sees the next one.
 * A failing handler is reported to the error sink and delivery continues with the next handler.
 * </p>
 */
public class EventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final Map<EventKind<?>, List<Registration<?>>> handlers = new ConcurrentHashMap<>();
    private final Consumer<HandlerFailure> errorSink;
    private final Object dispatchLock = new Object();

    public EventDispatcher() {
        this(EventDispatcher::logFailure);
    }

    public EventDispatcher(Consumer<HandlerFailure> errorSink) {
        this.errorSink = errorSink;
    }

    public static void logFailure(HandlerFailure failure) {
        log.warn("Handler for {} failed: {}", failure.kind(), failure.error().toString(), failure.error());
    }

    public <E extends RoomEvent> void register(EventKind<E> kind, RoomEventHandler<? super E> handler) {
        if (kind == null || handler == null) {
            throw new IllegalArgumentException("kind and handler are required");
        }
        handlers.computeIfAbsent(kind, k -> new CopyOnWriteArrayList<>()).add(new Registration<>(kind, handler));
        log.debug("Registered handler for {}", kind);
    }

    /**
     * Removes the first registration of the handler under the kind.
     *
     * @return true if the handler was registered
     */
    public <E extends RoomEvent> boolean unregister(EventKind<E> kind, RoomEventHandler<? super E> handler) {
        List<Registration<?>> list = handlers.get(kind);
        if (list == null) {
            return false;
        }
        for (Registration<?> registration : list) {
            if (registration.handler.equals(handler)) {
                return list.remove(registration);
            }
        }
        return false;
    }

    public int handlerCount(EventKind<?> kind) {
        List<Registration<?>> list = handlers.get(kind);
        return list == null ? 0 : list.size();
    }

    public void dispatch(RoomEvent event) {
        synchronized (dispatchLock) {
            deliver(event);
        }
    }

    /**
     * Delivers the events in order without interleaving events from other threads.
     */
    public void dispatchAll(Collection<? extends RoomEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        synchronized (dispatchLock) {
            for (RoomEvent event : events) {
                deliver(event);
            }
        }
    }

    private void deliver(RoomEvent event) {
        EventKind<?> kind = event.kind();
        List<Registration<?>> list = handlers.get(kind);
        if (list == null) {
            return;
        }
        // iterating a CopyOnWriteArrayList works on the snapshot taken here
        for (Registration<?> registration : list) {
            try {
                registration.deliver(event);
            } catch (Exception e) {
                reportFailure(new HandlerFailure(kind, event, e));
            }
        }
    }

    private static final class Registration<E extends RoomEvent> {
        private final EventKind<E> kind;
        private final RoomEventHandler<? super E> handler;

        private Registration(EventKind<E> kind, RoomEventHandler<? super E> handler) {
            this.kind = kind;
            this.handler = handler;
        }

        void deliver(RoomEvent event) throws Exception {
            handler.handle(kind.type().cast(event));
        }
    }

    private void reportFailure(HandlerFailure failure) {
        try {
            errorSink.accept(failure);
        } catch (RuntimeException e) {
            log.error("Error sink failed while reporting handler failure for {}", failure.kind(), e);
        }
    }
}
