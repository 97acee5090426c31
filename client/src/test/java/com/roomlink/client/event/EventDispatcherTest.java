package com.roomlink.client.event;

import com.roomlink.core.model.UserRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventDispatcherTest {

    private List<HandlerFailure> failures;
    private EventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        failures = new CopyOnWriteArrayList<>();
        dispatcher = new EventDispatcher(failures::add);
    }

    @Test
    void testHandlers_RunInRegistrationOrder() {
        List<String> calls = new CopyOnWriteArrayList<>();
        dispatcher.register(EventKind.USER_JOINED, e -> calls.add("first:" + e.getUser().getNick()));
        dispatcher.register(EventKind.USER_JOINED, e -> calls.add("second:" + e.getUser().getNick()));

        dispatcher.dispatch(new RoomEvents.UserJoined(user(1, "alice")));

        assertEquals(List.of("first:alice", "second:alice"), calls);
    }

    @Test
    void testOnlyMatchingKind_Receives() {
        List<RoomEvent> received = new CopyOnWriteArrayList<>();
        dispatcher.register(EventKind.USER_LEFT, received::add);

        dispatcher.dispatch(new RoomEvents.UserJoined(user(1, "alice")));

        assertTrue(received.isEmpty());
    }

    @Test
    void testFailingHandler_IsolatedAndReported() {
        List<String> calls = new CopyOnWriteArrayList<>();
        IllegalStateException boom = new IllegalStateException("boom");
        dispatcher.register(EventKind.CHAT_RECEIVED, e -> calls.add("before"));
        dispatcher.register(EventKind.CHAT_RECEIVED, e -> {
            throw boom;
        });
        dispatcher.register(EventKind.CHAT_RECEIVED, e -> calls.add("after"));

        RoomEvents.ChatReceived event = new RoomEvents.ChatReceived(user(2, "bob"), "hi");
        dispatcher.dispatch(event);

        assertEquals(List.of("before", "after"), calls);
        assertEquals(1, failures.size());
        assertSame(boom, failures.get(0).error());
        assertSame(event, failures.get(0).event());
        assertEquals(EventKind.CHAT_RECEIVED, failures.get(0).kind());
    }

    @Test
    void testCheckedException_Reported() {
        dispatcher.register(EventKind.SYSTEM_MESSAGE, e -> {
            throw new Exception("checked");
        });

        dispatcher.dispatch(new RoomEvents.SystemMessage("hello"));

        assertEquals("checked", failures.get(0).error().getMessage());
    }

    @Test
    void testRegistrationDuringDispatch_AppliesToNextEvent() {
        List<String> calls = new CopyOnWriteArrayList<>();
        RoomEventHandler<RoomEvents.UserJoined> late = e -> calls.add("late:" + e.getUser().getNick());
        dispatcher.register(EventKind.USER_JOINED, e -> {
            calls.add("early:" + e.getUser().getNick());
            if (dispatcher.handlerCount(EventKind.USER_JOINED) == 1) {
                dispatcher.register(EventKind.USER_JOINED, late);
            }
        });

        dispatcher.dispatch(new RoomEvents.UserJoined(user(1, "a")));
        dispatcher.dispatch(new RoomEvents.UserJoined(user(2, "b")));

        assertEquals(List.of("early:a", "early:b", "late:b"), calls);
    }

    @Test
    void testUnregister_StopsDelivery() {
        List<String> calls = new CopyOnWriteArrayList<>();
        RoomEventHandler<RoomEvents.UserLeft> handler = e -> calls.add(e.getUser().getNick());
        dispatcher.register(EventKind.USER_LEFT, handler);

        assertTrue(dispatcher.unregister(EventKind.USER_LEFT, handler));
        assertFalse(dispatcher.unregister(EventKind.USER_LEFT, handler));
        dispatcher.dispatch(new RoomEvents.UserLeft(user(1, "a")));

        assertTrue(calls.isEmpty());
    }

    @Test
    void testDispatchAll_KeepsOrder() {
        List<String> calls = new CopyOnWriteArrayList<>();
        dispatcher.register(EventKind.USER_JOINED, e -> calls.add("joined:" + e.getUser().getNick()));
        dispatcher.register(EventKind.USER_KICKED, e -> calls.add("kicked:" + e.getUser().getNick()));

        dispatcher.dispatchAll(List.of(
                new RoomEvents.UserJoined(user(1, "alice")),
                new RoomEvents.UserKicked(user(1, "alice"))));

        assertEquals(List.of("joined:alice", "kicked:alice"), calls);
    }

    @Test
    void testConcurrentDispatch_NeverOverlaps() throws InterruptedException {
        int[] active = {0};
        int[] maxActive = {0};
        dispatcher.register(EventKind.SYSTEM_MESSAGE, e -> {
            active[0]++;
            maxActive[0] = Math.max(maxActive[0], active[0]);
            Thread.sleep(1);
            active[0]--;
        });

        Thread[] threads = new Thread[4];
        for (int i = 0; i < threads.length; i++) {
            threads[i] = new Thread(() -> {
                for (int n = 0; n < 25; n++) {
                    dispatcher.dispatch(new RoomEvents.SystemMessage("m" + n));
                }
            });
            threads[i].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        assertEquals(1, maxActive[0]);
        assertTrue(failures.isEmpty());
    }

    @Test
    @DisplayName("A slow handler sees events in the same relative order as fast ones")
    void testSlowHandler_KeepsRelativeOrder() throws InterruptedException {
        // Given
        List<String> fast = new CopyOnWriteArrayList<>();
        List<String> slow = new CopyOnWriteArrayList<>();
        RoomEventHandler<RoomEvent> slowHandler = e -> {
            Thread.sleep(2);
            slow.add(label(e));
        };
        dispatcher.register(EventKind.USER_JOINED, slowHandler);
        dispatcher.register(EventKind.USER_JOINED, e -> fast.add(label(e)));
        dispatcher.register(EventKind.USER_LEFT, e -> fast.add(label(e)));
        dispatcher.register(EventKind.USER_LEFT, slowHandler);

        List<RoomEvent> sequence = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            sequence.add(i % 3 == 2 ? new RoomEvents.UserLeft(user(i, "u" + i)) : new RoomEvents.UserJoined(user(i, "u" + i)));
        }

        // When: delivered one by one from another thread, as the inbound path does
        Thread inbound = new Thread(() -> sequence.forEach(dispatcher::dispatch));
        inbound.start();
        inbound.join();

        // Then
        List<String> expected = sequence.stream().map(EventDispatcherTest::label).collect(Collectors.toList());
        assertEquals(expected, fast);
        assertEquals(expected, slow);
        assertTrue(failures.isEmpty());
    }

    @Test
    void testSupertypeHandler_ReceivesTypedEvents() {
        List<RoomEvent> seen = new CopyOnWriteArrayList<>();
        RoomEventHandler<RoomEvent> any = seen::add;
        dispatcher.register(EventKind.SYSTEM_MESSAGE, any);
        dispatcher.register(EventKind.USER_JOINED, any);

        dispatcher.dispatch(new RoomEvents.SystemMessage("hello"));
        dispatcher.dispatch(new RoomEvents.UserJoined(user(1, "alice")));

        assertEquals(2, seen.size());
        assertEquals(EventKind.SYSTEM_MESSAGE, seen.get(0).kind());
        assertTrue(dispatcher.unregister(EventKind.USER_JOINED, any));
        assertEquals(1, dispatcher.handlerCount(EventKind.SYSTEM_MESSAGE));
        assertEquals(0, dispatcher.handlerCount(EventKind.USER_JOINED));
    }

    private static String label(RoomEvent event) {
        if (event instanceof RoomEvents.UserJoined) {
            return "joined:" + ((RoomEvents.UserJoined) event).getUser().getNick();
        }
        return "left:" + ((RoomEvents.UserLeft) event).getUser().getNick();
    }

    private static UserRecord user(int handle, String nick) {
        return UserRecord.placeholder(handle, nick, Instant.EPOCH);
    }
}
