package com.roomlink.client.event;

import com.roomlink.client.event.RoomEvents.BanListReceived;
import com.roomlink.client.event.RoomEvents.BroadcastApproved;
import com.roomlink.client.event.RoomEvents.BroadcastClosed;
import com.roomlink.client.event.RoomEvents.BroadcastPending;
import com.roomlink.client.event.RoomEvents.BroadcastStarted;
import com.roomlink.client.event.RoomEvents.BroadcastStopped;
import com.roomlink.client.event.RoomEvents.CaptchaRequired;
import com.roomlink.client.event.RoomEvents.ChatReceived;
import com.roomlink.client.event.RoomEvents.MediaChanged;
import com.roomlink.client.event.RoomEvents.NickChanged;
import com.roomlink.client.event.RoomEvents.PasswordRequired;
import com.roomlink.client.event.RoomEvents.PlaylistReceived;
import com.roomlink.client.event.RoomEvents.PrivateMessageReceived;
import com.roomlink.client.event.RoomEvents.RoomJoined;
import com.roomlink.client.event.RoomEvents.RoomSettingsChanged;
import com.roomlink.client.event.RoomEvents.ServerClosed;
import com.roomlink.client.event.RoomEvents.SessionClosed;
import com.roomlink.client.event.RoomEvents.SessionStateChanged;
import com.roomlink.client.event.RoomEvents.SystemMessage;
import com.roomlink.client.event.RoomEvents.UnknownMessage;
import com.roomlink.client.event.RoomEvents.UserBanned;
import com.roomlink.client.event.RoomEvents.UserJoined;
import com.roomlink.client.event.RoomEvents.UserKicked;
import com.roomlink.client.event.RoomEvents.UserLeft;
import com.roomlink.client.event.RoomEvents.UserUnbanned;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Typed key of an event kind; handlers registered under a kind receive only events of its type.
 *
 * @param <E> event type
 */
public final class EventKind<E extends RoomEvent> {
    private static final List<EventKind<?>> ALL = new ArrayList<>();

    public static final EventKind<RoomJoined> ROOM_JOINED = define("room_joined", RoomJoined.class);
    public static final EventKind<UserJoined> USER_JOINED = define("user_joined", UserJoined.class);
    public static final EventKind<UserLeft> USER_LEFT = define("user_left", UserLeft.class);
    public static final EventKind<NickChanged> NICK_CHANGED = define("nick_changed", NickChanged.class);
    public static final EventKind<ChatReceived> CHAT_RECEIVED = define("chat_received", ChatReceived.class);
    public static final EventKind<PrivateMessageReceived> PRIVATE_MESSAGE_RECEIVED =
            define("private_message_received", PrivateMessageReceived.class);
    public static final EventKind<BroadcastStarted> BROADCAST_STARTED = define("broadcast_started", BroadcastStarted.class);
    public static final EventKind<BroadcastStopped> BROADCAST_STOPPED = define("broadcast_stopped", BroadcastStopped.class);
    public static final EventKind<BroadcastPending> BROADCAST_PENDING = define("broadcast_pending", BroadcastPending.class);
    public static final EventKind<BroadcastApproved> BROADCAST_APPROVED = define("broadcast_approved", BroadcastApproved.class);
    public static final EventKind<BroadcastClosed> BROADCAST_CLOSED = define("broadcast_closed", BroadcastClosed.class);
    public static final EventKind<UserKicked> USER_KICKED = define("user_kicked", UserKicked.class);
    public static final EventKind<UserBanned> USER_BANNED = define("user_banned", UserBanned.class);
    public static final EventKind<UserUnbanned> USER_UNBANNED = define("user_unbanned", UserUnbanned.class);
    public static final EventKind<BanListReceived> BAN_LIST_RECEIVED = define("ban_list_received", BanListReceived.class);
    public static final EventKind<RoomSettingsChanged> ROOM_SETTINGS_CHANGED =
            define("room_settings_changed", RoomSettingsChanged.class);
    public static final EventKind<SystemMessage> SYSTEM_MESSAGE = define("system_message", SystemMessage.class);
    public static final EventKind<PasswordRequired> PASSWORD_REQUIRED = define("password_required", PasswordRequired.class);
    public static final EventKind<CaptchaRequired> CAPTCHA_REQUIRED = define("captcha_required", CaptchaRequired.class);
    public static final EventKind<MediaChanged> MEDIA_CHANGED = define("media_changed", MediaChanged.class);
    public static final EventKind<PlaylistReceived> PLAYLIST_RECEIVED = define("playlist_received", PlaylistReceived.class);
    public static final EventKind<ServerClosed> SERVER_CLOSED = define("server_closed", ServerClosed.class);
    public static final EventKind<UnknownMessage> UNKNOWN_MESSAGE = define("unknown_message", UnknownMessage.class);
    public static final EventKind<SessionStateChanged> SESSION_STATE_CHANGED =
            define("session_state_changed", SessionStateChanged.class);
    public static final EventKind<SessionClosed> SESSION_CLOSED = define("session_closed", SessionClosed.class);

    private final String name;
    private final Class<E> type;

    private EventKind(String name, Class<E> type) {
        this.name = name;
        this.type = type;
    }

    private static <E extends RoomEvent> EventKind<E> define(String name, Class<E> type) {
        EventKind<E> kind = new EventKind<>(name, type);
        ALL.add(kind);
        return kind;
    }

    public static List<EventKind<?>> values() {
        return Collections.unmodifiableList(ALL);
    }

    public String name() {
        return name;
    }

    public Class<E> type() {
        return type;
    }

    @Override
    public String toString() {
        return name;
    }
}
