package com.roomlink.client.event;

import com.roomlink.client.session.SessionState;
import com.roomlink.core.model.BannedUser;
import com.roomlink.core.model.MediaItem;
import com.roomlink.core.model.RoomSnapshot;
import com.roomlink.core.model.UserRecord;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Events delivered to application handlers.
 * <p>
 * Room events are dispatched after the room state was updated, so a handler calling
 * {@code roomState()} already sees the change. User records are the state after the change,
 * except for {@link UserLeft}, {@link UserKicked} and {@link UserBanned}, which carry the last
 * known record.
 * </p>
 */
public final class RoomEvents {
    private RoomEvents() {
    }

    /**
     * Room snapshot received; the session is joined. Sent again after every reconnect.
     */
    @Value
    public static class RoomJoined implements RoomEvent {
        RoomSnapshot room;

        @Override
        public EventKind<RoomJoined> kind() {
            return EventKind.ROOM_JOINED;
        }
    }

    @Value
    public static class UserJoined implements RoomEvent {
        UserRecord user;

        @Override
        public EventKind<UserJoined> kind() {
            return EventKind.USER_JOINED;
        }
    }

    @Value
    public static class UserLeft implements RoomEvent {
        UserRecord user;

        @Override
        public EventKind<UserLeft> kind() {
            return EventKind.USER_LEFT;
        }
    }

    @Value
    public static class NickChanged implements RoomEvent {
        UserRecord user;
        String oldNick;

        @Override
        public EventKind<NickChanged> kind() {
            return EventKind.NICK_CHANGED;
        }
    }

    @Value
    public static class ChatReceived implements RoomEvent {
        UserRecord sender;
        String text;

        @Override
        public EventKind<ChatReceived> kind() {
            return EventKind.CHAT_RECEIVED;
        }
    }

    @Value
    public static class PrivateMessageReceived implements RoomEvent {
        UserRecord sender;
        String text;

        @Override
        public EventKind<PrivateMessageReceived> kind() {
            return EventKind.PRIVATE_MESSAGE_RECEIVED;
        }
    }

    @Value
    public static class BroadcastStarted implements RoomEvent {
        UserRecord user;

        @Override
        public EventKind<BroadcastStarted> kind() {
            return EventKind.BROADCAST_STARTED;
        }
    }

    @Value
    public static class BroadcastStopped implements RoomEvent {
        UserRecord user;

        @Override
        public EventKind<BroadcastStopped> kind() {
            return EventKind.BROADCAST_STOPPED;
        }
    }

    /**
     * User waits for approval to broadcast in a green room.
     */
    @Value
    public static class BroadcastPending implements RoomEvent {
        UserRecord user;

        @Override
        public EventKind<BroadcastPending> kind() {
            return EventKind.BROADCAST_PENDING;
        }
    }

    @Value
    public static class BroadcastApproved implements RoomEvent {
        UserRecord user;

        @Override
        public EventKind<BroadcastApproved> kind() {
            return EventKind.BROADCAST_APPROVED;
        }
    }

    /**
     * A moderator closed the user's broadcast.
     */
    @Value
    public static class BroadcastClosed implements RoomEvent {
        UserRecord user;

        @Override
        public EventKind<BroadcastClosed> kind() {
            return EventKind.BROADCAST_CLOSED;
        }
    }

    /**
     * Replaces {@link UserLeft} for a kicked user.
     */
    @Value
    public static class UserKicked implements RoomEvent {
        UserRecord user;

        @Override
        public EventKind<UserKicked> kind() {
            return EventKind.USER_KICKED;
        }
    }

    @Value
    public static class UserBanned implements RoomEvent {
        BannedUser ban;
        /**
         * Removed roster record, null when the banned user was not in the room.
         */
        UserRecord user;

        @Override
        public EventKind<UserBanned> kind() {
            return EventKind.USER_BANNED;
        }
    }

    @Value
    public static class UserUnbanned implements RoomEvent {
        BannedUser ban;

        @Override
        public EventKind<UserUnbanned> kind() {
            return EventKind.USER_UNBANNED;
        }
    }

    @Value
    public static class BanListReceived implements RoomEvent {
        List<BannedUser> banList;

        @Override
        public EventKind<BanListReceived> kind() {
            return EventKind.BAN_LIST_RECEIVED;
        }
    }

    @Value
    public static class RoomSettingsChanged implements RoomEvent {
        RoomSnapshot room;

        @Override
        public EventKind<RoomSettingsChanged> kind() {
            return EventKind.ROOM_SETTINGS_CHANGED;
        }
    }

    @Value
    public static class SystemMessage implements RoomEvent {
        String text;

        @Override
        public EventKind<SystemMessage> kind() {
            return EventKind.SYSTEM_MESSAGE;
        }
    }

    /**
     * Room asks for a password; answer with {@code RoomClient.sendRoomPassword}.
     */
    @Value
    public static class PasswordRequired implements RoomEvent {
        String room;

        @Override
        public EventKind<PasswordRequired> kind() {
            return EventKind.PASSWORD_REQUIRED;
        }
    }

    /**
     * Room asks for a captcha token; answer with {@code RoomClient.sendCaptcha}.
     */
    @Value
    public static class CaptchaRequired implements RoomEvent {
        String siteKey;

        @Override
        public EventKind<CaptchaRequired> kind() {
            return EventKind.CAPTCHA_REQUIRED;
        }
    }

    /**
     * Answer to a playlist request.
     */
    @Value
    public static class PlaylistReceived implements RoomEvent {
        List<MediaItem> items;

        @Override
        public EventKind<PlaylistReceived> kind() {
            return EventKind.PLAYLIST_RECEIVED;
        }
    }

    @Value
    public static class MediaChanged implements RoomEvent {
        public enum Action { PLAY, PAUSE, STOP }

        Action action;
        /**
         * User who changed the media, null when the server replays the current state.
         */
        UserRecord user;
        MediaItem item;

        @Override
        public EventKind<MediaChanged> kind() {
            return EventKind.MEDIA_CHANGED;
        }
    }

    @Value
    public static class ServerClosed implements RoomEvent {
        int code;
        String description;

        @Override
        public EventKind<ServerClosed> kind() {
            return EventKind.SERVER_CLOSED;
        }
    }

    /**
     * Frame with an opcode this client does not know.
     */
    @Value
    public static class UnknownMessage implements RoomEvent {
        String opcode;
        String raw;

        @Override
        public EventKind<UnknownMessage> kind() {
            return EventKind.UNKNOWN_MESSAGE;
        }
    }

    @Value
    public static class SessionStateChanged implements RoomEvent {
        SessionState from;
        SessionState to;

        @Override
        public EventKind<SessionStateChanged> kind() {
            return EventKind.SESSION_STATE_CHANGED;
        }
    }

    @Value
    public static class SessionClosed implements RoomEvent {
        CloseReason reason;
        /**
         * Failure that ended the cycle, null after a clean close or stop.
         */
        Throwable cause;
        /**
         * Number of the next reconnect attempt for {@link CloseReason#RETRYING}, else the last attempt made.
         */
        int attempt;
        Duration retryIn;

        @Override
        public EventKind<SessionClosed> kind() {
            return EventKind.SESSION_CLOSED;
        }
    }
}
