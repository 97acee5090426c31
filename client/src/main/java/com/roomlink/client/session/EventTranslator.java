package com.roomlink.client.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.roomlink.client.event.RoomEvent;
import com.roomlink.client.event.RoomEvents;
import com.roomlink.client.event.RoomEvents.MediaChanged;
import com.roomlink.client.state.RoomState;
import com.roomlink.client.state.RoomUpdate;
import com.roomlink.core.model.MediaItem;
import com.roomlink.core.model.UserRecord;
import com.roomlink.core.msg.Message;
import com.roomlink.core.util.JsonUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns an applied message into the events handlers see.
 * <p>
 * Runs after {@link RoomState#apply}, so the state passed in already reflects the message.
 * </p>
 */
public class EventTranslator {
    private final Clock clock;

    public EventTranslator(Clock clock) {
        this.clock = clock;
    }

    public List<RoomEvent> translate(Message message, RoomUpdate update, RoomState state) {
        return switch (message.getOpcode()) {
            case JOIN -> update.after() == null ? List.of() : List.of(new RoomEvents.UserJoined(update.after()));
            case QUIT -> update.before() == null ? List.of() : List.of(new RoomEvents.UserLeft(update.before()));
            case KICK -> update.before() == null ? List.of() : List.of(new RoomEvents.UserKicked(update.before()));
            case NICK -> update.after() == null ? List.of() : List.of(new RoomEvents.NickChanged(update.after(),
                    update.before() == null ? "" : update.before().getNick()));
            case MSG -> List.of(new RoomEvents.ChatReceived(sender(message, state), message.text("text")));
            case PVTMSG -> List.of(new RoomEvents.PrivateMessageReceived(sender(message, state), message.text("text")));
            case PUBLISH -> update.after() == null ? List.of() : List.of(new RoomEvents.BroadcastStarted(update.after()));
            case UNPUBLISH -> update.after() == null ? List.of() : List.of(new RoomEvents.BroadcastStopped(update.after()));
            case PENDING_MODERATION -> update.after() == null ? List.of()
                    : List.of(new RoomEvents.BroadcastPending(update.after()));
            case STREAM_MODER_ALLOW -> update.after() == null ? List.of()
                    : List.of(new RoomEvents.BroadcastApproved(update.after()));
            case STREAM_MODER_CLOSE -> update.after() == null ? List.of()
                    : List.of(new RoomEvents.BroadcastClosed(update.after()));
            case BAN -> update.banned() == null ? List.of()
                    : List.of(new RoomEvents.UserBanned(update.banned(), update.before()));
            case UNBAN -> update.banned() == null ? List.of() : List.of(new RoomEvents.UserUnbanned(update.banned()));
            case BANLIST -> List.of(new RoomEvents.BanListReceived(state.snapshot().getBanList()));
            case ROOM_SETTINGS -> List.of(new RoomEvents.RoomSettingsChanged(state.snapshot()));
            case SYSMSG -> message.has("text") ? List.of(new RoomEvents.SystemMessage(message.text("text"))) : List.of();
            case PASSWORD -> List.of(new RoomEvents.PasswordRequired(state.getName()));
            case CAPTCHA -> List.of(new RoomEvents.CaptchaRequired(message.text("key")));
            case YUT_PLAY -> List.of(media(MediaChanged.Action.PLAY, message, state));
            case YUT_PAUSE -> List.of(media(MediaChanged.Action.PAUSE, message, state));
            case YUT_STOP -> List.of(media(MediaChanged.Action.STOP, message, state));
            case YUT_PLAYLIST -> List.of(new RoomEvents.PlaylistReceived(playlist(message)));
            case CLOSED -> {
                int code = message.intValue("error", -1);
                yield List.of(new RoomEvents.ServerClosed(code, ServerCloseCodes.describe(code)));
            }
            case UNKNOWN -> List.of(new RoomEvents.UnknownMessage(message.text("tc"), message.getRaw()));
            default -> List.of();
        };
    }

    private UserRecord sender(Message message, RoomState state) {
        int handle = message.intValue("handle", -1);
        return state.user(handle)
                .orElseGet(() -> UserRecord.placeholder(handle, message.text("nick"), clock.instant()));
    }

    private static List<MediaItem> playlist(Message message) {
        List<MediaItem> items = new ArrayList<>();
        for (JsonNode item : message.getPayload().path("items")) {
            items.add(MediaItem.fromWire(item, true));
        }
        return items;
    }

    private MediaChanged media(MediaChanged.Action action, Message message, RoomState state) {
        boolean response = !message.has("handle");
        UserRecord user = response ? null : sender(message, state);
        JsonNode item = message.has("item") ? message.node("item") : JsonUtils.newObject();
        return new MediaChanged(action, user, MediaItem.fromWire(item, response));
    }
}
