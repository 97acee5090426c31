package com.roomlink.client.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.roomlink.core.model.BannedUser;
import com.roomlink.core.model.RoomSnapshot;
import com.roomlink.core.model.UserRecord;
import com.roomlink.core.msg.Message;
import com.roomlink.core.msg.Opcode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Local view of one joined room.
 * <p>
 * Written only by the session's inbound path. Every {@link #apply} publishes a fresh immutable
 * {@link RoomSnapshot}, which is what other threads read.
 * </p>
 * <p>
 * Mutations referencing a handle that is not in the roster insert a placeholder record first and
 * log a warning; removals for absent handles do nothing.
 * </p>
 */
public class RoomState {
    private static final Logger log = LoggerFactory.getLogger(RoomState.class);

    private final String name;
    private final Clock clock;

    private final Map<Integer, UserRecord> users = new LinkedHashMap<>();
    private final Map<Integer, BannedUser> banList = new LinkedHashMap<>();
    private final Map<String, String> metadata = new LinkedHashMap<>();
    private Integer selfHandle;
    private boolean greenRoom;
    private boolean passwordProtected;
    private boolean captchaEnabled;

    private volatile RoomSnapshot snapshot;

    public RoomState(String name, Clock clock) {
        this.name = name;
        this.clock = clock;
        this.snapshot = buildSnapshot();
    }

    /**
     * Applies one inbound message. Kinds that do not touch room state are no-ops.
     */
    public RoomUpdate apply(Message message) {
        RoomUpdate update = switch (message.getOpcode()) {
            case JOINED -> onJoined(message);
            case USERLIST -> onUserList(message);
            case JOIN -> onJoin(message);
            case QUIT, KICK -> remove(message.intValue("handle", -1));
            case NICK -> {
                String nick = message.text("nick");
                yield nick == null ? RoomUpdate.none() : mutate(message, u -> u.withNick(nick));
            }
            case PUBLISH -> mutate(message, u -> u.withBroadcasting(true).withWaiting(false));
            case UNPUBLISH -> mutateExisting(message.intValue("handle", -1), u -> u.withBroadcasting(false));
            case PENDING_MODERATION -> {
                greenRoom = true;
                yield mutate(message, u -> u.withWaiting(true));
            }
            case STREAM_MODER_ALLOW -> message.flag("success")
                    ? mutate(message, u -> u.withWaiting(false))
                    : RoomUpdate.none();
            case STREAM_MODER_CLOSE -> message.flag("success")
                    ? mutateExisting(message.intValue("handle", -1), u -> u.withBroadcasting(false).withWaiting(false))
                    : RoomUpdate.none();
            case BAN -> onBan(message);
            case UNBAN -> onUnban(message);
            case BANLIST -> onBanList(message);
            case ROOM_SETTINGS -> {
                readRoomInfo(message.getPayload());
                yield RoomUpdate.room();
            }
            case SYSMSG -> onSystemMessage(message.text("text"));
            case PASSWORD -> {
                passwordProtected = true;
                yield RoomUpdate.room();
            }
            case CAPTCHA -> {
                captchaEnabled = true;
                yield RoomUpdate.room();
            }
            default -> RoomUpdate.none();
        };
        if (update.changed()) {
            snapshot = buildSnapshot();
        }
        return update;
    }

    public RoomSnapshot snapshot() {
        return snapshot;
    }

    public Optional<UserRecord> user(int handle) {
        return snapshot.user(handle);
    }

    public Optional<UserRecord> self() {
        return snapshot.self();
    }

    /**
     * True when the own user holds a role that may moderate.
     */
    public boolean selfCanModerate() {
        return self().map(u -> u.getRole().canModerate()).orElse(false);
    }

    public String getName() {
        return name;
    }

    private RoomUpdate onJoined(Message message) {
        JsonNode room = message.node("room");
        if (room != null && room.isObject()) {
            readRoomInfo(room);
        }
        JsonNode self = message.node("self");
        if (self == null || !self.isObject()) {
            log.warn("joined without a self record in room {}", name);
            return RoomUpdate.room();
        }
        UserRecord record = UserRecord.fromWire(self, clock.instant());
        selfHandle = record.getHandle();
        UserRecord before = users.put(record.getHandle(), record);
        return RoomUpdate.user(before, record);
    }

    private RoomUpdate onUserList(Message message) {
        JsonNode list = message.node("users");
        if (list == null || !list.isArray()) {
            return RoomUpdate.none();
        }
        for (JsonNode node : list) {
            UserRecord record = UserRecord.fromWire(node, clock.instant());
            if (record.getHandle() < 0) {
                log.warn("Skipping userlist entry without handle in room {}", name);
                continue;
            }
            users.put(record.getHandle(), record);
        }
        return RoomUpdate.room();
    }

    private RoomUpdate onJoin(Message message) {
        UserRecord record = UserRecord.fromWire(message.getPayload(), clock.instant());
        if (record.getHandle() < 0) {
            log.warn("join without handle in room {}", name);
            return RoomUpdate.none();
        }
        // a rejoin replaces the old record and moves it to the end of the roster
        UserRecord before = users.remove(record.getHandle());
        users.put(record.getHandle(), record);
        return RoomUpdate.user(before, record);
    }

    private RoomUpdate remove(int handle) {
        UserRecord removed = users.remove(handle);
        if (removed == null) {
            return RoomUpdate.none();
        }
        return RoomUpdate.user(removed, null);
    }

    private RoomUpdate mutate(Message message, UnaryOperator<UserRecord> change) {
        int handle = message.intValue("handle", -1);
        if (handle < 0) {
            log.warn("{} without handle in room {}", message.getOpcode(), name);
            return RoomUpdate.none();
        }
        UserRecord before = users.get(handle);
        UserRecord base = before;
        if (base == null) {
            log.warn("{} for unknown handle {} in room {}, inserting placeholder", message.getOpcode(), handle, name);
            base = UserRecord.placeholder(handle, message.text("nick"), clock.instant());
        }
        UserRecord after = change.apply(base);
        users.put(handle, after);
        return RoomUpdate.user(before, after);
    }

    private RoomUpdate mutateExisting(int handle, UnaryOperator<UserRecord> change) {
        UserRecord before = users.get(handle);
        if (before == null) {
            return RoomUpdate.none();
        }
        UserRecord after = change.apply(before);
        users.put(handle, after);
        return RoomUpdate.user(before, after);
    }

    private RoomUpdate onBan(Message message) {
        if (!message.flag("success")) {
            return RoomUpdate.none();
        }
        BannedUser banned = BannedUser.fromWire(message.getPayload());
        if (banned.getBanId() >= 0) {
            banList.put(banned.getBanId(), banned);
        }
        UserRecord removed = message.has("handle") ? users.remove(message.intValue("handle", -1)) : null;
        return RoomUpdate.ban(banned, removed);
    }

    private RoomUpdate onUnban(Message message) {
        if (!message.flag("success")) {
            return RoomUpdate.none();
        }
        int banId = message.intValue("id", -1);
        BannedUser removed = banList.remove(banId);
        return RoomUpdate.ban(removed != null ? removed : BannedUser.fromWire(message.getPayload()), null);
    }

    private RoomUpdate onBanList(Message message) {
        banList.clear();
        JsonNode items = message.node("items");
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                BannedUser banned = BannedUser.fromWire(item);
                banList.put(banned.getBanId(), banned);
            }
        }
        return RoomUpdate.room();
    }

    private RoomUpdate onSystemMessage(String text) {
        if (text == null) {
            return RoomUpdate.none();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("banned") && selfCanModerate()) {
            // stale until the next banlist reply
            banList.clear();
            return RoomUpdate.room();
        }
        if (lower.contains("green room enabled")) {
            greenRoom = true;
            return RoomUpdate.room();
        }
        if (lower.contains("green room disabled")) {
            greenRoom = false;
            return RoomUpdate.room();
        }
        return RoomUpdate.none();
    }

    private void readRoomInfo(JsonNode room) {
        Iterator<Map.Entry<String, JsonNode>> fields = room.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isValueNode()) {
                metadata.put(field.getKey(), value.asText());
            }
        }
        if (room.has("greenroom")) {
            greenRoom = room.get("greenroom").asBoolean(greenRoom);
        }
        if (room.has("password_protected")) {
            passwordProtected = room.get("password_protected").asBoolean(passwordProtected);
        }
    }

    private RoomSnapshot buildSnapshot() {
        return RoomSnapshot.builder()
                .name(name)
                .users(Collections.unmodifiableMap(new LinkedHashMap<>(users)))
                .selfHandle(selfHandle)
                .greenRoom(greenRoom)
                .passwordProtected(passwordProtected)
                .captchaEnabled(captchaEnabled)
                .metadata(Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
                .banList(List.copyOf(banList.values()))
                .build();
    }
}
