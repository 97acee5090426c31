package com.roomlink.core.msg;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Protocol opcodes, carried in the {@code tc} field of every frame.
 * <p>
 * Opcodes marked as commands may be encoded by the client; several of them are symmetric
 * (the server echoes them back with extra fields, e.g. {@code nick} with the handle).
 * Server-only opcodes are decode-only.
 * </p>
 */
public enum Opcode {
    // commands (client -> server, some also server -> client)
    LOGIN("login", true, "token", "nick"),
    JOIN("join", true, "room"),
    PONG("pong", true),
    NICK("nick", true, "nick"),
    MSG("msg", true, "text"),
    PVTMSG("pvtmsg", true, "text", "handle"),
    KICK("kick", true, "handle"),
    BAN("ban", true, "handle"),
    UNBAN("unban", true, "id"),
    BANLIST("banlist", true),
    PASSWORD("password", true, "password"),
    CAPTCHA("captcha", true, "token"),
    STREAM_MODER_ALLOW("stream_moder_allow", true, "handle"),
    STREAM_MODER_CLOSE("stream_moder_close", true, "handle"),
    YUT_PLAY("yut_play", true, "item"),
    YUT_PAUSE("yut_pause", true, "item"),
    YUT_STOP("yut_stop", true, "item"),
    /**
     * Playlist request; the server answers with the same opcode carrying the items.
     */
    YUT_PLAYLIST("yut_playlist", true),
    YUT_PLAYLIST_ADD("yut_playlist_add", true, "item"),
    YUT_PLAYLIST_REMOVE("yut_playlist_remove", true, "item"),
    YUT_PLAYLIST_MODE("yut_playlist_mode", true, "mode"),

    // server -> client only
    PING("ping", false),
    LOGIN_OK("login_ok", false),
    LOGIN_FAILED("login_failed", false),
    RATE_LIMITED("rate_limited", false),
    JOINED("joined", false),
    USERLIST("userlist", false),
    QUIT("quit", false),
    PUBLISH("publish", false),
    UNPUBLISH("unpublish", false),
    PENDING_MODERATION("pending_moderation", false),
    SYSMSG("sysmsg", false),
    ROOM_SETTINGS("room_settings", false),
    CLOSED("closed", false),

    /**
     * Any {@code tc} value this client does not know. The message keeps the raw frame.
     */
    UNKNOWN("", false);

    private static final Map<String, Opcode> BY_WIRE_NAME = Arrays.stream(values())
            .filter(op -> op != UNKNOWN)
            .collect(Collectors.toUnmodifiableMap(Opcode::wireName, Function.identity()));

    private final String wireName;
    private final boolean command;
    private final List<String> requiredFields;

    Opcode(String wireName, boolean command, String... requiredFields) {
        this.wireName = wireName;
        this.command = command;
        this.requiredFields = List.of(requiredFields);
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return true when the client is allowed to encode this opcode
     */
    public boolean isCommand() {
        return command;
    }

    /**
     * Payload fields an outbound command must carry.
     */
    public List<String> requiredFields() {
        return requiredFields;
    }

    public static Opcode fromWire(String wireName) {
        return wireName == null ? UNKNOWN : BY_WIRE_NAME.getOrDefault(wireName, UNKNOWN);
    }
}
