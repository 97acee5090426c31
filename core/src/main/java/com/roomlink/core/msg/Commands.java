package com.roomlink.core.msg;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.roomlink.core.util.JsonUtils;

/**
 * Factories for every outbound command.
 * <p>
 * Factories only shape the payload; {@link MessageCodec#encode(Message)} validates it.
 * The request counter is assigned by the session at send time.
 * </p>
 */
public final class Commands {
    private Commands() {
    }

    /**
     * Guest login, or account login when {@code account} is non-null.
     */
    public static Message login(String token, String nick, String account, String password) {
        ObjectNode payload = JsonUtils.newObject();
        payload.put("token", token);
        payload.put("nick", nick);
        if (account != null) {
            payload.put("username", account);
            payload.put("password", password);
        }
        return Message.of(Opcode.LOGIN, payload);
    }

    public static Message join(String room, String userAgent) {
        ObjectNode payload = JsonUtils.newObject();
        payload.put("room", room);
        if (userAgent != null) {
            payload.put("useragent", userAgent);
        }
        return Message.of(Opcode.JOIN, payload);
    }

    public static Message pong() {
        return Message.of(Opcode.PONG);
    }

    public static Message nick(String nick) {
        ObjectNode payload = JsonUtils.newObject();
        payload.put("nick", nick);
        return Message.of(Opcode.NICK, payload);
    }

    public static Message chat(String text) {
        ObjectNode payload = JsonUtils.newObject();
        payload.put("text", text);
        return Message.of(Opcode.MSG, payload);
    }

    public static Message privateMessage(String text, int handle) {
        ObjectNode payload = JsonUtils.newObject();
        payload.put("text", text);
        payload.put("handle", handle);
        return Message.of(Opcode.PVTMSG, payload);
    }

    public static Message kick(int handle) {
        return handleCommand(Opcode.KICK, handle);
    }

    public static Message ban(int handle) {
        return handleCommand(Opcode.BAN, handle);
    }

    public static Message unban(int banId) {
        ObjectNode payload = JsonUtils.newObject();
        payload.put("id", banId);
        return Message.of(Opcode.UNBAN, payload);
    }

    public static Message banList() {
        return Message.of(Opcode.BANLIST);
    }

    public static Message roomPassword(String password) {
        ObjectNode payload = JsonUtils.newObject();
        payload.put("password", password);
        return Message.of(Opcode.PASSWORD, payload);
    }

    public static Message captcha(String token) {
        ObjectNode payload = JsonUtils.newObject();
        payload.put("token", token);
        return Message.of(Opcode.CAPTCHA, payload);
    }

    public static Message allowBroadcast(int handle) {
        return handleCommand(Opcode.STREAM_MODER_ALLOW, handle);
    }

    public static Message closeBroadcast(int handle) {
        return handleCommand(Opcode.STREAM_MODER_CLOSE, handle);
    }

    /**
     * Starts a video, or seeks when {@code offset} is non-zero (a seek carries no title).
     */
    public static Message mediaPlay(String videoId, double duration, String title, double offset) {
        ObjectNode item = mediaItem(videoId, duration, offset);
        if (offset == 0) {
            item.put("title", title);
        } else {
            item.put("playlist", false);
            item.put("seek", true);
        }
        return media(Opcode.YUT_PLAY, item);
    }

    public static Message mediaPause(String videoId, double duration, double offset) {
        return media(Opcode.YUT_PAUSE, mediaItem(videoId, duration, offset));
    }

    public static Message mediaStop(String videoId, double duration, double offset) {
        return media(Opcode.YUT_STOP, mediaItem(videoId, duration, offset));
    }

    public static Message playlist() {
        return Message.of(Opcode.YUT_PLAYLIST);
    }

    public static Message playlistAdd(String videoId, double duration, String title, String image) {
        return media(Opcode.YUT_PLAYLIST_ADD, playlistItem(videoId, duration, title, image));
    }

    public static Message playlistRemove(String videoId, double duration, String title, String image) {
        return media(Opcode.YUT_PLAYLIST_REMOVE, playlistItem(videoId, duration, title, image));
    }

    public static Message playlistMode(boolean random, boolean repeat) {
        ObjectNode mode = JsonUtils.newObject();
        mode.put("random", random);
        mode.put("repeat", repeat);
        ObjectNode payload = JsonUtils.newObject();
        payload.set("mode", mode);
        return Message.of(Opcode.YUT_PLAYLIST_MODE, payload);
    }

    private static Message handleCommand(Opcode opcode, int handle) {
        ObjectNode payload = JsonUtils.newObject();
        payload.put("handle", handle);
        return Message.of(opcode, payload);
    }

    private static ObjectNode mediaItem(String videoId, double duration, double offset) {
        ObjectNode item = JsonUtils.newObject();
        item.put("id", videoId);
        item.put("duration", duration);
        item.put("offset", offset);
        return item;
    }

    private static ObjectNode playlistItem(String videoId, double duration, String title, String image) {
        ObjectNode item = JsonUtils.newObject();
        item.put("id", videoId);
        item.put("duration", duration);
        item.put("title", title);
        item.put("image", image);
        return item;
    }

    private static Message media(Opcode opcode, ObjectNode item) {
        ObjectNode payload = JsonUtils.newObject();
        payload.set("item", item);
        return Message.of(opcode, payload);
    }
}
