package com.roomlink.client.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.roomlink.core.util.JsonUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal room server: accepts any login, answers {@code join} with {@code joined} and a
 * {@code userlist} containing the own user plus any preset users.
 */
public class RoomServerScript implements TestTransport.Responder {
    private final int selfHandle;
    private final boolean moderator;
    private final List<ObjectNode> others = new ArrayList<>();
    private volatile String loginFailure;
    private volatile String loggedInNick = "";

    public RoomServerScript(int selfHandle, boolean moderator) {
        this.selfHandle = selfHandle;
        this.moderator = moderator;
    }

    public RoomServerScript withUser(int handle, String nick) {
        others.add(user(handle, nick, false));
        return this;
    }

    /**
     * Rejects every login with the given {@code login_failed} reason.
     */
    public RoomServerScript rejectLogin(String reason) {
        this.loginFailure = reason;
        return this;
    }

    @Override
    public void onClientFrame(TestTransport transport, JsonNode frame) {
        switch (frame.path("tc").asText()) {
            case "login" -> {
                loggedInNick = frame.path("nick").asText();
                if (loginFailure != null) {
                    transport.serverSends(frame("login_failed").put("reason", loginFailure).toString());
                    return;
                }
                ObjectNode ok = frame("login_ok")
                        .put("handle", selfHandle)
                        .put("nick", frame.path("nick").asText())
                        .put("mod", moderator)
                        .put("owner", false);
                transport.serverSends(ok.toString());
            }
            case "join" -> {
                String nick = loggedInNick;
                ObjectNode joined = frame("joined");
                joined.set("self", user(selfHandle, nick, moderator));
                joined.set("room", JsonUtils.newObject()
                        .put("name", frame.path("room").asText())
                        .put("greenroom", false));
                transport.serverSends(joined.toString());

                ObjectNode userList = frame("userlist");
                ArrayNode users = userList.putArray("users");
                users.add(user(selfHandle, nick, moderator));
                others.forEach(users::add);
                transport.serverSends(userList.toString());
            }
            default -> {
                // other commands get no reply
            }
        }
    }

    public static ObjectNode frame(String tc) {
        return JsonUtils.newObject().put("tc", tc);
    }

    public static ObjectNode user(int handle, String nick, boolean moderator) {
        return JsonUtils.newObject()
                .put("handle", handle)
                .put("nick", nick)
                .put("username", "")
                .put("mod", moderator)
                .put("owner", false);
    }
}
