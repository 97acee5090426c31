package com.roomlink.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Immutable view of one user in the room roster, keyed by {@link #handle}.
 * <p>
 * Updates produce a new record via the {@code with*} methods, so records handed to event
 * handlers never change underneath them.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class UserRecord {
    /**
     * Server-assigned id, unique within the room for the session's lifetime.
     */
    int handle;

    String nick;

    /**
     * Account name, null for guests.
     */
    String account;

    UserRole role;

    boolean lurker;

    /**
     * True while the user has an active audio/video stream.
     */
    boolean broadcasting;

    /**
     * True while the user waits for broadcast approval in a green room.
     */
    boolean waiting;

    Instant joinTime;

    /**
     * Record with defaulted fields for a handle the roster does not know yet.
     */
    public static UserRecord placeholder(int handle, String nick, Instant now) {
        return UserRecord.builder()
                .handle(handle)
                .nick(nick == null ? "" : nick)
                .role(UserRole.DEFAULT)
                .joinTime(now)
                .build();
    }

    /**
     * Builds a record from a user object as sent in {@code join}, {@code userlist} and {@code joined}.
     */
    public static UserRecord fromWire(JsonNode node, Instant now) {
        String account = node.path("username").asText("");
        return UserRecord.builder()
                .handle(node.path("handle").asInt(-1))
                .nick(node.path("nick").asText(""))
                .account(account.isEmpty() ? null : account)
                .role(UserRole.of(node.path("mod").asBoolean(false), node.path("owner").asBoolean(false)))
                .lurker(node.path("lurker").asBoolean(false))
                .joinTime(now)
                .build();
    }

    public boolean isGuest() {
        return account == null;
    }
}
