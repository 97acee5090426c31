package com.roomlink.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * Entry of the room ban list.
 */
@Value
@Builder
public class BannedUser {
    int banId;
    String nick;
    String account;
    String bannedBy;

    public static BannedUser fromWire(JsonNode node) {
        String account = node.path("username").asText("");
        String bannedBy = node.path("moderator").asText("");
        return BannedUser.builder()
                .banId(node.path("id").asInt(-1))
                .nick(node.path("nick").asText(""))
                .account(account.isEmpty() ? null : account)
                .bannedBy(bannedBy.isEmpty() ? null : bannedBy)
                .build();
    }
}
