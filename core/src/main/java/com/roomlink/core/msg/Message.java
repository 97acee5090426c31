package com.roomlink.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.roomlink.core.util.JsonUtils;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.With;

/**
 * One wire unit: an opcode, the per-connection request counter and an ordered set of payload fields.
 * <p>
 * Produced by {@link MessageCodec#decode(String)} and consumed immediately by the session; never retained.
 * The payload is copied on construction and must be treated as read-only.
 * </p>
 */
@Value
public class Message {
    /**
     * Value of {@link #req} when the frame carries no {@code req} field.
     */
    public static final int NO_REQ = -1;

    Opcode opcode;

    @With
    int req;

    ObjectNode payload;

    /**
     * Original frame text, kept for {@link Opcode#UNKNOWN} messages and diagnostics.
     */
    @EqualsAndHashCode.Exclude
    String raw;

    public Message(Opcode opcode, int req, ObjectNode payload, String raw) {
        this.opcode = opcode;
        this.req = req;
        this.payload = payload == null ? JsonUtils.newObject() : payload.deepCopy();
        this.raw = raw;
    }

    public static Message of(Opcode opcode, ObjectNode payload) {
        return new Message(opcode, NO_REQ, payload, null);
    }

    public static Message of(Opcode opcode) {
        return new Message(opcode, NO_REQ, null, null);
    }

    public boolean has(String field) {
        JsonNode node = payload.get(field);
        return node != null && !node.isNull();
    }

    public JsonNode node(String field) {
        return payload.get(field);
    }

    /**
     * @return the field as text, or null when absent or JSON null
     */
    public String text(String field) {
        return has(field) ? payload.get(field).asText() : null;
    }

    public int intValue(String field, int defaultValue) {
        JsonNode node = payload.get(field);
        return node != null && node.canConvertToInt() ? node.asInt() : defaultValue;
    }

    public boolean flag(String field) {
        JsonNode node = payload.get(field);
        return node != null && node.asBoolean(false);
    }
}
