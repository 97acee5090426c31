package com.roomlink.core.msg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.roomlink.core.error.DecodeException;
import com.roomlink.core.error.EncodingException;
import com.roomlink.core.util.BytesUtils;
import com.roomlink.core.util.JsonUtils;
import com.roomlink.core.util.Nicks;
import reactor.core.publisher.Mono;

/**
 * Single place where the wire format lives.
 * <p>
 * Frames are JSON text objects: {@code {"tc": <opcode>, "req": <n>, ...payload}}.
 * The codec holds only immutable limits, so one instance can encode outbound commands
 * while the receive loop decodes inbound frames.
 * </p>
 */
public class MessageCodec {
    public static final int DEFAULT_MAX_FRAME_BYTES = 64 * 1024;
    public static final int DEFAULT_MAX_TEXT_LENGTH = 4000;

    static final String OPCODE_FIELD = "tc";
    static final String REQ_FIELD = "req";

    private final int maxFrameBytes;
    private final int maxTextLength;

    public MessageCodec() {
        this(DEFAULT_MAX_FRAME_BYTES, DEFAULT_MAX_TEXT_LENGTH);
    }

    public MessageCodec(int maxFrameBytes, int maxTextLength) {
        this.maxFrameBytes = maxFrameBytes;
        this.maxTextLength = maxTextLength;
    }

    /**
     * Encodes an outbound command.
     *
     * @param message command to encode
     * @return JSON text frame
     * @throws EncodingException if the command is not encodable or a field is missing or malformed
     */
    public String encode(Message message) {
        Opcode opcode = message.getOpcode();
        if (opcode == null || !opcode.isCommand()) {
            throw new EncodingException("Opcode " + opcode + " is not an outbound command");
        }
        validate(message);

        ObjectNode root = JsonUtils.newObject();
        root.put(OPCODE_FIELD, opcode.wireName());
        if (message.getReq() != Message.NO_REQ) {
            root.put(REQ_FIELD, message.getReq());
        }
        root.setAll(message.getPayload());

        String frame = JsonUtils.writeValueAsString(root);
        int size = BytesUtils.utf8Length(frame);
        if (size > maxFrameBytes) {
            throw new EncodingException(
                    "Encoded " + opcode.wireName() + " is " + size + " bytes, limit is " + maxFrameBytes);
        }
        return frame;
    }

    /**
     * Decodes an inbound frame. Never throws: malformed frames become an error signal,
     * unrecognised opcodes become {@link Opcode#UNKNOWN} messages that keep the {@code tc} field.
     *
     * @param frame raw text frame
     * @return Mono of the decoded message, or {@link DecodeException} error
     */
    public Mono<Message> decode(String frame) {
        return Mono.fromCallable(() -> decodeFrame(frame));
    }

    private Message decodeFrame(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new DecodeException("Empty frame");
        }
        JsonNode tree;
        try {
            tree = JsonUtils.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Frame is not valid JSON: " + abbreviate(frame), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new DecodeException("Frame is not a JSON object: " + abbreviate(frame));
        }
        JsonNode tc = tree.get(OPCODE_FIELD);
        if (tc == null || !tc.isTextual()) {
            throw new DecodeException("Frame has no '" + OPCODE_FIELD + "' discriminator: " + abbreviate(frame));
        }

        Opcode opcode = Opcode.fromWire(tc.asText());
        ObjectNode payload = ((ObjectNode) tree).deepCopy();
        if (opcode != Opcode.UNKNOWN) {
            payload.remove(OPCODE_FIELD);
        }
        JsonNode reqNode = payload.remove(REQ_FIELD);
        int req = reqNode != null && reqNode.canConvertToInt() ? reqNode.asInt() : Message.NO_REQ;

        return new Message(opcode, req, payload, frame);
    }

    private void validate(Message message) {
        Opcode opcode = message.getOpcode();
        for (String field : opcode.requiredFields()) {
            if (!message.has(field)) {
                throw new EncodingException(opcode.wireName() + " requires field '" + field + "'");
            }
            JsonNode node = message.node(field);
            if (node.isTextual() && node.asText().isBlank()) {
                throw new EncodingException(opcode.wireName() + " field '" + field + "' must not be blank");
            }
        }

        switch (opcode) {
            case LOGIN -> {
                requireNick(message);
                if (message.has("username") && isBlank(message.text("password"))) {
                    throw new EncodingException("login with an account requires a password");
                }
            }
            case NICK -> requireNick(message);
            case MSG -> requireText(message);
            case PVTMSG -> {
                requireText(message);
                requireNonNegativeInt(message, "handle");
            }
            case KICK, BAN, STREAM_MODER_ALLOW, STREAM_MODER_CLOSE -> requireNonNegativeInt(message, "handle");
            case UNBAN -> requireNonNegativeInt(message, "id");
            case YUT_PLAY, YUT_PAUSE, YUT_STOP, YUT_PLAYLIST_ADD, YUT_PLAYLIST_REMOVE -> requireMediaItem(message);
            case YUT_PLAYLIST_MODE -> requirePlaylistMode(message);
            default -> {
                // no extra constraints
            }
        }
    }

    private static void requireNick(Message message) {
        String nick = message.text("nick");
        if (!Nicks.isValid(nick)) {
            throw new EncodingException("Invalid nick '" + nick + "': 1-" + Nicks.MAX_LENGTH
                    + " characters without whitespace");
        }
    }

    private void requireText(Message message) {
        String text = message.text("text");
        if (isBlank(text)) {
            throw new EncodingException(message.getOpcode().wireName() + " text must not be empty");
        }
        if (text.length() > maxTextLength) {
            throw new EncodingException("Text is " + text.length() + " characters, limit is " + maxTextLength);
        }
    }

    private static void requireNonNegativeInt(Message message, String field) {
        JsonNode node = message.node(field);
        if (node == null || !node.isIntegralNumber() || !node.canConvertToInt() || node.asInt() < 0) {
            throw new EncodingException(message.getOpcode().wireName() + " field '" + field
                    + "' must be a non-negative integer, got " + node);
        }
    }

    private static void requireMediaItem(Message message) {
        JsonNode item = message.node("item");
        if (!item.isObject()) {
            throw new EncodingException(message.getOpcode().wireName() + " item must be an object");
        }
        JsonNode id = item.get("id");
        if (id == null || !id.isTextual() || id.asText().isBlank()) {
            throw new EncodingException(message.getOpcode().wireName() + " item requires a video id");
        }
        JsonNode duration = item.get("duration");
        if (duration == null || !duration.isNumber() || duration.asDouble() < 0) {
            throw new EncodingException(message.getOpcode().wireName() + " item requires a non-negative duration");
        }
        JsonNode offset = item.get("offset");
        if (offset != null && offset.asDouble() < 0) {
            throw new EncodingException(message.getOpcode().wireName() + " offset must not be negative");
        }
    }

    private static void requirePlaylistMode(Message message) {
        JsonNode mode = message.node("mode");
        if (!mode.isObject() || !mode.path("random").isBoolean() || !mode.path("repeat").isBoolean()) {
            throw new EncodingException("yut_playlist_mode requires boolean 'random' and 'repeat' flags");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String abbreviate(String frame) {
        return frame.length() <= 120 ? frame : frame.substring(0, 120) + "...";
    }
}
