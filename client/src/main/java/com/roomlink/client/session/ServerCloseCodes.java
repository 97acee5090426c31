package com.roomlink.client.session;

/**
 * Codes carried by the server's {@code closed} frame.
 */
public final class ServerCloseCodes {
    public static final int CLOSED = 3;
    public static final int BANNED = 4;
    public static final int RECONNECT = 5;
    public static final int DOUBLE_SIGN_IN = 6;
    public static final int TIMEOUT = 8;
    public static final int UNKNOWN = 11;
    public static final int KICKED = 12;

    private ServerCloseCodes() {
    }

    /**
     * Whether the server ended the session for good, so reconnecting would only repeat it.
     */
    public static boolean isTerminal(int code) {
        return code == BANNED || code == DOUBLE_SIGN_IN || code == KICKED;
    }

    public static String describe(int code) {
        return switch (code) {
            case CLOSED -> "closed by server";
            case BANNED -> "banned from the room";
            case RECONNECT -> "server asked to reconnect";
            case DOUBLE_SIGN_IN -> "account signed in elsewhere";
            case TIMEOUT -> "password or captcha not entered in time";
            case UNKNOWN -> "unknown server error";
            case KICKED -> "kicked from the room";
            default -> "close code " + code;
        };
    }
}
