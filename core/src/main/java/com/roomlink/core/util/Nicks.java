package com.roomlink.core.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Nick helpers shared by the codec and the client facade.
 */
public final class Nicks {
    private Nicks() {
    }

    public static final int MAX_LENGTH = 32;

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    /**
     * Random nick of {@code minLength..maxLength} lowercase letters and digits,
     * used when a client is created without a nick.
     */
    public static String random(int minLength, int maxLength) {
        if (minLength > maxLength) {
            throw new IllegalArgumentException(
                    "minLength(" + minLength + ") cannot be > maxLength(" + maxLength + ")");
        }
        ThreadLocalRandom random = ThreadLocalRandom.current();
        int length = minLength == maxLength ? minLength : random.nextInt(minLength, maxLength + 1);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    /**
     * @return true when the nick is non-empty, at most {@value #MAX_LENGTH} chars and has no whitespace
     */
    public static boolean isValid(String nick) {
        if (nick == null || nick.isEmpty() || nick.length() > MAX_LENGTH) {
            return false;
        }
        for (int i = 0; i < nick.length(); i++) {
            if (Character.isWhitespace(nick.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
