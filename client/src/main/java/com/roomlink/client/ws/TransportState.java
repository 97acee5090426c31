package com.roomlink.client.ws;

/**
 * Lifecycle of one transport connection.
 */
public enum TransportState {
    IDLE,
    CONNECTING,
    OPEN,
    CLOSING,
    /**
     * Ended with a close handshake, or closed by this client.
     */
    CLOSED,
    /**
     * Ended abnormally: I/O error, dropped connection or keepalive timeout.
     */
    FAILED;

    public boolean isTerminal() {
        return this == IDLE || this == CLOSED || this == FAILED;
    }
}
