package com.roomlink.client.session;

/**
 * Lifecycle of a room session.
 */
public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    AUTHENTICATING,
    JOINING_ROOM,
    JOINED,
    DISCONNECTING
}
