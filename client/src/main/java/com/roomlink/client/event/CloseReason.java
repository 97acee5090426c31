package com.roomlink.client.event;

/**
 * Why a connection cycle ended.
 */
public enum CloseReason {
    /**
     * {@code stop()} was called.
     */
    STOPPED,
    /**
     * Connection lost, a reconnect is scheduled.
     */
    RETRYING,
    /**
     * Session failed for good: reconnect budget exhausted, login rejected or terminal server close.
     */
    GAVE_UP
}
