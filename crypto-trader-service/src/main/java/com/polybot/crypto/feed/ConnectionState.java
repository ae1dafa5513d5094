package com.polybot.crypto.feed;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    BACKOFF
}
