package com.example.changefeed.client;

public enum StreamState {
    IDLE,
    CONNECTING,
    OPEN,
    BACKOFF,
    STOPPED
}
