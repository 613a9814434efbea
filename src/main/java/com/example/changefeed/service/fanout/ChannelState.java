package com.example.changefeed.service.fanout;

public enum ChannelState {
    CONNECTING,
    OPEN,
    CLOSED_NORMAL,
    CLOSED_ERROR;

    public boolean isClosed() {
        return this == CLOSED_NORMAL || this == CLOSED_ERROR;
    }
}
