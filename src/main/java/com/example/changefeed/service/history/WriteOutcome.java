package com.example.changefeed.service.history;

public enum WriteOutcome {
    /** Records were appended. */
    COMMITTED,
    /** The dedup key was already recorded; nothing was written. */
    DUPLICATE,
    /** Every field change was a no-op; nothing was written. */
    NO_CHANGES
}
