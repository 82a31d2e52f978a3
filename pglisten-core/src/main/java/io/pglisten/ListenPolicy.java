package io.pglisten;

/**
 * Per-channel buffering discipline between the connection and the channel's handler.
 */
public enum ListenPolicy {
    /** Every notification is delivered, in arrival order. Nothing is dropped. */
    ALL,
    /** Only the newest pending notification is kept; older undelivered ones are overwritten. */
    LAST
}
