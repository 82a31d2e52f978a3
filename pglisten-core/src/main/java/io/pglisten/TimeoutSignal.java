package io.pglisten;

import java.util.Objects;

/**
 * Delivered when no notification arrived on {@code channel} within one notification window.
 *
 * <p>Signals repeat once per elapsed window while the channel stays silent, so a steady
 * stream of them doubles as a liveness indicator during outages.
 *
 * @param channel the silent channel
 */
public record TimeoutSignal(String channel) implements ChannelEvent {

    public TimeoutSignal {
        Objects.requireNonNull(channel, "channel");
    }
}
