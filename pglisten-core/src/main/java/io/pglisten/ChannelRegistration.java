package io.pglisten;

import java.util.Objects;

/**
 * Binds a channel to its handler and buffering policy for the lifetime of a run.
 *
 * @param channel channel name, matched exactly against incoming notifications
 * @param handler callback for the channel's events
 * @param policy  buffering discipline
 */
public record ChannelRegistration(String channel, ChannelHandler handler, ListenPolicy policy) {

    public ChannelRegistration {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(policy, "policy");
        if (channel.isEmpty()) {
            throw new IllegalArgumentException("channel must not be empty");
        }
    }

    public static ChannelRegistration all(String channel, ChannelHandler handler) {
        return new ChannelRegistration(channel, handler, ListenPolicy.ALL);
    }

    public static ChannelRegistration last(String channel, ChannelHandler handler) {
        return new ChannelRegistration(channel, handler, ListenPolicy.LAST);
    }
}
