package io.pglisten;

import java.time.Instant;
import java.util.Objects;

/**
 * A single {@code NOTIFY} received on a subscribed channel.
 *
 * @param channel    channel name exactly as reported by the server
 * @param payload    notification payload; empty when the sender supplied none
 * @param receivedAt instant at which the notification was decoded off the connection
 */
public record Notification(String channel, String payload, Instant receivedAt) implements ChannelEvent {

    public Notification {
        Objects.requireNonNull(channel, "channel");
        payload = payload == null ? "" : payload;
        Objects.requireNonNull(receivedAt, "receivedAt");
    }

    /**
     * Creates a notification stamped with the current instant.
     */
    public static Notification of(String channel, String payload) {
        return new Notification(channel, payload, Instant.now());
    }
}
