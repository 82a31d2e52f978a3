package io.pglisten;

/**
 * Value handed to a {@link ChannelHandler}: either a {@link Notification} received from
 * the server, or a {@link TimeoutSignal} synthesized when a channel stayed silent for a
 * whole notification window.
 *
 * <p>Handlers typically branch with {@code instanceof}:
 * <pre>{@code
 * ChannelHandler handler = event -> {
 *   if (event instanceof Notification n) {
 *     refresh(n.payload());
 *   } else {
 *     heartbeat(event.channel());
 *   }
 * };
 * }</pre>
 */
public sealed interface ChannelEvent permits Notification, TimeoutSignal {

    /**
     * @return the channel this event belongs to
     */
    String channel();
}
