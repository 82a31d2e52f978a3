package io.pglisten;

/**
 * Thrown when the server rejects a channel subscription for a reason that retrying
 * cannot fix, such as an invalid channel name.
 *
 * <p>The connector does not reconnect after this failure; the whole run terminates and
 * {@link ListenerRun#await()} rethrows it.
 */
public final class SubscribeException extends Exception {

    private final String channel;

    public SubscribeException(String channel, String message) {
        super(message);
        this.channel = channel;
    }

    public SubscribeException(String channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    /**
     * @return the channel whose subscription failed, or {@code null} if not channel-specific
     */
    public String channel() {
        return channel;
    }
}
