package io.pglisten;

/**
 * Callback invoked for every event delivered on a channel.
 *
 * <p>Invocations for one channel are sequential and happen on that channel's delivery
 * thread. A handler may block or perform I/O; this only delays its own channel.
 * Exceptions are logged and do not stop delivery.
 */
@FunctionalInterface
public interface ChannelHandler {

    void onEvent(ChannelEvent event) throws Exception;
}
