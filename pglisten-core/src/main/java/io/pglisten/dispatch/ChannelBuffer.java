package io.pglisten.dispatch;

import io.pglisten.Notification;

import java.util.concurrent.TimeUnit;

/**
 * Per-channel buffer between the ingestion loop (sole writer) and the channel's delivery
 * loop (sole reader).
 *
 * @see FifoChannelBuffer
 * @see LatestChannelBuffer
 */
interface ChannelBuffer {

    /**
     * Adds a notification without blocking.
     *
     * @return {@code true} if a pending notification was discarded to make room
     */
    boolean offer(Notification notification);

    /**
     * Waits up to the given time for the next notification.
     *
     * @return the notification, or {@code null} if none arrived in time
     */
    Notification poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Waits indefinitely for the next notification.
     */
    Notification take() throws InterruptedException;

    /**
     * @return number of pending notifications
     */
    int size();
}
