package io.pglisten.dispatch;

import io.pglisten.Notification;

/**
 * Ordered source of notifications consumed by the dispatcher's ingestion loop.
 */
@FunctionalInterface
public interface NotificationStream {

    /**
     * Blocks until the next notification is available.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    Notification take() throws InterruptedException;
}
