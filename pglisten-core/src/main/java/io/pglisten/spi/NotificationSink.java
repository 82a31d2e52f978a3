package io.pglisten.spi;

import io.pglisten.Notification;

/**
 * Receives notifications decoded by the connector, in arrival order.
 */
@FunctionalInterface
public interface NotificationSink {

    void accept(Notification notification) throws InterruptedException;
}
