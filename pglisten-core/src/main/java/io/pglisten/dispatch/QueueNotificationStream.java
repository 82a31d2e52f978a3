package io.pglisten.dispatch;

import io.pglisten.Notification;
import io.pglisten.spi.NotificationSink;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded hand-off between the connector (writer) and the dispatcher's ingestion loop
 * (reader). Accepting never blocks, so a slow consumer can never stall the connection.
 */
public final class QueueNotificationStream implements NotificationSink, NotificationStream {
    private final BlockingQueue<Notification> queue = new LinkedBlockingQueue<>();

    @Override
    public void accept(Notification notification) {
        queue.add(Objects.requireNonNull(notification, "notification"));
    }

    @Override
    public Notification take() throws InterruptedException {
        return queue.take();
    }

    public int size() {
        return queue.size();
    }
}
