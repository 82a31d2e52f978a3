package io.pglisten.spring.boot;

import io.pglisten.Notification;
import io.pglisten.spi.NotificationConnection;
import io.pglisten.spi.NotificationConnectionFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connection factory that serves notifications pushed from the test thread.
 */
class InMemoryConnectionFactory implements NotificationConnectionFactory {

    final Set<String> subscribed = ConcurrentHashMap.newKeySet();
    final AtomicInteger open = new AtomicInteger();
    private final LinkedBlockingQueue<Notification> inbox = new LinkedBlockingQueue<>();

    void push(String channel, String payload) {
        if (subscribed.contains(channel)) {
            inbox.add(Notification.of(channel, payload));
        }
    }

    @Override
    public NotificationConnection connect() {
        open.incrementAndGet();
        return new NotificationConnection() {
            private boolean closed;

            @Override
            public void listen(String channel) {
                subscribed.add(channel);
            }

            @Override
            public List<Notification> receive(Duration maxWait) throws SQLException {
                try {
                    Notification next = inbox.poll(maxWait.toMillis(), TimeUnit.MILLISECONDS);
                    return next == null ? List.of() : List.of(next);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return List.of();
                }
            }

            @Override
            public synchronized void close() {
                if (!closed) {
                    closed = true;
                    subscribed.clear();
                    open.decrementAndGet();
                }
            }
        };
    }
}
