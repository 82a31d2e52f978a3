package io.pglisten;

import io.pglisten.spi.NotificationConnection;
import io.pglisten.spi.NotificationConnectionFactory;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * In-memory notification server for tests.
 *
 * <p>{@link #push} behaves like {@code NOTIFY}: it reaches the current connection only if that
 * connection listens on the channel, and is lost while no connection is open.
 * {@link #dropConnection()} makes the current connection fail on its next receive.
 */
public class StubConnectionFactory implements NotificationConnectionFactory {
    public final AtomicInteger connectCount = new AtomicInteger();
    public final AtomicInteger openConnections = new AtomicInteger();
    public final AtomicInteger maxOpenConnections = new AtomicInteger();
    public final AtomicInteger failNextConnects = new AtomicInteger();
    public final List<List<String>> subscriptions = new CopyOnWriteArrayList<>();
    public final Set<String> rejectedChannels = ConcurrentHashMap.newKeySet();
    public final Set<String> invalidChannels = ConcurrentHashMap.newKeySet();

    private volatile StubConnection current;

    @Override
    public NotificationConnection connect() throws SQLException {
        connectCount.incrementAndGet();
        if (failNextConnects.get() > 0 && failNextConnects.getAndDecrement() > 0) {
            throw new SQLTransientConnectionException("connection refused");
        }
        StubConnection connection = new StubConnection();
        maxOpenConnections.accumulateAndGet(openConnections.incrementAndGet(), Math::max);
        current = connection;
        return connection;
    }

    @Override
    public void validateChannel(String channel) throws SubscribeException {
        if (invalidChannels.contains(channel)) {
            throw new SubscribeException(channel, "invalid channel name: " + channel);
        }
    }

    /**
     * Sends a notification to the current connection if it listens on {@code channel}.
     *
     * @return {@code true} if the notification reached a connection
     */
    public boolean push(String channel, String payload) {
        StubConnection connection = current;
        if (connection == null || connection.closed || !connection.listened.contains(channel)) {
            return false;
        }
        connection.inbox.add(Notification.of(channel, payload));
        return true;
    }

    /**
     * Sends a notification to the current connection regardless of its subscriptions.
     */
    public void pushUnsolicited(String channel, String payload) {
        StubConnection connection = current;
        if (connection != null) {
            connection.inbox.add(Notification.of(channel, payload));
        }
    }

    public void dropConnection() {
        StubConnection connection = current;
        if (connection != null) {
            connection.broken = true;
        }
    }

    public static void await(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + timeout);
            }
            Thread.sleep(10);
        }
    }

    final class StubConnection implements NotificationConnection {
        final BlockingQueue<Notification> inbox = new LinkedBlockingQueue<>();
        final Set<String> listened = ConcurrentHashMap.newKeySet();
        final List<String> listenOrder = new CopyOnWriteArrayList<>();
        volatile boolean broken;
        volatile boolean closed;

        @Override
        public void listen(String channel) throws SQLException, SubscribeException {
            checkOpen();
            if (rejectedChannels.contains(channel)) {
                throw new SubscribeException(channel, "rejected by server: " + channel);
            }
            listened.add(channel);
            listenOrder.add(channel);
            if (listenOrder.size() == 1) {
                subscriptions.add(listenOrder);
            }
        }

        @Override
        public List<Notification> receive(Duration maxWait) throws SQLException {
            checkOpen();
            List<Notification> batch = new ArrayList<>();
            try {
                Notification first = inbox.poll(maxWait.toMillis(), TimeUnit.MILLISECONDS);
                if (first == null) {
                    checkOpen();
                    return batch;
                }
                batch.add(first);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return batch;
            }
            inbox.drainTo(batch);
            return batch;
        }

        private void checkOpen() throws SQLException {
            if (broken || closed) {
                throw new SQLException("An I/O error occurred while sending to the backend.", "08006");
            }
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                openConnections.decrementAndGet();
                if (current == this) {
                    current = null;
                }
            }
        }
    }
}
