package io.pglisten.spi;

import io.pglisten.Notification;
import io.pglisten.SubscribeException;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * A live connection able to subscribe to channels and receive their notifications.
 *
 * <p>Instances are confined to the connector thread, except {@link #close()} which
 * may be called from any thread.
 */
public interface NotificationConnection extends AutoCloseable {

    /**
     * Subscribes to {@code channel}.
     *
     * @throws SQLException       if the connection failed while subscribing (retried)
     * @throws SubscribeException if the server rejected the channel (fatal)
     */
    void listen(String channel) throws SQLException, SubscribeException;

    /**
     * Waits up to {@code maxWait} for notifications.
     *
     * @param maxWait upper bound on the wait
     * @return notifications in arrival order; empty if none arrived in time
     * @throws SQLException if the connection was lost
     */
    List<Notification> receive(Duration maxWait) throws SQLException;

    /**
     * Releases the connection. Idempotent; never throws.
     */
    @Override
    void close();
}
