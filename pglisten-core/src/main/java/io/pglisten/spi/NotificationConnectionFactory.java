package io.pglisten.spi;

import io.pglisten.SubscribeException;

import java.sql.SQLException;

/**
 * Opens dedicated connections for receiving notifications.
 *
 * <p>Each call must return a fresh connection: the connector closes a connection after
 * it is lost and asks for a new one before resubscribing. The PostgreSQL implementation is
 * {@code io.pglisten.jdbc.DataSourceConnectionFactory} in the {@code pglisten-jdbc} module.
 */
public interface NotificationConnectionFactory {

    /**
     * Opens a new connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException       if the connection cannot be established (retried)
     * @throws SubscribeException if the configured target can never serve notifications (fatal)
     */
    NotificationConnection connect() throws SQLException, SubscribeException;

    /**
     * Checks a channel name before any connection is opened.
     *
     * <p>The default accepts every name. Transports override this to reject names the
     * server would refuse or silently alter.
     *
     * @param channel the channel name
     * @throws SubscribeException if the name can never be subscribed
     */
    default void validateChannel(String channel) throws SubscribeException {
    }
}
