package io.pglisten.connect;

import io.pglisten.ConnectionState;
import io.pglisten.Notification;
import io.pglisten.SubscribeException;
import io.pglisten.spi.MetricsExporter;
import io.pglisten.spi.NotificationConnection;
import io.pglisten.spi.NotificationConnectionFactory;
import io.pglisten.spi.NotificationSink;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the single notification connection of a run and turns it into an endless stream
 * of {@link Notification}s.
 *
 * <p>{@link #run} connects, subscribes to every channel, then pulls notifications into a
 * {@link NotificationSink} until the calling thread is interrupted. A lost connection is
 * closed and re-established after a {@link ReconnectPolicy} delay, resubscribing to exactly
 * the same channel set; there is no retry ceiling. A {@link SubscribeException} ends the
 * run instead.
 *
 * <p>State is written only by the thread executing {@link #run}; {@link #state()} may be
 * read from any thread.
 *
 * @see ConnectionState
 */
public final class NotificationConnector {
    private static final Logger logger = Logger.getLogger(NotificationConnector.class.getName());

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

    private final NotificationConnectionFactory connectionFactory;
    private final ReconnectPolicy reconnectPolicy;
    private final Duration pollInterval;
    private final MetricsExporter metrics;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    /**
     * @param connectionFactory source of fresh connections
     * @param reconnectPolicy   delay between connection attempts
     * @param pollInterval      upper bound on a single receive wait; bounds cancellation latency
     * @param metrics           metrics sink
     */
    public NotificationConnector(NotificationConnectionFactory connectionFactory,
                                 ReconnectPolicy reconnectPolicy,
                                 Duration pollInterval,
                                 MetricsExporter metrics) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
    }

    /**
     * Listens on {@code channels} until the calling thread is interrupted.
     *
     * <p>Never returns normally.
     *
     * @param channels the channels to subscribe to; fixed for the whole run
     * @param sink     receives every decoded notification, in arrival order
     * @throws InterruptedException if the calling thread is interrupted (cancellation)
     * @throws SubscribeException   if a channel is invalid or rejected by the server
     */
    public void run(Collection<String> channels, NotificationSink sink)
            throws InterruptedException, SubscribeException {
        Objects.requireNonNull(sink, "sink");
        List<String> subscription = new ArrayList<>(new LinkedHashSet<>(
                Objects.requireNonNull(channels, "channels")));
        if (subscription.isEmpty()) {
            throw new IllegalArgumentException("channels must not be empty");
        }
        for (String channel : subscription) {
            connectionFactory.validateChannel(channel);
        }

        int failedAttempts = 0;
        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Connector cancelled");
            }
            Exception failure = null;
            NotificationConnection connection = null;
            try {
                transition(ConnectionState.CONNECTING);
                connection = connectionFactory.connect();
                for (String channel : subscription) {
                    connection.listen(channel);
                }
                transition(ConnectionState.LISTENING);
                logger.info("Listening on channels " + subscription);
                failedAttempts = 0;
                receive(connection, sink);
            } catch (SQLException | RuntimeException e) {
                failure = e;
            } finally {
                if (connection != null) {
                    connection.close();
                }
                transition(ConnectionState.DISCONNECTED);
            }

            failedAttempts++;
            long delayMs = reconnectPolicy.computeDelayMs(failedAttempts);
            metrics.incrementReconnects();
            logger.log(Level.WARNING, "Connection was lost or not established; reconnecting in "
                    + delayMs + " ms (attempt " + failedAttempts + ")", failure);
            TimeUnit.MILLISECONDS.sleep(delayMs);
        }
    }

    private void receive(NotificationConnection connection, NotificationSink sink)
            throws SQLException, InterruptedException {
        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Connector cancelled");
            }
            for (Notification notification : connection.receive(pollInterval)) {
                metrics.incrementReceived();
                sink.accept(notification);
            }
        }
    }

    private void transition(ConnectionState next) {
        if (state != next) {
            state = next;
            metrics.recordConnectionState(next);
        }
    }

    /**
     * @return the current connection state
     */
    public ConnectionState state() {
        return state;
    }
}
