package io.pglisten.spi;

import io.pglisten.ConnectionState;

/**
 * Observability hook for exporting listener counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of notifications decoded off the connection.
     */
    void incrementReceived();

    /**
     * Increments the count of notifications dropped because no handler is registered
     * for their channel.
     */
    void incrementUnroutable();

    /**
     * Increments the count of notifications handed to a handler.
     */
    void incrementDelivered();

    /**
     * Increments the count of pending notifications replaced under {@code LAST}.
     */
    void incrementOverwritten();

    /**
     * Increments the count of timeout signals delivered.
     */
    void incrementTimeouts();

    /**
     * Increments the count of handler invocations that threw.
     */
    void incrementHandlerFailures();

    /**
     * Increments the count of reconnect attempts after a lost or failed connection.
     */
    void incrementReconnects();

    /**
     * Records a connection state transition.
     *
     * @param state the new state
     */
    default void recordConnectionState(ConnectionState state) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementReceived() {
        }

        @Override
        public void incrementUnroutable() {
        }

        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementOverwritten() {
        }

        @Override
        public void incrementTimeouts() {
        }

        @Override
        public void incrementHandlerFailures() {
        }

        @Override
        public void incrementReconnects() {
        }
    }
}
