package io.pglisten.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.pglisten.ConnectionState;
import io.pglisten.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code pglisten.notifications.received}: decoded off the connection</li>
 *   <li>{@code pglisten.notifications.unroutable}: dropped, no handler for the channel</li>
 *   <li>{@code pglisten.notifications.delivered}: handed to a handler</li>
 *   <li>{@code pglisten.notifications.overwritten}: replaced while pending ({@code LAST} policy)</li>
 *   <li>{@code pglisten.timeouts}: timeout signals delivered</li>
 *   <li>{@code pglisten.handler.failures}: handler invocations that threw</li>
 *   <li>{@code pglisten.reconnects}: reconnect attempts scheduled</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code pglisten.connection.state}: {@link ConnectionState} ordinal
 *       (0 disconnected, 1 connecting, 2 listening)</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    public static final String DEFAULT_NAME_PREFIX = "pglisten";

    private final MeterRegistry registry;
    private final Counter received;
    private final Counter unroutable;
    private final Counter delivered;
    private final Counter overwritten;
    private final Counter timeouts;
    private final Counter handlerFailures;
    private final Counter reconnects;
    private final Gauge stateGauge;

    private final AtomicInteger state = new AtomicInteger(ConnectionState.DISCONNECTED.ordinal());
    private volatile boolean closed;

    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_NAME_PREFIX);
    }

    /**
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names, e.g. {@code "billing.pglisten"} when
     *                   several listeners share a registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.received = counter(namePrefix + ".notifications.received", "Notifications received from the server");
        this.unroutable = counter(namePrefix + ".notifications.unroutable", "Notifications with no registered channel");
        this.delivered = counter(namePrefix + ".notifications.delivered", "Notifications handed to a handler");
        this.overwritten = counter(namePrefix + ".notifications.overwritten", "Pending notifications replaced by newer ones");
        this.timeouts = counter(namePrefix + ".timeouts", "Timeout signals delivered");
        this.handlerFailures = counter(namePrefix + ".handler.failures", "Handler invocations that threw");
        this.reconnects = counter(namePrefix + ".reconnects", "Reconnect attempts");
        this.stateGauge = Gauge.builder(namePrefix + ".connection.state", state, AtomicInteger::get)
                .description("Connection state (0=disconnected, 1=connecting, 2=listening)")
                .register(registry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    @Override
    public void incrementReceived() {
        if (closed) return;
        received.increment();
    }

    @Override
    public void incrementUnroutable() {
        if (closed) return;
        unroutable.increment();
    }

    @Override
    public void incrementDelivered() {
        if (closed) return;
        delivered.increment();
    }

    @Override
    public void incrementOverwritten() {
        if (closed) return;
        overwritten.increment();
    }

    @Override
    public void incrementTimeouts() {
        if (closed) return;
        timeouts.increment();
    }

    @Override
    public void incrementHandlerFailures() {
        if (closed) return;
        handlerFailures.increment();
    }

    @Override
    public void incrementReconnects() {
        if (closed) return;
        reconnects.increment();
    }

    @Override
    public void recordConnectionState(ConnectionState connectionState) {
        if (closed) return;
        state.set(connectionState.ordinal());
    }

    /**
     * Removes this exporter's meters from the registry so a stopped listener leaves no
     * stale gauge behind.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(received, unroutable, delivered, overwritten,
                timeouts, handlerFailures, reconnects, stateGauge)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
