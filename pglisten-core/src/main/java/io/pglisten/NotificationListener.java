package io.pglisten;

import io.pglisten.connect.ExponentialBackoffReconnectPolicy;
import io.pglisten.connect.NotificationConnector;
import io.pglisten.connect.ReconnectPolicy;
import io.pglisten.dispatch.NotificationDispatcher;
import io.pglisten.dispatch.QueueNotificationStream;
import io.pglisten.spi.MetricsExporter;
import io.pglisten.spi.NotificationConnectionFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point that wires a {@link NotificationConnector} and a {@link NotificationDispatcher}
 * into a single cancellable run.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * NotificationListener listener = NotificationListener.builder()
 *     .connectionFactory(new DataSourceConnectionFactory(dataSource))
 *     .build();
 *
 * try (ListenerRun run = listener.run(
 *     Map.of("orders", event -> refreshOrders(event)),
 *     ListenPolicy.LAST,
 *     NotificationTimeout.of(Duration.ofSeconds(30)))) {
 *   run.await();
 * }
 * }</pre>
 *
 * <p>A listener is a reusable, immutable configuration; every call to {@code run} starts an
 * independent pipeline with its own connection.
 *
 * @see ListenerRun
 * @see NotificationListener.Builder
 */
public final class NotificationListener {

  /** Timeout used by {@link #run(Map)}. */
  public static final NotificationTimeout DEFAULT_NOTIFICATION_TIMEOUT =
      NotificationTimeout.of(Duration.ofSeconds(30));

  private final NotificationConnectionFactory connectionFactory;
  private final ReconnectPolicy reconnectPolicy;
  private final Duration pollInterval;
  private final Duration shutdownTimeout;
  private final MetricsExporter metrics;

  private NotificationListener(Builder builder) {
    this.connectionFactory = Objects.requireNonNull(builder.connectionFactory, "connectionFactory");
    this.reconnectPolicy = builder.reconnectPolicy != null
        ? builder.reconnectPolicy : new ExponentialBackoffReconnectPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.pollInterval = Objects.requireNonNull(builder.pollInterval, "pollInterval");
    this.shutdownTimeout = Objects.requireNonNull(builder.shutdownTimeout, "shutdownTimeout");
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must be > 0");
    }
    if (shutdownTimeout.isNegative()) {
      throw new IllegalArgumentException("shutdownTimeout must be >= 0");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts listening with {@link ListenPolicy#ALL} and a 30 second notification timeout.
   *
   * @see #run(Map, ListenPolicy, NotificationTimeout)
   */
  public ListenerRun run(Map<String, ChannelHandler> handlers) {
    return run(handlers, ListenPolicy.ALL, DEFAULT_NOTIFICATION_TIMEOUT);
  }

  /**
   * Starts listening on every channel in {@code handlers}, all with the same policy.
   *
   * @param handlers handler per channel name
   * @param policy   buffering policy applied to every channel
   * @param timeout  notification window, or {@link NotificationTimeout#NONE}
   * @return the handle of the running pipeline
   */
  public ListenerRun run(Map<String, ChannelHandler> handlers, ListenPolicy policy,
      NotificationTimeout timeout) {
    Objects.requireNonNull(handlers, "handlers");
    Objects.requireNonNull(policy, "policy");
    List<ChannelRegistration> registrations = new ArrayList<>(handlers.size());
    for (Map.Entry<String, ChannelHandler> entry : handlers.entrySet()) {
      registrations.add(new ChannelRegistration(entry.getKey(), entry.getValue(), policy));
    }
    return run(registrations, timeout);
  }

  /**
   * Starts listening with a policy chosen per channel.
   *
   * <p>The returned handle completes only when it is cancelled or when a subscription fails
   * fatally. Transient connection failures are retried indefinitely and never surface here.
   *
   * @param registrations one registration per channel
   * @param timeout       notification window, or {@link NotificationTimeout#NONE}
   * @return the handle of the running pipeline
   * @throws IllegalArgumentException if {@code registrations} is empty or names a channel twice
   */
  public ListenerRun run(List<ChannelRegistration> registrations, NotificationTimeout timeout) {
    Objects.requireNonNull(registrations, "registrations");
    Objects.requireNonNull(timeout, "timeout");
    if (registrations.isEmpty()) {
      throw new IllegalArgumentException("At least one channel registration is required");
    }
    Set<String> channels = new LinkedHashSet<>();
    for (ChannelRegistration registration : registrations) {
      if (!channels.add(registration.channel())) {
        throw new IllegalArgumentException("Duplicate registration for channel: " + registration.channel());
      }
    }

    QueueNotificationStream stream = new QueueNotificationStream();
    NotificationDispatcher dispatcher = new NotificationDispatcher(metrics, shutdownTimeout);
    NotificationConnector connector = new NotificationConnector(
        connectionFactory, reconnectPolicy, pollInterval, metrics);

    dispatcher.attach(List.copyOf(registrations), stream, timeout);
    return ListenerRun.start(connector, dispatcher, List.copyOf(channels), stream, shutdownTimeout);
  }

  /** Builder for {@link NotificationListener}. */
  public static final class Builder {
    private NotificationConnectionFactory connectionFactory;
    private ReconnectPolicy reconnectPolicy;
    private MetricsExporter metrics;
    private Duration pollInterval = NotificationConnector.DEFAULT_POLL_INTERVAL;
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    private Builder() {}

    /**
     * Sets the factory that opens dedicated notification connections.
     *
     * <p><b>Required.</b>
     *
     * @param connectionFactory the connection factory
     * @return this builder
     */
    public Builder connectionFactory(NotificationConnectionFactory connectionFactory) {
      this.connectionFactory = connectionFactory;
      return this;
    }

    /**
     * Sets the delay strategy between reconnect attempts.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffReconnectPolicy} with
     * {@code baseDelayMs=1000} and {@code maxDelayMs=5000}.
     *
     * @param reconnectPolicy the reconnect policy
     * @return this builder
     */
    public Builder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
      this.reconnectPolicy = reconnectPolicy;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the longest single wait on the connection. Cancellation is noticed at
     * least this often.
     *
     * <p>Optional. Defaults to 500 ms. Must be &gt; 0.
     *
     * @param pollInterval receive wait bound
     * @return this builder
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /**
     * Sets how long cancellation waits for handlers to return.
     *
     * <p>Optional. Defaults to 5 s.
     *
     * @param shutdownTimeout shutdown wait bound
     * @return this builder
     */
    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    /**
     * @return a new listener
     * @throws NullPointerException     if {@code connectionFactory} is null
     * @throws IllegalArgumentException if {@code pollInterval <= 0} or {@code shutdownTimeout < 0}
     */
    public NotificationListener build() {
      return new NotificationListener(this);
    }
  }
}
