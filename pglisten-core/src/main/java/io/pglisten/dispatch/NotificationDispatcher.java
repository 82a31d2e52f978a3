package io.pglisten.dispatch;

import io.pglisten.ChannelEvent;
import io.pglisten.ChannelRegistration;
import io.pglisten.ListenPolicy;
import io.pglisten.Notification;
import io.pglisten.NotificationTimeout;
import io.pglisten.TimeoutSignal;
import io.pglisten.spi.MetricsExporter;
import io.pglisten.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans a single {@link NotificationStream} out to independently paced channel handlers.
 *
 * <p>{@link #attach} starts one ingestion thread, which routes each notification by exact
 * channel name into that channel's {@link ChannelBuffer}, and one delivery thread per
 * registration, which waits up to the notification timeout for the next buffered item and
 * invokes the handler with it, or with a {@link TimeoutSignal} if the window elapsed empty.
 *
 * <p>Routing never blocks: {@link ListenPolicy#ALL} buffers are unbounded and
 * {@link ListenPolicy#LAST} buffers overwrite. Notifications for unregistered channels are
 * dropped. Handler failures are logged and counted; they never stop a delivery loop.
 *
 * <p>This class is thread-safe. Loops run until {@link #close()}, which marks the
 * dispatcher closed, interrupts all loops and waits up to the drain timeout for them to
 * unwind. An interrupt that does not come from {@code close()}, including one raised or
 * left behind by a handler, never ends a loop. A {@link VirtualMachineError} does.
 */
public final class NotificationDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(NotificationDispatcher.class.getName());

  private final MetricsExporter metrics;
  private final long drainTimeoutMs;

  private ExecutorService workers;
  private volatile Map<String, ChannelBuffer> buffers = Collections.emptyMap();
  private volatile boolean closed;

  /**
   * @param metrics       metrics sink
   * @param drainTimeout  how long {@link #close()} waits for loops to unwind
   */
  public NotificationDispatcher(MetricsExporter metrics, Duration drainTimeout) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(drainTimeout, "drainTimeout");
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
    this.drainTimeoutMs = drainTimeout.toMillis();
  }

  /**
   * Creates one buffer and one delivery loop per registration and starts consuming
   * {@code stream}. May be called once.
   *
   * @param registrations channel registrations; channel names must be unique
   * @param stream        notifications to route
   * @param timeout       per-channel wait window, or {@link NotificationTimeout#NONE}
   * @throws IllegalArgumentException if {@code registrations} is empty or names a channel twice
   * @throws IllegalStateException    if already attached or closed
   */
  public synchronized void attach(List<ChannelRegistration> registrations,
      NotificationStream stream, NotificationTimeout timeout) {
    Objects.requireNonNull(registrations, "registrations");
    Objects.requireNonNull(stream, "stream");
    Objects.requireNonNull(timeout, "timeout");
    if (closed) {
      throw new IllegalStateException("NotificationDispatcher has been closed");
    }
    if (workers != null) {
      throw new IllegalStateException("NotificationDispatcher is already attached");
    }
    if (registrations.isEmpty()) {
      throw new IllegalArgumentException("registrations must not be empty");
    }

    Map<String, ChannelBuffer> table = new LinkedHashMap<>();
    for (ChannelRegistration registration : registrations) {
      Objects.requireNonNull(registration, "registration");
      ChannelBuffer buffer = registration.policy() == ListenPolicy.LAST
          ? new LatestChannelBuffer() : new FifoChannelBuffer();
      if (table.putIfAbsent(registration.channel(), buffer) != null) {
        throw new IllegalArgumentException("Duplicate registration for channel: " + registration.channel());
      }
    }
    this.buffers = Collections.unmodifiableMap(table);

    workers = Executors.newFixedThreadPool(registrations.size() + 1,
        new DaemonThreadFactory("pglisten-dispatch-"));
    workers.execute(() -> ingestionLoop(stream));
    for (ChannelRegistration registration : registrations) {
      ChannelBuffer buffer = buffers.get(registration.channel());
      workers.execute(() -> deliveryLoop(registration, buffer, timeout));
    }
  }

  private void ingestionLoop(NotificationStream stream) {
    while (!closed) {
      try {
        route(stream.take());
      } catch (InterruptedException e) {
        logger.fine("Ingestion loop interrupted; closed=" + closed);
      } catch (VirtualMachineError e) {
        throw e;
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Ingestion loop error", t);
      }
    }
  }

  private void route(Notification notification) {
    ChannelBuffer buffer = buffers.get(notification.channel());
    if (buffer == null) {
      metrics.incrementUnroutable();
      logger.fine("No registration for channel " + notification.channel() + "; notification dropped");
      return;
    }
    if (buffer.offer(notification)) {
      metrics.incrementOverwritten();
    }
  }

  private void deliveryLoop(ChannelRegistration registration, ChannelBuffer buffer,
      NotificationTimeout timeout) {
    String channel = registration.channel();
    while (!closed) {
      try {
        ChannelEvent event = nextEvent(channel, buffer, timeout);
        deliver(registration, event);
      } catch (InterruptedException e) {
        logger.fine("Delivery loop on channel " + channel + " interrupted; closed=" + closed);
      } catch (VirtualMachineError e) {
        throw e;
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Delivery loop error on channel " + channel, t);
      }
    }
  }

  private static ChannelEvent nextEvent(String channel, ChannelBuffer buffer,
      NotificationTimeout timeout) throws InterruptedException {
    if (!timeout.isBounded()) {
      return buffer.take();
    }
    Notification notification = buffer.poll(timeout.window().toNanos(), TimeUnit.NANOSECONDS);
    return notification != null ? notification : new TimeoutSignal(channel);
  }

  private void deliver(ChannelRegistration registration, ChannelEvent event) {
    if (event instanceof Notification) {
      metrics.incrementDelivered();
    } else {
      metrics.incrementTimeouts();
    }
    try {
      registration.handler().onEvent(event);
    } catch (VirtualMachineError e) {
      throw e;
    } catch (Throwable t) {
      if (closed && t instanceof InterruptedException) {
        return;
      }
      metrics.incrementHandlerFailures();
      logger.log(Level.WARNING, "Handler for channel " + registration.channel()
          + " failed on " + event, t);
    }
    // A handler may leave the interrupt flag set; it must not end or disturb the loop.
    if (!closed && Thread.interrupted()) {
      logger.fine("Cleared interrupt left by handler for channel " + registration.channel());
    }
  }

  /**
   * @param channel a registered channel
   * @return number of notifications waiting for the channel's handler, or {@code -1} if
   *     the channel is not registered
   */
  public int pending(String channel) {
    ChannelBuffer buffer = buffers.get(channel);
    return buffer == null ? -1 : buffer.size();
  }

  /**
   * Interrupts the ingestion and delivery loops and waits for them to unwind.
   * Pending notifications are discarded. Idempotent.
   */
  @Override
  public void close() {
    ExecutorService toStop;
    synchronized (this) {
      if (closed) {
        return;
      }
      toStop = workers;
      closed = true;
    }
    if (toStop == null) {
      return;
    }
    toStop.shutdownNow();
    try {
      if (!toStop.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.warning("Drain timeout exceeded; some channel handlers are still running");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
