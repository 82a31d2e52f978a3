package io.pglisten;

import io.pglisten.connect.NotificationConnector;
import io.pglisten.dispatch.NotificationDispatcher;
import io.pglisten.spi.NotificationSink;
import io.pglisten.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handle of a running listener pipeline, returned by {@link NotificationListener#run}.
 *
 * <p>The run ends in exactly one of two ways:
 * <ul>
 *   <li>{@link #cancel()} (or {@link #close()}): the connector, the ingestion loop and all
 *       delivery loops are stopped together; {@link #await()} returns normally.
 *   <li>a fatal subscription failure: the pipeline tears itself down and {@link #await()}
 *       throws the {@link SubscribeException}.
 * </ul>
 *
 * <p>Do not cancel a run from inside one of its own handlers: cancellation waits for
 * the handlers to return.
 */
public final class ListenerRun implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ListenerRun.class.getName());

  private final NotificationConnector connector;
  private final NotificationDispatcher dispatcher;
  private final ExecutorService connectorThread;
  private final long shutdownTimeoutMs;
  private final CompletableFuture<Void> completion = new CompletableFuture<>();
  private final AtomicBoolean stopping = new AtomicBoolean(false);

  private ListenerRun(NotificationConnector connector, NotificationDispatcher dispatcher,
      Duration shutdownTimeout) {
    this.connector = connector;
    this.dispatcher = dispatcher;
    this.shutdownTimeoutMs = shutdownTimeout.toMillis();
    this.connectorThread = Executors.newSingleThreadExecutor(
        new DaemonThreadFactory("pglisten-connector-"));
  }

  static ListenerRun start(NotificationConnector connector, NotificationDispatcher dispatcher,
      List<String> channels, NotificationSink sink, Duration shutdownTimeout) {
    ListenerRun run = new ListenerRun(connector, dispatcher, shutdownTimeout);
    run.connectorThread.execute(() -> run.runConnector(channels, sink));
    return run;
  }

  private void runConnector(List<String> channels, NotificationSink sink) {
    try {
      connector.run(channels, sink);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (SubscribeException | RuntimeException e) {
      logger.log(Level.SEVERE, "Listener stopped: subscription to " + channels + " failed", e);
      fail(e);
    }
  }

  private void fail(Exception failure) {
    if (!stopping.compareAndSet(false, true)) {
      return;
    }
    dispatcher.close();
    connectorThread.shutdown();
    completion.completeExceptionally(failure);
  }

  /**
   * Cancels the whole run and waits until every task has unwound. Idempotent; a no-op
   * after a fatal failure.
   */
  public void cancel() {
    if (!stopping.compareAndSet(false, true)) {
      awaitQuietly();
      return;
    }
    connectorThread.shutdownNow();
    dispatcher.close();
    try {
      if (!connectorThread.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.warning("Connector did not stop within " + shutdownTimeoutMs + " ms");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    completion.complete(null);
    logger.info("Listener cancelled");
  }

  private void awaitQuietly() {
    try {
      completion.get(shutdownTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException | TimeoutException | CancellationException e) {
      logger.log(Level.FINE, "Listener already stopping", e);
    }
  }

  /**
   * Equivalent to {@link #cancel()}.
   */
  @Override
  public void close() {
    cancel();
  }

  /**
   * Blocks until the run ends.
   *
   * @throws SubscribeException   if the run ended because a subscription failed
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public void await() throws SubscribeException, InterruptedException {
    try {
      completion.get();
    } catch (ExecutionException e) {
      throw unwrap(e);
    }
  }

  /**
   * Blocks until the run ends or {@code timeout} elapses.
   *
   * @return {@code true} if the run ended, {@code false} on timeout
   * @throws SubscribeException   if the run ended because a subscription failed
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean await(Duration timeout) throws SubscribeException, InterruptedException {
    try {
      completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (ExecutionException e) {
      throw unwrap(e);
    }
  }

  private static SubscribeException unwrap(ExecutionException e) {
    Throwable cause = e.getCause();
    if (cause instanceof SubscribeException se) {
      return se;
    }
    if (cause instanceof RuntimeException re) {
      throw re;
    }
    if (cause instanceof Error err) {
      throw err;
    }
    throw new IllegalStateException("Listener failed", cause);
  }

  /**
   * @return a stage that completes when the run ends: normally after cancellation, or
   *     exceptionally with the fatal failure
   */
  public CompletionStage<Void> completion() {
    return completion.minimalCompletionStage();
  }

  public boolean isDone() {
    return completion.isDone();
  }

  /**
   * @return the connector's current connection state
   */
  public ConnectionState connectionState() {
    return connector.state();
  }
}
