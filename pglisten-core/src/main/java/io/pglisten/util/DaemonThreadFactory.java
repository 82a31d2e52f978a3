package io.pglisten.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the listener's worker threads: daemon threads named {@code <prefix>1},
 * {@code <prefix>2}, and so on.
 *
 * <p>Daemon status keeps a forgotten {@link io.pglisten.ListenerRun} from holding the JVM
 * open. Anything escaping a worker's loop is logged before the thread dies.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread worker = new Thread(task, prefix + sequence.getAndIncrement());
        worker.setDaemon(true);
        worker.setUncaughtExceptionHandler((t, e) ->
                logger.log(Level.SEVERE, "Uncaught error on " + t.getName(), e));
        return worker;
    }
}
