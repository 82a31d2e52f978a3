package io.pglisten.spring.boot;

import io.pglisten.ChannelRegistration;
import io.pglisten.ConnectionState;
import io.pglisten.ListenerRun;
import io.pglisten.NotificationListener;
import io.pglisten.NotificationTimeout;
import org.springframework.context.SmartLifecycle;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts a {@link ListenerRun} when the application context starts and cancels it on stop.
 *
 * <p>With no registered channel the lifecycle stays idle. A run that ends on a fatal
 * subscription failure is logged; the context itself keeps running.
 */
public class NotificationListenerLifecycle implements SmartLifecycle {
    private static final Logger logger = Logger.getLogger(NotificationListenerLifecycle.class.getName());

    private final NotificationListener listener;
    private final ChannelListenerRegistry registry;
    private final NotificationTimeout timeout;

    private volatile ListenerRun run;

    public NotificationListenerLifecycle(NotificationListener listener, ChannelListenerRegistry registry,
                                         NotificationTimeout timeout) {
        this.listener = Objects.requireNonNull(listener, "listener");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public synchronized void start() {
        if (run != null) {
            return;
        }
        List<ChannelRegistration> registrations = registry.registrations();
        if (registrations.isEmpty()) {
            logger.info("No @ChannelListener beans found; notification listener not started");
            return;
        }
        ListenerRun started = listener.run(registrations, timeout);
        started.completion().whenComplete((ignored, failure) -> {
            if (failure != null) {
                logger.log(Level.SEVERE, "Notification listener terminated", failure);
            }
        });
        run = started;
        logger.info("Notification listener started for " + registrations.size() + " channel(s)");
    }

    @Override
    public synchronized void stop() {
        ListenerRun current = run;
        if (current == null) {
            return;
        }
        run = null;
        current.cancel();
    }

    @Override
    public boolean isRunning() {
        ListenerRun current = run;
        return current != null && !current.isDone();
    }

    /**
     * @return the running handle, or {@code null} when not started
     */
    public ListenerRun run() {
        return run;
    }

    public ConnectionState connectionState() {
        ListenerRun current = run;
        return current == null ? ConnectionState.DISCONNECTED : current.connectionState();
    }
}
