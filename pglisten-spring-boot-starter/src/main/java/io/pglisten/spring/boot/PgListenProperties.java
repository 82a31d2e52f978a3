package io.pglisten.spring.boot;

import io.pglisten.ListenPolicy;
import io.pglisten.NotificationTimeout;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the notification listener.
 *
 * @see PgListenAutoConfiguration
 */
@ConfigurationProperties(prefix = "pglisten")
public class PgListenProperties {

    /**
     * Whether to start a listener with the application context.
     */
    private boolean enabled = true;

    /**
     * Buffering policy for channels whose {@code @ChannelListener} does not choose one.
     */
    private ListenPolicy policy = ListenPolicy.ALL;

    /**
     * Per-channel wait before a timeout signal is delivered. Zero or negative disables
     * timeout signals.
     */
    private Duration notificationTimeout = Duration.ofSeconds(30);

    /**
     * Longest single wait on the connection; bounds how quickly shutdown is noticed.
     */
    private Duration pollInterval = Duration.ofMillis(500);

    /**
     * How long shutdown waits for running handlers to return.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    private final Reconnect reconnect = new Reconnect();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public ListenPolicy getPolicy() {
        return policy;
    }

    public void setPolicy(ListenPolicy policy) {
        this.policy = policy;
    }

    public Duration getNotificationTimeout() {
        return notificationTimeout;
    }

    public void setNotificationTimeout(Duration notificationTimeout) {
        this.notificationTimeout = notificationTimeout;
    }

    /**
     * @return the configured timeout, {@link NotificationTimeout#NONE} when unset or not positive
     */
    public NotificationTimeout toNotificationTimeout() {
        if (notificationTimeout == null || notificationTimeout.isZero() || notificationTimeout.isNegative()) {
            return NotificationTimeout.NONE;
        }
        return NotificationTimeout.of(notificationTimeout);
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Reconnect getReconnect() {
        return reconnect;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Reconnect {
        private long baseDelayMs = 1000;
        private long maxDelayMs = 5000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "pglisten";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
