package io.pglisten;

import java.time.Duration;
import java.util.Objects;

/**
 * How long a channel's delivery loop waits for the next notification before it delivers
 * a {@link TimeoutSignal}.
 *
 * <p>Either a positive bounded window ({@link #of(Duration)}) or {@link #NONE}, in which case
 * the loop waits indefinitely and timeout signals are never produced.
 */
public final class NotificationTimeout {

    /** Wait indefinitely; never deliver a {@link TimeoutSignal}. */
    public static final NotificationTimeout NONE = new NotificationTimeout(null);

    private final Duration window;

    private NotificationTimeout(Duration window) {
        this.window = window;
    }

    /**
     * @param window the wait window, must be positive
     * @return a bounded timeout
     */
    public static NotificationTimeout of(Duration window) {
        Objects.requireNonNull(window, "window");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be > 0, got: " + window);
        }
        return new NotificationTimeout(window);
    }

    public static NotificationTimeout ofMillis(long millis) {
        return of(Duration.ofMillis(millis));
    }

    public boolean isBounded() {
        return window != null;
    }

    /**
     * @return the window
     * @throws IllegalStateException if this is {@link #NONE}
     */
    public Duration window() {
        if (window == null) {
            throw new IllegalStateException("NotificationTimeout.NONE has no window");
        }
        return window;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NotificationTimeout other)) return false;
        return Objects.equals(window, other.window);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(window);
    }

    @Override
    public String toString() {
        return window == null ? "NotificationTimeout[NONE]" : "NotificationTimeout[" + window + "]";
    }
}
