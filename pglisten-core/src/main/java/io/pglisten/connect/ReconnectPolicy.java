package io.pglisten.connect;

/**
 * Strategy for computing the delay before reconnecting after a lost or failed connection.
 *
 * @see ExponentialBackoffReconnectPolicy
 */
public interface ReconnectPolicy {

    /**
     * Computes the delay in milliseconds before the next connection attempt.
     *
     * @param failedAttempts consecutive failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int failedAttempts);
}
