package io.pglisten.dispatch;

import io.pglisten.Notification;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-slot buffer used for {@link io.pglisten.ListenPolicy#LAST}.
 *
 * <p>An arriving notification replaces any pending one. Overwrite and hand-out happen under
 * the same lock, so the reader always sees a whole notification and at most one is pending.
 */
final class LatestChannelBuffer implements ChannelBuffer {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private Notification pending;

    @Override
    public boolean offer(Notification notification) {
        lock.lock();
        try {
            boolean replaced = pending != null;
            pending = notification;
            notEmpty.signal();
            return replaced;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Notification poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (pending == null) {
                if (nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Notification take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pending == null) {
                notEmpty.await();
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    private Notification dequeue() {
        Notification next = pending;
        pending = null;
        return next;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return pending == null ? 0 : 1;
        } finally {
            lock.unlock();
        }
    }
}
