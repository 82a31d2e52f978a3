package io.pglisten.dispatch;

import io.pglisten.Notification;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded FIFO buffer used for {@link io.pglisten.ListenPolicy#ALL}: every notification is
 * kept and handed out in arrival order.
 */
final class FifoChannelBuffer implements ChannelBuffer {
    private final BlockingQueue<Notification> queue = new LinkedBlockingQueue<>();

    @Override
    public boolean offer(Notification notification) {
        queue.add(notification);
        return false;
    }

    @Override
    public Notification poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    @Override
    public Notification take() throws InterruptedException {
        return queue.take();
    }

    @Override
    public int size() {
        return queue.size();
    }
}
