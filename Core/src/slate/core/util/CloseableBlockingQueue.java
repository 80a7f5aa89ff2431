package slate.core.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * A thread-safe blocking queue that can be closed.
 *
 * Consumers are released from blocking polls when the queue is closed, so worker threads can be life-cycled without
 * interrupts. A closed queue can still be drained of whatever it holds, but nothing new can be added to it.
 */
public final class CloseableBlockingQueue<E> {
    private final Object monitor = new Object();
    private final int capacity;
    private final Deque<E> queue;
    private boolean isClosed = false;

    private CloseableBlockingQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive but was: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>();
    }

    /**
     * Constructs a new closeable blocking queue with the specified capacity.
     *
     * @param capacity The maximum amount of elements allowed in the queue at once.
     * @return the new queue.
     */
    public static <E> CloseableBlockingQueue<E> withCapacity(int capacity) {
        return new CloseableBlockingQueue<>(capacity);
    }

    /**
     * Attempts to add the element to the queue. If the queue is full then this method blocks until space is available
     * or until the queue is closed or the timeout elapses, whichever happens first.
     *
     * Returns true iff the element was added to the queue.
     *
     * @param element The element to add.
     * @param timeout The timeout duration.
     * @param unit The timeout duration units.
     * @return whether or not the element was added.
     */
    public boolean add(E element, long timeout, TimeUnit unit) throws InterruptedException {
        ObjectChecker.assertNonNull(element, unit);
        ObjectChecker.assertNonNegative(timeout);

        long currentTime = System.currentTimeMillis();
        long deadline = currentTime + unit.toMillis(timeout);

        synchronized (this.monitor) {
            while ((currentTime < deadline) && (!this.isClosed) && (this.queue.size() == this.capacity)) {
                this.monitor.wait(deadline - currentTime);
                currentTime = System.currentTimeMillis();
            }

            if ((!this.isClosed) && (this.queue.size() < this.capacity)) {
                this.queue.addLast(element);
                this.monitor.notifyAll();
                return true;
            } else {
                return false;
            }
        }
    }

    /**
     * Polls the next element in the queue. If the queue is empty then this method blocks until a new element is added,
     * the queue is closed or the timeout elapses, whichever happens first.
     *
     * Returns null if no element became available. Once the queue is closed and empty this method always returns null
     * immediately.
     *
     * @param timeout The timeout duration.
     * @param unit The timeout duration units.
     * @return the next element or null.
     */
    public E poll(long timeout, TimeUnit unit) throws InterruptedException {
        ObjectChecker.assertNonNull(unit);
        ObjectChecker.assertNonNegative(timeout);

        long currentTime = System.currentTimeMillis();
        long deadline = currentTime + unit.toMillis(timeout);

        synchronized (this.monitor) {
            while ((currentTime < deadline) && (!this.isClosed) && (this.queue.isEmpty())) {
                this.monitor.wait(deadline - currentTime);
                currentTime = System.currentTimeMillis();
            }

            E element = this.queue.pollFirst();
            if (element != null) {
                this.monitor.notifyAll();
            }
            return element;
        }
    }

    /**
     * Removes and returns every element still held by this queue, in queue order.
     *
     * @return the remaining elements.
     */
    public List<E> drain() {
        synchronized (this.monitor) {
            List<E> remaining = new ArrayList<>(this.queue);
            this.queue.clear();
            this.monitor.notifyAll();
            return remaining;
        }
    }

    /**
     * Returns true iff this queue is closed and holds no more elements.
     */
    public boolean isClosedAndEmpty() {
        synchronized (this.monitor) {
            return this.isClosed && this.queue.isEmpty();
        }
    }

    /**
     * Closes this queue. Once this queue is closed it cannot be reopened.
     */
    public void close() {
        synchronized (this.monitor) {
            this.isClosed = true;
            this.monitor.notifyAll();
        }
    }

    @Override
    public String toString() {
        synchronized (this.monitor) {
            return this.getClass().getSimpleName() + " { size: " + this.queue.size() + ", capacity: " + this.capacity + (this.isClosed ? ", [closed]" : "") + " }";
        }
    }
}
