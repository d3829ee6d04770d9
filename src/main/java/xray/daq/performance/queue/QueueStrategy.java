package xray.daq.performance.queue;

import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * Pairs a queue implementation with the way producers and the consumer
 * wait on it.
 *
 * Non-blocking queues (the JCTools array queues) have no way to park a
 * thread, so the wait is implemented here by polling with a back-off.
 */
public interface QueueStrategy<T>
{
    /**
     * Add an element, waiting for space if the queue is bounded and full.
     */
    void enqueue(T element) throws InterruptedException;

    /**
     * Remove the next element, waiting until one is available.
     */
    T dequeue() throws InterruptedException;

    /**
     * Remove the next element if one is available.
     *
     * @return next element or <tt>null</tt>
     */
    T poll();

    /**
     * Remove the next element, waiting at most <tt>timeout</tt>.
     *
     * @return next element or <tt>null</tt> if the wait timed out
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    int size();

    /**
     * Wraps a java.util.concurrent blocking queue.
     */
    class Blocking<T>
        implements QueueStrategy<T>
    {
        private final BlockingQueue<T> queue;

        public Blocking(BlockingQueue<T> queue)
        {
            this.queue = queue;
        }

        @Override
        public void enqueue(T element)
            throws InterruptedException
        {
            queue.put(element);
        }

        @Override
        public T dequeue()
            throws InterruptedException
        {
            return queue.take();
        }

        @Override
        public T poll()
        {
            return queue.poll();
        }

        @Override
        public T poll(long timeout, TimeUnit unit)
            throws InterruptedException
        {
            return queue.poll(timeout, unit);
        }

        @Override
        public int size()
        {
            return queue.size();
        }
    }

    /**
     * Wraps a non-blocking queue, sleeping a fixed interval between
     * attempts.
     */
    class NonBlockingPoll<T>
        implements QueueStrategy<T>
    {
        private final Queue<T> queue;
        private final long pollNanos;

        public NonBlockingPoll(Queue<T> queue, long pollMillis)
        {
            this.queue = queue;
            this.pollNanos = TimeUnit.MILLISECONDS.toNanos(pollMillis);
        }

        /** Wait between attempts; grows for back-off subclasses */
        long nextWait(long previous)
        {
            return pollNanos;
        }

        @Override
        public void enqueue(T element)
            throws InterruptedException
        {
            long wait = 0;
            while (!queue.offer(element)) {
                wait = pause(wait);
            }
        }

        @Override
        public T dequeue()
            throws InterruptedException
        {
            long wait = 0;
            while (true) {
                T element = queue.poll();
                if (element != null) {
                    return element;
                }
                wait = pause(wait);
            }
        }

        @Override
        public T poll()
        {
            return queue.poll();
        }

        @Override
        public T poll(long timeout, TimeUnit unit)
            throws InterruptedException
        {
            final long deadline = System.nanoTime() + unit.toNanos(timeout);

            long wait = 0;
            while (true) {
                T element = queue.poll();
                if (element != null) {
                    return element;
                }
                if (System.nanoTime() - deadline >= 0) {
                    return null;
                }
                wait = pause(wait);
            }
        }

        private long pause(long previous)
            throws InterruptedException
        {
            final long wait = nextWait(previous);
            LockSupport.parkNanos(wait);
            if (Thread.interrupted()) {
                throw new InterruptedException();
            }
            return wait;
        }

        @Override
        public int size()
        {
            return queue.size();
        }
    }

    /**
     * Polls a non-blocking queue, doubling the wait after each empty
     * attempt up to a ceiling.  Idle consumers cost little CPU while a
     * busy queue is still drained promptly.
     */
    class NonBlockingPollBackoff<T>
        extends NonBlockingPoll<T>
    {
        private static final long MIN_WAIT_NANOS = 1000L;

        private final long maxNanos;

        public NonBlockingPollBackoff(Queue<T> queue, long maxPollMillis)
        {
            super(queue, maxPollMillis);
            this.maxNanos = TimeUnit.MILLISECONDS.toNanos(maxPollMillis);
        }

        @Override
        long nextWait(long previous)
        {
            if (previous <= 0) {
                return MIN_WAIT_NANOS;
            }

            return Math.min(previous * 2, maxNanos);
        }
    }
}
