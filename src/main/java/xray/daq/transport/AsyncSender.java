package xray.daq.transport;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.log4j.Logger;

/**
 * Wraps a MessageSink with a thread to provide for asynchronous sends.
 *
 * Messages are delivered in submission order.  After the first delivery
 * failure the sender stops and every queued message is abandoned; the
 * failure is reported through the failed message's request.
 */
public class AsyncSender
{
    private static final Logger LOG = Logger.getLogger(AsyncSender.class);

    private final MessageSink delegate;
    private final ExecutorService executor;

    public AsyncSender(final MessageSink delegate, final int capacity,
                       final String threadName)
    {
        this.delegate = delegate;

        executor =
            new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                                   new LinkedBlockingQueue<Runnable>(capacity),
                                   new SingleThreadFactory(threadName),
                                   new BlockingExecutorRejectionHandler());
    }

    public int getQueueSize()
    {
        return ((ThreadPoolExecutor) executor).getQueue().size();
    }

    /**
     * Queue a message for delivery.
     *
     * @param dest destination rank
     * @param msg message
     *
     * @return request which completes once the message is delivered
     *
     * @throws TransportException if the sender has been stopped
     */
    public SendRequest submit(final int dest, final Message msg)
        throws TransportException
    {
        Future<Void> future;
        try {
            future = executor.submit(new Callable<Void>()
            {
                @Override
                public Void call()
                    throws Exception
                {
                    try {
                        delegate.deliver(dest, msg);
                    } catch (TransportException te) {
                        // shutdownNow() interrupts this thread
                        List<Runnable> abandoned = executor.shutdownNow();
                        Thread.interrupted();

                        LOG.error("Cannot send " + msg + " to rank " + dest +
                                  ", abandoning " + abandoned.size() +
                                  " queued messages", te);
                        throw te;
                    }
                    return null;
                }
            });
        } catch (RejectedExecutionException ree) {
            throw new TransportException("Cannot queue " + msg + " for rank " +
                                         dest, ree);
        }

        return new FutureRequest(future);
    }

    /**
     * Stop accepting messages and wait for queued messages to be sent.
     *
     * @param waitMillis how long to wait
     *
     * @return <tt>true</tt> if every queued message was sent
     */
    public boolean close(long waitMillis)
    {
        executor.shutdown();
        try {
            return executor.awaitTermination(waitMillis,
                                             TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Abandon every queued message.
     */
    public void abort()
    {
        List<Runnable> abandoned = executor.shutdownNow();
        if (abandoned.size() > 0) {
            LOG.warn("Abandoned " + abandoned.size() + " queued messages");
        }
    }

    /**
     * Completion handle backed by the executor's future.
     */
    private static final class FutureRequest
        implements SendRequest
    {
        private final Future<Void> future;

        FutureRequest(Future<Void> future)
        {
            this.future = future;
        }

        @Override
        public boolean isDone()
        {
            return future.isDone();
        }

        @Override
        public void await()
            throws TransportException
        {
            try {
                future.get();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new TransportException("Interrupted while sending", ie);
            } catch (ExecutionException ee) {
                throw unwrap(ee);
            } catch (CancellationException ce) {
                throw new TransportException("Send was abandoned", ce);
            }
        }

        @Override
        public boolean await(long timeout, TimeUnit unit)
            throws TransportException
        {
            try {
                future.get(timeout, unit);
                return true;
            } catch (TimeoutException te) {
                return false;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new TransportException("Interrupted while sending", ie);
            } catch (ExecutionException ee) {
                throw unwrap(ee);
            } catch (CancellationException ce) {
                throw new TransportException("Send was abandoned", ce);
            }
        }

        private static TransportException unwrap(ExecutionException ee)
        {
            if (ee.getCause() instanceof TransportException) {
                return (TransportException) ee.getCause();
            }

            return new TransportException("Send failed", ee.getCause());
        }
    }

    /**
     * Factory for defining the sending thread.
     *
     *    Prohibit generation of a replacement thread.
     */
    private static class SingleThreadFactory
        implements ThreadFactory
    {
        final String threadName;
        int instanceNumber;

        private SingleThreadFactory(final String threadName)
        {
            this.threadName = threadName;
        }

        @Override
        public Thread newThread(final Runnable runnable)
        {
            synchronized (this) {
                // prohibit thread restoration
                if (instanceNumber == 1) {
                    throw new Error("Unexpected sender thread death.");
                }

                Thread thread = new Thread(runnable);
                thread.setName(threadName);
                thread.setDaemon(true);

                instanceNumber++;
                return thread;
            }
        }
    }

    /**
     * Realizes a bounded executor that blocks on job submission when the
     * job queue is full.
     *
     * Jobs are assumed to be rejected only because the queue is full or
     * because the executor is shut down.
     */
    private static class BlockingExecutorRejectionHandler
        implements RejectedExecutionHandler
    {
        @Override
        public void rejectedExecution(final Runnable r,
                                      final ThreadPoolExecutor executor)
        {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("Executor is shutdown");
            }

            try {
                executor.getQueue().put(r);
            } catch (InterruptedException e) {
                throw new RejectedExecutionException(e);
            }
        }
    }
}
