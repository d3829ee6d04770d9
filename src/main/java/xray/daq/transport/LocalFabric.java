package xray.daq.transport;

import java.util.concurrent.TimeUnit;

import org.apache.log4j.Logger;

import xray.daq.performance.queue.QueueProvider;
import xray.daq.performance.queue.QueueStrategy;

/**
 * In-memory message fabric connecting every rank of a pool running as
 * threads inside one JVM.
 */
public class LocalFabric
{
    private static final Logger LOG = Logger.getLogger(LocalFabric.class);

    /** Default number of messages each inbox can hold */
    public static final int DEFAULT_INBOX_CAPACITY = 1024;

    private final int poolSize;
    private final QueueStrategy<Message>[] inboxes;
    private final LocalTransport[] transports;

    public LocalFabric(int poolSize)
    {
        this(poolSize, DEFAULT_INBOX_CAPACITY);
    }

    @SuppressWarnings("unchecked")
    public LocalFabric(int poolSize, int inboxCapacity)
    {
        if (poolSize < 2) {
            throw new IllegalArgumentException("Pool needs a collector and" +
                                               " at least one worker, not " +
                                               poolSize + " rank(s)");
        }

        this.poolSize = poolSize;

        inboxes = new QueueStrategy[poolSize];
        transports = new LocalTransport[poolSize];
        for (int i = 0; i < poolSize; i++) {
            inboxes[i] =
                QueueProvider.Subsystem.RANK_INBOX.createQueue(inboxCapacity);
        }
    }

    public int getPoolSize()
    {
        return poolSize;
    }

    /**
     * Get the endpoint for one rank.  Each rank has exactly one endpoint.
     */
    public synchronized Transport getTransport(int rank)
    {
        if (rank < 0 || rank >= poolSize) {
            throw new IllegalArgumentException("Bad rank " + rank +
                                               " for pool of " + poolSize);
        }

        if (transports[rank] == null) {
            transports[rank] = new LocalTransport(rank);
        }

        return transports[rank];
    }

    private void deliver(int src, int dest, Message msg)
        throws TransportException
    {
        if (dest < 0 || dest >= poolSize) {
            throw new TransportException("Rank " + src + " cannot send to" +
                                         " nonexistent rank " + dest);
        }

        try {
            inboxes[dest].enqueue(msg);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while sending " + msg +
                                         " to rank " + dest, ie);
        }
    }

    /**
     * One rank's view of the fabric.  Messages sent to a rank after it
     * closed stay in its inbox unread.
     */
    private final class LocalTransport
        implements Transport, MessageSink
    {
        private final int rank;
        private final AsyncSender sender;

        private volatile boolean closed;

        LocalTransport(int rank)
        {
            this.rank = rank;
            sender = new AsyncSender(this, DEFAULT_INBOX_CAPACITY,
                                     "LocalSender#" + rank);
        }

        @Override
        public int getRank()
        {
            return rank;
        }

        @Override
        public int getPoolSize()
        {
            return poolSize;
        }

        @Override
        public void deliver(int dest, Message msg)
            throws TransportException
        {
            LocalFabric.this.deliver(rank, dest, msg);
        }

        @Override
        public SendRequest send(int dest, Message msg)
            throws TransportException
        {
            if (closed) {
                throw new TransportException("Rank " + rank + " is closed");
            }

            return sender.submit(dest, msg);
        }

        @Override
        public void sendNow(int dest, Message msg)
            throws TransportException
        {
            if (closed) {
                throw new TransportException("Rank " + rank + " is closed");
            }

            deliver(dest, msg);
        }

        @Override
        public Message receive(long timeout, TimeUnit unit)
            throws TransportException
        {
            try {
                return inboxes[rank].poll(timeout, unit);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new TransportException("Rank " + rank +
                                             " interrupted while receiving",
                                             ie);
            }
        }

        @Override
        public Message poll()
        {
            return inboxes[rank].poll();
        }

        @Override
        public void close()
        {
            if (!closed) {
                closed = true;
                if (!sender.close(1000L)) {
                    LOG.warn("Rank " + rank + " closed with unsent" +
                             " messages");
                    sender.abort();
                }
            }
        }

        @Override
        public String toString()
        {
            return "LocalTransport#" + rank;
        }
    }
}
