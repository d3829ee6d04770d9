package xray.daq.coordinator;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.apache.log4j.Logger;

import xray.daq.transport.Message;
import xray.daq.transport.Transport;
import xray.daq.transport.TransportException;

/**
 * Collector rank main loop.  Hands every result to a {@link FrameSink} and
 * stops once each worker has sent END.
 *
 * {@link #requestShutdown()} may be called from any thread.  The loop
 * then sends TERMINATE to every active worker and waits until each one
 * has answered with END or TERMINATED, giving up after
 * <tt>shutdownRetries</tt> empty receive timeouts.
 */
public class CollectorNode
{
    private static final Logger LOG = Logger.getLogger(CollectorNode.class);

    public static final long DEFAULT_RECEIVE_TIMEOUT = 1000L;
    public static final int DEFAULT_SHUTDOWN_RETRIES = 10;

    private final Transport transport;
    private final FrameSink sink;
    private final long receiveTimeout;
    private final int shutdownRetries;

    private final Set<Integer> finished = new HashSet<Integer>();

    private volatile boolean shutdownRequested;

    private long numResults;

    public CollectorNode(Transport transport, FrameSink sink)
    {
        this(transport, sink, DEFAULT_RECEIVE_TIMEOUT,
             DEFAULT_SHUTDOWN_RETRIES);
    }

    /**
     * @param transport messaging for rank 0
     * @param sink result consumer
     * @param receiveTimeout milliseconds to wait for each message
     * @param shutdownRetries receive timeouts allowed while waiting for
     *                        shutdown acknowledgements
     */
    public CollectorNode(Transport transport, FrameSink sink,
                         long receiveTimeout, int shutdownRetries)
    {
        if (transport.getRank() != Transport.COLLECTOR_RANK) {
            throw new IllegalArgumentException("Collector must be rank " +
                                               Transport.COLLECTOR_RANK +
                                               ", not " + transport.getRank());
        }
        if (receiveTimeout <= 0) {
            throw new IllegalArgumentException("Bad receive timeout " +
                                               receiveTimeout);
        }
        if (shutdownRetries < 1) {
            throw new IllegalArgumentException("Bad retry count " +
                                               shutdownRetries);
        }

        this.transport = transport;
        this.sink = sink;
        this.receiveTimeout = receiveTimeout;
        this.shutdownRetries = shutdownRetries;
    }

    /**
     * Ask the collector to stop all workers and exit.
     */
    public void requestShutdown()
    {
        shutdownRequested = true;
    }

    public boolean isShutdownRequested()
    {
        return shutdownRequested;
    }

    /**
     * @return number of RESULT messages handed to the sink
     */
    public long getNumResults()
    {
        return numResults;
    }

    /**
     * @return number of workers which have sent END or TERMINATED
     */
    public int getNumFinished()
    {
        return finished.size();
    }

    private int getNumWorkers()
    {
        return transport.getPoolSize() - 1;
    }

    /**
     * Handle one message.
     */
    private void dispatch(Message msg)
    {
        final int src = msg.getSource();

        switch (msg.getKind()) {
        case RESULT:
            if (finished.contains(src)) {
                LOG.warn("Ignoring result from finished rank " + src);
                break;
            }

            numResults++;
            try {
                sink.frameReceived(src, msg.getFrame());
            } catch (RuntimeException rte) {
                LOG.error("Cannot handle result " + msg.getFrame() +
                          " from rank " + src, rte);
            }
            break;
        case END:
        case TERMINATED:
            if (!finished.add(src)) {
                LOG.warn("Rank " + src + " sent " + msg.getKind() +
                         " twice");
            } else if (LOG.isInfoEnabled()) {
                LOG.info("Rank " + src + " sent " + msg.getKind() + " (" +
                         finished.size() + " of " + getNumWorkers() +
                         " finished)");
            }
            break;
        default:
            LOG.warn("Collector ignoring unexpected " + msg);
            break;
        }
    }

    /**
     * Run until every worker has finished or a shutdown completes.
     *
     * @return exit status
     */
    public ExitStatus run()
    {
        try {
            while (finished.size() < getNumWorkers()) {
                if (shutdownRequested) {
                    return shutdown();
                }

                Message msg =
                    transport.receive(receiveTimeout, TimeUnit.MILLISECONDS);
                if (msg != null) {
                    dispatch(msg);
                }
            }
        } catch (TransportException te) {
            LOG.error("Collector transport failed", te);
            broadcastTerminate();
            return ExitStatus.TRANSPORT_FAILURE;
        }

        LOG.info("All " + getNumWorkers() + " workers finished after " +
                 numResults + " results");
        sink.endOfStream();
        return ExitStatus.CLEAN;
    }

    /**
     * Send TERMINATE to every worker which has not finished.
     */
    private void broadcastTerminate()
    {
        for (int rank = 1; rank < transport.getPoolSize(); rank++) {
            if (finished.contains(rank)) {
                continue;
            }

            try {
                transport.sendNow(rank,
                                  Message.terminate(Transport.COLLECTOR_RANK));
            } catch (TransportException te) {
                LOG.error("Cannot send TERMINATE to rank " + rank, te);
            }
        }
    }

    private ExitStatus shutdown()
        throws TransportException
    {
        LOG.info("Shutting down " + (getNumWorkers() - finished.size()) +
                 " active workers");

        broadcastTerminate();

        int timeouts = 0;
        while (finished.size() < getNumWorkers()) {
            Message msg =
                transport.receive(receiveTimeout, TimeUnit.MILLISECONDS);
            if (msg != null) {
                dispatch(msg);
                continue;
            }

            timeouts++;
            if (timeouts >= shutdownRetries) {
                LOG.error("Only " + finished.size() + " of " +
                          getNumWorkers() + " workers acknowledged" +
                          " shutdown; aborting");
                return ExitStatus.SHUTDOWN_TIMEOUT;
            }
        }

        LOG.info("All workers stopped");
        return ExitStatus.CLEAN;
    }
}
