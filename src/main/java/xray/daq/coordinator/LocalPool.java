package xray.daq.coordinator;

import org.apache.log4j.Logger;

import xray.daq.source.SourceAccessException;
import xray.daq.transport.LocalFabric;
import xray.daq.transport.Message;
import xray.daq.transport.Transport;
import xray.daq.transport.TransportException;

/**
 * Run a whole pool inside one JVM: every worker on its own thread, the
 * collector on the caller's thread, all connected by a {@link LocalFabric}.
 */
public class LocalPool
{
    private static final Logger LOG = Logger.getLogger(LocalPool.class);

    /** Milliseconds to wait for each worker thread after the collector */
    private static final long JOIN_MILLIS = 5000L;

    private final LocalFabric fabric;

    public LocalPool(int poolSize)
    {
        fabric = new LocalFabric(poolSize);
    }

    public int getPoolSize()
    {
        return fabric.getPoolSize();
    }

    /**
     * @return transport for the collector rank
     */
    public Transport getCollectorTransport()
    {
        return fabric.getTransport(Transport.COLLECTOR_RANK);
    }

    /**
     * Start the workers and run the collector until it exits.
     *
     * @param collector collector built on {@link #getCollectorTransport()}
     * @param factory worker builder
     *
     * @return the collector's status, or the first worker failure if the
     *         collector finished cleanly
     */
    public ExitStatus run(CollectorNode collector, WorkerFactory factory)
    {
        WorkerThread[] workers = new WorkerThread[fabric.getPoolSize() - 1];
        for (int i = 0; i < workers.length; i++) {
            workers[i] = new WorkerThread(fabric.getTransport(i + 1),
                                          factory);
            workers[i].start();
        }

        ExitStatus status = collector.run();

        for (WorkerThread thread : workers) {
            try {
                thread.join(JOIN_MILLIS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                LOG.error("Interrupted while waiting for " +
                          thread.getName());
                break;
            }

            if (thread.isAlive()) {
                LOG.error(thread.getName() + " did not stop");
            } else if (status == ExitStatus.CLEAN &&
                       thread.getStatus() != ExitStatus.CLEAN)
            {
                status = thread.getStatus();
            }
        }

        for (int rank = 0; rank < fabric.getPoolSize(); rank++) {
            fabric.getTransport(rank).close();
        }

        return status;
    }

    static class WorkerThread
        extends Thread
    {
        private final Transport transport;
        private final WorkerFactory factory;

        private volatile ExitStatus status;

        WorkerThread(Transport transport, WorkerFactory factory)
        {
            super("Worker#" + transport.getRank());
            setDaemon(true);

            this.transport = transport;
            this.factory = factory;
        }

        ExitStatus getStatus()
        {
            return status;
        }

        @Override
        public void run()
        {
            WorkerNode worker;
            try {
                worker = factory.create(transport);
            } catch (SourceAccessException sae) {
                LOG.error("Cannot start rank " + transport.getRank(), sae);
                status = ExitStatus.STARTUP_FAILURE;

                // let the collector stop waiting for this rank
                try {
                    transport.sendNow(Transport.COLLECTOR_RANK,
                                      Message.end(transport.getRank()));
                } catch (TransportException te) {
                    LOG.error("Cannot notify collector", te);
                }
                return;
            }

            status = worker.run();
        }
    }
}
