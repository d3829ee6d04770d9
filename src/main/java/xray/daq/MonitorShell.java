package xray.daq;

import java.io.File;
import java.io.PrintWriter;
import java.net.InetSocketAddress;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;
import org.apache.log4j.PropertyConfigurator;

import xray.daq.configuration.ConfigException;
import xray.daq.configuration.MonitorConfig;
import xray.daq.coordinator.CollectorNode;
import xray.daq.coordinator.ExitStatus;
import xray.daq.coordinator.FrameSink;
import xray.daq.coordinator.LocalPool;
import xray.daq.coordinator.WorkerFactory;
import xray.daq.coordinator.WorkerNode;
import xray.daq.geometry.Detector;
import xray.daq.geometry.GeometryLoader;
import xray.daq.geometry.GeometryParseException;
import xray.daq.monitoring.Broadcaster;
import xray.daq.monitoring.MonitorCollector;
import xray.daq.monitoring.Responder;
import xray.daq.monitoring.ZmqBroadcaster;
import xray.daq.monitoring.ZmqResponder;
import xray.daq.processing.CrystallographyProcessor;
import xray.daq.processing.GeometryInfo;
import xray.daq.source.EventAgeFilter;
import xray.daq.source.EventSource;
import xray.daq.source.SourceAccessException;
import xray.daq.source.SourceKind;
import xray.daq.transport.Message;
import xray.daq.transport.SocketTransport;
import xray.daq.transport.Transport;
import xray.daq.transport.TransportException;

/**
 * Command-line entry point.  Reads a monitor configuration file and runs
 * either every rank inside this JVM (<tt>transport.mode = local</tt>) or
 * the single rank named by the <tt>rank</tt> setting
 * (<tt>transport.mode = socket</tt>).
 */
public class MonitorShell
{
    private static final Logger LOG = Logger.getLogger(MonitorShell.class);

    public static final String LOCAL_MODE = "local";
    public static final String SOCKET_MODE = "socket";

    public static final String DEFAULT_BROADCAST_ENDPOINT = "tcp://*:12321";
    public static final String DEFAULT_COLLECTOR_ADDRESS = "localhost:12322";
    public static final long DEFAULT_CONNECT_MILLIS = 60000L;

    /** How long the shutdown hook waits for the collector to finish */
    private static final long SHUTDOWN_WAIT_MILLIS = 30000L;

    private final MonitorConfig cfg;
    private final GeometryInfo geom;
    private final EventSource source;
    private final CrystallographyProcessor.Builder processorBuilder;
    private final int framesPerEvent;
    private final double maxEventAge;

    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile CollectorNode collector;
    private volatile boolean shutdownRequested;
    private volatile ExitStatus exitStatus;

    /**
     * Load the geometry and build the data source and processor settings.
     *
     * @param cfg monitor settings
     *
     * @throws ConfigException if a setting is missing or malformed
     * @throws GeometryParseException if the geometry file is bad
     * @throws SourceAccessException if the source's index cannot be read
     */
    public MonitorShell(MonitorConfig cfg)
        throws ConfigException, GeometryParseException, SourceAccessException
    {
        this.cfg = cfg;

        Detector det = GeometryLoader.load(cfg.getFile(MonitorConfig.GEOMETRY_FILE));
        geom = GeometryInfo.from(det);

        source = SourceKind.lookup(cfg.getString(MonitorConfig.SOURCE_KIND,
                                                 "files")).create(cfg, det);
        processorBuilder = CrystallographyProcessor.configure(cfg, geom);

        framesPerEvent =
            cfg.getBoundedInt(MonitorConfig.FRAMES_PER_EVENT, 0, 0);
        maxEventAge =
            cfg.getDouble(MonitorConfig.EVENT_REJECTION_THRESHOLD, 0.0);
        if (maxEventAge < 0.0) {
            throw new ConfigException("\"" +
                                      MonitorConfig.EVENT_REJECTION_THRESHOLD +
                                      "\" cannot be negative");
        }

        if (LOG.isInfoEnabled()) {
            LOG.info("Loaded " + det.getPanels().size() + " panels (" +
                     geom.getSlabWidth() + "x" + geom.getSlabHeight() +
                     " slab), processor " + processorBuilder.build());
        }
    }

    public GeometryInfo getGeometry()
    {
        return geom;
    }

    /**
     * Build the worker for one rank.
     */
    WorkerNode createWorker(Transport transport)
        throws SourceAccessException
    {
        WorkerNode worker =
            new WorkerNode(transport,
                           source.open(transport.getRank(),
                                       transport.getPoolSize()),
                           processorBuilder.build(), geom);
        worker.setFramesPerEvent(framesPerEvent);
        if (maxEventAge > 0.0) {
            worker.setAgeFilter(new EventAgeFilter(maxEventAge));
        }
        return worker;
    }

    private CollectorNode createCollector(Transport transport, FrameSink sink)
        throws ConfigException
    {
        final long timeout =
            cfg.getLong(MonitorConfig.RECEIVE_TIMEOUT,
                        CollectorNode.DEFAULT_RECEIVE_TIMEOUT);
        if (timeout <= 0) {
            throw new ConfigException("\"" + MonitorConfig.RECEIVE_TIMEOUT +
                                      "\" must be positive");
        }

        CollectorNode node =
            new CollectorNode(transport, sink, timeout,
                              cfg.getBoundedInt(MonitorConfig.SHUTDOWN_RETRIES,
                                                CollectorNode.DEFAULT_SHUTDOWN_RETRIES,
                                                1));

        collector = node;
        if (shutdownRequested) {
            node.requestShutdown();
        }

        return node;
    }

    /**
     * Ask the collector to stop every worker.  Safe to call from any
     * thread, including before the collector has started.
     */
    public void requestShutdown()
    {
        shutdownRequested = true;

        CollectorNode node = collector;
        if (node != null) {
            node.requestShutdown();
        }
    }

    /**
     * Wait for {@link #run} to return.
     *
     * @return <tt>false</tt> if the wait timed out
     */
    public boolean awaitFinish(long timeout, TimeUnit unit)
        throws InterruptedException
    {
        return finished.await(timeout, unit);
    }

    /**
     * @return status of the finished run, or <tt>null</tt> if
     *         {@link #run} has not returned
     */
    public ExitStatus getExitStatus()
    {
        return exitStatus;
    }

    /**
     * Stop the run and wait for it to finish.
     *
     * @return the process exit code for the finished run
     */
    int shutdownAndWait(long millis)
    {
        requestShutdown();
        try {
            if (!awaitFinish(millis, TimeUnit.MILLISECONDS)) {
                LOG.error("Monitor did not stop within " + millis + " ms");
                return ExitStatus.SHUTDOWN_TIMEOUT.getCode();
            }
        } catch (InterruptedException ie) {
            LOG.error("Interrupted while stopping monitor", ie);
            return ExitStatus.SHUTDOWN_TIMEOUT.getCode();
        }

        return exitStatus.getCode();
    }

    /**
     * Run in the configured transport mode.
     *
     * @return exit status
     *
     * @throws ConfigException if a transport setting is bad or the
     *                         broadcast endpoint cannot be bound
     */
    public ExitStatus run()
        throws ConfigException
    {
        ExitStatus status = ExitStatus.STARTUP_FAILURE;
        try {
            final String mode = cfg.getString(MonitorConfig.TRANSPORT_MODE,
                                              LOCAL_MODE);
            if (mode.equalsIgnoreCase(LOCAL_MODE)) {
                status = runLocal();
            } else if (mode.equalsIgnoreCase(SOCKET_MODE)) {
                status = runSocket();
            } else {
                throw new ConfigException("Unknown transport mode \"" +
                                          mode + "\"");
            }

            return status;
        } finally {
            exitStatus = status;
            finished.countDown();
        }
    }

    private Broadcaster openBroadcaster()
        throws ConfigException
    {
        return new ZmqBroadcaster(cfg.getString(MonitorConfig.BROADCAST_ENDPOINT,
                                                DEFAULT_BROADCAST_ENDPOINT));
    }

    /**
     * @return <tt>null</tt> if no responding endpoint is configured
     */
    private Responder openResponder()
        throws ConfigException
    {
        if (!cfg.contains(MonitorConfig.RESPONDING_ENDPOINT)) {
            return null;
        }

        return new ZmqResponder(cfg.getString(MonitorConfig.RESPONDING_ENDPOINT));
    }

    private MonitorCollector createMonitor(Broadcaster bcast, Responder resp)
        throws ConfigException
    {
        MonitorCollector monitor = MonitorCollector.create(cfg, geom, bcast);
        if (resp != null) {
            monitor.setResponder(resp,
                                 cfg.getBoundedInt(MonitorConfig.REQUEST_QUEUE_SIZE,
                                                   MonitorCollector.DEFAULT_REQUEST_QUEUE_SIZE,
                                                   1));
        }
        return monitor;
    }

    /**
     * Run the collector and every worker in this JVM.
     */
    ExitStatus runLocal()
        throws ConfigException
    {
        LocalPool pool =
            new LocalPool(cfg.getBoundedInt(MonitorConfig.POOL_SIZE, 2, 2));

        Broadcaster bcast = openBroadcaster();
        try {
            Responder resp = openResponder();
            try {
                return runLocal(pool, bcast, resp);
            } finally {
                if (resp != null) {
                    resp.close();
                }
            }
        } finally {
            bcast.close();
        }
    }

    /**
     * Run the collector and every worker in this JVM, publishing through
     * <tt>bcast</tt> and answering requests through <tt>resp</tt>
     * (may be <tt>null</tt>).
     */
    ExitStatus runLocal(LocalPool pool, Broadcaster bcast, Responder resp)
        throws ConfigException
    {
        CollectorNode node =
            createCollector(pool.getCollectorTransport(),
                            createMonitor(bcast, resp));

        LOG.info("Running " + (pool.getPoolSize() - 1) +
                 " local workers");
        return pool.run(node, new WorkerFactory() {
                @Override
                public WorkerNode create(Transport transport)
                    throws SourceAccessException
                {
                    return createWorker(transport);
                }
            });
    }

    private ExitStatus runSocket()
        throws ConfigException
    {
        final int poolSize = cfg.getBoundedInt(MonitorConfig.POOL_SIZE, 2, 2);
        final int rank = cfg.getBoundedInt(MonitorConfig.RANK, 0, 0);
        if (rank >= poolSize) {
            throw new ConfigException("Rank " + rank +
                                      " is not in a pool of " + poolSize);
        }

        final InetSocketAddress addr =
            parseAddress(cfg.getString(MonitorConfig.COLLECTOR_ADDRESS,
                                       DEFAULT_COLLECTOR_ADDRESS));
        final long connectMillis =
            cfg.getLong(MonitorConfig.CONNECT_TIMEOUT, DEFAULT_CONNECT_MILLIS);

        if (rank == Transport.COLLECTOR_RANK) {
            return runSocketCollector(addr, poolSize, connectMillis);
        }

        return runSocketWorker(addr, rank, poolSize, connectMillis);
    }

    private ExitStatus runSocketCollector(InetSocketAddress addr,
                                          int poolSize, long connectMillis)
        throws ConfigException
    {
        Broadcaster bcast = openBroadcaster();
        Responder resp = null;
        try {
            resp = openResponder();

            LOG.info("Waiting for " + (poolSize - 1) + " workers on " + addr);

            SocketTransport transport;
            try {
                transport = SocketTransport.listen(addr, poolSize,
                                                   connectMillis);
            } catch (TransportException te) {
                LOG.error("Cannot accept workers", te);
                return ExitStatus.TRANSPORT_FAILURE;
            }

            try {
                return createCollector(transport,
                                       createMonitor(bcast, resp)).run();
            } finally {
                transport.close();
            }
        } finally {
            if (resp != null) {
                resp.close();
            }
            bcast.close();
        }
    }

    private ExitStatus runSocketWorker(InetSocketAddress addr, int rank,
                                       int poolSize, long connectMillis)
    {
        SocketTransport transport;
        try {
            transport = SocketTransport.connect(addr, rank, poolSize,
                                                connectMillis);
        } catch (TransportException te) {
            LOG.error("Rank " + rank + " cannot reach the collector", te);
            return ExitStatus.TRANSPORT_FAILURE;
        }

        try {
            WorkerNode worker;
            try {
                worker = createWorker(transport);
            } catch (SourceAccessException sae) {
                LOG.error("Cannot start rank " + rank, sae);
                try {
                    transport.sendNow(Transport.COLLECTOR_RANK,
                                      Message.end(rank));
                } catch (TransportException te) {
                    LOG.error("Cannot notify collector", te);
                }
                return ExitStatus.STARTUP_FAILURE;
            }

            return worker.run();
        } finally {
            transport.close();
        }
    }

    /**
     * Parse <tt>host:port</tt>.
     */
    static InetSocketAddress parseAddress(String val)
        throws ConfigException
    {
        final int colon = val.lastIndexOf(':');
        if (colon <= 0 || colon == val.length() - 1) {
            throw new ConfigException("Bad collector address \"" + val +
                                      "\", expected host:port");
        }

        final int port;
        try {
            port = Integer.parseInt(val.substring(colon + 1));
        } catch (NumberFormatException nfe) {
            throw new ConfigException("Bad port in collector address \"" +
                                      val + "\"", nfe);
        }
        if (port < 0 || port > 65535) {
            throw new ConfigException("Bad port in collector address \"" +
                                      val + "\"");
        }

        return new InetSocketAddress(val.substring(0, colon), port);
    }

    /**
     * Send log messages to the console unless a log4j configuration file
     * was named with <tt>-Dlog4j.configuration</tt>.
     */
    static void configureLogging()
    {
        final String logCfg = System.getProperty("log4j.configuration");
        if (logCfg != null && new File(logCfg).exists()) {
            PropertyConfigurator.configure(logCfg);
            return;
        }

        ConsoleAppender appender = new ConsoleAppender();
        appender.setWriter(new PrintWriter(System.out));
        appender.setLayout(new PatternLayout("%p[%t] %L - %m%n"));
        appender.setName("console");
        Logger.getRootLogger().addAppender(appender);
        Logger.getRootLogger().setLevel(Level.INFO);
    }

    private static void exit(ExitStatus status)
    {
        System.exit(status.getCode());
    }

    public static void main(String[] args)
    {
        configureLogging();

        if (args.length != 1) {
            System.err.println("usage: java " + MonitorShell.class.getName() +
                               " <monitor.properties>");
            exit(ExitStatus.STARTUP_FAILURE);
            return;
        }

        final MonitorShell shell;
        try {
            shell = new MonitorShell(MonitorConfig.load(new File(args[0])));
        } catch (ConfigException cex) {
            LOG.error("Bad configuration", cex);
            exit(ExitStatus.STARTUP_FAILURE);
            return;
        } catch (GeometryParseException gpe) {
            LOG.error("Bad geometry", gpe);
            exit(ExitStatus.STARTUP_FAILURE);
            return;
        } catch (SourceAccessException sae) {
            LOG.error("Cannot open data source", sae);
            exit(ExitStatus.STARTUP_FAILURE);
            return;
        }

        // System.exit() blocks once shutdown has begun, so the hook ends
        // the process itself with the run's status
        Runtime.getRuntime().addShutdownHook(new Thread("MonitorShutdown") {
                @Override
                public void run()
                {
                    final int code = shell.shutdownAndWait(SHUTDOWN_WAIT_MILLIS);
                    LOG.info("Stopped with exit code " + code);
                    Runtime.getRuntime().halt(code);
                }
            });

        ExitStatus status;
        try {
            status = shell.run();
        } catch (ConfigException cex) {
            LOG.error("Bad configuration", cex);
            status = ExitStatus.STARTUP_FAILURE;
        }

        LOG.info("Exiting with status " + status + " (" + status.getCode() +
                 ")");
        exit(status);
    }
}
