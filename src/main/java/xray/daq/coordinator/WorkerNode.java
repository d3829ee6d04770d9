package xray.daq.coordinator;

import org.apache.log4j.Logger;

import xray.daq.processing.FrameProcessor;
import xray.daq.processing.GeometryInfo;
import xray.daq.processing.ProcessedFrame;
import xray.daq.source.EventAgeFilter;
import xray.daq.source.EventIterator;
import xray.daq.source.FrameExtractionException;
import xray.daq.source.RawEvent;
import xray.daq.source.SourceAccessException;
import xray.daq.transport.Message;
import xray.daq.transport.MessageKind;
import xray.daq.transport.SendRequest;
import xray.daq.transport.Transport;
import xray.daq.transport.TransportException;

/**
 * Worker rank main loop.  Pulls events from the source, processes each
 * frame and ships the results to the collector.
 *
 * At most one result is in flight at any time: before handing over a new
 * message the worker waits for the previous send to complete.  Before
 * each fetch the worker checks for a TERMINATE request; if one has
 * arrived it drains its last send, acknowledges with TERMINATED and
 * stops without sending END.
 */
public class WorkerNode
{
    private static final Logger LOG = Logger.getLogger(WorkerNode.class);

    private final Transport transport;
    private final EventIterator events;
    private final FrameProcessor processor;
    private final GeometryInfo geom;

    private int framesPerEvent;
    private EventAgeFilter ageFilter;

    private WorkerState state = WorkerState.IDLE;

    private SendRequest outstanding;

    private long numEvents;
    private long numFrames;
    private long numSkipped;

    public WorkerNode(Transport transport, EventIterator events,
                      FrameProcessor processor, GeometryInfo geom)
    {
        if (transport.getRank() == Transport.COLLECTOR_RANK) {
            throw new IllegalArgumentException("Rank " +
                                               Transport.COLLECTOR_RANK +
                                               " is the collector");
        }

        this.transport = transport;
        this.events = events;
        this.processor = processor;
        this.geom = geom;
    }

    /**
     * Only process the last <tt>num</tt> frames of each event.
     *
     * @param num number of frames (0 processes every frame)
     */
    public void setFramesPerEvent(int num)
    {
        if (num < 0) {
            throw new IllegalArgumentException("Bad frame count " + num);
        }

        framesPerEvent = num;
    }

    /**
     * Drop events rejected by this filter.
     */
    public void setAgeFilter(EventAgeFilter filter)
    {
        ageFilter = filter;
    }

    public synchronized WorkerState getState()
    {
        return state;
    }

    private synchronized void setState(WorkerState state)
    {
        this.state = state;
        if (LOG.isDebugEnabled()) {
            LOG.debug("Rank " + transport.getRank() + " is " + state);
        }
    }

    public long getNumEvents()
    {
        return numEvents;
    }

    public long getNumFrames()
    {
        return numFrames;
    }

    /**
     * @return number of events and frames which could not be processed
     */
    public long getNumSkipped()
    {
        return numSkipped;
    }

    /**
     * Wait for the previous message, then start sending this one.
     */
    private void send(Message msg)
        throws TransportException
    {
        if (outstanding != null) {
            outstanding.await();
        }

        outstanding = transport.send(Transport.COLLECTOR_RANK, msg);
    }

    private void drain()
        throws TransportException
    {
        if (outstanding != null) {
            outstanding.await();
            outstanding = null;
        }
    }

    /**
     * Has the collector asked this worker to stop?
     */
    private boolean terminateRequested()
        throws TransportException
    {
        for (Message msg = transport.poll(); msg != null;
             msg = transport.poll())
        {
            if (msg.getKind() == MessageKind.TERMINATE) {
                return true;
            }

            LOG.warn("Rank " + transport.getRank() + " ignoring " + msg);
        }

        return false;
    }

    private void processEvent(RawEvent evt)
        throws TransportException
    {
        final int num = evt.getNumFrames();

        int first = 0;
        if (framesPerEvent > 0 && num > framesPerEvent) {
            first = num - framesPerEvent;
        }

        for (int i = first; i < num; i++) {
            setState(WorkerState.PROCESSING);

            ProcessedFrame frame;
            try {
                frame = processor.process(evt, i, geom);
            } catch (FrameExtractionException fee) {
                LOG.warn("Cannot process frame " + i + " of " +
                         evt.getEventId(), fee);
                numSkipped++;
                continue;
            } catch (RuntimeException rte) {
                LOG.warn("Processing failed for frame " + i + " of " +
                         evt.getEventId(), rte);
                numSkipped++;
                continue;
            }

            setState(WorkerState.SENDING);
            send(Message.result(transport.getRank(), frame));
            numFrames++;
        }
    }

    /**
     * Run until the data is exhausted or the collector asks this worker
     * to stop.
     *
     * @return exit status
     */
    public ExitStatus run()
    {
        final int rank = transport.getRank();

        try {
            while (true) {
                setState(WorkerState.FETCHING);

                if (terminateRequested()) {
                    LOG.info("Rank " + rank + " stopping on request");

                    setState(WorkerState.DRAINING);
                    drain();
                    transport.sendNow(Transport.COLLECTOR_RANK,
                                      Message.terminated(rank));
                    return ExitStatus.CLEAN;
                }

                if (!events.hasNext()) {
                    break;
                }

                RawEvent evt;
                try {
                    evt = events.next();
                } catch (SourceAccessException sae) {
                    LOG.warn("Rank " + rank + " skipping unreadable data",
                             sae);
                    numSkipped++;
                    continue;
                }

                try {
                    if (ageFilter == null || ageFilter.accept(evt)) {
                        numEvents++;
                        processEvent(evt);
                    }
                } finally {
                    evt.close();
                }
            }

            setState(WorkerState.DRAINING);
            send(Message.end(rank));
            drain();

            LOG.info("Rank " + rank + " finished: " + numEvents +
                     " events, " + numFrames + " frames, " + numSkipped +
                     " skipped");
            return ExitStatus.CLEAN;
        } catch (TransportException te) {
            LOG.error("Rank " + rank + " lost contact with the collector",
                      te);
            notifyCollector();
            return ExitStatus.TRANSPORT_FAILURE;
        } finally {
            events.close();
            setState(WorkerState.TERMINATED);
        }
    }

    /**
     * Single synchronous attempt to tell the collector this worker is gone.
     */
    private void notifyCollector()
    {
        try {
            transport.sendNow(Transport.COLLECTOR_RANK,
                              Message.end(transport.getRank()));
        } catch (TransportException te) {
            LOG.error("Cannot notify collector of failure on rank " +
                      transport.getRank(), te);
        }
    }
}
