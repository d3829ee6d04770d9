package xray.daq.monitoring;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import xray.daq.configuration.ConfigException;
import xray.daq.configuration.MonitorConfig;
import xray.daq.coordinator.FrameSink;
import xray.daq.processing.GeometryInfo;
import xray.daq.processing.PeakList;
import xray.daq.processing.ProcessedFrame;

/**
 * Collector-side consumer: feeds every result to the {@link Aggregator}
 * and publishes snapshots at a fixed event interval.  Frames carrying an
 * image are published as soon as they arrive.
 *
 * If a {@link Responder} is attached, external requests are read as each
 * frame arrives and queued.  A <tt>next</tt> request is answered with the
 * next hit; <tt>reset</tt> clears the statistics.
 */
public class MonitorCollector
    implements FrameSink
{
    private static final Logger LOG =
        Logger.getLogger(MonitorCollector.class);

    public static final String SNAPSHOT_TOPIC = "snapshot";
    public static final String FRAME_TOPIC = "frame";

    public static final int DEFAULT_REQUEST_QUEUE_SIZE = 20;

    private final Aggregator aggregator;
    private final Broadcaster broadcaster;
    private final int broadcastInterval;
    private final int speedReportInterval;

    private Responder responder;
    private final ArrayDeque<ExternalRequest> requests =
        new ArrayDeque<ExternalRequest>();
    private int requestQueueSize = DEFAULT_REQUEST_QUEUE_SIZE;

    private final long startTime;
    private long lastReportTime;
    private long numReceived;

    /**
     * @param aggregator statistics
     * @param broadcaster publisher
     * @param broadcastInterval events between snapshots
     * @param speedReportInterval events between rate log messages
     *                            (0 disables the report)
     */
    public MonitorCollector(Aggregator aggregator, Broadcaster broadcaster,
                            int broadcastInterval, int speedReportInterval)
    {
        if (broadcastInterval < 1) {
            throw new IllegalArgumentException("Bad broadcast interval " +
                                               broadcastInterval);
        }

        this.aggregator = aggregator;
        this.broadcaster = broadcaster;
        this.broadcastInterval = broadcastInterval;
        this.speedReportInterval = speedReportInterval;

        startTime = System.currentTimeMillis();
        lastReportTime = startTime;
    }

    /**
     * Build a collector from the monitoring settings.
     */
    public static MonitorCollector create(MonitorConfig cfg,
                                          GeometryInfo geom,
                                          Broadcaster broadcaster)
        throws ConfigException
    {
        final int window =
            cfg.getBoundedInt(MonitorConfig.WINDOW_SIZE,
                              Aggregator.DEFAULT_WINDOW_SIZE, 1);
        final List<Double> rings =
            cfg.getDoubleList(MonitorConfig.RESOLUTION_RINGS,
                              Arrays.asList(10.0, 9.0, 8.0, 7.0,
                                                      6.0, 5.0, 4.0, 3.0));

        return new MonitorCollector(new Aggregator(geom, window, rings),
                                    broadcaster,
                                    cfg.getBoundedInt(MonitorConfig.BROADCAST_INTERVAL,
                                                      10, 1),
                                    cfg.getBoundedInt(MonitorConfig.SPEED_REPORT_INTERVAL,
                                                      1000, 0));
    }

    /**
     * Answer external requests.
     *
     * @param responder request socket
     * @param queueSize maximum number of waiting requests; the oldest
     *                  request is dropped when a new one arrives
     */
    public void setResponder(Responder responder, int queueSize)
    {
        if (queueSize < 1) {
            throw new IllegalArgumentException("Bad request queue size " +
                                               queueSize);
        }

        this.responder = responder;
        requestQueueSize = queueSize;
    }

    public int getNumWaitingRequests()
    {
        return requests.size();
    }

    public Aggregator getAggregator()
    {
        return aggregator;
    }

    public long getNumReceived()
    {
        return numReceived;
    }

    @Override
    public void frameReceived(int source, ProcessedFrame frame)
    {
        if (responder != null) {
            answerRequests(source, frame);
        }

        aggregator.ingest(frame);
        numReceived++;

        if (numReceived % broadcastInterval == 0) {
            broadcaster.publish(SNAPSHOT_TOPIC, aggregator.snapshot().toMap());
        }

        if (frame.hasImage()) {
            broadcaster.publish(FRAME_TOPIC, frameMessage(source, frame));
        }

        if (speedReportInterval > 0 && numReceived % speedReportInterval == 0)
        {
            reportSpeed();
        }
    }

    private void answerRequests(int source, ProcessedFrame frame)
    {
        ExternalRequest req;
        while ((req = responder.poll()) != null) {
            if (requests.size() >= requestQueueSize) {
                LOG.warn("Request queue is full; dropping " +
                         requests.removeFirst());
            }
            requests.addLast(req);
        }

        while (!requests.isEmpty()) {
            ExternalRequest first = requests.peekFirst();
            final String cmd = first.getCommand();

            if (cmd.equals(ExternalRequest.NEXT)) {
                if (!frame.isHit()) {
                    break;
                }

                responder.reply(first, hitMessage(source, frame));
                requests.removeFirst();

                // one hit per frame
                break;
            } else if (cmd.equals(ExternalRequest.RESET)) {
                aggregator.reset();
                LOG.info("Statistics reset by external request");

                responder.reply(first, statusMessage(cmd, "ok"));
            } else {
                LOG.warn("Could not understand request \"" + cmd + "\"");

                responder.reply(first, statusMessage(cmd, "unknown request"));
            }

            requests.removeFirst();
        }
    }

    private static Map<String, Object> hitMessage(int source,
                                                  ProcessedFrame frame)
    {
        PeakList peaks = frame.getPeaks();

        LinkedHashMap<String, Object> peakMap =
            new LinkedHashMap<String, Object>();
        peakMap.put("fs", peaks.toFsArray());
        peakMap.put("ss", peaks.toSsArray());
        peakMap.put("intensity", peaks.toIntensityArray());

        LinkedHashMap<String, Object> map =
            new LinkedHashMap<String, Object>();
        map.put("event_id", frame.getEventId());
        map.put("frame_id", frame.getFrameIndex());
        map.put("source_rank", source);
        map.put("timestamp",
                AggregatorSnapshot.finiteOrNull(frame.getTimestamp()));
        map.put("beam_energy",
                AggregatorSnapshot.finiteOrNull(frame.getBeamEnergy()));
        map.put("detector_distance",
                AggregatorSnapshot.finiteOrNull(frame.getDetectorDistance()));
        map.put("peak_list", peakMap);
        return map;
    }

    private static Map<String, Object> statusMessage(String request,
                                                     String status)
    {
        LinkedHashMap<String, Object> map =
            new LinkedHashMap<String, Object>();
        map.put("request", request);
        map.put("status", status);
        return map;
    }

    private Map<String, Object> frameMessage(int source, ProcessedFrame frame)
    {
        LinkedHashMap<String, Object> map =
            new LinkedHashMap<String, Object>();
        map.put("event_id", frame.getEventId());
        map.put("frame_id", frame.getFrameIndex());
        map.put("source_rank", source);
        map.put("timestamp", frame.getTimestamp());
        map.put("hit", frame.isHit());
        map.put("frame_data", aggregator.getFrameImage());
        map.put("peak_list_x_in_frame", aggregator.getPeakXInFrame());
        map.put("peak_list_y_in_frame", aggregator.getPeakYInFrame());
        return map;
    }

    private void reportSpeed()
    {
        final long now = System.currentTimeMillis();
        final double secs = (now - lastReportTime) / 1000.0;
        lastReportTime = now;

        if (LOG.isInfoEnabled()) {
            LOG.info(String.format("Processed: %d in %.2f seconds (%.3f Hz)",
                                   numReceived, secs,
                                   secs > 0.0 ? speedReportInterval / secs :
                                   0.0));
        }
    }

    @Override
    public void endOfStream()
    {
        broadcaster.publish(SNAPSHOT_TOPIC, aggregator.snapshot().toMap());

        final double secs = (System.currentTimeMillis() - startTime) / 1000.0;
        LOG.info(String.format("Processing finished: %d frames, %d hits," +
                               " %d saturated in %.1f seconds",
                               aggregator.getNumEvents(),
                               aggregator.getNumHits(),
                               aggregator.getNumSaturated(), secs));
    }
}
