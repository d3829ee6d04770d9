package xray.daq.processing;

import xray.daq.source.FrameExtractionException;
import xray.daq.source.RawEvent;

/**
 * Per-frame analysis run on a worker rank.
 */
public interface FrameProcessor
{
    /**
     * Analyse one frame of an event.
     *
     * @param evt source event
     * @param frameIndex frame within the event
     * @param geom detector geometry
     *
     * @return analysis result
     *
     * @throws FrameExtractionException if the frame data cannot be used
     */
    ProcessedFrame process(RawEvent evt, int frameIndex, GeometryInfo geom)
        throws FrameExtractionException;
}
