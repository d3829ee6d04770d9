package xray.daq.coordinator;

import xray.daq.processing.ProcessedFrame;

/**
 * Consumer of the results arriving at the collector.  Called from the
 * collector's message loop thread only.
 */
public interface FrameSink
{
    /**
     * Handle one worker result.
     *
     * @param source rank which produced the frame
     * @param frame result
     */
    void frameReceived(int source, ProcessedFrame frame);

    /**
     * Every worker has finished its share of the data.
     */
    void endOfStream();
}
