package xray.daq.source;

/**
 * One detector event as delivered by a data source.  An event holds one
 * or more frames of slab data.
 */
public interface RawEvent
{
    /**
     * @return identifier used in log messages and broadcasts
     */
    String getEventId();

    /**
     * @return event time in seconds since the epoch
     */
    double getTimestamp();

    int getNumFrames();

    /**
     * Read one frame as row-major slab data.
     *
     * @param index frame number
     *
     * @return pixel values
     *
     * @throws FrameExtractionException if the frame cannot be read
     */
    float[] extractFrame(int index)
        throws FrameExtractionException;

    /**
     * @return photon energy in eV, or NaN if unknown
     */
    double getBeamEnergy();

    /**
     * @return detector distance in metres, or NaN if unknown
     */
    double getDetectorDistance();

    /**
     * Release any resources held by this event.
     */
    void close();
}
