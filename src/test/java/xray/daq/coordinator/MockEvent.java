package xray.daq.coordinator;

import xray.daq.source.RawEvent;

/**
 * Event with tiny empty frames.
 */
class MockEvent
    implements RawEvent
{
    private final String id;
    private final int numFrames;
    private final double timestamp;

    private boolean closed;

    MockEvent(String id, int numFrames)
    {
        this(id, numFrames, System.currentTimeMillis() / 1000.0);
    }

    MockEvent(String id, int numFrames, double timestamp)
    {
        this.id = id;
        this.numFrames = numFrames;
        this.timestamp = timestamp;
    }

    boolean isClosed()
    {
        return closed;
    }

    @Override
    public String getEventId()
    {
        return id;
    }

    @Override
    public double getTimestamp()
    {
        return timestamp;
    }

    @Override
    public int getNumFrames()
    {
        return numFrames;
    }

    @Override
    public float[] extractFrame(int index)
    {
        return new float[4];
    }

    @Override
    public double getBeamEnergy()
    {
        return Double.NaN;
    }

    @Override
    public double getDetectorDistance()
    {
        return Double.NaN;
    }

    @Override
    public void close()
    {
        closed = true;
    }
}
