package xray.daq.processing;

/**
 * One worker's analysis result for one detector frame.
 *
 * Instances are built on a worker rank, shipped to the collector and
 * consumed once by the aggregator.  They are never modified after
 * construction.
 */
public final class ProcessedFrame
{
    private final String eventId;
    private final int frameIndex;
    private final double timestamp;
    private final PeakList peaks;
    private final boolean hit;
    private final boolean saturated;
    private final double beamEnergy;
    private final double detectorDistance;

    private final float[] image;
    private final int imageWidth;
    private final int imageHeight;

    private ProcessedFrame(Builder bldr)
    {
        eventId = bldr.eventId;
        frameIndex = bldr.frameIndex;
        timestamp = bldr.timestamp;
        peaks = bldr.peaks;
        hit = bldr.hit;
        saturated = bldr.saturated;
        beamEnergy = bldr.beamEnergy;
        detectorDistance = bldr.detectorDistance;
        image = bldr.image;
        imageWidth = bldr.imageWidth;
        imageHeight = bldr.imageHeight;
    }

    public String getEventId()
    {
        return eventId;
    }

    public int getFrameIndex()
    {
        return frameIndex;
    }

    /**
     * @return event time in seconds since the epoch
     */
    public double getTimestamp()
    {
        return timestamp;
    }

    public PeakList getPeaks()
    {
        return peaks;
    }

    public boolean isHit()
    {
        return hit;
    }

    public boolean isSaturated()
    {
        return saturated;
    }

    /**
     * @return photon energy in eV, or NaN if unknown
     */
    public double getBeamEnergy()
    {
        return beamEnergy;
    }

    /**
     * @return detector distance in metres, or NaN if unknown
     */
    public double getDetectorDistance()
    {
        return detectorDistance;
    }

    public boolean hasImage()
    {
        return image != null;
    }

    /**
     * Corrected slab image, row-major.  Callers must not modify the
     * returned array.
     *
     * @return image data or <tt>null</tt>
     */
    public float[] getImage()
    {
        return image;
    }

    public int getImageWidth()
    {
        return imageWidth;
    }

    public int getImageHeight()
    {
        return imageHeight;
    }

    @Override
    public String toString()
    {
        return "ProcessedFrame[" + eventId + "#" + frameIndex + " " +
            peaks.size() + " peaks" + (hit ? " HIT" : "") +
            (saturated ? " SAT" : "") + (image == null ? "" : " +image") +
            "]";
    }

    public static final class Builder
    {
        private final String eventId;
        private final int frameIndex;
        private double timestamp;
        private PeakList peaks = PeakList.EMPTY;
        private boolean hit;
        private boolean saturated;
        private double beamEnergy = Double.NaN;
        private double detectorDistance = Double.NaN;
        private float[] image;
        private int imageWidth;
        private int imageHeight;

        public Builder(String eventId, int frameIndex)
        {
            if (eventId == null) {
                throw new IllegalArgumentException("Event ID cannot be null");
            }

            this.eventId = eventId;
            this.frameIndex = frameIndex;
        }

        public Builder timestamp(double val)
        {
            timestamp = val;
            return this;
        }

        public Builder peaks(PeakList val)
        {
            if (val == null) {
                throw new IllegalArgumentException("Peak list cannot be" +
                                                   " null");
            }

            peaks = val;
            return this;
        }

        public Builder hit(boolean val)
        {
            hit = val;
            return this;
        }

        public Builder saturated(boolean val)
        {
            saturated = val;
            return this;
        }

        public Builder beamEnergy(double val)
        {
            beamEnergy = val;
            return this;
        }

        public Builder detectorDistance(double val)
        {
            detectorDistance = val;
            return this;
        }

        /**
         * Attach an image.  The array is not copied.
         */
        public Builder image(float[] data, int width, int height)
        {
            if (data != null && data.length != width * height) {
                throw new IllegalArgumentException("Image has " +
                                                   data.length +
                                                   " pixels, expected " +
                                                   width + "x" + height);
            }

            image = data;
            imageWidth = data == null ? 0 : width;
            imageHeight = data == null ? 0 : height;
            return this;
        }

        public ProcessedFrame build()
        {
            return new ProcessedFrame(this);
        }
    }
}
