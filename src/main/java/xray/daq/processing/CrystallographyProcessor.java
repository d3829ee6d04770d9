package xray.daq.processing;

import java.io.File;
import java.io.IOException;

import org.apache.log4j.Logger;

import xray.daq.configuration.ConfigException;
import xray.daq.configuration.MonitorConfig;
import xray.daq.source.FrameExtractionException;
import xray.daq.source.RawEvent;
import xray.daq.source.RawFrameFile;

/**
 * Crystallography frame analysis: dark/gain correction, peak finding
 * and hit classification.
 *
 * A frame is a hit when <tt>minPeaks &lt; n &lt; maxPeaks</tt> and is
 * saturated when more than <tt>maxSaturatedPeaks</tt> peaks exceed the
 * saturation value.  The corrected image is attached to every
 * <tt>hitInterval</tt>-th hit and every <tt>nonHitInterval</tt>-th non-hit;
 * an interval of zero never attaches images.
 *
 * Instances keep per-worker counters and are not thread-safe.
 */
public class CrystallographyProcessor
    implements FrameProcessor
{
    private static final Logger LOG =
        Logger.getLogger(CrystallographyProcessor.class);

    private final PeakFinder peakFinder;
    private final float[] dark;
    private final float[] gain;
    private final int minPeaks;
    private final int maxPeaks;
    private final int maxSaturatedPeaks;
    private final double saturationValue;
    private final int hitInterval;
    private final int nonHitInterval;

    private int hitCounter;
    private int nonHitCounter;

    private CrystallographyProcessor(Builder bldr)
    {
        peakFinder = bldr.peakFinder;
        dark = bldr.dark;
        gain = bldr.gain;
        minPeaks = bldr.minPeaks;
        maxPeaks = bldr.maxPeaks;
        maxSaturatedPeaks = bldr.maxSaturatedPeaks;
        saturationValue = bldr.saturationValue;
        hitInterval = bldr.hitInterval;
        nonHitInterval = bldr.nonHitInterval;
    }

    /**
     * Build a processor from the <tt>processing.*</tt> and frame sending
     * settings.
     *
     * @throws ConfigException if a setting is bad or a correction file
     *                         cannot be read
     */
    public static CrystallographyProcessor create(MonitorConfig cfg,
                                                  GeometryInfo geom)
        throws ConfigException
    {
        return configure(cfg, geom).build();
    }

    /**
     * Read the <tt>processing.*</tt> and frame sending settings into a
     * builder.  Each call to {@link Builder#build()} gives a processor
     * with its own frame sending counters; correction maps are shared.
     *
     * @throws ConfigException if a setting is bad or a correction file
     *                         cannot be read
     */
    public static Builder configure(MonitorConfig cfg, GeometryInfo geom)
        throws ConfigException
    {
        final int pixels = geom.getSlabWidth() * geom.getSlabHeight();

        Builder bldr = new Builder(PeakFinderKind.lookup(cfg.getString(MonitorConfig.PEAK_FINDER,
                                                                       "threshold")).create(cfg));
        if (cfg.contains(MonitorConfig.DARK_FILE)) {
            bldr.dark(readCorrection(cfg.getFile(MonitorConfig.DARK_FILE),
                                     pixels));
        }
        if (cfg.contains(MonitorConfig.GAIN_FILE)) {
            bldr.gain(readCorrection(cfg.getFile(MonitorConfig.GAIN_FILE),
                                     pixels));
        }

        final int minPeaks = cfg.getBoundedInt(MonitorConfig.MIN_PEAKS, 10, 0);
        final int maxPeaks =
            cfg.getBoundedInt(MonitorConfig.MAX_PEAKS, 5000, minPeaks + 1);

        return bldr.peakRange(minPeaks, maxPeaks).
            saturation(cfg.getBoundedInt(MonitorConfig.MAX_SATURATED_PEAKS,
                                         0, 0),
                       cfg.getDouble(MonitorConfig.SATURATION_VALUE,
                                     Double.POSITIVE_INFINITY)).
            frameSending(cfg.getBoundedInt(MonitorConfig.HIT_FRAME_INTERVAL,
                                           0, 0),
                         cfg.getBoundedInt(MonitorConfig.NON_HIT_FRAME_INTERVAL,
                                           0, 0));
    }

    private static float[] readCorrection(File file, int pixels)
        throws ConfigException
    {
        try {
            return RawFrameFile.readSingleFrame(file, pixels);
        } catch (IOException ioe) {
            throw new ConfigException("Cannot read correction file " + file,
                                      ioe);
        }
    }

    /**
     * Should the image for this frame be sent to the collector?
     */
    private boolean shouldSendImage(boolean hit)
    {
        if (hit) {
            if (hitInterval <= 0) {
                return false;
            }

            hitCounter++;
            if (hitCounter < hitInterval) {
                return false;
            }

            hitCounter = 0;
            return true;
        }

        if (nonHitInterval <= 0) {
            return false;
        }

        nonHitCounter++;
        if (nonHitCounter < nonHitInterval) {
            return false;
        }

        nonHitCounter = 0;
        return true;
    }

    @Override
    public ProcessedFrame process(RawEvent evt, int frameIndex,
                                  GeometryInfo geom)
        throws FrameExtractionException
    {
        final int width = geom.getSlabWidth();
        final int height = geom.getSlabHeight();

        float[] data = evt.extractFrame(frameIndex);
        if (data.length != width * height) {
            throw new FrameExtractionException("Frame " + frameIndex +
                                               " of " + evt.getEventId() +
                                               " has " + data.length +
                                               " pixels, expected " +
                                               width + "x" + height);
        }

        if (dark != null || gain != null) {
            for (int i = 0; i < data.length; i++) {
                float val = data[i];
                if (dark != null) {
                    val -= dark[i];
                }
                if (gain != null) {
                    val *= gain[i];
                }
                data[i] = val;
            }
        }

        PeakList peaks =
            peakFinder.findPeaks(data, width, height, geom.getMask());

        final int numPeaks = peaks.size();
        final boolean hit = minPeaks < numPeaks && numPeaks < maxPeaks;

        int numSaturated = 0;
        for (int i = 0; i < numPeaks; i++) {
            if (peaks.getIntensity(i) > saturationValue) {
                numSaturated++;
            }
        }
        final boolean saturated = numSaturated > maxSaturatedPeaks;

        if (LOG.isDebugEnabled()) {
            LOG.debug(evt.getEventId() + "#" + frameIndex + ": " + numPeaks +
                      " peaks, " + numSaturated + " saturated");
        }

        ProcessedFrame.Builder bldr =
            new ProcessedFrame.Builder(evt.getEventId(), frameIndex).
            timestamp(evt.getTimestamp()).
            peaks(hit ? peaks : PeakList.EMPTY).
            hit(hit).
            saturated(saturated).
            beamEnergy(evt.getBeamEnergy()).
            detectorDistance(evt.getDetectorDistance());

        if (shouldSendImage(hit)) {
            bldr.image(data, width, height);
        }

        return bldr.build();
    }

    @Override
    public String toString()
    {
        return "CrystallographyProcessor[peaks " + minPeaks + "-" +
            maxPeaks + ", sat " + maxSaturatedPeaks + ">" + saturationValue +
            (dark == null ? "" : ", dark") + (gain == null ? "" : ", gain") +
            "]";
    }

    public static final class Builder
    {
        private final PeakFinder peakFinder;
        private float[] dark;
        private float[] gain;
        private int minPeaks = 10;
        private int maxPeaks = 5000;
        private int maxSaturatedPeaks;
        private double saturationValue = Double.POSITIVE_INFINITY;
        private int hitInterval;
        private int nonHitInterval;

        public Builder(PeakFinder peakFinder)
        {
            if (peakFinder == null) {
                throw new IllegalArgumentException("Peak finder cannot be" +
                                                   " null");
            }

            this.peakFinder = peakFinder;
        }

        public Builder dark(float[] val)
        {
            dark = val;
            return this;
        }

        public Builder gain(float[] val)
        {
            gain = val;
            return this;
        }

        public Builder peakRange(int min, int max)
        {
            minPeaks = min;
            maxPeaks = max;
            return this;
        }

        public Builder saturation(int maxPeaks, double value)
        {
            maxSaturatedPeaks = maxPeaks;
            saturationValue = value;
            return this;
        }

        public Builder frameSending(int hit, int nonHit)
        {
            hitInterval = hit;
            nonHitInterval = nonHit;
            return this;
        }

        public CrystallographyProcessor build()
        {
            return new CrystallographyProcessor(this);
        }
    }
}
