package xray.daq.monitoring;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import xray.daq.geometry.Panel;
import xray.daq.geometry.VisualizationPixelMaps;
import xray.daq.processing.GeometryInfo;
import xray.daq.processing.PeakList;
import xray.daq.processing.ProcessedFrame;
import xray.daq.util.RollingWindow;

/**
 * Running statistics over the frames received by the collector.
 *
 * Keeps hit and saturation rates over a rolling window, a virtual powder
 * pattern accumulated from the peaks of every hit, the peaks of the latest
 * hit with peaks, the latest detector image, and the resolution rings for
 * the latest beam parameters.  Images are laid out in visualization
 * coordinates.  Peaks of non-hit frames are ignored.
 *
 * Used only from the collector's message loop; not thread-safe.
 */
public class Aggregator
{
    private static final Logger LOG = Logger.getLogger(Aggregator.class);

    public static final int DEFAULT_WINDOW_SIZE = 10000;
    public static final int HISTORY_SIZE = 5000;

    private final int slabWidth;
    private final int slabHeight;
    private final VisualizationPixelMaps visualMaps;
    private final double pixelsPerMetre;
    private final double coffset;
    private final List<Double> ringResolutions;

    private final RollingWindow<Double> hitWindow;
    private final RollingWindow<Double> saturationWindow;
    private final RollingWindow<Double> hitRateHistory;
    private final RollingWindow<Double> timestampHistory;

    private final float[] powderImage;
    private final float[] eventImage;
    private final float[] frameImage;

    private final ArrayList<Integer> peakXInFrame = new ArrayList<Integer>();
    private final ArrayList<Integer> peakYInFrame = new ArrayList<Integer>();

    private long numEvents;
    private long numHits;
    private long numSaturated;
    private long numPeaksOutsideSlab;

    private double timestamp = Double.NaN;
    private double beamEnergy = Double.NaN;
    private double detectorDistance = Double.NaN;
    private ResolutionRings rings = ResolutionRings.UNAVAILABLE;

    /**
     * @param geom detector geometry
     * @param windowSize number of frames in the rate averages
     * @param ringResolutions resolution ring sizes in Angstrom
     */
    public Aggregator(GeometryInfo geom, int windowSize,
                      List<Double> ringResolutions)
    {
        slabWidth = geom.getSlabWidth();
        slabHeight = geom.getSlabHeight();
        visualMaps = geom.getVisualizationMaps();

        Panel first = geom.getDetector().getFirstPanel();
        pixelsPerMetre = first.getResolution();
        coffset = first.getCameraLengthOffset();

        this.ringResolutions =
            Collections.unmodifiableList(new ArrayList<Double>(ringResolutions));

        hitWindow = new RollingWindow<Double>(windowSize);
        saturationWindow = new RollingWindow<Double>(windowSize);
        hitRateHistory = new RollingWindow<Double>(HISTORY_SIZE);
        timestampHistory = new RollingWindow<Double>(HISTORY_SIZE);

        final int visSize = visualMaps.getHeight() * visualMaps.getWidth();
        powderImage = new float[visSize];
        eventImage = new float[visSize];
        frameImage = new float[visSize];
    }

    /**
     * Add one frame to the statistics.
     */
    public void ingest(ProcessedFrame frame)
    {
        numEvents++;
        if (frame.isHit()) {
            numHits++;
        }
        if (frame.isSaturated()) {
            numSaturated++;
        }

        hitWindow.push(frame.isHit() ? 1.0 : 0.0);
        saturationWindow.push(frame.isSaturated() ? 1.0 : 0.0);

        timestamp = frame.getTimestamp();
        hitRateHistory.push(hitWindow.getAverage() * 100.0);
        timestampHistory.push(Double.isNaN(timestamp) ? 0.0 : timestamp);

        peakXInFrame.clear();
        peakYInFrame.clear();
        if (frame.isHit()) {
            scatterPeaks(frame.getPeaks());
        }

        if (frame.hasImage()) {
            scatterImage(frame);
        }

        updateRings(frame.getBeamEnergy(), frame.getDetectorDistance());
    }

    private void scatterPeaks(PeakList peaks)
    {
        if (peaks.isEmpty()) {
            return;
        }

        Arrays.fill(eventImage, 0.0F);

        for (int i = 0; i < peaks.size(); i++) {
            final long fs = Math.round(peaks.getFs(i));
            final long ss = Math.round(peaks.getSs(i));
            if (fs < 0 || fs >= slabWidth || ss < 0 || ss >= slabHeight) {
                numPeaksOutsideSlab++;
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Peak at fs " + peaks.getFs(i) + ", ss " +
                              peaks.getSs(i) + " is outside the slab");
                }
                continue;
            }

            final int slabIdx = (int) (ss * slabWidth + fs);
            final int x = visualMaps.getX(slabIdx);
            final int y = visualMaps.getY(slabIdx);
            final int visIdx = y * visualMaps.getWidth() + x;

            final float intensity = (float) peaks.getIntensity(i);
            eventImage[visIdx] += intensity;
            powderImage[visIdx] += intensity;

            peakXInFrame.add(x);
            peakYInFrame.add(y);
        }
    }

    private void scatterImage(ProcessedFrame frame)
    {
        float[] image = frame.getImage();
        if (frame.getImageWidth() != slabWidth ||
            frame.getImageHeight() != slabHeight)
        {
            LOG.warn("Ignoring " + frame.getImageWidth() + "x" +
                     frame.getImageHeight() + " image from " +
                     frame.getEventId() + "; slab is " + slabWidth + "x" +
                     slabHeight);
            return;
        }

        final int visWidth = visualMaps.getWidth();
        for (int i = 0; i < image.length; i++) {
            frameImage[visualMaps.getY(i) * visWidth + visualMaps.getX(i)] =
                image[i];
        }
    }

    private void updateRings(double energy, double distance)
    {
        beamEnergy = energy;
        detectorDistance = distance;

        rings = ResolutionRings.compute(ringResolutions, energy, distance,
                                        pixelsPerMetre, coffset);
    }

    /**
     * Forget everything seen so far.
     */
    public void reset()
    {
        numEvents = 0;
        numHits = 0;
        numSaturated = 0;
        numPeaksOutsideSlab = 0;

        hitWindow.clear();
        saturationWindow.clear();
        hitRateHistory.clear();
        timestampHistory.clear();

        Arrays.fill(powderImage, 0.0F);
        Arrays.fill(eventImage, 0.0F);
        Arrays.fill(frameImage, 0.0F);
        peakXInFrame.clear();
        peakYInFrame.clear();

        timestamp = Double.NaN;
        beamEnergy = Double.NaN;
        detectorDistance = Double.NaN;
        rings = ResolutionRings.UNAVAILABLE;
    }

    public long getNumEvents()
    {
        return numEvents;
    }

    public long getNumHits()
    {
        return numHits;
    }

    public long getNumSaturated()
    {
        return numSaturated;
    }

    /**
     * @return peaks dropped because they fell outside the slab
     */
    public long getNumPeaksOutsideSlab()
    {
        return numPeaksOutsideSlab;
    }

    /**
     * @return fraction of hits in the rolling window
     */
    public double getHitRate()
    {
        return hitWindow.getAverage();
    }

    /**
     * @return fraction of saturated frames in the rolling window
     */
    public double getSaturationRate()
    {
        return saturationWindow.getAverage();
    }

    public int getWindowSize()
    {
        return hitWindow.capacity();
    }

    public ResolutionRings getRings()
    {
        return rings;
    }

    /**
     * @return hit rate percentages for the most recent frames, oldest first
     */
    public List<Double> getHitRateHistory()
    {
        return hitRateHistory.toList();
    }

    /**
     * @return timestamps matching {@link #getHitRateHistory()}
     */
    public List<Double> getTimestampHistory()
    {
        return timestampHistory.toList();
    }

    /**
     * @return visualization x of the peaks in the most recent frame
     */
    public List<Integer> getPeakXInFrame()
    {
        return new ArrayList<Integer>(peakXInFrame);
    }

    public List<Integer> getPeakYInFrame()
    {
        return new ArrayList<Integer>(peakYInFrame);
    }

    public float[][] getPowderImage()
    {
        return toRows(powderImage);
    }

    public float[][] getEventImage()
    {
        return toRows(eventImage);
    }

    public float[][] getFrameImage()
    {
        return toRows(frameImage);
    }

    /**
     * Read one pixel of the virtual powder pattern.
     */
    public float getPowderValue(int x, int y)
    {
        return powderImage[y * visualMaps.getWidth() + x];
    }

    private float[][] toRows(float[] image)
    {
        final int width = visualMaps.getWidth();

        float[][] rows = new float[visualMaps.getHeight()][];
        for (int y = 0; y < rows.length; y++) {
            rows[y] = Arrays.copyOfRange(image, y * width, (y + 1) * width);
        }
        return rows;
    }

    /**
     * Capture the current statistics.
     */
    public AggregatorSnapshot snapshot()
    {
        return new AggregatorSnapshot(this, timestamp, beamEnergy,
                                      detectorDistance, pixelsPerMetre,
                                      coffset);
    }
}
