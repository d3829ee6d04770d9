package xray.daq.source;

import cern.jet.random.Poisson;
import cern.jet.random.Uniform;
import cern.jet.random.engine.MersenneTwister;
import cern.jet.random.engine.RandomEngine;

import java.util.NoSuchElementException;

import org.apache.log4j.Logger;

/**
 * Generated events for dry runs.  Each frame holds Poisson background
 * noise; "hit" events also carry a Poisson-distributed number of bright
 * spots.  Frames are generated on demand from a per-event seed, so the
 * same configuration always produces the same data.
 */
public class SyntheticEventSource
    implements EventSource
{
    private static final Logger LOG =
        Logger.getLogger(SyntheticEventSource.class);

    /** Mean background count per pixel */
    public static final double BACKGROUND = 2.0;
    /** Peak height above background */
    public static final float PEAK_HEIGHT = 1000.0F;

    private final int slabWidth;
    private final int slabHeight;
    private final int numEvents;
    private final int framesPerEvent;
    private final double hitFraction;
    private final double meanPeaks;
    private final int seed;
    private final double beamEnergy;
    private final double detectorDistance;

    /**
     * @param slabWidth slab width in pixels
     * @param slabHeight slab height in pixels
     * @param numEvents total number of events across all workers
     * @param framesPerEvent frames in each event
     * @param hitFraction probability that an event is a hit
     * @param meanPeaks mean number of spots in a hit frame
     * @param seed random seed
     * @param beamEnergy photon energy in eV (NaN if unknown)
     * @param detectorDistance detector distance in metres (NaN if unknown)
     */
    public SyntheticEventSource(int slabWidth, int slabHeight, int numEvents,
                                int framesPerEvent, double hitFraction,
                                double meanPeaks, int seed,
                                double beamEnergy, double detectorDistance)
    {
        if (slabWidth <= 0 || slabHeight <= 0) {
            throw new IllegalArgumentException("Bad slab size " + slabWidth +
                                               "x" + slabHeight);
        }
        if (framesPerEvent < 1) {
            throw new IllegalArgumentException("Events need at least one" +
                                               " frame");
        }

        this.slabWidth = slabWidth;
        this.slabHeight = slabHeight;
        this.numEvents = numEvents;
        this.framesPerEvent = framesPerEvent;
        this.hitFraction = hitFraction;
        this.meanPeaks = meanPeaks;
        this.seed = seed;
        this.beamEnergy = beamEnergy;
        this.detectorDistance = detectorDistance;
    }

    @Override
    public EventIterator open(int rank, int poolSize)
    {
        WorkPartition part = WorkPartition.forRank(numEvents, rank, poolSize);
        if (LOG.isInfoEnabled()) {
            LOG.info("Rank " + rank + " generates events " + part);
        }

        return new SyntheticIterator(rank, part);
    }

    /**
     * Is event <tt>num</tt> generated as a hit?
     */
    boolean isHitEvent(int num)
    {
        RandomEngine rand = new MersenneTwister(eventSeed(num));
        return rand.nextDouble() < hitFraction;
    }

    private int eventSeed(int num)
    {
        return seed * 31 + num;
    }

    float[] generateFrame(int eventNum, int frameIndex)
    {
        RandomEngine rand =
            new MersenneTwister(eventSeed(eventNum) * 17 + frameIndex + 1);
        final boolean hit = isHitEvent(eventNum);

        Poisson noise = new Poisson(BACKGROUND, rand);

        float[] data = new float[slabWidth * slabHeight];
        for (int i = 0; i < data.length; i++) {
            data[i] = noise.nextInt();
        }

        if (hit && meanPeaks > 0.0) {
            Poisson peakCount = new Poisson(meanPeaks, rand);
            Uniform uniform = new Uniform(rand);

            final int numPeaks = Math.max(1, peakCount.nextInt());
            for (int p = 0; p < numPeaks; p++) {
                final int fs = uniform.nextIntFromTo(0, slabWidth - 1);
                final int ss = uniform.nextIntFromTo(0, slabHeight - 1);
                addSpot(data, fs, ss);
            }
        }

        return data;
    }

    private void addSpot(float[] data, int fs, int ss)
    {
        data[ss * slabWidth + fs] += PEAK_HEIGHT;

        final float wing = PEAK_HEIGHT / 4.0F;
        if (fs > 0) {
            data[ss * slabWidth + fs - 1] += wing;
        }
        if (fs < slabWidth - 1) {
            data[ss * slabWidth + fs + 1] += wing;
        }
        if (ss > 0) {
            data[(ss - 1) * slabWidth + fs] += wing;
        }
        if (ss < slabHeight - 1) {
            data[(ss + 1) * slabWidth + fs] += wing;
        }
    }

    class SyntheticIterator
        implements EventIterator
    {
        private final int rank;
        private final int end;
        private int next;

        SyntheticIterator(int rank, WorkPartition part)
        {
            this.rank = rank;
            this.next = part.getStart();
            this.end = part.getEnd();
        }

        @Override
        public boolean hasNext()
        {
            return next < end;
        }

        @Override
        public RawEvent next()
        {
            if (!hasNext()) {
                throw new NoSuchElementException("No more synthetic events");
            }

            return new SyntheticEvent(rank, next++,
                                      System.currentTimeMillis() / 1000.0);
        }

        @Override
        public void close()
        {
            next = end;
        }
    }

    class SyntheticEvent
        implements RawEvent
    {
        private final int rank;
        private final int num;
        private final double timestamp;

        SyntheticEvent(int rank, int num, double timestamp)
        {
            this.rank = rank;
            this.num = num;
            this.timestamp = timestamp;
        }

        @Override
        public String getEventId()
        {
            return String.format("synthetic-%d-%06d", rank, num);
        }

        @Override
        public double getTimestamp()
        {
            return timestamp;
        }

        @Override
        public int getNumFrames()
        {
            return framesPerEvent;
        }

        @Override
        public float[] extractFrame(int index)
            throws FrameExtractionException
        {
            if (index < 0 || index >= framesPerEvent) {
                throw new FrameExtractionException("Event " + getEventId() +
                                                   " has no frame " + index);
            }

            return generateFrame(num, index);
        }

        @Override
        public double getBeamEnergy()
        {
            return beamEnergy;
        }

        @Override
        public double getDetectorDistance()
        {
            return detectorDistance;
        }

        @Override
        public void close()
        {
            // nothing to release
        }
    }
}
