package xray.daq.processing;

import java.util.Properties;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.varia.NullAppender;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import xray.daq.configuration.ConfigException;
import xray.daq.configuration.MonitorConfig;
import xray.daq.geometry.GeometryLoader;
import xray.daq.geometry.GeometryParseException;
import xray.daq.source.FrameExtractionException;
import xray.daq.source.RawEvent;

import static org.junit.Assert.*;

public class CrystallographyProcessorTest
{
    private static final int WIDTH = ThresholdPeakFinderTest.WIDTH;

    /**
     * Event holding one frame with a fixed number of spots.
     */
    static class SpotEvent
        implements RawEvent
    {
        private final int numSpots;
        private final float height;
        private final int numPixels;

        SpotEvent(int numSpots, float height, int numPixels)
        {
            this.numSpots = numSpots;
            this.height = height;
            this.numPixels = numPixels;
        }

        @Override
        public String getEventId()
        {
            return "spots" + numSpots;
        }

        @Override
        public double getTimestamp()
        {
            return 12.5;
        }

        @Override
        public int getNumFrames()
        {
            return 1;
        }

        @Override
        public float[] extractFrame(int index)
        {
            float[] data = new float[numPixels];
            for (int i = 0; i < numSpots; i++) {
                // spots on every other pixel of even rows stay separate
                final int fs = (i % 5) * 2;
                final int ss = (i / 5) * 2;
                data[ss * WIDTH + fs] = height;
            }
            return data;
        }

        @Override
        public double getBeamEnergy()
        {
            return 9300.0;
        }

        @Override
        public double getDetectorDistance()
        {
            return 0.1;
        }

        @Override
        public void close()
        {
        }
    }

    private GeometryInfo geom;

    @Before
    public void setUp()
        throws GeometryParseException
    {
        BasicConfigurator.resetConfiguration();
        BasicConfigurator.configure(new NullAppender());

        geom = GeometryInfo.from(GeometryLoader.parse(ThresholdPeakFinderTest.GEOMETRY));
    }

    @After
    public void tearDown()
    {
        BasicConfigurator.resetConfiguration();
    }

    private static CrystallographyProcessor.Builder builder()
    {
        return new CrystallographyProcessor.Builder(new ThresholdPeakFinder(100.0,
                                                                            0));
    }

    @Test
    public void testHitRange()
        throws FrameExtractionException
    {
        CrystallographyProcessor proc = builder().peakRange(2, 6).build();

        assertFalse(proc.process(new SpotEvent(2, 500.0F, 100), 0,
                                 geom).isHit());
        assertTrue(proc.process(new SpotEvent(3, 500.0F, 100), 0,
                                geom).isHit());
        assertTrue(proc.process(new SpotEvent(5, 500.0F, 100), 0,
                                geom).isHit());
        assertFalse(proc.process(new SpotEvent(6, 500.0F, 100), 0,
                                 geom).isHit());
    }

    @Test
    public void testResultFields()
        throws FrameExtractionException
    {
        ProcessedFrame frame =
            builder().peakRange(0, 100).build().process(new SpotEvent(4,
                                                                      500.0F,
                                                                      100),
                                                        0, geom);

        assertEquals("spots4", frame.getEventId());
        assertEquals(0, frame.getFrameIndex());
        assertEquals(12.5, frame.getTimestamp(), 0.0);
        assertEquals(4, frame.getPeaks().size());
        assertEquals(9300.0, frame.getBeamEnergy(), 0.0);
        assertEquals(0.1, frame.getDetectorDistance(), 0.0);
        assertFalse(frame.hasImage());
    }

    @Test
    public void testPeaksOnlySentForHits()
        throws FrameExtractionException
    {
        CrystallographyProcessor proc =
            builder().peakRange(3, 5).saturation(1, 1000.0).build();

        ProcessedFrame tooFew =
            proc.process(new SpotEvent(2, 2000.0F, 100), 0, geom);
        assertFalse(tooFew.isHit());
        assertTrue(tooFew.getPeaks().isEmpty());
        assertTrue(tooFew.isSaturated());

        ProcessedFrame tooMany =
            proc.process(new SpotEvent(7, 500.0F, 100), 0, geom);
        assertFalse(tooMany.isHit());
        assertTrue(tooMany.getPeaks().isEmpty());

        ProcessedFrame hit =
            proc.process(new SpotEvent(4, 500.0F, 100), 0, geom);
        assertTrue(hit.isHit());
        assertEquals(4, hit.getPeaks().size());
    }

    @Test
    public void testSaturation()
        throws FrameExtractionException
    {
        CrystallographyProcessor proc =
            builder().peakRange(0, 100).saturation(2, 1000.0).build();

        assertFalse(proc.process(new SpotEvent(2, 2000.0F, 100), 0,
                                 geom).isSaturated());
        assertTrue(proc.process(new SpotEvent(3, 2000.0F, 100), 0,
                                geom).isSaturated());
        assertFalse(proc.process(new SpotEvent(8, 900.0F, 100), 0,
                                 geom).isSaturated());
    }

    @Test
    public void testDarkAndGain()
        throws FrameExtractionException
    {
        float[] dark = new float[100];
        float[] gain = new float[100];
        for (int i = 0; i < 100; i++) {
            dark[i] = 300.0F;
            gain[i] = 2.0F;
        }

        ProcessedFrame frame = builder().peakRange(0, 100).dark(dark).
            gain(gain).frameSending(1, 1).build().
            process(new SpotEvent(1, 500.0F, 100), 0, geom);

        assertEquals(1, frame.getPeaks().size());
        assertEquals(400.0, frame.getPeaks().getIntensity(0), 0.0);
        assertTrue(frame.hasImage());
        assertEquals(-600.0F, frame.getImage()[99], 0.0F);
    }

    @Test
    public void testFrameSendingIntervals()
        throws FrameExtractionException
    {
        CrystallographyProcessor proc =
            builder().peakRange(0, 100).frameSending(3, 0).build();

        int hitImages = 0;
        int missImages = 0;
        for (int i = 0; i < 9; i++) {
            if (proc.process(new SpotEvent(2, 500.0F, 100), 0,
                             geom).hasImage())
            {
                hitImages++;
            }
            if (proc.process(new SpotEvent(0, 500.0F, 100), 0,
                             geom).hasImage())
            {
                missImages++;
            }
        }

        assertEquals(3, hitImages);
        assertEquals(0, missImages);
    }

    @Test
    public void testWrongFrameSize()
    {
        try {
            builder().build().process(new SpotEvent(1, 500.0F, 99), 0, geom);
            fail("Short frame should be rejected");
        } catch (FrameExtractionException fee) {
            assertTrue(fee.getMessage().contains("99 pixels"));
        }
    }

    @Test
    public void testCreateFromConfig()
        throws ConfigException, FrameExtractionException
    {
        MonitorConfig cfg = new MonitorConfig(new Properties()).
            with(MonitorConfig.PEAK_FINDER, "None").
            with(MonitorConfig.MIN_PEAKS, "-1").
            with(MonitorConfig.MAX_PEAKS, "5");

        try {
            CrystallographyProcessor.create(cfg, geom);
            fail("Negative minimum should be rejected");
        } catch (ConfigException ce) {
            assertTrue(ce.getMessage().contains(MonitorConfig.MIN_PEAKS));
        }

        CrystallographyProcessor proc =
            CrystallographyProcessor.create(cfg.with(MonitorConfig.MIN_PEAKS,
                                                     "1"),
                                            geom);
        assertEquals(0, proc.process(new SpotEvent(4, 500.0F, 100), 0,
                                     geom).getPeaks().size());

        try {
            CrystallographyProcessor.create(cfg.with(MonitorConfig.PEAK_FINDER,
                                                     "magic"), geom);
            fail("Unknown peak finder should be rejected");
        } catch (ConfigException ce) {
            assertTrue(ce.getMessage().contains("magic"));
        }
    }
}
