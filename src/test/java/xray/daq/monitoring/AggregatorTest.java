package xray.daq.monitoring;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Level;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import xray.daq.common.MockAppender;
import xray.daq.geometry.GeometryLoader;
import xray.daq.geometry.GeometryParseException;
import xray.daq.processing.GeometryInfo;
import xray.daq.processing.PeakList;
import xray.daq.processing.ProcessedFrame;

import static org.junit.Assert.*;

public class AggregatorTest
{
    /** 10x10 panel centred on the beam; visualization (x,y) = (fs,ss) */
    static final String GEOMETRY =
        "res = 10000\n" +
        "clen = 0.1\n" +
        "adu_per_photon = 1\n" +
        "p0/min_fs = 0\n" +
        "p0/max_fs = 9\n" +
        "p0/min_ss = 0\n" +
        "p0/max_ss = 9\n" +
        "p0/corner_x = -5\n" +
        "p0/corner_y = -5\n" +
        "p0/fs = +x\n" +
        "p0/ss = +y\n";

    static final double ONE_ANGSTROM_EV = 12398.42;

    private static final List<Double> RINGS = Arrays.asList(2.0, 1.0);

    private MockAppender appender;
    private GeometryInfo geom;
    private int frameNum;

    @Before
    public void setUp()
        throws GeometryParseException
    {
        appender = new MockAppender(Level.WARN);

        BasicConfigurator.resetConfiguration();
        BasicConfigurator.configure(appender);

        geom = GeometryInfo.from(GeometryLoader.parse(GEOMETRY));
    }

    @After
    public void tearDown()
    {
        appender.assertNoLogMessages();
        BasicConfigurator.resetConfiguration();
    }

    private ProcessedFrame.Builder frame(boolean hit)
    {
        return new ProcessedFrame.Builder("evt" + frameNum, frameNum++)
            .timestamp(1000.0 + frameNum).hit(hit);
    }

    private static PeakList peaks(double[] fs, double[] ss, double[] inten)
    {
        return new PeakList(fs, ss, inten);
    }

    @Test
    public void testEmpty()
    {
        Aggregator agg = new Aggregator(geom, 10, RINGS);

        assertEquals(0L, agg.getNumEvents());
        assertEquals(0.0, agg.getHitRate(), 0.0);
        assertEquals(10, agg.getWindowSize());
        assertFalse(agg.getRings().isAvailable());

        float[][] powder = agg.getPowderImage();
        assertEquals(12, powder.length);
        assertEquals(12, powder[0].length);
    }

    @Test
    public void testCounters()
    {
        Aggregator agg = new Aggregator(geom, 10, RINGS);

        agg.ingest(frame(true).build());
        agg.ingest(frame(true).saturated(true).build());
        agg.ingest(frame(false).build());
        agg.ingest(frame(false).build());

        assertEquals(4L, agg.getNumEvents());
        assertEquals(2L, agg.getNumHits());
        assertEquals(1L, agg.getNumSaturated());
        assertEquals(0.5, agg.getHitRate(), 1.0E-12);
        assertEquals(0.25, agg.getSaturationRate(), 1.0E-12);

        List<Double> history = agg.getHitRateHistory();
        assertEquals(4, history.size());
        assertEquals(100.0, history.get(1), 1.0E-9);
        assertEquals(66.667, history.get(2), 0.001);
        assertEquals(50.0, history.get(3), 1.0E-9);
        assertEquals(4, agg.getTimestampHistory().size());
        assertEquals(1001.0, agg.getTimestampHistory().get(0), 0.0);
    }

    @Test
    public void testRollingWindow()
    {
        Aggregator agg = new Aggregator(geom, 5, RINGS);

        for (int i = 0; i < 10000; i++) {
            agg.ingest(frame(false).build());
        }
        agg.ingest(frame(true).build());

        assertEquals(10001L, agg.getNumEvents());
        assertEquals(1L, agg.getNumHits());
        assertEquals(0.2, agg.getHitRate(), 1.0E-12);

        List<Double> history = agg.getHitRateHistory();
        assertEquals(Aggregator.HISTORY_SIZE, history.size());
        assertEquals(20.0, history.get(history.size() - 1), 1.0E-9);
        assertEquals(0.0, history.get(0), 0.0);
    }

    @Test
    public void testMissingTimestamp()
    {
        Aggregator agg = new Aggregator(geom, 5, RINGS);

        agg.ingest(new ProcessedFrame.Builder("x", 0).timestamp(Double.NaN)
                   .build());

        assertEquals(Arrays.asList(0.0), agg.getTimestampHistory());
        assertNull(agg.snapshot().toMap().get("timestamp"));
    }

    @Test
    public void testPeakScatter()
    {
        Aggregator agg = new Aggregator(geom, 10, RINGS);

        agg.ingest(frame(true)
                   .peaks(peaks(new double[] { 2.2, 7.0 },
                                new double[] { 3.4, 8.6 },
                                new double[] { 50.0, 70.0 }))
                   .build());

        assertEquals(Arrays.asList(2, 7), agg.getPeakXInFrame());
        assertEquals(Arrays.asList(3, 9), agg.getPeakYInFrame());
        assertEquals(50.0F, agg.getPowderValue(2, 3), 0.0F);
        assertEquals(70.0F, agg.getPowderValue(7, 9), 0.0F);
        assertEquals(50.0F, agg.getEventImage()[3][2], 0.0F);

        agg.ingest(frame(true)
                   .peaks(peaks(new double[] { 2.0 }, new double[] { 3.0 },
                                new double[] { 25.0 }))
                   .build());

        // powder accumulates, the event image only holds the latest peaks
        assertEquals(75.0F, agg.getPowderValue(2, 3), 0.0F);
        assertEquals(70.0F, agg.getPowderValue(7, 9), 0.0F);
        assertEquals(25.0F, agg.getEventImage()[3][2], 0.0F);
        assertEquals(0.0F, agg.getEventImage()[9][7], 0.0F);
        assertEquals(Arrays.asList(2), agg.getPeakXInFrame());

        // a frame without peaks has no peaks of its own, the event image
        // still shows the latest hit
        agg.ingest(frame(false).build());
        assertTrue(agg.getPeakXInFrame().isEmpty());
        assertTrue(agg.getPeakYInFrame().isEmpty());
        assertEquals(25.0F, agg.getEventImage()[3][2], 0.0F);
    }

    @Test
    public void testNonHitPeaksIgnored()
    {
        Aggregator agg = new Aggregator(geom, 10, RINGS);

        agg.ingest(frame(false)
                   .peaks(peaks(new double[] { 4.0, 6.0 },
                                new double[] { 4.0, 6.0 },
                                new double[] { 600.0, 600.0 }))
                   .build());

        assertEquals(0L, agg.getNumHits());
        assertEquals(0.0F, agg.getPowderValue(4, 4), 0.0F);
        assertEquals(0.0F, agg.getPowderValue(6, 6), 0.0F);
        assertEquals(0.0F, agg.getEventImage()[4][4], 0.0F);
        assertTrue(agg.getPeakXInFrame().isEmpty());

        float sum = 0.0F;
        for (float[] row : agg.getPowderImage()) {
            for (float val : row) {
                sum += val;
            }
        }
        assertEquals(0.0F, sum, 0.0F);
    }

    @Test
    public void testPeaksOutsideSlab()
    {
        Aggregator agg = new Aggregator(geom, 10, RINGS);

        agg.ingest(frame(true)
                   .peaks(peaks(new double[] { -1.0, 4.0, 12.0, 9.6 },
                                new double[] { 4.0, 4.0, 1.0, 0.0 },
                                new double[] { 1.0, 2.0, 3.0, 4.0 }))
                   .build());

        // 9.6 rounds to 10, past the last column
        assertEquals(3L, agg.getNumPeaksOutsideSlab());
        assertEquals(Arrays.asList(4), agg.getPeakXInFrame());
        assertEquals(2.0F, agg.getPowderValue(4, 4), 0.0F);
    }

    @Test
    public void testFrameImage()
    {
        Aggregator agg = new Aggregator(geom, 10, RINGS);

        float[] image = new float[100];
        for (int i = 0; i < image.length; i++) {
            image[i] = i;
        }

        agg.ingest(frame(true).image(image, 10, 10).build());

        float[][] vis = agg.getFrameImage();
        assertEquals(12, vis.length);
        assertEquals(0.0F, vis[0][0], 0.0F);
        assertEquals(37.0F, vis[3][7], 0.0F);
        assertEquals(99.0F, vis[9][9], 0.0F);
        assertEquals(0.0F, vis[11][11], 0.0F);
    }

    @Test
    public void testWrongImageSize()
    {
        Aggregator agg = new Aggregator(geom, 10, RINGS);

        agg.ingest(frame(true).image(new float[20], 5, 4).build());

        assertEquals(1L, agg.getNumEvents());
        appender.assertLogMessage("Ignoring 5x4 image");
        appender.assertNoLogMessages();
    }

    @Test
    public void testRings()
    {
        Aggregator agg = new Aggregator(geom, 10, RINGS);

        agg.ingest(frame(false).beamEnergy(ONE_ANGSTROM_EV)
                   .detectorDistance(0.1).build());

        ResolutionRings rings = agg.getRings();
        assertTrue(rings.isAvailable());
        assertEquals(2, rings.size());
        assertEquals(2000.0 * Math.sqrt(3.0), rings.getDiameter(1), 0.01);

        // beam parameters follow the latest frame
        agg.ingest(frame(false).build());
        assertFalse(agg.getRings().isAvailable());
    }

    @Test
    public void testSnapshot()
    {
        Aggregator agg = new Aggregator(geom, 10, RINGS);

        agg.ingest(frame(true).beamEnergy(ONE_ANGSTROM_EV)
                   .detectorDistance(0.1)
                   .peaks(peaks(new double[] { 1.0 }, new double[] { 1.0 },
                                new double[] { 9.0 }))
                   .build());
        agg.ingest(frame(false).beamEnergy(ONE_ANGSTROM_EV)
                   .detectorDistance(0.1).build());

        AggregatorSnapshot snap = agg.snapshot();
        agg.reset();

        assertEquals(2L, snap.getNumEvents());
        assertEquals(1L, snap.getNumHits());
        assertEquals(9.0F, snap.getPowderImage()[1][1], 0.0F);

        Map<String, Object> map = snap.toMap();
        assertEquals(2L, map.get("num_events"));
        assertEquals(50.0, (Double) map.get("hit_rate"), 1.0E-9);
        assertEquals(0.1, (Double) map.get("detector_distance"), 0.0);
        assertEquals(10000.0, (Double) map.get("pixel_size"), 0.0);
        assertEquals(Boolean.TRUE, map.get("resolution_rings_available"));
        assertEquals(2, ((List<?>) map.get("resolution_rings")).size());
    }

    @Test
    public void testReset()
    {
        Aggregator agg = new Aggregator(geom, 10, RINGS);

        agg.ingest(frame(true).beamEnergy(ONE_ANGSTROM_EV)
                   .detectorDistance(0.1)
                   .peaks(peaks(new double[] { 1.0 }, new double[] { 1.0 },
                                new double[] { 9.0 }))
                   .build());
        agg.reset();

        assertEquals(0L, agg.getNumEvents());
        assertEquals(0L, agg.getNumHits());
        assertEquals(0.0, agg.getHitRate(), 0.0);
        assertTrue(agg.getHitRateHistory().isEmpty());
        assertTrue(agg.getPeakXInFrame().isEmpty());
        assertEquals(0.0F, agg.getPowderValue(1, 1), 0.0F);
        assertFalse(agg.getRings().isAvailable());
    }
}
