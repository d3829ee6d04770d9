package xray.daq.source;

import java.util.NoSuchElementException;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.varia.NullAppender;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class SyntheticEventSourceTest
{
    private static final int WIDTH = 16;
    private static final int HEIGHT = 12;

    @Before
    public void setUp()
    {
        BasicConfigurator.resetConfiguration();
        BasicConfigurator.configure(new NullAppender());
    }

    @After
    public void tearDown()
    {
        BasicConfigurator.resetConfiguration();
    }

    private static SyntheticEventSource create(int events, double hitFraction)
    {
        return new SyntheticEventSource(WIDTH, HEIGHT, events, 2,
                                        hitFraction, 5.0, 1234, 9300.0,
                                        0.1);
    }

    private static float max(float[] data)
    {
        float m = Float.NEGATIVE_INFINITY;
        for (float f : data) {
            m = Math.max(m, f);
        }
        return m;
    }

    @Test
    public void testEventCount()
        throws SourceAccessException, FrameExtractionException
    {
        SyntheticEventSource src = create(10, 0.5);

        int total = 0;
        for (int rank = 1; rank < 4; rank++) {
            EventIterator iter = src.open(rank, 4);
            while (iter.hasNext()) {
                RawEvent evt = iter.next();
                assertTrue(evt.getEventId(),
                           evt.getEventId().startsWith("synthetic-" + rank));
                assertEquals(2, evt.getNumFrames());
                assertEquals(WIDTH * HEIGHT, evt.extractFrame(1).length);
                assertEquals(9300.0, evt.getBeamEnergy(), 0.0);
                total++;
            }
            iter.close();
        }

        assertEquals(10, total);
    }

    @Test
    public void testRepeatable()
    {
        SyntheticEventSource a = create(4, 0.5);
        SyntheticEventSource b = create(4, 0.5);

        for (int i = 0; i < 4; i++) {
            assertEquals(a.isHitEvent(i), b.isHitEvent(i));
            assertArrayEquals(a.generateFrame(i, 1), b.generateFrame(i, 1),
                              0.0F);
        }
    }

    @Test
    public void testHitsHaveSpots()
    {
        SyntheticEventSource hits = create(3, 1.0);
        SyntheticEventSource misses = create(3, 0.0);

        for (int i = 0; i < 3; i++) {
            assertTrue(hits.isHitEvent(i));
            assertTrue(max(hits.generateFrame(i, 0)) >=
                       SyntheticEventSource.PEAK_HEIGHT);

            assertFalse(misses.isHitEvent(i));
            assertTrue(max(misses.generateFrame(i, 0)) <
                       SyntheticEventSource.PEAK_HEIGHT / 4.0F);
        }
    }

    @Test
    public void testBadFrame()
        throws SourceAccessException
    {
        EventIterator iter = create(1, 0.0).open(1, 2);
        RawEvent evt = iter.next();
        try {
            evt.extractFrame(2);
            fail("Frame 2 should not exist");
        } catch (FrameExtractionException fee) {
            assertTrue(fee.getMessage().contains("no frame 2"));
        }

        assertFalse(iter.hasNext());
        try {
            iter.next();
            fail("Iterator should be exhausted");
        } catch (NoSuchElementException nse) {
            // expected
        }
    }
}
