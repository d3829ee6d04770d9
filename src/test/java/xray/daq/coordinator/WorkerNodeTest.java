package xray.daq.coordinator;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Level;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import xray.daq.common.MockAppender;
import xray.daq.processing.FrameProcessor;
import xray.daq.processing.GeometryInfo;
import xray.daq.processing.ProcessedFrame;
import xray.daq.source.EventAgeFilter;
import xray.daq.source.FrameExtractionException;
import xray.daq.source.RawEvent;
import xray.daq.transport.Message;
import xray.daq.transport.MessageKind;

import static org.junit.Assert.*;

public class WorkerNodeTest
{
    /**
     * Returns an empty result, failing for selected event IDs.
     */
    static class EchoProcessor
        implements FrameProcessor
    {
        private final String badId;
        private final String brokenId;

        EchoProcessor()
        {
            this(null, null);
        }

        EchoProcessor(String badId, String brokenId)
        {
            this.badId = badId;
            this.brokenId = brokenId;
        }

        @Override
        public ProcessedFrame process(RawEvent evt, int frameIndex,
                                      GeometryInfo geom)
            throws FrameExtractionException
        {
            if (evt.getEventId().equals(badId)) {
                throw new FrameExtractionException("Bad data in " + badId);
            }
            if (evt.getEventId().equals(brokenId)) {
                throw new IllegalStateException("Broken " + brokenId);
            }

            return new ProcessedFrame.Builder(evt.getEventId(),
                                              frameIndex).build();
        }
    }

    private MockAppender appender;

    @Before
    public void setUp()
    {
        appender = new MockAppender(Level.WARN);

        BasicConfigurator.resetConfiguration();
        BasicConfigurator.configure(appender);
    }

    @After
    public void tearDown()
    {
        appender.assertNoLogMessages();
        BasicConfigurator.resetConfiguration();
    }

    private static List<RawEvent> events(int num, int framesPerEvent)
    {
        List<RawEvent> list = new ArrayList<RawEvent>();
        for (int i = 0; i < num; i++) {
            list.add(new MockEvent("evt" + i, framesPerEvent));
        }
        return list;
    }

    private static List<String> frameNames(List<Message> msgs)
    {
        List<String> names = new ArrayList<String>();
        for (Message msg : msgs) {
            if (msg.getKind() == MessageKind.RESULT) {
                names.add(msg.getFrame().getEventId() + "#" +
                          msg.getFrame().getFrameIndex());
            } else {
                names.add(msg.getKind().name());
            }
        }
        return names;
    }

    @Test
    public void testAllResultsThenEnd()
    {
        MockTransport transport = new MockTransport(2, 3);
        List<RawEvent> evts = events(5, 2);
        ListEventIterator iter = new ListEventIterator(evts);

        WorkerNode worker =
            new WorkerNode(transport, iter, new EchoProcessor(), null);
        assertEquals(WorkerState.IDLE, worker.getState());

        assertEquals(ExitStatus.CLEAN, worker.run());
        assertEquals(WorkerState.TERMINATED, worker.getState());

        List<Message> sent = transport.getSent();
        assertEquals(11, sent.size());
        for (int i = 0; i < 10; i++) {
            assertEquals(MessageKind.RESULT, sent.get(i).getKind());
            assertEquals(2, sent.get(i).getSource());
        }
        assertEquals(MessageKind.END, sent.get(10).getKind());
        assertTrue(transport.getSentNow().isEmpty());

        assertEquals(1, transport.getMaxOutstanding());
        assertEquals(5, worker.getNumEvents());
        assertEquals(10, worker.getNumFrames());

        assertTrue(iter.isClosed());
        for (RawEvent evt : evts) {
            assertTrue(((MockEvent) evt).isClosed());
        }
    }

    @Test
    public void testLastFramesOnly()
    {
        MockTransport transport = new MockTransport(1, 2);

        WorkerNode worker =
            new WorkerNode(transport, new ListEventIterator(events(2, 3)),
                           new EchoProcessor(), null);
        worker.setFramesPerEvent(2);

        assertEquals(ExitStatus.CLEAN, worker.run());

        List<String> expected = new ArrayList<String>();
        expected.add("evt0#1");
        expected.add("evt0#2");
        expected.add("evt1#1");
        expected.add("evt1#2");
        expected.add("END");
        assertEquals(expected, frameNames(transport.getSent()));
    }

    @Test
    public void testTerminate()
    {
        MockTransport transport = new MockTransport(1, 2);
        // first two fetches see nothing, third sees TERMINATE
        transport.addIncoming(Message.terminate(0), 2);

        ListEventIterator iter = new ListEventIterator(events(5, 1));
        WorkerNode worker =
            new WorkerNode(transport, iter, new EchoProcessor(), null);

        assertEquals(ExitStatus.CLEAN, worker.run());
        assertEquals(WorkerState.TERMINATED, worker.getState());

        List<String> expected = new ArrayList<String>();
        expected.add("evt0#0");
        expected.add("evt1#0");
        assertEquals(expected, frameNames(transport.getSent()));

        assertEquals(1, transport.getSentNow().size());
        assertEquals(MessageKind.TERMINATED,
                     transport.getSentNow().get(0).getKind());
        assertTrue(iter.isClosed());
    }

    @Test
    public void testSkipBadData()
    {
        MockTransport transport = new MockTransport(1, 2);

        List<RawEvent> evts = events(4, 1);
        evts.add(1, null);

        WorkerNode worker =
            new WorkerNode(transport, new ListEventIterator(evts),
                           new EchoProcessor("evt1", "evt2"), null);

        assertEquals(ExitStatus.CLEAN, worker.run());

        List<String> expected = new ArrayList<String>();
        expected.add("evt0#0");
        expected.add("evt3#0");
        expected.add("END");
        assertEquals(expected, frameNames(transport.getSent()));
        assertEquals(3, worker.getNumSkipped());

        appender.assertLogMessage("skipping unreadable data");
        appender.assertLogMessage("Cannot process frame 0 of evt1");
        appender.assertLogMessage("Processing failed for frame 0 of evt2");
    }

    @Test
    public void testTransportFailure()
    {
        MockTransport transport = new MockTransport(3, 4);
        transport.setFailAfter(2);

        WorkerNode worker =
            new WorkerNode(transport, new ListEventIterator(events(5, 1)),
                           new EchoProcessor(), null);

        assertEquals(ExitStatus.TRANSPORT_FAILURE, worker.run());
        assertEquals(WorkerState.TERMINATED, worker.getState());

        assertEquals(2, transport.getSent().size());
        assertEquals(1, transport.getSentNow().size());
        assertEquals(MessageKind.END,
                     transport.getSentNow().get(0).getKind());

        appender.assertLogMessage("Rank 3 lost contact with the collector");
    }

    @Test
    public void testStaleEventsDropped()
    {
        MockTransport transport = new MockTransport(1, 2);

        List<RawEvent> evts = new ArrayList<RawEvent>();
        evts.add(new MockEvent("old", 1, 0.0));
        evts.add(new MockEvent("new", 1));

        WorkerNode worker =
            new WorkerNode(transport, new ListEventIterator(evts),
                           new EchoProcessor(), null);
        EventAgeFilter filter = new EventAgeFilter(60.0);
        worker.setAgeFilter(filter);

        assertEquals(ExitStatus.CLEAN, worker.run());

        List<String> expected = new ArrayList<String>();
        expected.add("new#0");
        expected.add("END");
        assertEquals(expected, frameNames(transport.getSent()));
        assertEquals(1, filter.getNumRejected());
        assertTrue(((MockEvent) evts.get(0)).isClosed());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCollectorRank()
    {
        new WorkerNode(new MockTransport(0, 2), new ListEventIterator(),
                       new EchoProcessor(), null);
    }
}
