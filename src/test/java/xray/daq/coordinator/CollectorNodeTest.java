package xray.daq.coordinator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Level;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import xray.daq.common.MockAppender;
import xray.daq.processing.ProcessedFrame;
import xray.daq.transport.LocalFabric;
import xray.daq.transport.Message;
import xray.daq.transport.MessageKind;
import xray.daq.transport.Transport;
import xray.daq.transport.TransportException;

import static org.junit.Assert.*;

public class CollectorNodeTest
{
    static class RecordingSink
        implements FrameSink
    {
        private final List<String> log = new ArrayList<String>();

        @Override
        public synchronized void frameReceived(int source,
                                               ProcessedFrame frame)
        {
            log.add(source + ":" + frame.getEventId());
        }

        @Override
        public synchronized void endOfStream()
        {
            log.add("EOS");
        }

        synchronized List<String> getLog()
        {
            return new ArrayList<String>(log);
        }
    }

    /**
     * Run a collector on its own thread.
     */
    static class CollectorThread
        extends Thread
    {
        private final CollectorNode node;
        private ExitStatus status;

        CollectorThread(CollectorNode node)
        {
            super("Collector");
            this.node = node;
        }

        @Override
        public void run()
        {
            status = node.run();
        }

        ExitStatus finish()
            throws InterruptedException
        {
            join(10000L);
            assertFalse("Collector did not finish", isAlive());
            return status;
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

    private static ProcessedFrame frame(String id)
    {
        return new ProcessedFrame.Builder(id, 0).build();
    }

    @Test
    public void testFourWorkersEnd()
        throws TransportException
    {
        LocalFabric fabric = new LocalFabric(4);
        RecordingSink sink = new RecordingSink();
        CollectorNode node = new CollectorNode(fabric.getTransport(0), sink,
                                               50L, 3);

        Transport w1 = fabric.getTransport(1);
        Transport w2 = fabric.getTransport(2);
        Transport w3 = fabric.getTransport(3);

        w1.sendNow(0, Message.result(1, frame("a")));
        w1.sendNow(0, Message.end(1));
        w2.sendNow(0, Message.result(2, frame("b")));
        w2.sendNow(0, Message.end(2));
        w3.sendNow(0, Message.result(3, frame("c")));
        w3.sendNow(0, Message.result(3, frame("d")));
        w3.sendNow(0, Message.end(3));
        // arrives after the last END and must never be handled
        w2.sendNow(0, Message.result(2, frame("late")));

        assertEquals(ExitStatus.CLEAN, node.run());

        List<String> expected = new ArrayList<String>();
        expected.add("1:a");
        expected.add("2:b");
        expected.add("3:c");
        expected.add("3:d");
        expected.add("EOS");
        assertEquals(expected, sink.getLog());

        assertEquals(4, node.getNumResults());
        assertEquals(3, node.getNumFinished());
    }

    @Test
    public void testEndCountedOncePerRank()
        throws InterruptedException, TransportException
    {
        LocalFabric fabric = new LocalFabric(3);
        RecordingSink sink = new RecordingSink();
        CollectorThread thread =
            new CollectorThread(new CollectorNode(fabric.getTransport(0),
                                                  sink, 20L, 3));
        thread.start();

        Transport w1 = fabric.getTransport(1);
        w1.sendNow(0, Message.end(1));
        w1.sendNow(0, Message.end(1));

        Thread.sleep(100L);
        assertTrue("Collector stopped after one worker", thread.isAlive());

        fabric.getTransport(2).sendNow(0, Message.end(2));
        assertEquals(ExitStatus.CLEAN, thread.finish());

        appender.assertLogMessage("Rank 1 sent END twice");
    }

    @Test
    public void testResultAfterEndIgnored()
        throws TransportException
    {
        LocalFabric fabric = new LocalFabric(3);
        RecordingSink sink = new RecordingSink();
        CollectorNode node = new CollectorNode(fabric.getTransport(0), sink,
                                               20L, 3);

        fabric.getTransport(1).sendNow(0, Message.end(1));
        fabric.getTransport(1).sendNow(0, Message.result(1, frame("x")));
        fabric.getTransport(2).sendNow(0, Message.end(2));

        assertEquals(ExitStatus.CLEAN, node.run());
        assertEquals(0, node.getNumResults());

        appender.assertLogMessage("Ignoring result from finished rank 1");
    }

    @Test
    public void testShutdownHandshake()
        throws InterruptedException, TransportException
    {
        LocalFabric fabric = new LocalFabric(3);
        RecordingSink sink = new RecordingSink();
        CollectorNode node = new CollectorNode(fabric.getTransport(0), sink,
                                               20L, 50);

        Transport w1 = fabric.getTransport(1);
        Transport w2 = fabric.getTransport(2);

        // worker 2 already finished
        w2.sendNow(0, Message.end(2));

        node.requestShutdown();
        CollectorThread thread = new CollectorThread(node);
        thread.start();

        Message msg = w1.receive(5, TimeUnit.SECONDS);
        assertNotNull("Worker 1 was not told to stop", msg);
        assertEquals(MessageKind.TERMINATE, msg.getKind());
        assertNull("Finished worker should not be told to stop", w2.poll());

        w1.sendNow(0, Message.terminated(1));

        assertEquals(ExitStatus.CLEAN, thread.finish());
        assertEquals(2, node.getNumFinished());
        assertFalse("Shutdown is not end of stream",
                    sink.getLog().contains("EOS"));
    }

    @Test
    public void testShutdownTimeout()
    {
        LocalFabric fabric = new LocalFabric(3);
        CollectorNode node = new CollectorNode(fabric.getTransport(0),
                                               new RecordingSink(), 10L, 3);
        node.requestShutdown();

        assertEquals(ExitStatus.SHUTDOWN_TIMEOUT, node.run());

        appender.assertLogMessage("Only 0 of 2 workers acknowledged");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWorkerRank()
    {
        new CollectorNode(new LocalFabric(2).getTransport(1),
                          new RecordingSink());
    }
}
