package xray.daq.performance.queue;

import java.util.concurrent.TimeUnit;

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Tests QueueProvider.java
 */
public class QueueProviderTest
{
    @Test
    public void testSubsystems()
    {
        for (QueueProvider.Subsystem subsystem :
                 QueueProvider.Subsystem.values())
        {
            QueueStrategy<String> q = subsystem.createQueue(16);
            assertNotNull(q);
            assertEquals(0, q.size());
        }
    }

    @Test
    public void testMPSCOptions()
        throws InterruptedException
    {
        for (QueueProvider.MPSCOption option :
                 QueueProvider.MPSCOption.values())
        {
            QueueStrategy<Integer> q = option.createQueue(16);

            assertNull(option.name(), q.poll());
            assertNull(option.name(), q.poll(5, TimeUnit.MILLISECONDS));

            q.enqueue(1);
            q.enqueue(2);
            assertEquals(option.name(), 2, q.size());
            assertEquals(option.name(), Integer.valueOf(1), q.dequeue());
            assertEquals(option.name(), Integer.valueOf(2),
                         q.poll(1, TimeUnit.SECONDS));
            assertEquals(option.name(), 0, q.size());

            QueueProvider.MPSCOption lookup =
                QueueProvider.MPSCOption.valueOf(option.name().toUpperCase());
            assertSame(option, lookup);
        }
    }

    @Test
    public void testManyProducers()
        throws InterruptedException
    {
        final QueueStrategy<Integer> q =
            QueueProvider.MPSCOption.BACKOFF.createQueue(4);

        Thread[] producers = new Thread[3];
        for (int i = 0; i < producers.length; i++) {
            final int base = i * 100;
            producers[i] = new Thread("Producer" + i) {
                @Override
                public void run()
                {
                    try {
                        for (int n = 0; n < 50; n++) {
                            q.enqueue(base + n);
                        }
                    } catch (InterruptedException ie) {
                        fail("Interrupted");
                    }
                }
            };
            producers[i].start();
        }

        // each producer's values must arrive in order
        int[] next = new int[producers.length];
        for (int i = 0; i < 150; i++) {
            Integer val = q.poll(5, TimeUnit.SECONDS);
            assertNotNull("Timed out after " + i + " values", val);

            final int producer = val / 100;
            assertEquals(next[producer], val % 100);
            next[producer]++;
        }

        for (Thread t : producers) {
            t.join();
        }
    }
}
