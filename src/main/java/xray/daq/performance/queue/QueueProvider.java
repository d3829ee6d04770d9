package xray.daq.performance.queue;

import java.util.concurrent.LinkedBlockingQueue;

import org.jctools.queues.MpscArrayQueue;

/**
 * Centralize the selection of queue implementations.
 *
 * The rank inbox is fed by one reader thread per peer and drained by the
 * rank's message loop, so it is a many-producer, single-consumer case.
 */
public class QueueProvider
{
    /** Optional inbox config */
    private static final String inboxConfig =
        System.getProperty("xray.daq.performance.queue.inbox.queue",
                           MPSCOption.BACKOFF.name());

    /**
     * Implemented as an enumeration to emphasize that queue selection
     * details are highly use-case specific.
     */
    public static enum Subsystem
    {
        RANK_INBOX
        {
            /**
             * Creates the queue holding messages received by one rank.
             */
            @Override
            public <T> QueueStrategy<T> createQueue(final int size)
            {
                MPSCOption option =
                    MPSCOption.valueOf(inboxConfig.toUpperCase());

                return option.createQueue(size);
            }
        };

        /**
         * Creates the queue that is optimized for the subsystem.
         *
         * @param size The bounding size of the queue.
         * @param <T> The type of objects held in the queue.
         * @return The queue implementation for the subsystem.
         */
        public abstract <T> QueueStrategy<T> createQueue(final int size);
    }

    /**
     * Permitted configurations for a Multiple Producer, Single Consumer
     * case.
     */
    static enum MPSCOption
    {
        LINKED_BLOCKING
        {
            @Override
            public <T> QueueStrategy<T> createQueue(final int size)
            {
                LinkedBlockingQueue<T> base = new LinkedBlockingQueue<T>(size);
                return new QueueStrategy.Blocking<T>(base);
            }
        },
        POLL
        {
            @Override
            public <T> QueueStrategy<T> createQueue(final int size)
            {
                MpscArrayQueue<T> base = new MpscArrayQueue<T>(size);
                return new QueueStrategy.NonBlockingPoll<T>(base, 1);
            }
        },
        BACKOFF
        {
            @Override
            public <T> QueueStrategy<T> createQueue(final int size)
            {
                MpscArrayQueue<T> base = new MpscArrayQueue<T>(size);
                return new QueueStrategy.NonBlockingPollBackoff<T>(base, 10);
            }
        };

        public abstract <T> QueueStrategy<T> createQueue(final int size);
    }
}
