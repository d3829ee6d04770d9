package xray.daq.transport;

import java.util.concurrent.TimeUnit;

/**
 * Point-to-point messaging between the ranks of one pool.
 *
 * Messages from one sender to one receiver are delivered in send order.
 * Receives are performed by a single thread per rank.
 */
public interface Transport
{
    /** Rank of the collector */
    int COLLECTOR_RANK = 0;

    int getRank();

    int getPoolSize();

    /**
     * Start sending a message.
     *
     * @param dest destination rank
     * @param msg message
     *
     * @return handle which completes once the message has been handed over
     *
     * @throws TransportException if the channel has already failed
     */
    SendRequest send(int dest, Message msg)
        throws TransportException;

    /**
     * Send a message and wait for it to be handed over.  The message
     * bypasses the queue used by {@link #send}, so callers must wait for
     * their outstanding sends first if order matters.
     */
    void sendNow(int dest, Message msg)
        throws TransportException;

    /**
     * Wait for a message from any rank.
     *
     * @return next message, or <tt>null</tt> if the timeout expired
     *
     * @throws TransportException if the channel failed
     */
    Message receive(long timeout, TimeUnit unit)
        throws TransportException;

    /**
     * Return the next message if one has already arrived.
     *
     * @return next message or <tt>null</tt>
     *
     * @throws TransportException if the channel failed
     */
    Message poll()
        throws TransportException;

    /**
     * Release all resources.  Pending sends may be abandoned.
     */
    void close();
}
