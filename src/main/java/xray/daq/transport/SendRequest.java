package xray.daq.transport;

import java.util.concurrent.TimeUnit;

/**
 * Handle for an asynchronous send.
 */
public interface SendRequest
{
    /**
     * Has the message been handed to the peer (or failed)?
     */
    boolean isDone();

    /**
     * Wait until the message has been handed to the peer.
     *
     * @throws TransportException if the send failed
     */
    void await()
        throws TransportException;

    /**
     * Wait at most <tt>timeout</tt> for the send to complete.
     *
     * @return <tt>false</tt> if the send is still pending
     *
     * @throws TransportException if the send failed
     */
    boolean await(long timeout, TimeUnit unit)
        throws TransportException;
}
