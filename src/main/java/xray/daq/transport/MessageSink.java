package xray.daq.transport;

/**
 * Synchronous delivery of one message to a peer.
 */
public interface MessageSink
{
    void deliver(int dest, Message msg)
        throws TransportException;
}
