package xray.daq.transport;

/**
 * The message channel to a peer rank failed.
 */
public class TransportException
    extends Exception
{
    private static final long serialVersionUID = 1L;

    public TransportException(String msg)
    {
        super(msg);
    }

    public TransportException(String msg, Throwable thr)
    {
        super(msg, thr);
    }
}
