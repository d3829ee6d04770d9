package xray.daq.source;

/**
 * The data for one event could not be interpreted.
 */
public class FrameExtractionException
    extends Exception
{
    private static final long serialVersionUID = 1L;

    public FrameExtractionException(String msg)
    {
        super(msg);
    }

    public FrameExtractionException(String msg, Throwable thr)
    {
        super(msg, thr);
    }
}
