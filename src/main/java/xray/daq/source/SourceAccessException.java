package xray.daq.source;

/**
 * A unit of work (file, run, stream) could not be opened.
 */
public class SourceAccessException
    extends Exception
{
    private static final long serialVersionUID = 1L;

    public SourceAccessException(String msg)
    {
        super(msg);
    }

    public SourceAccessException(String msg, Throwable thr)
    {
        super(msg, thr);
    }
}
