package xray.daq.geometry;

/**
 * A geometry description is malformed or inconsistent.
 */
public class GeometryParseException
    extends Exception
{
    private static final long serialVersionUID = 1L;

    public GeometryParseException(String msg)
    {
        super(msg);
    }

    public GeometryParseException(String msg, Throwable thr)
    {
        super(msg, thr);
    }

    /**
     * Build an exception which names the offending line.
     *
     * @param source name of the description (usually a file name)
     * @param lineNum 1-based line number
     * @param msg problem description
     *
     * @return new exception
     */
    static GeometryParseException atLine(String source, int lineNum,
                                         String msg)
    {
        return new GeometryParseException(source + ":" + lineNum + ": " +
                                          msg);
    }
}
