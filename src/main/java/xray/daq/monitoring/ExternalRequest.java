package xray.daq.monitoring;

/**
 * A request from an external program, with the identity of the client
 * which must receive the reply.
 */
public class ExternalRequest
{
    /** Send the data of the next hit */
    public static final String NEXT = "next";
    /** Clear the accumulated statistics */
    public static final String RESET = "reset";

    private final byte[] identity;
    private final String command;

    public ExternalRequest(byte[] identity, String command)
    {
        this.identity = identity;
        this.command = command;
    }

    public byte[] getIdentity()
    {
        return identity;
    }

    public String getCommand()
    {
        return command;
    }

    @Override
    public String toString()
    {
        return "ExternalRequest[" + command + "]";
    }
}
