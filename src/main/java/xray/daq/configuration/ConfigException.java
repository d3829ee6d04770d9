package xray.daq.configuration;

/**
 * A configuration value is missing or malformed.
 */
public class ConfigException
    extends Exception
{
    private static final long serialVersionUID = 1L;

    public ConfigException(String msg)
    {
        super(msg);
    }

    public ConfigException(String msg, Throwable thr)
    {
        super(msg, thr);
    }
}
