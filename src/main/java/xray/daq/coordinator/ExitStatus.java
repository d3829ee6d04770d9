package xray.daq.coordinator;

/**
 * Process exit codes.
 */
public enum ExitStatus
{
    /** All work finished or shutdown fully acknowledged */
    CLEAN(0),
    /** A rank lost its connection to the pool */
    TRANSPORT_FAILURE(1),
    /** Bad configuration or geometry */
    STARTUP_FAILURE(2),
    /** Workers did not acknowledge shutdown in time */
    SHUTDOWN_TIMEOUT(3);

    private final int code;

    ExitStatus(int code)
    {
        this.code = code;
    }

    public int getCode()
    {
        return code;
    }
}
