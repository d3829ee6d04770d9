package xray.daq.coordinator;

public enum WorkerState
{
    /**
     * Waiting to start.
     */
    IDLE,

    /**
     * Checking for a shutdown request and pulling the next event.
     */
    FETCHING,

    /**
     * Running the frame processor on one frame.
     */
    PROCESSING,

    /**
     * Waiting for the previous send to complete before handing over a
     * new result.
     */
    SENDING,

    /**
     * Finishing the last outstanding send before exit.
     */
    DRAINING,

    /**
     * Done; no further messages will be sent.
     */
    TERMINATED
}
