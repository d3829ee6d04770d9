package xray.daq.source;

/**
 * Factory for the event iterator of one worker rank.
 */
public interface EventSource
{
    /**
     * Open this rank's share of the data.
     *
     * @param rank worker rank (1 or greater)
     * @param poolSize number of ranks, including the collector
     *
     * @return iterator over this rank's events
     *
     * @throws SourceAccessException if the data cannot be opened at all
     */
    EventIterator open(int rank, int poolSize)
        throws SourceAccessException;
}
