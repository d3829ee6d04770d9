package xray.daq.source;

/**
 * Pull-style iterator over the events assigned to one worker.
 */
public interface EventIterator
{
    boolean hasNext();

    /**
     * Return the next event.  If the next unit of work cannot be opened
     * the iterator still moves past it, so the caller may skip it and
     * carry on.
     *
     * @return next event
     *
     * @throws SourceAccessException if the next unit cannot be opened
     * @throws java.util.NoSuchElementException if there are no more events
     */
    RawEvent next()
        throws SourceAccessException;

    void close();
}
