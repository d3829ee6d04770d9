package xray.daq.source;

import org.apache.log4j.Logger;

/**
 * Reject events which are too old to be worth processing.  Used on live
 * feeds, where a worker that falls behind should skip ahead rather than
 * show stale data.
 */
public class EventAgeFilter
{
    private static final Logger LOG = Logger.getLogger(EventAgeFilter.class);

    private final double maxAge;

    private long numRejected;

    /**
     * @param maxAge maximum event age in seconds
     */
    public EventAgeFilter(double maxAge)
    {
        if (!(maxAge > 0.0)) {
            throw new IllegalArgumentException("Bad maximum age " + maxAge);
        }

        this.maxAge = maxAge;
    }

    /**
     * Current time in seconds since the epoch.
     */
    protected double now()
    {
        return System.currentTimeMillis() / 1000.0;
    }

    public double getMaxAge()
    {
        return maxAge;
    }

    public long getNumRejected()
    {
        return numRejected;
    }

    /**
     * Should this event be processed?
     *
     * @param evt event
     *
     * @return <tt>false</tt> if the event is older than the maximum age
     */
    public boolean accept(RawEvent evt)
    {
        final double age = now() - evt.getTimestamp();
        if (age <= maxAge) {
            return true;
        }

        numRejected++;
        if (LOG.isDebugEnabled()) {
            LOG.debug(String.format("Dropping %s (%.1fs old)",
                                    evt.getEventId(), age));
        }

        return false;
    }
}
