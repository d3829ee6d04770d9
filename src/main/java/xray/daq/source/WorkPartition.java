package xray.daq.source;

import java.util.List;

/**
 * Static split of an enumerable work set across the worker ranks.
 *
 * Worker <tt>rank</tt> (1 to <tt>poolSize-1</tt>) gets the contiguous
 * slice starting at <tt>(rank-1)*n</tt> where
 * <tt>n = ceil(total / (poolSize-1))</tt>.  Trailing workers may get a
 * short or empty slice.
 */
public final class WorkPartition
{
    private final int start;
    private final int end;

    private WorkPartition(int start, int end)
    {
        this.start = start;
        this.end = end;
    }

    /**
     * Compute one worker's slice of <tt>total</tt> units.
     */
    public static WorkPartition forRank(int total, int rank, int poolSize)
    {
        if (poolSize < 2) {
            throw new IllegalArgumentException("Pool of " + poolSize +
                                               " has no workers");
        }
        if (rank < 1 || rank >= poolSize) {
            throw new IllegalArgumentException("Bad worker rank " + rank +
                                               " for pool of " + poolSize);
        }
        if (total < 0) {
            throw new IllegalArgumentException("Negative total " + total);
        }

        final int workers = poolSize - 1;
        final int size = (total + workers - 1) / workers;

        final int start = Math.min((rank - 1) * size, total);
        final int end = Math.min(rank * size, total);

        return new WorkPartition(start, end);
    }

    /**
     * Return one worker's slice of a list.
     */
    public static <T> List<T> slice(List<T> items, int rank, int poolSize)
    {
        WorkPartition part = forRank(items.size(), rank, poolSize);
        return items.subList(part.start, part.end);
    }

    /**
     * @return first unit (inclusive)
     */
    public int getStart()
    {
        return start;
    }

    /**
     * @return last unit (exclusive)
     */
    public int getEnd()
    {
        return end;
    }

    public int size()
    {
        return end - start;
    }

    @Override
    public String toString()
    {
        return "[" + start + "," + end + ")";
    }
}
