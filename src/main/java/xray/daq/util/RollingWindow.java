package xray.daq.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity FIFO of the most recent samples, with a simple
 * moving average over the samples currently held.
 *
 * Once the window is full, each push evicts the oldest sample.
 *
 * NOTE: The running sum is maintained incrementally, so very long runs
 * of values with wildly different magnitudes will accumulate rounding
 * error. The sum is recomputed from the held samples every time the
 * write index wraps to bound that error.
 */
public class RollingWindow<T extends Number>
{
    private final Object[] samples;
    private int idx;
    private int validValues;

    private double sum;

    public RollingWindow(int capacity)
    {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Window capacity must be" +
                                               " positive, not " + capacity);
        }

        samples = new Object[capacity];
        idx = 0;
    }

    /**
     * Add a sample, evicting the oldest one if the window is full.
     *
     * @param value new sample
     *
     * @return the average after the push
     */
    public final double push(final T value)
    {
        if (value == null) {
            throw new IllegalArgumentException("Cannot push null sample");
        }

        synchronized (this)
        {
            if (validValues == samples.length) {
                sum -= valueAt(idx);
            } else {
                validValues++;
            }

            samples[idx] = value;
            sum += value.doubleValue();

            idx = ++idx % samples.length;
            if (idx == 0) {
                resum();
            }

            return getAverage();
        }
    }

    /**
     * Average of the held samples, or zero for an empty window.
     */
    public final double getAverage()
    {
        synchronized (this)
        {
            if (validValues == 0) {
                return 0.0;
            }

            return sum / (double) validValues;
        }
    }

    public final int capacity()
    {
        return samples.length;
    }

    public final boolean isFull()
    {
        synchronized (this)
        {
            return validValues == samples.length;
        }
    }

    public final int size()
    {
        synchronized (this)
        {
            return validValues;
        }
    }

    /**
     * Discard every sample.
     */
    public final void clear()
    {
        synchronized (this)
        {
            for (int i = 0; i < samples.length; i++) {
                samples[i] = null;
            }
            idx = 0;
            validValues = 0;
            sum = 0.0;
        }
    }

    /**
     * Return the held samples, oldest first.
     */
    @SuppressWarnings("unchecked")
    public final List<T> toList()
    {
        synchronized (this)
        {
            ArrayList<T> list = new ArrayList<T>(validValues);

            int start;
            if (validValues < samples.length) {
                start = 0;
            } else {
                start = idx;
            }

            for (int i = 0; i < validValues; i++) {
                list.add((T) samples[(start + i) % samples.length]);
            }

            return list;
        }
    }

    private double valueAt(int index)
    {
        return ((Number) samples[index]).doubleValue();
    }

    private void resum()
    {
        double total = 0.0;
        for (int i = 0; i < validValues; i++) {
            total += valueAt(i);
        }
        sum = total;
    }

    @Override
    public String toString()
    {
        return String.format("RollingWindow[%d/%d avg=%f]", size(), capacity(),
                             getAverage());
    }
}
