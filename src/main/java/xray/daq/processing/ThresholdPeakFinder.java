package xray.daq.processing;

import org.apache.log4j.Logger;

import xray.daq.geometry.PixelMask;

/**
 * Simple peak finder.  A peak is a good pixel above the threshold which
 * is the maximum of its 3x3 neighbourhood; its position is the centre of
 * mass of the surrounding window.
 */
public class ThresholdPeakFinder
    implements PeakFinder
{
    private static final Logger LOG =
        Logger.getLogger(ThresholdPeakFinder.class);

    /** Frames with more candidate peaks than this are treated as noise */
    public static final int MAX_CANDIDATES = 10000;

    private final double threshold;
    private final int windowSize;

    /**
     * @param threshold minimum peak pixel value
     * @param windowSize half-width of the centre-of-mass window
     */
    public ThresholdPeakFinder(double threshold, int windowSize)
    {
        if (windowSize < 0) {
            throw new IllegalArgumentException("Bad window size " +
                                               windowSize);
        }

        this.threshold = threshold;
        this.windowSize = windowSize;
    }

    public double getThreshold()
    {
        return threshold;
    }

    private boolean isLocalMax(float[] data, int width, int height, int fs,
                               int ss)
    {
        final float val = data[ss * width + fs];
        for (int j = Math.max(0, ss - 1); j <= Math.min(height - 1, ss + 1);
             j++)
        {
            for (int i = Math.max(0, fs - 1); i <= Math.min(width - 1, fs + 1);
                 i++)
            {
                if (data[j * width + i] > val) {
                    return false;
                }
            }
        }

        return true;
    }

    @Override
    public PeakList findPeaks(float[] data, int width, int height,
                              PixelMask mask)
    {
        double[] fsList = new double[16];
        double[] ssList = new double[16];
        double[] intList = new double[16];
        int num = 0;

        for (int ss = 0; ss < height; ss++) {
            for (int fs = 0; fs < width; fs++) {
                final int idx = ss * width + fs;
                if (data[idx] <= threshold || !mask.isGood(idx) ||
                    !isLocalMax(data, width, height, fs, ss))
                {
                    continue;
                }

                if (num == MAX_CANDIDATES) {
                    LOG.warn("More than " + MAX_CANDIDATES +
                             " peak candidates; ignoring frame");
                    return PeakList.EMPTY;
                }

                if (num == fsList.length) {
                    fsList = grow(fsList);
                    ssList = grow(ssList);
                    intList = grow(intList);
                }

                double sum = 0.0;
                double sumFs = 0.0;
                double sumSs = 0.0;
                for (int j = Math.max(0, ss - windowSize);
                     j <= Math.min(height - 1, ss + windowSize); j++)
                {
                    for (int i = Math.max(0, fs - windowSize);
                         i <= Math.min(width - 1, fs + windowSize); i++)
                    {
                        final double val = data[j * width + i];
                        sum += val;
                        sumFs += val * i;
                        sumSs += val * j;
                    }
                }

                if (sum > 0.0) {
                    fsList[num] = sumFs / sum;
                    ssList[num] = sumSs / sum;
                } else {
                    fsList[num] = fs;
                    ssList[num] = ss;
                }
                intList[num] = data[idx];
                num++;
            }
        }

        return new PeakList(trim(fsList, num), trim(ssList, num),
                            trim(intList, num));
    }

    private static double[] grow(double[] array)
    {
        double[] bigger = new double[array.length * 2];
        System.arraycopy(array, 0, bigger, 0, array.length);
        return bigger;
    }

    private static double[] trim(double[] array, int len)
    {
        double[] trimmed = new double[len];
        System.arraycopy(array, 0, trimmed, 0, len);
        return trimmed;
    }
}
