package xray.daq.processing;

import java.util.Arrays;

/**
 * Detected Bragg peaks as parallel arrays of fast-scan position, slow-scan
 * position and integrated intensity.
 */
public final class PeakList
{
    public static final PeakList EMPTY =
        new PeakList(new double[0], new double[0], new double[0]);

    private final double[] fs;
    private final double[] ss;
    private final double[] intensity;

    public PeakList(double[] fs, double[] ss, double[] intensity)
    {
        if (fs.length != ss.length || fs.length != intensity.length) {
            throw new IllegalArgumentException("Peak arrays differ in" +
                                               " length (fs " + fs.length +
                                               ", ss " + ss.length +
                                               ", intensity " +
                                               intensity.length + ")");
        }

        this.fs = fs.clone();
        this.ss = ss.clone();
        this.intensity = intensity.clone();
    }

    public int size()
    {
        return fs.length;
    }

    public boolean isEmpty()
    {
        return fs.length == 0;
    }

    public double getFs(int idx)
    {
        return fs[idx];
    }

    public double getSs(int idx)
    {
        return ss[idx];
    }

    public double getIntensity(int idx)
    {
        return intensity[idx];
    }

    public double[] toFsArray()
    {
        return fs.clone();
    }

    public double[] toSsArray()
    {
        return ss.clone();
    }

    public double[] toIntensityArray()
    {
        return intensity.clone();
    }

    @Override
    public boolean equals(Object obj)
    {
        if (!(obj instanceof PeakList)) {
            return false;
        }

        PeakList other = (PeakList) obj;
        return Arrays.equals(fs, other.fs) && Arrays.equals(ss, other.ss) &&
            Arrays.equals(intensity, other.intensity);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(fs) ^ Arrays.hashCode(ss) ^
            Arrays.hashCode(intensity);
    }

    @Override
    public String toString()
    {
        return "PeakList[" + fs.length + " peaks]";
    }
}
