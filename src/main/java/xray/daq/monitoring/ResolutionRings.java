package xray.daq.monitoring;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sizes of the resolution rings drawn over the virtual powder pattern.
 *
 * For a ring at resolution <tt>d</tt> the diameter in pixels is
 * <tt>2 * res * (D + coffset) * tan(2 * asin(lambda / 2d))</tt>, with
 * <tt>lambda = h*c / E</tt>.  Rings the beam cannot reach
 * (<tt>lambda / 2d &gt; 1</tt>) are left out.
 */
public final class ResolutionRings
{
    /** Planck constant (J s) */
    public static final double PLANCK = 6.62607015E-34;
    /** Speed of light (m/s) */
    public static final double SPEED_OF_LIGHT = 299792458.0;
    /** Joules per electronvolt */
    public static final double JOULES_PER_EV = 1.602176634E-19;

    /** Rings cannot be computed without beam energy and distance */
    public static final ResolutionRings UNAVAILABLE =
        new ResolutionRings(false, Collections.<Double>emptyList(),
                            new double[0]);

    private final boolean available;
    private final List<Double> resolutions;
    private final double[] diameters;

    private ResolutionRings(boolean available, List<Double> resolutions,
                            double[] diameters)
    {
        this.available = available;
        this.resolutions = resolutions;
        this.diameters = diameters;
    }

    /**
     * @return wavelength in metres for a photon energy in eV
     */
    public static double wavelength(double beamEnergy)
    {
        return PLANCK * SPEED_OF_LIGHT / (beamEnergy * JOULES_PER_EV);
    }

    /**
     * Compute ring sizes.
     *
     * @param ringsAngstrom ring resolutions in Angstrom
     * @param beamEnergy photon energy in eV
     * @param distance detector distance in metres
     * @param pixelsPerMetre detector resolution
     * @param coffset camera length offset in metres
     *
     * @return rings, or {@link #UNAVAILABLE} if the beam energy or
     *         distance is missing or not positive
     */
    public static ResolutionRings compute(List<Double> ringsAngstrom,
                                          double beamEnergy, double distance,
                                          double pixelsPerMetre,
                                          double coffset)
    {
        if (!isUsable(beamEnergy) || !isUsable(distance)) {
            return UNAVAILABLE;
        }

        final double lambda = wavelength(beamEnergy);

        ArrayList<Double> kept = new ArrayList<Double>();
        double[] sizes = new double[ringsAngstrom.size()];
        for (Double res : ringsAngstrom) {
            if (res == null || !(res > 0.0)) {
                continue;
            }

            final double sinTheta = lambda / (2.0 * res * 1.0E-10);
            if (sinTheta > 1.0) {
                continue;
            }

            sizes[kept.size()] = 2.0 * pixelsPerMetre * (distance + coffset) *
                Math.tan(2.0 * Math.asin(sinTheta));
            kept.add(res);
        }

        double[] diameters = new double[kept.size()];
        System.arraycopy(sizes, 0, diameters, 0, diameters.length);

        return new ResolutionRings(true, Collections.unmodifiableList(kept),
                                   diameters);
    }

    private static boolean isUsable(double val)
    {
        return !Double.isNaN(val) && !Double.isInfinite(val) && val > 0.0;
    }

    public boolean isAvailable()
    {
        return available;
    }

    /**
     * @return number of reachable rings
     */
    public int size()
    {
        return diameters.length;
    }

    /**
     * @return ring resolution in Angstrom
     */
    public double getResolution(int idx)
    {
        return resolutions.get(idx);
    }

    /**
     * @return ring diameter in pixels
     */
    public double getDiameter(int idx)
    {
        return diameters[idx];
    }

    @Override
    public String toString()
    {
        if (!available) {
            return "ResolutionRings[unavailable]";
        }

        StringBuilder buf = new StringBuilder("ResolutionRings[");
        for (int i = 0; i < diameters.length; i++) {
            if (i > 0) {
                buf.append(", ");
            }
            buf.append(resolutions.get(i)).append("A=").
                append(String.format("%.1fpx", diameters[i]));
        }
        return buf.append(']').toString();
    }
}
