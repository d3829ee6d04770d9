package xray.daq.geometry;

/**
 * Physical coordinates for every slab pixel, stored row-major
 * (<tt>index = ss * slabWidth + fs</tt>).
 *
 * Slab pixels not covered by any panel map to the origin.  Instances
 * are immutable and may be shared between threads.
 */
public final class PixelMaps
{
    private final int slabWidth;
    private final int slabHeight;

    private final double[] x;
    private final double[] y;
    private final double[] z;
    private final double[] r;
    private final double[] phi;

    private PixelMaps(int slabWidth, int slabHeight, double[] x, double[] y,
                      double[] z)
    {
        this.slabWidth = slabWidth;
        this.slabHeight = slabHeight;
        this.x = x;
        this.y = y;
        this.z = z;

        r = new double[x.length];
        phi = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            r[i] = Math.sqrt(x[i] * x[i] + y[i] * y[i]);
            phi[i] = Math.atan2(y[i], x[i]);
        }
    }

    /**
     * Compute pixel maps for a detector.
     *
     * Panels are written in declaration order, so if two panels claim the
     * same slab pixel the later one wins.
     *
     * @param det detector layout
     *
     * @return new pixel maps
     */
    public static PixelMaps compute(Detector det)
    {
        final int width = det.getSlabWidth();
        final int height = det.getSlabHeight();

        double[] x = new double[width * height];
        double[] y = new double[width * height];
        double[] z = new double[width * height];

        final double clen = det.getFirstPanel().getCameraLength();

        for (Panel p : det.getPanels().values()) {
            for (int ss = 0; ss < p.getHeight(); ss++) {
                final int row = (ss + p.getMinSs()) * width;
                for (int fs = 0; fs < p.getWidth(); fs++) {
                    final int idx = row + fs + p.getMinFs();
                    x[idx] = p.toX(fs, ss);
                    y[idx] = p.toY(fs, ss);
                    z[idx] = clen;
                }
            }
        }

        return new PixelMaps(width, height, x, y, z);
    }

    /**
     * Smallest origin-centred image which holds every pixel.
     *
     * @return <tt>{ height, width }</tt>
     */
    public int[] computeVisualizationShape()
    {
        return new int[] { symmetricExtent(y), symmetricExtent(x) };
    }

    private static int symmetricExtent(double[] vals)
    {
        double min = 0.0;
        double max = 0.0;
        for (int i = 0; i < vals.length; i++) {
            if (vals[i] < min) {
                min = vals[i];
            }
            if (vals[i] > max) {
                max = vals[i];
            }
        }

        return 2 * (int) Math.max(Math.abs(min), Math.abs(max)) + 2;
    }

    /**
     * Re-express the physical maps as indices into the visualization image.
     *
     * @return visualization maps
     */
    public VisualizationPixelMaps computeVisualizationPixelMaps()
    {
        final int[] shape = computeVisualizationShape();

        int[] visX = new int[x.length];
        int[] visY = new int[y.length];
        for (int i = 0; i < x.length; i++) {
            visX[i] = (int) x[i] + shape[1] / 2 - 1;
            visY[i] = (int) y[i] + shape[0] / 2 - 1;
        }

        return new VisualizationPixelMaps(shape[0], shape[1], visX, visY);
    }

    public int getSlabWidth()
    {
        return slabWidth;
    }

    public int getSlabHeight()
    {
        return slabHeight;
    }

    public int size()
    {
        return x.length;
    }

    public double getX(int index)
    {
        return x[index];
    }

    public double getY(int index)
    {
        return y[index];
    }

    /**
     * @return camera length used for this pixel (NaN if it is read from
     *         the data stream)
     */
    public double getZ(int index)
    {
        return z[index];
    }

    public double getRadius(int index)
    {
        return r[index];
    }

    public double getPhi(int index)
    {
        return phi[index];
    }

    public double getX(int fs, int ss)
    {
        return x[ss * slabWidth + fs];
    }

    public double getY(int fs, int ss)
    {
        return y[ss * slabWidth + fs];
    }

    public double getRadius(int fs, int ss)
    {
        return r[ss * slabWidth + fs];
    }

    @Override
    public String toString()
    {
        return "PixelMaps[" + slabHeight + "x" + slabWidth + "]";
    }
}
