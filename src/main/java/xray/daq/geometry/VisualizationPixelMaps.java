package xray.daq.geometry;

/**
 * Integer indices into an origin-centred visualization image for each
 * slab pixel.
 */
public final class VisualizationPixelMaps
{
    private final int height;
    private final int width;
    private final int[] x;
    private final int[] y;

    VisualizationPixelMaps(int height, int width, int[] x, int[] y)
    {
        this.height = height;
        this.width = width;
        this.x = x;
        this.y = y;
    }

    /**
     * @return visualization image height
     */
    public int getHeight()
    {
        return height;
    }

    /**
     * @return visualization image width
     */
    public int getWidth()
    {
        return width;
    }

    public int size()
    {
        return x.length;
    }

    /**
     * @param slabIndex <tt>ss * slabWidth + fs</tt>
     *
     * @return visualization column
     */
    public int getX(int slabIndex)
    {
        return x[slabIndex];
    }

    /**
     * @param slabIndex <tt>ss * slabWidth + fs</tt>
     *
     * @return visualization row
     */
    public int getY(int slabIndex)
    {
        return y[slabIndex];
    }
}
