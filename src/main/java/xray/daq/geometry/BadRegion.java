package xray.daq.geometry;

/**
 * Named rectangular exclusion zone, expressed either in physical x/y
 * coordinates or in slab fs/ss coordinates (never both).
 */
public final class BadRegion
{
    private final String name;
    private final String panel;
    private final boolean fsss;

    private final double minX;
    private final double maxX;
    private final double minY;
    private final double maxY;

    private final int minFs;
    private final int maxFs;
    private final int minSs;
    private final int maxSs;

    BadRegion(String name, String panel, boolean fsss, double minX,
              double maxX, double minY, double maxY, int minFs, int maxFs,
              int minSs, int maxSs)
    {
        this.name = name;
        this.panel = panel;
        this.fsss = fsss;
        this.minX = minX;
        this.maxX = maxX;
        this.minY = minY;
        this.maxY = maxY;
        this.minFs = minFs;
        this.maxFs = maxFs;
        this.minSs = minSs;
        this.maxSs = maxSs;
    }

    /**
     * Does this region cover the specified pixel?
     *
     * @param panelName name of the panel holding the pixel
     * @param fs slab fast-scan index
     * @param ss slab slow-scan index
     * @param x physical x coordinate of the pixel
     * @param y physical y coordinate of the pixel
     *
     * @return <tt>true</tt> if the pixel is excluded by this region
     */
    public boolean contains(String panelName, int fs, int ss, double x,
                            double y)
    {
        if (panel != null && !panel.equals(panelName)) {
            return false;
        }

        if (fsss) {
            return fs >= minFs && fs <= maxFs && ss >= minSs && ss <= maxSs;
        }

        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    public String getName()
    {
        return name;
    }

    /**
     * @return name of the panel this region is restricted to, or
     *         <tt>null</tt> if it applies to the whole detector
     */
    public String getPanel()
    {
        return panel;
    }

    /**
     * @return <tt>true</tt> if the region is defined in fs/ss coordinates
     */
    public boolean isFsss()
    {
        return fsss;
    }

    public double getMinX()
    {
        return minX;
    }

    public double getMaxX()
    {
        return maxX;
    }

    public double getMinY()
    {
        return minY;
    }

    public double getMaxY()
    {
        return maxY;
    }

    public int getMinFs()
    {
        return minFs;
    }

    public int getMaxFs()
    {
        return maxFs;
    }

    public int getMinSs()
    {
        return minSs;
    }

    public int getMaxSs()
    {
        return maxSs;
    }

    @Override
    public String toString()
    {
        if (fsss) {
            return String.format("BadRegion[%s fs %d-%d ss %d-%d]", name,
                                 minFs, maxFs, minSs, maxSs);
        }

        return String.format("BadRegion[%s x %f-%f y %f-%f]", name, minX,
                             maxX, minY, maxY);
    }
}
