package xray.daq.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rectangular sub-region of the detector's slab pixel array, with its
 * own physical placement and orientation.
 *
 * Physical coordinates are expressed in pixel units relative to the beam
 * interaction point; divide by {@link #getResolution()} to get metres.
 */
public final class Panel
{
    private final String name;

    private final int minFs;
    private final int maxFs;
    private final int minSs;
    private final int maxSs;
    private final int width;
    private final int height;

    private final double cornerX;
    private final double cornerY;

    private final double fsx;
    private final double fsy;
    private final double fsz;
    private final double ssx;
    private final double ssy;
    private final double ssz;

    /** inverse of the fs/ss basis */
    private final double xfs;
    private final double yfs;
    private final double xss;
    private final double yss;

    private final double resolution;
    private final double cameraLength;
    private final String cameraLengthFrom;
    private final double cameraLengthOffset;
    private final double aduPerEv;
    private final double aduPerPhoton;
    private final double maxAdu;
    private final char badRowDirection;
    private final boolean noIndex;

    private final String data;
    private final String mask;
    private final String maskFile;
    private final String saturationMap;
    private final String saturationMapFile;

    private final double railX;
    private final double railY;
    private final double railZ;
    private final double clenForCentering;

    private final List<DimEntry> dimStructure;

    Panel(Builder bldr)
    {
        name = bldr.name;

        minFs = bldr.minFs;
        maxFs = bldr.maxFs;
        minSs = bldr.minSs;
        maxSs = bldr.maxSs;
        width = maxFs - minFs + 1;
        height = maxSs - minSs + 1;

        cornerX = bldr.cornerX;
        cornerY = bldr.cornerY;

        fsx = bldr.fsx;
        fsy = bldr.fsy;
        fsz = bldr.fsz;
        ssx = bldr.ssx;
        ssy = bldr.ssy;
        ssz = bldr.ssz;

        final double det = fsx * ssy - ssx * fsy;
        xfs = ssy / det;
        yfs = -ssx / det;
        xss = -fsy / det;
        yss = fsx / det;

        resolution = bldr.resolution;
        cameraLength = bldr.cameraLength;
        cameraLengthFrom = bldr.cameraLengthFrom;
        cameraLengthOffset = bldr.cameraLengthOffset;
        aduPerEv = bldr.aduPerEv;
        aduPerPhoton = bldr.aduPerPhoton;
        maxAdu = bldr.maxAdu;
        badRowDirection = bldr.badRowDirection;
        noIndex = bldr.noIndex;

        data = bldr.data;
        mask = bldr.mask;
        maskFile = bldr.maskFile;
        saturationMap = bldr.saturationMap;
        saturationMapFile = bldr.saturationMapFile;

        if (Double.isNaN(bldr.railX)) {
            railX = 0.0;
            railY = 0.0;
            railZ = 1.0;
        } else {
            railX = bldr.railX;
            railY = bldr.railY;
            railZ = bldr.railZ;
        }
        if (Double.isNaN(bldr.clenForCentering)) {
            clenForCentering = 0.0;
        } else {
            clenForCentering = bldr.clenForCentering;
        }

        dimStructure =
            Collections.unmodifiableList(new ArrayList<DimEntry>(bldr.dims));
    }

    /**
     * Determinant of the fs/ss to x/y basis.
     */
    public double getDeterminant()
    {
        return fsx * ssy - ssx * fsy;
    }

    /**
     * Map a panel-relative pixel position to physical x.
     *
     * @param fs fast-scan offset from the panel's first column
     * @param ss slow-scan offset from the panel's first row
     */
    public double toX(double fs, double ss)
    {
        return ss * ssx + fs * fsx + cornerX;
    }

    /**
     * Map a panel-relative pixel position to physical y.
     *
     * @param fs fast-scan offset from the panel's first column
     * @param ss slow-scan offset from the panel's first row
     */
    public double toY(double fs, double ss)
    {
        return ss * ssy + fs * fsy + cornerY;
    }

    /**
     * Map a physical position back to a panel-relative fast-scan offset.
     */
    public double toFs(double x, double y)
    {
        return xfs * (x - cornerX) + yfs * (y - cornerY);
    }

    /**
     * Map a physical position back to a panel-relative slow-scan offset.
     */
    public double toSs(double x, double y)
    {
        return xss * (x - cornerX) + yss * (y - cornerY);
    }

    /**
     * Does this panel's slab rectangle contain the pixel?
     */
    public boolean containsSlabPixel(int fs, int ss)
    {
        return fs >= minFs && fs <= maxFs && ss >= minSs && ss <= maxSs;
    }

    public String getName()
    {
        return name;
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

    public int getWidth()
    {
        return width;
    }

    public int getHeight()
    {
        return height;
    }

    public double getCornerX()
    {
        return cornerX;
    }

    public double getCornerY()
    {
        return cornerY;
    }

    public double getFsx()
    {
        return fsx;
    }

    public double getFsy()
    {
        return fsy;
    }

    public double getFsz()
    {
        return fsz;
    }

    public double getSsx()
    {
        return ssx;
    }

    public double getSsy()
    {
        return ssy;
    }

    public double getSsz()
    {
        return ssz;
    }

    public double getXfs()
    {
        return xfs;
    }

    public double getYfs()
    {
        return yfs;
    }

    public double getXss()
    {
        return xss;
    }

    public double getYss()
    {
        return yss;
    }

    /**
     * @return pixels per metre
     */
    public double getResolution()
    {
        return resolution;
    }

    /**
     * @return camera length in metres, or NaN if it is read from the data
     */
    public double getCameraLength()
    {
        return cameraLength;
    }

    /**
     * @return data location of the camera length, or <tt>null</tt>
     */
    public String getCameraLengthFrom()
    {
        return cameraLengthFrom;
    }

    public double getCameraLengthOffset()
    {
        return cameraLengthOffset;
    }

    /**
     * @return ADU per eV, or NaN if the gain is given per photon
     */
    public double getAduPerEv()
    {
        return aduPerEv;
    }

    /**
     * @return ADU per photon, or NaN if the gain is given per eV
     */
    public double getAduPerPhoton()
    {
        return aduPerPhoton;
    }

    public double getMaxAdu()
    {
        return maxAdu;
    }

    /**
     * @return 'f', 's' or '-'
     */
    public char getBadRowDirection()
    {
        return badRowDirection;
    }

    public boolean isNoIndex()
    {
        return noIndex;
    }

    public String getData()
    {
        return data;
    }

    public String getMask()
    {
        return mask;
    }

    public String getMaskFile()
    {
        return maskFile;
    }

    public String getSaturationMap()
    {
        return saturationMap;
    }

    public String getSaturationMapFile()
    {
        return saturationMapFile;
    }

    public double getRailX()
    {
        return railX;
    }

    public double getRailY()
    {
        return railY;
    }

    public double getRailZ()
    {
        return railZ;
    }

    public double getClenForCentering()
    {
        return clenForCentering;
    }

    public List<DimEntry> getDimStructure()
    {
        return dimStructure;
    }

    /**
     * Number of placeholder axes in the dimension structure.
     */
    public int getNumPlaceholders()
    {
        int num = 0;
        for (DimEntry entry : dimStructure) {
            if (entry.getKind() == DimEntry.Kind.PLACEHOLDER) {
                num++;
            }
        }
        return num;
    }

    @Override
    public String toString()
    {
        return String.format("Panel[%s fs %d-%d ss %d-%d corner (%f,%f)]",
                             name, minFs, maxFs, minSs, maxSs, cornerX,
                             cornerY);
    }

    /**
     * Mutable panel description filled in while a geometry file is parsed.
     *
     * Unset numeric fields are NaN (or -1 for the pixel bounds) so that
     * missing values can be detected once the whole file has been read.
     */
    static final class Builder
    {
        String name;

        int minFs = -1;
        int maxFs = -1;
        int minSs = -1;
        int maxSs = -1;

        double cornerX = Double.NaN;
        double cornerY = Double.NaN;

        double fsx = 1.0;
        double fsy;
        double fsz;
        double ssx;
        double ssy = 1.0;
        double ssz;

        double resolution = -1.0;
        double cameraLength = Double.NaN;
        String cameraLengthFrom;
        double cameraLengthOffset;
        double aduPerEv = Double.NaN;
        double aduPerPhoton = Double.NaN;
        double maxAdu = Double.POSITIVE_INFINITY;
        char badRowDirection = '-';
        boolean noIndex;

        String data;
        String mask;
        String maskFile;
        String saturationMap;
        String saturationMapFile;

        double railX = Double.NaN;
        double railY = Double.NaN;
        double railZ = Double.NaN;
        double clenForCentering = Double.NaN;

        List<DimEntry> dims = new ArrayList<DimEntry>();

        Builder(String name)
        {
            this.name = name;
        }

        /**
         * Copy the detector-wide defaults into a new named panel.
         */
        Builder copy(String newName)
        {
            Builder bldr = new Builder(newName);

            bldr.minFs = minFs;
            bldr.maxFs = maxFs;
            bldr.minSs = minSs;
            bldr.maxSs = maxSs;
            bldr.cornerX = cornerX;
            bldr.cornerY = cornerY;
            bldr.fsx = fsx;
            bldr.fsy = fsy;
            bldr.fsz = fsz;
            bldr.ssx = ssx;
            bldr.ssy = ssy;
            bldr.ssz = ssz;
            bldr.resolution = resolution;
            bldr.cameraLength = cameraLength;
            bldr.cameraLengthFrom = cameraLengthFrom;
            bldr.cameraLengthOffset = cameraLengthOffset;
            bldr.aduPerEv = aduPerEv;
            bldr.aduPerPhoton = aduPerPhoton;
            bldr.maxAdu = maxAdu;
            bldr.badRowDirection = badRowDirection;
            bldr.noIndex = noIndex;
            bldr.data = data;
            bldr.mask = mask;
            bldr.maskFile = maskFile;
            bldr.saturationMap = saturationMap;
            bldr.saturationMapFile = saturationMapFile;
            bldr.railX = railX;
            bldr.railY = railY;
            bldr.railZ = railZ;
            bldr.clenForCentering = clenForCentering;
            bldr.dims = new ArrayList<DimEntry>(dims);

            return bldr;
        }

        void setDim(int index, DimEntry entry)
        {
            while (dims.size() <= index) {
                dims.add(null);
            }
            dims.set(index, entry);
        }
    }
}
