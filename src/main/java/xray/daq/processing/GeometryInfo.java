package xray.daq.processing;

import xray.daq.geometry.Detector;
import xray.daq.geometry.PixelMaps;
import xray.daq.geometry.PixelMask;
import xray.daq.geometry.VisualizationPixelMaps;

/**
 * Everything derived from the detector geometry at startup.  Immutable
 * and shared by all threads of a rank.
 */
public final class GeometryInfo
{
    private final Detector detector;
    private final PixelMaps pixelMaps;
    private final PixelMask mask;
    private final VisualizationPixelMaps visualMaps;

    private GeometryInfo(Detector detector, PixelMaps pixelMaps,
                         PixelMask mask, VisualizationPixelMaps visualMaps)
    {
        this.detector = detector;
        this.pixelMaps = pixelMaps;
        this.mask = mask;
        this.visualMaps = visualMaps;
    }

    public static GeometryInfo from(Detector det)
    {
        PixelMaps maps = PixelMaps.compute(det);
        return new GeometryInfo(det, maps, PixelMask.fromDetector(det, maps),
                                maps.computeVisualizationPixelMaps());
    }

    public Detector getDetector()
    {
        return detector;
    }

    public PixelMaps getPixelMaps()
    {
        return pixelMaps;
    }

    public PixelMask getMask()
    {
        return mask;
    }

    public VisualizationPixelMaps getVisualizationMaps()
    {
        return visualMaps;
    }

    public int getSlabWidth()
    {
        return pixelMaps.getSlabWidth();
    }

    public int getSlabHeight()
    {
        return pixelMaps.getSlabHeight();
    }
}
