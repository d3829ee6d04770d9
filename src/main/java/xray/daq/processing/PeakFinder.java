package xray.daq.processing;

import xray.daq.geometry.PixelMask;

/**
 * Locate Bragg peaks in a corrected slab frame.
 */
public interface PeakFinder
{
    /**
     * @param data corrected slab data, row-major
     * @param width slab width
     * @param height slab height
     * @param mask good-pixel mask; bad pixels never hold a peak
     *
     * @return peaks in slab coordinates
     */
    PeakList findPeaks(float[] data, int width, int height, PixelMask mask);
}
