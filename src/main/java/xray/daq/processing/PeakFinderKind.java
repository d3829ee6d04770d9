package xray.daq.processing;

import xray.daq.configuration.ConfigException;
import xray.daq.configuration.MonitorConfig;
import xray.daq.geometry.PixelMask;

/**
 * Peak finders selectable through <tt>processing.peak.finder</tt>.
 */
public enum PeakFinderKind
{
    THRESHOLD
    {
        @Override
        public PeakFinder create(MonitorConfig cfg)
            throws ConfigException
        {
            return new ThresholdPeakFinder(cfg.getDouble(MonitorConfig.PEAK_THRESHOLD,
                                                         100.0),
                                           cfg.getBoundedInt(MonitorConfig.PEAK_WINDOW,
                                                             2, 0));
        }
    },
    NONE
    {
        @Override
        public PeakFinder create(MonitorConfig cfg)
        {
            return new PeakFinder() {
                @Override
                public PeakList findPeaks(float[] data, int width,
                                          int height, PixelMask mask)
                {
                    return PeakList.EMPTY;
                }
            };
        }
    };

    public abstract PeakFinder create(MonitorConfig cfg)
        throws ConfigException;

    /**
     * Find a peak finder by name (case-insensitive).
     *
     * @throws ConfigException if the name is unknown
     */
    public static PeakFinderKind lookup(String name)
        throws ConfigException
    {
        for (PeakFinderKind kind : values()) {
            if (kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }

        throw new ConfigException("Unknown peak finder \"" + name + "\"");
    }
}
