package xray.daq.source;

import java.io.File;

import xray.daq.configuration.ConfigException;
import xray.daq.configuration.MonitorConfig;
import xray.daq.geometry.Detector;

/**
 * Known data sources, selected by the <tt>source.kind</tt> setting.
 */
public enum SourceKind
{
    FILES
    {
        @Override
        public EventSource create(MonitorConfig cfg, Detector det)
            throws ConfigException, SourceAccessException
        {
            final File listFile = cfg.getFile(MonitorConfig.SOURCE_FILE_LIST);
            return new FileListEventSource(FileListEventSource.readFileList(listFile),
                                           det.getSlabWidth() *
                                           det.getSlabHeight(),
                                           fallbackEnergy(cfg),
                                           fallbackDistance(cfg));
        }
    },
    SYNTHETIC
    {
        @Override
        public EventSource create(MonitorConfig cfg, Detector det)
            throws ConfigException
        {
            final double hitFraction =
                cfg.getDouble(MonitorConfig.SYNTHETIC_HIT_FRACTION, 0.1);
            if (hitFraction < 0.0 || hitFraction > 1.0) {
                throw new ConfigException("\"" +
                                          MonitorConfig.SYNTHETIC_HIT_FRACTION +
                                          "\" must be between 0 and 1");
            }

            return new SyntheticEventSource(det.getSlabWidth(),
                                            det.getSlabHeight(),
                                            cfg.getBoundedInt(MonitorConfig.SYNTHETIC_EVENTS,
                                                              100, 0),
                                            cfg.getBoundedInt(MonitorConfig.SYNTHETIC_FRAMES,
                                                              1, 1),
                                            hitFraction,
                                            cfg.getDouble(MonitorConfig.SYNTHETIC_PEAKS,
                                                          30.0),
                                            cfg.getInt(MonitorConfig.SYNTHETIC_SEED,
                                                       4357),
                                            fallbackEnergy(cfg),
                                            fallbackDistance(cfg));
        }
    };

    /**
     * Build the configured source.
     *
     * @param cfg settings
     * @param det detector layout, which fixes the frame size
     *
     * @return new event source
     *
     * @throws ConfigException if a setting is missing or malformed
     * @throws SourceAccessException if the source's index cannot be read
     */
    public abstract EventSource create(MonitorConfig cfg, Detector det)
        throws ConfigException, SourceAccessException;

    private static double fallbackEnergy(MonitorConfig cfg)
        throws ConfigException
    {
        return cfg.getDouble(MonitorConfig.FALLBACK_BEAM_ENERGY, Double.NaN);
    }

    private static double fallbackDistance(MonitorConfig cfg)
        throws ConfigException
    {
        return cfg.getDouble(MonitorConfig.FALLBACK_DETECTOR_DISTANCE,
                             Double.NaN);
    }

    /**
     * Find the source kind named by a setting value (case-insensitive).
     *
     * @throws ConfigException if the name is unknown
     */
    public static SourceKind lookup(String name)
        throws ConfigException
    {
        for (SourceKind kind : values()) {
            if (kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }

        throw new ConfigException("Unknown source kind \"" + name + "\"");
    }
}
