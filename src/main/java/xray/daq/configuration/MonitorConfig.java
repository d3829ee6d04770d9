package xray.daq.configuration;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.TreeMap;

import org.apache.log4j.Logger;

/**
 * Immutable monitor settings, loaded once at startup and handed to every
 * component which needs them.
 */
public final class MonitorConfig
{
    private static final Logger LOG = Logger.getLogger(MonitorConfig.class);

    public static final String GEOMETRY_FILE = "geometry.file";

    public static final String SOURCE_KIND = "source.kind";
    public static final String SOURCE_FILE_LIST = "source.file.list";
    public static final String FALLBACK_BEAM_ENERGY =
        "source.fallback.beam.energy";
    public static final String FALLBACK_DETECTOR_DISTANCE =
        "source.fallback.detector.distance";
    public static final String SYNTHETIC_EVENTS = "source.synthetic.events";
    public static final String SYNTHETIC_FRAMES =
        "source.synthetic.frames.per.event";
    public static final String SYNTHETIC_HIT_FRACTION =
        "source.synthetic.hit.fraction";
    public static final String SYNTHETIC_PEAKS = "source.synthetic.peaks";
    public static final String SYNTHETIC_SEED = "source.synthetic.seed";
    public static final String FRAMES_PER_EVENT = "frames.per.event";
    public static final String EVENT_REJECTION_THRESHOLD =
        "event.rejection.threshold";

    public static final String DARK_FILE = "processing.dark.file";
    public static final String GAIN_FILE = "processing.gain.file";
    public static final String PEAK_FINDER = "processing.peak.finder";
    public static final String PEAK_THRESHOLD = "processing.peak.threshold";
    public static final String PEAK_WINDOW = "processing.peak.window";
    public static final String MIN_PEAKS = "processing.min.peaks";
    public static final String MAX_PEAKS = "processing.max.peaks";
    public static final String MAX_SATURATED_PEAKS =
        "processing.max.saturated.peaks";
    public static final String SATURATION_VALUE =
        "processing.saturation.value";
    public static final String HIT_FRAME_INTERVAL =
        "hit.frame.sending.interval";
    public static final String NON_HIT_FRAME_INTERVAL =
        "non.hit.frame.sending.interval";

    public static final String WINDOW_SIZE = "running.average.window.size";
    public static final String BROADCAST_INTERVAL = "data.broadcast.interval";
    public static final String SPEED_REPORT_INTERVAL =
        "speed.report.interval";
    public static final String BROADCAST_ENDPOINT = "broadcast.endpoint";
    public static final String RESOLUTION_RINGS = "resolution.rings";
    public static final String RESPONDING_ENDPOINT = "responding.endpoint";
    public static final String REQUEST_QUEUE_SIZE = "request.queue.size";

    public static final String TRANSPORT_MODE = "transport.mode";
    public static final String COLLECTOR_ADDRESS = "transport.collector.address";
    public static final String CONNECT_TIMEOUT = "transport.connect.timeout";
    public static final String POOL_SIZE = "pool.size";
    public static final String RANK = "rank";
    public static final String RECEIVE_TIMEOUT = "collector.receive.timeout";
    public static final String SHUTDOWN_RETRIES = "collector.shutdown.retries";

    /** System properties which override the file */
    public static final String RANK_PROPERTY = "xray.daq.rank";
    public static final String POOL_SIZE_PROPERTY = "xray.daq.poolSize";

    private final Properties props;
    /** Directory used to resolve relative file names */
    private final File baseDir;

    /**
     * Wrap a set of properties.  The properties are copied.
     */
    public MonitorConfig(Properties props)
    {
        this(props, null);
    }

    /**
     * Wrap a set of properties.  The properties are copied.
     *
     * @param props settings
     * @param baseDir directory for relative file names (may be
     *                <tt>null</tt>)
     */
    public MonitorConfig(Properties props, File baseDir)
    {
        this.baseDir = baseDir;
        this.props = new Properties();
        for (String key : props.stringPropertyNames()) {
            this.props.setProperty(key, props.getProperty(key).trim());
        }
    }

    /**
     * Load settings from a properties file.  The rank and pool size may
     * be overridden by the <tt>xray.daq.rank</tt> and
     * <tt>xray.daq.poolSize</tt> system properties.
     *
     * @param file properties file
     *
     * @return loaded settings
     *
     * @throws ConfigException if the file cannot be read
     */
    public static MonitorConfig load(File file)
        throws ConfigException
    {
        Properties props = new Properties();

        InputStream in = null;
        try {
            in = new FileInputStream(file);
            props.load(in);
        } catch (IOException ioe) {
            throw new ConfigException("Cannot read configuration file " +
                                      file, ioe);
        } finally {
            if (in != null) {
                try {
                    in.close();
                } catch (IOException ioe) {
                    LOG.error("Cannot close " + file, ioe);
                }
            }
        }

        copySystemProperty(props, RANK_PROPERTY, RANK);
        copySystemProperty(props, POOL_SIZE_PROPERTY, POOL_SIZE);

        return new MonitorConfig(props,
                                 file.getAbsoluteFile().getParentFile());
    }

    private static void copySystemProperty(Properties props, String sysKey,
                                           String key)
    {
        final String val = System.getProperty(sysKey);
        if (val != null) {
            props.setProperty(key, val);
        }
    }

    /**
     * Return a copy of these settings with one value replaced.
     */
    public MonitorConfig with(String key, String value)
    {
        Properties copy = new Properties();
        copy.putAll(props);
        copy.setProperty(key, value);
        return new MonitorConfig(copy, baseDir);
    }

    public boolean contains(String key)
    {
        final String val = props.getProperty(key);
        return val != null && val.length() > 0;
    }

    /**
     * @throws ConfigException if the key is not set
     */
    public String getString(String key)
        throws ConfigException
    {
        if (!contains(key)) {
            throw new ConfigException("Missing required setting \"" + key +
                                      "\"");
        }

        return props.getProperty(key);
    }

    public String getString(String key, String defaultValue)
    {
        if (!contains(key)) {
            return defaultValue;
        }

        return props.getProperty(key);
    }

    public int getInt(String key)
        throws ConfigException
    {
        return parseInt(key, getString(key));
    }

    public int getInt(String key, int defaultValue)
        throws ConfigException
    {
        if (!contains(key)) {
            return defaultValue;
        }

        return parseInt(key, props.getProperty(key));
    }

    private static int parseInt(String key, String val)
        throws ConfigException
    {
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException nfe) {
            throw new ConfigException("Bad integer value \"" + val +
                                      "\" for \"" + key + "\"", nfe);
        }
    }

    public long getLong(String key, long defaultValue)
        throws ConfigException
    {
        if (!contains(key)) {
            return defaultValue;
        }

        final String val = props.getProperty(key);
        try {
            return Long.parseLong(val);
        } catch (NumberFormatException nfe) {
            throw new ConfigException("Bad integer value \"" + val +
                                      "\" for \"" + key + "\"", nfe);
        }
    }

    public double getDouble(String key, double defaultValue)
        throws ConfigException
    {
        if (!contains(key)) {
            return defaultValue;
        }

        return parseDouble(key, props.getProperty(key));
    }

    private static double parseDouble(String key, String val)
        throws ConfigException
    {
        try {
            return Double.parseDouble(val);
        } catch (NumberFormatException nfe) {
            throw new ConfigException("Bad numeric value \"" + val +
                                      "\" for \"" + key + "\"", nfe);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue)
        throws ConfigException
    {
        if (!contains(key)) {
            return defaultValue;
        }

        final String val = props.getProperty(key);
        if (val.equalsIgnoreCase("true") || val.equalsIgnoreCase("yes")) {
            return true;
        } else if (val.equalsIgnoreCase("false") ||
                   val.equalsIgnoreCase("no"))
        {
            return false;
        }

        throw new ConfigException("Bad boolean value \"" + val +
                                  "\" for \"" + key + "\"");
    }

    /**
     * Parse a comma-separated list of numbers.
     */
    public List<Double> getDoubleList(String key, List<Double> defaultValue)
        throws ConfigException
    {
        if (!contains(key)) {
            return defaultValue;
        }

        ArrayList<Double> list = new ArrayList<Double>();
        for (String item : props.getProperty(key).split(",")) {
            final String trimmed = item.trim();
            if (trimmed.length() > 0) {
                list.add(parseDouble(key, trimmed));
            }
        }

        return Collections.unmodifiableList(list);
    }

    /**
     * Get an integer which must be at least <tt>minimum</tt>.
     */
    public int getBoundedInt(String key, int defaultValue, int minimum)
        throws ConfigException
    {
        final int val = getInt(key, defaultValue);
        if (val < minimum) {
            throw new ConfigException("\"" + key + "\" must be at least " +
                                      minimum + ", not " + val);
        }

        return val;
    }

    /**
     * Resolve a file setting.  Relative paths are resolved against the
     * directory holding the configuration file.
     */
    public File getFile(String key)
        throws ConfigException
    {
        File file = new File(getString(key));
        if (!file.isAbsolute() && baseDir != null) {
            file = new File(baseDir, file.getPath());
        }

        return file;
    }

    @Override
    public String toString()
    {
        return "MonitorConfig" + new TreeMap<Object, Object>(props);
    }
}
