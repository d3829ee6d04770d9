package xray.daq.geometry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable detector model: an ordered set of panels plus bad regions,
 * mask bit values and rigid groups.
 *
 * Instances are built by {@link GeometryLoader} and shared read-only by
 * every component which needs the detector layout.
 */
public final class Detector
{
    private final Map<String, Panel> panels;
    private final Map<String, BadRegion> badRegions;
    private final Map<String, List<String>> rigidGroups;
    private final Map<String, List<String>> rigidGroupCollections;

    private final int maskGood;
    private final int maskBad;

    private final Beam beam;
    private final String peakInfoLocation;

    private final int slabWidth;
    private final int slabHeight;

    private final PixelExtent furthestOut;
    private final PixelExtent furthestIn;

    Detector(Map<String, Panel> panels, Map<String, BadRegion> badRegions,
             Map<String, List<String>> rigidGroups,
             Map<String, List<String>> rigidGroupCollections, int maskGood,
             int maskBad, Beam beam, String peakInfoLocation)
    {
        this.panels =
            Collections.unmodifiableMap(new LinkedHashMap<String,
                                        Panel>(panels));
        this.badRegions =
            Collections.unmodifiableMap(new LinkedHashMap<String,
                                        BadRegion>(badRegions));
        this.rigidGroups = freezeGroups(rigidGroups);
        this.rigidGroupCollections = freezeGroups(rigidGroupCollections);
        this.maskGood = maskGood;
        this.maskBad = maskBad;
        this.beam = beam;
        this.peakInfoLocation = peakInfoLocation;

        int maxFs = 0;
        int maxSs = 0;
        for (Panel p : this.panels.values()) {
            if (p.getMaxFs() > maxFs) {
                maxFs = p.getMaxFs();
            }
            if (p.getMaxSs() > maxSs) {
                maxSs = p.getMaxSs();
            }
        }
        slabWidth = maxFs + 1;
        slabHeight = maxSs + 1;

        PixelExtent[] extremes = findExtremes(this.panels.values());
        furthestIn = extremes[0];
        furthestOut = extremes[1];
    }

    private static Map<String, List<String>>
        freezeGroups(Map<String, List<String>> groups)
    {
        LinkedHashMap<String, List<String>> copy =
            new LinkedHashMap<String, List<String>>();
        for (Map.Entry<String, List<String>> entry : groups.entrySet()) {
            copy.put(entry.getKey(),
                     Collections.unmodifiableList(new ArrayList<String>(entry.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Check the four corners of every panel to find the pixels closest to
     * and furthest from the beam axis.
     */
    private static PixelExtent[] findExtremes(Collection<Panel> panels)
    {
        PixelExtent in = null;
        PixelExtent out = null;

        for (Panel p : panels) {
            final int[][] corners = new int[][] {
                { 0, 0 },
                { p.getWidth(), 0 },
                { 0, p.getHeight() },
                { p.getWidth(), p.getHeight() },
            };

            for (int[] corner : corners) {
                final double rx =
                    p.toX(corner[0], corner[1]) / p.getResolution();
                final double ry =
                    p.toY(corner[0], corner[1]) / p.getResolution();
                final double dist = Math.sqrt(rx * rx + ry * ry);

                if (out == null || dist > out.getDistance()) {
                    out = new PixelExtent(p.getName(), corner[0], corner[1],
                                          dist);
                }
                if (in == null || dist < in.getDistance()) {
                    in = new PixelExtent(p.getName(), corner[0], corner[1],
                                         dist);
                }
            }
        }

        return new PixelExtent[] { in, out };
    }

    public Map<String, Panel> getPanels()
    {
        return panels;
    }

    /**
     * @return the named panel, or <tt>null</tt> if it does not exist
     */
    public Panel getPanel(String name)
    {
        return panels.get(name);
    }

    /**
     * The first panel declared in the description.  Detector-wide
     * quantities (resolution, camera length offset) are taken from it.
     */
    public Panel getFirstPanel()
    {
        return panels.values().iterator().next();
    }

    /**
     * Find the panel whose slab rectangle holds a pixel.  If panels
     * overlap, the last one declared wins, matching the pixel maps.
     *
     * @return panel, or <tt>null</tt> if no panel covers the pixel
     */
    public Panel findPanel(int fs, int ss)
    {
        Panel found = null;
        for (Panel p : panels.values()) {
            if (p.containsSlabPixel(fs, ss)) {
                found = p;
            }
        }
        return found;
    }

    public Map<String, BadRegion> getBadRegions()
    {
        return badRegions;
    }

    public Map<String, List<String>> getRigidGroups()
    {
        return rigidGroups;
    }

    public Map<String, List<String>> getRigidGroupCollections()
    {
        return rigidGroupCollections;
    }

    public int getMaskGood()
    {
        return maskGood;
    }

    public int getMaskBad()
    {
        return maskBad;
    }

    public Beam getBeam()
    {
        return beam;
    }

    /**
     * @return location of per-frame peak lists in the data, or
     *         <tt>null</tt>
     */
    public String getPeakInfoLocation()
    {
        return peakInfoLocation;
    }

    /**
     * Number of slab columns (largest max_fs + 1).
     */
    public int getSlabWidth()
    {
        return slabWidth;
    }

    /**
     * Number of slab rows (largest max_ss + 1).
     */
    public int getSlabHeight()
    {
        return slabHeight;
    }

    public PixelExtent getFurthestOut()
    {
        return furthestOut;
    }

    public PixelExtent getFurthestIn()
    {
        return furthestIn;
    }

    @Override
    public String toString()
    {
        return "Detector[" + panels.size() + " panels, " +
            badRegions.size() + " bad regions, slab " + slabWidth + "x" +
            slabHeight + "]";
    }

    /**
     * A panel corner and its distance (in metres) from the beam axis.
     */
    public static final class PixelExtent
    {
        private final String panel;
        private final int fs;
        private final int ss;
        private final double distance;

        PixelExtent(String panel, int fs, int ss, double distance)
        {
            this.panel = panel;
            this.fs = fs;
            this.ss = ss;
            this.distance = distance;
        }

        public String getPanel()
        {
            return panel;
        }

        public int getFs()
        {
            return fs;
        }

        public int getSs()
        {
            return ss;
        }

        public double getDistance()
        {
            return distance;
        }

        @Override
        public String toString()
        {
            return String.format("%s(%d,%d)@%f", panel, fs, ss, distance);
        }
    }
}
