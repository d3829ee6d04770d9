package xray.daq.geometry;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Build a {@link Detector} from a line-oriented geometry description.
 *
 * Each line is an assignment <tt>[name/]key = value</tt>.  Lines starting
 * with ';' are comments, as is anything following a ';' on a value line.
 * Keys without a <tt>name/</tt> prefix are detector-wide settings; panel
 * keys given at the top level become defaults for every panel which is
 * first mentioned later in the file.  Names starting with <tt>bad</tt>
 * declare bad regions rather than panels.
 *
 * The description is validated only after every line has been read,
 * since later lines may complete panels started earlier.
 */
public final class GeometryLoader
{
    private static final Logger LOG = Logger.getLogger(GeometryLoader.class);

    private static final String RIGID_GROUP = "rigid_group";
    private static final String RIGID_GROUP_COLLECTION =
        "rigid_group_collection";

    /** Highest rank of a detector data array */
    public static final int MAX_DIMENSIONS = 32;

    /** Name used in error messages */
    private final String source;

    private final LinkedHashMap<String, Panel.Builder> panels =
        new LinkedHashMap<String, Panel.Builder>();
    private final LinkedHashMap<String, BadRegionBuilder> badRegions =
        new LinkedHashMap<String, BadRegionBuilder>();
    private final LinkedHashMap<String, List<String>> rigidGroups =
        new LinkedHashMap<String, List<String>>();
    private final LinkedHashMap<String, List<String>> rigidCollections =
        new LinkedHashMap<String, List<String>>();

    private final Panel.Builder defaults = new Panel.Builder("");

    private int maskGood;
    private int maskBad;

    private double photonEnergy;
    private String photonEnergyFrom;
    private double photonEnergyScale = 1.0;

    private String peakInfoLocation;

    /** Line currently being parsed */
    private int lineNum;

    private GeometryLoader(String source)
    {
        this.source = source;
    }

    /**
     * Load a geometry file.
     *
     * @param file geometry file
     *
     * @return validated detector
     *
     * @throws GeometryParseException if the file cannot be read or is
     *         invalid
     */
    public static Detector load(File file)
        throws GeometryParseException
    {
        Reader rdr;
        try {
            rdr = new InputStreamReader(new FileInputStream(file),
                                        StandardCharsets.UTF_8);
        } catch (IOException ioe) {
            throw new GeometryParseException("Cannot open geometry file " +
                                             file, ioe);
        }

        try {
            return load(rdr, file.getName());
        } finally {
            try {
                rdr.close();
            } catch (IOException ioe) {
                LOG.error("Cannot close " + file, ioe);
            }
        }
    }

    /**
     * Load a geometry description held in a string.
     *
     * @param description geometry text
     *
     * @return validated detector
     *
     * @throws GeometryParseException if the description is invalid
     */
    public static Detector parse(String description)
        throws GeometryParseException
    {
        return load(new StringReader(description), "<string>");
    }

    /**
     * Load a geometry description.
     *
     * @param rdr description source
     * @param sourceName name used in error messages
     *
     * @return validated detector
     *
     * @throws GeometryParseException if the description cannot be read or
     *         is invalid
     */
    public static Detector load(Reader rdr, String sourceName)
        throws GeometryParseException
    {
        GeometryLoader loader = new GeometryLoader(sourceName);

        BufferedReader in = new BufferedReader(rdr);
        try {
            String line;
            while ((line = in.readLine()) != null) {
                loader.lineNum++;
                loader.parseLine(line);
            }
        } catch (IOException ioe) {
            throw new GeometryParseException("Cannot read " + sourceName,
                                             ioe);
        }

        return loader.build();
    }

    private GeometryParseException error(String msg)
    {
        return GeometryParseException.atLine(source, lineNum, msg);
    }

    private void parseLine(String rawLine)
        throws GeometryParseException
    {
        String line = rawLine.trim();
        if (line.length() == 0 || line.startsWith(";")) {
            return;
        }

        final int semi = line.indexOf(';');
        if (semi >= 0) {
            line = line.substring(0, semi).trim();
        }

        final int eq = line.indexOf('=');
        if (eq < 0) {
            throw error("Expected 'key = value', not \"" + line + "\"");
        }

        final String path = line.substring(0, eq).trim();
        final String value = line.substring(eq + 1).replaceAll("\\s+", "");
        if (path.length() == 0) {
            throw error("Missing key in \"" + line + "\"");
        }
        if (value.length() == 0) {
            throw error("Missing value for \"" + path + "\"");
        }

        String[] parts = path.split("/");
        if (parts.length == 1) {
            parseTopLevel(path, value);
        } else if (parts.length > 2 || parts[0].length() == 0 ||
                   parts[1].length() == 0)
        {
            throw error("Bad key \"" + path + "\"");
        } else if (parts[0].startsWith("bad")) {
            BadRegionBuilder bad = badRegions.get(parts[0]);
            if (bad == null) {
                bad = new BadRegionBuilder(parts[0]);
                badRegions.put(parts[0], bad);
            }
            parseBadRegionField(parts[1], value, bad);
        } else {
            Panel.Builder panel = panels.get(parts[0]);
            if (panel == null) {
                panel = defaults.copy(parts[0]);
                panels.put(parts[0], panel);
            }
            parsePanelField(parts[1], value, panel);
        }
    }

    private void parseTopLevel(String key, String value)
        throws GeometryParseException
    {
        if (key.equals("mask_good")) {
            maskGood = parseMaskBits(value);
        } else if (key.equals("mask_bad")) {
            maskBad = parseMaskBits(value);
        } else if (key.equals("photon_energy")) {
            if (value.startsWith("/")) {
                photonEnergy = 0.0;
                photonEnergyFrom = value;
            } else {
                photonEnergy = parseDouble(key, value);
                photonEnergyFrom = null;
            }
        } else if (key.equals("photon_energy_scale")) {
            photonEnergyScale = parseDouble(key, value);
        } else if (key.equals("peak_info_location")) {
            peakInfoLocation = value;
        } else if (key.startsWith(RIGID_GROUP_COLLECTION + "_")) {
            final String name =
                key.substring(RIGID_GROUP_COLLECTION.length() + 1);
            rigidCollections.put(name, splitList(key, value));
        } else if (key.startsWith(RIGID_GROUP + "_")) {
            final String name = key.substring(RIGID_GROUP.length() + 1);
            rigidGroups.put(name, splitList(key, value));
        } else if (key.equals(RIGID_GROUP)) {
            throw error("Panel rigid groups must be set per panel");
        } else {
            parsePanelField(key, value, defaults);
        }
    }

    private List<String> splitList(String key, String value)
        throws GeometryParseException
    {
        ArrayList<String> list = new ArrayList<String>();
        for (String item : value.split(",")) {
            if (item.length() == 0) {
                throw error("Empty entry in " + key);
            }
            list.add(item);
        }
        return list;
    }

    private void parsePanelField(String key, String value,
                                 Panel.Builder panel)
        throws GeometryParseException
    {
        if (key.equals("min_fs")) {
            panel.minFs = parseIndex(key, value);
        } else if (key.equals("max_fs")) {
            panel.maxFs = parseIndex(key, value);
        } else if (key.equals("min_ss")) {
            panel.minSs = parseIndex(key, value);
        } else if (key.equals("max_ss")) {
            panel.maxSs = parseIndex(key, value);
        } else if (key.equals("corner_x")) {
            panel.cornerX = parseDouble(key, value);
        } else if (key.equals("corner_y")) {
            panel.cornerY = parseDouble(key, value);
        } else if (key.equals("fs")) {
            double[] dir = parseDirection(key, value);
            panel.fsx = dir[0];
            panel.fsy = dir[1];
            panel.fsz = dir[2];
        } else if (key.equals("ss")) {
            double[] dir = parseDirection(key, value);
            panel.ssx = dir[0];
            panel.ssy = dir[1];
            panel.ssz = dir[2];
        } else if (key.equals("rail_direction")) {
            double[] dir = parseDirection(key, value);
            panel.railX = dir[0];
            panel.railY = dir[1];
            panel.railZ = dir[2];
        } else if (key.equals("clen_for_centering")) {
            panel.clenForCentering = parseDouble(key, value);
        } else if (key.equals("res")) {
            panel.resolution = parseDouble(key, value);
        } else if (key.equals("clen")) {
            try {
                panel.cameraLength = Double.parseDouble(value);
                panel.cameraLengthFrom = null;
            } catch (NumberFormatException nfe) {
                panel.cameraLength = Double.NaN;
                panel.cameraLengthFrom = value;
            }
        } else if (key.equals("coffset")) {
            panel.cameraLengthOffset = parseDouble(key, value);
        } else if (key.equals("adu_per_eV")) {
            panel.aduPerEv = parseDouble(key, value);
        } else if (key.equals("adu_per_photon")) {
            panel.aduPerPhoton = parseDouble(key, value);
        } else if (key.equals("max_adu")) {
            panel.maxAdu = parseDouble(key, value);
        } else if (key.equals("badrow_direction")) {
            panel.badRowDirection = parseBadRow(value);
        } else if (key.equals("no_index")) {
            panel.noIndex = !value.equals("0") &&
                !value.equalsIgnoreCase("false");
        } else if (key.equals("data")) {
            panel.data = parseLocation(key, value);
        } else if (key.equals("mask")) {
            panel.mask = parseLocation(key, value);
        } else if (key.equals("mask_file")) {
            panel.maskFile = value;
        } else if (key.equals("saturation_map")) {
            panel.saturationMap = value;
        } else if (key.equals("saturation_map_file")) {
            panel.saturationMapFile = value;
        } else if (key.equals(RIGID_GROUP)) {
            if (panel.name.length() == 0) {
                throw error("Panel rigid groups must be set per panel");
            }
            List<String> members = rigidGroups.get(value);
            if (members == null) {
                members = new ArrayList<String>();
                rigidGroups.put(value, members);
            }
            if (!members.contains(panel.name)) {
                members.add(panel.name);
            }
        } else if (key.startsWith("dim")) {
            parseDim(key, value, panel);
        } else {
            throw error("Unrecognized field \"" + key + "\"");
        }
    }

    private void parseDim(String key, String value, Panel.Builder panel)
        throws GeometryParseException
    {
        final String numStr = key.substring(3);
        if (numStr.length() == 0) {
            throw error("'dim' must be followed by a number, e.g. 'dim0'");
        }

        int index;
        try {
            index = Integer.parseInt(numStr);
        } catch (NumberFormatException nfe) {
            throw error("Invalid dimension number \"" + numStr + "\"");
        }
        if (index < 0) {
            throw error("Invalid dimension number \"" + numStr + "\"");
        }
        if (index >= MAX_DIMENSIONS) {
            throw error("Dimension number " + index + " is too large" +
                        " (data has at most " + MAX_DIMENSIONS +
                        " dimensions)");
        }

        DimEntry entry = DimEntry.parse(value);
        if (entry == null) {
            throw error("Invalid dim entry \"" + value + "\"");
        }

        panel.setDim(index, entry);
    }

    private void parseBadRegionField(String key, String value,
                                     BadRegionBuilder bad)
        throws GeometryParseException
    {
        if (key.equals("min_x")) {
            bad.setCoordinateSystem(false);
            bad.minX = parseDouble(key, value);
        } else if (key.equals("max_x")) {
            bad.setCoordinateSystem(false);
            bad.maxX = parseDouble(key, value);
        } else if (key.equals("min_y")) {
            bad.setCoordinateSystem(false);
            bad.minY = parseDouble(key, value);
        } else if (key.equals("max_y")) {
            bad.setCoordinateSystem(false);
            bad.maxY = parseDouble(key, value);
        } else if (key.equals("min_fs")) {
            bad.setCoordinateSystem(true);
            bad.minFs = parseIndex(key, value);
        } else if (key.equals("max_fs")) {
            bad.setCoordinateSystem(true);
            bad.maxFs = parseIndex(key, value);
        } else if (key.equals("min_ss")) {
            bad.setCoordinateSystem(true);
            bad.minSs = parseIndex(key, value);
        } else if (key.equals("max_ss")) {
            bad.setCoordinateSystem(true);
            bad.maxSs = parseIndex(key, value);
        } else if (key.equals("panel")) {
            bad.panel = value;
        } else {
            throw error("Unrecognized bad region field \"" + key + "\"");
        }
    }

    private char parseBadRow(String value)
    {
        if (value.equals("x") || value.equals("f")) {
            return 'f';
        } else if (value.equals("y") || value.equals("s")) {
            return 's';
        } else if (value.equals("-")) {
            return '-';
        }

        LOG.warn(source + ":" + lineNum + ": badrow_direction must be x," +
                 " y, f, s or '-', not \"" + value + "\"; assuming '-'");
        return '-';
    }

    private String parseLocation(String key, String value)
        throws GeometryParseException
    {
        if (!value.startsWith("/")) {
            throw error("Invalid " + key + " location \"" + value + "\"");
        }

        return value;
    }

    private double parseDouble(String key, String value)
        throws GeometryParseException
    {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException nfe) {
            throw error("Bad " + key + " value \"" + value + "\"");
        }
    }

    private int parseIndex(String key, String value)
        throws GeometryParseException
    {
        int val;
        try {
            val = Integer.parseInt(value);
        } catch (NumberFormatException nfe) {
            throw error("Bad " + key + " value \"" + value + "\"");
        }

        if (val < 0) {
            throw error("Negative " + key + " value " + val);
        }

        return val;
    }

    private int parseMaskBits(String value)
        throws GeometryParseException
    {
        String digits = value;
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            digits = digits.substring(2);
        } else {
            try {
                return Integer.parseInt(digits);
            } catch (NumberFormatException nfe) {
                // fall through and try hexadecimal
            }
        }

        try {
            return Integer.parseInt(digits, 16);
        } catch (NumberFormatException nfe) {
            throw error("Bad mask value \"" + value + "\"");
        }
    }

    /**
     * Parse an algebraic direction like <tt>+0.5x-1y</tt> or <tt>-z</tt>.
     * Components not mentioned are zero.
     */
    private double[] parseDirection(String key, String value)
        throws GeometryParseException
    {
        double[] dir = new double[3];

        List<String> terms = splitTerms(value);
        if (terms.isEmpty()) {
            throw error("Invalid " + key + " direction \"" + value + "\"");
        }

        for (String term : terms) {
            final char axis = term.charAt(term.length() - 1);
            final String coeffStr = term.substring(0, term.length() - 1);

            double coeff;
            if (coeffStr.equals("+")) {
                coeff = 1.0;
            } else if (coeffStr.equals("-")) {
                coeff = -1.0;
            } else {
                try {
                    coeff = Double.parseDouble(coeffStr);
                } catch (NumberFormatException nfe) {
                    throw error("Invalid " + key + " direction \"" + value +
                                "\"");
                }
            }

            switch (axis) {
            case 'x':
                dir[0] = coeff;
                break;
            case 'y':
                dir[1] = coeff;
                break;
            case 'z':
                dir[2] = coeff;
                break;
            default:
                throw error("Invalid symbol '" + axis + "' in " + key +
                            " direction (must be x, y or z)");
            }
        }

        return dir;
    }

    /**
     * Split "+0.5x-1y" into signed terms "+0.5x", "-1y".  A leading term
     * without a sign is treated as positive.
     */
    private static List<String> splitTerms(String value)
    {
        ArrayList<String> terms = new ArrayList<String>();

        StringBuilder cur = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            final char ch = value.charAt(i);
            // a sign starts a new term unless it belongs to an exponent
            if ((ch == '+' || ch == '-') && cur.length() > 0 &&
                !endsWithExponent(cur))
            {
                terms.add(cur.toString());
                cur.setLength(0);
            }
            if (cur.length() == 0 && ch != '+' && ch != '-') {
                cur.append('+');
            }
            cur.append(ch);
        }
        if (cur.length() > 0) {
            terms.add(cur.toString());
        }

        return terms;
    }

    private static boolean endsWithExponent(StringBuilder term)
    {
        final int len = term.length();
        if (len < 2) {
            return false;
        }

        final char last = term.charAt(len - 1);
        return (last == 'e' || last == 'E') &&
            Character.isDigit(term.charAt(len - 2));
    }

    /**
     * Validate everything which has been read and build the detector.
     */
    private Detector build()
        throws GeometryParseException
    {
        if (panels.isEmpty()) {
            throw new GeometryParseException("No panel descriptions in " +
                                             source);
        }

        checkDimStructures();

        LinkedHashMap<String, Panel> built =
            new LinkedHashMap<String, Panel>();
        for (Panel.Builder bldr : panels.values()) {
            checkRequiredFields(bldr);
            built.put(bldr.name, new Panel(bldr));
        }

        LinkedHashMap<String, BadRegion> bad =
            new LinkedHashMap<String, BadRegion>();
        for (BadRegionBuilder bldr : badRegions.values()) {
            bad.put(bldr.name, bldr.build(built));
        }

        for (Map.Entry<String, List<String>> entry : rigidGroups.entrySet()) {
            for (String name : entry.getValue()) {
                if (!built.containsKey(name)) {
                    throw new GeometryParseException("Cannot add panel \"" +
                                                     name +
                                                     "\" to rigid group \"" +
                                                     entry.getKey() +
                                                     "\": panel not found");
                }
            }
        }
        for (Map.Entry<String, List<String>> entry :
                 rigidCollections.entrySet())
        {
            for (String name : entry.getValue()) {
                if (!rigidGroups.containsKey(name)) {
                    throw new GeometryParseException("Cannot add rigid" +
                                                     " group \"" + name +
                                                     "\" to collection \"" +
                                                     entry.getKey() +
                                                     "\": group not found");
                }
            }
        }

        for (Panel p : built.values()) {
            if (p.getDeterminant() == 0.0) {
                throw new GeometryParseException("Panel " + p.getName() +
                                                 " transformation is" +
                                                 " singular");
            }
        }

        Beam beam = new Beam(photonEnergy, photonEnergyFrom,
                             photonEnergyScale);

        Detector det = new Detector(built, bad, rigidGroups, rigidCollections,
                                    maskGood, maskBad, beam,
                                    peakInfoLocation);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Loaded " + det + " from " + source);
        }

        return det;
    }

    private void checkDimStructures()
        throws GeometryParseException
    {
        int numPlaceholders = -1;
        int numMaskPlaceholders = -1;
        int dimLength = -1;

        for (Panel.Builder bldr : panels.values()) {
            if (bldr.dims.isEmpty()) {
                bldr.dims = new ArrayList<DimEntry>(Arrays.asList(DimEntry.SLOW_SCAN,
                                                                  DimEntry.FAST_SCAN));
            }

            int foundSs = 0;
            int foundFs = 0;
            int foundPlaceholder = 0;
            for (int i = 0; i < bldr.dims.size(); i++) {
                DimEntry entry = bldr.dims.get(i);
                if (entry == null) {
                    throw new GeometryParseException("Dimension " + i +
                                                     " for panel " +
                                                     bldr.name +
                                                     " is undefined");
                }

                switch (entry.getKind()) {
                case SLOW_SCAN:
                    foundSs++;
                    break;
                case FAST_SCAN:
                    foundFs++;
                    break;
                case PLACEHOLDER:
                    foundPlaceholder++;
                    break;
                default:
                    break;
                }
            }

            if (foundSs != 1) {
                throw new GeometryParseException("Exactly one slow scan dim" +
                                                 " coordinate is needed" +
                                                 " (found " + foundSs +
                                                 " for panel " + bldr.name +
                                                 ")");
            }
            if (foundFs != 1) {
                throw new GeometryParseException("Exactly one fast scan dim" +
                                                 " coordinate is needed" +
                                                 " (found " + foundFs +
                                                 " for panel " + bldr.name +
                                                 ")");
            }
            if (foundPlaceholder > 1) {
                throw new GeometryParseException("Only one placeholder dim" +
                                                 " coordinate is allowed" +
                                                 " (found " +
                                                 foundPlaceholder +
                                                 " for panel " + bldr.name +
                                                 ")");
            }

            if (numPlaceholders < 0) {
                numPlaceholders = foundPlaceholder;
            } else if (numPlaceholders != foundPlaceholder) {
                throw new GeometryParseException("All panels must have the" +
                                                 " same number of" +
                                                 " placeholders");
            }

            if (dimLength < 0) {
                dimLength = bldr.dims.size();
            } else if (dimLength != bldr.dims.size()) {
                throw new GeometryParseException("Number of dim coordinates" +
                                                 " must be the same for all" +
                                                 " panels");
            }

            final int maskPlaceholders = countPlaceholders(bldr.mask);
            if (numMaskPlaceholders < 0) {
                numMaskPlaceholders = maskPlaceholders;
            } else if (numMaskPlaceholders != maskPlaceholders) {
                throw new GeometryParseException("All panels' mask entries" +
                                                 " must have the same number" +
                                                 " of placeholders");
            }
        }

        if (numMaskPlaceholders > numPlaceholders) {
            throw new GeometryParseException("Number of placeholders in mask" +
                                             " cannot be larger than the" +
                                             " number for data");
        }
    }

    private static int countPlaceholders(String location)
    {
        if (location == null) {
            return 0;
        }

        int num = 0;
        for (int i = 0; i < location.length(); i++) {
            if (location.charAt(i) == '%') {
                num++;
            }
        }
        return num;
    }

    private static void checkRequiredFields(Panel.Builder bldr)
        throws GeometryParseException
    {
        final String name = bldr.name;

        if (bldr.minFs < 0) {
            throw missing("the minimum fs coordinate", name);
        }
        if (bldr.maxFs < 0) {
            throw missing("the maximum fs coordinate", name);
        }
        if (bldr.minSs < 0) {
            throw missing("the minimum ss coordinate", name);
        }
        if (bldr.maxSs < 0) {
            throw missing("the maximum ss coordinate", name);
        }
        if (bldr.maxFs < bldr.minFs) {
            throw new GeometryParseException("Panel " + name + " max_fs " +
                                             bldr.maxFs + " is less than" +
                                             " min_fs " + bldr.minFs);
        }
        if (bldr.maxSs < bldr.minSs) {
            throw new GeometryParseException("Panel " + name + " max_ss " +
                                             bldr.maxSs + " is less than" +
                                             " min_ss " + bldr.minSs);
        }
        if (Double.isNaN(bldr.cornerX)) {
            throw missing("the corner X coordinate", name);
        }
        if (Double.isNaN(bldr.cornerY)) {
            throw missing("the corner Y coordinate", name);
        }
        if (Double.isNaN(bldr.cameraLength) &&
            bldr.cameraLengthFrom == null)
        {
            throw missing("the camera length", name);
        }
        if (!(bldr.resolution > 0.0)) {
            throw missing("a positive resolution", name);
        }

        final boolean perEv = !Double.isNaN(bldr.aduPerEv);
        final boolean perPhoton = !Double.isNaN(bldr.aduPerPhoton);
        if (perEv == perPhoton) {
            throw new GeometryParseException("Please specify exactly one of" +
                                             " adu_per_eV or adu_per_photon" +
                                             " for panel " + name);
        }

        if (!Double.isNaN(bldr.railX) &&
            Double.isNaN(bldr.clenForCentering))
        {
            throw new GeometryParseException("You must specify" +
                                             " clen_for_centering if you" +
                                             " specify the rail direction" +
                                             " (panel " + name + ")");
        }
    }

    private static GeometryParseException missing(String what, String panel)
    {
        return new GeometryParseException("Please specify " + what +
                                          " for panel " + panel);
    }

    /**
     * Bad region fields collected while parsing.
     */
    private final class BadRegionBuilder
    {
        private final String name;
        private String panel;
        /** -1 until a coordinate is set, then 0 for x/y or 1 for fs/ss */
        private int fsss = -1;

        private double minX = Double.NaN;
        private double maxX = Double.NaN;
        private double minY = Double.NaN;
        private double maxY = Double.NaN;

        private int minFs;
        private int maxFs;
        private int minSs;
        private int maxSs;

        BadRegionBuilder(String name)
        {
            this.name = name;
        }

        void setCoordinateSystem(boolean isFsss)
            throws GeometryParseException
        {
            final int val = isFsss ? 1 : 0;
            if (fsss < 0) {
                fsss = val;
            } else if (fsss != val) {
                throw error("You can't mix x/y and fs/ss in bad region " +
                            name);
            }
        }

        BadRegion build(Map<String, Panel> knownPanels)
            throws GeometryParseException
        {
            if (fsss < 0) {
                throw new GeometryParseException("Please specify the" +
                                                 " coordinate ranges for bad" +
                                                 " region " + name);
            }
            if (panel != null && !knownPanels.containsKey(panel)) {
                throw new GeometryParseException("Bad region " + name +
                                                 " refers to unknown panel " +
                                                 panel);
            }
            if (fsss == 0 && (Double.isNaN(minX) || Double.isNaN(maxX) ||
                              Double.isNaN(minY) || Double.isNaN(maxY)))
            {
                throw new GeometryParseException("Please specify all four" +
                                                 " x/y limits for bad region " +
                                                 name);
            }

            return new BadRegion(name, panel, fsss == 1, minX, maxX, minY,
                                 maxY, minFs, maxFs, minSs, maxSs);
        }
    }
}
