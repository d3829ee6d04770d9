package xray.daq.geometry;

/**
 * One axis of a panel's raw data block.
 */
public final class DimEntry
{
    /** What an axis of the raw data block represents */
    public enum Kind
    {
        /** slow-scan pixel axis */
        SLOW_SCAN("ss"),
        /** fast-scan pixel axis */
        FAST_SCAN("fs"),
        /** frame index within a multi-frame stack */
        PLACEHOLDER("%"),
        /** fixed index into an extra axis */
        FIXED(null);

        private final String token;

        Kind(String token)
        {
            this.token = token;
        }

        String getToken()
        {
            return token;
        }
    }

    public static final DimEntry SLOW_SCAN =
        new DimEntry(Kind.SLOW_SCAN, -1);
    public static final DimEntry FAST_SCAN =
        new DimEntry(Kind.FAST_SCAN, -1);
    public static final DimEntry PLACEHOLDER =
        new DimEntry(Kind.PLACEHOLDER, -1);

    private final Kind kind;
    private final int index;

    private DimEntry(Kind kind, int index)
    {
        this.kind = kind;
        this.index = index;
    }

    /**
     * Create an entry pinning an axis to a single index.
     */
    public static DimEntry fixed(int index)
    {
        if (index < 0) {
            throw new IllegalArgumentException("Negative dim index " + index);
        }

        return new DimEntry(Kind.FIXED, index);
    }

    /**
     * Parse the value of a <tt>dimN</tt> field.
     *
     * @return parsed entry, or <tt>null</tt> if the value is not valid
     */
    static DimEntry parse(String value)
    {
        if (value.equals(Kind.SLOW_SCAN.getToken())) {
            return SLOW_SCAN;
        } else if (value.equals(Kind.FAST_SCAN.getToken())) {
            return FAST_SCAN;
        } else if (value.equals(Kind.PLACEHOLDER.getToken())) {
            return PLACEHOLDER;
        }

        if (value.length() == 0) {
            return null;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return null;
            }
        }

        try {
            return fixed(Integer.parseInt(value));
        } catch (NumberFormatException nfe) {
            // too many digits
            return null;
        }
    }

    public int getIndex()
    {
        return index;
    }

    public Kind getKind()
    {
        return kind;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (!(obj instanceof DimEntry)) {
            return false;
        }

        DimEntry other = (DimEntry) obj;
        return kind == other.kind && index == other.index;
    }

    @Override
    public int hashCode()
    {
        return kind.hashCode() * 31 + index;
    }

    @Override
    public String toString()
    {
        if (kind == Kind.FIXED) {
            return Integer.toString(index);
        }

        return kind.getToken();
    }
}
