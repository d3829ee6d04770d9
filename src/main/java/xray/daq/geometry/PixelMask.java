package xray.daq.geometry;

/**
 * Per-slab-pixel good/bad flags derived from a detector's bad regions and
 * <tt>no_index</tt> panels.
 */
public final class PixelMask
{
    private final int slabWidth;
    private final boolean[] good;
    private final int numBad;

    private PixelMask(int slabWidth, boolean[] good)
    {
        this.slabWidth = slabWidth;
        this.good = good;

        int bad = 0;
        for (int i = 0; i < good.length; i++) {
            if (!good[i]) {
                bad++;
            }
        }
        numBad = bad;
    }

    /**
     * Build the mask for a detector.  Pixels outside every panel are bad.
     *
     * @param det detector layout
     * @param maps pixel maps computed from <tt>det</tt>
     *
     * @return new mask
     */
    public static PixelMask fromDetector(Detector det, PixelMaps maps)
    {
        final int width = det.getSlabWidth();
        boolean[] good = new boolean[width * det.getSlabHeight()];

        for (Panel p : det.getPanels().values()) {
            for (int ss = p.getMinSs(); ss <= p.getMaxSs(); ss++) {
                for (int fs = p.getMinFs(); fs <= p.getMaxFs(); fs++) {
                    final int idx = ss * width + fs;
                    if (p.isNoIndex()) {
                        good[idx] = false;
                        continue;
                    }

                    boolean ok = true;
                    for (BadRegion bad : det.getBadRegions().values()) {
                        if (bad.contains(p.getName(), fs, ss,
                                         maps.getX(idx), maps.getY(idx)))
                        {
                            ok = false;
                            break;
                        }
                    }
                    good[idx] = ok;
                }
            }
        }

        return new PixelMask(width, good);
    }

    public boolean isGood(int slabIndex)
    {
        return good[slabIndex];
    }

    public boolean isGood(int fs, int ss)
    {
        return good[ss * slabWidth + fs];
    }

    public int size()
    {
        return good.length;
    }

    public int getNumBad()
    {
        return numBad;
    }
}
