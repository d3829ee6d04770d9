package xray.daq.monitoring;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of the aggregated statistics, ready to publish.
 */
public final class AggregatorSnapshot
{
    private final long numEvents;
    private final long numHits;
    private final long numSaturated;
    private final long numPeaksOutsideSlab;
    private final double hitRate;
    private final double saturationRate;
    private final List<Double> hitRateHistory;
    private final List<Double> timestampHistory;
    private final float[][] powderImage;
    private final ResolutionRings rings;
    private final double timestamp;
    private final double beamEnergy;
    private final double detectorDistance;
    private final double pixelsPerMetre;
    private final double coffset;

    AggregatorSnapshot(Aggregator agg, double timestamp, double beamEnergy,
                       double detectorDistance, double pixelsPerMetre,
                       double coffset)
    {
        numEvents = agg.getNumEvents();
        numHits = agg.getNumHits();
        numSaturated = agg.getNumSaturated();
        numPeaksOutsideSlab = agg.getNumPeaksOutsideSlab();
        hitRate = agg.getHitRate();
        saturationRate = agg.getSaturationRate();
        hitRateHistory = agg.getHitRateHistory();
        timestampHistory = agg.getTimestampHistory();
        powderImage = agg.getPowderImage();
        rings = agg.getRings();

        this.timestamp = timestamp;
        this.beamEnergy = beamEnergy;
        this.detectorDistance = detectorDistance;
        this.pixelsPerMetre = pixelsPerMetre;
        this.coffset = coffset;
    }

    public long getNumEvents()
    {
        return numEvents;
    }

    public long getNumHits()
    {
        return numHits;
    }

    public long getNumSaturated()
    {
        return numSaturated;
    }

    public double getHitRate()
    {
        return hitRate;
    }

    public double getSaturationRate()
    {
        return saturationRate;
    }

    public ResolutionRings getRings()
    {
        return rings;
    }

    public float[][] getPowderImage()
    {
        return powderImage;
    }

    /**
     * NaN and infinite values have no JSON form.
     */
    static Double finiteOrNull(double val)
    {
        if (Double.isNaN(val) || Double.isInfinite(val)) {
            return null;
        }

        return val;
    }

    /**
     * Build the broadcast form of this snapshot.
     */
    public Map<String, Object> toMap()
    {
        LinkedHashMap<String, Object> map =
            new LinkedHashMap<String, Object>();

        map.put("timestamp", finiteOrNull(timestamp));
        map.put("num_events", numEvents);
        map.put("num_hits", numHits);
        map.put("num_saturated", numSaturated);
        map.put("num_peaks_outside_slab", numPeaksOutsideSlab);
        map.put("hit_rate", hitRate * 100.0);
        map.put("saturation_rate", saturationRate * 100.0);
        map.put("hit_rate_history", hitRateHistory);
        map.put("hit_rate_timestamp_history", timestampHistory);
        map.put("virtual_powder_plot", powderImage);
        map.put("beam_energy", finiteOrNull(beamEnergy));
        map.put("detector_distance", finiteOrNull(detectorDistance));
        map.put("first_panel_coffset", coffset);
        map.put("pixel_size", pixelsPerMetre);

        List<Map<String, Double>> ringList =
            new ArrayList<Map<String, Double>>();
        for (int i = 0; i < rings.size(); i++) {
            LinkedHashMap<String, Double> ring =
                new LinkedHashMap<String, Double>();
            ring.put("resolution", rings.getResolution(i));
            ring.put("diameter", rings.getDiameter(i));
            ringList.add(ring);
        }
        map.put("resolution_rings_available", rings.isAvailable());
        map.put("resolution_rings", ringList);

        return map;
    }

    @Override
    public String toString()
    {
        return String.format("Snapshot[%d events, %d hits, hit rate %.2f%%," +
                             " sat rate %.2f%%]", numEvents, numHits,
                             hitRate * 100.0, saturationRate * 100.0);
    }
}
