package xray.daq.geometry;

/**
 * Beam properties declared in a geometry description.
 */
public final class Beam
{
    private final double photonEnergy;
    private final String photonEnergyFrom;
    private final double photonEnergyScale;

    Beam(double photonEnergy, String photonEnergyFrom,
         double photonEnergyScale)
    {
        this.photonEnergy = photonEnergy;
        this.photonEnergyFrom = photonEnergyFrom;
        this.photonEnergyScale = photonEnergyScale;
    }

    /**
     * @return photon energy in eV, or zero if it must be read from the data
     */
    public double getPhotonEnergy()
    {
        return photonEnergy;
    }

    /**
     * @return data location of the photon energy, or <tt>null</tt>
     */
    public String getPhotonEnergyFrom()
    {
        return photonEnergyFrom;
    }

    public double getPhotonEnergyScale()
    {
        return photonEnergyScale;
    }

    @Override
    public String toString()
    {
        if (photonEnergyFrom != null) {
            return "Beam[from " + photonEnergyFrom + " x" + photonEnergyScale +
                "]";
        }

        return "Beam[" + photonEnergy + " eV x" + photonEnergyScale + "]";
    }
}
