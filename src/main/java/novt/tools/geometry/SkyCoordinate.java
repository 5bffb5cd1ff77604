package novt.tools.geometry;

/**
 * A position on the celestial sphere, RA and Dec in degrees.
 */
public record SkyCoordinate(double ra, double dec) {

    @Override
    public String toString() {
        return ra + "," + dec;
    }
}
