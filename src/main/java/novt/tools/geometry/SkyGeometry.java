package novt.tools.geometry;

import net.sf.geographiclib.Geodesic;
import net.sf.geographiclib.GeodesicData;
import net.sf.geographiclib.GeodesicMask;
import novt.tools.math.Transformations;

/**
 * Great circle operations on the celestial sphere. Dec plays the role of latitude and RA that of longitude, so
 * geodesic azimuths are position angles measured from North through East.
 */
public class SkyGeometry {

    private static final Geodesic UNIT_SPHERE = new Geodesic(1.0, 0.0);

    private SkyGeometry() {

    }

    /**
     * Computes the angular distance between two sky positions
     *
     * @return the separation in degrees
     **/
    public static double separation(double ra1, double dec1, double ra2, double dec2) {
        GeodesicData g = UNIT_SPHERE.Inverse(dec1, ra1, dec2, ra2, GeodesicMask.DISTANCE);
        return g.a12;
    }

    /**
     * Computes the position angle of the second position as seen from the first one
     *
     * @return the position angle in degrees, within [0, 360)
     **/
    public static double positionAngle(double ra1, double dec1, double ra2, double dec2) {
        GeodesicData g = UNIT_SPHERE.Inverse(dec1, ra1, dec2, ra2, GeodesicMask.AZIMUTH);
        return Transformations.wrap360(g.azi1);
    }

    public static double separation(SkyCoordinate from, SkyCoordinate to) {
        return separation(from.ra(), from.dec(), to.ra(), to.dec());
    }

    public static double positionAngle(SkyCoordinate from, SkyCoordinate to) {
        return positionAngle(from.ra(), from.dec(), to.ra(), to.dec());
    }

}
