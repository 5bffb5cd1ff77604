package novt.tools.math;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * This class holds the conversions between sky coordinates, telescope coordinates and unit vectors
 **/
public class Transformations {

    public static final double ARCSEC_PER_DEGREE = 3600.0D;

    private Transformations() {

    }

    /**
     * Unit vector for a pair of spherical coordinates, x towards (0, 0) and z towards the pole
     *
     * @param longitudeDeg the longitude (RA or V2) in degrees
     * @param latitudeDeg  the latitude (Dec or V3) in degrees
     * @return the unit vector
     **/
    public static Vector3D toUnitVector(double longitudeDeg, double latitudeDeg) {
        return new Vector3D(Math.toRadians(longitudeDeg), Math.toRadians(latitudeDeg));
    }

    /**
     * Unit vector for a telescope frame point given in arcseconds
     **/
    public static Vector3D toUnitVector(TelCoordinate telPoint) {
        return toUnitVector(telPoint.v2() / ARCSEC_PER_DEGREE, telPoint.v3() / ARCSEC_PER_DEGREE);
    }

    /**
     * Takes a vector in the celestial frame and returns its RA and Dec in degrees, RA wrapped into [0, 360)
     **/
    public static double[] toSky(Vector3D vector) {
        double ra = wrap360(Math.toDegrees(vector.getAlpha()));
        double dec = Math.toDegrees(vector.getDelta());
        return new double[]{ra, dec};
    }

    /**
     * Wraps an angle in degrees into [0, 360). Non-finite values are returned as they are.
     **/
    public static double wrap360(double angleDeg) {
        double wrapped = angleDeg % 360.0;
        if (wrapped < 0) {
            wrapped += 360.0;
        }
        // -1e-17 % 360 + 360 rounds up to 360
        return wrapped >= 360.0 ? 0.0 : wrapped;
    }

}
