package novt.tools.ephemeris;

import novt.tools.geometry.SkyCoordinate;
import novt.tools.math.Transformations;
import novt.tools.utilities.TimeUtils;

import java.time.Instant;

/**
 * Low precision geocentric solar coordinates (Astronomical Almanac), good to about 0.01 degree between 1950
 * and 2050.
 **/
public class SolarPosition {

    private static final double J2000 = 2451545.0;

    private SolarPosition() {

    }

    public static SkyCoordinate at(Instant time) {
        double n = TimeUtils.toJulianDate(time) - J2000;

        double meanLongitude = Transformations.wrap360(280.460 + 0.9856474 * n);
        double meanAnomaly = Math.toRadians(Transformations.wrap360(357.528 + 0.9856003 * n));
        double eclipticLongitude = Math.toRadians(meanLongitude
                + 1.915 * Math.sin(meanAnomaly)
                + 0.020 * Math.sin(2 * meanAnomaly));
        double obliquity = Math.toRadians(23.439 - 0.0000004 * n);

        double ra = Math.atan2(Math.cos(obliquity) * Math.sin(eclipticLongitude), Math.cos(eclipticLongitude));
        double dec = Math.asin(Math.sin(obliquity) * Math.sin(eclipticLongitude));

        return new SkyCoordinate(Transformations.wrap360(Math.toDegrees(ra)), Math.toDegrees(dec));
    }

}
