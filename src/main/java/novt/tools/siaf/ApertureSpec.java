package novt.tools.siaf;

import novt.tools.math.TelCoordinate;

import java.util.List;

/**
 * One aperture of the calibration model.
 *
 * @param name               aperture name, e.g. NRCA5_FULL
 * @param instrument         parent assembly
 * @param v3IdlYAngle        angle between the aperture's ideal Y axis and V3, degrees
 * @param referenceAperture  true for the aperture that defines the assembly center and roll offset
 * @param corners            closed polygon in the telescope frame, arcsec, in catalog order
 */
public record ApertureSpec(String name, Instrument instrument, double v3IdlYAngle, boolean referenceAperture,
                           List<TelCoordinate> corners) {

    public ApertureSpec {
        if (corners.size() < 3) {
            throw new IllegalArgumentException("Aperture " + name + " has " + corners.size() + " corners");
        }
        corners = List.copyOf(corners);
    }

    /**
     * Mean of the corner points
     **/
    public TelCoordinate centroid() {
        double v2 = 0;
        double v3 = 0;
        for (TelCoordinate corner : corners) {
            v2 += corner.v2();
            v3 += corner.v3();
        }
        return new TelCoordinate(v2 / corners.size(), v3 / corners.size());
    }
}
