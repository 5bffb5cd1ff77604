package novt.tools.geometry;

import novt.tools.math.TelCoordinate;
import novt.tools.math.Transformations;
import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.RotationConvention;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Maps telescope frame (V2, V3) points onto the sky for a given attitude.
 * <p>
 * The attitude is defined by a reference point in the telescope frame, the sky position that point is placed on
 * and the roll about it. The transform is the rotation chain Rz(ra) Ry(-dec) Rx(-roll) Ry(v3) Rz(-v2): the reference
 * point is first brought to the x axis, rolled, and then carried to (ra, dec).
 * <p>
 * Instances are immutable and can be shared.
 **/
public class AttitudeTransform {

    private final TelCoordinate reference;
    private final double ra;
    private final double dec;
    private final double roll;
    private final Rotation attitude;

    private AttitudeTransform(TelCoordinate reference, double ra, double dec, double roll) {
        this.reference = reference;
        this.ra = ra;
        this.dec = dec;
        this.roll = roll;

        double v2Deg = reference.v2() / Transformations.ARCSEC_PER_DEGREE;
        double v3Deg = reference.v3() / Transformations.ARCSEC_PER_DEGREE;

        Rotation mv2 = rotation(Vector3D.PLUS_K, -v2Deg);
        Rotation mv3 = rotation(Vector3D.PLUS_J, v3Deg);
        Rotation mpa = rotation(Vector3D.PLUS_I, -roll);
        Rotation mdec = rotation(Vector3D.PLUS_J, -dec);
        Rotation mra = rotation(Vector3D.PLUS_K, ra);

        // applied right to left: mv2 first, mra last
        this.attitude = mra.compose(mdec.compose(mpa.compose(mv3.compose(mv2,
                        RotationConvention.VECTOR_OPERATOR),
                        RotationConvention.VECTOR_OPERATOR),
                        RotationConvention.VECTOR_OPERATOR),
                RotationConvention.VECTOR_OPERATOR);
    }

    /**
     * Builds the transform for a pointing.
     *
     * @param reference  telescope frame point placed on the target, arcsec
     * @param ra         target RA in degrees
     * @param dec        target Dec in degrees
     * @param roll       target position angle in degrees, not required to be wrapped
     * @param rollOffset roll offset of the instrument assembly in degrees
     * @return the attitude transform
     **/
    public static AttitudeTransform build(TelCoordinate reference, double ra, double dec, double roll, double rollOffset) {
        return new AttitudeTransform(reference, ra, dec, roll - rollOffset);
    }

    /**
     * Maps a telescope frame point to the sky.
     *
     * @param telPoint the point in arcsec
     * @return RA in [0, 360) and Dec, in degrees. Non-finite input propagates to the output.
     **/
    public SkyCoordinate apply(TelCoordinate telPoint) {
        Vector3D sky = attitude.applyTo(Transformations.toUnitVector(telPoint));
        double[] raDec = Transformations.toSky(sky);
        return new SkyCoordinate(raDec[0], raDec[1]);
    }

    private static Rotation rotation(Vector3D axis, double angleDeg) {
        return new Rotation(axis, Math.toRadians(angleDeg), RotationConvention.VECTOR_OPERATOR);
    }

    public TelCoordinate getReference() {
        return reference;
    }

    public double getRa() {
        return ra;
    }

    public double getDec() {
        return dec;
    }

    /**
     * @return the effective roll, target position angle minus the assembly offset
     */
    public double getRoll() {
        return roll;
    }

}
