package novt.tools.math;

/**
 * A point or an offset in the telescope (V2, V3) frame, in arcseconds.
 */
public record TelCoordinate(double v2, double v3) {

    public static final TelCoordinate ZERO = new TelCoordinate(0.0, 0.0);

    public TelCoordinate plus(TelCoordinate other) {
        return new TelCoordinate(v2 + other.v2, v3 + other.v3);
    }

    @Override
    public String toString() {
        return v2 + "," + v3;
    }
}
