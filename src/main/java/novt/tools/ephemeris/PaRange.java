package novt.tools.ephemeris;

/**
 * Allowed position angle envelope of an instrument, degrees. NaN bounds mean unknown: the target is not observable.
 */
public record PaRange(double min, double max) {

    public static final PaRange UNKNOWN = new PaRange(Double.NaN, Double.NaN);
}
