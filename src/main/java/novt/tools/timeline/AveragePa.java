package novt.tools.timeline;

/**
 * Summary position angle over a stretch of a timeline, in [0, 360) degrees, or NaN when the target is never visible.
 */
public record AveragePa(double value) {

    public static final AveragePa NOT_VISIBLE = new AveragePa(Double.NaN);

    public boolean isVisible() {
        return !Double.isNaN(value);
    }

    public String label() {
        if (!isVisible()) {
            return "(not visible)";
        }
        // half to even
        return String.format("Avg. PA: %d deg", (long) Math.rint(value));
    }

    @Override
    public String toString() {
        return label();
    }
}
