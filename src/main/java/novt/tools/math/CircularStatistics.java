package novt.tools.math;

import java.util.Collection;

/**
 * Statistics for angles that wrap at 360 degrees
 **/
public class CircularStatistics {

    private CircularStatistics() {

    }

    /**
     * Circular mean of a set of angles, computed from the mean of their unit vectors.
     *
     * @param anglesDeg angles in degrees; NaN entries are ignored
     * @return the mean direction in degrees within (-180, 180], or NaN when no finite angle is present
     **/
    public static double circularMean(double... anglesDeg) {
        double sumSin = 0;
        double sumCos = 0;
        int count = 0;
        for (double angle : anglesDeg) {
            if (Double.isNaN(angle)) {
                continue;
            }
            double rads = Math.toRadians(angle);
            sumSin += Math.sin(rads);
            sumCos += Math.cos(rads);
            count++;
        }
        if (count == 0) {
            return Double.NaN;
        }
        return Math.toDegrees(Math.atan2(sumSin, sumCos));
    }

    public static double circularMean(Collection<Double> anglesDeg) {
        return circularMean(anglesDeg.stream().mapToDouble(Double::doubleValue).toArray());
    }

}
