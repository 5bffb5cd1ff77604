package novt.tools.timeline;

import novt.tools.math.CircularStatistics;
import novt.tools.math.Transformations;
import novt.tools.siaf.Instrument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Wrap-aware summaries of the allowed position angle envelope. Minimum and maximum envelope values are pooled into
 * a single population of angles.
 **/
public class PositionAngleSummarizer {

    private PositionAngleSummarizer() {

    }

    public static AveragePa averagePa(Timeline timeline, Instrument instrument, Instant from, Instant to,
                                      AveragingMethod method) {
        return averagePa(timeline.times(), timeline.minPa(instrument), timeline.maxPa(instrument), from, to, method);
    }

    /**
     * @param times  sample times
     * @param minPa  minimum PA per sample, NaN when unknown
     * @param maxPa  maximum PA per sample, NaN when unknown
     * @param from   inclusive start of the range, or null
     * @param to     inclusive end of the range, or null. The range is applied only when both ends are set
     * @param method mean of all values, or most frequent rounded per-sample mean
     * @return the summary angle, {@link AveragePa#NOT_VISIBLE} when no sample is left
     */
    public static AveragePa averagePa(List<Instant> times, double[] minPa, double[] maxPa, Instant from, Instant to,
                                      AveragingMethod method) {

        if (times.size() != minPa.length || times.size() != maxPa.length) {
            throw new IllegalArgumentException("Times and PA columns differ in length");
        }

        boolean restrict = from != null && to != null;
        List<double[]> kept = new ArrayList<>();

        for (int i = 0; i < times.size(); i++) {
            Instant time = times.get(i);
            if (restrict && (time.isBefore(from) || time.isAfter(to))) {
                continue;
            }
            if (Double.isNaN(minPa[i]) && Double.isNaN(maxPa[i])) {
                continue;
            }
            kept.add(new double[]{minPa[i], maxPa[i]});
        }

        if (kept.isEmpty()) {
            return AveragePa.NOT_VISIBLE;
        }

        double value = method == AveragingMethod.MODE ? mode(kept) : mean(kept);
        return new AveragePa(Transformations.wrap360(value));
    }

    private static double mean(List<double[]> samples) {
        double[] pooled = new double[samples.size() * 2];
        int i = 0;
        for (double[] sample : samples) {
            pooled[i++] = sample[0];
            pooled[i++] = sample[1];
        }
        return CircularStatistics.circularMean(pooled);
    }

    // Counted on the signed (-180, 180] means; ties resolve to the lowest signed value, wrapped by the caller
    private static double mode(List<double[]> samples) {
        Map<Double, Integer> counts = new TreeMap<>();
        for (double[] sample : samples) {
            // + 0.0 folds -0.0 into 0.0
            double rounded = Math.rint(CircularStatistics.circularMean(sample)) + 0.0;
            counts.merge(rounded, 1, Integer::sum);
        }

        double best = Double.NaN;
        int bestCount = 0;
        for (Map.Entry<Double, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

}
