package novt.tools.timeline;

import novt.tools.ephemeris.PaRange;
import novt.tools.siaf.Instrument;

import java.time.Instant;
import java.util.Map;

/**
 * One row of a visibility timeline. NaN angles mark times when the target is outside the field of regard.
 */
public record VisibilitySample(Instant time, double v3Pa, Map<Instrument, PaRange> ranges) {

    public VisibilitySample {
        ranges = Map.copyOf(ranges);
    }

    public double minPa(Instrument instrument) {
        return ranges.getOrDefault(instrument, PaRange.UNKNOWN).min();
    }

    public double maxPa(Instrument instrument) {
        return ranges.getOrDefault(instrument, PaRange.UNKNOWN).max();
    }

    public boolean isVisible() {
        return !Double.isNaN(v3Pa);
    }
}
