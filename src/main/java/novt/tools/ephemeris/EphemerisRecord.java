package novt.tools.ephemeris;

import novt.tools.siaf.Instrument;

import java.time.Instant;
import java.util.Map;

/**
 * One sample of an ephemeris query for a fixed target.
 *
 * @param time            sample time
 * @param v3Pa            observatory V3 position angle, degrees
 * @param inFieldOfRegard whether the target is observable at that time
 * @param ranges          allowed position angles per requested instrument
 */
public record EphemerisRecord(Instant time, double v3Pa, boolean inFieldOfRegard, Map<Instrument, PaRange> ranges) {

    public EphemerisRecord {
        ranges = Map.copyOf(ranges);
    }
}
