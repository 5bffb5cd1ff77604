package novt.tools.ephemeris;

import novt.tools.siaf.Instrument;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Source of observatory roll and field of regard data for fixed targets.
 */
public interface EphemerisService {

    /**
     * Computes visibility and position angles for a fixed target.
     *
     * @param ra          target RA, degrees
     * @param dec         target Dec, degrees
     * @param start       first sample time
     * @param end         last sample time
     * @param instruments instruments to report position angle envelopes for
     * @return time-ascending samples
     * @throws IOException if the ephemeris cannot be obtained
     */
    List<EphemerisRecord> query(double ra, double dec, Instant start, Instant end, List<Instrument> instruments)
            throws IOException;

    /**
     * @return the last date covered by the ephemeris
     * @throws IOException if the coverage cannot be determined
     */
    LocalDate maximumDate() throws IOException;

}
