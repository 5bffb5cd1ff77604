package novt.tools.timeline;

import novt.tools.ephemeris.EphemerisRecord;
import novt.tools.ephemeris.EphemerisService;
import novt.tools.ephemeris.PaRange;
import novt.tools.siaf.Instrument;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Daily samples with fixed angles. Every third sample is outside the field of regard.
 */
class StubEphemerisService implements EphemerisService {

    LocalDate maximumDate = LocalDate.of(2025, 6, 26);
    IOException queryFailure;
    IOException coverageFailure;
    RuntimeException coverageError;

    Instant lastStart;
    Instant lastEnd;
    List<Instrument> lastInstruments;

    @Override
    public List<EphemerisRecord> query(double ra, double dec, Instant start, Instant end, List<Instrument> instruments)
            throws IOException {
        if (queryFailure != null) {
            throw queryFailure;
        }
        lastStart = start;
        lastEnd = end;
        lastInstruments = instruments;

        List<EphemerisRecord> records = new ArrayList<>();
        int index = 0;
        for (Instant time = start; !time.isAfter(end); time = time.plus(Duration.ofDays(1))) {
            Map<Instrument, PaRange> ranges = new EnumMap<>(Instrument.class);
            for (Instrument instrument : instruments) {
                double pa = instrument == Instrument.NIRSPEC ? 70.0 : 290.0;
                ranges.put(instrument, new PaRange(pa - 5.0, pa + 5.0));
            }
            records.add(new EphemerisRecord(time, 290.1, index % 3 != 2, ranges));
            index++;
        }
        return records;
    }

    @Override
    public LocalDate maximumDate() throws IOException {
        if (coverageFailure != null) {
            throw coverageFailure;
        }
        if (coverageError != null) {
            throw coverageError;
        }
        return maximumDate;
    }
}
