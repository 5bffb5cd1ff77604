package novt.tools.timeline;

import novt.tools.ephemeris.EphemerisRecord;
import novt.tools.ephemeris.EphemerisService;
import novt.tools.ephemeris.PaRange;
import novt.tools.errors.EphemerisUnavailableException;
import novt.tools.errors.InvalidInputException;
import novt.tools.siaf.Instrument;
import novt.tools.utilities.AppConfig;
import novt.tools.utilities.TimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds visibility timelines for fixed targets from an {@link EphemerisService}.
 * <p>
 * Dates are checked against the ephemeris coverage before querying. Samples outside the field of regard have every
 * angle replaced by NaN.
 **/
public class TimelineEngine {

    private static final Logger log = LoggerFactory.getLogger(TimelineEngine.class);

    private final EphemerisService service;
    private final LocalDate minimumDate;
    private final LocalDate fallbackMaximumDate;
    private final int defaultDays;
    private final Clock clock;

    public TimelineEngine(EphemerisService service, AppConfig config) {
        this(service, config, Clock.systemUTC());
    }

    public TimelineEngine(EphemerisService service, AppConfig config, Clock clock) {
        this.service = service;
        this.minimumDate = config.minimumDate();
        this.fallbackMaximumDate = config.fallbackMaximumDate();
        this.defaultDays = config.timelineDefaultDays();
        this.clock = clock;
    }

    /**
     * @param ra         target RA, degrees
     * @param dec        target Dec, degrees
     * @param start      first time, now when null
     * @param end        last time, start plus the default span when null
     * @param instrument instrument to report, both when null
     * @throws InvalidInputException         if the dates are out of order or outside the ephemeris coverage
     * @throws EphemerisUnavailableException if the ephemeris query fails
     */
    public Timeline timeline(double ra, double dec, Instant start, Instant end, Instrument instrument) {

        if (start == null) {
            start = clock.instant();
        }
        if (end == null) {
            end = start.plus(Duration.ofDays(defaultDays));
        }

        if (!end.isAfter(start)) {
            throw new InvalidInputException("End date must be later than start date.");
        }
        if (start.isBefore(TimeUtils.startOfDay(minimumDate.minusDays(1)))) {
            throw new InvalidInputException("No JWST ephemeris available prior to " + minimumDate);
        }
        LocalDate maximumDate = maximumDate();
        if (end.isAfter(TimeUtils.startOfDay(maximumDate))) {
            throw new InvalidInputException("No JWST ephemeris available after " + maximumDate);
        }

        List<Instrument> instruments = instrument == null ? List.of(Instrument.values()) : List.of(instrument);

        List<EphemerisRecord> records;
        try {
            records = service.query(ra, dec, start, end, instruments);
        } catch (IOException | RuntimeException e) {
            log.error("Ephemeris query failed for ({}, {}): {}", ra, dec, e.getMessage());
            throw new EphemerisUnavailableException("Ephemeris query failed for target (" + ra + ", " + dec + ")", e);
        }

        List<VisibilitySample> samples = new ArrayList<>(records.size());
        int masked = 0;
        for (EphemerisRecord record : records) {
            if (!record.inFieldOfRegard()) {
                masked++;
            }
            samples.add(toSample(record, instruments));
        }

        log.debug("Timeline for ({}, {}): {} samples, {} outside the field of regard", ra, dec, samples.size(), masked);
        return new Timeline(ra, dec, instruments, samples);
    }

    private static VisibilitySample toSample(EphemerisRecord record, List<Instrument> instruments) {
        Map<Instrument, PaRange> ranges = new EnumMap<>(Instrument.class);
        for (Instrument instrument : instruments) {
            PaRange range = record.ranges().getOrDefault(instrument, PaRange.UNKNOWN);
            ranges.put(instrument, record.inFieldOfRegard() ? range : PaRange.UNKNOWN);
        }
        double v3Pa = record.inFieldOfRegard() ? record.v3Pa() : Double.NaN;
        return new VisibilitySample(record.time(), v3Pa, ranges);
    }

    /**
     * Last date of the ephemeris, or the configured fallback when the service cannot tell
     **/
    public LocalDate maximumDate() {
        try {
            return service.maximumDate();
        } catch (IOException | RuntimeException e) {
            log.warn("Could not determine the ephemeris coverage ({}), using {}", e, fallbackMaximumDate);
            return fallbackMaximumDate;
        }
    }

}
