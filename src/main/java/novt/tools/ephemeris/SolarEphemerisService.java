package novt.tools.ephemeris;

import novt.tools.geometry.SkyCoordinate;
import novt.tools.geometry.SkyGeometry;
import novt.tools.math.Transformations;
import novt.tools.siaf.ApertureCatalog;
import novt.tools.siaf.Instrument;
import novt.tools.utilities.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Analytic field of regard and roll model for an observatory orbiting the Sun-Earth L2 point.
 * <p>
 * From L2 the Sun direction is taken to be the geocentric one. A target is observable while its solar elongation
 * stays within the field of regard limits. The nominal roll keeps the Sun behind the sunshield, so the V3 axis
 * points away from the Sun: V3PA is the position angle of the Sun seen from the target plus 180 degrees. The
 * allowed off-nominal roll grows with the pitch away from the Sun-perpendicular plane.
 **/
public class SolarEphemerisService implements EphemerisService {

    private static final Logger log = LoggerFactory.getLogger(SolarEphemerisService.class);

    private final ApertureCatalog catalog;
    private final HorizonsCoverage coverage;
    private final Duration step;
    private final double fieldOfRegardMin;
    private final double fieldOfRegardMax;
    private final double nominalRollTolerance;

    public SolarEphemerisService(AppConfig config, ApertureCatalog catalog, HorizonsCoverage coverage) {
        this(catalog, coverage, Duration.ofSeconds(Math.round(config.timelineStepHours() * 3600.0)),
                config.fieldOfRegardMin(), config.fieldOfRegardMax(), config.nominalRollTolerance());
    }

    public SolarEphemerisService(ApertureCatalog catalog, HorizonsCoverage coverage, Duration step,
                                 double fieldOfRegardMin, double fieldOfRegardMax, double nominalRollTolerance) {
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("Ephemeris step must be positive: " + step);
        }
        this.catalog = catalog;
        this.coverage = coverage;
        this.step = step;
        this.fieldOfRegardMin = fieldOfRegardMin;
        this.fieldOfRegardMax = fieldOfRegardMax;
        this.nominalRollTolerance = nominalRollTolerance;
    }

    @Override
    public List<EphemerisRecord> query(double ra, double dec, Instant start, Instant end, List<Instrument> instruments) {

        SkyCoordinate target = new SkyCoordinate(ra, dec);
        List<EphemerisRecord> records = new ArrayList<>();

        for (Instant time = start; !time.isAfter(end); time = time.plus(step)) {
            records.add(sample(target, time, instruments));
        }

        log.debug("Computed {} ephemeris samples for ({}, {})", records.size(), ra, dec);
        return records;
    }

    EphemerisRecord sample(SkyCoordinate target, Instant time, List<Instrument> instruments) {

        SkyCoordinate sun = SolarPosition.at(time);
        double elongation = SkyGeometry.separation(target, sun);
        boolean inFieldOfRegard = elongation >= fieldOfRegardMin && elongation <= fieldOfRegardMax;

        double v3Pa = Transformations.wrap360(SkyGeometry.positionAngle(target, sun) + 180.0);
        double maxRoll = maximumRoll(elongation);

        Map<Instrument, PaRange> ranges = new EnumMap<>(Instrument.class);
        for (Instrument instrument : instruments) {
            double pa = v3Pa + catalog.referenceAperture(instrument).v3IdlYAngle();
            ranges.put(instrument, new PaRange(Transformations.wrap360(pa - maxRoll),
                    Transformations.wrap360(pa + maxRoll)));
        }

        return new EphemerisRecord(time, v3Pa, inFieldOfRegard, ranges);
    }

    /**
     * Maximum off-nominal roll for a target at the given solar elongation
     *
     * @return the allowed roll in degrees, 90 when unconstrained
     **/
    double maximumRoll(double elongation) {
        double pitch = Math.toRadians(90.0 - elongation);
        double ratio = Math.sin(Math.toRadians(nominalRollTolerance)) / Math.cos(pitch);
        if (ratio < 1.0) {
            return Math.toDegrees(Math.asin(ratio));
        }
        return 90.0;
    }

    @Override
    public LocalDate maximumDate() throws IOException {
        return coverage.maximumDate();
    }

}
