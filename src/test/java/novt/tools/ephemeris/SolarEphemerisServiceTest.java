package novt.tools.ephemeris;

import novt.tools.geometry.SkyCoordinate;
import novt.tools.siaf.Instrument;
import novt.tools.siaf.SiafApertureCatalog;
import org.junit.BeforeClass;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class SolarEphemerisServiceTest {

    private static final double M51_RA = 202.4695898;
    private static final double M51_DEC = 47.1951868;

    private static SolarEphemerisService service;

    @BeforeClass
    public static void setUp() {
        HorizonsCoverage offline = new HorizonsCoverage("http://127.0.0.1:1/?start=%s&stop=%s",
                LocalDate.of(2021, 12, 27), Duration.ofSeconds(2));
        service = new SolarEphemerisService(SiafApertureCatalog.load("siaf/apertures.json"), offline,
                Duration.ofDays(1), 85.0, 135.0, 5.2);
    }

    @Test
    public void positionAnglesForM51InJanuary() {
        List<EphemerisRecord> records = service.query(M51_RA, M51_DEC, Instant.parse("2022-01-05T00:00:00Z"),
                Instant.parse("2022-01-09T00:00:00Z"), List.of(Instrument.NIRSPEC, Instrument.NIRCAM));

        assertEquals(5, records.size());
        for (EphemerisRecord record : records) {
            assertTrue(record.inFieldOfRegard());
            assertEquals(69.0, mid(record.ranges().get(Instrument.NIRSPEC)), 10.0);
            assertEquals(290.0, mid(record.ranges().get(Instrument.NIRCAM)), 10.0);
        }
        assertEquals(Instant.parse("2022-01-09T00:00:00Z"), records.get(4).time());
    }

    @Test
    public void visibilityComesAndGoesOverAYear() {
        List<EphemerisRecord> records = service.query(M51_RA, M51_DEC, Instant.parse("2022-01-01T00:00:00Z"),
                Instant.parse("2022-12-31T00:00:00Z"), List.of(Instrument.NIRSPEC));

        assertEquals(365, records.size());
        assertTrue(records.stream().anyMatch(EphemerisRecord::inFieldOfRegard));
        assertTrue(records.stream().anyMatch(record -> !record.inFieldOfRegard()));
        assertEquals(List.of(Instrument.NIRSPEC), List.copyOf(records.get(0).ranges().keySet()));
    }

    @Test
    public void eclipticPoleIsAlwaysObservable() {
        List<EphemerisRecord> records = service.query(270.0, 66.56, Instant.parse("2022-01-01T00:00:00Z"),
                Instant.parse("2022-12-31T00:00:00Z"), List.of(Instrument.NIRCAM));
        assertTrue(records.stream().allMatch(EphemerisRecord::inFieldOfRegard));
    }

    @Test
    public void envelopeWidthFollowsTheRollTolerance() {
        assertEquals(5.2, service.maximumRoll(90.0), 1e-9);
        assertTrue(service.maximumRoll(130.0) > 5.2);
        assertEquals(90.0, service.maximumRoll(179.9), 0.0);
    }

    @Test
    public void rangesAreWrapped() {
        EphemerisRecord record = service.sample(new SkyCoordinate(M51_RA, M51_DEC),
                Instant.parse("2022-01-05T00:00:00Z"), List.of(Instrument.NIRCAM, Instrument.NIRSPEC));
        for (PaRange range : record.ranges().values()) {
            assertTrue(range.min() >= 0.0 && range.min() < 360.0);
            assertTrue(range.max() >= 0.0 && range.max() < 360.0);
        }
        assertTrue(record.v3Pa() >= 0.0 && record.v3Pa() < 360.0);
    }

    @Test
    public void sunPositionAtTheSolstice() {
        SkyCoordinate sun = SolarPosition.at(Instant.parse("2022-06-21T09:14:00Z"));
        assertEquals(90.0, sun.ra(), 0.5);
        assertEquals(23.44, sun.dec(), 0.05);
    }

    @Test
    public void stepMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SolarEphemerisService(
                SiafApertureCatalog.load("siaf/apertures.json"), null, Duration.ZERO, 85.0, 135.0, 5.2));
    }

    @Test
    public void coverageComesFromHorizons() {
        assertThrows(java.io.IOException.class, () -> service.maximumDate());
    }

    private static double mid(PaRange range) {
        double half = ((range.max() - range.min()) % 360.0 + 360.0) % 360.0 / 2.0;
        return (range.min() + half) % 360.0;
    }
}
