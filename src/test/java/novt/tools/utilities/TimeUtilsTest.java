package novt.tools.utilities;

import org.junit.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.Assert.assertEquals;

public class TimeUtilsTest {

    @Test
    public void horizonsDates() {
        assertEquals(LocalDate.of(2025, 6, 26), TimeUtils.parseHorizonsDate("2025-JUN-26"));
        assertEquals(LocalDate.of(2030, 1, 3), TimeUtils.parseHorizonsDate("2030-Jan-3"));
        assertEquals("2021-12-27", TimeUtils.formatHorizonsDate(LocalDate.of(2021, 12, 27)));
    }

    @Test
    public void julianDate() {
        assertEquals(2451545.0, TimeUtils.toJulianDate(Instant.parse("2000-01-01T12:00:00Z")), 1e-9);
        assertEquals(TimeUtils.UNIX_EPOCH_JD, TimeUtils.toJulianDate(Instant.EPOCH), 0.0);
    }

    @Test
    public void startOfDayIsUtcMidnight() {
        assertEquals(Instant.parse("2021-12-26T00:00:00Z"), TimeUtils.startOfDay(LocalDate.of(2021, 12, 26)));
    }
}
