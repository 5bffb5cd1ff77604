package novt.tools.ephemeris;

import org.junit.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

public class HorizonsCoverageTest {

    @Test
    public void readsTheLastDateFromTheErrorMessage() throws IOException {
        String body = "API VERSION: 1.2\n"
                + "API SOURCE: NASA/JPL Horizons API\n\n"
                + "No ephemeris for target \"James Webb Space Telescope (spacecraft)\" after A.D. 2025-JUN-26 "
                + "00:01:09.1823 TDB\n";
        assertEquals(LocalDate.of(2025, 6, 26), HorizonsCoverage.parseMaximumDate(body));
    }

    @Test
    public void answerWithoutDateFails() {
        assertThrows(IOException.class, () -> HorizonsCoverage.parseMaximumDate("Ephemeris follows\n$$SOE\n"));
        assertThrows(IOException.class, () -> HorizonsCoverage.parseMaximumDate(null));
    }

    @Test
    public void unreachableServiceFails() {
        HorizonsCoverage coverage = new HorizonsCoverage("http://127.0.0.1:1/horizons.api?START=%s&STOP=%s",
                LocalDate.of(2021, 12, 27), Duration.ofSeconds(2));
        assertThrows(IOException.class, coverage::maximumDate);
    }

    @Test
    public void missingTemplateFails() {
        HorizonsCoverage coverage = new HorizonsCoverage(null, LocalDate.of(2021, 12, 27), Duration.ofSeconds(2));
        assertThrows(IOException.class, coverage::maximumDate);
    }

    @Test
    public void invalidTemplateFails() {
        HorizonsCoverage coverage = new HorizonsCoverage("not a url %s %s", LocalDate.of(2021, 12, 27),
                Duration.ofSeconds(2));
        assertThrows(IOException.class, coverage::maximumDate);
    }
}
