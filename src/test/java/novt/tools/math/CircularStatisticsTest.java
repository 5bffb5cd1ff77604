package novt.tools.math;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CircularStatisticsTest {

    @Test
    public void meanAcrossZero() {
        assertEquals(0.0, CircularStatistics.circularMean(358.0, 2.0), 1e-9);
        assertEquals(-5.0, CircularStatistics.circularMean(350.0, 0.0), 1e-9);
    }

    @Test
    public void nanValuesAreIgnored() {
        assertEquals(40.0, CircularStatistics.circularMean(Double.NaN, 40.0, Double.NaN), 1e-9);
        assertEquals(20.0, CircularStatistics.circularMean(List.of(10.0, Double.NaN, 30.0)), 1e-9);
    }

    @Test
    public void emptyInputHasNoMean() {
        assertTrue(Double.isNaN(CircularStatistics.circularMean()));
        assertTrue(Double.isNaN(CircularStatistics.circularMean(Double.NaN, Double.NaN)));
    }
}
