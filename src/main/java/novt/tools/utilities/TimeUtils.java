package novt.tools.utilities;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.Locale;

public class TimeUtils {

    public static final double UNIX_EPOCH_JD = 2440587.5;
    private static final double SECONDS_PER_DAY = 86400.0;

    // Horizons reports dates as 2025-Jun-26
    private static final DateTimeFormatter HORIZONS_DATE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("yyyy-MMM-d")
            .toFormatter(Locale.ENGLISH);

    private TimeUtils() {

    }

    /**
     * Parses an ISO date (YYYY-MM-DD)
     **/
    public static LocalDate parseDate(String date) {
        if (date == null) {
            throw new IllegalArgumentException("Missing date value");
        }
        return LocalDate.parse(date.trim());
    }

    public static LocalDate parseHorizonsDate(String date) {
        return LocalDate.parse(date.trim(), HORIZONS_DATE);
    }

    public static String formatHorizonsDate(LocalDate date) {
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    /**
     * Midnight UTC at the start of the given date
     **/
    public static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public static double toJulianDate(Instant instant) {
        return UNIX_EPOCH_JD + (instant.getEpochSecond() + instant.getNano() / 1.0e9) / SECONDS_PER_DAY;
    }

}
