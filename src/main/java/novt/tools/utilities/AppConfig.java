package novt.tools.utilities;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.JSONConfiguration;
import org.apache.commons.configuration2.builder.fluent.Configurations;
import org.apache.commons.configuration2.ex.ConfigurationException;

import java.time.LocalDate;
import java.util.Locale;

public record AppConfig(
        String apertureCatalog,
        String ditherPatterns,
        LocalDate minimumDate,
        LocalDate fallbackMaximumDate,
        String horizonsUrl,
        long horizonsTimeoutSeconds,
        int timelineDefaultDays,
        double timelineStepHours,
        double fieldOfRegardMin,
        double fieldOfRegardMax,
        double nominalRollTolerance,
        boolean debugMode
) {

    public static final String DEFAULT_CONFIGURATION = "novt.properties";

    public AppConfig(String configFilePath) throws ConfigurationException {
        this(loadConfiguration(configFilePath));
    }

    private AppConfig(Configuration config) {
        this(
                config.getString("aperture_catalog", "siaf/apertures.json"),
                config.getString("dither_patterns", "dither/nircam-dithers.json"),
                TimeUtils.parseDate(config.getString("jwst_minimum_date")),
                TimeUtils.parseDate(config.getString("jwst_fallback_maximum_date")),
                config.getString("horizons_url"),
                config.getLong("horizons_timeout_seconds", 10L),
                config.getInt("timeline_default_days", 365),
                config.getDouble("timeline_step_hours", 24.0),
                config.getDouble("field_of_regard_min"),
                config.getDouble("field_of_regard_max"),
                config.getDouble("nominal_roll_tolerance"),
                config.getBoolean("debug_mode", false)
        );
    }

    /**
     * Reads a properties or JSON file, looked up on the file system and then on the classpath
     **/
    private static Configuration loadConfiguration(String configFilePath) throws ConfigurationException {
        Configurations configs = new Configurations();
        if (configFilePath.toLowerCase(Locale.ROOT).endsWith(".json")) {
            return configs.fileBased(JSONConfiguration.class, configFilePath);
        }
        return configs.properties(configFilePath);
    }

}
