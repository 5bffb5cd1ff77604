package novt.tools;

import novt.tools.catalog.CatalogTable;
import novt.tools.catalog.SourceCatalog;
import novt.tools.catalog.SourceCatalogLoader;
import novt.tools.ephemeris.EphemerisService;
import novt.tools.ephemeris.HorizonsCoverage;
import novt.tools.ephemeris.SolarEphemerisService;
import novt.tools.footprint.DitherPatternTable;
import novt.tools.footprint.DitherTiler;
import novt.tools.footprint.FootprintProjector;
import novt.tools.footprint.MosaicWindow;
import novt.tools.geometry.FootprintRegion;
import novt.tools.math.TelCoordinate;
import novt.tools.siaf.ApertureCatalog;
import novt.tools.siaf.ApertureSet;
import novt.tools.siaf.Instrument;
import novt.tools.siaf.SiafApertureCatalog;
import novt.tools.timeline.AveragePa;
import novt.tools.timeline.AveragingMethod;
import novt.tools.timeline.PositionAngleSummarizer;
import novt.tools.timeline.Timeline;
import novt.tools.timeline.TimelineEngine;
import novt.tools.utilities.AppConfig;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * NIRSpec Observation Visualization Toolkit
 * <p>
 * Loads the configuration, the aperture catalog and the dither table once and wires the footprint, catalog and
 * timeline components on top of them.
 **/
public class NovtToolkit {

    private static final Logger log = LoggerFactory.getLogger(NovtToolkit.class);

    private final AppConfig appConfig;
    private final ApertureCatalog apertureCatalog;
    private final FootprintProjector projector;
    private final DitherTiler tiler;
    private final SourceCatalogLoader catalogLoader = new SourceCatalogLoader();
    private final TimelineEngine timelineEngine;

    /**
     * Attempts to locate and load novt.properties on the classpath
     **/
    public NovtToolkit() {
        this(AppConfig.DEFAULT_CONFIGURATION);
    }

    /**
     * Accepts configurations (either properties or JSON)
     **/
    public NovtToolkit(String configurations) {
        this(loadConfigurations(configurations));
    }

    public NovtToolkit(AppConfig appConfig) {
        this(appConfig, SiafApertureCatalog.load(appConfig.apertureCatalog()), null);
    }

    /**
     * @param ephemerisService ephemeris source for timelines; null selects the built-in solar model
     **/
    public NovtToolkit(AppConfig appConfig, ApertureCatalog apertureCatalog, EphemerisService ephemerisService) {
        this.appConfig = appConfig;
        this.apertureCatalog = apertureCatalog;
        this.projector = new FootprintProjector(apertureCatalog);
        this.tiler = new DitherTiler(projector, DitherPatternTable.load(appConfig.ditherPatterns()));
        EphemerisService service = ephemerisService != null ? ephemerisService
                : new SolarEphemerisService(appConfig, apertureCatalog, new HorizonsCoverage(appConfig));
        this.timelineEngine = new TimelineEngine(service, appConfig);

        if (appConfig.debugMode()) {
            log.info("Debug mode: {}", appConfig);
            log.info("Apertures: {}", apertureCatalog.apertures().size());
        }
    }

    private static AppConfig loadConfigurations(String configurations) {
        try {
            AppConfig config = new AppConfig(configurations);
            log.info("Loaded configuration from {}", configurations);
            return config;
        } catch (ConfigurationException | RuntimeException e) {
            log.error("Error loading configuration {}: {}", configurations, e.getMessage());
            throw new IllegalStateException("Could not load configuration " + configurations, e);
        }
    }

    public List<FootprintRegion> nirspecFootprint(double ra, double dec, double pa) {
        return projector.project(ApertureSet.NIRSPEC, ra, dec, pa);
    }

    public List<FootprintRegion> nirspecFootprint(double ra, double dec, double pa, boolean includeCenter,
                                                  List<String> apertures) {
        return projector.project(ApertureSet.NIRSPEC, ra, dec, pa, TelCoordinate.ZERO, includeCenter, apertures);
    }

    /**
     * @param channel "short" for the short wavelength detectors, anything else for the long wavelength ones
     **/
    public List<FootprintRegion> nircamFootprint(double ra, double dec, double pa, String channel) {
        return projector.project(ApertureSet.nircamChannel(channel), ra, dec, pa);
    }

    public List<FootprintRegion> nircamDitherFootprint(double ra, double dec, double pa, String channel,
                                                       String ditherPattern) {
        return tiler.tile(ApertureSet.nircamChannel(channel), ra, dec, pa, ditherPattern);
    }

    public List<FootprintRegion> nircamDitherFootprint(double ra, double dec, double pa, String channel,
                                                       String ditherPattern, boolean addMosaic,
                                                       MosaicWindow mosaicWindow, boolean includeCenter) {
        return tiler.tile(ApertureSet.nircamChannel(channel), ra, dec, pa, ditherPattern, addMosaic, mosaicWindow,
                includeCenter, null);
    }

    public SourceCatalog sourceCatalog(Path catalogFile) {
        return catalogLoader.load(catalogFile);
    }

    public SourceCatalog sourceCatalog(CatalogTable table) {
        return catalogLoader.load(table);
    }

    public Timeline timeline(double ra, double dec, Instant start, Instant end, Instrument instrument) {
        return timelineEngine.timeline(ra, dec, start, end, instrument);
    }

    public LocalDate maximumDate() {
        return timelineEngine.maximumDate();
    }

    public AveragePa averagePa(Timeline timeline, Instrument instrument, Instant from, Instant to,
                               AveragingMethod method) {
        return PositionAngleSummarizer.averagePa(timeline, instrument, from, to, method);
    }

    public AppConfig getAppConfig() {
        return appConfig;
    }

    public ApertureCatalog getApertureCatalog() {
        return apertureCatalog;
    }

}
