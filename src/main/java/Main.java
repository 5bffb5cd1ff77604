import novt.tools.NovtToolkit;
import novt.tools.errors.EphemerisUnavailableException;
import novt.tools.errors.InvalidInputException;
import novt.tools.geometry.FootprintRegion;
import novt.tools.siaf.Instrument;
import novt.tools.timeline.AveragePa;
import novt.tools.timeline.AveragingMethod;
import novt.tools.timeline.Timeline;
import novt.tools.utilities.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {

        if (args.length < 3) {
            System.err.println("Usage: Main <ra> <dec> <pa> [config]");
            System.exit(1);
        }

        double ra = Double.parseDouble(args[0]);
        double dec = Double.parseDouble(args[1]);
        double pa = Double.parseDouble(args[2]);
        NovtToolkit toolkit = new NovtToolkit(args.length > 3 ? args[3] : AppConfig.DEFAULT_CONFIGURATION);

        List<FootprintRegion> nirspec = toolkit.nirspecFootprint(ra, dec, pa);
        log.info("NIRSpec footprint: {} regions", nirspec.size());
        nirspec.forEach(region -> log.info("  {}", region));

        List<FootprintRegion> nircam = toolkit.nircamDitherFootprint(ra, dec, pa, "long", "FULL3");
        log.info("NIRCam FULL3 footprint: {} regions", nircam.size());
        nircam.forEach(region -> log.info("  {}", region));

        Timeline timeline;
        try {
            timeline = toolkit.timeline(ra, dec, null, null, null);
        } catch (InvalidInputException | EphemerisUnavailableException e) {
            log.warn("No visibility timeline: {}", e.getMessage());
            return;
        }
        for (Instrument instrument : timeline.instruments()) {
            AveragePa average = toolkit.averagePa(timeline, instrument, null, null, AveragingMethod.MEAN);
            log.info("{} {}", instrument.getSiafName(), average.label());
        }
    }

}
