package novt.tools.siaf;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import novt.tools.errors.InvalidInputException;
import novt.tools.math.TelCoordinate;
import novt.tools.utilities.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aperture catalog backed by a JSON export of the science instrument aperture file. Loaded once, immutable
 * afterwards, safe to share between threads.
 */
public class SiafApertureCatalog implements ApertureCatalog {

    private static final Logger log = LoggerFactory.getLogger(SiafApertureCatalog.class);

    private final Map<String, ApertureSpec> apertures;
    private final Map<Instrument, ApertureSpec> references;

    public SiafApertureCatalog(Collection<ApertureSpec> apertureList) {
        Map<String, ApertureSpec> byName = new LinkedHashMap<>();
        Map<Instrument, ApertureSpec> byInstrument = new EnumMap<>(Instrument.class);
        for (ApertureSpec aperture : apertureList) {
            if (byName.put(aperture.name(), aperture) != null) {
                throw new IllegalStateException("Duplicate aperture " + aperture.name());
            }
            if (aperture.referenceAperture()) {
                ApertureSpec previous = byInstrument.put(aperture.instrument(), aperture);
                if (previous != null) {
                    throw new IllegalStateException("Instrument " + aperture.instrument().getSiafName()
                            + " has two reference apertures: " + previous.name() + ", " + aperture.name());
                }
            }
        }
        for (Instrument instrument : Instrument.values()) {
            ApertureSpec reference = byInstrument.get(instrument);
            if (reference == null || !reference.name().equals(instrument.getReferenceAperture())) {
                throw new IllegalStateException("Instrument " + instrument.getSiafName()
                        + " must use " + instrument.getReferenceAperture() + " as reference aperture");
            }
        }
        this.apertures = Collections.unmodifiableMap(byName);
        this.references = Collections.unmodifiableMap(byInstrument);
    }

    /**
     * Loads the catalog from a JSON file or classpath resource
     *
     * @param location file path or resource name, e.g. siaf/apertures.json
     **/
    public static SiafApertureCatalog load(String location) {
        try (Reader reader = FileUtils.openReader(location)) {
            SiafApertureCatalog catalog = fromJson(reader);
            log.info("Loaded {} apertures from {}", catalog.apertures.size(), location);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read aperture catalog " + location, e);
        }
    }

    static SiafApertureCatalog fromJson(Reader reader) {
        CatalogFile file;
        try {
            file = new Gson().fromJson(reader, CatalogFile.class);
        } catch (JsonParseException e) {
            throw new IllegalStateException("Malformed aperture catalog: " + e.getMessage(), e);
        }
        if (file == null || file.apertures == null) {
            throw new IllegalStateException("Aperture catalog has no apertures");
        }
        List<ApertureSpec> specs = new ArrayList<>();
        for (ApertureEntry entry : file.apertures) {
            List<TelCoordinate> corners = new ArrayList<>();
            for (double[] corner : entry.corners) {
                corners.add(new TelCoordinate(corner[0], corner[1]));
            }
            specs.add(new ApertureSpec(entry.name, Instrument.parse(entry.instrument), entry.v3IdlYAngle,
                    entry.referenceAperture, corners));
        }
        return new SiafApertureCatalog(specs);
    }

    @Override
    public ApertureSpec aperture(String name) {
        ApertureSpec aperture = apertures.get(name);
        if (aperture == null) {
            throw new InvalidInputException("Aperture " + name + " not found in the calibration model");
        }
        return aperture;
    }

    @Override
    public ApertureSpec referenceAperture(Instrument instrument) {
        return references.get(instrument);
    }

    @Override
    public boolean contains(String name) {
        return apertures.containsKey(name);
    }

    @Override
    public Collection<ApertureSpec> apertures() {
        return apertures.values();
    }

    /* Gson binding of the JSON layout */
    private static class CatalogFile {
        List<ApertureEntry> apertures;
    }

    private static class ApertureEntry {
        String name;
        String instrument;
        double v3IdlYAngle;
        boolean referenceAperture;
        List<double[]> corners;
    }

}
