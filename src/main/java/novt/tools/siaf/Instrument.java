package novt.tools.siaf;

import novt.tools.errors.InvalidInputException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Instrument assemblies. Each one has a single reference aperture that supplies the pointing center and the
 * roll offset of the whole assembly.
 */
public enum Instrument {

    NIRSPEC("NIRSpec", "NRS_FULL_MSA"),
    NIRCAM("NIRCam", "NRCALL_FULL");

    private final String siafName;
    private final String referenceAperture;

    Instrument(String siafName, String referenceAperture) {
        this.siafName = siafName;
        this.referenceAperture = referenceAperture;
    }

    public String getSiafName() {
        return siafName;
    }

    public String getReferenceAperture() {
        return referenceAperture;
    }

    /**
     * Upper case key used for timeline columns, e.g. NIRSPEC_min_PA
     */
    public String columnKey() {
        return name();
    }

    /**
     * Resolves an instrument from its display or column name, ignoring case
     **/
    public static Instrument parse(String name) {
        String key = name == null ? "" : name.trim();
        for (Instrument instrument : values()) {
            if (instrument.siafName.equalsIgnoreCase(key) || instrument.name().equals(key.toUpperCase(Locale.ROOT))) {
                return instrument;
            }
        }
        throw new InvalidInputException("Instrument " + name + " not recognized. Options are: "
                + Arrays.stream(values()).map(Instrument::getSiafName).toList() + ".");
    }
}
