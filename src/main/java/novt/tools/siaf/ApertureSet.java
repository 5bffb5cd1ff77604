package novt.tools.siaf;

import java.util.List;
import java.util.Locale;

/**
 * Default aperture subsets drawn for each instrument channel.
 */
public enum ApertureSet {

    /**
     * The four MSA quadrants, the IFU and the five fixed slits.
     */
    NIRSPEC(Instrument.NIRSPEC, List.of(
            "NRS_FULL_MSA1",
            "NRS_FULL_MSA2",
            "NRS_FULL_MSA3",
            "NRS_FULL_MSA4",
            "NRS_FULL_IFU",
            "NRS_S200A1_SLIT",
            "NRS_S200A2_SLIT",
            "NRS_S400A1_SLIT",
            "NRS_S1600A1_SLIT",
            "NRS_S200B1_SLIT")),

    /**
     * The eight short wavelength detectors of modules A and B.
     */
    NIRCAM_SHORT(Instrument.NIRCAM, List.of(
            "NRCA1_FULL",
            "NRCA2_FULL",
            "NRCA3_FULL",
            "NRCA4_FULL",
            "NRCB1_FULL",
            "NRCB2_FULL",
            "NRCB3_FULL",
            "NRCB4_FULL")),

    /**
     * The two long wavelength detectors.
     */
    NIRCAM_LONG(Instrument.NIRCAM, List.of("NRCA5_FULL", "NRCB5_FULL"));

    private final Instrument instrument;
    private final List<String> defaultApertures;

    ApertureSet(Instrument instrument, List<String> defaultApertures) {
        this.instrument = instrument;
        this.defaultApertures = defaultApertures;
    }

    public Instrument getInstrument() {
        return instrument;
    }

    public List<String> getDefaultApertures() {
        return defaultApertures;
    }

    /**
     * NIRCam channel selection: "short" picks the short wavelength set, anything else the long one
     **/
    public static ApertureSet nircamChannel(String channel) {
        if (channel != null && channel.trim().toLowerCase(Locale.ROOT).equals("short")) {
            return NIRCAM_SHORT;
        }
        return NIRCAM_LONG;
    }
}
