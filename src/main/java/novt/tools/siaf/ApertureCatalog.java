package novt.tools.siaf;

import java.util.Collection;

/**
 * Read-only lookup into the instrument calibration model.
 */
public interface ApertureCatalog {

    /**
     * @param name aperture name
     * @return the aperture
     * @throws novt.tools.errors.InvalidInputException if no aperture has that name
     */
    ApertureSpec aperture(String name);

    /**
     * @return the aperture that defines the center and roll offset of the instrument assembly
     */
    ApertureSpec referenceAperture(Instrument instrument);

    boolean contains(String name);

    Collection<ApertureSpec> apertures();

}
