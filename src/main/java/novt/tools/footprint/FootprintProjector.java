package novt.tools.footprint;

import novt.tools.geometry.AttitudeTransform;
import novt.tools.geometry.FootprintRegion;
import novt.tools.geometry.PointRegion;
import novt.tools.geometry.PolygonRegion;
import novt.tools.geometry.SkyCoordinate;
import novt.tools.math.TelCoordinate;
import novt.tools.siaf.ApertureCatalog;
import novt.tools.siaf.ApertureSet;
import novt.tools.siaf.ApertureSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects the apertures of one instrument channel onto the sky for a pointing.
 * <p>
 * The pointing center and the roll offset come from the assembly's reference aperture. Stateless apart from the
 * read-only catalog, so a single instance can serve concurrent callers.
 **/
public class FootprintProjector {

    private static final Logger log = LoggerFactory.getLogger(FootprintProjector.class);

    private final ApertureCatalog catalog;

    public FootprintProjector(ApertureCatalog catalog) {
        this.catalog = catalog;
    }

    public List<FootprintRegion> project(ApertureSet apertureSet, double ra, double dec, double pa) {
        return project(apertureSet, ra, dec, pa, TelCoordinate.ZERO, true, null);
    }

    /**
     * Creates the footprint regions in sky coordinates.
     *
     * @param apertureSet   the instrument channel
     * @param ra            RA of the instrument center, degrees
     * @param dec           Dec of the instrument center, degrees
     * @param pa            position angle of the instrument, degrees from North through East
     * @param offset        additional (V2, V3) offset of the center in arcsec, as from a dither pattern. V2 is
     *                      subtracted from the center and V3 is added to it.
     * @param includeCenter if set, a point region at exactly (ra, dec) comes first
     * @param apertures     apertures to draw, in order; null selects the channel defaults
     * @return the center point (optional) followed by one polygon per aperture
     **/
    public List<FootprintRegion> project(ApertureSet apertureSet, double ra, double dec, double pa,
                                         TelCoordinate offset, boolean includeCenter, List<String> apertures) {

        List<String> apertureNames = apertures == null ? apertureSet.getDefaultApertures() : apertures;

        // resolve everything before building output so a bad name leaves no partial result
        List<ApertureSpec> specs = new ArrayList<>(apertureNames.size());
        for (String name : apertureNames) {
            specs.add(catalog.aperture(name));
        }

        ApertureSpec reference = catalog.referenceAperture(apertureSet.getInstrument());
        AttitudeTransform transform = AttitudeTransform.build(pointingCenter(reference, offset), ra, dec, pa,
                reference.v3IdlYAngle());

        List<FootprintRegion> regions = new ArrayList<>(specs.size() + 1);
        if (includeCenter) {
            regions.add(new PointRegion(ra, dec));
        }

        for (ApertureSpec spec : specs) {
            List<SkyCoordinate> vertices = new ArrayList<>(spec.corners().size());
            for (TelCoordinate corner : spec.corners()) {
                vertices.add(transform.apply(corner));
            }
            regions.add(new PolygonRegion(spec.name(), vertices));
        }

        log.debug("{} footprint at ({}, {}) PA {}: {} regions", apertureSet, ra, dec, pa, regions.size());
        return regions;
    }

    /**
     * Centroid of the reference aperture shifted by an offset, V2 subtracted and V3 added
     **/
    public static TelCoordinate pointingCenter(ApertureSpec reference, TelCoordinate offset) {
        TelCoordinate centroid = reference.centroid();
        return new TelCoordinate(centroid.v2() - offset.v2(), centroid.v3() + offset.v3());
    }

}
