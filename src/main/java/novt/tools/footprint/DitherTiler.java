package novt.tools.footprint;

import novt.tools.geometry.FootprintRegion;
import novt.tools.math.TelCoordinate;
import novt.tools.siaf.ApertureSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Dithers and/or mosaics a footprint.
 * <p>
 * Every tile center is combined with every dither offset (tiles outer, dithers inner) and each combination is
 * projected separately. Only the first projection carries the center point, so the output holds
 * n_tiles * n_dithers * n_apertures polygons plus at most one point.
 **/
public class DitherTiler {

    private static final Logger log = LoggerFactory.getLogger(DitherTiler.class);

    private final FootprintProjector projector;
    private final DitherPatternTable ditherTable;

    public DitherTiler(FootprintProjector projector, DitherPatternTable ditherTable) {
        this.projector = projector;
        this.ditherTable = ditherTable;
    }

    public List<FootprintRegion> tile(ApertureSet apertureSet, double ra, double dec, double pa, String ditherPattern) {
        return tile(apertureSet, ra, dec, pa, ditherPattern, false, null, true, null);
    }

    /**
     * @param apertureSet   the instrument channel
     * @param ra            RA of the instrument center, degrees
     * @param dec           Dec of the instrument center, degrees
     * @param pa            position angle, degrees
     * @param ditherPattern pattern name, trimmed and case-insensitive
     * @param addMosaic     request a two-tile mosaic; ignored for patterns that do not allow one
     * @param mosaicWindow  mosaic window width; null is a zero window. A zero window with the mosaic enabled still
     *                      produces two (coincident) tiles.
     * @param includeCenter if set, the output starts with a single center point
     * @param apertures     apertures to draw; null selects the channel defaults
     * @return the ordered regions
     * @throws novt.tools.errors.UnknownDitherPatternException if the pattern is not in the table
     **/
    public List<FootprintRegion> tile(ApertureSet apertureSet, double ra, double dec, double pa,
                                      String ditherPattern, boolean addMosaic, MosaicWindow mosaicWindow,
                                      boolean includeCenter, List<String> apertures) {

        String pattern = ditherTable.resolve(ditherPattern);
        List<TelCoordinate> ditherOffsets = ditherTable.offsets(pattern);

        boolean mosaic = addMosaic && ditherTable.allowsMosaic(pattern);
        MosaicWindow window = mosaicWindow == null ? MosaicWindow.NONE : mosaicWindow;
        List<TelCoordinate> tileCenters = mosaic ? window.tileCenters() : List.of(TelCoordinate.ZERO);

        List<FootprintRegion> regions = new ArrayList<>();
        boolean center = includeCenter;
        for (TelCoordinate tileCenter : tileCenters) {
            for (TelCoordinate ditherOffset : ditherOffsets) {
                regions.addAll(projector.project(apertureSet, ra, dec, pa, ditherOffset.plus(tileCenter),
                        center, apertures));
                // include center only once
                center = false;
            }
        }

        log.debug("{} {} mosaic={}: {} tiles x {} dithers -> {} regions", apertureSet, pattern, mosaic,
                tileCenters.size(), ditherOffsets.size(), regions.size());
        return regions;
    }

}
