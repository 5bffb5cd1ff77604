package novt.tools.footprint;

import novt.tools.math.TelCoordinate;

import java.util.List;

/**
 * Window width of a two-tile mosaic, in telescope (V2, V3) arcsec. The two tiles are centered at
 * +/- half the window around the pointing center.
 */
public record MosaicWindow(double v2Width, double v3Width) {

    public static final MosaicWindow NONE = new MosaicWindow(0.0, 0.0);

    /**
     * @return the two tile center offsets, (+w2/2, -w3/2) then (-w2/2, +w3/2)
     */
    public List<TelCoordinate> tileCenters() {
        return List.of(
                new TelCoordinate(v2Width / 2, -v3Width / 2),
                new TelCoordinate(-v2Width / 2, v3Width / 2));
    }
}
