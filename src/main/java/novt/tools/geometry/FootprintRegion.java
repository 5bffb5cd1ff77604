package novt.tools.geometry;

import java.util.List;

/**
 * A sky-frame region produced by the footprint projection: either a {@link PointRegion}
 * marking a pointing center or a {@link PolygonRegion} outlining an aperture.
 */
public interface FootprintRegion {

    /**
     * @return the vertices of the region, a single coordinate for a point
     */
    List<SkyCoordinate> coordinates();

}
