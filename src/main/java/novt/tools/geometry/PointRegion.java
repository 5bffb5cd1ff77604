package novt.tools.geometry;

import java.util.List;

public record PointRegion(SkyCoordinate center) implements FootprintRegion {

    public PointRegion(double ra, double dec) {
        this(new SkyCoordinate(ra, dec));
    }

    @Override
    public List<SkyCoordinate> coordinates() {
        return List.of(center);
    }
}
